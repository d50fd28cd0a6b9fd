package com.crosspost.platform.publication.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "publication_media")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "publication")
@EqualsAndHashCode(exclude = "publication")
public class PublicationMedia {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "publication_id", nullable = false)
    private Publication publication;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "media_id", nullable = false)
    private Media media;

    @Column(nullable = false)
    private Integer position;

    @Column(name = "has_spoiler")
    @Builder.Default
    private Boolean hasSpoiler = false;
}
