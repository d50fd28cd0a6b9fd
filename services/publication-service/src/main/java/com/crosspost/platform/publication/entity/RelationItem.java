package com.crosspost.platform.publication.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "relation_items",
       uniqueConstraints = @UniqueConstraint(columnNames = {"group_id", "publication_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"group", "publication"})
@EqualsAndHashCode(exclude = {"group", "publication"})
public class RelationItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "group_id", nullable = false)
    private RelationGroup group;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "publication_id", nullable = false)
    private Publication publication;

    @Column(nullable = false)
    private Integer position;

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;
}
