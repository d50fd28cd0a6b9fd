package com.crosspost.platform.publication.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Table(name = "author_signature_variants",
       uniqueConstraints = @UniqueConstraint(columnNames = {"signature_id", "language"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "signature")
@EqualsAndHashCode(exclude = "signature")
public class AuthorSignatureVariant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "signature_id", nullable = false)
    private AuthorSignature signature;

    @Column(nullable = false, length = 10)
    private String language;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;
}
