package com.crosspost.platform.publication.entity;

import com.crosspost.platform.publication.model.Platform;
import com.crosspost.platform.publication.model.PostStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "posts",
       uniqueConstraints = @UniqueConstraint(columnNames = {"publication_id", "channel_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"publication", "channel"})
@EqualsAndHashCode(exclude = {"publication", "channel"})
public class Post {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "publication_id", nullable = false)
    private Publication publication;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "channel_id", nullable = false)
    private Channel channel;

    // copied from the channel at creation
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PostStatus status = PostStatus.PENDING;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(name = "scheduled_at")
    private OffsetDateTime scheduledAt;

    @Column(name = "author_signature", columnDefinition = "TEXT")
    private String authorSignature;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "published_at")
    private OffsetDateTime publishedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> meta;

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean isPublished() {
        return status == PostStatus.PUBLISHED;
    }

    public void resetToPending() {
        status = PostStatus.PENDING;
        scheduledAt = null;
        errorMessage = null;
        publishedAt = null;
    }
}
