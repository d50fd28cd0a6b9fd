package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.Platform;
import com.crosspost.platform.publication.model.PostStatus;
import lombok.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostResponse {
    private UUID id;
    private UUID publicationId;
    private UUID channelId;
    private String channelName;
    private Platform platform;
    private PostStatus status;
    private String content;
    private OffsetDateTime scheduledAt;
    private String authorSignature;
    private String errorMessage;
    private OffsetDateTime publishedAt;
    private OffsetDateTime createdAt;
}
