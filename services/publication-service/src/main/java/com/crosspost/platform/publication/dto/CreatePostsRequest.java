package com.crosspost.platform.publication.dto;

import lombok.*;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePostsRequest {
    private List<UUID> channelIds;
    private OffsetDateTime scheduledAt;
    private SignatureSelection signature;
}
