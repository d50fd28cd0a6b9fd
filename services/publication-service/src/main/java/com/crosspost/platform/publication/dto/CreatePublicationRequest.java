package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.ContentType;
import com.crosspost.platform.publication.model.PublicationStatus;
import com.crosspost.platform.publication.model.RelationGroupType;
import lombok.*;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePublicationRequest {
    private UUID projectId;
    private String title;
    private String description;
    private String content;
    private String authorComment;
    private List<String> tags;
    private PublicationStatus status;
    private ContentType contentType;
    private String language;
    private OffsetDateTime scheduledAt;
    private String sourceNewsItemId;
    private Map<String, Object> meta;
    private List<MediaLinkInput> media;
    private List<UUID> channelIds;
    private SignatureSelection signature;
    private UUID linkToPublicationId;
    @Builder.Default
    private RelationGroupType linkType = RelationGroupType.LOCALIZATION;
}
