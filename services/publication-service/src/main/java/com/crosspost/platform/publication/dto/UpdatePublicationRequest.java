package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.ContentType;
import com.crosspost.platform.publication.model.PublicationStatus;
import lombok.*;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Partial update: null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePublicationRequest {
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
}
