package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.RelationGroupType;
import lombok.*;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkPublicationRequest {
    private UUID targetPublicationId;
    @Builder.Default
    private RelationGroupType type = RelationGroupType.LOCALIZATION;
}
