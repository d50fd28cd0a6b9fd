package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.RelationGroupType;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRelatedRequest {
    @Builder.Default
    private RelationGroupType type = RelationGroupType.LOCALIZATION;
    private String language;
    private String title;
}
