package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.RelationGroupType;
import lombok.*;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationGroupResponse {
    private UUID id;
    private UUID projectId;
    private RelationGroupType type;
    private List<Member> members;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Member {
        private UUID publicationId;
        private String title;
        private String language;
        private Integer position;
    }
}
