package com.crosspost.platform.publication.dto;

import lombok.*;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePostRequest {
    private String content;
    private OffsetDateTime scheduledAt;
    private String authorSignature;
}
