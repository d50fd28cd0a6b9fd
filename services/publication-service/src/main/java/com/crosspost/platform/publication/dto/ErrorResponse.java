package com.crosspost.platform.publication.dto;

import lombok.*;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String code;
    private String message;
    private Object details;
    @Builder.Default
    private OffsetDateTime timestamp = OffsetDateTime.now();
}
