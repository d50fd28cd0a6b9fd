package com.crosspost.platform.publication.dto;

import lombok.*;
import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {
    private OffsetDateTime scheduledAt;
}
