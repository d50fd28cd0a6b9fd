package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.Platform;
import lombok.*;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelViolation {
    private UUID channelId;
    private String channelName;
    private Platform platform;
    private List<String> errors;
}
