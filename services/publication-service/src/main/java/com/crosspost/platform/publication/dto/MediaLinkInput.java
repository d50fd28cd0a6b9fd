package com.crosspost.platform.publication.dto;

import lombok.*;
import java.util.UUID;

/**
 * Either an existing media id or a descriptor of media to register.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaLinkInput {
    private UUID mediaId;
    private NewMediaRequest media;
    @Builder.Default
    private Boolean hasSpoiler = false;
}
