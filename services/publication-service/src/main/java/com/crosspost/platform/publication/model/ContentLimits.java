package com.crosspost.platform.publication.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentLimits {
    private int maxTextLength;
    private int maxCaptionLength;

    @Builder.Default
    private int minMediaCount = 0;

    private int maxMediaCount;

    // 0 means galleries are not supported
    private int maxGalleryCount;

    @Builder.Default
    private Set<MediaType> allowedTypes = EnumSet.allOf(MediaType.class);

    @Builder.Default
    private Set<MediaType> allowedGalleryTypes = EnumSet.noneOf(MediaType.class);

    /**
     * Caption limit applies when media is attached, text limit otherwise.
     */
    public int textLimit(boolean hasMedia) {
        return hasMedia ? maxCaptionLength : maxTextLength;
    }

    public boolean isAllowedSingle(MediaType type) {
        return allowedTypes.contains(type);
    }

    public boolean isAllowedInGallery(MediaType type) {
        return allowedGalleryTypes.contains(type);
    }
}
