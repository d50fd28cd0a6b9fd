package com.crosspost.platform.publication.validation;

import com.crosspost.platform.publication.model.ContentLimits;
import com.crosspost.platform.publication.model.ContentType;
import com.crosspost.platform.publication.model.MediaType;
import com.crosspost.platform.publication.model.Platform;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;

/**
 * Per-platform content limits, keyed by content type.
 */
@Component
public class PlatformRules {

    private final Map<Platform, Map<ContentType, ContentLimits>> limits = new EnumMap<>(Platform.class);

    public PlatformRules() {
        ContentLimits telegramPost = ContentLimits.builder()
                .maxTextLength(4096)
                .maxCaptionLength(1024)
                .maxMediaCount(10)
                .maxGalleryCount(10)
                .allowedGalleryTypes(EnumSet.of(MediaType.IMAGE, MediaType.VIDEO))
                .build();
        register(Platform.TELEGRAM, telegramPost, ContentType.POST, ContentType.NEWS);
        register(Platform.TELEGRAM, ContentLimits.builder()
                .maxTextLength(65536)
                .maxCaptionLength(65536)
                .maxMediaCount(1)
                .maxGalleryCount(0)
                .allowedTypes(EnumSet.of(MediaType.IMAGE))
                .build(), ContentType.ARTICLE);

        register(Platform.VK, ContentLimits.builder()
                .maxTextLength(16384)
                .maxCaptionLength(16384)
                .maxMediaCount(10)
                .maxGalleryCount(10)
                .allowedGalleryTypes(EnumSet.allOf(MediaType.class))
                .build(), ContentType.POST, ContentType.NEWS);
        register(Platform.VK, ContentLimits.builder()
                .maxTextLength(65536)
                .maxCaptionLength(65536)
                .maxMediaCount(10)
                .maxGalleryCount(10)
                .allowedTypes(EnumSet.of(MediaType.IMAGE, MediaType.VIDEO))
                .allowedGalleryTypes(EnumSet.of(MediaType.IMAGE, MediaType.VIDEO))
                .build(), ContentType.ARTICLE);

        register(Platform.YOUTUBE, singleVideo(5000), ContentType.VIDEO, ContentType.SHORT, ContentType.POST);
        register(Platform.TIKTOK, singleVideo(2200), ContentType.VIDEO, ContentType.SHORT, ContentType.POST);

        register(Platform.FACEBOOK, ContentLimits.builder()
                .maxTextLength(63206)
                .maxCaptionLength(63206)
                .maxMediaCount(10)
                .maxGalleryCount(10)
                .allowedGalleryTypes(EnumSet.of(MediaType.IMAGE, MediaType.VIDEO))
                .build(), ContentType.POST, ContentType.NEWS, ContentType.VIDEO, ContentType.STORY);

        register(Platform.SITE, ContentLimits.builder()
                .maxTextLength(500000)
                .maxCaptionLength(500000)
                .maxMediaCount(100)
                .maxGalleryCount(100)
                .allowedTypes(EnumSet.of(MediaType.IMAGE))
                .allowedGalleryTypes(EnumSet.of(MediaType.IMAGE))
                .build(), ContentType.ARTICLE, ContentType.NEWS);
    }

    public boolean supports(Platform platform, ContentType contentType) {
        return limits.getOrDefault(platform, Map.of()).containsKey(contentType);
    }

    /**
     * Limits for the content type, falling back to the platform's POST limits.
     */
    public Optional<ContentLimits> limitsFor(Platform platform, ContentType contentType) {
        Map<ContentType, ContentLimits> byType = limits.getOrDefault(platform, Map.of());
        ContentLimits found = byType.get(contentType);
        if (found == null) {
            found = byType.get(ContentType.POST);
        }
        return Optional.ofNullable(found);
    }

    private static ContentLimits singleVideo(int maxLength) {
        return ContentLimits.builder()
                .maxTextLength(maxLength)
                .maxCaptionLength(maxLength)
                .minMediaCount(1)
                .maxMediaCount(1)
                .maxGalleryCount(1)
                .allowedTypes(EnumSet.of(MediaType.VIDEO))
                .build();
    }

    private void register(Platform platform, ContentLimits contentLimits, ContentType... types) {
        Map<ContentType, ContentLimits> byType = limits.computeIfAbsent(platform, p -> new EnumMap<>(ContentType.class));
        for (ContentType type : types) {
            byType.put(type, contentLimits);
        }
    }
}
