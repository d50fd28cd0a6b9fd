package com.crosspost.platform.publication.validation;

import com.crosspost.platform.publication.model.ContentLimits;
import com.crosspost.platform.publication.model.ContentType;
import com.crosspost.platform.publication.model.MediaType;
import com.crosspost.platform.publication.model.Platform;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks content and media against the rules of a target platform.
 * Stateless, no I/O.
 */
@Component
@RequiredArgsConstructor
public class ContentValidator {

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");
    private static final Pattern DECIMAL_ENTITY = Pattern.compile("&#(\\d+);");
    private static final Pattern HEX_ENTITY = Pattern.compile("&#x([0-9a-fA-F]+);");

    private final PlatformRules platformRules;

    public ValidationResult validate(String content, int mediaCount, List<MediaType> mediaTypes,
                                     Platform platform, ContentType contentType) {
        ValidationResult result = ValidationResult.valid(platform);
        int textLength = textLength(content);
        boolean hasMedia = mediaCount > 0;

        if (!hasText(content) && !hasMedia) {
            result.addError("Content or media is required for " + platform);
        }

        if (!platformRules.supports(platform, contentType)) {
            result.addError(String.format("Content type %s is not supported by %s", contentType, platform));
        }

        Optional<ContentLimits> found = platformRules.limitsFor(platform, contentType);
        if (found.isEmpty()) {
            return result;
        }
        ContentLimits limits = found.get();

        int maxLength = limits.textLimit(hasMedia);
        if (textLength > maxLength) {
            result.addError(String.format("%s length (%d) exceeds maximum allowed (%d) for %s",
                    hasMedia ? "Caption" : "Text", textLength, maxLength, platform));
        }

        if (mediaCount > limits.getMaxMediaCount()) {
            result.addError(String.format("Media count (%d) exceeds maximum allowed (%d) for %s",
                    mediaCount, limits.getMaxMediaCount(), platform));
        }
        if (mediaCount < limits.getMinMediaCount()) {
            result.addError(String.format("Media count (%d) is below minimum required (%d) for %s",
                    mediaCount, limits.getMinMediaCount(), platform));
        }

        List<MediaType> types = mediaTypes == null ? List.of() : mediaTypes;
        if (types.size() == 1) {
            MediaType single = types.get(0);
            if (!limits.isAllowedSingle(single)) {
                result.addError(String.format("Media type %s is not allowed for %s %s",
                        single, platform, contentType));
            }
        } else if (types.size() > 1) {
            if (types.size() > limits.getMaxGalleryCount()) {
                result.addError(String.format("Gallery size (%d) exceeds maximum allowed (%d) for %s",
                        types.size(), limits.getMaxGalleryCount(), platform));
            }
            types.stream()
                    .filter(type -> !limits.isAllowedInGallery(type))
                    .distinct()
                    .forEach(type -> result.addError(String.format(
                            "Media type %s is not allowed in a gallery for %s", type, platform)));
        }

        return result;
    }

    /**
     * Length of the text as the reader sees it: tags stripped, entities decoded.
     */
    public static int textLength(String content) {
        if (content == null || content.isEmpty()) return 0;
        return plainText(content).length();
    }

    public static boolean hasText(String content) {
        return content != null && !plainText(content).isBlank();
    }

    /**
     * A post override that renders to whitespace only is treated as absent.
     */
    public static String normalizeOverride(String content) {
        if (content == null) return null;
        return plainText(content).trim().isEmpty() ? null : content;
    }

    static String plainText(String html) {
        String stripped = HTML_TAG.matcher(html).replaceAll("");
        stripped = replaceCodePoints(DECIMAL_ENTITY.matcher(stripped), 10);
        stripped = replaceCodePoints(HEX_ENTITY.matcher(stripped), 16);
        return stripped
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }

    private static String replaceCodePoints(Matcher matcher, int radix) {
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement;
            try {
                replacement = new String(Character.toChars(Integer.parseInt(matcher.group(1), radix)));
            } catch (IllegalArgumentException e) {
                // out of range code points stay as written
                replacement = matcher.group();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
