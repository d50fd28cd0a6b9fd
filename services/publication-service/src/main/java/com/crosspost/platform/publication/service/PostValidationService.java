package com.crosspost.platform.publication.service;

import com.crosspost.platform.publication.dto.ChannelViolation;
import com.crosspost.platform.publication.entity.Media;
import com.crosspost.platform.publication.entity.Post;
import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.entity.PublicationMedia;
import com.crosspost.platform.publication.exception.ValidationFailedException;
import com.crosspost.platform.publication.model.ContentType;
import com.crosspost.platform.publication.model.MediaType;
import com.crosspost.platform.publication.model.Platform;
import com.crosspost.platform.publication.model.PostStatus;
import com.crosspost.platform.publication.model.PublicationStatus;
import com.crosspost.platform.publication.validation.ContentValidator;
import com.crosspost.platform.publication.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the content validator over the posts of a publication, either as a
 * blocking gate before scheduling or as a non-blocking recheck after edits.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PostValidationService {

    private final ContentValidator contentValidator;

    public ValidationResult validatePost(Post post, Publication publication) {
        return validatePost(post, publication, publication.getContent(), publication.getContentType());
    }

    ValidationResult validatePost(Post post, Publication publication, String publicationContent,
                                  ContentType contentType) {
        String content = post.getContent() != null ? post.getContent() : publicationContent;
        List<MediaType> mediaTypes = mediaTypes(publication);
        return contentValidator.validate(content, mediaTypes.size(), mediaTypes, platformOf(post), contentType);
    }

    /**
     * Blocks scheduling when any post breaks its platform rules. Content and
     * content type are passed in since they may not be applied yet.
     *
     * @throws ValidationFailedException listing every offending channel
     */
    public void assertSchedulable(Publication publication, String publicationContent, ContentType contentType) {
        List<ChannelViolation> violations = new ArrayList<>();
        for (Post post : publication.getPosts()) {
            ValidationResult result = validatePost(post, publication, publicationContent, contentType);
            if (!result.isValid()) {
                violations.add(ChannelViolation.builder()
                        .channelId(post.getChannel() != null ? post.getChannel().getId() : null)
                        .channelName(channelName(post))
                        .platform(platformOf(post))
                        .errors(result.getErrors())
                        .build());
            }
        }
        if (!violations.isEmpty()) {
            throw new ValidationFailedException(violations);
        }
    }

    /**
     * Rechecks every unpublished post after a content or media edit. Committed
     * publications get failing posts marked FAILED and are themselves downgraded
     * to FAILED; drafts only get the problem noted on the post.
     *
     * @return number of failing posts
     */
    public int revalidate(Publication publication) {
        boolean committed = publication.getStatus().isCommitted();
        int failures = 0;

        for (Post post : publication.getPosts()) {
            if (post.isPublished()) {
                continue;
            }
            ValidationResult result = validatePost(post, publication);
            if (!result.isValid()) {
                failures++;
                post.setErrorMessage(failureMessage(post, result));
                if (committed) {
                    post.setStatus(PostStatus.FAILED);
                }
            } else if (!committed) {
                post.setErrorMessage(null);
            }
        }

        if (committed && failures > 0) {
            log.warn("Publication {} downgraded to FAILED: {} posts no longer pass validation",
                    publication.getId(), failures);
            publication.setStatus(PublicationStatus.FAILED);
        }
        return failures;
    }

    public static String failureMessage(Post post, ValidationResult result) {
        return "Validation failed for " + channelName(post) + ": " + result.joinedErrors();
    }

    private static String channelName(Post post) {
        return post.getChannel() != null ? post.getChannel().getName() : String.valueOf(post.getPlatform());
    }

    private static Platform platformOf(Post post) {
        return post.getChannel() != null ? post.getChannel().getPlatform() : post.getPlatform();
    }

    private static List<MediaType> mediaTypes(Publication publication) {
        return publication.getMedia().stream()
                .map(PublicationMedia::getMedia)
                .map(Media::getType)
                .collect(Collectors.toList());
    }
}
