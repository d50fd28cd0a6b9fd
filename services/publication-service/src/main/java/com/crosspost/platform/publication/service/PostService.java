package com.crosspost.platform.publication.service;

import com.crosspost.platform.publication.dto.PostResponse;
import com.crosspost.platform.publication.dto.UpdatePostRequest;
import com.crosspost.platform.publication.entity.Post;
import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.exception.NotFoundException;
import com.crosspost.platform.publication.model.PostStatus;
import com.crosspost.platform.publication.model.PublicationStatus;
import com.crosspost.platform.publication.repository.PostRepository;
import com.crosspost.platform.publication.repository.PublicationRepository;
import com.crosspost.platform.publication.validation.ContentValidator;
import com.crosspost.platform.publication.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Per-post overrides. Posts themselves are only created by fan-out.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostService {

    private final PostRepository postRepository;
    private final PublicationRepository publicationRepository;
    private final PublicationAccessGuard accessGuard;
    private final PostValidationService postValidationService;
    private final ChronologyCalculator chronologyCalculator;
    private final PublicationMapper mapper;

    @Transactional(readOnly = true)
    public PostResponse getPost(UUID postId, UUID userId) {
        Post post = loadPost(postId);
        accessGuard.loadReadable(post.getPublication().getId(), userId);
        return mapper.toPostResponse(post);
    }

    @Transactional
    public PostResponse updatePost(UUID postId, UUID userId, UpdatePostRequest request) {
        Post post = loadPost(postId);
        Publication publication = accessGuard.loadForUpdate(post.getPublication().getId(), userId);

        if (request.getScheduledAt() != null) {
            post.setScheduledAt(request.getScheduledAt());
        }
        if (request.getAuthorSignature() != null) {
            post.setAuthorSignature(request.getAuthorSignature().isBlank() ? null : request.getAuthorSignature());
        }
        if (request.getContent() != null) {
            post.setContent(ContentValidator.normalizeOverride(request.getContent()));
            if (!post.isPublished()) {
                recheck(post, publication);
            }
        }

        Post saved = postRepository.save(post);
        log.info("Updated post {} of publication {}", postId, publication.getId());
        return mapper.toPostResponse(saved);
    }

    private void recheck(Post post, Publication publication) {
        ValidationResult result = postValidationService.validatePost(post, publication);
        if (result.isValid()) {
            if (post.getStatus() == PostStatus.FAILED) {
                post.setStatus(PostStatus.PENDING);
            }
            post.setErrorMessage(null);
            return;
        }

        post.setErrorMessage(PostValidationService.failureMessage(post, result));
        if (publication.getStatus().isCommitted()) {
            post.setStatus(PostStatus.FAILED);
            if (publication.getStatus() != PublicationStatus.FAILED) {
                log.warn("Publication {} downgraded to FAILED: post {} no longer passes validation",
                        publication.getId(), post.getId());
                publication.setStatus(PublicationStatus.FAILED);
                chronologyCalculator.refresh(publication);
                publicationRepository.save(publication);
            }
        }
    }

    private Post loadPost(UUID postId) {
        return postRepository.findById(postId)
                .orElseThrow(() -> new NotFoundException("Post not found"));
    }
}
