package com.crosspost.platform.publication.service;

import com.crosspost.platform.publication.dto.CreatePostsRequest;
import com.crosspost.platform.publication.dto.CreatePublicationRequest;
import com.crosspost.platform.publication.dto.CreateRelatedRequest;
import com.crosspost.platform.publication.dto.LinkPublicationRequest;
import com.crosspost.platform.publication.dto.PostResponse;
import com.crosspost.platform.publication.dto.PublicationPageResponse;
import com.crosspost.platform.publication.dto.PublicationResponse;
import com.crosspost.platform.publication.dto.RelationGroupResponse;
import com.crosspost.platform.publication.dto.UpdatePublicationRequest;
import com.crosspost.platform.publication.entity.Post;
import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.entity.PublicationMedia;
import com.crosspost.platform.publication.entity.RelationGroup;
import com.crosspost.platform.publication.event.PublicationScheduledEvent;
import com.crosspost.platform.publication.exception.BadRequestException;
import com.crosspost.platform.publication.model.ContentType;
import com.crosspost.platform.publication.model.PublicationStatus;
import com.crosspost.platform.publication.model.RelationGroupType;
import com.crosspost.platform.publication.repository.PublicationRepository;
import com.crosspost.platform.publication.validation.ContentValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Owns the publication status machine: DRAFT, READY and SCHEDULED are driven
 * from here, the remaining statuses are reported by the dispatch worker.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PublicationLifecycleService {

    private static final int MAX_PAGE_SIZE = 100;

    private final PublicationRepository publicationRepository;
    private final PublicationAccessGuard accessGuard;
    private final PostValidationService postValidationService;
    private final FanOutService fanOutService;
    private final RelationGroupService relationGroupService;
    private final PublicationMediaService mediaService;
    private final ChronologyCalculator chronologyCalculator;
    private final PublicationMapper mapper;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public PublicationResponse create(UUID userId, CreatePublicationRequest request) {
        if (request.getProjectId() == null) {
            throw new BadRequestException("Project is required");
        }
        accessGuard.assertCanCreateIn(request.getProjectId(), userId);

        PublicationStatus status = request.getStatus() != null ? request.getStatus() : PublicationStatus.DRAFT;
        assertSettable(status);
        boolean scheduling = status == PublicationStatus.SCHEDULED
                || (request.getStatus() == null && request.getScheduledAt() != null);

        List<PublicationMedia> links = request.getMedia() != null
                ? mediaService.resolveLinks(request.getMedia()) : List.of();
        boolean hasContent = hasContentOrMedia(request.getContent(), links.size());
        if (status == PublicationStatus.READY && !hasContent) {
            throw new BadRequestException("Content or media is required when status is READY");
        }
        if (scheduling) {
            assertSchedulePreconditions(request.getScheduledAt(), hasContent);
        }

        Publication linkTarget = request.getLinkToPublicationId() != null
                ? accessGuard.loadReadable(request.getLinkToPublicationId(), userId) : null;

        Publication publication = Publication.builder()
                .projectId(request.getProjectId())
                .createdBy(userId)
                .title(request.getTitle())
                .description(request.getDescription())
                .content(request.getContent())
                .authorComment(request.getAuthorComment())
                .tags(normalizeTags(request.getTags()))
                .status(scheduling ? PublicationStatus.DRAFT : status)
                .contentType(request.getContentType() != null ? request.getContentType() : ContentType.POST)
                .language(request.getLanguage())
                .scheduledAt(scheduling ? request.getScheduledAt() : null)
                .sourceNewsItemId(request.getSourceNewsItemId())
                .meta(request.getMeta() != null ? new HashMap<>(request.getMeta()) : new HashMap<>())
                .build();
        mediaService.attach(publication, links);
        publication = publicationRepository.save(publication);

        if (linkTarget != null) {
            RelationGroupType linkType = request.getLinkType() != null
                    ? request.getLinkType() : RelationGroupType.LOCALIZATION;
            relationGroupService.linkTogether(publication, linkTarget, linkType, userId);
        }
        if (request.getChannelIds() != null && !request.getChannelIds().isEmpty()) {
            fanOutService.createPosts(publication, request.getChannelIds(), null, request.getSignature());
        }
        if (scheduling) {
            postValidationService.assertSchedulable(publication, publication.getContent(), publication.getContentType());
            publication.setStatus(PublicationStatus.SCHEDULED);
        }

        chronologyCalculator.refresh(publication);
        publication = publicationRepository.save(publication);
        log.info("Created publication {} in project {} with status {}",
                publication.getId(), publication.getProjectId(), publication.getStatus());

        if (scheduling) {
            publishScheduled(publication);
        }
        return mapper.toResponse(publication);
    }

    @Transactional(readOnly = true)
    public PublicationResponse get(UUID publicationId, UUID userId) {
        return mapper.toResponse(accessGuard.loadReadable(publicationId, userId));
    }

    /**
     * Page of the project's publications, newest effective time first.
     */
    @Transactional(readOnly = true)
    public PublicationPageResponse list(UUID projectId, UUID userId, PublicationStatus status,
                                        boolean includeArchived, int page, int size) {
        accessGuard.assertProjectAccessible(projectId, userId);
        int pageSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        PageRequest pageable = PageRequest.of(Math.max(page, 0), pageSize,
                Sort.by(Sort.Direction.DESC, "effectiveAt"));

        Page<Publication> result = publicationRepository.search(projectId, status, includeArchived, pageable);
        return PublicationPageResponse.builder()
                .items(result.getContent().stream()
                        .map(mapper::toResponse)
                        .collect(Collectors.toList()))
                .total(result.getTotalElements())
                .page(pageable.getPageNumber())
                .size(pageSize)
                .build();
    }

    /**
     * Applies a partial update. Leaving DRAFT/READY for SCHEDULED, explicitly or
     * by passing a schedule time, validates every post first and fails as a whole.
     */
    @Transactional
    public PublicationResponse update(UUID publicationId, UUID userId, UpdatePublicationRequest request) {
        Publication publication = accessGuard.loadForUpdate(publicationId, userId);
        PublicationStatus previous = publication.getStatus();

        if (request.getProjectId() != null && !request.getProjectId().equals(publication.getProjectId())) {
            accessGuard.assertCanCreateIn(request.getProjectId(), userId);
            moveToProject(publication, request.getProjectId());
        }

        if (request.getLanguage() != null && !request.getLanguage().equals(publication.getLanguage())) {
            relationGroupService.assertLanguageChangeAllowed(publication, request.getLanguage());
        }

        PublicationStatus targetStatus = request.getStatus();
        if (targetStatus != null && targetStatus != previous) {
            assertSettable(targetStatus);
        }
        String content = request.getContent() != null ? request.getContent() : publication.getContent();
        ContentType contentType = request.getContentType() != null
                ? request.getContentType() : publication.getContentType();
        boolean hasContent = hasContentOrMedia(content, publication.getMedia().size());

        boolean unscheduling = targetStatus == PublicationStatus.DRAFT || targetStatus == PublicationStatus.READY;
        if (unscheduling) {
            if (targetStatus == PublicationStatus.READY && !hasContent) {
                throw new BadRequestException("Content or media is required when status is READY");
            }
            resetPostsToPending(publication);
        }

        boolean scheduling = !unscheduling
                && (targetStatus == PublicationStatus.SCHEDULED || request.getScheduledAt() != null);
        OffsetDateTime scheduleAt = null;
        if (scheduling) {
            scheduleAt = request.getScheduledAt() != null ? request.getScheduledAt() : publication.getScheduledAt();
            assertSchedulePreconditions(scheduleAt, hasContent);
            postValidationService.assertSchedulable(publication, content, contentType);
            resetPostsToPending(publication);
            targetStatus = PublicationStatus.SCHEDULED;
        }

        applyFields(publication, request);
        if (unscheduling) {
            publication.setScheduledAt(null);
        } else if (scheduling) {
            publication.setScheduledAt(scheduleAt);
        }
        if (targetStatus != null) {
            publication.setStatus(targetStatus);
        }

        if (!unscheduling && (request.getContent() != null || request.getContentType() != null)) {
            postValidationService.revalidate(publication);
        }

        chronologyCalculator.refresh(publication);
        Publication saved = publicationRepository.save(publication);
        if (saved.getStatus() != previous) {
            log.info("Publication {} moved from {} to {}", saved.getId(), previous, saved.getStatus());
        }
        if (scheduling) {
            publishScheduled(saved);
        }
        return mapper.toResponse(saved);
    }

    @Transactional
    public PublicationResponse schedule(UUID publicationId, UUID userId, OffsetDateTime scheduledAt) {
        return update(publicationId, userId, UpdatePublicationRequest.builder()
                .status(PublicationStatus.SCHEDULED)
                .scheduledAt(scheduledAt)
                .build());
    }

    @Transactional
    public PublicationResponse changeStatus(UUID publicationId, UUID userId, PublicationStatus status) {
        if (status == null) {
            throw new BadRequestException("Status is required");
        }
        return update(publicationId, userId, UpdatePublicationRequest.builder().status(status).build());
    }

    @Transactional
    public void delete(UUID publicationId, UUID userId) {
        Publication publication = accessGuard.loadForDelete(publicationId, userId);
        relationGroupService.unlinkAll(publication.getId());
        publicationRepository.delete(publication);
        log.info("Deleted publication {}", publicationId);
    }

    @Transactional
    public PublicationResponse archive(UUID publicationId, UUID userId) {
        Publication publication = accessGuard.loadForUpdate(publicationId, userId);
        publication.setArchivedAt(OffsetDateTime.now());
        publication.setArchivedBy(userId);
        log.info("Archived publication {}", publicationId);
        return mapper.toResponse(publicationRepository.save(publication));
    }

    @Transactional
    public PublicationResponse unarchive(UUID publicationId, UUID userId) {
        Publication publication = accessGuard.loadForUpdate(publicationId, userId);
        publication.setArchivedAt(null);
        publication.setArchivedBy(null);
        log.info("Unarchived publication {}", publicationId);
        return mapper.toResponse(publicationRepository.save(publication));
    }

    /**
     * Fans the publication out to more channels. New posts are PENDING even
     * on a SCHEDULED publication and go live with the next schedule pass.
     */
    @Transactional
    public List<PostResponse> createPosts(UUID publicationId, UUID userId, CreatePostsRequest request) {
        Publication publication = accessGuard.loadForUpdate(publicationId, userId);
        List<Post> posts = fanOutService.createPosts(publication, request.getChannelIds(),
                request.getScheduledAt(), request.getSignature());
        return posts.stream()
                .map(mapper::toPostResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public RelationGroupResponse link(UUID publicationId, UUID userId, LinkPublicationRequest request) {
        if (request.getTargetPublicationId() == null) {
            throw new BadRequestException("Target publication is required");
        }
        Publication source = accessGuard.loadForUpdate(publicationId, userId);
        Publication target = accessGuard.loadReadable(request.getTargetPublicationId(), userId);
        RelationGroupType type = request.getType() != null ? request.getType() : RelationGroupType.LOCALIZATION;

        UUID groupId = relationGroupService.linkTogether(source, target, type, userId);
        return relationGroupService.toResponse(relationGroupService.getGroup(groupId));
    }

    @Transactional
    public void unlink(UUID publicationId, UUID userId, UUID groupId) {
        accessGuard.loadForUpdate(publicationId, userId);
        relationGroupService.unlink(publicationId, groupId);
    }

    @Transactional(readOnly = true)
    public List<RelationGroupResponse> relations(UUID publicationId, UUID userId) {
        accessGuard.loadReadable(publicationId, userId);
        return relationGroupService.groupsOf(publicationId);
    }

    @Transactional
    public RelationGroupResponse reorderGroup(UUID groupId, UUID userId, List<UUID> publicationIds) {
        RelationGroup group = relationGroupService.getGroup(groupId);
        accessGuard.assertProjectAccessible(group.getProjectId(), userId);
        return relationGroupService.toResponse(relationGroupService.reorder(groupId, publicationIds));
    }

    /**
     * Copies the publication into a new DRAFT and links the copy to it.
     */
    @Transactional
    public PublicationResponse createRelated(UUID publicationId, UUID userId, CreateRelatedRequest request) {
        Publication source = accessGuard.loadReadable(publicationId, userId);
        accessGuard.assertCanCreateIn(source.getProjectId(), userId);

        Publication copy = Publication.builder()
                .projectId(source.getProjectId())
                .createdBy(userId)
                .title(request.getTitle() != null ? request.getTitle() : source.getTitle())
                .description(source.getDescription())
                .content(source.getContent())
                .authorComment(source.getAuthorComment())
                .tags(new ArrayList<>(source.getTags() != null ? source.getTags() : List.of()))
                .status(PublicationStatus.DRAFT)
                .contentType(source.getContentType())
                .language(request.getLanguage() != null ? request.getLanguage() : source.getLanguage())
                .meta(source.getMeta() != null ? new HashMap<>(source.getMeta()) : new HashMap<>())
                .build();
        copy = publicationRepository.save(copy);

        RelationGroupType type = request.getType() != null ? request.getType() : RelationGroupType.LOCALIZATION;
        relationGroupService.linkTogether(copy, source, type, userId);

        chronologyCalculator.refresh(copy);
        copy = publicationRepository.save(copy);
        log.info("Created publication {} related to {} (type={})", copy.getId(), publicationId, type);
        return mapper.toResponse(copy);
    }

    /**
     * Detaches the publication from everything scoped to its current project
     * and restarts it as a draft in the target project.
     */
    void moveToProject(Publication publication, UUID targetProjectId) {
        UUID sourceProjectId = publication.getProjectId();
        publication.getPosts().clear();
        relationGroupService.unlinkAll(publication.getId());
        publication.setProjectId(targetProjectId);
        publication.setStatus(PublicationStatus.DRAFT);
        publication.setScheduledAt(null);
        chronologyCalculator.refresh(publication);
        log.info("Moved publication {} from project {} to {}", publication.getId(), sourceProjectId, targetProjectId);
    }

    void resetPostsToPending(Publication publication) {
        publication.getPosts().forEach(Post::resetToPending);
    }

    static List<String> normalizeTags(List<String> tags) {
        List<String> normalized = new ArrayList<>();
        if (tags == null) {
            return normalized;
        }
        Set<String> seen = new HashSet<>();
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) continue;
            String trimmed = tag.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                normalized.add(trimmed);
            }
        }
        return normalized;
    }

    private void applyFields(Publication publication, UpdatePublicationRequest request) {
        if (request.getTitle() != null) publication.setTitle(request.getTitle());
        if (request.getDescription() != null) publication.setDescription(request.getDescription());
        if (request.getContent() != null) publication.setContent(request.getContent());
        if (request.getAuthorComment() != null) publication.setAuthorComment(request.getAuthorComment());
        if (request.getTags() != null) publication.setTags(normalizeTags(request.getTags()));
        if (request.getContentType() != null) publication.setContentType(request.getContentType());
        if (request.getLanguage() != null) publication.setLanguage(request.getLanguage());
        if (request.getSourceNewsItemId() != null) publication.setSourceNewsItemId(request.getSourceNewsItemId());
        if (request.getMeta() != null) {
            Map<String, Object> meta = publication.getMeta() != null
                    ? new HashMap<>(publication.getMeta()) : new HashMap<>();
            request.getMeta().forEach((key, value) -> {
                if (value == null) {
                    meta.remove(key);
                } else {
                    meta.put(key, value);
                }
            });
            publication.setMeta(meta);
        }
    }

    private void assertSettable(PublicationStatus status) {
        if (status.isWorkerManaged() || status == PublicationStatus.FAILED) {
            throw new BadRequestException("Status " + status + " cannot be set directly");
        }
    }

    private void assertSchedulePreconditions(OffsetDateTime scheduleAt, boolean hasContent) {
        if (scheduleAt == null) {
            throw new BadRequestException("Cannot set status to SCHEDULED without a scheduled time");
        }
        if (!hasContent) {
            throw new BadRequestException("Content or media is required when status is SCHEDULED");
        }
    }

    private static boolean hasContentOrMedia(String content, int mediaCount) {
        return mediaCount > 0 || ContentValidator.hasText(content);
    }

    private void publishScheduled(Publication publication) {
        eventPublisher.publishEvent(new PublicationScheduledEvent(
                publication.getId(), publication.getProjectId(), publication.getScheduledAt()));
    }
}
