package com.crosspost.platform.publication.service;

import com.crosspost.platform.publication.dto.MediaLinkInput;
import com.crosspost.platform.publication.dto.MediaUploadRequest;
import com.crosspost.platform.publication.dto.NewMediaRequest;
import com.crosspost.platform.publication.dto.PublicationResponse;
import com.crosspost.platform.publication.dto.StoredMedia;
import com.crosspost.platform.publication.entity.Media;
import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.entity.PublicationMedia;
import com.crosspost.platform.publication.exception.BadRequestException;
import com.crosspost.platform.publication.exception.NotFoundException;
import com.crosspost.platform.publication.external.MediaStore;
import com.crosspost.platform.publication.model.PublicationStatus;
import com.crosspost.platform.publication.repository.MediaRepository;
import com.crosspost.platform.publication.repository.PublicationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Edits the ordered media list of a publication. Changes to the media set
 * recheck the live posts but never set the publication status directly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PublicationMediaService {

    private final PublicationAccessGuard accessGuard;
    private final PublicationRepository publicationRepository;
    private final MediaRepository mediaRepository;
    private final MediaStore mediaStore;
    private final PostValidationService postValidationService;
    private final ChronologyCalculator chronologyCalculator;
    private final PublicationMapper mapper;

    @Transactional
    public PublicationResponse appendMedia(UUID publicationId, UUID userId, List<MediaLinkInput> inputs) {
        Publication publication = accessGuard.loadForUpdate(publicationId, userId);
        if (inputs == null || inputs.isEmpty()) {
            throw new BadRequestException("At least one media item is required");
        }
        attach(publication, resolveLinks(inputs));
        log.info("Added {} media to publication {}", inputs.size(), publicationId);
        return afterMediaSetChange(publication);
    }

    /**
     * Stores the file through the media store, then appends it.
     */
    @Transactional
    public PublicationResponse uploadMedia(UUID publicationId, UUID userId, MediaUploadRequest request) {
        Publication publication = accessGuard.loadForUpdate(publicationId, userId);
        if (request.getType() == null) {
            throw new BadRequestException("Media type is required");
        }

        StoredMedia stored = mediaStore.upload(request);
        Media media = mediaRepository.save(Media.builder()
                .type(request.getType())
                .storageType(stored.getStorageType())
                .storageRef(stored.getStorageRef())
                .filename(request.getFilename())
                .mimeType(stored.getMimeType() != null ? stored.getMimeType() : request.getMimeType())
                .sizeBytes(stored.getSizeBytes())
                .build());

        attach(publication, List.of(PublicationMedia.builder()
                .media(media)
                .hasSpoiler(Boolean.TRUE.equals(request.getHasSpoiler()))
                .build()));
        log.info("Uploaded media {} to publication {}", media.getId(), publicationId);
        return afterMediaSetChange(publication);
    }

    @Transactional
    public PublicationResponse removeMedia(UUID publicationId, UUID userId, UUID mediaId) {
        Publication publication = accessGuard.loadForUpdate(publicationId, userId);
        PublicationMedia link = publication.getMedia().stream()
                .filter(existing -> mediaId.equals(existing.getMedia().getId()))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Media not found in this publication"));

        publication.getMedia().removeIf(existing -> existing == link);
        publication.compactMediaPositions();
        log.info("Removed media {} from publication {}", mediaId, publicationId);
        return afterMediaSetChange(publication);
    }

    /**
     * Reorders media to follow the given link ids, which must list every link exactly once.
     */
    @Transactional
    public PublicationResponse reorderMedia(UUID publicationId, UUID userId, List<UUID> linkIds) {
        Publication publication = accessGuard.loadForUpdate(publicationId, userId);
        Set<UUID> current = publication.getMedia().stream()
                .map(PublicationMedia::getId)
                .collect(Collectors.toSet());
        if (linkIds == null || linkIds.size() != current.size() || !current.equals(new HashSet<>(linkIds))) {
            throw new BadRequestException("Reorder must list every media link of the publication exactly once");
        }

        publication.getMedia().sort(Comparator.comparingInt(link -> linkIds.indexOf(link.getId())));
        publication.compactMediaPositions();
        return mapper.toResponse(publicationRepository.save(publication));
    }

    /**
     * Replaces the whole media set, in the given order.
     */
    @Transactional
    public PublicationResponse replaceMedia(UUID publicationId, UUID userId, List<MediaLinkInput> inputs) {
        Publication publication = accessGuard.loadForUpdate(publicationId, userId);
        List<PublicationMedia> links = inputs == null ? List.of() : resolveLinks(inputs);
        publication.getMedia().clear();
        attach(publication, links);
        log.info("Replaced media of publication {} with {} items", publicationId, links.size());
        return afterMediaSetChange(publication);
    }

    @Transactional
    public PublicationResponse updateMediaLink(UUID publicationId, UUID userId, UUID linkId, Boolean hasSpoiler) {
        Publication publication = accessGuard.loadForUpdate(publicationId, userId);
        PublicationMedia link = publication.getMedia().stream()
                .filter(existing -> linkId.equals(existing.getId()))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Media not found in this publication"));
        if (hasSpoiler != null) {
            link.setHasSpoiler(hasSpoiler);
        }
        return mapper.toResponse(publicationRepository.save(publication));
    }

    /**
     * Turns link inputs into unsaved links, registering media given by descriptor.
     */
    List<PublicationMedia> resolveLinks(List<MediaLinkInput> inputs) {
        List<UUID> existingIds = inputs.stream()
                .map(MediaLinkInput::getMediaId)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.toList());
        Map<UUID, Media> existing = existingIds.isEmpty() ? Map.of() : mediaRepository.findAllById(existingIds).stream()
                .collect(Collectors.toMap(Media::getId, Function.identity()));
        List<UUID> missing = existingIds.stream()
                .filter(id -> !existing.containsKey(id))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new NotFoundException("Media not found: " + missing);
        }

        List<PublicationMedia> links = new ArrayList<>();
        for (MediaLinkInput input : inputs) {
            Media media;
            if (input.getMediaId() != null) {
                media = existing.get(input.getMediaId());
            } else if (input.getMedia() != null) {
                media = registerMedia(input.getMedia());
            } else {
                throw new BadRequestException("Media id or media descriptor is required");
            }
            links.add(PublicationMedia.builder()
                    .media(media)
                    .hasSpoiler(Boolean.TRUE.equals(input.getHasSpoiler()))
                    .build());
        }
        return links;
    }

    void attach(Publication publication, List<PublicationMedia> links) {
        for (PublicationMedia link : links) {
            link.setPublication(publication);
            publication.getMedia().add(link);
        }
        publication.compactMediaPositions();
    }

    private Media registerMedia(NewMediaRequest request) {
        if (request.getType() == null || request.getStorageRef() == null || request.getStorageRef().isBlank()) {
            throw new BadRequestException("Media type and storage reference are required");
        }
        return mediaRepository.save(Media.builder()
                .type(request.getType())
                .storageType(request.getStorageType())
                .storageRef(request.getStorageRef())
                .filename(request.getFilename())
                .mimeType(request.getMimeType())
                .sizeBytes(request.getSizeBytes())
                .meta(request.getMeta())
                .build());
    }

    private PublicationResponse afterMediaSetChange(Publication publication) {
        PublicationStatus before = publication.getStatus();
        postValidationService.revalidate(publication);
        if (publication.getStatus() != before) {
            chronologyCalculator.refresh(publication);
        }
        return mapper.toResponse(publicationRepository.save(publication));
    }
}
