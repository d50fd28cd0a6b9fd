package com.crosspost.platform.publication.service;

import com.crosspost.platform.publication.dto.BulkOperationRequest;
import com.crosspost.platform.publication.dto.BulkOperationResult;
import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.exception.BadRequestException;
import com.crosspost.platform.publication.exception.PublicationServiceException;
import com.crosspost.platform.publication.external.PermissionAuthority;
import com.crosspost.platform.publication.model.BulkOperation;
import com.crosspost.platform.publication.model.Capability;
import com.crosspost.platform.publication.model.PublicationStatus;
import com.crosspost.platform.publication.repository.PublicationOwnership;
import com.crosspost.platform.publication.repository.PublicationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Applies one operation to a selection of publications. Publications the user
 * may not touch are skipped without error; the result only counts the ones changed.
 * Each publication is changed in its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BulkOperationService {

    private final PublicationRepository publicationRepository;
    private final PublicationAccessGuard accessGuard;
    private final PermissionAuthority permissionAuthority;
    private final PublicationLifecycleService lifecycleService;
    private final RelationGroupService relationGroupService;
    private final ChronologyCalculator chronologyCalculator;
    private final TransactionTemplate transactionTemplate;

    public BulkOperationResult apply(UUID userId, BulkOperationRequest request) {
        BulkOperation operation = request.getOperation();
        if (operation == null) {
            throw new BadRequestException("Operation is required");
        }
        if (operation == BulkOperation.SET_STATUS && request.getStatus() == null) {
            throw new BadRequestException("Status is required for SET_STATUS");
        }
        if (operation == BulkOperation.MOVE && request.getTargetProjectId() == null) {
            throw new BadRequestException("Target project is required for MOVE");
        }

        List<UUID> ids = request.getIds() == null ? List.of() : request.getIds().stream()
                .distinct()
                .collect(Collectors.toList());
        if (ids.isEmpty()) {
            return new BulkOperationResult(0);
        }
        if (operation == BulkOperation.MOVE) {
            permissionAuthority.checkPermission(request.getTargetProjectId(), userId, Capability.PUBLICATIONS_CREATE);
        }

        Set<UUID> authorized = publicationRepository.findByIdIn(ids).stream()
                .filter(row -> isAuthorized(row, operation, userId))
                .map(PublicationOwnership::getId)
                .collect(Collectors.toSet());

        int count = 0;
        for (UUID id : ids) {
            if (!authorized.contains(id)) {
                continue;
            }
            try {
                Boolean applied = transactionTemplate.execute(status -> applyOne(id, request, userId));
                if (Boolean.TRUE.equals(applied)) {
                    count++;
                }
            } catch (RuntimeException e) {
                log.warn("Bulk {} failed for publication {}: {}", operation, id, e.getMessage());
            }
        }

        log.info("Bulk {} by user {} applied to {} of {} publications", operation, userId, count, ids.size());
        return new BulkOperationResult(count);
    }

    private boolean isAuthorized(PublicationOwnership row, BulkOperation operation, UUID userId) {
        try {
            if (operation == BulkOperation.DELETE) {
                accessGuard.assertCanDelete(row.getProjectId(), row.getCreatedBy(), userId);
            } else {
                accessGuard.assertCanUpdate(row.getProjectId(), row.getCreatedBy(), userId);
            }
            return true;
        } catch (PublicationServiceException e) {
            log.warn("Bulk {} skipped publication {}: {}", operation, row.getId(), e.getMessage());
            return false;
        }
    }

    private boolean applyOne(UUID id, BulkOperationRequest request, UUID userId) {
        Optional<Publication> found = publicationRepository.findById(id);
        if (found.isEmpty()) {
            return false;
        }
        Publication publication = found.get();

        switch (request.getOperation()) {
            case DELETE -> {
                relationGroupService.unlinkAll(id);
                publicationRepository.delete(publication);
                return true;
            }
            case ARCHIVE -> {
                publication.setArchivedAt(OffsetDateTime.now());
                publication.setArchivedBy(userId);
            }
            case UNARCHIVE -> {
                publication.setArchivedAt(null);
                publication.setArchivedBy(null);
            }
            case SET_STATUS -> {
                PublicationStatus status = request.getStatus();
                if (status == PublicationStatus.DRAFT || status == PublicationStatus.READY) {
                    lifecycleService.resetPostsToPending(publication);
                    publication.setScheduledAt(null);
                }
                publication.setStatus(status);
                chronologyCalculator.refresh(publication);
            }
            case MOVE -> lifecycleService.moveToProject(publication, request.getTargetProjectId());
        }
        publicationRepository.save(publication);
        return true;
    }
}
