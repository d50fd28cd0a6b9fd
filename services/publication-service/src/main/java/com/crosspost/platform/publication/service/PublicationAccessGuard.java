package com.crosspost.platform.publication.service;

import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.exception.ForbiddenException;
import com.crosspost.platform.publication.exception.NotFoundException;
import com.crosspost.platform.publication.external.PermissionAuthority;
import com.crosspost.platform.publication.model.Capability;
import com.crosspost.platform.publication.repository.PublicationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.UUID;

/**
 * Loads publications on behalf of a user. Missing project access is reported
 * as NotFound so callers never learn that the publication exists.
 */
@Component
@RequiredArgsConstructor
public class PublicationAccessGuard {

    private final PublicationRepository publicationRepository;
    private final PermissionAuthority permissionAuthority;

    public Publication loadReadable(UUID publicationId, UUID userId) {
        Publication publication = publicationRepository.findById(publicationId)
                .orElseThrow(() -> new NotFoundException("Publication not found"));
        try {
            permissionAuthority.checkAccess(publication.getProjectId(), userId);
        } catch (ForbiddenException e) {
            throw new NotFoundException("Publication not found");
        }
        return publication;
    }

    public Publication loadForUpdate(UUID publicationId, UUID userId) {
        Publication publication = loadReadable(publicationId, userId);
        assertCanUpdate(publication.getProjectId(), publication.getCreatedBy(), userId);
        return publication;
    }

    public Publication loadForDelete(UUID publicationId, UUID userId) {
        Publication publication = loadReadable(publicationId, userId);
        assertCanDelete(publication.getProjectId(), publication.getCreatedBy(), userId);
        return publication;
    }

    public void assertCanUpdate(UUID projectId, UUID createdBy, UUID userId) {
        permissionAuthority.checkPermission(projectId, userId, Capability.update(Objects.equals(createdBy, userId)));
    }

    public void assertCanDelete(UUID projectId, UUID createdBy, UUID userId) {
        permissionAuthority.checkPermission(projectId, userId, Capability.delete(Objects.equals(createdBy, userId)));
    }

    public void assertProjectAccessible(UUID projectId, UUID userId) {
        try {
            permissionAuthority.checkAccess(projectId, userId);
        } catch (ForbiddenException e) {
            throw new NotFoundException("Project not found");
        }
    }

    public void assertCanCreateIn(UUID projectId, UUID userId) {
        assertProjectAccessible(projectId, userId);
        permissionAuthority.checkPermission(projectId, userId, Capability.PUBLICATIONS_CREATE);
    }
}
