package com.crosspost.platform.publication.external;

import com.crosspost.platform.publication.exception.ForbiddenException;
import com.crosspost.platform.publication.model.Capability;

import java.util.UUID;

/**
 * Yes/no authorization decisions for project-scoped actions.
 */
public interface PermissionAuthority {

    /**
     * Passes when the user can see the project at all.
     *
     * @throws ForbiddenException otherwise
     */
    void checkAccess(UUID projectId, UUID userId);

    /**
     * Passes when the user holds the capability in the project.
     *
     * @throws ForbiddenException otherwise
     */
    void checkPermission(UUID projectId, UUID userId, Capability capability);
}
