package com.crosspost.platform.publication.repository;

import java.util.UUID;

/**
 * Minimal identity and ownership projection used for bulk authorization.
 */
public interface PublicationOwnership {

    UUID getId();

    UUID getProjectId();

    UUID getCreatedBy();
}
