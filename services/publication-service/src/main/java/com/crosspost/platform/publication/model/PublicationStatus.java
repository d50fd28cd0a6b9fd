package com.crosspost.platform.publication.model;

import java.util.EnumSet;
import java.util.Set;

public enum PublicationStatus {
    DRAFT,
    READY,
    SCHEDULED,
    PROCESSING,
    PUBLISHED,
    PARTIAL,
    FAILED,
    EXPIRED;

    private static final Set<PublicationStatus> WORKER_MANAGED =
            EnumSet.of(PROCESSING, PUBLISHED, PARTIAL, EXPIRED);

    /**
     * DRAFT and READY are editable states with no live posts.
     */
    public boolean isCommitted() {
        return this != DRAFT && this != READY;
    }

    /**
     * Reached only through outcomes reported by the dispatch worker.
     */
    public boolean isWorkerManaged() {
        return WORKER_MANAGED.contains(this);
    }
}
