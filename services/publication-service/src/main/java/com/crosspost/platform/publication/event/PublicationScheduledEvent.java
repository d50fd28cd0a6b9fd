package com.crosspost.platform.publication.event;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Published when a publication enters SCHEDULED. Relayed to the dispatch queue after commit.
 */
@Data
@AllArgsConstructor
public class PublicationScheduledEvent {
    private UUID publicationId;
    private UUID projectId;
    private OffsetDateTime scheduledAt;
}
