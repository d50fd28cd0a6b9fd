package com.crosspost.platform.publication.service;

import com.crosspost.platform.publication.entity.Post;
import com.crosspost.platform.publication.entity.Publication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the single timestamp publications are listed by.
 */
@Component
@Slf4j
public class ChronologyCalculator {

    /**
     * Latest publish time of a PUBLISHED post, else the schedule, else the creation time.
     */
    public OffsetDateTime effectiveTime(Publication publication) {
        Optional<OffsetDateTime> lastPublished = publication.getPosts().stream()
                .filter(Post::isPublished)
                .map(Post::getPublishedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder());
        if (lastPublished.isPresent()) {
            return lastPublished.get();
        }
        if (publication.getScheduledAt() != null) {
            return publication.getScheduledAt();
        }
        return publication.getCreatedAt() != null ? publication.getCreatedAt() : OffsetDateTime.now();
    }

    public void refresh(Publication publication) {
        OffsetDateTime effective = effectiveTime(publication);
        log.debug("Effective time of publication {} is {}", publication.getId(), effective);
        publication.setEffectiveAt(effective);
    }
}
