package com.crosspost.platform.publication.repository;

import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.model.PublicationStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface PublicationRepository extends JpaRepository<Publication, UUID> {

    List<PublicationOwnership> findByIdIn(Collection<UUID> ids);

    @Query("SELECT p FROM Publication p WHERE p.projectId = :projectId " +
           "AND (:status IS NULL OR p.status = :status) " +
           "AND (:includeArchived = TRUE OR p.archivedAt IS NULL)")
    Page<Publication> search(@Param("projectId") UUID projectId,
                             @Param("status") PublicationStatus status,
                             @Param("includeArchived") boolean includeArchived,
                             Pageable pageable);
}
