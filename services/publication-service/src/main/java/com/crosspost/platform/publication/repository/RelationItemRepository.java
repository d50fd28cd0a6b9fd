package com.crosspost.platform.publication.repository;

import com.crosspost.platform.publication.entity.RelationItem;
import com.crosspost.platform.publication.model.RelationGroupType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RelationItemRepository extends JpaRepository<RelationItem, UUID> {

    List<RelationItem> findByPublicationId(UUID publicationId);

    Optional<RelationItem> findByPublicationIdAndGroupId(UUID publicationId, UUID groupId);

    @Query("SELECT i FROM RelationItem i WHERE i.publication.id = :publicationId AND i.group.type = :type")
    List<RelationItem> findByPublicationAndGroupType(@Param("publicationId") UUID publicationId,
                                                     @Param("type") RelationGroupType type);
}
