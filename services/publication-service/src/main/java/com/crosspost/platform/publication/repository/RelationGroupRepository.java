package com.crosspost.platform.publication.repository;

import com.crosspost.platform.publication.entity.RelationGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.UUID;

public interface RelationGroupRepository extends JpaRepository<RelationGroup, UUID> {
}
