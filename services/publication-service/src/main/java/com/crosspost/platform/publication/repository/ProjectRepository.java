package com.crosspost.platform.publication.repository;

import com.crosspost.platform.publication.entity.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.UUID;

public interface ProjectRepository extends JpaRepository<Project, UUID> {
}
