package com.crosspost.platform.publication.repository;

import com.crosspost.platform.publication.entity.Media;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.UUID;

public interface MediaRepository extends JpaRepository<Media, UUID> {
}
