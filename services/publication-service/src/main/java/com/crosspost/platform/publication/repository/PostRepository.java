package com.crosspost.platform.publication.repository;

import com.crosspost.platform.publication.entity.Post;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.UUID;

public interface PostRepository extends JpaRepository<Post, UUID> {
}
