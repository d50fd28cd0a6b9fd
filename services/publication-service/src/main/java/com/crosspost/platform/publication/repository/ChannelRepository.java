package com.crosspost.platform.publication.repository;

import com.crosspost.platform.publication.entity.Channel;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ChannelRepository extends JpaRepository<Channel, UUID> {

    List<Channel> findByIdInAndProjectId(Collection<UUID> ids, UUID projectId);
}
