package com.crosspost.platform.publication.external;

import com.crosspost.platform.publication.entity.Channel;
import com.crosspost.platform.publication.repository.ChannelRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JpaChannelDirectory implements ChannelDirectory {

    private final ChannelRepository channelRepository;

    @Override
    public List<Channel> channelsByIds(Collection<UUID> ids, UUID projectId) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return channelRepository.findByIdInAndProjectId(ids, projectId);
    }
}
