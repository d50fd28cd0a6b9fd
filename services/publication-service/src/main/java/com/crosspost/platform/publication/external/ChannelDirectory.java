package com.crosspost.platform.publication.external;

import com.crosspost.platform.publication.entity.Channel;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ChannelDirectory {

    /**
     * Channels among the given ids that belong to the project. Unknown or
     * foreign ids are simply absent from the result.
     */
    List<Channel> channelsByIds(Collection<UUID> ids, UUID projectId);
}
