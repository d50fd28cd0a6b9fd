package com.crosspost.platform.publication.exception;

import java.util.Collection;
import java.util.UUID;

public class ChannelScopeMismatchException extends BadRequestException {

    public ChannelScopeMismatchException(Collection<UUID> missingChannelIds) {
        super("Channels not found in the publication's project: " + missingChannelIds);
    }

    @Override
    public String getCode() {
        return "CHANNEL_SCOPE_MISMATCH";
    }
}
