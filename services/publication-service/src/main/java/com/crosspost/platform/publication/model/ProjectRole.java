package com.crosspost.platform.publication.model;

import java.util.EnumSet;
import java.util.Set;

public enum ProjectRole {
    ADMIN(EnumSet.allOf(Capability.class)),
    EDITOR(EnumSet.of(
            Capability.PUBLICATIONS_CREATE,
            Capability.PUBLICATIONS_READ,
            Capability.PUBLICATIONS_UPDATE_OWN,
            Capability.PUBLICATIONS_DELETE_OWN)),
    VIEWER(EnumSet.of(Capability.PUBLICATIONS_READ));

    private final Set<Capability> capabilities;

    ProjectRole(Set<Capability> capabilities) {
        this.capabilities = capabilities;
    }

    public boolean grants(Capability capability) {
        return capabilities.contains(capability);
    }
}
