package com.crosspost.platform.publication.model;

public enum Capability {
    PUBLICATIONS_CREATE,
    PUBLICATIONS_READ,
    PUBLICATIONS_UPDATE_OWN,
    PUBLICATIONS_UPDATE_ALL,
    PUBLICATIONS_DELETE_OWN,
    PUBLICATIONS_DELETE_ALL;

    public boolean isMutation() {
        return this != PUBLICATIONS_READ;
    }

    public static Capability update(boolean own) {
        return own ? PUBLICATIONS_UPDATE_OWN : PUBLICATIONS_UPDATE_ALL;
    }

    public static Capability delete(boolean own) {
        return own ? PUBLICATIONS_DELETE_OWN : PUBLICATIONS_DELETE_ALL;
    }
}
