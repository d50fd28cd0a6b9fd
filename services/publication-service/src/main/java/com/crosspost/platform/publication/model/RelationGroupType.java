package com.crosspost.platform.publication.model;

public enum RelationGroupType {
    LOCALIZATION,
    SERIES,
    GENERIC;

    /**
     * A publication may belong to at most one group of an exclusive type.
     */
    public boolean isExclusive() {
        return this == LOCALIZATION || this == SERIES;
    }
}
