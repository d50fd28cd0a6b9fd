package com.crosspost.platform.publication.model;

public enum BulkOperation {
    DELETE,
    ARCHIVE,
    UNARCHIVE,
    SET_STATUS,
    MOVE
}
