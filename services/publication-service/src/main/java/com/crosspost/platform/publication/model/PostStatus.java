package com.crosspost.platform.publication.model;

public enum PostStatus {
    PENDING,
    SCHEDULED,
    PUBLISHED,
    FAILED
}
