package com.crosspost.platform.publication.model;

public enum ContentType {
    POST,
    ARTICLE,
    NEWS,
    STORY,
    VIDEO,
    SHORT
}
