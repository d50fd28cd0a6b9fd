package com.crosspost.platform.publication.model;

public enum MediaType {
    IMAGE,
    VIDEO,
    AUDIO,
    DOCUMENT
}
