package com.crosspost.platform.publication.model;

public enum StorageType {
    FS,
    S3,
    URL
}
