package com.crosspost.platform.publication.model;

public enum Platform {
    TELEGRAM,
    VK,
    YOUTUBE,
    TIKTOK,
    FACEBOOK,
    SITE
}
