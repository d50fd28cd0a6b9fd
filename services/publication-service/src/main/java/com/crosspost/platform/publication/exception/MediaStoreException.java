package com.crosspost.platform.publication.exception;

public class MediaStoreException extends PublicationServiceException {

    public MediaStoreException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "MEDIA_STORE_ERROR";
    }
}
