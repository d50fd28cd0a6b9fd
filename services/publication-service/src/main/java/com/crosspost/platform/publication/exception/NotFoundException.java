package com.crosspost.platform.publication.exception;

public class NotFoundException extends PublicationServiceException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "NOT_FOUND";
    }
}
