package com.crosspost.platform.publication.exception;

public class ForbiddenException extends PublicationServiceException {

    public ForbiddenException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "FORBIDDEN";
    }
}
