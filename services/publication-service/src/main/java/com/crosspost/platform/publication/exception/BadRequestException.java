package com.crosspost.platform.publication.exception;

public class BadRequestException extends PublicationServiceException {

    public BadRequestException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "BAD_REQUEST";
    }
}
