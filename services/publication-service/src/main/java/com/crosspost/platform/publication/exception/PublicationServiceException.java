package com.crosspost.platform.publication.exception;

/**
 * Root of the errors raised by the publication core.
 */
public abstract class PublicationServiceException extends RuntimeException {

    protected PublicationServiceException(String message) {
        super(message);
    }

    public abstract String getCode();
}
