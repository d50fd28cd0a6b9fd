package com.crosspost.platform.publication.exception;

/**
 * Linked publications must share project and content type.
 */
public class IncompatibleLinkException extends BadRequestException {

    public IncompatibleLinkException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "INCOMPATIBLE_LINK";
    }
}
