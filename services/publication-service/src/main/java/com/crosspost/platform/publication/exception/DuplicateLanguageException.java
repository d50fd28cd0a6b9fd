package com.crosspost.platform.publication.exception;

public class DuplicateLanguageException extends BadRequestException {

    public DuplicateLanguageException(String language) {
        super("Publication with language " + language + " already exists in this group");
    }

    @Override
    public String getCode() {
        return "DUPLICATE_LANGUAGE";
    }
}
