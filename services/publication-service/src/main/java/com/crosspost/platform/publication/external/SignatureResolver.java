package com.crosspost.platform.publication.external;

import java.util.Optional;
import java.util.UUID;

public interface SignatureResolver {

    /**
     * Text of the named signature in the given language, if the project has one.
     */
    Optional<String> resolveSignature(UUID projectId, UUID signatureId, String language);
}
