package com.crosspost.platform.publication.exception;

import com.crosspost.platform.publication.dto.ChannelViolation;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when posts break their platform's content rules at schedule time.
 */
@Getter
public class ValidationFailedException extends PublicationServiceException {

    private final List<ChannelViolation> violations;

    public ValidationFailedException(List<ChannelViolation> violations) {
        super("Cannot schedule: media/content validation failed for " + violations.stream()
                .map(v -> v.getChannelName() + ": " + String.join("; ", v.getErrors()))
                .collect(Collectors.joining(" | ")));
        this.violations = List.copyOf(violations);
    }

    @Override
    public String getCode() {
        return "VALIDATION_FAILED";
    }
}
