package com.crosspost.platform.publication.validation;

import com.crosspost.platform.publication.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {
    private Platform platform;

    @Builder.Default
    private boolean valid = true;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static ValidationResult valid(Platform platform) {
        return ValidationResult.builder()
                .platform(platform)
                .valid(true)
                .build();
    }

    public void addError(String error) {
        if (errors == null) errors = new ArrayList<>();
        errors.add(error);
        valid = false;
    }

    public String joinedErrors() {
        return errors == null ? "" : String.join("; ", errors);
    }
}
