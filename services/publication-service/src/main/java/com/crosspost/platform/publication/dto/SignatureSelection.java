package com.crosspost.platform.publication.dto;

import lombok.*;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Named signature applied to every channel, with optional per-channel text overrides.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignatureSelection {
    private UUID signatureId;
    @Builder.Default
    private Map<UUID, String> overrides = new HashMap<>();
}
