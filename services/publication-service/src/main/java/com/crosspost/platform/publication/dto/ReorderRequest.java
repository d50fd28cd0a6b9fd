package com.crosspost.platform.publication.dto;

import lombok.*;
import java.util.List;
import java.util.UUID;

/**
 * Complete list of member ids in their new order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReorderRequest {
    private List<UUID> ids;
}
