package com.crosspost.platform.publication.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkOperationResult {
    private int count;
}
