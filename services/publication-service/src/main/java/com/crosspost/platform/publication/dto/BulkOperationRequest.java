package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.BulkOperation;
import com.crosspost.platform.publication.model.PublicationStatus;
import lombok.*;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkOperationRequest {
    private List<UUID> ids;
    private BulkOperation operation;
    // SET_STATUS only
    private PublicationStatus status;
    // MOVE only
    private UUID targetProjectId;
}
