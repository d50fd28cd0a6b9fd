package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.PublicationStatus;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusChangeRequest {
    private PublicationStatus status;
}
