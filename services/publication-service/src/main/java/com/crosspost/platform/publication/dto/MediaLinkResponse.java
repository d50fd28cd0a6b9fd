package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.MediaType;
import com.crosspost.platform.publication.model.StorageType;
import lombok.*;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaLinkResponse {
    private UUID id;
    private UUID mediaId;
    private MediaType type;
    private StorageType storageType;
    private String storageRef;
    private String filename;
    private String mimeType;
    private Long sizeBytes;
    private Integer position;
    private Boolean hasSpoiler;
}
