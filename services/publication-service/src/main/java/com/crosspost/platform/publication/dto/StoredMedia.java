package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.StorageType;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredMedia {
    @Builder.Default
    private StorageType storageType = StorageType.FS;
    private String storageRef;
    private String mimeType;
    private Long sizeBytes;
}
