package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.MediaType;
import com.crosspost.platform.publication.model.StorageType;
import lombok.*;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewMediaRequest {
    private MediaType type;
    @Builder.Default
    private StorageType storageType = StorageType.URL;
    private String storageRef;
    private String filename;
    private String mimeType;
    private Long sizeBytes;
    private Map<String, Object> meta;
}
