package com.crosspost.platform.publication.dto;

import com.crosspost.platform.publication.model.MediaType;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaUploadRequest {
    // one of url or bytes
    private String url;
    private byte[] bytes;
    private String filename;
    private String mimeType;
    private MediaType type;
    @Builder.Default
    private Boolean hasSpoiler = false;
}
