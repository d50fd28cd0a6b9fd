package com.crosspost.platform.publication.external;

import com.crosspost.platform.publication.dto.MediaUploadRequest;
import com.crosspost.platform.publication.dto.StoredMedia;

public interface MediaStore {

    /**
     * Stores the bytes or the file behind the url and returns its descriptor.
     */
    StoredMedia upload(MediaUploadRequest request);
}
