package com.crosspost.platform.publication.external;

import com.crosspost.platform.publication.dto.MediaUploadRequest;
import com.crosspost.platform.publication.dto.StoredMedia;
import com.crosspost.platform.publication.exception.BadRequestException;
import com.crosspost.platform.publication.exception.MediaStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Client of the media storage service. Bytes are streamed as-is, urls are
 * handed over for the store to fetch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RemoteMediaStore implements MediaStore {

    private final WebClient.Builder webClientBuilder;

    @Value("${media-store.url}")
    private String mediaStoreUrl;

    @Value("${media-store.timeout-seconds:60}")
    private long timeoutSeconds;

    @Override
    public StoredMedia upload(MediaUploadRequest request) {
        boolean hasBytes = request.getBytes() != null && request.getBytes().length > 0;
        boolean hasUrl = request.getUrl() != null && !request.getUrl().isBlank();
        if (hasBytes == hasUrl) {
            throw new BadRequestException("Exactly one of file bytes or url is required");
        }

        WebClient client = webClientBuilder.baseUrl(mediaStoreUrl).build();
        StoredMedia stored;
        try {
            if (hasBytes) {
                stored = client.post()
                        .uri("/api/v1/files")
                        .header(HttpHeaders.CONTENT_TYPE, request.getMimeType() != null
                                ? request.getMimeType() : MediaType.APPLICATION_OCTET_STREAM_VALUE)
                        .header("X-Filename", request.getFilename() != null ? request.getFilename() : "")
                        .bodyValue(request.getBytes())
                        .retrieve()
                        .bodyToMono(StoredMedia.class)
                        .timeout(Duration.ofSeconds(timeoutSeconds))
                        .block();
            } else {
                stored = client.post()
                        .uri("/api/v1/files/from-url")
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .bodyValue(Map.of("url", request.getUrl()))
                        .retrieve()
                        .bodyToMono(StoredMedia.class)
                        .timeout(Duration.ofSeconds(timeoutSeconds))
                        .block();
            }
        } catch (RuntimeException e) {
            // block() rethrows timeouts and transport errors unchecked
            log.error("Media upload failed: {}", e.getMessage(), e);
            throw new MediaStoreException("Failed to upload media: " + e.getMessage());
        }

        if (stored == null || stored.getStorageRef() == null) {
            throw new MediaStoreException("Media store returned no storage reference");
        }
        log.info("Uploaded media {} ({} bytes)", stored.getStorageRef(), stored.getSizeBytes());
        return stored;
    }
}
