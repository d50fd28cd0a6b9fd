package com.crosspost.platform.publication.external;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.crosspost.platform.publication.dto.MediaUploadRequest;
import com.crosspost.platform.publication.dto.StoredMedia;
import com.crosspost.platform.publication.exception.BadRequestException;
import com.crosspost.platform.publication.exception.MediaStoreException;
import com.crosspost.platform.publication.model.MediaType;
import com.crosspost.platform.publication.model.StorageType;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class RemoteMediaStoreTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void url_upload_is_handed_to_the_store() {
        RemoteMediaStore store = store(HttpStatus.OK,
                "{\"storageType\":\"S3\",\"storageRef\":\"media/abc.jpg\",\"mimeType\":\"image/jpeg\",\"sizeBytes\":512}");

        StoredMedia stored = store.upload(MediaUploadRequest.builder()
                .url("https://example.org/abc.jpg")
                .type(MediaType.IMAGE)
                .build());

        assertEquals("media/abc.jpg", stored.getStorageRef());
        assertEquals(StorageType.S3, stored.getStorageType());
        assertEquals(512L, stored.getSizeBytes());
        assertEquals("/api/v1/files/from-url", requests.get(0).url().getPath());
    }

    @Test
    void bytes_are_posted_with_their_mime_type() {
        RemoteMediaStore store = store(HttpStatus.OK, "{\"storageRef\":\"media/clip.mp4\"}");

        StoredMedia stored = store.upload(MediaUploadRequest.builder()
                .bytes(new byte[] {1, 2, 3})
                .mimeType("video/mp4")
                .filename("clip.mp4")
                .type(MediaType.VIDEO)
                .build());

        assertEquals("media/clip.mp4", stored.getStorageRef());
        assertEquals(StorageType.FS, stored.getStorageType());
        ClientRequest request = requests.get(0);
        assertEquals("/api/v1/files", request.url().getPath());
        assertEquals("video/mp4", request.headers().getFirst(HttpHeaders.CONTENT_TYPE));
        assertEquals("clip.mp4", request.headers().getFirst("X-Filename"));
    }

    @Test
    void exactly_one_source_is_required() {
        RemoteMediaStore store = store(HttpStatus.OK, "{}");

        assertThrows(BadRequestException.class, () -> store.upload(MediaUploadRequest.builder()
                .type(MediaType.IMAGE)
                .build()));
        assertThrows(BadRequestException.class, () -> store.upload(MediaUploadRequest.builder()
                .url("https://example.org/a.jpg")
                .bytes(new byte[] {1})
                .build()));
    }

    @Test
    void store_errors_become_media_store_exceptions() {
        RemoteMediaStore store = store(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"down\"}");

        assertThrows(MediaStoreException.class, () -> store.upload(MediaUploadRequest.builder()
                .url("https://example.org/a.jpg")
                .build()));
    }

    @Test
    void missing_storage_reference_is_an_error() {
        RemoteMediaStore store = store(HttpStatus.OK, "{\"mimeType\":\"image/png\"}");

        assertThrows(MediaStoreException.class, () -> store.upload(MediaUploadRequest.builder()
                .url("https://example.org/a.png")
                .build()));
    }

    private RemoteMediaStore store(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, "application/json")
                    .body(body)
                    .build());
        });
        RemoteMediaStore store = new RemoteMediaStore(builder);
        ReflectionTestUtils.setField(store, "mediaStoreUrl", "http://media-store:8086");
        ReflectionTestUtils.setField(store, "timeoutSeconds", 5L);
        return store;
    }
}
