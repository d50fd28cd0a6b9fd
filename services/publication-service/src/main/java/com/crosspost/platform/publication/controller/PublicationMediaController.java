package com.crosspost.platform.publication.controller;

import com.crosspost.platform.publication.dto.*;
import com.crosspost.platform.publication.service.PublicationMediaService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/publications/{publicationId}/media")
@RequiredArgsConstructor
public class PublicationMediaController {

    private final PublicationMediaService mediaService;

    @PostMapping
    public ResponseEntity<PublicationResponse> append(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @RequestBody List<MediaLinkInput> media
    ) {
        return ResponseEntity.ok(mediaService.appendMedia(publicationId, userId, media));
    }

    @PutMapping
    public ResponseEntity<PublicationResponse> replace(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @RequestBody List<MediaLinkInput> media
    ) {
        return ResponseEntity.ok(mediaService.replaceMedia(publicationId, userId, media));
    }

    @PostMapping("/upload")
    public ResponseEntity<PublicationResponse> upload(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @RequestBody MediaUploadRequest request
    ) {
        return ResponseEntity.ok(mediaService.uploadMedia(publicationId, userId, request));
    }

    @PutMapping("/order")
    public ResponseEntity<PublicationResponse> reorder(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @RequestBody ReorderRequest request
    ) {
        return ResponseEntity.ok(mediaService.reorderMedia(publicationId, userId, request.getIds()));
    }

    @PatchMapping("/links/{linkId}")
    public ResponseEntity<PublicationResponse> updateLink(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @PathVariable UUID linkId,
            @RequestBody UpdateMediaLinkRequest request
    ) {
        return ResponseEntity.ok(mediaService.updateMediaLink(publicationId, userId, linkId, request.getHasSpoiler()));
    }

    @DeleteMapping("/{mediaId}")
    public ResponseEntity<PublicationResponse> remove(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @PathVariable UUID mediaId
    ) {
        return ResponseEntity.ok(mediaService.removeMedia(publicationId, userId, mediaId));
    }
}
