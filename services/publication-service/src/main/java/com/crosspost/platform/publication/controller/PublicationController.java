package com.crosspost.platform.publication.controller;

import com.crosspost.platform.publication.dto.*;
import com.crosspost.platform.publication.model.PublicationStatus;
import com.crosspost.platform.publication.service.BulkOperationService;
import com.crosspost.platform.publication.service.PublicationLifecycleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/publications")
@RequiredArgsConstructor
public class PublicationController {

    private final PublicationLifecycleService lifecycleService;
    private final BulkOperationService bulkOperationService;

    @PostMapping
    public ResponseEntity<PublicationResponse> create(
            @RequestHeader("X-User-Id") UUID userId,
            @RequestBody CreatePublicationRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(lifecycleService.create(userId, request));
    }

    @GetMapping
    public ResponseEntity<PublicationPageResponse> list(
            @RequestHeader("X-User-Id") UUID userId,
            @RequestParam UUID projectId,
            @RequestParam(required = false) PublicationStatus status,
            @RequestParam(defaultValue = "false") boolean includeArchived,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(lifecycleService.list(projectId, userId, status, includeArchived, page, size));
    }

    @GetMapping("/{publicationId}")
    public ResponseEntity<PublicationResponse> get(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId
    ) {
        return ResponseEntity.ok(lifecycleService.get(publicationId, userId));
    }

    @PatchMapping("/{publicationId}")
    public ResponseEntity<PublicationResponse> update(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @RequestBody UpdatePublicationRequest request
    ) {
        return ResponseEntity.ok(lifecycleService.update(publicationId, userId, request));
    }

    @PostMapping("/{publicationId}/schedule")
    public ResponseEntity<PublicationResponse> schedule(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @RequestBody ScheduleRequest request
    ) {
        return ResponseEntity.ok(lifecycleService.schedule(publicationId, userId, request.getScheduledAt()));
    }

    @PostMapping("/{publicationId}/status")
    public ResponseEntity<PublicationResponse> changeStatus(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @RequestBody StatusChangeRequest request
    ) {
        return ResponseEntity.ok(lifecycleService.changeStatus(publicationId, userId, request.getStatus()));
    }

    @DeleteMapping("/{publicationId}")
    public ResponseEntity<Void> delete(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId
    ) {
        lifecycleService.delete(publicationId, userId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{publicationId}/archive")
    public ResponseEntity<PublicationResponse> archive(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId
    ) {
        return ResponseEntity.ok(lifecycleService.archive(publicationId, userId));
    }

    @DeleteMapping("/{publicationId}/archive")
    public ResponseEntity<PublicationResponse> unarchive(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId
    ) {
        return ResponseEntity.ok(lifecycleService.unarchive(publicationId, userId));
    }

    @PostMapping("/{publicationId}/posts")
    public ResponseEntity<List<PostResponse>> createPosts(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @RequestBody CreatePostsRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(lifecycleService.createPosts(publicationId, userId, request));
    }

    @PostMapping("/bulk")
    public ResponseEntity<BulkOperationResult> bulk(
            @RequestHeader("X-User-Id") UUID userId,
            @RequestBody BulkOperationRequest request
    ) {
        return ResponseEntity.ok(bulkOperationService.apply(userId, request));
    }
}
