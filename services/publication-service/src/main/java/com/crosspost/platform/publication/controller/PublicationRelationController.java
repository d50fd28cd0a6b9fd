package com.crosspost.platform.publication.controller;

import com.crosspost.platform.publication.dto.*;
import com.crosspost.platform.publication.service.PublicationLifecycleService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class PublicationRelationController {

    private final PublicationLifecycleService lifecycleService;

    @GetMapping("/publications/{publicationId}/relations")
    public ResponseEntity<List<RelationGroupResponse>> relations(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId
    ) {
        return ResponseEntity.ok(lifecycleService.relations(publicationId, userId));
    }

    @PostMapping("/publications/{publicationId}/relations")
    public ResponseEntity<RelationGroupResponse> link(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @RequestBody LinkPublicationRequest request
    ) {
        return ResponseEntity.ok(lifecycleService.link(publicationId, userId, request));
    }

    @DeleteMapping("/publications/{publicationId}/relations/{groupId}")
    public ResponseEntity<Void> unlink(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @PathVariable UUID groupId
    ) {
        lifecycleService.unlink(publicationId, userId, groupId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/publications/{publicationId}/related")
    public ResponseEntity<PublicationResponse> createRelated(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID publicationId,
            @RequestBody CreateRelatedRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(lifecycleService.createRelated(publicationId, userId, request));
    }

    @PutMapping("/relation-groups/{groupId}/order")
    public ResponseEntity<RelationGroupResponse> reorder(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID groupId,
            @RequestBody ReorderRequest request
    ) {
        return ResponseEntity.ok(lifecycleService.reorderGroup(groupId, userId, request.getIds()));
    }
}
