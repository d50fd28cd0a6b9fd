package com.crosspost.platform.publication.controller;

import com.crosspost.platform.publication.dto.PostResponse;
import com.crosspost.platform.publication.dto.UpdatePostRequest;
import com.crosspost.platform.publication.service.PostService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/posts")
@RequiredArgsConstructor
public class PostController {

    private final PostService postService;

    @GetMapping("/{postId}")
    public ResponseEntity<PostResponse> get(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID postId
    ) {
        return ResponseEntity.ok(postService.getPost(postId, userId));
    }

    @PatchMapping("/{postId}")
    public ResponseEntity<PostResponse> update(
            @RequestHeader("X-User-Id") UUID userId,
            @PathVariable UUID postId,
            @RequestBody UpdatePostRequest request
    ) {
        return ResponseEntity.ok(postService.updatePost(postId, userId, request));
    }
}
