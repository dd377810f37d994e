package com.social.feed.backend.controller;

import com.social.feed.backend.model.payload.request.CreatePostRequest;
import com.social.feed.backend.model.payload.response.MessageResponse;
import com.social.feed.backend.model.payload.response.PostWithCommentsResponse;
import com.social.feed.backend.service.PostService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/posts")
@Tag(name = "posts")
public class PostController {

    private final PostService postService;

    @Operation(summary = "게시글 작성")
    @PostMapping
    public ResponseEntity<MessageResponse> create(@RequestBody(required = false) CreatePostRequest req) {
        postService.create(req);
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new MessageResponse("Post created successfully"));
    }

    @Operation(summary = "게시글 + 댓글 조회")
    @GetMapping("/{id}")
    public PostWithCommentsResponse get(@PathVariable Long id) {
        return postService.getPostWithComments(id);
    }
}
