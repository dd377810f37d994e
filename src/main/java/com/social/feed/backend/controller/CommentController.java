package com.social.feed.backend.controller;

import com.social.feed.backend.model.payload.request.CreateCommentRequest;
import com.social.feed.backend.model.payload.response.MessageResponse;
import com.social.feed.backend.service.CommentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/comments")
@Tag(name = "comments")
public class CommentController {

    private final CommentService commentService;

    @Operation(summary = "댓글 작성")
    @PostMapping
    public ResponseEntity<MessageResponse> create(@RequestBody(required = false) CreateCommentRequest req) {
        commentService.create(req);
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new MessageResponse("Comment created successfully"));
    }
}
