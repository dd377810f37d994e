package com.social.feed.backend.model.payload.request;

import lombok.Data;

@Data
public class CreateCommentRequest {
    private Long id;
    private Long postId;   // post_id
    private Long userId;   // user_id
    private String content;
}
