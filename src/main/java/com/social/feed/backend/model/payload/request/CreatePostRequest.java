package com.social.feed.backend.model.payload.request;

import lombok.Data;

@Data
public class CreatePostRequest {
    private Long id;
    private Long userId;   // user_id
    private String content;
}
