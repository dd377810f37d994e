package com.social.feed.backend.model.payload.response;

import com.social.feed.backend.model.Post;

public record PostResponse(
        Long id,
        Long userId,
        String content,
        String createdAt
) {
    public static PostResponse from(Post p) {
        return new PostResponse(
                p.getId(),
                p.getUserId(),
                p.getContent(),
                p.getCreatedAt()
        );
    }
}
