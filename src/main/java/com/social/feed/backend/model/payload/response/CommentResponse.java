package com.social.feed.backend.model.payload.response;

import com.social.feed.backend.model.Comment;

public record CommentResponse(
        Long id,
        Long postId,
        Long userId,
        String content,
        String createdAt
) {
    public static CommentResponse from(Comment c) {
        return new CommentResponse(
                c.getId(),
                c.getPostId(),
                c.getUserId(),
                c.getContent(),
                c.getCreatedAt()
        );
    }
}
