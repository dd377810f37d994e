package com.social.feed.backend.model.payload.response;

import java.util.List;

public record PostWithCommentsResponse(
        PostResponse post,
        List<CommentResponse> comments
) {}
