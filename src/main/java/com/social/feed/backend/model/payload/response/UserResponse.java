package com.social.feed.backend.model.payload.response;

import com.social.feed.backend.model.User;

public record UserResponse(
        Long id,
        String name
) {
    public static UserResponse from(User u) {
        return new UserResponse(u.getId(), u.getName());
    }
}
