package com.social.feed.backend.model.payload.request;

import lombok.Data;

@Data
public class CreateUserRequest {
    private Long id;
    private String name;
}
