package com.social.feed.backend.model.payload.response;

public record MessageResponse(String message) {}
