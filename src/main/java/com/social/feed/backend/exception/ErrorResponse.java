package com.social.feed.backend.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String details
) {
    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
