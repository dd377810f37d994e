package com.social.feed.backend.exception;

public class ResourceAlreadyInUseException extends RuntimeException {

    public ResourceAlreadyInUseException(String resourceName, Object resourceId) {
        super(resourceName + " already exists. id=" + resourceId);
    }
}
