package com.clouddeploy.exception;

/**
 * Exception thrown when a resource does not exist or belongs to another user.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource) {
        super(resource + " not found");
    }

    public ResourceNotFoundException(String resource, Object identifier) {
        super(String.format("%s '%s' not found", resource, identifier));
    }
}
