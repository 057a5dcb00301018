package com.clouddeploy.exception;

/**
 * Exception thrown when a unique name, email or username is already taken.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String resource, String identifier) {
        super(String.format("%s '%s' already exists", resource, identifier));
    }
}
