package com.clouddeploy.exception;

/**
 * Authenticated caller lacking the role an operation requires.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
