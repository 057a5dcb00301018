package com.clouddeploy.exception;

/**
 * Exception thrown for requests that are well-formed but not acceptable,
 * such as exceeding the per-user app limit.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
