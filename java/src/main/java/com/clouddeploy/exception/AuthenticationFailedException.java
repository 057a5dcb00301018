package com.clouddeploy.exception;

/**
 * Base class for failures to resolve a caller from a credential.
 */
public abstract class AuthenticationFailedException extends RuntimeException {

    protected AuthenticationFailedException(String message) {
        super(message);
    }
}
