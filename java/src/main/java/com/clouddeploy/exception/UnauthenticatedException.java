package com.clouddeploy.exception;

/**
 * Missing, invalid or expired credential.
 */
public class UnauthenticatedException extends AuthenticationFailedException {

    public UnauthenticatedException() {
        super("Could not validate credentials");
    }

    public UnauthenticatedException(String message) {
        super(message);
    }
}
