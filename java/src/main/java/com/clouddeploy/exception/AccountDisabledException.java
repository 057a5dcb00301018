package com.clouddeploy.exception;

/**
 * Valid credential for an account whose active flag is off.
 */
public class AccountDisabledException extends AuthenticationFailedException {

    public AccountDisabledException() {
        super("User account is disabled");
    }
}
