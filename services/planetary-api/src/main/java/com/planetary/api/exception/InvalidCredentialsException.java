package com.planetary.api.exception;

/**
 * Login with an (email, password) pair that matches no user, or password
 * recovery for an unknown email.
 */
public class InvalidCredentialsException extends BusinessException {
    public InvalidCredentialsException(String message) {
        super(ErrorCode.AUTHENTICATION_FAILED, message);
    }
}
