package com.planetary.api.exception;

/**
 * Bearer token that is malformed, expired or signed with another key.
 */
public class InvalidTokenException extends BusinessException {
    public InvalidTokenException(String message, Throwable cause) {
        super(ErrorCode.AUTHENTICATION_FAILED, message, cause);
    }
}
