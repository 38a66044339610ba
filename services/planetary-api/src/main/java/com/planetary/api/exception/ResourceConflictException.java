package com.planetary.api.exception;

/**
 * Duplicate email on registration or duplicate planet name on add.
 */
public class ResourceConflictException extends BusinessException {
    public ResourceConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
