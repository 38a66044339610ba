package com.planetary.api.exception;

/**
 * A planet looked up by id does not exist. Maps to 404.
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
