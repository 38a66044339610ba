package com.planetary.api.exception;

import org.springframework.http.HttpStatus;

/**
 * Error categories surfaced by the API, each bound to the HTTP status it
 * maps to and a fallback message used when no specific detail is given.
 */
public enum ErrorCode {
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid request parameters"),
    AUTHENTICATION_FAILED(HttpStatus.UNAUTHORIZED, "Missing or invalid access token"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Requested resource does not exist"),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed"),
    CONFLICT(HttpStatus.CONFLICT, "Resource already exists"),
    DELIVERY_FAILED(HttpStatus.SERVICE_UNAVAILABLE, "Mail could not be delivered"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

    private final HttpStatus httpStatus;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String message) {
        this.httpStatus = httpStatus;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getMessage() {
        return message;
    }
}
