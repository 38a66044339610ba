package com.planetary.api.exception;

import com.planetary.api.dto.MessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Converts every failure into a {@code {"message": ...}} body with the status
 * of its error category. Nothing is retried.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<MessageResponse> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode == ErrorCode.DELIVERY_FAILED) {
            log.error("Business exception occurred: code={}, message={}", errorCode, e.getMessage(), e);
        } else {
            log.warn("Business exception occurred: code={}, message={}", errorCode, e.getMessage());
        }
        return respond(errorCode, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<MessageResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Parameter type mismatch: name={}, value={}", e.getName(), e.getValue());
        return respond(ErrorCode.INVALID_INPUT,
                String.format("Parameter '%s' has an invalid value: %s", e.getName(), e.getValue()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<MessageResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing parameter: {}", e.getParameterName());
        return respond(ErrorCode.INVALID_INPUT, "Missing required parameter: " + e.getParameterName());
    }

    @ExceptionHandler(BindException.class)
    public ResponseEntity<MessageResponse> handleBindException(BindException e) {
        log.warn("Validation failed: {}", e.getMessage());
        String message = ErrorCode.INVALID_INPUT.getMessage();
        if (e.getBindingResult().getFieldError() != null) {
            message = e.getBindingResult().getFieldError().getField() + ": "
                    + e.getBindingResult().getFieldError().getDefaultMessage();
        }
        return respond(ErrorCode.INVALID_INPUT, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<MessageResponse> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(ErrorCode.INVALID_INPUT, "Malformed request body");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<MessageResponse> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException e) {
        log.warn("Unsupported content type: {}", e.getContentType());
        return respond(ErrorCode.INVALID_INPUT, "Unsupported content type: " + e.getContentType());
    }

    // Unique constraint hit after a lost check-then-insert race
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<MessageResponse> handleDataIntegrityViolation(DataIntegrityViolationException e) {
        log.warn("Store constraint violation: {}", e.getMostSpecificCause().getMessage());
        return respond(ErrorCode.CONFLICT, ErrorCode.CONFLICT.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<MessageResponse> handleNoResourceFound(NoResourceFoundException e) {
        log.warn("Resource not found: {}", e.getResourcePath());
        return respond(ErrorCode.NOT_FOUND, "No endpoint at /" + e.getResourcePath());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<MessageResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        log.warn("Method not supported: {}", e.getMethod());
        return respond(ErrorCode.METHOD_NOT_ALLOWED, "Method not allowed: " + e.getMethod());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<MessageResponse> handleException(Exception e) {
        log.error("Unexpected exception occurred", e);
        return respond(ErrorCode.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
    }

    private ResponseEntity<MessageResponse> respond(ErrorCode errorCode, String message) {
        return ResponseEntity.status(errorCode.getHttpStatus()).body(new MessageResponse(message));
    }
}
