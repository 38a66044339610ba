package com.planetary.api.exception;

/**
 * The mail transport refused or failed to send a message.
 */
public class MailDeliveryException extends BusinessException {
    public MailDeliveryException(String message, Throwable cause) {
        super(ErrorCode.DELIVERY_FAILED, message, cause);
    }
}
