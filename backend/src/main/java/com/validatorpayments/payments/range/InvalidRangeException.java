package com.validatorpayments.payments.range;

/**
 * The requested date interval cannot be turned into a non-empty slot range.
 */
public class InvalidRangeException extends RuntimeException {

    public InvalidRangeException(String message) {
        super(message);
    }

    public InvalidRangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
