package com.validatorpayments.chain;

import com.validatorpayments.common.RetryPolicy;

/**
 * Thrown when every attempt allowed by a {@link RetryPolicy} has failed. The cause is the last error.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
        super(buildMessage(operation, attempts, lastError), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    private static String buildMessage(String operation, int attempts, Throwable lastError) {
        String msg = operation + " failed after " + attempts + " attempts";
        if (lastError != null && lastError.getMessage() != null && !lastError.getMessage().isBlank()) {
            msg += ": " + lastError.getMessage();
        }
        return msg;
    }
}
