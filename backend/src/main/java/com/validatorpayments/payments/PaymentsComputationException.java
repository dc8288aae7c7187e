package com.validatorpayments.payments;

/**
 * A payment computation could not start because a chain prerequisite (e.g. genesis time) is unavailable.
 */
public class PaymentsComputationException extends RuntimeException {

    public PaymentsComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
