package com.validatorpayments.payments.validator;

/**
 * None of the requested identifiers resolved to a validator; there is nothing to scan.
 */
public class NoValidatorsResolvedException extends RuntimeException {

    public NoValidatorsResolvedException(String message) {
        super(message);
    }
}
