package com.validatorpayments.chain;

/**
 * The queried resource does not exist: a slot with no proposed block, an unknown validator,
 * a transaction without a receipt. Never retried.
 */
public class NotFoundException extends RpcException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
