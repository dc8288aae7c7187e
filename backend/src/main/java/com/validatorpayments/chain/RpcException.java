package com.validatorpayments.chain;

/**
 * Thrown when a chain query fails (HTTP, timeout, JSON-RPC error or undecodable payload). Retryable.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
