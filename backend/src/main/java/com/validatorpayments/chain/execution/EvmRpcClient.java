package com.validatorpayments.chain.execution;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC client abstraction for testing and endpoint rotation.
 * Retries are handled by the caller.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call. Method and params are standard Ethereum JSON-RPC.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getBlockByNumber"
     * @param params      method params
     * @return response body as string (JSON); errors with RpcException on HTTP failure or timeout
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
