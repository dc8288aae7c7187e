package com.validatorpayments.chain.beacon;

import reactor.core.publisher.Mono;

/**
 * Beacon node REST API client abstraction for testing and endpoint rotation.
 */
public interface BeaconApiClient {

    /**
     * Perform a single GET against the beacon API.
     *
     * @param endpointUrl beacon API base URL
     * @param path        e.g. "/eth/v1/beacon/genesis"
     * @return response body as string (JSON); errors with NotFoundException on HTTP 404, RpcException otherwise
     */
    Mono<String> get(String endpointUrl, String path);
}
