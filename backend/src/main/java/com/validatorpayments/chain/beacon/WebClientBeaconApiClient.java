package com.validatorpayments.chain.beacon;

import com.validatorpayments.chain.NotFoundException;
import com.validatorpayments.chain.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Beacon API client using WebClient. Each request is bounded by the configured timeout.
 * HTTP 404 and 400 (unknown or invalid index) are terminal; everything else is retryable.
 */
public class WebClientBeaconApiClient implements BeaconApiClient {

    private final WebClient webClient;
    private final Duration requestTimeout;

    public WebClientBeaconApiClient(WebClient.Builder builder, Duration requestTimeout) {
        this.webClient = builder.build();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<String> get(String endpointUrl, String path) {
        String uri = endpointUrl + path;
        return webClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .onErrorMap(WebClientResponseException.NotFound.class,
                        e -> new NotFoundException("Not found: GET " + path, e))
                .onErrorMap(WebClientResponseException.BadRequest.class,
                        e -> new NotFoundException("Bad request (unknown id or slot): GET " + path, e))
                .onErrorMap(WebClientResponseException.class,
                        e -> new RpcException("HTTP " + e.getStatusCode().value() + " for GET " + path, e))
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new RpcException("Request timed out after " + requestTimeout.toMillis() + " ms: GET " + path, e));
    }
}
