package com.validatorpayments.chain.execution;

import com.validatorpayments.chain.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * EVM JSON-RPC client using WebClient. Each call is bounded by the configured timeout.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    private final WebClient webClient;
    private final Duration requestTimeout;

    public WebClientEvmRpcClient(WebClient.Builder builder, Duration requestTimeout) {
        this.webClient = builder.build();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(requestTimeout)
                .onErrorMap(WebClientResponseException.class, e -> new RpcException(method + ": " + e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(method + ": " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new RpcException(method + " timed out after " + requestTimeout.toMillis() + " ms", e));
    }
}
