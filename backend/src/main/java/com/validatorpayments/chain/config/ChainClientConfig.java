package com.validatorpayments.chain.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.validatorpayments.chain.RequestBudget;
import com.validatorpayments.chain.RetryingOperation;
import com.validatorpayments.chain.RpcEndpointRotator;
import com.validatorpayments.chain.beacon.BeaconApiChainService;
import com.validatorpayments.chain.beacon.BeaconApiClient;
import com.validatorpayments.chain.beacon.BeaconChainService;
import com.validatorpayments.chain.beacon.WebClientBeaconApiClient;
import com.validatorpayments.chain.execution.EvmExecutionChainService;
import com.validatorpayments.chain.execution.EvmRpcClient;
import com.validatorpayments.chain.execution.ExecutionChainService;
import com.validatorpayments.chain.execution.WebClientEvmRpcClient;
import com.validatorpayments.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the beacon and execution query services: clients, endpoint rotators, request budgets and the retry policy.
 */
@Configuration
@EnableConfigurationProperties({ ChainProperties.class, RetryProperties.class })
public class ChainClientConfig {

    /** Beacon block and receipt payloads for busy blocks exceed WebClient's 256 KiB default. */
    private static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    @Bean
    public RetryingOperation retryingOperation(RetryProperties retryProperties) {
        return new RetryingOperation(new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts()));
    }

    @Bean
    public BeaconApiClient beaconApiClient(WebClient.Builder webClientBuilder, ChainProperties properties) {
        return new WebClientBeaconApiClient(withLargeBuffers(webClientBuilder), Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, ChainProperties properties) {
        return new WebClientEvmRpcClient(withLargeBuffers(webClientBuilder), Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean
    public BeaconChainService beaconChainService(BeaconApiClient beaconApiClient, ChainProperties properties,
                                                 ObjectMapper objectMapper) {
        return new BeaconApiChainService(
                beaconApiClient,
                new RpcEndpointRotator(properties.getBeacon().getUrls()),
                requestBudget("beacon-api", properties),
                objectMapper,
                properties.getStateId());
    }

    @Bean
    public ExecutionChainService executionChainService(EvmRpcClient evmRpcClient, ChainProperties properties,
                                                       ObjectMapper objectMapper) {
        return new EvmExecutionChainService(
                evmRpcClient,
                new RpcEndpointRotator(properties.getExecution().getUrls()),
                requestBudget("evm-rpc", properties),
                objectMapper);
    }

    private static RequestBudget requestBudget(String name, ChainProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return new RequestBudget(RateLimiter.of(name, config), properties.getLocalLimiterLogThresholdMs());
    }

    private static WebClient.Builder withLargeBuffers(WebClient.Builder builder) {
        return builder.clone().codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES));
    }
}
