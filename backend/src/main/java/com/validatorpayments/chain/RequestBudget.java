package com.validatorpayments.chain;

import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

/**
 * Local request budget in front of a chain endpoint. Waits for a limiter permit and logs long waits.
 */
@Slf4j
public class RequestBudget {

    private final RateLimiter rateLimiter;
    private final long logThresholdMs;

    public RequestBudget(RateLimiter rateLimiter, long logThresholdMs) {
        this.rateLimiter = rateLimiter;
        this.logThresholdMs = Math.max(1L, logThresholdMs);
    }

    /**
     * Blocks until a permit is granted.
     *
     * @throws RpcException when the limiter times out; retryable like any other transient failure
     */
    public void acquire(String request, String endpoint) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + request + " on " + endpoint);
        }
        if (waitedMs >= logThresholdMs) {
            log.info("Local {} limiter delayed {} ms before {} on {}", rateLimiter.getName(), waitedMs, request, endpoint);
        }
    }
}
