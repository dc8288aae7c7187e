package com.validatorpayments.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for chain queries (linear backoff). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "validatorpayments.retry")
@NoArgsConstructor
@Getter
@Setter
public class RetryProperties {

    /** Delay before the first retry; the n-th retry waits n times this. Default 1000. */
    private long baseDelayMs = 1000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0. */
    private double jitterFactor = 0.0;

    /** Total attempts including the initial call. Default 5. */
    private int maxAttempts = 5;
}
