package com.validatorpayments.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Beacon and execution endpoints, per-request timeout and local request budgets. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "validatorpayments.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    private Endpoints beacon = new Endpoints(new ArrayList<>(List.of("https://rpc-pulsechain.g4mm4.io/beacon-api")));

    private Endpoints execution = new Endpoints(new ArrayList<>(List.of("https://rpc-pulsechain.g4mm4.io")));

    /** Validator state queried for identifier resolution. */
    private String stateId = "finalized";

    /** Upper bound for one HTTP request; a timeout is retried like any transient failure. */
    private long requestTimeoutMs = 30_000;

    /** Request budget per service (beacon, execution) for this instance. */
    private int maxRequestsPerSecond = 300;

    /** How long a request may wait for a local limiter permit before failing. */
    private long localLimiterTimeoutMs = 30_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;

    public void setBeacon(Endpoints beacon) {
        this.beacon = beacon != null ? beacon : new Endpoints();
    }

    public void setExecution(Endpoints execution) {
        this.execution = execution != null ? execution : new Endpoints();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Endpoints {

        private List<String> urls = new ArrayList<>();

        Endpoints(List<String> urls) {
            this.urls = urls;
        }

        public void setUrls(List<String> urls) {
            this.urls = urls != null ? urls : new ArrayList<>();
        }
    }
}
