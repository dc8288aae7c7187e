package com.validatorpayments.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.validatorpayments.chain.RequestBudget;
import com.validatorpayments.chain.RpcEndpointRotator;
import com.validatorpayments.chain.beacon.BeaconApiChainService;
import com.validatorpayments.chain.beacon.BeaconApiClient;
import com.validatorpayments.chain.beacon.BeaconChainService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        GenesisCacheConfigTest.BeaconServiceConfig.class
})
class GenesisCacheConfigTest {

    private static final String NODE = "https://beacon.example";

    @Autowired
    CacheManager cacheManager;

    @Autowired
    BeaconChainService beaconChainService;

    @MockBean
    BeaconApiClient beaconApiClient;

    @Test
    @DisplayName("genesis cache is created and genesis fetched once")
    void genesisCached() {
        when(beaconApiClient.get(NODE, "/eth/v1/beacon/genesis"))
                .thenReturn(Mono.just("{\"data\":{\"genesis_time\":\"1683776400\"}}"));

        assertThat(cacheManager.getCache(CaffeineConfig.GENESIS_CACHE)).isNotNull();
        assertThat(beaconChainService.getGenesis().genesisTimeSeconds()).isEqualTo(1683776400L);
        assertThat(beaconChainService.getGenesis().genesisTimeSeconds()).isEqualTo(1683776400L);
        verify(beaconApiClient, times(1)).get(NODE, "/eth/v1/beacon/genesis");
    }

    @TestConfiguration
    static class BeaconServiceConfig {

        @Bean
        BeaconChainService beaconChainService(BeaconApiClient beaconApiClient) {
            RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.ofDefaults());
            return new BeaconApiChainService(beaconApiClient, new RpcEndpointRotator(List.of(NODE)),
                    new RequestBudget(limiter, 100), new ObjectMapper(), "finalized");
        }
    }
}
