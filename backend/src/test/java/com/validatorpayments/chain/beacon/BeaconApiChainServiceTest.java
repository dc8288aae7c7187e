package com.validatorpayments.chain.beacon;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.validatorpayments.chain.NotFoundException;
import com.validatorpayments.chain.RequestBudget;
import com.validatorpayments.chain.RpcEndpointRotator;
import com.validatorpayments.chain.RpcException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BeaconApiChainServiceTest {

    private static final String NODE = "https://beacon.example";

    @Mock
    private BeaconApiClient apiClient;
    @Mock
    private RateLimiter rateLimiter;

    private BeaconApiChainService service;

    @BeforeEach
    void setUp() {
        when(rateLimiter.acquirePermission()).thenReturn(true);
        service = new BeaconApiChainService(apiClient, new RpcEndpointRotator(List.of(NODE)),
                new RequestBudget(rateLimiter, 10_000), new ObjectMapper(), null);
    }

    @Test
    @DisplayName("genesis time parsed from data.genesis_time")
    void genesis() {
        when(apiClient.get(NODE, "/eth/v1/beacon/genesis")).thenReturn(Mono.just("""
                {"data":{"genesis_time":"1683776400","genesis_validators_root":"0xab","genesis_fork_version":"0x00000369"}}
                """));

        assertThat(service.getGenesis().genesisTimeSeconds()).isEqualTo(1683776400L);
    }

    @Test
    @DisplayName("validator queried at finalized state with index, pubkey and credentials")
    void validator() {
        when(apiClient.get(NODE, "/eth/v1/beacon/states/finalized/validators/7")).thenReturn(Mono.just("""
                {"data":{"index":"7","balance":"32000000000","status":"active_ongoing",
                  "validator":{"pubkey":"0xaa","withdrawal_credentials":"0x010000000000000000000000abcdefabcdefabcdefabcdefabcdefabcdefabcd"}}}
                """));

        BeaconValidator v = service.getValidator("7");

        assertThat(v.index()).isEqualTo(7L);
        assertThat(v.pubkey()).isEqualTo("0xaa");
        assertThat(v.withdrawalCredentials()).startsWith("0x01");
    }

    @Test
    @DisplayName("block parsed with proposer, fee recipient and withdrawals")
    void block() {
        when(apiClient.get(NODE, "/eth/v2/beacon/blocks/100")).thenReturn(Mono.just("""
                {"version":"capella","data":{"message":{"slot":"100","proposer_index":"7","body":{
                  "execution_payload":{"block_number":"5000","fee_recipient":"0xFEE0000000000000000000000000000000000001",
                    "withdrawals":[{"index":"1","validator_index":"7","address":"0xaaaa000000000000000000000000000000000001","amount":"33000000000"},
                                   {"index":"2","validator_index":"8","address":"0xbbbb000000000000000000000000000000000002","amount":"1000"}]}}}}}
                """));

        BeaconBlock block = service.getBlock(100);

        assertThat(block.proposerIndex()).isEqualTo(7L);
        assertThat(block.payload()).isPresent();
        ExecutionPayload payload = block.payload().get();
        assertThat(payload.blockNumber()).isEqualTo(5000L);
        assertThat(payload.withdrawals()).hasSize(2);
        assertThat(payload.withdrawals().get(0).amountGwei()).isEqualTo(new BigInteger("33000000000"));
        assertThat(payload.withdrawals().get(1).validatorIndex()).isEqualTo(8L);
    }

    @Test
    @DisplayName("pre-merge block has no execution payload")
    void blockWithoutPayload() {
        when(apiClient.get(NODE, "/eth/v2/beacon/blocks/3")).thenReturn(Mono.just("""
                {"data":{"message":{"slot":"3","proposer_index":"9","body":{}}}}
                """));

        assertThat(service.getBlock(3).payload()).isEmpty();
    }

    @Test
    @DisplayName("not found from the client propagates as NotFoundException")
    void notFound() {
        when(apiClient.get(eq(NODE), anyString())).thenReturn(Mono.error(new NotFoundException("Not found")));

        assertThatThrownBy(() -> service.getBlock(42)).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("missing proposer index is a retryable RpcException")
    void malformedBlock() {
        when(apiClient.get(NODE, "/eth/v2/beacon/blocks/5")).thenReturn(Mono.just("""
                {"data":{"message":{"body":{}}}}
                """));

        assertThatThrownBy(() -> service.getBlock(5))
                .isInstanceOf(RpcException.class)
                .isNotInstanceOf(NotFoundException.class)
                .hasMessageContaining("proposer_index");
    }

    @Test
    @DisplayName("response without data is a retryable RpcException")
    void missingData() {
        when(apiClient.get(NODE, "/eth/v1/beacon/genesis")).thenReturn(Mono.just("{\"code\":500}"));

        assertThatThrownBy(() -> service.getGenesis()).isInstanceOf(RpcException.class);
    }
}
