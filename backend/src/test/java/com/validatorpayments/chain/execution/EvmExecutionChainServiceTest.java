package com.validatorpayments.chain.execution;

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
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvmExecutionChainServiceTest {

    private static final String NODE = "https://rpc.example";

    @Mock
    private EvmRpcClient rpcClient;
    @Mock
    private RateLimiter rateLimiter;

    private EvmExecutionChainService service;

    @BeforeEach
    void setUp() {
        when(rateLimiter.acquirePermission()).thenReturn(true);
        service = new EvmExecutionChainService(rpcClient, new RpcEndpointRotator(List.of(NODE)),
                new RequestBudget(rateLimiter, 10_000), new ObjectMapper());
    }

    @Test
    @DisplayName("block fetched with full transactions and fee fields decoded from hex")
    void blockByNumber() {
        when(rpcClient.call(NODE, "eth_getBlockByNumber", List.of("0x1388", true))).thenReturn(Mono.just("""
                {"jsonrpc":"2.0","id":1,"result":{"number":"0x1388","baseFeePerGas":"0x5",
                  "transactions":[
                    {"hash":"0xt1","type":"0x2","maxPriorityFeePerGas":"0x2","maxFeePerGas":"0xc"},
                    {"hash":"0xt2","type":"0x0","gasPrice":"0xa"}]}}
                """));

        ExecutionBlock block = service.getBlockByNumber(5000);

        assertThat(block.baseFeePerGas()).isEqualTo(BigInteger.valueOf(5));
        assertThat(block.transactions()).hasSize(2);
        ExecutionTransaction t1 = block.transactions().get(0);
        assertThat(t1.hasFeeCaps()).isTrue();
        assertThat(t1.maxFeePerGas()).isEqualTo(BigInteger.valueOf(12));
        ExecutionTransaction t2 = block.transactions().get(1);
        assertThat(t2.hasFeeCaps()).isFalse();
        assertThat(t2.gasPrice()).isEqualTo(BigInteger.TEN);
    }

    @Test
    @DisplayName("receipt gasUsed decoded")
    void receipt() {
        when(rpcClient.call(NODE, "eth_getTransactionReceipt", Collections.singletonList("0xt1"))).thenReturn(Mono.just("""
                {"jsonrpc":"2.0","id":1,"result":{"transactionHash":"0xt1","gasUsed":"0x3e8","status":"0x1"}}
                """));

        assertThat(service.getTransactionReceipt("0xt1").gasUsed()).isEqualTo(BigInteger.valueOf(1000));
    }

    @Test
    @DisplayName("null result maps to NotFoundException")
    void nullResult() {
        when(rpcClient.call(eq(NODE), eq("eth_getTransactionReceipt"), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}"));

        assertThatThrownBy(() -> service.getTransactionReceipt("0xmissing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("JSON-RPC error object maps to retryable RpcException")
    void rpcError() {
        when(rpcClient.call(eq(NODE), eq("eth_getBlockByNumber"), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32005,\"message\":\"rate limited\"}}"));

        assertThatThrownBy(() -> service.getBlockByNumber(1))
                .isInstanceOf(RpcException.class)
                .isNotInstanceOf(NotFoundException.class)
                .hasMessageContaining("rate limited");
    }

    @Test
    @DisplayName("hash-only transaction list is rejected")
    void hashOnlyTransactions() {
        when(rpcClient.call(eq(NODE), eq("eth_getBlockByNumber"), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"baseFeePerGas\":\"0x1\",\"transactions\":[\"0xt1\"]}}"));

        assertThatThrownBy(() -> service.getBlockByNumber(1)).isInstanceOf(RpcException.class);
    }
}
