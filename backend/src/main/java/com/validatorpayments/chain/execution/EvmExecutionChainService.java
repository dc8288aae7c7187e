package com.validatorpayments.chain.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.validatorpayments.chain.NotFoundException;
import com.validatorpayments.chain.RequestBudget;
import com.validatorpayments.chain.RpcEndpointRotator;
import com.validatorpayments.chain.RpcException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JSON-RPC adapter for eth_getBlockByNumber and eth_getTransactionReceipt.
 * A {@code null} result means the node does not know the object and maps to {@link NotFoundException}.
 */
public class EvmExecutionChainService implements ExecutionChainService {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RequestBudget requestBudget;
    private final ObjectMapper objectMapper;

    public EvmExecutionChainService(EvmRpcClient rpcClient, RpcEndpointRotator rotator, RequestBudget requestBudget,
                                    ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.requestBudget = requestBudget;
        this.objectMapper = objectMapper;
    }

    @Override
    public ExecutionBlock getBlockByNumber(long blockNumber) {
        String blockTag = "0x" + Long.toHexString(blockNumber);
        JsonNode result = callRpc("eth_getBlockByNumber", List.of(blockTag, true), "block " + blockNumber);
        List<ExecutionTransaction> transactions = new ArrayList<>();
        JsonNode txs = result.path("transactions");
        if (txs.isArray()) {
            for (JsonNode tx : txs) {
                if (!tx.isObject()) {
                    throw new RpcException("eth_getBlockByNumber returned transaction hashes only for block " + blockNumber);
                }
                String hash = tx.path("hash").asText(null);
                if (hash == null || hash.isBlank()) {
                    throw new RpcException("Malformed transaction in block " + blockNumber + ": missing hash");
                }
                transactions.add(new ExecutionTransaction(
                        hash,
                        parseQuantity(tx, "maxPriorityFeePerGas"),
                        parseQuantity(tx, "maxFeePerGas"),
                        parseQuantity(tx, "gasPrice")));
            }
        }
        return new ExecutionBlock(blockNumber, parseQuantity(result, "baseFeePerGas"), transactions);
    }

    @Override
    public TransactionReceipt getTransactionReceipt(String transactionHash) {
        JsonNode result = callRpc("eth_getTransactionReceipt", Collections.singletonList(transactionHash),
                "receipt " + transactionHash);
        BigInteger gasUsed = parseQuantity(result, "gasUsed");
        if (gasUsed == null) {
            throw new RpcException("Malformed receipt " + transactionHash + ": missing gasUsed");
        }
        return new TransactionReceipt(transactionHash, gasUsed);
    }

    private JsonNode callRpc(String method, Object params, String subject) {
        String endpoint = rotator.getNextEndpoint();
        requestBudget.acquire(method, endpoint);
        String json = rpcClient.call(endpoint, method, params).block();
        if (json == null) {
            throw new RpcException(method + " returned null for " + subject);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response for " + subject, e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error for " + subject + ": " + error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode() || result.isNull()) {
            throw new NotFoundException(method + " has no result for " + subject);
        }
        return result;
    }

    /**
     * Hex quantity ("0x1a") to BigInteger; null when the field is absent.
     */
    static BigInteger parseQuantity(JsonNode node, String field) {
        String value = node.path(field).asText(null);
        if (value == null || value.isBlank()) {
            return null;
        }
        String hex = value.startsWith("0x") || value.startsWith("0X") ? value.substring(2) : value;
        if (hex.isEmpty()) {
            return BigInteger.ZERO;
        }
        try {
            return new BigInteger(hex, 16);
        } catch (NumberFormatException e) {
            throw new RpcException("Invalid hex quantity " + field + "=" + value, e);
        }
    }
}
