package com.validatorpayments.chain.beacon;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.validatorpayments.chain.RequestBudget;
import com.validatorpayments.chain.RpcEndpointRotator;
import com.validatorpayments.chain.RpcException;
import com.validatorpayments.config.CaffeineConfig;
import org.springframework.cache.annotation.Cacheable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Beacon node REST adapter: genesis, validator state and proposed blocks.
 * Payloads missing fields that should be present are reported as {@link RpcException} so the caller retries.
 */
public class BeaconApiChainService implements BeaconChainService {

    static final String GENESIS_PATH = "/eth/v1/beacon/genesis";
    static final String VALIDATOR_PATH = "/eth/v1/beacon/states/%s/validators/%s";
    static final String BLOCK_PATH = "/eth/v2/beacon/blocks/%d";

    private final BeaconApiClient apiClient;
    private final RpcEndpointRotator rotator;
    private final RequestBudget requestBudget;
    private final ObjectMapper objectMapper;
    private final String stateId;

    public BeaconApiChainService(BeaconApiClient apiClient, RpcEndpointRotator rotator, RequestBudget requestBudget,
                                 ObjectMapper objectMapper, String stateId) {
        this.apiClient = apiClient;
        this.rotator = rotator;
        this.requestBudget = requestBudget;
        this.objectMapper = objectMapper;
        this.stateId = stateId != null && !stateId.isBlank() ? stateId : "finalized";
    }

    @Override
    @Cacheable(CaffeineConfig.GENESIS_CACHE)
    public Genesis getGenesis() {
        JsonNode data = fetchData(GENESIS_PATH);
        return new Genesis(parseLong(data, "genesis_time", "genesis"));
    }

    @Override
    public BeaconValidator getValidator(String identifier) {
        JsonNode data = fetchData(VALIDATOR_PATH.formatted(stateId, identifier));
        JsonNode validator = data.path("validator");
        String context = "validator " + identifier;
        return new BeaconValidator(
                parseLong(data, "index", context),
                requireText(validator, "pubkey", context),
                requireText(validator, "withdrawal_credentials", context));
    }

    @Override
    public BeaconBlock getBlock(long slot) {
        JsonNode message = fetchData(BLOCK_PATH.formatted(slot)).path("message");
        String context = "block at slot " + slot;
        long proposerIndex = parseLong(message, "proposer_index", context);
        JsonNode payload = message.path("body").path("execution_payload");
        if (payload.isMissingNode() || payload.isNull()) {
            return new BeaconBlock(slot, proposerIndex, null);
        }
        return new BeaconBlock(slot, proposerIndex, parsePayload(payload, context));
    }

    private ExecutionPayload parsePayload(JsonNode payload, String context) {
        List<Withdrawal> withdrawals = new ArrayList<>();
        JsonNode wds = payload.path("withdrawals");
        if (wds.isArray()) {
            for (JsonNode wd : wds) {
                withdrawals.add(new Withdrawal(
                        wd.path("index").asLong(0),
                        parseLong(wd, "validator_index", context),
                        requireText(wd, "address", context),
                        parseBigInteger(wd, "amount", context)));
            }
        }
        return new ExecutionPayload(
                parseLong(payload, "block_number", context),
                requireText(payload, "fee_recipient", context),
                withdrawals);
    }

    private JsonNode fetchData(String path) {
        String endpoint = rotator.getNextEndpoint();
        requestBudget.acquire("GET " + path, endpoint);
        String json = apiClient.get(endpoint, path).block();
        if (json == null || json.isBlank()) {
            throw new RpcException("Empty response for GET " + path);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse response for GET " + path, e);
        }
        JsonNode data = root.path("data");
        if (data.isMissingNode() || data.isNull()) {
            throw new RpcException("Response for GET " + path + " has no data");
        }
        return data;
    }

    private static String requireText(JsonNode node, String field, String context) {
        String value = node.path(field).asText(null);
        if (value == null || value.isBlank()) {
            throw new RpcException("Malformed " + context + ": missing " + field);
        }
        return value;
    }

    private static long parseLong(JsonNode node, String field, String context) {
        String value = requireText(node, field, context);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new RpcException("Malformed " + context + ": " + field + "=" + value, e);
        }
    }

    private static BigInteger parseBigInteger(JsonNode node, String field, String context) {
        String value = requireText(node, field, context);
        try {
            return new BigInteger(value);
        } catch (NumberFormatException e) {
            throw new RpcException("Malformed " + context + ": " + field + "=" + value, e);
        }
    }
}
