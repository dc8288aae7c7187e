package com.validatorpayments.chain.beacon;

import java.util.Optional;

/**
 * A proposed beacon block. {@code executionPayload} is null for pre-merge blocks.
 */
public record BeaconBlock(long slot, long proposerIndex, ExecutionPayload executionPayload) {

    public Optional<ExecutionPayload> payload() {
        return Optional.ofNullable(executionPayload);
    }
}
