package com.validatorpayments.chain.beacon;

import java.util.List;

/**
 * The parts of a block's execution payload used for payment accounting.
 */
public record ExecutionPayload(long blockNumber, String feeRecipient, List<Withdrawal> withdrawals) {

    public ExecutionPayload {
        withdrawals = withdrawals != null ? List.copyOf(withdrawals) : List.of();
    }
}
