package com.validatorpayments.chain.execution;

import java.math.BigInteger;
import java.util.List;

/**
 * Execution block with full transactions. {@code baseFeePerGas} is zero before London.
 */
public record ExecutionBlock(long number, BigInteger baseFeePerGas, List<ExecutionTransaction> transactions) {

    public ExecutionBlock {
        baseFeePerGas = baseFeePerGas != null ? baseFeePerGas : BigInteger.ZERO;
        transactions = transactions != null ? List.copyOf(transactions) : List.of();
    }
}
