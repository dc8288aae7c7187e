package com.validatorpayments.chain.execution;

import java.math.BigInteger;

/**
 * Fee fields of a transaction from eth_getBlockByNumber(n, true), in wei per gas.
 * EIP-1559 transactions carry both fee caps; legacy transactions carry only {@code gasPrice}.
 */
public record ExecutionTransaction(String hash, BigInteger maxPriorityFeePerGas, BigInteger maxFeePerGas,
                                   BigInteger gasPrice) {

    public boolean hasFeeCaps() {
        return maxPriorityFeePerGas != null && maxFeePerGas != null;
    }
}
