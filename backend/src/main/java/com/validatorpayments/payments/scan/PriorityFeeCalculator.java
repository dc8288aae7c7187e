package com.validatorpayments.payments.scan;

import com.validatorpayments.chain.execution.ExecutionTransaction;

import java.math.BigInteger;

/**
 * Effective priority fee (tip) per gas paid to the block proposer, in wei.
 * EIP-1559: min(maxPriorityFeePerGas, maxFeePerGas - baseFee). Legacy: gasPrice - baseFee.
 * Never negative.
 */
public final class PriorityFeeCalculator {

    private PriorityFeeCalculator() {
    }

    public static BigInteger tipPerGas(ExecutionTransaction tx, BigInteger baseFeePerGas) {
        BigInteger baseFee = baseFeePerGas != null ? baseFeePerGas : BigInteger.ZERO;
        BigInteger tip;
        if (tx.hasFeeCaps()) {
            tip = tx.maxPriorityFeePerGas().min(tx.maxFeePerGas().subtract(baseFee));
        } else if (tx.gasPrice() != null) {
            tip = tx.gasPrice().subtract(baseFee);
        } else {
            tip = BigInteger.ZERO;
        }
        return tip.signum() > 0 ? tip : BigInteger.ZERO;
    }
}
