package com.validatorpayments.chain.beacon;

import java.math.BigInteger;

/**
 * One consensus-layer withdrawal from an execution payload. Amount is in gwei.
 */
public record Withdrawal(long index, long validatorIndex, String address, BigInteger amountGwei) {
}
