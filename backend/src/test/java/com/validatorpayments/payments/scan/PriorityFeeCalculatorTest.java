package com.validatorpayments.payments.scan;

import com.validatorpayments.chain.execution.ExecutionTransaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PriorityFeeCalculatorTest {

    @Test
    @DisplayName("EIP-1559: tip capped by maxPriorityFeePerGas")
    void cappedByPriorityFee() {
        ExecutionTransaction tx = new ExecutionTransaction("0x1", wei(2), wei(12), null);

        assertThat(PriorityFeeCalculator.tipPerGas(tx, wei(5))).isEqualTo(wei(2));
    }

    @Test
    @DisplayName("EIP-1559: tip capped by maxFeePerGas minus base fee")
    void cappedByFeeHeadroom() {
        ExecutionTransaction tx = new ExecutionTransaction("0x1", wei(10), wei(8), null);

        assertThat(PriorityFeeCalculator.tipPerGas(tx, wei(5))).isEqualTo(wei(3));
    }

    @Test
    @DisplayName("legacy: gasPrice minus base fee")
    void legacy() {
        ExecutionTransaction tx = new ExecutionTransaction("0x1", null, null, wei(10));

        assertThat(PriorityFeeCalculator.tipPerGas(tx, wei(4))).isEqualTo(wei(6));
    }

    @Test
    @DisplayName("tip below base fee clamped to zero")
    void clampedAtZero() {
        assertThat(PriorityFeeCalculator.tipPerGas(new ExecutionTransaction("0x1", null, null, wei(3)), wei(5)))
                .isEqualTo(BigInteger.ZERO);
        assertThat(PriorityFeeCalculator.tipPerGas(new ExecutionTransaction("0x2", wei(1), wei(4), null), wei(5)))
                .isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("missing base fee treated as zero")
    void nullBaseFee() {
        ExecutionTransaction tx = new ExecutionTransaction("0x1", null, null, wei(7));

        assertThat(PriorityFeeCalculator.tipPerGas(tx, null)).isEqualTo(wei(7));
    }

    private static BigInteger wei(long value) {
        return BigInteger.valueOf(value);
    }
}
