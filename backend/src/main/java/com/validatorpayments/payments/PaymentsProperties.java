package com.validatorpayments.payments;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Chain constants and scan settings for payment computation. Defaults match PulseChain.
 */
@ConfigurationProperties(prefix = "validatorpayments.payments")
@NoArgsConstructor
@Getter
@Setter
public class PaymentsProperties {

    private long secondsPerSlot = 12;

    /** Withdrawal amounts are in gwei: 10^9 per coin. */
    private int consensusUnitDecimals = 9;

    /** Priority fees are in wei: 10^18 per coin. */
    private int executionUnitDecimals = 18;

    /** Withdrawals of at least this many coins are full exits; the principal is stripped before crediting. */
    private BigDecimal maxEffectiveBalance = BigDecimal.valueOf(32);

    /** Withdrawal credential prefixes whose trailing 20 bytes are an execution address. */
    private List<String> executionAddressCredentialPrefixes = new ArrayList<>(List.of("0x01"));

    /** Maximum number of slots in flight at once. */
    private int concurrency = 90;

    /** Minimum wall time between progress observations. */
    private long progressIntervalMs = 4_000;

    public void setExecutionAddressCredentialPrefixes(List<String> prefixes) {
        this.executionAddressCredentialPrefixes = prefixes != null ? prefixes : new ArrayList<>();
    }
}
