package com.validatorpayments.payments;

import com.validatorpayments.payments.range.SlotRange;
import com.validatorpayments.payments.scan.ScanReport;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.SortedMap;

/**
 * Result of {@link ValidatorPaymentsService#computePayments}: totals in whole coins by receiving address
 * and by validator, plus scan completeness.
 */
public record PaymentsReport(
        Instant start,
        Instant end,
        SlotRange slotRange,
        SortedMap<String, BigDecimal> consensusTotalsByAddress,
        SortedMap<String, BigDecimal> executionTotalsByAddress,
        List<ValidatorPayments> validators,
        ScanReport scan
) {

    public BigDecimal consensusTotal() {
        return sum(consensusTotalsByAddress);
    }

    public BigDecimal executionTotal() {
        return sum(executionTotalsByAddress);
    }

    private static BigDecimal sum(SortedMap<String, BigDecimal> totals) {
        return totals.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Per-validator totals. {@code withdrawalAddress} is null when the credentials do not name an address.
     */
    public record ValidatorPayments(long index, String pubkey, String withdrawalAddress,
                                    BigDecimal consensusTotal, BigDecimal executionTotal) {
    }
}
