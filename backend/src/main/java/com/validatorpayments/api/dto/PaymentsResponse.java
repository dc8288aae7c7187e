package com.validatorpayments.api.dto;

import com.validatorpayments.payments.PaymentsReport;
import com.validatorpayments.payments.scan.ScanReport;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * POST /api/v1/payments response. Amounts are whole coins.
 */
public record PaymentsResponse(
        long startSlot,
        long endSlot,
        Map<String, BigDecimal> consensus,
        Map<String, BigDecimal> execution,
        BigDecimal consensusTotal,
        BigDecimal executionTotal,
        List<ValidatorEntry> validators,
        ScanSummary scan
) {

    public static PaymentsResponse from(PaymentsReport report) {
        ScanReport s = report.scan();
        return new PaymentsResponse(
                report.slotRange().startSlot(),
                report.slotRange().endSlot(),
                report.consensusTotalsByAddress(),
                report.executionTotalsByAddress(),
                report.consensusTotal(),
                report.executionTotal(),
                report.validators().stream()
                        .map(v -> new ValidatorEntry(v.index(), v.pubkey(), v.withdrawalAddress(),
                                v.consensusTotal(), v.executionTotal()))
                        .toList(),
                new ScanSummary(s.total(), s.processed(), s.missed(), s.failed(), s.anomaliesAffectingTotals(),
                        s.isComplete()));
    }

    public record ValidatorEntry(long index, String pubkey, String withdrawalAddress,
                                 BigDecimal consensus, BigDecimal execution) {
    }

    /** {@code complete=false} means totals are a lower bound. */
    public record ScanSummary(long totalSlots, long processedSlots, long missedSlots, long failedSlots,
                              long anomalies, boolean complete) {
    }
}
