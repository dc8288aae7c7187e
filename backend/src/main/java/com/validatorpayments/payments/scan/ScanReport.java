package com.validatorpayments.payments.scan;

/**
 * Completion counters of one scan. When {@code failed > 0} or {@code anomaliesAffectingTotals > 0}
 * the totals are a lower bound.
 */
public record ScanReport(long total, long processed, long completed, long missed, long failed,
                         long anomaliesAffectingTotals) {

    public boolean isComplete() {
        return failed == 0 && anomaliesAffectingTotals == 0;
    }
}
