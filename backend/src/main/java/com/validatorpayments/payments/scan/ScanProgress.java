package com.validatorpayments.payments.scan;

/**
 * Slots settled so far out of the total. Only ever advances.
 */
public final class ScanProgress {

    private final long total;
    private long processed;

    public ScanProgress(long total) {
        this.total = total;
    }

    void advance(long settled) {
        if (settled < 0) {
            throw new IllegalArgumentException("settled must not be negative");
        }
        processed = Math.min(total, processed + settled);
    }

    public long getProcessed() {
        return processed;
    }

    public long getTotal() {
        return total;
    }

    public boolean isComplete() {
        return processed >= total;
    }
}
