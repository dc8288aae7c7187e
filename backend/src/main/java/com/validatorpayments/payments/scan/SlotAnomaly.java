package com.validatorpayments.payments.scan;

/**
 * A slot whose payments may be missing or incomplete. Reported to {@link ScanListener}, never thrown.
 */
public record SlotAnomaly(long slot, Kind kind, String detail) {

    public enum Kind {
        /** No block was proposed for the slot. Normal. */
        NO_BLOCK,
        /** A tracked validator proposed a block without an execution payload; no fee credit was recorded. */
        MISSING_EXECUTION_PAYLOAD,
        /** The execution node has no block for the payload's block number. */
        EXECUTION_BLOCK_NOT_FOUND,
        /** A transaction had no receipt; its tip counts as zero. */
        RECEIPT_NOT_FOUND,
        /** Every attempt failed; the slot contributes nothing. */
        RETRIES_EXHAUSTED
    }

    /** True when totals may be a lower bound because of this anomaly. */
    public boolean affectsTotals() {
        return kind != Kind.NO_BLOCK;
    }

    @Override
    public String toString() {
        return "slot " + slot + " " + kind + (detail != null ? ": " + detail : "");
    }
}
