package com.validatorpayments.payments.scan;

public enum SlotOutcome {
    COMPLETED,
    /** No block for the slot. */
    MISSED,
    /** Retries exhausted; nothing committed. */
    FAILED
}
