package com.validatorpayments.payments.aggregate;

/**
 * Payment categories tracked per address and per validator.
 */
public enum PaymentCategory {
    /** Consensus-layer withdrawals (yield only; full-exit principal stripped). */
    CONSENSUS,
    /** Execution-layer priority fees from blocks the validator proposed. */
    EXECUTION
}
