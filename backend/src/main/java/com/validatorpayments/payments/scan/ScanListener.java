package com.validatorpayments.payments.scan;

/**
 * Observes a running scan. Called from scanner and worker threads; implementations must be thread-safe
 * and return quickly.
 */
public interface ScanListener {

    void onProgress(long processed, long total);

    void onSlotAnomaly(SlotAnomaly anomaly);
}
