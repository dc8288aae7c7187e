package com.validatorpayments.payments.scan;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Default scan observer: progress at INFO, missed slots at DEBUG, everything that may reduce totals at WARN.
 */
@Slf4j
@Component
public class LoggingScanListener implements ScanListener {

    @Override
    public void onProgress(long processed, long total) {
        double pct = total == 0 ? 100.0 : (processed * 100.0) / total;
        log.info("Progress: processed {} / {} slots ({}%)", processed, total, String.format(Locale.ROOT, "%.2f", pct));
    }

    @Override
    public void onSlotAnomaly(SlotAnomaly anomaly) {
        if (anomaly.affectsTotals()) {
            log.warn("Slot anomaly: {}", anomaly);
        } else {
            log.debug("Slot anomaly: {}", anomaly);
        }
    }
}
