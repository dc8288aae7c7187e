package com.validatorpayments.payments.scan;

import com.validatorpayments.payments.aggregate.Credit;

import java.util.List;

/**
 * Everything one slot adds to the totals, computed without touching shared state.
 * The scanner commits it only after the whole slot succeeded, so a retried slot is never counted twice.
 */
public record SlotContribution(long slot, boolean blockProposed, List<Credit> credits, List<SlotAnomaly> anomalies) {

    public SlotContribution {
        credits = List.copyOf(credits);
        anomalies = List.copyOf(anomalies);
    }

    public static SlotContribution noBlock(long slot, String detail) {
        return new SlotContribution(slot, false, List.of(),
                List.of(new SlotAnomaly(slot, SlotAnomaly.Kind.NO_BLOCK, detail)));
    }
}
