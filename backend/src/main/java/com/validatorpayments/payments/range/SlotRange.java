package com.validatorpayments.payments.range;

/**
 * Inclusive slot interval [startSlot, endSlot].
 */
public record SlotRange(long startSlot, long endSlot) {

    public SlotRange {
        if (startSlot < 0 || startSlot > endSlot) {
            throw new InvalidRangeException("Invalid slot range [" + startSlot + ", " + endSlot + "]");
        }
    }

    public long size() {
        return endSlot - startSlot + 1;
    }
}
