package com.validatorpayments.payments.aggregate;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * One payment to a tracked validator, attributed both to the validator and to the receiving address.
 * Amount is in whole coins; address is lower-cased.
 */
public record Credit(PaymentCategory category, long validatorIndex, String address, BigDecimal amount) {

    public Credit {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Credit amount must not be negative: " + amount);
        }
        address = address.trim().toLowerCase(Locale.ROOT);
    }
}
