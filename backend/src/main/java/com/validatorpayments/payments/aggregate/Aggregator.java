package com.validatorpayments.payments.aggregate;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Running payment totals for one computation: per address and per validator, for each {@link PaymentCategory}.
 * All methods synchronize on this instance, so concurrent slot workers never lose an update and a
 * {@link #commit(Collection)} is observed whole or not at all.
 */
public class Aggregator {

    private final Map<PaymentCategory, Map<String, BigDecimal>> byAddress = new EnumMap<>(PaymentCategory.class);
    private final Map<Long, ValidatorTotals> byValidator = new HashMap<>();

    public Aggregator() {
        for (PaymentCategory category : PaymentCategory.values()) {
            byAddress.put(category, new HashMap<>());
        }
    }

    public synchronized void credit(String address, PaymentCategory category, BigDecimal amount) {
        requireNonNegative(amount);
        String key = Objects.requireNonNull(address, "address").trim().toLowerCase(Locale.ROOT);
        byAddress.get(category).merge(key, amount, BigDecimal::add);
    }

    public synchronized void creditValidator(long validatorIndex, PaymentCategory category, BigDecimal amount) {
        requireNonNegative(amount);
        ValidatorTotals current = byValidator.getOrDefault(validatorIndex, ValidatorTotals.zero(validatorIndex));
        byValidator.put(validatorIndex, current.plus(category, amount));
    }

    /**
     * Applies every credit of one slot in a single critical section.
     */
    public synchronized void commit(Collection<Credit> credits) {
        for (Credit c : credits) {
            credit(c.address(), c.category(), c.amount());
            creditValidator(c.validatorIndex(), c.category(), c.amount());
        }
    }

    public synchronized SortedMap<String, BigDecimal> totalsByAddress(PaymentCategory category) {
        return Collections.unmodifiableSortedMap(new TreeMap<>(byAddress.get(category)));
    }

    public synchronized SortedMap<Long, ValidatorTotals> totalsByValidator() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(byValidator));
    }

    public synchronized BigDecimal total(PaymentCategory category) {
        return byAddress.get(category).values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static void requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Credit amount must be non-negative: " + amount);
        }
    }
}
