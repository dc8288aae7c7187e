package com.validatorpayments.payments.aggregate;

import java.math.BigDecimal;

public record ValidatorTotals(long validatorIndex, BigDecimal consensus, BigDecimal execution) {

    static ValidatorTotals zero(long validatorIndex) {
        return new ValidatorTotals(validatorIndex, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    ValidatorTotals plus(PaymentCategory category, BigDecimal amount) {
        return category == PaymentCategory.CONSENSUS
                ? new ValidatorTotals(validatorIndex, consensus.add(amount), execution)
                : new ValidatorTotals(validatorIndex, consensus, execution.add(amount));
    }

    public BigDecimal get(PaymentCategory category) {
        return category == PaymentCategory.CONSENSUS ? consensus : execution;
    }
}
