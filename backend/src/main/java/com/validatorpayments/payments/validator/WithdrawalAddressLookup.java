package com.validatorpayments.payments.validator;

/**
 * Outcome of looking up one identifier's withdrawal address.
 */
public record WithdrawalAddressLookup(String identifier, Status status, Long index, String withdrawalAddress,
                                      String error) {

    public enum Status {
        SET,
        NOT_SET,
        ERROR
    }

    static WithdrawalAddressLookup of(String identifier, ValidatorRecord record) {
        return record.withdrawalAddress() != null
                ? new WithdrawalAddressLookup(identifier, Status.SET, record.index(), record.withdrawalAddress(), null)
                : new WithdrawalAddressLookup(identifier, Status.NOT_SET, record.index(), null, null);
    }

    static WithdrawalAddressLookup failed(String identifier, String error) {
        return new WithdrawalAddressLookup(identifier, Status.ERROR, null, null, error);
    }
}
