package com.validatorpayments.payments.validator;

import java.util.Optional;

/**
 * A tracked validator. {@code withdrawalAddress} is lower-case and null unless the credentials name an execution address.
 */
public record ValidatorRecord(long index, String pubkey, String withdrawalAddress) {

    public Optional<String> withdrawalAddressIfSet() {
        return Optional.ofNullable(withdrawalAddress);
    }
}
