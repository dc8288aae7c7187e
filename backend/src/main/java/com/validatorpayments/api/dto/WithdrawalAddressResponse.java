package com.validatorpayments.api.dto;

import com.validatorpayments.payments.validator.WithdrawalAddressLookup;

/**
 * One entry of GET /api/v1/validators/withdrawal-addresses.
 */
public record WithdrawalAddressResponse(String id, String status, Long index, String withdrawalAddress, String error) {

    public static WithdrawalAddressResponse from(WithdrawalAddressLookup lookup) {
        return new WithdrawalAddressResponse(
                lookup.identifier(),
                lookup.status().name(),
                lookup.index(),
                lookup.withdrawalAddress(),
                lookup.error());
    }
}
