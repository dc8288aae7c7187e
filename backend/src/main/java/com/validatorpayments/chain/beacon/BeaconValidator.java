package com.validatorpayments.chain.beacon;

/**
 * Validator state from /eth/v1/beacon/states/{state}/validators/{id}. Credentials are 0x-prefixed hex.
 */
public record BeaconValidator(long index, String pubkey, String withdrawalCredentials) {
}
