package com.validatorpayments.chain.beacon;

/**
 * Chain genesis as reported by /eth/v1/beacon/genesis.
 */
public record Genesis(long genesisTimeSeconds) {
}
