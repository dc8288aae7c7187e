package com.validatorpayments.chain.beacon;

/**
 * Beacon-chain queries used by payment scanning. Single attempt per call; callers own retries.
 */
public interface BeaconChainService {

    Genesis getGenesis();

    /**
     * @param identifier decimal validator index or 0x-prefixed BLS public key
     * @throws com.validatorpayments.chain.NotFoundException for unknown identifiers
     */
    BeaconValidator getValidator(String identifier);

    /**
     * @throws com.validatorpayments.chain.NotFoundException when no block was proposed for the slot
     */
    BeaconBlock getBlock(long slot);
}
