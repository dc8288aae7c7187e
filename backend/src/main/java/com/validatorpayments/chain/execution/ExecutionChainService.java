package com.validatorpayments.chain.execution;

/**
 * Execution-chain queries used for priority-fee accounting. Single attempt per call; callers own retries.
 */
public interface ExecutionChainService {

    /**
     * Block with full transaction objects.
     *
     * @throws com.validatorpayments.chain.NotFoundException when the node has no such block
     */
    ExecutionBlock getBlockByNumber(long blockNumber);

    /**
     * @throws com.validatorpayments.chain.NotFoundException when the node has no receipt for the hash
     */
    TransactionReceipt getTransactionReceipt(String transactionHash);
}
