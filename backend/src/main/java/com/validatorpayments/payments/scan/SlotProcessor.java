package com.validatorpayments.payments.scan;

import com.validatorpayments.chain.NotFoundException;
import com.validatorpayments.chain.RetryingOperation;
import com.validatorpayments.chain.beacon.BeaconBlock;
import com.validatorpayments.chain.beacon.BeaconChainService;
import com.validatorpayments.chain.beacon.ExecutionPayload;
import com.validatorpayments.chain.beacon.Withdrawal;
import com.validatorpayments.chain.execution.ExecutionBlock;
import com.validatorpayments.chain.execution.ExecutionChainService;
import com.validatorpayments.chain.execution.ExecutionTransaction;
import com.validatorpayments.payments.aggregate.Credit;
import com.validatorpayments.payments.aggregate.PaymentCategory;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes one slot's payments to the tracked validators:
 * consensus withdrawals (full-exit principal stripped) and, when a tracked validator proposed the block,
 * the priority fees of its execution block. Returns an uncommitted {@link SlotContribution}.
 * <p>
 * Transport and decode failures propagate so the caller can retry the whole slot. A receipt lookup that exhausts
 * its own retries fails the slot without a further slot-level retry.
 */
@Slf4j
public class SlotProcessor {

    private final BeaconChainService beaconChainService;
    private final ExecutionChainService executionChainService;
    private final RetryingOperation retryingOperation;
    private final Set<Long> trackedIndices;
    private final BigInteger maxEffectiveBalanceGwei;
    private final int consensusUnitDecimals;
    private final int executionUnitDecimals;

    public SlotProcessor(BeaconChainService beaconChainService, ExecutionChainService executionChainService,
                         RetryingOperation retryingOperation, Set<Long> trackedIndices,
                         BigDecimal maxEffectiveBalance, int consensusUnitDecimals, int executionUnitDecimals) {
        this.beaconChainService = beaconChainService;
        this.executionChainService = executionChainService;
        this.retryingOperation = retryingOperation;
        this.trackedIndices = Set.copyOf(trackedIndices);
        this.maxEffectiveBalanceGwei = maxEffectiveBalance.movePointRight(consensusUnitDecimals).toBigInteger();
        this.consensusUnitDecimals = consensusUnitDecimals;
        this.executionUnitDecimals = executionUnitDecimals;
    }

    public SlotContribution process(long slot) {
        BeaconBlock block;
        try {
            block = beaconChainService.getBlock(slot);
        } catch (NotFoundException e) {
            return SlotContribution.noBlock(slot, e.getMessage());
        }
        List<Credit> credits = new ArrayList<>();
        List<SlotAnomaly> anomalies = new ArrayList<>();
        Optional<ExecutionPayload> payload = block.payload();
        payload.ifPresent(p -> addWithdrawalCredits(p, credits));

        long proposer = block.proposerIndex();
        if (trackedIndices.contains(proposer)) {
            if (payload.isEmpty()) {
                log.warn("Slot {}: tracked proposer {} has no execution payload", slot, proposer);
                anomalies.add(new SlotAnomaly(slot, SlotAnomaly.Kind.MISSING_EXECUTION_PAYLOAD,
                        "proposer " + proposer));
            } else {
                addExecutionCredit(slot, proposer, payload.get(), credits, anomalies);
            }
        }
        return new SlotContribution(slot, true, credits, anomalies);
    }

    /**
     * Whole coins credited for a withdrawal: amounts at or above the max effective balance are full exits,
     * and only the part above the principal counts.
     */
    BigDecimal creditedWithdrawalCoins(BigInteger amountGwei) {
        BigInteger credited = amountGwei.compareTo(maxEffectiveBalanceGwei) >= 0
                ? amountGwei.subtract(maxEffectiveBalanceGwei)
                : amountGwei;
        return new BigDecimal(credited).movePointLeft(consensusUnitDecimals);
    }

    private void addWithdrawalCredits(ExecutionPayload payload, List<Credit> credits) {
        for (Withdrawal wd : payload.withdrawals()) {
            if (!trackedIndices.contains(wd.validatorIndex())) {
                continue;
            }
            credits.add(new Credit(PaymentCategory.CONSENSUS, wd.validatorIndex(), wd.address(),
                    creditedWithdrawalCoins(wd.amountGwei())));
        }
    }

    private void addExecutionCredit(long slot, long proposer, ExecutionPayload payload,
                                    List<Credit> credits, List<SlotAnomaly> anomalies) {
        ExecutionBlock executionBlock;
        try {
            executionBlock = executionChainService.getBlockByNumber(payload.blockNumber());
        } catch (NotFoundException e) {
            anomalies.add(new SlotAnomaly(slot, SlotAnomaly.Kind.EXECUTION_BLOCK_NOT_FOUND,
                    "block " + payload.blockNumber()));
            return;
        }
        BigInteger tipsWei = BigInteger.ZERO;
        for (ExecutionTransaction tx : executionBlock.transactions()) {
            BigInteger tip = PriorityFeeCalculator.tipPerGas(tx, executionBlock.baseFeePerGas());
            if (tip.signum() == 0) {
                continue;
            }
            Optional<BigInteger> gasUsed = gasUsed(slot, tx.hash(), anomalies);
            if (gasUsed.isPresent()) {
                tipsWei = tipsWei.add(tip.multiply(gasUsed.get()));
            }
        }
        BigDecimal coins = new BigDecimal(tipsWei).movePointLeft(executionUnitDecimals);
        credits.add(new Credit(PaymentCategory.EXECUTION, proposer, payload.feeRecipient(), coins));
    }

    private Optional<BigInteger> gasUsed(long slot, String txHash, List<SlotAnomaly> anomalies) {
        try {
            return Optional.of(retryingOperation.execute("receipt " + txHash,
                    () -> executionChainService.getTransactionReceipt(txHash).gasUsed()));
        } catch (NotFoundException e) {
            anomalies.add(new SlotAnomaly(slot, SlotAnomaly.Kind.RECEIPT_NOT_FOUND, txHash));
            return Optional.empty();
        }
    }
}
