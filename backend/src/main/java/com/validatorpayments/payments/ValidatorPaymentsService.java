package com.validatorpayments.payments;

import com.validatorpayments.chain.RetryingOperation;
import com.validatorpayments.chain.beacon.BeaconChainService;
import com.validatorpayments.chain.execution.ExecutionChainService;
import com.validatorpayments.payments.aggregate.Aggregator;
import com.validatorpayments.payments.aggregate.PaymentCategory;
import com.validatorpayments.payments.aggregate.ValidatorTotals;
import com.validatorpayments.payments.range.InvalidRangeException;
import com.validatorpayments.payments.range.SlotRange;
import com.validatorpayments.payments.range.SlotRangeResolver;
import com.validatorpayments.payments.scan.BoundedScanner;
import com.validatorpayments.payments.scan.ScanListener;
import com.validatorpayments.payments.scan.ScanReport;
import com.validatorpayments.payments.scan.SlotProcessor;
import com.validatorpayments.payments.validator.ValidatorRecord;
import com.validatorpayments.payments.validator.ValidatorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.SortedMap;

/**
 * Computes consensus and execution payments to a set of validators over a UTC date range.
 * <p>
 * Fatal: invalid dates or range, genesis unavailable after retries, no validator resolved.
 * Everything per slot (missed slots, exhausted retries, missing payloads) is reported through the
 * {@link ScanListener} and the report's {@link ScanReport}, never thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidatorPaymentsService {

    private final BeaconChainService beaconChainService;
    private final ExecutionChainService executionChainService;
    private final RetryingOperation retryingOperation;
    private final ValidatorRegistry validatorRegistry;
    private final SlotRangeResolver slotRangeResolver;
    private final BoundedScanner boundedScanner;
    private final PaymentsProperties paymentsProperties;
    private final ScanListener scanListener;

    /**
     * @param startDate YYYY-MM-DD, inclusive from 00:00 UTC
     * @param endDate   YYYY-MM-DD, exclusive from 00:00 UTC
     */
    public PaymentsReport computePayments(List<String> ids, String startDate, String endDate) {
        LocalDate start = SlotRangeResolver.parseDate(startDate, "startDate");
        LocalDate end = SlotRangeResolver.parseDate(endDate, "endDate");
        return computePayments(ids, start, end);
    }

    public PaymentsReport computePayments(List<String> ids, LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new InvalidRangeException("startDate and endDate are required");
        }
        return computePayments(ids,
                startDate.atStartOfDay(ZoneOffset.UTC).toInstant(),
                endDate.atStartOfDay(ZoneOffset.UTC).toInstant(),
                scanListener);
    }

    public PaymentsReport computePayments(List<String> ids, Instant start, Instant end, ScanListener listener) {
        long genesisTime = fetchGenesisTime();
        SlotRange range = slotRangeResolver.resolve(start, end, genesisTime);
        SortedMap<Long, ValidatorRecord> validators = validatorRegistry.resolve(ids);

        Aggregator aggregator = new Aggregator();
        SlotProcessor processor = new SlotProcessor(
                beaconChainService,
                executionChainService,
                retryingOperation,
                validators.keySet(),
                paymentsProperties.getMaxEffectiveBalance(),
                paymentsProperties.getConsensusUnitDecimals(),
                paymentsProperties.getExecutionUnitDecimals());
        ScanReport scan = boundedScanner.scan(range, processor::process, aggregator, listener);

        PaymentsReport report = new PaymentsReport(
                start,
                end,
                range,
                aggregator.totalsByAddress(PaymentCategory.CONSENSUS),
                aggregator.totalsByAddress(PaymentCategory.EXECUTION),
                toValidatorPayments(validators, aggregator.totalsByValidator()),
                scan);
        log.info("Consensus layer payments by withdrawal address: {}", report.consensusTotalsByAddress());
        log.info("Execution layer payments by fee recipient: {}", report.executionTotalsByAddress());
        if (!scan.isComplete()) {
            log.warn("Totals are a lower bound: {} slot(s) failed, {} anomaly(ies) affected totals",
                    scan.failed(), scan.anomaliesAffectingTotals());
        }
        return report;
    }

    private long fetchGenesisTime() {
        try {
            return retryingOperation.execute("genesis", beaconChainService::getGenesis).genesisTimeSeconds();
        } catch (RuntimeException e) {
            throw new PaymentsComputationException("Failed to fetch genesis time: " + e.getMessage(), e);
        }
    }

    private static List<PaymentsReport.ValidatorPayments> toValidatorPayments(
            SortedMap<Long, ValidatorRecord> validators, SortedMap<Long, ValidatorTotals> totals) {
        return validators.values().stream()
                .map(v -> {
                    ValidatorTotals t = totals.get(v.index());
                    return new PaymentsReport.ValidatorPayments(
                            v.index(),
                            v.pubkey(),
                            v.withdrawalAddress(),
                            t != null ? t.consensus() : BigDecimal.ZERO,
                            t != null ? t.execution() : BigDecimal.ZERO);
                })
                .toList();
    }
}
