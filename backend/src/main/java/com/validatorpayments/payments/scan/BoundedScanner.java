package com.validatorpayments.payments.scan;

import com.validatorpayments.chain.NotFoundException;
import com.validatorpayments.chain.RetryExhaustedException;
import com.validatorpayments.chain.RetryingOperation;
import com.validatorpayments.payments.aggregate.Aggregator;
import com.validatorpayments.payments.range.SlotRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongFunction;

/**
 * Walks a slot range with at most {@code concurrency} slots in flight. Slots are admitted in batches of
 * {@code concurrency}; each batch settles completely (success, skip or exhausted retries) before the next starts.
 * A slot's contribution is committed to the {@link Aggregator} only when its retried unit succeeds.
 */
@Slf4j
public class BoundedScanner {

    private final int concurrency;
    private final long progressIntervalMs;
    private final RetryingOperation retryingOperation;
    private final Clock clock;

    public BoundedScanner(int concurrency, long progressIntervalMs, RetryingOperation retryingOperation, Clock clock) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        this.concurrency = concurrency;
        this.progressIntervalMs = Math.max(0L, progressIntervalMs);
        this.retryingOperation = retryingOperation;
        this.clock = clock;
    }

    public ScanReport scan(SlotRange range, LongFunction<SlotContribution> slotWork, Aggregator aggregator,
                           ScanListener listener) {
        ScanProgress progress = new ScanProgress(range.size());
        AtomicLong anomaliesAffectingTotals = new AtomicLong();
        ScanListener counting = new CountingListener(listener, anomaliesAffectingTotals);
        Map<SlotOutcome, Long> outcomes = new EnumMap<>(SlotOutcome.class);
        for (SlotOutcome o : SlotOutcome.values()) {
            outcomes.put(o, 0L);
        }

        log.info("Starting scan of {} slots [{}-{}] with concurrency {}",
                range.size(), range.startSlot(), range.endSlot(), concurrency);
        ThreadPoolTaskExecutor executor = newExecutor((int) Math.min(concurrency, range.size()));
        long lastEmitMs = clock.millis();
        try {
            List<CompletableFuture<SlotOutcome>> batch = new ArrayList<>(concurrency);
            for (long slot = range.startSlot(); slot <= range.endSlot(); slot++) {
                long s = slot;
                batch.add(CompletableFuture.supplyAsync(() -> runSlot(s, slotWork, aggregator, counting), executor));
                if (batch.size() >= concurrency || slot == range.endSlot()) {
                    settle(batch, outcomes);
                    progress.advance(batch.size());
                    batch = new ArrayList<>(concurrency);
                    long now = clock.millis();
                    if (now - lastEmitMs >= progressIntervalMs || progress.isComplete()) {
                        counting.onProgress(progress.getProcessed(), progress.getTotal());
                        lastEmitMs = now;
                    }
                }
            }
        } finally {
            executor.shutdown();
        }

        ScanReport report = new ScanReport(progress.getTotal(), progress.getProcessed(),
                outcomes.get(SlotOutcome.COMPLETED), outcomes.get(SlotOutcome.MISSED), outcomes.get(SlotOutcome.FAILED),
                anomaliesAffectingTotals.get());
        log.info("Scan complete: {} / {} slots ({} completed, {} missed, {} failed)",
                report.processed(), report.total(), report.completed(), report.missed(), report.failed());
        return report;
    }

    public int getConcurrency() {
        return concurrency;
    }

    private SlotOutcome runSlot(long slot, LongFunction<SlotContribution> slotWork, Aggregator aggregator,
                                ScanListener listener) {
        try {
            SlotContribution contribution = retryingOperation.execute("slot " + slot, () -> slotWork.apply(slot));
            contribution.anomalies().forEach(listener::onSlotAnomaly);
            if (!contribution.blockProposed()) {
                return SlotOutcome.MISSED;
            }
            aggregator.commit(contribution.credits());
            return SlotOutcome.COMPLETED;
        } catch (NotFoundException e) {
            listener.onSlotAnomaly(new SlotAnomaly(slot, SlotAnomaly.Kind.NO_BLOCK, e.getMessage()));
            return SlotOutcome.MISSED;
        } catch (RetryExhaustedException e) {
            listener.onSlotAnomaly(new SlotAnomaly(slot, SlotAnomaly.Kind.RETRIES_EXHAUSTED, e.getMessage()));
            return SlotOutcome.FAILED;
        } catch (RuntimeException e) {
            log.warn("Slot {} failed unexpectedly: {}", slot, e.getMessage(), e);
            listener.onSlotAnomaly(new SlotAnomaly(slot, SlotAnomaly.Kind.RETRIES_EXHAUSTED, e.getMessage()));
            return SlotOutcome.FAILED;
        }
    }

    private static void settle(List<CompletableFuture<SlotOutcome>> batch, Map<SlotOutcome, Long> outcomes) {
        CompletableFuture.allOf(batch.toArray(new CompletableFuture[0])).join();
        for (CompletableFuture<SlotOutcome> f : batch) {
            outcomes.merge(f.join(), 1L, Long::sum);
        }
    }

    private static ThreadPoolTaskExecutor newExecutor(int threads) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix("slot-scan-");
        e.initialize();
        return e;
    }

    private static final class CountingListener implements ScanListener {

        private final ScanListener delegate;
        private final AtomicLong affectingTotals;

        private CountingListener(ScanListener delegate, AtomicLong affectingTotals) {
            this.delegate = delegate;
            this.affectingTotals = affectingTotals;
        }

        @Override
        public void onProgress(long processed, long total) {
            try {
                delegate.onProgress(processed, total);
            } catch (RuntimeException e) {
                log.warn("Scan listener failed on progress {}/{}: {}", processed, total, e.getMessage());
            }
        }

        @Override
        public void onSlotAnomaly(SlotAnomaly anomaly) {
            if (anomaly.affectsTotals()) {
                affectingTotals.incrementAndGet();
            }
            try {
                delegate.onSlotAnomaly(anomaly);
            } catch (RuntimeException e) {
                log.warn("Scan listener failed on {}: {}", anomaly, e.getMessage());
            }
        }
    }
}
