package com.validatorpayments.chain;

import com.validatorpayments.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Runs a unit of chain work with bounded retries and linear backoff.
 * <ul>
 *     <li>{@link NotFoundException}: terminal skip, rethrown at once without consuming the retry budget.</li>
 *     <li>{@link RetryExhaustedException} from a nested operation: rethrown at once.</li>
 *     <li>any other runtime failure: retried after {@link RetryPolicy#delayMs(int)}.</li>
 *     <li>budget spent: {@link RetryExhaustedException} carrying the last error.</li>
 * </ul>
 */
@Slf4j
public class RetryingOperation {

    private final RetryPolicy retryPolicy;

    public RetryingOperation(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public <T> T execute(String operation, Supplier<T> work) {
        RuntimeException lastError = null;
        int maxAttempts = retryPolicy.getMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                sleep(retryPolicy.delayMs(attempt - 1));
            }
            try {
                return work.get();
            } catch (NotFoundException | RetryExhaustedException e) {
                throw e;
            } catch (RuntimeException e) {
                lastError = e;
                log.debug("{} attempt {}/{} failed: {}", operation, attempt, maxAttempts, e.getMessage());
            }
        }
        throw new RetryExhaustedException(operation, maxAttempts, lastError);
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    private static void sleep(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during retry", e);
        }
    }
}
