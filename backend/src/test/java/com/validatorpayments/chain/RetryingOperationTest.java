package com.validatorpayments.chain;

import com.validatorpayments.common.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryingOperationTest {

    private final RetryingOperation retrying = new RetryingOperation(new RetryPolicy(0L, 0, 5));

    @Test
    @DisplayName("success on first attempt returns value without retry")
    void firstAttemptSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        String result = retrying.execute("op", () -> {
            calls.incrementAndGet();
            return "ok";
        });
        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("transient failures are retried until success")
    void retriesTransientFailures() {
        AtomicInteger calls = new AtomicInteger();
        String result = retrying.execute("op", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new RpcException("HTTP 503");
            }
            return "ok";
        });
        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("not found is rethrown at once without consuming retries")
    void notFoundIsTerminal() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> retrying.execute("op", () -> {
            calls.incrementAndGet();
            throw new NotFoundException("HTTP 404");
        })).isInstanceOf(NotFoundException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("exhausted budget throws RetryExhaustedException with last error")
    void exhaustion() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> retrying.execute("slot 7", () -> {
            throw new RpcException("timeout " + calls.incrementAndGet());
        }))
                .isInstanceOf(RetryExhaustedException.class)
                .hasMessageContaining("slot 7")
                .hasMessageContaining("5 attempts")
                .hasRootCauseMessage("timeout 5");
        assertThat(calls).hasValue(5);
    }

    @Test
    @DisplayName("exhaustion of a nested operation is not retried by the enclosing one")
    void nestedExhaustionNotMultiplied() {
        AtomicInteger innerCalls = new AtomicInteger();
        AtomicInteger outerCalls = new AtomicInteger();
        assertThatThrownBy(() -> retrying.execute("slot 1", () -> {
            outerCalls.incrementAndGet();
            return retrying.execute("receipt 0xt1", () -> {
                innerCalls.incrementAndGet();
                throw new RpcException("HTTP 502");
            });
        }))
                .isInstanceOf(RetryExhaustedException.class)
                .hasMessageContaining("receipt 0xt1");
        assertThat(outerCalls).hasValue(1);
        assertThat(innerCalls).hasValue(5);
    }

    @Test
    @DisplayName("null policy falls back to the default")
    void nullPolicy() {
        assertThat(new RetryingOperation(null).getRetryPolicy().getMaxAttempts()).isEqualTo(5);
    }
}
