package com.payment.fraudcheck.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestAbortSignalTest {

    @Test
    void firstAbortWinsAndListenersRunOnce() {
        RequestAbortSignal signal = RequestAbortSignal.create();
        AtomicInteger runs = new AtomicInteger();
        signal.onAbort(runs::incrementAndGet);

        signal.abort("client disconnected");
        signal.abort("timeout");

        assertThat(signal.isAborted()).isTrue();
        assertThat(signal.getReason()).isEqualTo("client disconnected");
        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void lateListenerRunsImmediately() {
        RequestAbortSignal signal = RequestAbortSignal.create();
        signal.abort(null);
        AtomicInteger runs = new AtomicInteger();

        signal.onAbort(runs::incrementAndGet);

        assertThat(runs.get()).isEqualTo(1);
        assertThat(signal.getReason()).isEqualTo("aborted");
    }

    @Test
    void checkpointThrowsOnlyAfterAbort() {
        RequestAbortSignal signal = RequestAbortSignal.create();
        assertThatCode(signal::checkpoint).doesNotThrowAnyException();

        signal.abort("gone");

        assertThatThrownBy(signal::checkpoint).isInstanceOf(RequestAbortedException.class).hasMessageContaining("gone");
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        RequestAbortSignal signal = RequestAbortSignal.create();
        AtomicInteger runs = new AtomicInteger();
        signal.onAbort(() -> {
            throw new IllegalStateException("boom");
        });
        signal.onAbort(runs::incrementAndGet);

        signal.abort("x");

        assertThat(runs.get()).isEqualTo(1);
    }
}
