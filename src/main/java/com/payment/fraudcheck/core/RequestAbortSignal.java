package com.payment.fraudcheck.core;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Lets whoever owns a request abort it from any thread. The fraud check polls {@link #checkpoint()}
 * between steps and registers listeners that close its open spans as soon as the abort happens.
 */
@Slf4j
public class RequestAbortSignal {

    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile String reason;

    public static RequestAbortSignal create() {
        return new RequestAbortSignal();
    }

    /** First call wins; later calls are ignored. */
    public void abort(String reason) {
        synchronized (this) {
            if (this.reason != null) {
                return;
            }
            this.reason = reason != null ? reason : "aborted";
        }
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Abort listener failed: {}", e.getMessage(), e);
            }
        }
    }

    public boolean isAborted() {
        return reason != null;
    }

    public String getReason() {
        return reason;
    }

    /** Runs the listener on abort, immediately if the signal is already aborted. */
    public void onAbort(Runnable listener) {
        listeners.add(listener);
        if (isAborted()) {
            listener.run();
        }
    }

    public void checkpoint() {
        if (isAborted()) {
            throw new RequestAbortedException("Request aborted: " + reason);
        }
    }
}
