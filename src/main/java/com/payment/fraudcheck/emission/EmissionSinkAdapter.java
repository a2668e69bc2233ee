package com.payment.fraudcheck.emission;

import com.payment.fraudcheck.metrics.MetricSample;
import com.payment.fraudcheck.metrics.MetricsAggregator;
import com.payment.fraudcheck.metrics.MetricsSnapshot;
import com.payment.fraudcheck.trace.Trace;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Hands telemetry to the {@link TelemetryCollector} without ever blocking or failing the caller.
 * <p>
 * Records go onto a bounded queue drained by one dispatcher thread. When the queue is full the oldest
 * record is evicted; evictions and collector failures are counted in {@link #stats()} and in the
 * {@code telemetry.emission.*} metrics.
 */
@Slf4j
@Component
public class EmissionSinkAdapter {

    private static final long POLL_MS = 200;

    private final TelemetryCollector collector;
    private final TelemetryRecordMapper mapper;
    private final MetricsAggregator metrics;
    private final boolean emitAbortedTraces;
    private final LinkedBlockingDeque<PendingExport> queue;

    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong exported = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    /** Queued plus currently being exported. */
    private final AtomicLong pending = new AtomicLong();

    private ExecutorService dispatcher;
    private volatile boolean running;

    public EmissionSinkAdapter(TelemetryCollector collector,
                               TelemetryRecordMapper mapper,
                               MetricsAggregator metrics,
                               @Value("${fraudcheck.telemetry.queue-capacity:1000}") int queueCapacity,
                               @Value("${fraudcheck.telemetry.emit-aborted-traces:true}") boolean emitAbortedTraces) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("fraudcheck.telemetry.queue-capacity must be > 0, got " + queueCapacity);
        }
        this.collector = collector;
        this.mapper = mapper;
        this.metrics = metrics;
        this.emitAbortedTraces = emitAbortedTraces;
        this.queue = new LinkedBlockingDeque<>(queueCapacity);
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "telemetry-emitter");
            t.setDaemon(true);
            return t;
        });
        dispatcher.submit(this::drainLoop);
        log.info("Telemetry emission started: collector={}, queueCapacity={}, emitAbortedTraces={}",
                collector.getName(), queue.remainingCapacity() + queue.size(), emitAbortedTraces);
    }

    /** Stops accepting work, exports what is still queued (up to five seconds) and stops the dispatcher. */
    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Telemetry dispatcher did not finish in time; {} record(s) left unexported", queue.size());
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
        log.info("Telemetry emission stopped: {}", stats());
    }

    public void emit(Trace trace) {
        if (trace.isAborted() && !emitAbortedTraces) {
            log.debug("Not emitting aborted trace {}", trace.getTraceId());
            return;
        }
        try {
            TraceRecord record = mapper.toRecord(trace);
            enqueue("trace", c -> c.exportTrace(record));
        } catch (RuntimeException e) {
            countFailure("trace", e);
        }
    }

    public void emit(MetricsSnapshot snapshot) {
        try {
            List<MetricRecord> records = mapper.toRecords(snapshot);
            enqueue("metrics", c -> c.exportMetrics(records));
        } catch (RuntimeException e) {
            countFailure("metrics", e);
        }
    }

    public void emit(LogRecord record) {
        enqueue("log", c -> c.exportLog(record));
    }

    public boolean isRunning() {
        return running;
    }

    public EmissionStats stats() {
        return new EmissionStats(collector.getName(), enqueued.get(), exported.get(), dropped.get(), failed.get(), queue.size());
    }

    /**
     * Waits until everything handed in so far has been exported, failed or dropped.
     *
     * @return false on timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    private void enqueue(String kind, Consumer<TelemetryCollector> action) {
        PendingExport export = new PendingExport(kind, action);
        pending.incrementAndGet();
        while (!queue.offerLast(export)) {
            PendingExport oldest = queue.pollFirst();
            if (oldest != null) {
                pending.decrementAndGet();
                long total = dropped.incrementAndGet();
                metrics.record(MetricSample.increment("telemetry.emission.dropped", Map.of("kind", oldest.kind())));
                if (total == 1 || total % 100 == 0) {
                    log.warn("Telemetry queue full; dropped oldest {} record ({} dropped so far)", oldest.kind(), total);
                }
            }
        }
        enqueued.incrementAndGet();
    }

    private void drainLoop() {
        while (running || !queue.isEmpty()) {
            PendingExport export;
            try {
                export = queue.pollFirst(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Telemetry dispatcher interrupted; {} record(s) left unexported", queue.size());
                return;
            }
            if (export == null) {
                continue;
            }
            try {
                export.action().accept(collector);
                exported.incrementAndGet();
            } catch (RuntimeException e) {
                countFailure(export.kind(), e);
            } finally {
                pending.decrementAndGet();
            }
        }
    }

    private void countFailure(String kind, RuntimeException e) {
        long total = failed.incrementAndGet();
        metrics.record(MetricSample.increment("telemetry.emission.failed", Map.of("kind", kind)));
        if (e instanceof EmissionException) {
            log.warn("Telemetry export of {} to {} failed ({} failures so far): {}", kind, collector.getName(), total, e.getMessage());
        } else {
            log.error("Unexpected error exporting {} to {} ({} failures so far)", kind, collector.getName(), total, e);
        }
    }

    private record PendingExport(String kind, Consumer<TelemetryCollector> action) {}
}
