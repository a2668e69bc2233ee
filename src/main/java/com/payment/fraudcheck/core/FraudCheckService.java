package com.payment.fraudcheck.core;

import com.payment.fraudcheck.api.FraudCheckUnavailableException;
import com.payment.fraudcheck.client.DecisionIntelligenceClient;
import com.payment.fraudcheck.client.DecisionIntelligenceException;
import com.payment.fraudcheck.domain.FraudStatus;
import com.payment.fraudcheck.domain.RiskAssessment;
import com.payment.fraudcheck.domain.Transaction;
import com.payment.fraudcheck.emission.EmissionSinkAdapter;
import com.payment.fraudcheck.emission.LogRecord;
import com.payment.fraudcheck.metrics.MetricSample;
import com.payment.fraudcheck.metrics.MetricsAggregator;
import com.payment.fraudcheck.risk.engine.InvalidInputException;
import com.payment.fraudcheck.risk.engine.RiskModel;
import com.payment.fraudcheck.risk.engine.RiskSeedSource;
import com.payment.fraudcheck.trace.Span;
import com.payment.fraudcheck.trace.SpanAttributes;
import com.payment.fraudcheck.trace.SpanLifecycleException;
import com.payment.fraudcheck.trace.SpanStatus;
import com.payment.fraudcheck.trace.Trace;
import com.payment.fraudcheck.trace.TraceContext;
import com.payment.fraudcheck.trace.TraceContextPropagator;
import com.payment.fraudcheck.trace.TraceRecorder;
import com.payment.fraudcheck.trace.TraceRecorderFactory;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs one fraud check end to end: validates the transaction, scores it through the decision-intelligence
 * client and records the call as a four-span trace
 * ({@code http.request -> fraud.check -> mastercard.client.call -> response.generation}).
 * <p>
 * Each call owns its own {@link TraceRecorder}; the trace context is passed explicitly, never through
 * thread-locals, so concurrent checks cannot mix spans. Telemetry problems never fail a check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudCheckService {

    public static final String HTTP_REQUEST = "http.request";
    public static final String FRAUD_CHECK = "fraud.check";
    public static final String CLIENT_CALL = "mastercard.client.call";
    public static final String RESPONSE_GENERATION = "response.generation";

    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_SPAN_ID = "spanId";

    static final String HTTP_METHOD = "POST";
    static final String HTTP_ROUTE = "/api/fraud/check";
    private static final String RESILIENCE_INSTANCE = "decisionIntelligence";

    private final RiskModel riskModel;
    private final DecisionIntelligenceClient client;
    private final RiskSeedSource seedSource;
    private final TraceContextPropagator propagator;
    private final TraceRecorderFactory recorderFactory;
    private final EmissionSinkAdapter sink;
    private final MetricsAggregator metrics;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;
    private final Clock clock;

    /** Rethrow span lifecycle violations instead of dropping the trace. Meant for tests and CI. */
    @Value("${fraudcheck.trace.strict-lifecycle:false}")
    private boolean strictLifecycle;

    /** Abort checks running longer than this; 0 disables the deadline. */
    @Value("${fraudcheck.check.timeout-ms:0}")
    private long timeoutMs;

    private final ScheduledThreadPoolExecutor watchdog = newWatchdog();

    public RiskAssessment checkFraud(Transaction transaction) {
        return checkFraud(transaction, null, RequestAbortSignal.create()).getAssessment();
    }

    /**
     * @param parent caller's trace context (e.g. from an inbound {@code traceparent}); null starts a new trace
     * @param abort  aborting it closes the open spans with status error and fails the call
     * @throws InvalidInputException          transaction cannot be scored; no trace is recorded
     * @throws FraudCheckUnavailableException decision intelligence did not answer
     * @throws RequestAbortedException        the request was aborted before it finished
     */
    public FraudCheckResult checkFraud(Transaction transaction, TraceContext parent, RequestAbortSignal abort) {
        try {
            riskModel.validate(transaction);
        } catch (InvalidInputException e) {
            metrics.record(MetricSample.increment("fraud.check.rejected", Map.of()));
            log.warn("Fraud check rejected: transactionId={} reason={}",
                    transaction != null ? transaction.getTransactionId() : null, e.getMessage());
            throw e;
        }
        abort.checkpoint();

        TraceContext context = parent != null ? parent : propagator.newTrace();
        TraceRecorder recorder = recorderFactory.open(context, this::onTraceSealed);
        abort.onAbort(() -> recorder.abort(TraceRecorder.ABORTED));
        ScheduledFuture<?> deadline = timeoutMs > 0
                ? watchdog.schedule(() -> abort.abort("timeout after " + timeoutMs + "ms"), timeoutMs, TimeUnit.MILLISECONDS)
                : null;

        Deque<Span> open = new ArrayDeque<>();
        FraudCheckResult result = null;
        try {
            Span root = begin(recorder, HTTP_REQUEST, null, open);
            MDC.put(MDC_TRACE_ID, root.getTraceId());
            MDC.put(MDC_SPAN_ID, root.getSpanId());
            abort.checkpoint();

            Span checkSpan = begin(recorder, FRAUD_CHECK, root, open);
            Span callSpan = begin(recorder, CLIENT_CALL, checkSpan, open);
            long seed = seedSource.seedFor(transaction);
            AtomicInteger attempts = new AtomicInteger();
            RiskAssessment assessment = callDecisionIntelligence(transaction, seed, attempts);
            abort.checkpoint();

            begin(recorder, RESPONSE_GENERATION, callSpan, open);
            result = new FraudCheckResult(transaction, assessment, root.getTraceId(), root.getSpanId(), clock.instant());
            end(recorder, open, SpanAttributes.builder()
                    .put("response.recommendation", assessment.getRecommendation())
                    .build());
            end(recorder, open, SpanAttributes.builder()
                    .put("api.name", client.getApiName())
                    .put("api.operation", "check_fraud")
                    .put("client.attempts", (long) attempts.get())
                    .build());
            end(recorder, open, fraudAttributes(transaction, assessment));
            end(recorder, open, httpAttributes(200));
            // only a completed check counts; an abort can no longer land once the root has ended
            recordOutcome(transaction, assessment, checkSpan.getTraceId(), checkSpan.getSpanId());
            return result;
        } catch (RequestAbortedException e) {
            throw aborted(recorder, abort, transaction);
        } catch (SpanLifecycleException e) {
            if (abort.isAborted()) {
                throw aborted(recorder, abort, transaction);
            }
            return handleLifecycleError(recorder, result, e);
        } catch (FraudCheckUnavailableException e) {
            failOpenSpans(recorder, open, 503, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            if (abort.isAborted()) {
                throw aborted(recorder, abort, transaction);
            }
            log.error("Fraud check failed: transactionId={}", transaction.getTransactionId(), e);
            failOpenSpans(recorder, open, 500, e.getMessage());
            throw e;
        } finally {
            if (deadline != null) {
                deadline.cancel(false);
            }
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_SPAN_ID);
        }
    }

    private static ScheduledThreadPoolExecutor newWatchdog() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "fraud-check-watchdog");
            t.setDaemon(true);
            return t;
        });
        // finished checks cancel their deadline; drop it from the queue right away
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @PreDestroy
    void shutdown() {
        watchdog.shutdownNow();
    }

    private RiskAssessment callDecisionIntelligence(Transaction transaction, long seed, AtomicInteger attempts) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(RESILIENCE_INSTANCE);
        Retry retry = retryRegistry.retry(RESILIENCE_INSTANCE);
        Supplier<RiskAssessment> call = () -> {
            attempts.incrementAndGet();
            return client.checkFraud(transaction, seed);
        };
        RiskAssessment assessment;
        try {
            assessment = Retry.decorateSupplier(retry, CircuitBreaker.decorateSupplier(circuitBreaker, call)).get();
        } catch (CallNotPermittedException e) {
            log.warn("Decision intelligence circuit open; transactionId={}", transaction.getTransactionId());
            throw new FraudCheckUnavailableException("Decision intelligence is temporarily unavailable (circuit open)", e);
        } catch (DecisionIntelligenceException e) {
            log.warn("Decision intelligence failed after {} attempt(s): transactionId={} error={}",
                    attempts.get(), transaction.getTransactionId(), e.getMessage());
            throw new FraudCheckUnavailableException(
                    "Decision intelligence unavailable after " + attempts.get() + " attempt(s): " + e.getMessage(), e);
        }
        if (assessment == null || assessment.getStatus() == null
                || assessment.getStatus() != FraudStatus.forScore(assessment.getRiskScore(), assessment.getThreshold())) {
            throw new IllegalStateException("Inconsistent assessment for transaction " + transaction.getTransactionId()
                    + ": " + assessment);
        }
        return assessment;
    }

    private void recordOutcome(Transaction transaction, RiskAssessment assessment, String traceId, String spanId) {
        metrics.record(MetricSample.increment("fraud.checks",
                Map.of("status", assessment.getStatus().wireName(), "currency", transaction.getCurrencyCode())));
        metrics.recordOutcome(assessment.getStatus());
        log.info("[AUDIT] FRAUD_CHECK transactionId={} merchantId={} amount={} riskScore={} status={} traceId={}",
                transaction.getTransactionId(), transaction.getMerchantId(), transaction.getAmount(),
                assessment.getRiskScore(), assessment.getStatus().wireName(), traceId);
        if (assessment.isFlagged()) {
            log.warn("Suspicious transaction detected: {} (risk score: {})",
                    transaction.getTransactionId(), assessment.getRiskScore());
            sink.emit(LogRecord.builder()
                    .timestamp(clock.millis())
                    .severity("WARN")
                    .body("Suspicious transaction detected: " + transaction.getTransactionId())
                    .traceId(traceId)
                    .spanId(spanId)
                    .attributes(Map.of(
                            "transaction.id", transaction.getTransactionId(),
                            "fraud.risk_score", assessment.getRiskScore(),
                            "fraud.status", assessment.getStatus().wireName()))
                    .build());
        }
    }

    private void onTraceSealed(Trace trace) {
        for (Span span : trace.getSpans()) {
            metrics.record(MetricSample.duration("span.duration", span.getDurationMs(), Map.of("operation", span.getName())));
        }
        if (trace.isAborted()) {
            metrics.record(MetricSample.increment("trace.aborted", Map.of()));
        } else {
            metrics.record(MetricSample.duration("fraud.check.duration", trace.getDurationMs(),
                    Map.of("status", trace.getRoot().getStatus().wireName())));
        }
        sink.emit(trace);
    }

    private RequestAbortedException aborted(TraceRecorder recorder, RequestAbortSignal abort, Transaction transaction) {
        recorder.abort(TraceRecorder.ABORTED);
        String reason = abort.isAborted() ? abort.getReason() : "interrupted";
        log.warn("Fraud check aborted: transactionId={} traceId={} reason={}",
                transaction.getTransactionId(), recorder.getTraceId(), reason);
        return new RequestAbortedException("Fraud check for " + transaction.getTransactionId() + " aborted: " + reason);
    }

    private FraudCheckResult handleLifecycleError(TraceRecorder recorder, FraudCheckResult result, SpanLifecycleException e) {
        log.error("Span lifecycle violation in trace {}; trace dropped", recorder.getTraceId(), e);
        metrics.record(MetricSample.increment("trace.lifecycle.errors", Map.of()));
        recorder.discard();
        if (strictLifecycle || result == null) {
            throw e;
        }
        recordOutcome(result.getTransaction(), result.getAssessment(), result.getTraceId(), result.getRootSpanId());
        return result;
    }

    /** Ends whatever is still open with status error, innermost first; the root carries the HTTP status. */
    private void failOpenSpans(TraceRecorder recorder, Deque<Span> open, int httpStatus, String message) {
        try {
            while (!open.isEmpty()) {
                Span span = open.pop();
                SpanAttributes attributes = open.isEmpty()
                        ? httpAttributes(httpStatus)
                        : SpanAttributes.builder().put("error.message", message).build();
                recorder.endSpan(span, attributes, SpanStatus.ERROR, message);
            }
        } catch (SpanLifecycleException e) {
            log.error("Could not close spans of failed trace {}; trace dropped", recorder.getTraceId(), e);
            metrics.record(MetricSample.increment("trace.lifecycle.errors", Map.of()));
            recorder.discard();
        }
    }

    private static Span begin(TraceRecorder recorder, String name, Span parent, Deque<Span> open) {
        Span span = recorder.beginSpan(name, parent);
        open.push(span);
        return span;
    }

    private static void end(TraceRecorder recorder, Deque<Span> open, SpanAttributes attributes) {
        recorder.endSpan(open.pop(), attributes, SpanStatus.OK);
    }

    private static SpanAttributes fraudAttributes(Transaction transaction, RiskAssessment assessment) {
        return SpanAttributes.builder()
                .put("transaction.id", transaction.getTransactionId())
                .put("transaction.amount", transaction.getAmount())
                .put("transaction.currency", transaction.getCurrencyCode())
                .put("merchant.id", transaction.getMerchantId())
                .put("fraud.risk_score", assessment.getRiskScore())
                .put("fraud.status", assessment.getStatus().wireName())
                .put("fraud.threshold", assessment.getThreshold())
                .put("fraud.risk_factor_count", (long) assessment.getRiskFactors().size())
                .build();
    }

    private static SpanAttributes httpAttributes(int statusCode) {
        return SpanAttributes.builder()
                .put("http.method", HTTP_METHOD)
                .put("http.route", HTTP_ROUTE)
                .put("http.status_code", (long) statusCode)
                .build();
    }
}
