package com.payment.fraudcheck.api;

import com.payment.fraudcheck.core.DemoTrafficGenerator;
import com.payment.fraudcheck.core.FraudCheckResult;
import com.payment.fraudcheck.core.FraudCheckService;
import com.payment.fraudcheck.core.RequestAbortSignal;
import com.payment.fraudcheck.core.TrafficSummary;
import com.payment.fraudcheck.domain.Transaction;
import com.payment.fraudcheck.trace.TraceContext;
import com.payment.fraudcheck.trace.TraceContextPropagator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * REST API for fraud checks. Each call produces one trace; a valid inbound {@code traceparent} makes the
 * caller's span the parent of the trace root, and the response carries the root's {@code traceparent}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Fraud", description = "Score transactions for fraud risk")
public class FraudCheckController {

    private final FraudCheckService fraudCheckService;
    private final TraceContextPropagator propagator;
    private final DemoTrafficGenerator trafficGenerator;

    @PostMapping("/api/fraud/check")
    @Operation(
            summary = "Check transaction for fraud",
            description = "Scores the transaction and records the call as a trace "
                    + "(http.request, fraud.check, mastercard.client.call, response.generation). "
                    + "status is flagged when risk_score exceeds the threshold (default 70), with recommendation review.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Transaction scored. Body.status is approved or flagged.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = FraudCheckResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request. Body: { \"error\": \"VALIDATION_FAILED\"|\"INVALID_INPUT\", \"details\"|\"message\": ... }"),
            @ApiResponse(responseCode = "503", description = "Decision intelligence unavailable or request aborted. Body: { \"error\": \"FRAUD_CHECK_UNAVAILABLE\"|\"REQUEST_ABORTED\", \"message\": \"...\" }"),
            @ApiResponse(responseCode = "500", description = "Internal error. Body: { \"error\": \"INTERNAL_ERROR\", \"message\": \"...\" }")
    })
    public ResponseEntity<FraudCheckResponseDto> check(
            @Valid @RequestBody FraudCheckRequestDto dto,
            @Parameter(description = "W3C trace context of the caller")
            @RequestHeader(value = TraceContextPropagator.TRACEPARENT_HEADER, required = false) String traceparent) {
        Transaction transaction = Transaction.builder()
                .transactionId(dto.getTransactionId())
                .amount(dto.getAmount())
                .merchantId(dto.getMerchantId())
                .currencyCode(dto.getCurrency())
                .timestamp(dto.getTimestamp() != null ? dto.getTimestamp() : Instant.now())
                .riskSignals(dto.getRiskSignals())
                .build();
        TraceContext parent = propagator.extract(traceparent).orElse(null);
        log.info("Fraud check: {}, amount: {}, remoteParent={}", transaction.getTransactionId(), transaction.getAmount(), parent != null);

        FraudCheckResult result = fraudCheckService.checkFraud(transaction, parent, RequestAbortSignal.create());
        return ResponseEntity.ok()
                .header(TraceContextPropagator.TRACEPARENT_HEADER,
                        propagator.inject(new TraceContext(result.getTraceId(), result.getRootSpanId(), false)))
                .body(FraudCheckResponseDto.from(result));
    }

    @GetMapping("/api/demo/generate-traffic")
    @Operation(summary = "Generate demo traffic",
            description = "Runs N fraud checks with random amounts ($10 to $5000) concurrently to populate dashboards.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Counts of approved, flagged and failed checks"),
            @ApiResponse(responseCode = "400", description = "requests outside 1..100")
    })
    public ResponseEntity<TrafficSummary> generateTraffic(
            @Parameter(description = "Number of fraud checks, 1 to 100") @RequestParam(defaultValue = "10") int requests) {
        return ResponseEntity.ok(trafficGenerator.generate(requests));
    }
}
