package com.payment.fraudcheck.api;

import com.payment.fraudcheck.metrics.MetricSample;
import com.payment.fraudcheck.metrics.MetricsAggregator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * Counts HTTP requests and their response time per route: {@code http.server.requests} and
 * {@code http.server.duration}, tagged with method, route and status.
 */
@Component
@RequiredArgsConstructor
public class HttpMetricsInterceptor implements HandlerInterceptor {

    private static final String START_ATTRIBUTE = HttpMetricsInterceptor.class.getName() + ".start";

    private final MetricsAggregator metrics;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_ATTRIBUTE, System.nanoTime());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        Object start = request.getAttribute(START_ATTRIBUTE);
        if (!(start instanceof Long startNanos)) {
            return;
        }
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        Map<String, String> tags = Map.of(
                "method", request.getMethod(),
                "route", pattern != null ? pattern.toString() : "unmatched",
                "status", String.valueOf(response.getStatus()));
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.record(MetricSample.increment("http.server.requests", tags));
        metrics.record(MetricSample.duration("http.server.duration", elapsedMs, tags));
    }
}
