package com.payment.fraudcheck.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.payment.fraudcheck.core.FraudCheckResult;
import com.payment.fraudcheck.domain.FraudStatus;
import com.payment.fraudcheck.domain.RiskAssessment;
import com.payment.fraudcheck.domain.RiskFactor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FraudCheckResponseDto {

    String transactionId;
    double riskScore;
    FraudStatus status;
    List<RiskFactorDto> riskFactors;
    String recommendation;
    double threshold;
    Instant timestamp;
    String traceId;

    @Value
    public static class RiskFactorDto {
        String name;
        double contribution;
    }

    public static FraudCheckResponseDto from(FraudCheckResult result) {
        RiskAssessment assessment = result.getAssessment();
        return FraudCheckResponseDto.builder()
                .transactionId(assessment.getTransactionId())
                .riskScore(assessment.getRiskScore())
                .status(assessment.getStatus())
                .riskFactors(assessment.getRiskFactors().stream()
                        .map(FraudCheckResponseDto::toDto)
                        .toList())
                .recommendation(assessment.getRecommendation())
                .threshold(assessment.getThreshold())
                .timestamp(result.getCompletedAt())
                .traceId(result.getTraceId())
                .build();
    }

    private static RiskFactorDto toDto(RiskFactor factor) {
        return new RiskFactorDto(factor.getName(), factor.getContribution());
    }
}
