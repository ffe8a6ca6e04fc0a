package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Risk, escalation and business impact assessment for an incident.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessment {

    /** Highest severity among the risk factors, LOW when there are none */
    private Severity currentRisk;

    @Builder.Default
    private List<RiskFactor> riskFactors = new ArrayList<>();

    /** Always within [0.1, 0.95] */
    private double escalationProbability;

    private BusinessImpact businessImpact;

    private TimeToResolutionEstimate timeToResolution;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RiskFactor {
        private FactorType type;
        private String description;
        private Severity severity;

        /** 0.0 to 1.0 */
        private double likelihood;

        /** 0.0 to 1.0 */
        private double impact;
    }

    public enum FactorType {
        TECHNICAL, BUSINESS, OPERATIONAL
    }

    /**
     * Four-axis business impact classification.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BusinessImpact {
        private UserImpact userImpact;
        private ImpactLevel revenueImpact;
        private ImpactLevel reputationImpact;
        private ImpactLevel complianceRisk;
    }

    public enum UserImpact {
        NONE, MINIMAL, MODERATE, SEVERE
    }

    public enum ImpactLevel {
        NONE, LOW, MEDIUM, HIGH
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimeToResolutionEstimate {
        private long estimatedMinutes;
        private double confidence;

        @Builder.Default
        private List<String> factors = new ArrayList<>();
    }
}
