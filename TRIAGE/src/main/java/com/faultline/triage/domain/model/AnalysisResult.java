package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Merged output of pattern, anomaly, correlation and risk analysis for one incident.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {

    private Incident incident;

    @Builder.Default
    private List<FaultPattern> detectedPatterns = new ArrayList<>();

    @Builder.Default
    private List<Anomaly> anomalies = new ArrayList<>();

    @Builder.Default
    private List<ErrorPattern> errorPatterns = new ArrayList<>();

    @Builder.Default
    private List<CorrelatedEvent> correlatedEvents = new ArrayList<>();

    private RiskAssessment riskAssessment;

    @Builder.Default
    private List<AnalysisRecommendation> recommendations = new ArrayList<>();

    /** 0.3 to 0.95 */
    private double confidence;

    private Instant analysisTimestamp;
}
