package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Correlation-based analysis of a single incident.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentAnalysis {

    private Incident incident;

    @Builder.Default
    private List<TimelineEvent> timeline = new ArrayList<>();

    @Builder.Default
    private List<AffectedEntity> affectedEntities = new ArrayList<>();

    private IncidentMetrics metrics;

    @Builder.Default
    private List<CorrelatedEvent> correlatedEvents = new ArrayList<>();

    /** Sorted by probability, highest first */
    @Builder.Default
    private List<PossibleCause> possibleCauses = new ArrayList<>();

    @Builder.Default
    private List<Recommendation> recommendations = new ArrayList<>();

    private double confidence;

    private String analysisMethod;

    private Instant generatedAt;

    public double maxErrorRate() {
        return affectedEntities.stream()
                .mapToDouble(entity -> entity.getMetrics().getErrorRate())
                .max()
                .orElse(0);
    }

    public double maxResponseTime() {
        return affectedEntities.stream()
                .mapToDouble(entity -> entity.getMetrics().getResponseTime())
                .max()
                .orElse(0);
    }
}
