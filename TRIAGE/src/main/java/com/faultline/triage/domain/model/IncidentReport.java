package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Post-incident report combining analysis, root cause and lessons learned.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentReport {

    private Incident incident;
    private IncidentAnalysis analysis;
    private RootCauseAnalysis rootCause;

    @Builder.Default
    private List<TimelineEvent> timeline = new ArrayList<>();

    private ImpactAssessment impactAssessment;
    private ResolutionSummary resolutionSummary;

    @Builder.Default
    private List<String> lessonsLearned = new ArrayList<>();

    @Builder.Default
    private List<Recommendation.ActionItem> actionItems = new ArrayList<>();

    private Instant generatedAt;
    private String generatedBy;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImpactAssessment {
        private long durationMinutes;
        private long affectedUsers;

        @Builder.Default
        private List<String> affectedServices = new ArrayList<>();

        private String businessImpact;

        /** Only set for critical incidents */
        private String reputationalImpact;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResolutionSummary {
        private Instant resolvedAt;
        private String resolvedBy;
        private String resolutionMethod;

        @Builder.Default
        private List<String> stepsToResolve = new ArrayList<>();

        private long timeToResolveMinutes;
    }
}
