package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * How a fault evolved from detection through degradation and error escalation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressionAnalysis {

    @Builder.Default
    private List<ProgressionStage> stages = new ArrayList<>();

    private String currentStage;

    /** Null when no further stage is expected */
    private String nextLikelyStage;

    private Speed progressionSpeed;

    @Builder.Default
    private List<InterventionPoint> interventionPoints = new ArrayList<>();

    public enum Speed {
        SLOW, MODERATE, FAST, CRITICAL
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProgressionStage {
        private String name;
        private String description;
        private Instant timestamp;

        @Builder.Default
        private List<String> indicators = new ArrayList<>();

        private Severity severity;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InterventionPoint {
        private String stage;
        private String action;
        private double effectiveness;
        private int timeWindowMinutes;
    }
}
