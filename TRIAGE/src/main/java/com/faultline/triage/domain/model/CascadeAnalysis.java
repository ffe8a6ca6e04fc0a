package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Failure propagation across affected systems with containment and recovery plans.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CascadeAnalysis {

    private String primaryFailure;

    @Builder.Default
    private List<CascadeStep> cascadeChain = new ArrayList<>();

    @Builder.Default
    private List<String> affectedSystems = new ArrayList<>();

    @Builder.Default
    private List<String> containmentStrategies = new ArrayList<>();

    /** Reverse of the cascade order */
    @Builder.Default
    private List<RecoveryStep> recoveryPlan = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CascadeStep {
        private String system;
        private String failureMode;
        private Instant timestamp;
        private Severity impact;

        @Builder.Default
        private List<String> dependencies = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecoveryStep {
        private int order;
        private String action;
        private String system;
        private int estimatedTimeMinutes;

        @Builder.Default
        private List<String> dependencies = new ArrayList<>();

        private String rollbackPlan;
    }
}
