package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationPrediction {

    private double probability;

    /** Minutes until the nearest trigger is expected to fire */
    private long timeframeMinutes;

    @Builder.Default
    private List<Trigger> triggers = new ArrayList<>();

    /** Deduplicated, in first-seen order */
    @Builder.Default
    private List<String> preventionActions = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Trigger {
        private TriggerKind kind;
        private String condition;
        private double threshold;
        private double currentValue;

        /** Null when the threshold is already crossed */
        private Long timeToThresholdMinutes;
    }

    public enum TriggerKind {
        ERROR_RATE, RESPONSE_TIME, DURATION
    }
}
