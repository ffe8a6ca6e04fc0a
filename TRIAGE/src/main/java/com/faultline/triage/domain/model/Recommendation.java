package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator-facing recommendation attached to an incident analysis or root cause analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {

    private Horizon type;
    private Severity priority;
    private String title;
    private String description;

    @Builder.Default
    private List<ActionItem> actionItems = new ArrayList<>();

    private String estimatedImpact;
    private String estimatedEffort;
    private Category category;

    public enum Horizon {
        IMMEDIATE, SHORT_TERM, LONG_TERM
    }

    public enum Category {
        MONITORING, INFRASTRUCTURE, CODE, PROCESS
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ActionItem {
        private String description;

        @Builder.Default
        private String status = "pending";

        private Severity priority;
    }
}
