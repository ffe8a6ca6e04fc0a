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
public class ActionPlan {

    @Builder.Default
    private List<PlanAction> immediateActions = new ArrayList<>();

    @Builder.Default
    private List<PlanAction> shortTermActions = new ArrayList<>();

    @Builder.Default
    private List<PlanAction> longTermActions = new ArrayList<>();

    @Builder.Default
    private List<ContingencyPlan> contingencyPlans = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlanAction {
        private String id;
        private String title;
        private String description;
        private Severity priority;
        private int estimatedTimeMinutes;
        private String assignee;

        @Builder.Default
        private List<String> dependencies = new ArrayList<>();

        @Builder.Default
        private List<String> successCriteria = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ContingencyPlan {
        private String trigger;

        @Builder.Default
        private List<PlanAction> actions = new ArrayList<>();

        @Builder.Default
        private List<String> rollbackPlan = new ArrayList<>();
    }
}
