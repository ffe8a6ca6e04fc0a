package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Time-boxed recommendation produced by a comprehensive analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRecommendation {

    private Priority priority;
    private Category category;
    private String title;
    private String description;

    @Builder.Default
    private List<String> actions = new ArrayList<>();

    private String expectedOutcome;

    private int timeEstimateMinutes;

    public enum Priority {
        IMMEDIATE, HIGH, MEDIUM, LOW
    }

    public enum Category {
        INVESTIGATION, MITIGATION, ESCALATION, COMMUNICATION
    }
}
