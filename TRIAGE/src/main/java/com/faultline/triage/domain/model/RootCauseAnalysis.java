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
public class RootCauseAnalysis {

    private Cause primaryCause;

    /** Next three causes after the primary one */
    @Builder.Default
    private List<Cause> contributingFactors = new ArrayList<>();

    @Builder.Default
    private List<Evidence> evidenceChain = new ArrayList<>();

    private double confidenceScore;

    private String analysisMethod;

    @Builder.Default
    private List<Recommendation> recommendations = new ArrayList<>();

    @Builder.Default
    private List<PreventionStrategy> preventionStrategies = new ArrayList<>();
}
