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
public class FailurePoint {

    private String system;
    private String component;
    private String failureMode;
    private double probability;
    private Severity impact;

    @Builder.Default
    private List<String> mitigations = new ArrayList<>();

    public double riskScore() {
        return probability * impact.getImpactScore();
    }
}
