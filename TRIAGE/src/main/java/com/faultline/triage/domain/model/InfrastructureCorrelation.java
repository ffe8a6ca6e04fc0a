package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InfrastructureCorrelation {

    private InfrastructureEvent event;
    private double correlation;
    private double timeGapMinutes;
    private double confidence;
    private Impact impact;

    public enum Impact {
        DIRECT_CAUSE, CONTRIBUTING_FACTOR, UNRELATED
    }
}
