package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentCorrelation {

    private DeploymentEvent deployment;

    /** 0.0 to 1.0 */
    private double correlation;

    /** Minutes between deployment and incident open */
    private double timeGapMinutes;

    private double confidence;

    private Impact impact;

    public enum Impact {
        LIKELY_CAUSE, POSSIBLE_CAUSE, COINCIDENTAL
    }
}
