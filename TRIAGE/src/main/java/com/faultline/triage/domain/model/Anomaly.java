package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A metric value that deviates from the series baseline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Anomaly {

    private Instant timestamp;
    private String entityGuid;
    private String entityName;
    private String metricName;

    private double actualValue;

    /** Series mean */
    private double expectedValue;

    /** Distance from the mean in standard deviations */
    private double deviation;

    private Severity severity;
    private Direction type;

    /** 0.0 to 1.0 */
    private double confidence;

    public enum Direction {
        SPIKE, DROP
    }
}
