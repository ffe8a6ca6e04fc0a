package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One weighted condition of a fault signature.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternIndicator {

    /** Metric key, e.g. response_time, error_rate, memory_usage */
    private String metric;

    private Condition condition;

    private double threshold;

    /** Minutes the condition is expected to hold */
    private int durationMinutes;

    /** Importance of this indicator, 0.0 to 1.0 */
    private double weight;

    public enum Condition {
        ABOVE, BELOW, EQUALS, SPIKE, DROP
    }
}
