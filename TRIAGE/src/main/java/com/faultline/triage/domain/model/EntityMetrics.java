package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate health metrics of one entity over the recent window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityMetrics {

    /** Average response time (ms) */
    private double responseTime;

    /** Requests per minute */
    private double throughput;

    /** Error percentage, 0-100 */
    private double errorRate;

    private double apdexScore;

    /** Only present when host metrics are available */
    private Double cpuUsage;
    private Double memoryUsage;

    public static EntityMetrics empty() {
        return EntityMetrics.builder().build();
    }
}
