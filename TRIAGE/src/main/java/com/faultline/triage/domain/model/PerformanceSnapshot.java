package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One time bucket of an entity's performance. Collections keep snapshots ordered by timestamp.
 * A metric the query did not return is null, never zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceSnapshot {

    private Instant timestamp;
    private String entityId;
    private String entityName;

    private Double responseTime;
    private Double throughput;
    private Double errorRate;
    private Double apdexScore;

    private Double cpuUsage;
    private Double memoryUsage;
}
