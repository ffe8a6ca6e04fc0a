package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentMetrics {

    private long durationMinutes;

    private IncidentSeverity severity;

    /** 0 to 100 */
    private int impactScore;

    private String businessImpact;

    public enum IncidentSeverity {
        INFO, WARNING, CRITICAL
    }
}
