package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A past incident that matched a fault pattern.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FaultExample {
    private String incidentId;
    private Instant timestamp;
    private Severity severity;
    private long durationMinutes;
    private String resolution;
}
