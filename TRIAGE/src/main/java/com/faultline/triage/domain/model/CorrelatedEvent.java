package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A nearby event scored for temporal relatedness to an incident.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrelatedEvent {

    private Instant timestamp;
    private EventType type;
    private String description;

    /** 0.0 to 1.0 */
    private double correlationScore;

    private String source;

    public enum EventType {
        DEPLOYMENT, INFRASTRUCTURE
    }
}
