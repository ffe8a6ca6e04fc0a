package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Evidence {

    private EvidenceType type;
    private String description;
    private Instant timestamp;
    private String source;

    public enum EvidenceType {
        DEPLOYMENT, ERROR_SPIKE, PERFORMANCE_DEGRADATION, METRIC_ANOMALY, INFRASTRUCTURE_EVENT
    }
}
