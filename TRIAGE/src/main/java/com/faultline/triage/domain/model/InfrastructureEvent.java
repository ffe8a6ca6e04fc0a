package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InfrastructureEvent {

    private Instant timestamp;

    /** host_down, high_cpu, high_memory, disk_full, network_issue */
    private String type;

    private String hostname;
    private String description;

    @Builder.Default
    private Severity severity = Severity.MEDIUM;

    @Builder.Default
    private Map<String, Object> attributes = new HashMap<>();
}
