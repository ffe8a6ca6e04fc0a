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
public class TimelineEvent {

    private Instant timestamp;

    /** incident_opened, violation_started, violation_ended, incident_acknowledged, incident_closed */
    private String type;

    private String description;

    private String source;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
