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
public class ErrorEvent {

    private Instant timestamp;
    private String message;
    private String stackTrace;
    private String entityGuid;
    private String entityName;

    @Builder.Default
    private Map<String, Object> attributes = new HashMap<>();
}
