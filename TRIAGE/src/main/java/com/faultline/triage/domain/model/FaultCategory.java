package com.faultline.triage.domain.model;

public enum FaultCategory {
    PERFORMANCE_DEGRADATION,
    ERROR_SPIKE,
    RESOURCE_EXHAUSTION,
    CASCADE_FAILURE,
    EXTERNAL_DEPENDENCY
}
