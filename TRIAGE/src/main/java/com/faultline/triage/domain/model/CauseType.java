package com.faultline.triage.domain.model;

import java.util.Locale;

/**
 * Root cause hypothesis categories.
 */
public enum CauseType {
    CODE_DEPLOYMENT,
    RESOURCE_EXHAUSTION,
    EXTERNAL_DEPENDENCY,
    INFRASTRUCTURE_ISSUE,
    CONFIGURATION_CHANGE,
    UNKNOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** "code deployment" style label for titles */
    public String label() {
        return wireName().replace('_', ' ');
    }
}
