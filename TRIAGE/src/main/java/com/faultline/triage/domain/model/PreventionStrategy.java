package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreventionStrategy {
    /** testing, monitoring, infrastructure */
    private String type;
    private String description;
    private String implementation;
    private Severity effort;
    private Severity impact;
}
