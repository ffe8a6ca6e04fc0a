package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A ranked cause inside a root cause analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cause {

    private CauseType type;
    private String description;
    private double probability;

    /** Derived from probability: high above 0.7, medium above 0.4, else low */
    private Severity impact;

    @Builder.Default
    private List<Evidence> evidence = new ArrayList<>();

    @Builder.Default
    private List<Instant> timeline = new ArrayList<>();
}
