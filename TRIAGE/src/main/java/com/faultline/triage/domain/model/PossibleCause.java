package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Candidate root cause with its supporting evidence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PossibleCause {

    private CauseType type;
    private String description;

    /** 0.0 to 1.0 */
    private double probability;

    @Builder.Default
    private List<Evidence> evidence = new ArrayList<>();

    private String mitigation;
}
