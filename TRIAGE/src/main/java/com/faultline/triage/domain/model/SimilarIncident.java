package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarIncident {

    private Incident incident;
    private double similarity;

    @Builder.Default
    private List<String> commonFactors = new ArrayList<>();

    /** "Resolved" or "Ongoing" */
    private String resolution;

    /** Null while the historical incident is still open */
    private Long timeToResolveMinutes;
}
