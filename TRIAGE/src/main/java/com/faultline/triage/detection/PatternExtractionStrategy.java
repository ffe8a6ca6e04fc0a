package com.faultline.triage.detection;

import com.faultline.triage.domain.model.AnalysisResult;
import com.faultline.triage.domain.model.FaultPattern;
import com.faultline.triage.domain.model.Incident;

import java.util.Optional;

/**
 * Derives a new fault pattern from an incident that matched no known pattern.
 */
public interface PatternExtractionStrategy {

    /**
     * @param incident   the resolved incident
     * @param analysis   comprehensive analysis of that incident
     * @param resolution how the incident was resolved
     * @return a pattern to register, or empty to register nothing
     */
    Optional<FaultPattern> extract(Incident incident, AnalysisResult analysis, String resolution);
}
