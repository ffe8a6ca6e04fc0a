package com.faultline.triage.detection;

import com.faultline.triage.domain.model.AnalysisResult;
import com.faultline.triage.domain.model.FaultPattern;
import com.faultline.triage.domain.model.Incident;
import com.faultline.triage.observability.TriageStructuredLogger;
import com.faultline.triage.observability.TriageStructuredLogger.PatternEventType;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Default extraction: records the candidate and registers nothing.
 */
@Component
public class LoggingPatternExtractionStrategy implements PatternExtractionStrategy {

    private final TriageStructuredLogger structuredLogger;

    public LoggingPatternExtractionStrategy(TriageStructuredLogger structuredLogger) {
        this.structuredLogger = structuredLogger;
    }

    @Override
    public Optional<FaultPattern> extract(Incident incident, AnalysisResult analysis, String resolution) {
        structuredLogger.logPatternEvent(null, PatternEventType.EXTRACTION_SKIPPED,
                "No extraction strategy configured, incident left unclassified",
                Map.of("incidentId", incident.getId(),
                        "confidence", analysis.getConfidence(),
                        "resolution", String.valueOf(resolution)));
        return Optional.empty();
    }
}
