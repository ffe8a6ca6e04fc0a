package com.faultline.triage.observability;

import com.faultline.triage.domain.model.AnalysisResult;
import com.faultline.triage.domain.model.IncidentAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging for the TRIAGE engine.
 * <p>
 * Emits {@code message | data={...}} lines with MDC context for:
 * <ul>
 *     <li>Analysis stage lifecycle per incident</li>
 *     <li>Completed incident and comprehensive analyses</li>
 *     <li>Telemetry query execution</li>
 *     <li>Fault pattern registry changes</li>
 * </ul>
 */
@Slf4j
@Component
public class TriageStructuredLogger {

    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_PATTERN_ID = "patternId";

    private static final int MAX_QUERY_LENGTH = 500;
    private static final long SLOW_QUERY_MS = 5000;

    /**
     * Log an analysis lifecycle event.
     */
    public void logAnalysisEvent(String incidentId, AnalysisEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_INCIDENT_ID, incidentId != null ? incidentId : ""))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("incidentId", incidentId);
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                case PARTIAL_DATA -> log.warn("{} | data={}", message, formatLogData(logData));
                case CACHE_HIT -> log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * A telemetry sub-fetch failed and was replaced with empty data.
     */
    public void logPartialData(String incidentId, String source, Throwable error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", source);
        details.put("error", error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        logAnalysisEvent(incidentId, AnalysisEventType.PARTIAL_DATA,
                "Failed to collect " + source + ", continuing with empty data", details);
    }

    public void logIncidentAnalysis(String incidentId, IncidentAnalysis analysis) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("possibleCauses", analysis.getPossibleCauses().size());
        details.put("correlatedEvents", analysis.getCorrelatedEvents().size());
        details.put("recommendations", analysis.getRecommendations().size());
        details.put("confidence", analysis.getConfidence());
        if (analysis.getMetrics() != null) {
            details.put("severity", analysis.getMetrics().getSeverity());
            details.put("impactScore", analysis.getMetrics().getImpactScore());
        }
        logAnalysisEvent(incidentId, AnalysisEventType.COMPLETED, "Completed incident analysis", details);
    }

    public void logIncidentAnalysis(String incidentId, AnalysisResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("patterns", result.getDetectedPatterns().size());
        details.put("anomalies", result.getAnomalies().size());
        details.put("errorPatterns", result.getErrorPatterns().size());
        details.put("correlatedEvents", result.getCorrelatedEvents().size());
        details.put("confidence", result.getConfidence());
        if (result.getRiskAssessment() != null) {
            details.put("risk", result.getRiskAssessment().getCurrentRisk());
            details.put("escalationProbability", result.getRiskAssessment().getEscalationProbability());
        }
        logAnalysisEvent(incidentId, AnalysisEventType.COMPLETED, "Completed comprehensive analysis", details);
    }

    public void logQueryExecution(String query, int resultCount, long durationMs) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", "QUERY_EXECUTED");
        logData.put("query", abbreviate(query.replaceAll("\\s+", " ").trim()));
        logData.put("resultCount", resultCount);
        logData.put("durationMs", durationMs);

        if (durationMs > SLOW_QUERY_MS) {
            log.warn("Slow telemetry query took {}ms | data={}", durationMs, formatLogData(logData));
        } else {
            log.debug("Executed telemetry query | data={}", formatLogData(logData));
        }
    }

    /**
     * Log a fault pattern registry event.
     */
    public void logPatternEvent(String patternId, PatternEventType eventType,
                                String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_PATTERN_ID, patternId != null ? patternId : ""))) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("patternId", patternId);
            if (details != null) {
                logData.putAll(details);
            }
            log.info("{} | data={}", message, formatLogData(logData));
        }
    }

    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private String abbreviate(String query) {
        return query.length() <= MAX_QUERY_LENGTH ? query : query.substring(0, MAX_QUERY_LENGTH) + "...";
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    public enum AnalysisEventType {
        STARTED, COMPLETED, FAILED, CACHE_HIT, PARTIAL_DATA
    }

    public enum PatternEventType {
        OCCURRENCE_RECORDED, PATTERN_ADDED, PATTERN_REPLACED, EXTRACTION_SKIPPED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
