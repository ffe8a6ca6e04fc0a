package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Alert incident as reported by the telemetry platform. Read-only here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    /** Platform incident identifier */
    private String id;

    private Instant openedAt;

    /** Null while the incident is still open */
    private Instant closedAt;

    private String description;

    @Builder.Default
    private IncidentState state = IncidentState.OPEN;

    @Builder.Default
    private IncidentPriority priority = IncidentPriority.NORMAL;

    private String policyId;
    private String policyName;
    private String conditionId;
    private String conditionName;
    private String violationUrl;

    /** Primary affected entity, if the platform attached one */
    private String entityId;
    private String entityName;
    private String entityType;

    @Builder.Default
    private List<Violation> violations = new ArrayList<>();

    private Acknowledgement acknowledgement;

    public boolean isClosed() {
        return closedAt != null || state == IncidentState.CLOSED;
    }

    /**
     * Minutes from open to close, or to {@code now} while open, rounded to the nearest minute.
     */
    public long durationMinutes(Instant now) {
        Instant end = closedAt != null ? closedAt : now;
        return Math.round(Duration.between(openedAt, end).toMillis() / 60_000.0);
    }

    public enum IncidentState {
        OPEN, ACKNOWLEDGED, CLOSED;

        public static IncidentState fromValue(String value) {
            if (value == null) {
                return OPEN;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "closed" -> CLOSED;
                case "acknowledged" -> ACKNOWLEDGED;
                default -> OPEN;
            };
        }
    }

    public enum IncidentPriority {
        CRITICAL, HIGH, NORMAL, LOW;

        public static IncidentPriority fromValue(String value) {
            if (value == null) {
                return NORMAL;
            }
            return switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "critical" -> CRITICAL;
                case "high" -> HIGH;
                case "low" -> LOW;
                default -> NORMAL;
            };
        }

        public Severity toSeverity() {
            return switch (this) {
                case CRITICAL -> Severity.CRITICAL;
                case HIGH -> Severity.HIGH;
                case NORMAL -> Severity.MEDIUM;
                case LOW -> Severity.LOW;
            };
        }
    }

    /**
     * A threshold violation that contributed to the incident.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Violation {
        private String id;
        private String label;
        private long durationSeconds;
        private Instant openedAt;
        private Instant closedAt;
        private String metricName;
        private double metricValue;
        private double thresholdValue;
        private String entityId;
        private String entityName;
        private String entityType;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Acknowledgement {
        private Instant acknowledgedAt;
        private String acknowledgedBy;
    }
}
