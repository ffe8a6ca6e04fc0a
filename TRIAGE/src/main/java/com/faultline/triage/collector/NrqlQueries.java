package com.faultline.triage.collector;

import com.faultline.triage.domain.model.TimeRange;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * NRQL text for the telemetry fetched around an incident.
 */
public final class NrqlQueries {

    private NrqlQueries() {
    }

    public static String entityMetrics(String entityId, String since) {
        return """
                SELECT average(duration) AS responseTime, \
                rate(count(*), 1 minute) AS throughput, \
                percentage(count(*), WHERE error IS true) AS errorRate, \
                apdex(duration, t: 0.5) AS apdexScore \
                FROM Transaction WHERE appId = %s SINCE %s""".formatted(literal(entityId), since);
    }

    public static String performanceSeries(String entityId, TimeRange range, int bucketMinutes) {
        return """
                SELECT average(duration) AS responseTime, \
                rate(count(*), 1 minute) AS throughput, \
                percentage(count(*), WHERE error IS true) AS errorRate, \
                apdex(duration, t: 0.5) AS apdexScore \
                FROM Transaction WHERE appId = %s %s TIMESERIES %d minutes"""
                .formatted(literal(entityId), window(range), bucketMinutes);
    }

    /**
     * Series with snake_case column names, as consumed by anomaly detection.
     */
    public static String anomalySeries(String entityId, TimeRange range, int bucketMinutes) {
        return """
                SELECT average(duration) AS response_time, \
                rate(count(*), 1 minute) AS throughput, \
                percentage(count(*), WHERE error IS true) AS error_rate \
                FROM Transaction WHERE appId = %s %s TIMESERIES %d minutes"""
                .formatted(literal(entityId), window(range), bucketMinutes);
    }

    public static String errorEvents(Collection<String> entityIds, TimeRange range, int limit) {
        return """
                SELECT message, error.class, transactionName, appId, appName, timestamp \
                FROM TransactionError WHERE appId IN (%s) %s LIMIT %d"""
                .formatted(literals(entityIds), window(range), limit);
    }

    public static String deployments(Collection<String> entityIds, TimeRange range, int limit) {
        return """
                SELECT timestamp, appId, appName, revision, description, user, changelog \
                FROM Deployment WHERE appId IN (%s) %s LIMIT %d"""
                .formatted(literals(entityIds), window(range), limit);
    }

    public static String infrastructureEvents(TimeRange range, int limit) {
        return """
                SELECT timestamp, type, hostname, description, severity \
                FROM InfrastructureEvent %s LIMIT %d"""
                .formatted(window(range), limit);
    }

    static String window(TimeRange range) {
        return "SINCE " + range.since().toEpochMilli() + " UNTIL " + range.until().toEpochMilli();
    }

    /**
     * Numeric ids are inlined, anything else becomes a quoted string literal.
     */
    static String literal(String value) {
        if (value.matches("\\d+")) {
            return value;
        }
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private static String literals(Collection<String> values) {
        return values.stream().map(NrqlQueries::literal).collect(Collectors.joining(", "));
    }
}
