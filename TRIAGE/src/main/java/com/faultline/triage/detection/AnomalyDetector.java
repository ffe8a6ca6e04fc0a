package com.faultline.triage.detection;

import com.faultline.triage.client.NrqlRows;
import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.Anomaly;
import com.faultline.triage.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Static-baseline anomaly detector.
 * <p>
 * Mean and standard deviation are computed once over the whole series; every point further
 * than the configured number of deviations from the mean is an anomaly. Holds no state between calls.
 */
@Slf4j
@Component
public class AnomalyDetector {

    /** Series column to display name, in detection order */
    static final Map<String, String> SERIES_METRICS = new LinkedHashMap<>();

    static {
        SERIES_METRICS.put("response_time", "Response Time");
        SERIES_METRICS.put("throughput", "Throughput");
        SERIES_METRICS.put("error_rate", "Error Rate");
    }

    private final TriageProperties.Anomaly config;

    public AnomalyDetector(TriageProperties properties) {
        this.config = properties.getAnomaly();
    }

    /**
     * Detect anomalies in every known metric column of a time-bucketed series.
     */
    public List<Anomaly> detect(List<Map<String, Object>> rows, String entityGuid, String entityName) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, String> metric : SERIES_METRICS.entrySet()) {
            List<MetricPoint> points = rows.stream()
                    .map(row -> new MetricPoint(NrqlRows.timestamp(row), NrqlRows.optionalNumber(row, metric.getKey())))
                    .filter(point -> point.value() != null)
                    .collect(Collectors.toList());
            anomalies.addAll(detect(points, metric.getValue(), entityGuid, entityName));
        }
        log.debug("Detected {} anomalies for entity {} over {} rows", anomalies.size(), entityGuid, rows.size());
        return anomalies;
    }

    /**
     * Detect anomalies in a single metric series.
     *
     * @return anomalies in series order, empty when the series is too short or has no variance
     */
    public List<Anomaly> detect(List<MetricPoint> series, String metricName, String entityGuid, String entityName) {
        if (series.size() < config.getMinimumSamples()) {
            return List.of();
        }

        double mean = series.stream().mapToDouble(MetricPoint::value).average().orElse(0.0);
        double variance = series.stream()
                .mapToDouble(point -> Math.pow(point.value() - mean, 2))
                .sum() / series.size();
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0.0) {
            return List.of();
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (MetricPoint point : series) {
            double deviation = Math.abs(point.value() - mean) / stdDev;
            if (deviation <= config.getThreshold()) {
                continue;
            }
            anomalies.add(Anomaly.builder()
                    .timestamp(point.timestamp())
                    .entityGuid(entityGuid)
                    .entityName(entityName)
                    .metricName(metricName)
                    .actualValue(point.value())
                    .expectedValue(mean)
                    .deviation(deviation)
                    .severity(severityFor(deviation))
                    .type(point.value() > mean ? Anomaly.Direction.SPIKE : Anomaly.Direction.DROP)
                    .confidence(Math.min(deviation / config.getConfidenceScale(), 1.0))
                    .build());
        }
        return anomalies;
    }

    Severity severityFor(double deviation) {
        if (deviation > config.getCriticalAbove()) {
            return Severity.CRITICAL;
        }
        if (deviation > config.getHighAbove()) {
            return Severity.HIGH;
        }
        if (deviation > config.getMediumAbove()) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    public record MetricPoint(Instant timestamp, Double value) {}
}
