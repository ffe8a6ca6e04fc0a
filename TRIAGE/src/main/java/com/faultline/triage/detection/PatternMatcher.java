package com.faultline.triage.detection;

import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.FaultExample;
import com.faultline.triage.domain.model.FaultPattern;
import com.faultline.triage.domain.model.Incident;
import com.faultline.triage.domain.model.PatternIndicator;
import com.faultline.triage.domain.model.PerformanceSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Scores collected performance data against weighted fault signatures.
 * <p>
 * An indicator matches when any snapshot satisfies its condition. Pattern confidence is the
 * matched share of the total indicator weight.
 */
@Slf4j
@Component
public class PatternMatcher {

    private final TriageProperties.Patterns config;

    public PatternMatcher(TriageProperties properties) {
        this.config = properties.getPatterns();
    }

    /**
     * Patterns whose confidence exceeds the detection threshold, as copies carrying the match
     * confidence and this incident as their newest example. The given patterns are not modified.
     */
    public List<FaultPattern> detect(List<FaultPattern> patterns, List<PerformanceSnapshot> snapshots,
                                     Incident incident, Instant now) {
        List<FaultPattern> detected = new ArrayList<>();
        for (FaultPattern pattern : patterns) {
            double confidence = evaluate(pattern, snapshots);
            if (confidence > config.getDetectionThreshold()) {
                FaultPattern match = pattern.copy();
                match.setConfidence(confidence);
                match.setExamples(pattern.examplesWith(exampleOf(incident, now, null), config.getMaxExamples()));
                detected.add(match);
            } else {
                log.trace("Pattern {} below detection threshold: {}", pattern.getId(), confidence);
            }
        }
        return detected;
    }

    /**
     * @return matched weight over total weight, 0 when the pattern has no weight
     */
    public double evaluate(FaultPattern pattern, List<PerformanceSnapshot> snapshots) {
        double totalWeight = pattern.totalWeight();
        if (totalWeight <= 0) {
            return 0.0;
        }
        double matchedWeight = pattern.getIndicators().stream()
                .filter(indicator -> matches(indicator, snapshots))
                .mapToDouble(PatternIndicator::getWeight)
                .sum();
        return Math.min(1.0, Math.max(0.0, matchedWeight / totalWeight));
    }

    public boolean matches(PatternIndicator indicator, List<PerformanceSnapshot> snapshots) {
        for (PerformanceSnapshot snapshot : snapshots) {
            Double value = metricValue(snapshot, indicator.getMetric());
            if (value != null && satisfies(indicator, value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Snapshot value for an indicator metric key. Null when snapshots do not carry the metric
     * or this snapshot is missing it, which never matches.
     */
    public static Double metricValue(PerformanceSnapshot snapshot, String metric) {
        return switch (metric) {
            case "response_time" -> snapshot.getResponseTime();
            case "error_rate" -> snapshot.getErrorRate();
            case "throughput" -> snapshot.getThroughput();
            case "memory_usage" -> snapshot.getMemoryUsage();
            case "cpu_usage" -> snapshot.getCpuUsage();
            default -> null;
        };
    }

    public static FaultExample exampleOf(Incident incident, Instant now, String resolution) {
        return FaultExample.builder()
                .incidentId(incident.getId())
                .timestamp(incident.getOpenedAt())
                .severity(incident.getPriority().toSeverity())
                .durationMinutes(incident.durationMinutes(now))
                .resolution(resolution)
                .build();
    }

    private boolean satisfies(PatternIndicator indicator, double value) {
        double threshold = indicator.getThreshold();
        return switch (indicator.getCondition()) {
            case ABOVE -> value > threshold;
            case BELOW -> value < threshold;
            case EQUALS -> Math.abs(value - threshold) < config.getEqualsTolerance();
            case SPIKE -> value > threshold * config.getSpikeFactor();
            case DROP -> value < threshold * config.getDropFactor();
        };
    }
}
