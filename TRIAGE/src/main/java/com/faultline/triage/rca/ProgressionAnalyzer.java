package com.faultline.triage.rca;

import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.ErrorEvent;
import com.faultline.triage.domain.model.IncidentDataCollection;
import com.faultline.triage.domain.model.PerformanceSnapshot;
import com.faultline.triage.domain.model.ProgressionAnalysis;
import com.faultline.triage.domain.model.ProgressionAnalysis.InterventionPoint;
import com.faultline.triage.domain.model.ProgressionAnalysis.ProgressionStage;
import com.faultline.triage.domain.model.ProgressionAnalysis.Speed;
import com.faultline.triage.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Reconstructs how a fault progressed: detection, performance degradation, error escalation.
 * Jump, spike and speed tiers come from {@link TriageProperties.Progression}.
 */
@Slf4j
@Component
public class ProgressionAnalyzer {

    static final String DETECTION = "Detection";
    static final String DEGRADATION = "Degradation";
    static final String ERROR_ESCALATION = "Error Escalation";
    static final String SERVICE_FAILURE = "Service Failure";

    private final TriageProperties.Progression config;

    public ProgressionAnalyzer(TriageProperties properties) {
        this.config = properties.getProgression();
    }

    public ProgressionAnalysis analyze(IncidentDataCollection data) {
        List<ProgressionStage> stages = new ArrayList<>();

        stages.add(ProgressionStage.builder()
                .name(DETECTION)
                .description("Incident first detected by monitoring systems")
                .timestamp(data.getIncident().getOpenedAt())
                .indicators(new ArrayList<>(List.of("Alert triggered", "Threshold exceeded")))
                .severity(Severity.MEDIUM)
                .build());

        for (DegradationPoint point : degradationPoints(data.getPerformanceData())) {
            stages.add(ProgressionStage.builder()
                    .name(DEGRADATION)
                    .description("Performance degradation detected: " + point.metric())
                    .timestamp(point.timestamp())
                    .indicators(new ArrayList<>(List.of(String.format(Locale.ROOT, "%s %s by %.1f%s",
                            point.metric(), point.change() > 0 ? "increased" : "decreased",
                            Math.abs(point.change()), point.percent() ? "%" : " points"))))
                    .severity(severityFromChange(point.change()))
                    .build());
        }

        for (ErrorSpike spike : errorSpikes(data.getErrorEvents())) {
            stages.add(ProgressionStage.builder()
                    .name(ERROR_ESCALATION)
                    .description("Error rate spike detected")
                    .timestamp(spike.timestamp())
                    .indicators(new ArrayList<>(List.of(
                            spike.errorCount() + " errors in " + config.getSpikeWindowMinutes() + " minutes")))
                    .severity(spikeSeverity(spike.errorCount()))
                    .build());
        }

        stages.sort(Comparator.comparing(ProgressionStage::getTimestamp));
        String current = stages.get(stages.size() - 1).getName();

        return ProgressionAnalysis.builder()
                .stages(stages)
                .currentStage(current)
                .nextLikelyStage(nextStage(current))
                .progressionSpeed(speed(stages))
                .interventionPoints(interventionPoints(stages))
                .build();
    }

    /**
     * Consecutive-snapshot jumps, compared per entity: response time up by more than the jump
     * percentage, or error rate up by more than the jump points. Snapshots without a timestamp
     * or value are skipped.
     */
    List<DegradationPoint> degradationPoints(List<PerformanceSnapshot> snapshots) {
        Map<String, List<PerformanceSnapshot>> byEntity = snapshots.stream()
                .filter(s -> s.getTimestamp() != null)
                .collect(Collectors.groupingBy(s -> Objects.toString(s.getEntityId(), ""),
                        LinkedHashMap::new, Collectors.toList()));

        List<DegradationPoint> points = new ArrayList<>();
        for (List<PerformanceSnapshot> series : byEntity.values()) {
            for (int i = 1; i < series.size(); i++) {
                PerformanceSnapshot previous = series.get(i - 1);
                PerformanceSnapshot current = series.get(i);

                if (nonZero(previous.getResponseTime()) && nonZero(current.getResponseTime())) {
                    double change = (current.getResponseTime() - previous.getResponseTime())
                            / previous.getResponseTime() * 100;
                    if (change > config.getResponseTimeJumpPercent()) {
                        points.add(new DegradationPoint(current.getTimestamp(), "response_time", change, true));
                    }
                }

                if (nonZero(previous.getErrorRate()) && nonZero(current.getErrorRate())) {
                    double change = current.getErrorRate() - previous.getErrorRate();
                    if (change > config.getErrorRateJumpPoints()) {
                        points.add(new DegradationPoint(current.getTimestamp(), "error_rate", change, false));
                    }
                }
            }
        }
        return points;
    }

    /**
     * Fixed windows holding more than the spike factor times the average errors per non-empty window.
     */
    List<ErrorSpike> errorSpikes(List<ErrorEvent> errors) {
        Map<Long, List<ErrorEvent>> windows = new LinkedHashMap<>();
        long windowMillis = Duration.ofMinutes(config.getSpikeWindowMinutes()).toMillis();
        for (ErrorEvent error : errors) {
            if (error.getTimestamp() != null) {
                windows.computeIfAbsent(Math.floorDiv(error.getTimestamp().toEpochMilli(), windowMillis),
                        k -> new ArrayList<>()).add(error);
            }
        }
        if (windows.isEmpty()) {
            return List.of();
        }

        double average = windows.values().stream().mapToInt(List::size).sum() / (double) windows.size();
        return windows.values().stream()
                .filter(window -> window.size() > average * config.getSpikeFactor())
                .map(window -> new ErrorSpike(window.get(0).getTimestamp(), window.size()))
                .collect(Collectors.toList());
    }

    Severity severityFromChange(double change) {
        double magnitude = Math.abs(change);
        if (magnitude > config.getCriticalChange()) {
            return Severity.CRITICAL;
        }
        if (magnitude > config.getHighChange()) {
            return Severity.HIGH;
        }
        if (magnitude > config.getMediumChange()) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    Severity spikeSeverity(int errorCount) {
        if (errorCount > config.getSpikeCriticalCount()) {
            return Severity.CRITICAL;
        }
        if (errorCount > config.getSpikeHighCount()) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }

    /**
     * Stages per hour between the first and last stage. Stages sharing one instant count as critical.
     */
    Speed speed(List<ProgressionStage> stages) {
        if (stages.size() < 2) {
            return Speed.SLOW;
        }
        double minutes = Duration.between(stages.get(0).getTimestamp(),
                stages.get(stages.size() - 1).getTimestamp()).toMillis() / 60_000.0;
        double perHour = stages.size() / minutes * 60;
        if (perHour > config.getCriticalPerHour()) {
            return Speed.CRITICAL;
        }
        if (perHour > config.getFastPerHour()) {
            return Speed.FAST;
        }
        if (perHour > config.getModeratePerHour()) {
            return Speed.MODERATE;
        }
        return Speed.SLOW;
    }

    List<InterventionPoint> interventionPoints(List<ProgressionStage> stages) {
        return stages.stream()
                .filter(stage -> stage.getSeverity() == Severity.MEDIUM || stage.getSeverity() == Severity.HIGH)
                .map(stage -> InterventionPoint.builder()
                        .stage(stage.getName())
                        .action("Intervene during " + stage.getName() + " stage to prevent escalation")
                        .effectiveness(stage.getSeverity() == Severity.HIGH
                                ? config.getHighInterventionEffectiveness()
                                : config.getMediumInterventionEffectiveness())
                        .timeWindowMinutes(config.getInterventionWindowMinutes())
                        .build())
                .collect(Collectors.toList());
    }

    static String nextStage(String current) {
        return switch (current) {
            case DETECTION -> DEGRADATION;
            case DEGRADATION -> ERROR_ESCALATION;
            case ERROR_ESCALATION -> SERVICE_FAILURE;
            default -> null;
        };
    }

    private static boolean nonZero(Double value) {
        return value != null && value != 0;
    }

    record DegradationPoint(Instant timestamp, String metric, double change, boolean percent) {}

    record ErrorSpike(Instant timestamp, int errorCount) {}
}
