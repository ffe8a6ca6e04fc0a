package com.faultline.triage.detection;

import com.faultline.triage.domain.model.FaultCategory;
import com.faultline.triage.domain.model.FaultPattern;
import com.faultline.triage.domain.model.PatternIndicator;
import com.faultline.triage.domain.model.PatternIndicator.Condition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fault signatures the registry starts with.
 */
final class StarterPatterns {

    private StarterPatterns() {
    }

    static List<FaultPattern> create(Instant seededAt) {
        List<FaultPattern> patterns = new ArrayList<>();

        patterns.add(FaultPattern.builder()
                .id("memory_leak_pattern")
                .name("Memory Leak Pattern")
                .description("Gradual increase in memory usage leading to performance degradation")
                .type(FaultCategory.RESOURCE_EXHAUSTION)
                .indicators(new ArrayList<>(List.of(
                        indicator("memory_usage", Condition.ABOVE, 80, 30, 0.8),
                        indicator("response_time", Condition.ABOVE, 2000, 15, 0.6),
                        indicator("gc_time", Condition.ABOVE, 100, 10, 0.7))))
                .confidence(0.85)
                .frequency(12)
                .lastSeen(seededAt)
                .build());

        patterns.add(FaultPattern.builder()
                .id("database_connection_exhaustion")
                .name("Database Connection Pool Exhaustion")
                .description("Database connection pool reaches maximum capacity")
                .type(FaultCategory.RESOURCE_EXHAUSTION)
                .indicators(new ArrayList<>(List.of(
                        indicator("database_connections", Condition.ABOVE, 90, 5, 0.9),
                        indicator("database_response_time", Condition.ABOVE, 5000, 10, 0.7),
                        indicator("error_rate", Condition.ABOVE, 5, 5, 0.6))))
                .confidence(0.9)
                .frequency(8)
                .lastSeen(seededAt)
                .build());

        patterns.add(FaultPattern.builder()
                .id("cascade_failure_pattern")
                .name("Cascade Failure Pattern")
                .description("Failure in one service causing failures in dependent services")
                .type(FaultCategory.CASCADE_FAILURE)
                .indicators(new ArrayList<>(List.of(
                        indicator("error_rate", Condition.SPIKE, 10, 5, 0.8),
                        indicator("response_time", Condition.SPIKE, 3000, 5, 0.7),
                        indicator("throughput", Condition.DROP, 50, 10, 0.6))))
                .confidence(0.75)
                .frequency(15)
                .lastSeen(seededAt)
                .build());

        return patterns;
    }

    private static PatternIndicator indicator(String metric, Condition condition, double threshold,
                                              int durationMinutes, double weight) {
        return PatternIndicator.builder()
                .metric(metric)
                .condition(condition)
                .threshold(threshold)
                .durationMinutes(durationMinutes)
                .weight(weight)
                .build();
    }
}
