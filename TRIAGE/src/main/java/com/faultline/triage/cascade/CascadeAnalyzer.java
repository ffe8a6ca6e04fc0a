package com.faultline.triage.cascade;

import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.AffectedEntity;
import com.faultline.triage.domain.model.CascadeAnalysis;
import com.faultline.triage.domain.model.CascadeAnalysis.CascadeStep;
import com.faultline.triage.domain.model.CascadeAnalysis.RecoveryStep;
import com.faultline.triage.domain.model.EntityMetrics;
import com.faultline.triage.domain.model.FailurePoint;
import com.faultline.triage.domain.model.IncidentAnalysis;
import com.faultline.triage.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Cascade chain, containment and recovery planning over the affected entities.
 * <p>
 * Entity order is taken as the propagation order: the first entity is the primary failure and
 * each later entity depends on the one before it. No service topology is consulted.
 */
@Slf4j
@Component
public class CascadeAnalyzer {

    private final int recoveryStepMinutes;

    public CascadeAnalyzer(TriageProperties properties) {
        this.recoveryStepMinutes = properties.getCascade().getRecoveryStepMinutes();
    }

    public CascadeAnalysis analyze(IncidentAnalysis analysis) {
        List<CascadeStep> chain = cascadeChain(analysis);
        List<String> affectedSystems = analysis.getAffectedEntities().stream()
                .map(AffectedEntity::getName)
                .collect(Collectors.toList());

        return CascadeAnalysis.builder()
                .primaryFailure(primaryFailure(analysis))
                .cascadeChain(chain)
                .affectedSystems(affectedSystems)
                .containmentStrategies(containmentStrategies(chain))
                .recoveryPlan(recoveryPlan(chain))
                .build();
    }

    static String primaryFailure(IncidentAnalysis analysis) {
        if (!analysis.getPossibleCauses().isEmpty()) {
            return analysis.getPossibleCauses().get(0).getType().wireName();
        }
        if (!analysis.getAffectedEntities().isEmpty()) {
            return analysis.getAffectedEntities().get(0).getName();
        }
        return "Unknown primary failure";
    }

    List<CascadeStep> cascadeChain(IncidentAnalysis analysis) {
        List<CascadeStep> chain = new ArrayList<>();
        for (AffectedEntity entity : analysis.getAffectedEntities()) {
            boolean primary = chain.isEmpty();
            chain.add(CascadeStep.builder()
                    .system(entity.getName())
                    .failureMode(primary ? "Primary failure point" : "Cascade failure")
                    .timestamp(analysis.getIncident().getOpenedAt())
                    .impact(entity.getImpactLevel())
                    .dependencies(primary
                            ? new ArrayList<>()
                            : new ArrayList<>(List.of(chain.get(chain.size() - 1).getSystem())))
                    .build());
        }
        return chain;
    }

    static List<String> containmentStrategies(List<CascadeStep> chain) {
        List<String> strategies = new ArrayList<>();
        if (chain.size() > 1) {
            strategies.add("Isolate primary failure point to prevent further cascade");
            strategies.add("Implement circuit breakers on dependent services");
            strategies.add("Scale up healthy instances to handle redirected traffic");
        }
        strategies.add("Monitor system boundaries for early cascade detection");
        strategies.add("Prepare rollback procedures for recent changes");
        return strategies;
    }

    /**
     * Restore the most downstream system first; each step waits for the one before it.
     */
    List<RecoveryStep> recoveryPlan(List<CascadeStep> chain) {
        List<CascadeStep> reversed = new ArrayList<>(chain);
        Collections.reverse(reversed);

        List<RecoveryStep> plan = new ArrayList<>();
        for (int i = 0; i < reversed.size(); i++) {
            String system = reversed.get(i).getSystem();
            plan.add(RecoveryStep.builder()
                    .order(i + 1)
                    .action("Restore " + system)
                    .system(system)
                    .estimatedTimeMinutes(recoveryStepMinutes)
                    .dependencies(i > 0
                            ? new ArrayList<>(List.of(reversed.get(i - 1).getSystem()))
                            : new ArrayList<>())
                    .rollbackPlan("Rollback " + system + " to previous stable state")
                    .build());
        }
        return plan;
    }

    /**
     * Likely failure points per entity, highest probability x impact first.
     */
    public List<FailurePoint> failurePoints(IncidentAnalysis analysis) {
        List<FailurePoint> points = new ArrayList<>();

        for (AffectedEntity entity : analysis.getAffectedEntities()) {
            EntityMetrics metrics = entity.getMetrics();

            if (metrics.getResponseTime() > 2000) {
                points.add(FailurePoint.builder()
                        .system(entity.getName())
                        .component("Database")
                        .failureMode("High response time indicating potential database issues")
                        .probability(0.7)
                        .impact(Severity.HIGH)
                        .mitigations(new ArrayList<>(List.of(
                                "Check database connection pool",
                                "Analyze slow queries",
                                "Monitor database resource utilization")))
                        .build());
            }

            if (metrics.getMemoryUsage() != null && metrics.getMemoryUsage() > 85) {
                points.add(FailurePoint.builder()
                        .system(entity.getName())
                        .component("Memory Management")
                        .failureMode("High memory usage indicating potential memory leak")
                        .probability(0.8)
                        .impact(Severity.CRITICAL)
                        .mitigations(new ArrayList<>(List.of(
                                "Restart application instances",
                                "Analyze memory dumps",
                                "Review recent code changes")))
                        .build());
            }

            if (metrics.getErrorRate() > 5) {
                points.add(FailurePoint.builder()
                        .system(entity.getName())
                        .component("Application Logic")
                        .failureMode("High error rate indicating application issues")
                        .probability(0.9)
                        .impact(Severity.HIGH)
                        .mitigations(new ArrayList<>(List.of(
                                "Review error logs",
                                "Check external dependencies",
                                "Validate recent deployments")))
                        .build());
            }
        }

        points.sort(Comparator.comparingDouble(FailurePoint::riskScore).reversed());
        log.debug("Identified {} failure points for incident {}", points.size(), analysis.getIncident().getId());
        return points;
    }
}
