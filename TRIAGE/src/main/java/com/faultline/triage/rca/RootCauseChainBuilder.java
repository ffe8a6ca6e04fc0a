package com.faultline.triage.rca;

import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.detection.ErrorPatternAnalyzer;
import com.faultline.triage.domain.model.Cause;
import com.faultline.triage.domain.model.CauseChain;
import com.faultline.triage.domain.model.CauseChain.ChainLink;
import com.faultline.triage.domain.model.CauseType;
import com.faultline.triage.domain.model.DeploymentEvent;
import com.faultline.triage.domain.model.ErrorPattern;
import com.faultline.triage.domain.model.Evidence;
import com.faultline.triage.domain.model.Incident;
import com.faultline.triage.domain.model.IncidentAnalysis;
import com.faultline.triage.domain.model.IncidentDataCollection;
import com.faultline.triage.domain.model.PerformanceSnapshot;
import com.faultline.triage.domain.model.PossibleCause;
import com.faultline.triage.domain.model.PreventionStrategy;
import com.faultline.triage.domain.model.RootCauseAnalysis;
import com.faultline.triage.domain.model.Severity;
import com.faultline.triage.recommendation.RecommendationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Ranks possible causes and builds root-cause analyses and cause chains.
 * <p>
 * Three heuristics produce candidate causes:
 * <ul>
 *     <li>a recent deployment near the incident opening</li>
 *     <li>high or critical error-pattern clusters</li>
 *     <li>degraded performance in a large share of the snapshots</li>
 * </ul>
 * Probabilities and thresholds come from {@link TriageProperties.Rca}.
 */
@Slf4j
@Component
public class RootCauseChainBuilder {

    static final String ANALYSIS_METHOD = "correlation_and_pattern_analysis";
    static final String DEGRADATION = "Performance degradation";

    private static final int MAX_CONTRIBUTING_FACTORS = 3;
    private static final int MAX_ALTERNATIVE_CHAINS = 2;

    private final ErrorPatternAnalyzer errorPatternAnalyzer;
    private final RecommendationEngine recommendationEngine;
    private final TriageProperties.Rca config;

    public RootCauseChainBuilder(ErrorPatternAnalyzer errorPatternAnalyzer,
                                 RecommendationEngine recommendationEngine,
                                 TriageProperties properties) {
        this.errorPatternAnalyzer = errorPatternAnalyzer;
        this.recommendationEngine = recommendationEngine;
        this.config = properties.getRca();
    }

    /**
     * Candidate causes for a collection, most probable first.
     */
    public List<PossibleCause> possibleCauses(IncidentDataCollection data) {
        Incident incident = data.getIncident();
        List<PossibleCause> causes = new ArrayList<>();

        List<DeploymentEvent> recent = recommendationEngine.deploymentsNear(incident, data.getDeploymentEvents());
        if (!recent.isEmpty()) {
            causes.add(PossibleCause.builder()
                    .type(CauseType.CODE_DEPLOYMENT)
                    .description("Recent deployment detected: " + recent.size()
                            + " deployment(s) within 1 hour of incident")
                    .probability(config.getDeploymentProbability())
                    .evidence(new ArrayList<>(List.of(Evidence.builder()
                            .type(Evidence.EvidenceType.DEPLOYMENT)
                            .description(recent.size() + " deployment(s) detected near incident time")
                            .timestamp(recent.get(0).getTimestamp())
                            .source("Deployment Events")
                            .build())))
                    .mitigation("Consider rolling back recent deployments")
                    .build());
        }

        if (!data.getErrorEvents().isEmpty()) {
            List<ErrorPattern> severe = errorPatternAnalyzer.analyze(data.getErrorEvents()).stream()
                    .filter(pattern -> pattern.getSeverity().isAtLeast(Severity.HIGH))
                    .collect(Collectors.toList());
            if (!severe.isEmpty()) {
                causes.add(PossibleCause.builder()
                        .type(CauseType.EXTERNAL_DEPENDENCY)
                        .description("High frequency error patterns detected: " + severe.stream()
                                .map(ErrorPattern::getPattern)
                                .collect(Collectors.joining(", ")))
                        .probability(config.getErrorPatternProbability())
                        .evidence(severe.stream()
                                .map(pattern -> Evidence.builder()
                                        .type(Evidence.EvidenceType.ERROR_SPIKE)
                                        .description("Error pattern: " + pattern.getPattern()
                                                + " (" + pattern.getFrequency() + " occurrences)")
                                        .timestamp(pattern.getFirstSeen())
                                        .source("Error Analysis")
                                        .build())
                                .collect(Collectors.toList()))
                        .mitigation("Investigate error patterns and external dependencies")
                        .build());
            }
        }

        List<PerformanceSnapshot> snapshots = data.getPerformanceData();
        long degraded = snapshots.stream()
                .filter(this::degraded)
                .count();
        if (degraded > snapshots.size() * config.getDegradedSnapshotShare()) {
            causes.add(PossibleCause.builder()
                    .type(CauseType.RESOURCE_EXHAUSTION)
                    .description("Significant performance degradation detected across multiple time periods")
                    .probability(config.getDegradationProbability())
                    .evidence(new ArrayList<>(List.of(Evidence.builder()
                            .type(Evidence.EvidenceType.PERFORMANCE_DEGRADATION)
                            .description(degraded + " out of " + snapshots.size()
                                    + " snapshots show degraded performance")
                            .timestamp(incident.getOpenedAt())
                            .source("Performance Analysis")
                            .build())))
                    .mitigation("Check resource utilization and scaling policies")
                    .build());
        }

        causes.sort(Comparator.comparingDouble(PossibleCause::getProbability).reversed());
        return causes;
    }

    public Cause toCause(PossibleCause possibleCause, Incident incident) {
        return Cause.builder()
                .type(possibleCause.getType())
                .description(possibleCause.getDescription())
                .probability(possibleCause.getProbability())
                .impact(causeImpact(possibleCause.getProbability()))
                .evidence(new ArrayList<>(possibleCause.getEvidence()))
                .timeline(new ArrayList<>(List.of(incident.getOpenedAt())))
                .build();
    }

    /**
     * Full root-cause analysis. When no candidate cause exists the primary cause is
     * {@link CauseType#UNKNOWN} with a low probability rather than a failure.
     */
    public RootCauseAnalysis analyze(IncidentDataCollection data) {
        Incident incident = data.getIncident();
        List<Cause> ranked = possibleCauses(data).stream()
                .map(cause -> toCause(cause, incident))
                .collect(Collectors.toList());

        Cause primary = ranked.isEmpty() ? unknownCause(incident) : ranked.get(0);
        List<Cause> contributing = ranked.size() > 1
                ? new ArrayList<>(ranked.subList(1, Math.min(ranked.size(), 1 + MAX_CONTRIBUTING_FACTORS)))
                : new ArrayList<>();

        List<Evidence> evidenceChain = evidenceChain(primary, incident);
        double confidence = confidence(primary, evidenceChain);

        log.debug("Root cause for incident {}: {} (confidence {})", incident.getId(),
                primary.getType().wireName(), confidence);

        return RootCauseAnalysis.builder()
                .primaryCause(primary)
                .contributingFactors(contributing)
                .evidenceChain(evidenceChain)
                .confidenceScore(confidence)
                .analysisMethod(ANALYSIS_METHOD)
                .recommendations(recommendationEngine.rootCauseRecommendations(primary, contributing))
                .preventionStrategies(preventionStrategies(primary))
                .build();
    }

    /**
     * The primary chain plus up to two alternative chains from the next ranked causes.
     */
    public CauseChain causeChain(IncidentAnalysis analysis) {
        List<PossibleCause> causes = analysis.getPossibleCauses();
        if (causes.isEmpty()) {
            return CauseChain.builder()
                    .rootCause("Unknown")
                    .confidence(config.getUnknownProbability())
                    .build();
        }

        PossibleCause primary = causes.get(0);
        List<List<ChainLink>> alternatives = new ArrayList<>();
        for (int i = 1; i < Math.min(causes.size(), 1 + MAX_ALTERNATIVE_CHAINS); i++) {
            alternatives.add(links(causes.get(i), analysis.getIncident()));
        }

        return CauseChain.builder()
                .rootCause(primary.getType().wireName())
                .chain(links(primary, analysis.getIncident()))
                .confidence(primary.getProbability())
                .alternativeChains(alternatives)
                .build();
    }

    List<Evidence> evidenceChain(Cause primary, Incident incident) {
        List<Evidence> chain = new ArrayList<>(primary.getEvidence());
        chain.add(Evidence.builder()
                .type(Evidence.EvidenceType.METRIC_ANOMALY)
                .description("Incident timeline shows correlation with identified cause")
                .timestamp(incident.getOpenedAt())
                .source("Timeline Analysis")
                .build());
        return chain;
    }

    /**
     * Weighted cause probability plus weighted evidence-chain length, which saturates.
     */
    double confidence(Cause primary, List<Evidence> evidenceChain) {
        return primary.getProbability() * config.getCauseWeight()
                + Math.min(evidenceChain.size() / (double) config.getEvidenceSaturation(), 1.0) * config.getEvidenceWeight();
    }

    Severity causeImpact(double probability) {
        if (probability > config.getHighImpactProbability()) {
            return Severity.HIGH;
        }
        if (probability > config.getMediumImpactProbability()) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    List<PreventionStrategy> preventionStrategies(Cause primary) {
        List<PreventionStrategy> strategies = new ArrayList<>();
        switch (primary.getType()) {
            case CODE_DEPLOYMENT -> strategies.add(PreventionStrategy.builder()
                    .type("testing")
                    .description("Implement comprehensive pre-deployment testing")
                    .implementation("Set up automated testing pipeline with staging environment validation")
                    .effort(Severity.HIGH)
                    .impact(Severity.HIGH)
                    .build());
            case RESOURCE_EXHAUSTION -> strategies.add(PreventionStrategy.builder()
                    .type("monitoring")
                    .description("Implement proactive resource monitoring")
                    .implementation("Set up alerts for resource utilization thresholds")
                    .effort(Severity.MEDIUM)
                    .impact(Severity.HIGH)
                    .build());
            case EXTERNAL_DEPENDENCY -> strategies.add(PreventionStrategy.builder()
                    .type("infrastructure")
                    .description("Implement circuit breaker pattern for external dependencies")
                    .implementation("Add resilience patterns and fallback mechanisms")
                    .effort(Severity.HIGH)
                    .impact(Severity.MEDIUM)
                    .build());
            default -> {
                // no standard strategy
            }
        }
        return strategies;
    }

    private List<ChainLink> links(PossibleCause cause, Incident incident) {
        List<ChainLink> chain = new ArrayList<>();
        chain.add(ChainLink.builder()
                .cause(cause.getType().wireName())
                .effect(DEGRADATION)
                .evidence(new ArrayList<>(cause.getEvidence()))
                .confidence(cause.getProbability())
                .timestamp(incident.getOpenedAt())
                .build());

        if (cause.getType() == CauseType.CODE_DEPLOYMENT) {
            chain.add(ChainLink.builder()
                    .cause(DEGRADATION)
                    .effect("User impact")
                    .evidence(new ArrayList<>(List.of(Evidence.builder()
                            .type(Evidence.EvidenceType.METRIC_ANOMALY)
                            .description("Increased response time and error rate")
                            .timestamp(incident.getOpenedAt())
                            .source("Performance Monitoring")
                            .build())))
                    .confidence(config.getDeploymentImpactLinkConfidence())
                    .build());
        }
        return chain;
    }

    private boolean degraded(PerformanceSnapshot snapshot) {
        return exceeds(snapshot.getResponseTime(), config.getDegradedResponseTime())
                || exceeds(snapshot.getErrorRate(), config.getDegradedErrorRate());
    }

    private static boolean exceeds(Double value, double threshold) {
        return value != null && value > threshold;
    }

    private Cause unknownCause(Incident incident) {
        return Cause.builder()
                .type(CauseType.UNKNOWN)
                .description("No definitive root cause identified from the collected telemetry")
                .probability(config.getUnknownProbability())
                .impact(Severity.LOW)
                .timeline(new ArrayList<>(List.of(incident.getOpenedAt())))
                .build();
    }
}
