package com.faultline.triage.correlation;

import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.CorrelatedEvent;
import com.faultline.triage.domain.model.DeploymentCorrelation;
import com.faultline.triage.domain.model.DeploymentEvent;
import com.faultline.triage.domain.model.Incident;
import com.faultline.triage.domain.model.InfrastructureCorrelation;
import com.faultline.triage.domain.model.InfrastructureEvent;
import com.faultline.triage.domain.model.Severity;
import com.faultline.triage.domain.model.SimilarIncident;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Temporal correlation of events with an incident, and similarity between incidents.
 * <p>
 * Correlation decays linearly over a per-event-type window and is weighted by the event type's
 * causal multiplier. Deployments and infrastructure events are further classified into causal tiers.
 */
@Slf4j
@Component
public class CorrelationEngine {

    private final TriageProperties.Correlation correlation;
    private final TriageProperties.Similarity similarity;

    public CorrelationEngine(TriageProperties properties) {
        this.correlation = properties.getCorrelation();
        this.similarity = properties.getSimilarity();
    }

    /**
     * {@code max(0, 1 - gap / window) * multiplier}, clamped to [0, 1].
     */
    public double eventCorrelation(Instant incidentTime, Instant eventTime, CorrelatedEvent.EventType type) {
        TriageProperties.EventWindow window = switch (type) {
            case DEPLOYMENT -> correlation.getDeployment();
            case INFRASTRUCTURE -> correlation.getInfrastructure();
        };
        double base = decay(gapMinutes(incidentTime, eventTime), window.getWindow());
        return clamp(base * window.getMultiplier());
    }

    /**
     * Events correlated above the report threshold, strongest first.
     */
    public List<CorrelatedEvent> correlateEvents(Incident incident,
                                                 List<DeploymentEvent> deployments,
                                                 List<InfrastructureEvent> infrastructureEvents) {
        Instant incidentTime = incident.getOpenedAt();
        List<CorrelatedEvent> events = new ArrayList<>();

        for (DeploymentEvent deployment : deployments) {
            double score = eventCorrelation(incidentTime, deployment.getTimestamp(), CorrelatedEvent.EventType.DEPLOYMENT);
            if (score > correlation.getReportThreshold()) {
                events.add(CorrelatedEvent.builder()
                        .timestamp(deployment.getTimestamp())
                        .type(CorrelatedEvent.EventType.DEPLOYMENT)
                        .description("Deployment of " + deployment.getApplicationName()
                                + " (" + deployment.getRevision() + ")")
                        .correlationScore(score)
                        .source("Deployments")
                        .build());
            }
        }

        for (InfrastructureEvent event : infrastructureEvents) {
            double score = eventCorrelation(incidentTime, event.getTimestamp(), CorrelatedEvent.EventType.INFRASTRUCTURE);
            if (score > correlation.getReportThreshold()) {
                events.add(CorrelatedEvent.builder()
                        .timestamp(event.getTimestamp())
                        .type(CorrelatedEvent.EventType.INFRASTRUCTURE)
                        .description(event.getType() + " on " + event.getHostname())
                        .correlationScore(score)
                        .source("Infrastructure Monitoring")
                        .build());
            }
        }

        events.sort(Comparator.comparingDouble(CorrelatedEvent::getCorrelationScore).reversed());
        log.debug("Correlated {} of {} candidate events for incident {}", events.size(),
                deployments.size() + infrastructureEvents.size(), incident.getId());
        return events;
    }

    /**
     * Deployments classified as likely cause, possible cause or coincidental, strongest first.
     */
    public List<DeploymentCorrelation> deploymentCorrelations(Incident incident, List<DeploymentEvent> deployments) {
        TriageProperties.DeploymentTiers tiers = correlation.getDeploymentTiers();
        List<DeploymentCorrelation> correlations = new ArrayList<>();

        for (DeploymentEvent deployment : deployments) {
            double gap = gapMinutes(incident.getOpenedAt(), deployment.getTimestamp());
            double score = decay(gap, tiers.getWindow());
            if (Objects.equals(deployment.getApplicationId(), incident.getEntityId())) {
                score *= tiers.getSameEntityBoost();
            }
            score = clamp(score);

            DeploymentCorrelation.Impact impact;
            if (score > tiers.getLikelyCauseMinScore() && gap < tiers.getLikelyCauseMaxGapMinutes()) {
                impact = DeploymentCorrelation.Impact.LIKELY_CAUSE;
            } else if (score > tiers.getPossibleCauseMinScore() && gap < tiers.getPossibleCauseMaxGapMinutes()) {
                impact = DeploymentCorrelation.Impact.POSSIBLE_CAUSE;
            } else {
                impact = DeploymentCorrelation.Impact.COINCIDENTAL;
            }

            correlations.add(DeploymentCorrelation.builder()
                    .deployment(deployment)
                    .correlation(score)
                    .timeGapMinutes(gap)
                    .confidence(deploymentConfidence(gap, score, tiers))
                    .impact(impact)
                    .build());
        }

        correlations.sort(Comparator.comparingDouble(DeploymentCorrelation::getCorrelation).reversed());
        return correlations;
    }

    /**
     * Infrastructure events classified as direct cause, contributing factor or unrelated, strongest first.
     */
    public List<InfrastructureCorrelation> infrastructureCorrelations(Incident incident,
                                                                      List<InfrastructureEvent> events) {
        TriageProperties.InfrastructureTiers tiers = correlation.getInfrastructureTiers();
        List<InfrastructureCorrelation> correlations = new ArrayList<>();

        for (InfrastructureEvent event : events) {
            double gap = gapMinutes(incident.getOpenedAt(), event.getTimestamp());
            double score = decay(gap, tiers.getWindow());
            if (event.getSeverity() == Severity.CRITICAL) {
                score *= tiers.getCriticalMultiplier();
            } else if (event.getSeverity() == Severity.HIGH) {
                score *= tiers.getHighMultiplier();
            }
            score = clamp(score);

            InfrastructureCorrelation.Impact impact;
            if (score > tiers.getDirectCauseMinScore() && gap < tiers.getDirectCauseMaxGapMinutes()
                    && event.getSeverity() == Severity.CRITICAL) {
                impact = InfrastructureCorrelation.Impact.DIRECT_CAUSE;
            } else if (score > tiers.getContributingMinScore() && gap < tiers.getContributingMaxGapMinutes()) {
                impact = InfrastructureCorrelation.Impact.CONTRIBUTING_FACTOR;
            } else {
                impact = InfrastructureCorrelation.Impact.UNRELATED;
            }

            correlations.add(InfrastructureCorrelation.builder()
                    .event(event)
                    .correlation(score)
                    .timeGapMinutes(gap)
                    .confidence(infrastructureConfidence(gap, score, event.getSeverity(), tiers))
                    .impact(impact)
                    .build());
        }

        correlations.sort(Comparator.comparingDouble(InfrastructureCorrelation::getCorrelation).reversed());
        return correlations;
    }

    /**
     * Weighted sum of shared entity, condition, policy and time of day.
     */
    public double similarity(Incident incident, Incident other) {
        double score = 0.0;
        if (Objects.equals(incident.getEntityId(), other.getEntityId())) {
            score += similarity.getSameEntityWeight();
        }
        if (Objects.equals(incident.getConditionId(), other.getConditionId())) {
            score += similarity.getSameConditionWeight();
        }
        if (Objects.equals(incident.getPolicyId(), other.getPolicyId())) {
            score += similarity.getSamePolicyWeight();
        }
        int hour = incident.getOpenedAt().atZone(ZoneOffset.UTC).getHour();
        int otherHour = other.getOpenedAt().atZone(ZoneOffset.UTC).getHour();
        if (Math.abs(hour - otherHour) <= similarity.getTimeOfDayWindowHours()) {
            score += similarity.getTimeOfDayWeight();
        }
        return score;
    }

    public List<String> commonFactors(Incident incident, Incident other) {
        List<String> factors = new ArrayList<>();
        if (Objects.equals(incident.getEntityId(), other.getEntityId())) {
            factors.add("Same affected entity");
        }
        if (Objects.equals(incident.getConditionName(), other.getConditionName())) {
            factors.add("Same alert condition");
        }
        if (Objects.equals(incident.getPolicyName(), other.getPolicyName())) {
            factors.add("Same alert policy");
        }
        return factors;
    }

    /**
     * Historical incidents scoring above the similarity threshold, most similar first.
     */
    public List<SimilarIncident> similarIncidents(Incident incident, List<Incident> history) {
        return history.stream()
                .filter(candidate -> !candidate.getId().equals(incident.getId()))
                .map(candidate -> new AbstractMap.SimpleEntry<>(candidate, similarity(incident, candidate)))
                .filter(scored -> scored.getValue() > similarity.getThreshold())
                .sorted(Map.Entry.<Incident, Double>comparingByValue().reversed())
                .limit(similarity.getMaxResults())
                .map(scored -> SimilarIncident.builder()
                        .incident(scored.getKey())
                        .similarity(scored.getValue())
                        .commonFactors(commonFactors(incident, scored.getKey()))
                        .resolution(scored.getKey().isClosed() ? "Resolved" : "Ongoing")
                        .timeToResolveMinutes(scored.getKey().getClosedAt() != null
                                ? Math.round(Duration.between(scored.getKey().getOpenedAt(),
                                        scored.getKey().getClosedAt()).toMillis() / 60_000.0)
                                : null)
                        .build())
                .collect(Collectors.toList());
    }

    static double deploymentConfidence(double gapMinutes, double score, TriageProperties.DeploymentTiers tiers) {
        for (TriageProperties.ConfidenceTier tier : tiers.getConfidenceTiers()) {
            if (gapMinutes < tier.getMaxGapMinutes() && score > tier.getMinScore()) {
                return tier.getConfidence();
            }
        }
        return tiers.getConfidenceFloor();
    }

    static double infrastructureConfidence(double gapMinutes, double score, Severity severity,
                                           TriageProperties.InfrastructureTiers tiers) {
        double confidence = score * tiers.getConfidenceWeight();
        if (severity == Severity.CRITICAL) {
            confidence *= tiers.getCriticalConfidenceBoost();
        }
        if (gapMinutes < tiers.getCloseGapMinutes()) {
            confidence *= tiers.getCloseGapConfidenceBoost();
        }
        return Math.min(confidence, 1.0);
    }

    private static double gapMinutes(Instant incidentTime, Instant eventTime) {
        return Math.abs(Duration.between(eventTime, incidentTime).toMillis()) / 60_000.0;
    }

    private static double decay(double gapMinutes, Duration window) {
        return Math.max(0.0, 1.0 - gapMinutes / window.toMinutes());
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }
}
