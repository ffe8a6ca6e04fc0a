package com.faultline.triage.risk;

import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.AffectedEntity;
import com.faultline.triage.domain.model.Anomaly;
import com.faultline.triage.domain.model.CauseType;
import com.faultline.triage.domain.model.CorrelatedEvent;
import com.faultline.triage.domain.model.EscalationPrediction;
import com.faultline.triage.domain.model.EscalationPrediction.Trigger;
import com.faultline.triage.domain.model.EscalationPrediction.TriggerKind;
import com.faultline.triage.domain.model.FaultPattern;
import com.faultline.triage.domain.model.Incident;
import com.faultline.triage.domain.model.IncidentAnalysis;
import com.faultline.triage.domain.model.IncidentMetrics;
import com.faultline.triage.domain.model.IncidentMetrics.IncidentSeverity;
import com.faultline.triage.domain.model.PossibleCause;
import com.faultline.triage.domain.model.RiskAssessment;
import com.faultline.triage.domain.model.RiskAssessment.BusinessImpact;
import com.faultline.triage.domain.model.RiskAssessment.FactorType;
import com.faultline.triage.domain.model.RiskAssessment.ImpactLevel;
import com.faultline.triage.domain.model.RiskAssessment.RiskFactor;
import com.faultline.triage.domain.model.RiskAssessment.TimeToResolutionEstimate;
import com.faultline.triage.domain.model.RiskAssessment.UserImpact;
import com.faultline.triage.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.*;

/**
 * Incident severity, risk, business impact and escalation scoring.
 * <p>
 * All thresholds come from {@link TriageProperties.Risk}; the formulas are additive and capped.
 */
@Slf4j
@Component
public class RiskModel {

    private final TriageProperties.Risk config;

    public RiskModel(TriageProperties properties) {
        this.config = properties.getRisk();
    }

    // ========== Incident metrics ==========

    public IncidentMetrics incidentMetrics(Incident incident, List<AffectedEntity> entities, Instant now) {
        long duration = incident.durationMinutes(now);
        double maxErrorRate = entities.stream()
                .mapToDouble(entity -> entity.getMetrics().getErrorRate())
                .max()
                .orElse(0);
        int entityCount = entities.size();

        TriageProperties.IncidentSeverityTiers tiers = config.getSeverity();
        IncidentSeverity severity = IncidentSeverity.INFO;
        if (maxErrorRate > tiers.getCriticalErrorRate() || entityCount > tiers.getCriticalEntityCount()) {
            severity = IncidentSeverity.CRITICAL;
        } else if (maxErrorRate > tiers.getWarningErrorRate() || entityCount > tiers.getWarningEntityCount()) {
            severity = IncidentSeverity.WARNING;
        }

        double impactScore = Math.min(maxErrorRate * tiers.getErrorRateScoreWeight(), tiers.getErrorRateScoreCap())
                + Math.min(entityCount * tiers.getEntityScoreWeight(), tiers.getEntityScoreCap())
                + Math.min(duration / tiers.getMinutesPerDurationPoint(), tiers.getDurationScoreCap());

        return IncidentMetrics.builder()
                .durationMinutes(duration)
                .severity(severity)
                .impactScore((int) Math.round(impactScore))
                .businessImpact(switch (severity) {
                    case CRITICAL -> "High business impact due to service degradation";
                    case WARNING -> "Moderate business impact";
                    case INFO -> "Low business impact";
                })
                .build();
    }

    /**
     * Confidence of an incident analysis: a fixed floor without causes, otherwise a blend of the
     * strongest cause, the average evidence count and the strongest correlated event, capped.
     */
    public double analysisConfidence(List<PossibleCause> causes, List<CorrelatedEvent> correlatedEvents) {
        TriageProperties.AnalysisConfidence weights = config.getAnalysisConfidence();
        if (causes.isEmpty()) {
            return weights.getWithoutCauses();
        }
        double maxProbability = causes.stream().mapToDouble(PossibleCause::getProbability).max().orElse(0);
        double averageEvidence = causes.stream().mapToInt(cause -> cause.getEvidence().size()).average().orElse(0);
        double maxCorrelation = correlatedEvents.stream()
                .mapToDouble(CorrelatedEvent::getCorrelationScore)
                .max()
                .orElse(0);
        return Math.min(maxProbability * weights.getCauseWeight()
                + averageEvidence * weights.getEvidencePerItem() * weights.getEvidenceWeight()
                + maxCorrelation * weights.getCorrelationWeight(), weights.getCap());
    }

    // ========== Risk assessment ==========

    public RiskAssessment assess(IncidentAnalysis analysis) {
        BusinessImpact businessImpact = businessImpact(analysis);
        List<RiskFactor> factors = riskFactors(analysis, businessImpact);
        Severity currentRisk = overallRisk(factors);
        double escalation = escalationProbability(analysis, factors);

        log.debug("Risk for incident {}: {} (escalation {})", analysis.getIncident().getId(),
                currentRisk, escalation);

        return RiskAssessment.builder()
                .currentRisk(currentRisk)
                .riskFactors(factors)
                .escalationProbability(escalation)
                .businessImpact(businessImpact)
                .timeToResolution(timeToResolution(analysis))
                .build();
    }

    public List<RiskFactor> riskFactors(IncidentAnalysis analysis, BusinessImpact businessImpact) {
        List<RiskFactor> factors = new ArrayList<>();
        IncidentMetrics metrics = analysis.getMetrics();
        TriageProperties.RiskFactors table = config.getFactors();

        if (metrics.getSeverity() == IncidentSeverity.CRITICAL) {
            factors.add(factor(FactorType.TECHNICAL, "Critical severity incident with high impact potential",
                    Severity.CRITICAL, table.getCriticalSeverity()));
        }
        if (analysis.getAffectedEntities().size() > table.getMultipleSystemsEntityCount()) {
            factors.add(factor(FactorType.TECHNICAL, "Multiple systems affected, indicating potential cascade failure",
                    Severity.HIGH, table.getMultipleSystems()));
        }
        if (businessImpact.getUserImpact() == UserImpact.SEVERE) {
            factors.add(factor(FactorType.BUSINESS, "Severe user impact affecting customer experience",
                    Severity.CRITICAL, table.getSevereUserImpact()));
        }
        if (metrics.getDurationMinutes() > config.getLongDurationMinutes()) {
            factors.add(factor(FactorType.OPERATIONAL, "Extended incident duration increasing operational complexity",
                    Severity.MEDIUM, table.getExtendedDuration()));
        }
        return factors;
    }

    /**
     * Highest factor severity, low when there are no factors.
     */
    public static Severity overallRisk(List<RiskFactor> factors) {
        return factors.stream()
                .map(RiskFactor::getSeverity)
                .reduce(Severity.LOW, Severity::max);
    }

    /**
     * Additive escalation probability, always within [base, cap].
     */
    public double escalationProbability(IncidentAnalysis analysis, List<RiskFactor> factors) {
        IncidentMetrics metrics = analysis.getMetrics();
        double probability = config.getEscalationBase();

        if (metrics.getSeverity() == IncidentSeverity.CRITICAL) {
            probability += config.getCriticalSeverityIncrement();
        } else if (metrics.getSeverity() == IncidentSeverity.WARNING) {
            probability += config.getWarningSeverityIncrement();
        }

        if (metrics.getDurationMinutes() > config.getLongDurationMinutes()) {
            probability += config.getLongDurationIncrement();
        } else if (metrics.getDurationMinutes() > config.getMediumDurationMinutes()) {
            probability += config.getMediumDurationIncrement();
        }

        for (RiskFactor factor : factors) {
            probability += factor.getLikelihood() * factor.getImpact() * config.getRiskFactorWeight();
        }

        return Math.max(config.getEscalationBase(), Math.min(probability, config.getEscalationCap()));
    }

    public BusinessImpact businessImpact(IncidentAnalysis analysis) {
        double maxErrorRate = analysis.maxErrorRate();
        IncidentMetrics metrics = analysis.getMetrics();
        boolean critical = metrics.getSeverity() == IncidentSeverity.CRITICAL;
        long duration = metrics.getDurationMinutes();
        int entityCount = analysis.getAffectedEntities().size();
        TriageProperties.BusinessImpactTiers tiers = config.getBusinessImpact();

        UserImpact user = UserImpact.NONE;
        if (maxErrorRate > config.getSevereUserErrorRate()) {
            user = UserImpact.SEVERE;
        } else if (maxErrorRate > config.getModerateUserErrorRate()) {
            user = UserImpact.MODERATE;
        } else if (maxErrorRate > config.getMinimalUserErrorRate()) {
            user = UserImpact.MINIMAL;
        }
        boolean usersAffected = user != UserImpact.NONE;

        ImpactLevel revenue = ImpactLevel.NONE;
        if (critical && entityCount > tiers.getRevenueHighEntityCount()) {
            revenue = ImpactLevel.HIGH;
        } else if (critical || entityCount > tiers.getRevenueMediumEntityCount()) {
            revenue = ImpactLevel.MEDIUM;
        } else if (usersAffected) {
            revenue = ImpactLevel.LOW;
        }

        ImpactLevel reputation = ImpactLevel.NONE;
        if (user == UserImpact.SEVERE && duration > tiers.getReputationHighDurationMinutes()) {
            reputation = ImpactLevel.HIGH;
        } else if (user == UserImpact.MODERATE || duration > tiers.getReputationMediumDurationMinutes()) {
            reputation = ImpactLevel.MEDIUM;
        } else if (usersAffected) {
            reputation = ImpactLevel.LOW;
        }

        ImpactLevel compliance = ImpactLevel.NONE;
        if (critical && duration > tiers.getComplianceHighDurationMinutes()) {
            compliance = ImpactLevel.HIGH;
        } else if (critical) {
            compliance = ImpactLevel.MEDIUM;
        } else if (usersAffected) {
            compliance = ImpactLevel.LOW;
        }

        return BusinessImpact.builder()
                .userImpact(user)
                .revenueImpact(revenue)
                .reputationImpact(reputation)
                .complianceRisk(compliance)
                .build();
    }

    public TimeToResolutionEstimate timeToResolution(IncidentAnalysis analysis) {
        IncidentMetrics metrics = analysis.getMetrics();
        double minutes = config.getBaselineResolutionMinutes();

        if (metrics.getSeverity() == IncidentSeverity.CRITICAL) {
            minutes *= config.getCriticalResolutionMultiplier();
        } else if (metrics.getSeverity() == IncidentSeverity.WARNING) {
            minutes *= config.getWarningResolutionMultiplier();
        }

        minutes += analysis.getAffectedEntities().size() * config.getMinutesPerAffectedEntity();

        if (!analysis.getPossibleCauses().isEmpty()) {
            CauseType primary = analysis.getPossibleCauses().get(0).getType();
            if (primary == CauseType.CODE_DEPLOYMENT) {
                minutes *= config.getDeploymentCauseMultiplier();
            } else if (primary == CauseType.RESOURCE_EXHAUSTION) {
                minutes *= config.getResourceExhaustionMultiplier();
            }
        }

        return TimeToResolutionEstimate.builder()
                .estimatedMinutes(Math.round(minutes))
                .confidence(config.getResolutionEstimateConfidence())
                .factors(new ArrayList<>(List.of(
                        "Severity: " + metrics.getSeverity().name().toLowerCase(Locale.ROOT),
                        "Affected entities: " + analysis.getAffectedEntities().size(),
                        "Detected patterns: " + analysis.getPossibleCauses().size())))
                .build();
    }

    // ========== Escalation ==========

    public EscalationPrediction predictEscalation(IncidentAnalysis analysis, RiskAssessment riskAssessment) {
        List<Trigger> triggers = new ArrayList<>();
        TriageProperties.EscalationTriggers limits = config.getTriggers();

        double errorRate = analysis.maxErrorRate();
        if (errorRate > limits.getErrorRateTrigger()) {
            triggers.add(Trigger.builder()
                    .kind(TriggerKind.ERROR_RATE)
                    .condition("Error rate exceeds " + plain(limits.getErrorRateThreshold()) + "%")
                    .threshold(limits.getErrorRateThreshold())
                    .currentValue(errorRate)
                    .timeToThresholdMinutes(timeToThreshold(errorRate, limits.getErrorRateThreshold()))
                    .build());
        }

        double responseTime = analysis.maxResponseTime();
        if (responseTime > limits.getResponseTimeTrigger()) {
            triggers.add(Trigger.builder()
                    .kind(TriggerKind.RESPONSE_TIME)
                    .condition("Response time exceeds " + plain(limits.getResponseTimeThreshold() / 1000) + " seconds")
                    .threshold(limits.getResponseTimeThreshold())
                    .currentValue(responseTime)
                    .timeToThresholdMinutes(timeToThreshold(responseTime, limits.getResponseTimeThreshold()))
                    .build());
        }

        long duration = analysis.getMetrics().getDurationMinutes();
        long durationLimit = limits.getDurationThresholdMinutes();
        triggers.add(Trigger.builder()
                .kind(TriggerKind.DURATION)
                .condition("Incident duration exceeds " + plain(durationLimit / 60.0) + " hours")
                .threshold(durationLimit)
                .currentValue(duration)
                .timeToThresholdMinutes(Math.max(0, durationLimit - duration))
                .build());

        long timeframe = triggers.stream()
                .map(Trigger::getTimeToThresholdMinutes)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .min()
                .orElse(limits.getDefaultTimeframeMinutes());

        return EscalationPrediction.builder()
                .probability(riskAssessment.getEscalationProbability())
                .timeframeMinutes(timeframe)
                .triggers(triggers)
                .preventionActions(preventionActions(triggers))
                .build();
    }

    /**
     * Fixed projection while under the threshold; null once exceeded.
     */
    Long timeToThreshold(double current, double threshold) {
        return current < threshold ? config.getTriggers().getProjectedMinutesToThreshold() : null;
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static List<String> preventionActions(List<Trigger> triggers) {
        Set<String> actions = new LinkedHashSet<>();
        for (Trigger trigger : triggers) {
            switch (trigger.getKind()) {
                case ERROR_RATE -> {
                    actions.add("Implement circuit breaker to prevent error propagation");
                    actions.add("Scale up application instances to handle load");
                }
                case RESPONSE_TIME -> {
                    actions.add("Optimize database queries and add caching");
                    actions.add("Review and optimize application performance");
                }
                case DURATION -> {
                    actions.add("Escalate to senior engineering team");
                    actions.add("Activate incident response procedures");
                }
            }
        }
        return new ArrayList<>(actions);
    }

    // ========== Comprehensive analysis ==========

    public double comprehensiveConfidence(List<FaultPattern> patterns, List<Anomaly> anomalies,
                                          List<CorrelatedEvent> correlatedEvents) {
        TriageProperties.ComprehensiveConfidence weights = config.getComprehensiveConfidence();
        double confidence = weights.getBase();
        confidence += patterns.stream().mapToDouble(FaultPattern::getConfidence).max().orElse(0)
                * weights.getPatternWeight();
        if (!anomalies.isEmpty()) {
            confidence += Math.min(anomalies.size() / weights.getAnomaliesPerPoint(), weights.getAnomalyCap());
        }
        confidence += correlatedEvents.stream()
                .mapToDouble(CorrelatedEvent::getCorrelationScore)
                .max()
                .orElse(0) * weights.getCorrelationWeight();
        return Math.min(confidence, weights.getCap());
    }

    private static RiskFactor factor(FactorType type, String description, Severity severity,
                                     TriageProperties.FactorWeight weight) {
        return RiskFactor.builder()
                .type(type)
                .description(description)
                .severity(severity)
                .likelihood(weight.getLikelihood())
                .impact(weight.getImpact())
                .build();
    }
}
