package com.faultline.triage.recommendation;

import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.ActionPlan;
import com.faultline.triage.domain.model.ActionPlan.ContingencyPlan;
import com.faultline.triage.domain.model.ActionPlan.PlanAction;
import com.faultline.triage.domain.model.AffectedEntity;
import com.faultline.triage.domain.model.AnalysisRecommendation;
import com.faultline.triage.domain.model.AnalysisResult;
import com.faultline.triage.domain.model.Anomaly;
import com.faultline.triage.domain.model.Cause;
import com.faultline.triage.domain.model.CauseType;
import com.faultline.triage.domain.model.DeploymentEvent;
import com.faultline.triage.domain.model.FaultCategory;
import com.faultline.triage.domain.model.FaultPattern;
import com.faultline.triage.domain.model.Incident;
import com.faultline.triage.domain.model.IncidentAnalysis;
import com.faultline.triage.domain.model.IncidentMetrics;
import com.faultline.triage.domain.model.Recommendation;
import com.faultline.triage.domain.model.Recommendation.ActionItem;
import com.faultline.triage.domain.model.RiskAssessment;
import com.faultline.triage.domain.model.RootCauseAnalysis;
import com.faultline.triage.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Deterministic recommendation rules and action plan assembly.
 */
@Slf4j
@Component
public class RecommendationEngine {

    private final TriageProperties.Risk risk;
    private final TriageProperties.Recommendations config;

    public RecommendationEngine(TriageProperties properties) {
        this.risk = properties.getRisk();
        this.config = properties.getRecommendations();
    }

    // ========== Incident recommendations ==========

    /**
     * Recommendations derived from incident state, entity error rates and nearby deployments.
     */
    public List<Recommendation> incidentRecommendations(Incident incident,
                                                        List<AffectedEntity> entities,
                                                        List<DeploymentEvent> deployments) {
        List<Recommendation> recommendations = new ArrayList<>();

        if (incident.getState() == Incident.IncidentState.OPEN) {
            recommendations.add(Recommendation.builder()
                    .type(Recommendation.Horizon.IMMEDIATE)
                    .priority(Severity.HIGH)
                    .title("Acknowledge and Assess Impact")
                    .description("Acknowledge the incident and assess the current impact on users and systems")
                    .actionItems(new ArrayList<>(List.of(
                            action("Acknowledge the incident in the alerting platform", Severity.HIGH),
                            action("Assess current user impact and business impact", Severity.HIGH))))
                    .estimatedImpact("Reduces response time and improves incident coordination")
                    .estimatedEffort("Low")
                    .category(Recommendation.Category.PROCESS)
                    .build());
        }

        List<AffectedEntity> erroring = entities.stream()
                .filter(entity -> entity.getMetrics() != null && entity.getMetrics().getErrorRate() > config.getHighErrorRate())
                .collect(Collectors.toList());
        if (!erroring.isEmpty()) {
            recommendations.add(Recommendation.builder()
                    .type(Recommendation.Horizon.IMMEDIATE)
                    .priority(Severity.HIGH)
                    .title("Address High Error Rates")
                    .description(erroring.size() + " entities showing elevated error rates")
                    .actionItems(erroring.stream()
                            .map(entity -> action("Investigate errors in " + entity.getName(), Severity.HIGH))
                            .collect(Collectors.toList()))
                    .estimatedImpact("Directly addresses user-facing errors")
                    .estimatedEffort("Medium")
                    .category(Recommendation.Category.MONITORING)
                    .build());
        }

        List<DeploymentEvent> recent = deploymentsNear(incident, deployments);
        if (!recent.isEmpty()) {
            recommendations.add(Recommendation.builder()
                    .type(Recommendation.Horizon.IMMEDIATE)
                    .priority(Severity.HIGH)
                    .title("Consider Deployment Rollback")
                    .description("Recent deployments detected near incident time")
                    .actionItems(recent.stream()
                            .map(deployment -> action("Evaluate rollback of " + deployment.getApplicationName()
                                    + " deployment (" + deployment.getRevision() + ")", Severity.HIGH))
                            .collect(Collectors.toList()))
                    .estimatedImpact("May quickly resolve incident if deployment-related")
                    .estimatedEffort("Medium")
                    .category(Recommendation.Category.CODE)
                    .build());
        }

        recommendations.add(Recommendation.builder()
                .type(Recommendation.Horizon.LONG_TERM)
                .priority(Severity.MEDIUM)
                .title("Improve Monitoring and Alerting")
                .description("Enhance monitoring to detect similar issues earlier")
                .actionItems(new ArrayList<>(List.of(
                        action("Review alert thresholds and sensitivity", Severity.MEDIUM),
                        action("Add synthetic monitoring for critical user journeys", Severity.MEDIUM))))
                .estimatedImpact("Reduces time to detection for future incidents")
                .estimatedEffort("High")
                .category(Recommendation.Category.MONITORING)
                .build());

        return recommendations;
    }

    /**
     * One immediate recommendation for the primary cause, one short-term recommendation for
     * each of the top two contributing factors.
     */
    public List<Recommendation> rootCauseRecommendations(Cause primaryCause, List<Cause> contributingFactors) {
        List<Recommendation> recommendations = new ArrayList<>();

        recommendations.add(Recommendation.builder()
                .type(Recommendation.Horizon.IMMEDIATE)
                .priority(Severity.HIGH)
                .title("Address " + primaryCause.getType().label())
                .description(primaryCause.getDescription())
                .actionItems(new ArrayList<>(List.of(
                        action("Investigate and resolve " + primaryCause.getType().wireName(), Severity.HIGH))))
                .estimatedImpact("Directly addresses the root cause")
                .estimatedEffort("High")
                .category(categoryFor(primaryCause.getType()))
                .build());

        for (Cause factor : contributingFactors.subList(0, Math.min(2, contributingFactors.size()))) {
            recommendations.add(Recommendation.builder()
                    .type(Recommendation.Horizon.SHORT_TERM)
                    .priority(Severity.MEDIUM)
                    .title("Mitigate " + factor.getType().label())
                    .description(factor.getDescription())
                    .actionItems(new ArrayList<>(List.of(
                            action("Address contributing factor: " + factor.getType().wireName(), Severity.MEDIUM))))
                    .estimatedImpact("Reduces likelihood of similar incidents")
                    .estimatedEffort("Medium")
                    .category(categoryFor(factor.getType()))
                    .build());
        }

        return recommendations;
    }

    public static Recommendation.Category categoryFor(CauseType type) {
        return switch (type) {
            case CODE_DEPLOYMENT -> Recommendation.Category.CODE;
            case INFRASTRUCTURE_ISSUE, RESOURCE_EXHAUSTION -> Recommendation.Category.INFRASTRUCTURE;
            case EXTERNAL_DEPENDENCY -> Recommendation.Category.MONITORING;
            default -> Recommendation.Category.PROCESS;
        };
    }

    // ========== Analysis recommendations ==========

    /**
     * Rules over risk level, detected pattern types and anomaly severity.
     */
    public List<AnalysisRecommendation> analysisRecommendations(RiskAssessment riskAssessment,
                                                                List<FaultPattern> patterns,
                                                                List<Anomaly> anomalies) {
        List<AnalysisRecommendation> recommendations = new ArrayList<>();

        if (riskAssessment.getCurrentRisk() == Severity.CRITICAL) {
            recommendations.add(AnalysisRecommendation.builder()
                    .priority(AnalysisRecommendation.Priority.IMMEDIATE)
                    .category(AnalysisRecommendation.Category.ESCALATION)
                    .title("Escalate Immediately")
                    .description("Critical risk level requires immediate escalation")
                    .actions(new ArrayList<>(List.of("Contact on-call engineer", "Activate incident response")))
                    .expectedOutcome("Senior engineering engagement")
                    .timeEstimateMinutes(5)
                    .build());
        }

        for (FaultPattern pattern : patterns) {
            if (pattern.getType() == FaultCategory.RESOURCE_EXHAUSTION) {
                recommendations.add(AnalysisRecommendation.builder()
                        .priority(AnalysisRecommendation.Priority.HIGH)
                        .category(AnalysisRecommendation.Category.MITIGATION)
                        .title("Address Resource Exhaustion")
                        .description(String.format(Locale.ROOT, "%s detected with %.0f%% confidence",
                                pattern.getName(), pattern.getConfidence() * 100))
                        .actions(new ArrayList<>(List.of(
                                "Check resource utilization", "Scale resources if needed", "Identify resource leaks")))
                        .expectedOutcome("Resource utilization normalized")
                        .timeEstimateMinutes(30)
                        .build());
            }
        }

        long criticalAnomalies = anomalies.stream()
                .filter(anomaly -> anomaly.getSeverity() == Severity.CRITICAL)
                .count();
        if (criticalAnomalies > 0) {
            recommendations.add(AnalysisRecommendation.builder()
                    .priority(AnalysisRecommendation.Priority.HIGH)
                    .category(AnalysisRecommendation.Category.INVESTIGATION)
                    .title("Investigate Critical Anomalies")
                    .description(criticalAnomalies + " critical anomalies detected")
                    .actions(new ArrayList<>(List.of(
                            "Analyze anomaly patterns", "Check for external factors", "Review recent changes")))
                    .expectedOutcome("Anomaly root cause identified")
                    .timeEstimateMinutes(20)
                    .build());
        }

        return recommendations;
    }

    // ========== Action plan ==========

    /**
     * Regroup an analysis into immediate, short-term and long-term actions plus contingency plans.
     */
    public ActionPlan actionPlan(AnalysisResult analysis) {
        List<PlanAction> immediate = new ArrayList<>();
        List<PlanAction> shortTerm = new ArrayList<>();
        List<PlanAction> longTerm = new ArrayList<>();
        List<ContingencyPlan> contingencies = new ArrayList<>();
        RiskAssessment riskAssessment = analysis.getRiskAssessment();

        if (riskAssessment != null && riskAssessment.getCurrentRisk() == Severity.CRITICAL) {
            immediate.add(PlanAction.builder()
                    .id("escalate_incident")
                    .title("Escalate to Senior Engineering")
                    .description("Immediately escalate to senior engineering team due to critical risk level")
                    .priority(Severity.CRITICAL)
                    .estimatedTimeMinutes(5)
                    .successCriteria(new ArrayList<>(List.of("Senior engineer assigned", "Escalation documented")))
                    .build());
        }

        for (FaultPattern pattern : analysis.getDetectedPatterns()) {
            if (pattern.getType() == FaultCategory.RESOURCE_EXHAUSTION) {
                immediate.add(PlanAction.builder()
                        .id("address_" + pattern.getId())
                        .title("Address " + pattern.getName())
                        .description(pattern.getDescription())
                        .priority(Severity.HIGH)
                        .estimatedTimeMinutes(30)
                        .successCriteria(new ArrayList<>(List.of("Resource utilization reduced", "Performance improved")))
                        .build());
            }
        }

        for (AnalysisRecommendation recommendation : analysis.getRecommendations()) {
            PlanAction action = PlanAction.builder()
                    .id("rec_" + recommendation.getTitle().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_"))
                    .title(recommendation.getTitle())
                    .description(recommendation.getDescription())
                    .priority(actionPriority(recommendation.getPriority()))
                    .estimatedTimeMinutes(recommendation.getTimeEstimateMinutes())
                    .successCriteria(new ArrayList<>(List.of(recommendation.getExpectedOutcome())))
                    .build();
            switch (recommendation.getPriority()) {
                case IMMEDIATE -> immediate.add(action);
                case HIGH -> shortTerm.add(action);
                default -> longTerm.add(action);
            }
        }

        if (riskAssessment != null && riskAssessment.getEscalationProbability() > risk.getContingencyThreshold()) {
            contingencies.add(ContingencyPlan.builder()
                    .trigger("Incident escalates to critical severity")
                    .actions(new ArrayList<>(List.of(PlanAction.builder()
                            .id("emergency_response")
                            .title("Activate Emergency Response")
                            .description("Activate emergency response procedures")
                            .priority(Severity.CRITICAL)
                            .estimatedTimeMinutes(10)
                            .successCriteria(new ArrayList<>(List.of(
                                    "Emergency team activated", "Communication plan initiated")))
                            .build())))
                    .rollbackPlan(new ArrayList<>(List.of("Document lessons learned", "Update emergency procedures")))
                    .build());
        }

        log.debug("Built action plan for incident {}: immediate={}, shortTerm={}, longTerm={}, contingencies={}",
                analysis.getIncident().getId(), immediate.size(), shortTerm.size(), longTerm.size(),
                contingencies.size());

        return ActionPlan.builder()
                .immediateActions(immediate)
                .shortTermActions(shortTerm)
                .longTermActions(longTerm)
                .contingencyPlans(contingencies)
                .build();
    }

    // ========== Report content ==========

    public List<String> lessonsLearned(IncidentAnalysis analysis, RootCauseAnalysis rootCause) {
        List<String> lessons = new ArrayList<>();

        if (rootCause.getPrimaryCause().getType() == CauseType.CODE_DEPLOYMENT) {
            lessons.add("Deployment processes should include more comprehensive testing");
            lessons.add("Consider implementing canary deployments for critical services");
        }
        if (analysis.getMetrics().getSeverity() == IncidentMetrics.IncidentSeverity.CRITICAL) {
            lessons.add("Critical incidents require faster detection and response");
            lessons.add("Consider implementing additional monitoring for early warning signs");
        }
        if (!analysis.getCorrelatedEvents().isEmpty()) {
            lessons.add("Event correlation analysis proved valuable for root cause identification");
        }

        return lessons;
    }

    /**
     * Deployments strictly closer than the recent-deployment window to the incident opening, in either direction.
     */
    public List<DeploymentEvent> deploymentsNear(Incident incident, List<DeploymentEvent> deployments) {
        return deployments.stream()
                .filter(deployment -> deployment.getTimestamp() != null)
                .filter(deployment -> Duration.between(deployment.getTimestamp(), incident.getOpenedAt())
                        .abs().compareTo(config.getRecentDeployment()) < 0)
                .collect(Collectors.toList());
    }

    private static Severity actionPriority(AnalysisRecommendation.Priority priority) {
        return switch (priority) {
            case IMMEDIATE -> Severity.CRITICAL;
            case HIGH -> Severity.HIGH;
            case MEDIUM -> Severity.MEDIUM;
            case LOW -> Severity.LOW;
        };
    }

    private static ActionItem action(String description, Severity priority) {
        return ActionItem.builder().description(description).priority(priority).build();
    }
}
