package com.faultline.triage.service;

import com.faultline.triage.cache.CacheKeys;
import com.faultline.triage.cache.InFlightRequests;
import com.faultline.triage.client.IncidentFilters;
import com.faultline.triage.client.TelemetryClient;
import com.faultline.triage.collector.TelemetryCollector;
import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.correlation.CorrelationEngine;
import com.faultline.triage.detection.AnomalyDetector;
import com.faultline.triage.detection.ErrorPatternAnalyzer;
import com.faultline.triage.domain.model.*;
import com.faultline.triage.observability.TriageMetrics;
import com.faultline.triage.observability.TriageStructuredLogger;
import com.faultline.triage.rca.RootCauseChainBuilder;
import com.faultline.triage.recommendation.RecommendationEngine;
import com.faultline.triage.risk.RiskModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Incident-level analysis operations.
 * <p>
 * Resolves incidents through the {@link TelemetryClient}, collects their telemetry, and
 * runs correlation, root cause, and recommendation stages over the collection. Results
 * are memoized in the result cache:
 * <ul>
 *     <li>incident listings, details and collections for the collection TTL</li>
 *     <li>incident analyses for the analysis TTL</li>
 * </ul>
 * Concurrent collection or analysis of the same incident shares one execution.
 */
@Slf4j
@Service
public class IncidentAnalyzer {

    static final String ANALYSIS_METHOD = "automated_correlation_analysis";
    static final String REPORT_GENERATOR = "TRIAGE";

    private final TelemetryClient telemetryClient;
    private final TelemetryCollector collector;
    private final InFlightRequests inFlight;
    private final AnalysisStageRunner stages;
    private final AnomalyDetector anomalyDetector;
    private final ErrorPatternAnalyzer errorPatternAnalyzer;
    private final CorrelationEngine correlationEngine;
    private final RootCauseChainBuilder rootCauseChainBuilder;
    private final RiskModel riskModel;
    private final RecommendationEngine recommendationEngine;
    private final TriageProperties properties;
    private final TriageMetrics metrics;
    private final TriageStructuredLogger structuredLogger;
    private final Clock clock;

    public IncidentAnalyzer(TelemetryClient telemetryClient,
                            TelemetryCollector collector,
                            InFlightRequests inFlight,
                            AnalysisStageRunner stages,
                            AnomalyDetector anomalyDetector,
                            ErrorPatternAnalyzer errorPatternAnalyzer,
                            CorrelationEngine correlationEngine,
                            RootCauseChainBuilder rootCauseChainBuilder,
                            RiskModel riskModel,
                            RecommendationEngine recommendationEngine,
                            TriageProperties properties,
                            TriageMetrics metrics,
                            TriageStructuredLogger structuredLogger,
                            Clock clock) {
        this.telemetryClient = telemetryClient;
        this.collector = collector;
        this.inFlight = inFlight;
        this.stages = stages;
        this.anomalyDetector = anomalyDetector;
        this.errorPatternAnalyzer = errorPatternAnalyzer;
        this.correlationEngine = correlationEngine;
        this.rootCauseChainBuilder = rootCauseChainBuilder;
        this.riskModel = riskModel;
        this.recommendationEngine = recommendationEngine;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    // ========== Incident lookup ==========

    public Mono<List<Incident>> getIncidents(IncidentFilters filters) {
        IncidentFilters effective = filters != null ? filters : IncidentFilters.none();
        return stages.run(AnalysisStage.INCIDENT_LISTING, null, () ->
                stages.cached(CacheKeys.incidents(effective.cacheKey()),
                        properties.getCache().getCollectionTtl(), false, null,
                        () -> telemetryClient.listIncidents(effective)));
    }

    /**
     * Incident details, or empty when the platform has no such incident.
     */
    public Mono<Incident> getIncidentDetails(String incidentId) {
        return stages.run(AnalysisStage.INCIDENT_LOOKUP, incidentId, () ->
                stages.cached(CacheKeys.incidentDetails(incidentId),
                        properties.getCache().getCollectionTtl(), false, incidentId,
                        () -> telemetryClient.getIncident(incidentId)));
    }

    public Mono<Incident> requireIncident(String incidentId) {
        return getIncidentDetails(incidentId)
                .switchIfEmpty(Mono.error(() -> new IncidentNotFoundException(incidentId)));
    }

    // ========== Collection & analysis ==========

    public Mono<IncidentDataCollection> collectIncidentData(String incidentId) {
        return collectIncidentData(incidentId, false);
    }

    public Mono<IncidentDataCollection> collectIncidentData(String incidentId, boolean forceRefresh) {
        String key = CacheKeys.collection(incidentId);
        return stages.run(AnalysisStage.DATA_COLLECTION, incidentId, () ->
                inFlight.join(key, () ->
                        stages.cached(key, properties.getCache().getCollectionTtl(), forceRefresh, incidentId,
                                () -> requireIncident(incidentId).flatMap(collector::collect))));
    }

    public Mono<IncidentAnalysis> analyzeIncident(String incidentId) {
        return analyzeIncident(incidentId, false);
    }

    public Mono<IncidentAnalysis> analyzeIncident(String incidentId, boolean forceRefresh) {
        String key = CacheKeys.analysis(incidentId);
        return stages.run(AnalysisStage.INCIDENT_ANALYSIS, incidentId, () ->
                inFlight.join(key, () ->
                        stages.cached(key, properties.getCache().getAnalysisTtl(), forceRefresh, incidentId,
                                () -> collectIncidentData(incidentId, forceRefresh)
                                        .flatMap(this::buildAnalysis))));
    }

    private Mono<IncidentAnalysis> buildAnalysis(IncidentDataCollection data) {
        Incident incident = data.getIncident();
        structuredLogger.logAnalysisEvent(incident.getId(),
                TriageStructuredLogger.AnalysisEventType.STARTED, "Analyzing incident", Map.of());

        return correlatedEvents(incident).map(correlatedEvents -> {
            List<PossibleCause> possibleCauses = rootCauseChainBuilder.possibleCauses(data);
            List<Recommendation> recommendations = recommendationEngine.incidentRecommendations(
                    incident, data.getAffectedEntities(), data.getDeploymentEvents());

            IncidentAnalysis analysis = IncidentAnalysis.builder()
                    .incident(incident)
                    .timeline(new ArrayList<>(data.getTimeline()))
                    .affectedEntities(new ArrayList<>(data.getAffectedEntities()))
                    .metrics(riskModel.incidentMetrics(incident, data.getAffectedEntities(), clock.instant()))
                    .correlatedEvents(correlatedEvents)
                    .possibleCauses(possibleCauses)
                    .recommendations(recommendations)
                    .confidence(riskModel.analysisConfidence(possibleCauses, correlatedEvents))
                    .analysisMethod(ANALYSIS_METHOD)
                    .generatedAt(clock.instant())
                    .build();

            metrics.recordConfidence(analysis.getConfidence());
            structuredLogger.logIncidentAnalysis(incident.getId(), analysis);
            return analysis;
        });
    }

    public Mono<RootCauseAnalysis> performRootCauseAnalysis(Incident incident) {
        return stages.run(AnalysisStage.ROOT_CAUSE_ANALYSIS, incident.getId(), () ->
                collectIncidentData(incident.getId())
                        .map(rootCauseChainBuilder::analyze)
                        .doOnNext(rca -> log.info("Completed root cause analysis: incidentId={}, primaryCause={}, confidence={}",
                                incident.getId(), rca.getPrimaryCause().getType(), rca.getConfidenceScore())));
    }

    /**
     * Recommendations for an existing analysis. Deployment proximity is not re-fetched here.
     */
    public Mono<List<Recommendation>> generateRecommendations(IncidentAnalysis analysis) {
        return stages.run(AnalysisStage.RECOMMENDATIONS, analysis.getIncident().getId(), () ->
                Mono.fromCallable(() -> recommendationEngine.incidentRecommendations(
                        analysis.getIncident(), analysis.getAffectedEntities(), List.of())));
    }

    public Mono<IncidentReport> createIncidentReport(String incidentId) {
        return stages.run(AnalysisStage.INCIDENT_REPORT, incidentId, () ->
                analyzeIncident(incidentId).flatMap(analysis ->
                        performRootCauseAnalysis(analysis.getIncident())
                                .map(rootCause -> buildReport(analysis, rootCause))));
    }

    private IncidentReport buildReport(IncidentAnalysis analysis, RootCauseAnalysis rootCause) {
        List<Recommendation.ActionItem> actionItems = analysis.getRecommendations().stream()
                .flatMap(recommendation -> recommendation.getActionItems().stream())
                .collect(Collectors.toList());

        IncidentReport report = IncidentReport.builder()
                .incident(analysis.getIncident())
                .analysis(analysis)
                .rootCause(rootCause)
                .timeline(new ArrayList<>(analysis.getTimeline()))
                .impactAssessment(impactAssessment(analysis))
                .resolutionSummary(resolutionSummary(analysis.getIncident()))
                .lessonsLearned(recommendationEngine.lessonsLearned(analysis, rootCause))
                .actionItems(actionItems)
                .generatedAt(clock.instant())
                .generatedBy(REPORT_GENERATOR)
                .build();

        log.info("Created incident report: incidentId={}, actionItems={}",
                analysis.getIncident().getId(), actionItems.size());
        return report;
    }

    IncidentReport.ImpactAssessment impactAssessment(IncidentAnalysis analysis) {
        IncidentMetrics incidentMetrics = analysis.getMetrics();
        String businessImpact = incidentMetrics.getBusinessImpact();
        return IncidentReport.ImpactAssessment.builder()
                .durationMinutes(incidentMetrics.getDurationMinutes())
                // no user counts available from telemetry
                .affectedUsers(0)
                .affectedServices(analysis.getAffectedEntities().stream()
                        .map(AffectedEntity::getName)
                        .collect(Collectors.toList()))
                .businessImpact(businessImpact != null && !businessImpact.isBlank()
                        ? businessImpact : "Impact assessment pending")
                .reputationalImpact(incidentMetrics.getSeverity() == IncidentMetrics.IncidentSeverity.CRITICAL
                        ? "Potential customer impact" : null)
                .build();
    }

    IncidentReport.ResolutionSummary resolutionSummary(Incident incident) {
        if (incident.getClosedAt() == null) {
            return IncidentReport.ResolutionSummary.builder()
                    .resolutionMethod("Incident still open")
                    .timeToResolveMinutes(0)
                    .build();
        }
        return IncidentReport.ResolutionSummary.builder()
                .resolvedAt(incident.getClosedAt())
                .resolvedBy("Unknown")
                .resolutionMethod("Automatic resolution")
                .stepsToResolve(new ArrayList<>(List.of("Incident resolved automatically")))
                .timeToResolveMinutes(incident.durationMinutes(incident.getClosedAt()))
                .build();
    }

    // ========== Detection & correlation ==========

    public Mono<List<Anomaly>> detectAnomalies(String entityId, TimeRange timeRange) {
        return stages.run(AnalysisStage.ANOMALY_DETECTION, null, () ->
                collector.fetchMetricSeries(entityId, timeRange)
                        .map(rows -> anomalyDetector.detect(rows, entityId, entityId))
                        .doOnNext(anomalies -> {
                            metrics.recordAnomalies(anomalies.size());
                            log.info("Detected anomalies: entityId={}, since={}, until={}, count={}",
                                    entityId, timeRange.since(), timeRange.until(), anomalies.size());
                        }));
    }

    /**
     * Historical incidents on the same entity scored for similarity. The lookback start is floored
     * to the listing TTL so that repeated searches share one cached listing.
     */
    public Mono<List<SimilarIncident>> findSimilarIncidents(Incident incident) {
        Instant since = clock.instant().minus(properties.getSimilarity().getLookback());
        IncidentFilters filters = IncidentFilters.builder()
                .entityId(incident.getEntityId())
                .since(floor(since, properties.getCache().getCollectionTtl()))
                .build();
        return stages.run(AnalysisStage.SIMILAR_INCIDENTS, incident.getId(), () ->
                getIncidents(filters)
                        .map(history -> correlationEngine.similarIncidents(incident, history))
                        .doOnNext(similar -> log.info("Found similar incidents: incidentId={}, count={}",
                                incident.getId(), similar.size())));
    }

    static Instant floor(Instant instant, Duration granularity) {
        long step = granularity.toMillis();
        if (step <= 0) {
            return instant;
        }
        return Instant.ofEpochMilli(Math.floorDiv(instant.toEpochMilli(), step) * step);
    }

    public Mono<List<ErrorPattern>> analyzeErrorPatterns(List<ErrorEvent> errors) {
        return stages.run(AnalysisStage.ERROR_PATTERNS, null, () ->
                Mono.fromCallable(() -> errorPatternAnalyzer.analyze(errors)));
    }

    public Mono<List<CorrelatedEvent>> findCorrelatedEvents(Incident incident) {
        return stages.run(AnalysisStage.EVENT_CORRELATION, incident.getId(), () -> correlatedEvents(incident));
    }

    private Mono<List<CorrelatedEvent>> correlatedEvents(Incident incident) {
        TimeRange window = collector.correlationWindow(incident);
        return Mono.zip(
                        collector.collectDeploymentEvents(incident, window),
                        collector.collectInfrastructureEvents(incident, window))
                .map(events -> correlationEngine.correlateEvents(incident, events.getT1(), events.getT2()));
    }

    public Mono<List<DeploymentCorrelation>> analyzeDeploymentCorrelation(Incident incident) {
        return stages.run(AnalysisStage.DEPLOYMENT_CORRELATION, incident.getId(), () ->
                collector.collectDeploymentEvents(incident, collector.deploymentWindow(incident))
                        .map(deployments -> correlationEngine.deploymentCorrelations(incident, deployments)));
    }

    public Mono<List<InfrastructureCorrelation>> analyzeInfrastructureCorrelation(Incident incident) {
        return stages.run(AnalysisStage.INFRASTRUCTURE_CORRELATION, incident.getId(), () ->
                collector.collectInfrastructureEvents(incident, collector.correlationWindow(incident))
                        .map(events -> correlationEngine.infrastructureCorrelations(incident, events)));
    }
}
