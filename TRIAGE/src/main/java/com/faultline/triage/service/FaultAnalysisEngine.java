package com.faultline.triage.service;

import com.faultline.triage.cache.CacheKeys;
import com.faultline.triage.cache.ResultCache;
import com.faultline.triage.cascade.CascadeAnalyzer;
import com.faultline.triage.collector.TelemetryCollector;
import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.detection.AnomalyDetector;
import com.faultline.triage.detection.FaultPatternRegistry;
import com.faultline.triage.detection.FaultPatternValidator;
import com.faultline.triage.detection.PatternExtractionStrategy;
import com.faultline.triage.detection.PatternMatcher;
import com.faultline.triage.domain.model.*;
import com.faultline.triage.observability.TriageMetrics;
import com.faultline.triage.observability.TriageStructuredLogger;
import com.faultline.triage.observability.TriageStructuredLogger.PatternEventType;
import com.faultline.triage.rca.ProgressionAnalyzer;
import com.faultline.triage.rca.RootCauseChainBuilder;
import com.faultline.triage.recommendation.RecommendationEngine;
import com.faultline.triage.risk.RiskModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Fault-level analysis on top of {@link IncidentAnalyzer}.
 * <p>
 * Owns the fault pattern registry and drives:
 * <ol>
 *     <li>pattern detection against collected performance data</li>
 *     <li>progression, root cause chain, risk, escalation and cascade analysis</li>
 *     <li>the comprehensive analysis and its action plan</li>
 *     <li>the learning feedback path into the registry</li>
 * </ol>
 */
@Slf4j
@Service
public class FaultAnalysisEngine {

    /** Learned pattern extraction is attempted only below this comprehensive confidence */
    static final double EXTRACTION_CONFIDENCE_CEILING = 0.5;

    private final IncidentAnalyzer incidentAnalyzer;
    private final TelemetryCollector collector;
    private final FaultPatternRegistry registry;
    private final PatternMatcher patternMatcher;
    private final PatternExtractionStrategy extractionStrategy;
    private final AnomalyDetector anomalyDetector;
    private final ProgressionAnalyzer progressionAnalyzer;
    private final RootCauseChainBuilder rootCauseChainBuilder;
    private final RiskModel riskModel;
    private final CascadeAnalyzer cascadeAnalyzer;
    private final RecommendationEngine recommendationEngine;
    private final AnalysisStageRunner stages;
    private final ResultCache cache;
    private final TriageProperties properties;
    private final TriageMetrics metrics;
    private final TriageStructuredLogger structuredLogger;
    private final Clock clock;

    public FaultAnalysisEngine(IncidentAnalyzer incidentAnalyzer,
                               TelemetryCollector collector,
                               FaultPatternRegistry registry,
                               PatternMatcher patternMatcher,
                               PatternExtractionStrategy extractionStrategy,
                               AnomalyDetector anomalyDetector,
                               ProgressionAnalyzer progressionAnalyzer,
                               RootCauseChainBuilder rootCauseChainBuilder,
                               RiskModel riskModel,
                               CascadeAnalyzer cascadeAnalyzer,
                               RecommendationEngine recommendationEngine,
                               AnalysisStageRunner stages,
                               ResultCache cache,
                               TriageProperties properties,
                               TriageMetrics metrics,
                               TriageStructuredLogger structuredLogger,
                               Clock clock) {
        this.incidentAnalyzer = incidentAnalyzer;
        this.collector = collector;
        this.registry = registry;
        this.patternMatcher = patternMatcher;
        this.extractionStrategy = extractionStrategy;
        this.anomalyDetector = anomalyDetector;
        this.progressionAnalyzer = progressionAnalyzer;
        this.rootCauseChainBuilder = rootCauseChainBuilder;
        this.riskModel = riskModel;
        this.cascadeAnalyzer = cascadeAnalyzer;
        this.recommendationEngine = recommendationEngine;
        this.stages = stages;
        this.cache = cache;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    // ========== Detection ==========

    public Mono<List<FaultPattern>> detectFaultPatterns(Incident incident) {
        return detectFaultPatterns(incident, false);
    }

    /**
     * Registered patterns matching the incident's performance data. Detection works on copies;
     * the registry only changes through {@link #learnFromIncident} and {@link #updatePatternDatabase}.
     */
    public Mono<List<FaultPattern>> detectFaultPatterns(Incident incident, boolean forceRefresh) {
        return stages.run(AnalysisStage.PATTERN_DETECTION, incident.getId(), () ->
                stages.cached(CacheKeys.faultPatterns(incident.getId()),
                        properties.getCache().getPatternTtl(), forceRefresh, incident.getId(),
                        () -> incidentAnalyzer.collectIncidentData(incident.getId())
                                .map(data -> patternMatcher.detect(registry.snapshot(),
                                        data.getPerformanceData(), incident, clock.instant()))
                                .doOnNext(patterns -> {
                                    metrics.recordPatternsDetected(patterns.size());
                                    log.info("Detected fault patterns: incidentId={}, patternCount={}",
                                            incident.getId(), patterns.size());
                                })));
    }

    public Mono<ProgressionAnalysis> analyzeFaultProgression(Incident incident) {
        return stages.run(AnalysisStage.FAULT_PROGRESSION, incident.getId(), () ->
                incidentAnalyzer.collectIncidentData(incident.getId())
                        .map(progressionAnalyzer::analyze));
    }

    public Mono<CauseChain> identifyRootCauseChain(Incident incident) {
        return stages.run(AnalysisStage.ROOT_CAUSE_CHAIN, incident.getId(), () ->
                incidentAnalyzer.analyzeIncident(incident.getId())
                        .map(rootCauseChainBuilder::causeChain)
                        .doOnNext(chain -> log.info("Identified root cause chain: incidentId={}, rootCause={}, confidence={}",
                                incident.getId(), chain.getRootCause(), chain.getConfidence())));
    }

    // ========== Risk ==========

    public Mono<RiskAssessment> assessIncidentRisk(Incident incident) {
        return stages.run(AnalysisStage.RISK_ASSESSMENT, incident.getId(), () ->
                incidentAnalyzer.analyzeIncident(incident.getId())
                        .map(riskModel::assess)
                        .doOnNext(risk -> log.info("Assessed incident risk: incidentId={}, risk={}, escalationProbability={}",
                                incident.getId(), risk.getCurrentRisk(), risk.getEscalationProbability())));
    }

    public Mono<EscalationPrediction> predictEscalation(Incident incident) {
        return stages.run(AnalysisStage.ESCALATION_PREDICTION, incident.getId(), () ->
                incidentAnalyzer.analyzeIncident(incident.getId())
                        .map(analysis -> riskModel.predictEscalation(analysis, riskModel.assess(analysis))));
    }

    public Mono<RiskAssessment.BusinessImpact> calculateBusinessImpact(Incident incident) {
        return stages.run(AnalysisStage.BUSINESS_IMPACT, incident.getId(), () ->
                incidentAnalyzer.analyzeIncident(incident.getId())
                        .map(riskModel::businessImpact));
    }

    // ========== Comprehensive analysis ==========

    public Mono<AnalysisResult> performComprehensiveAnalysis(Incident incident) {
        return performComprehensiveAnalysis(incident, false);
    }

    public Mono<AnalysisResult> performComprehensiveAnalysis(Incident incident, boolean forceRefresh) {
        String incidentId = incident.getId();
        return stages.run(AnalysisStage.COMPREHENSIVE_ANALYSIS, incidentId, () ->
                stages.cached(CacheKeys.comprehensiveAnalysis(incidentId),
                        properties.getCache().getEngineTtl(), forceRefresh, incidentId,
                        () -> Mono.zip(
                                        detectFaultPatterns(incident, forceRefresh),
                                        incidentAnomalies(incident),
                                        incidentAnalyzer.findCorrelatedEvents(incident),
                                        assessIncidentRisk(incident))
                                .flatMap(parts -> incidentAnalyzer.collectIncidentData(incidentId)
                                        .flatMap(data -> incidentAnalyzer.analyzeErrorPatterns(data.getErrorEvents()))
                                        .map(errorPatterns -> AnalysisResult.builder()
                                                .incident(incident)
                                                .detectedPatterns(parts.getT1())
                                                .anomalies(parts.getT2())
                                                .errorPatterns(errorPatterns)
                                                .correlatedEvents(parts.getT3())
                                                .riskAssessment(parts.getT4())
                                                .recommendations(recommendationEngine.analysisRecommendations(
                                                        parts.getT4(), parts.getT1(), parts.getT2()))
                                                .confidence(riskModel.comprehensiveConfidence(
                                                        parts.getT1(), parts.getT2(), parts.getT3()))
                                                .analysisTimestamp(clock.instant())
                                                .build()))
                                .doOnNext(result -> {
                                    metrics.recordConfidence(result.getConfidence());
                                    structuredLogger.logIncidentAnalysis(incidentId, result);
                                })));
    }

    /**
     * Anomalies on the primary entity over the incident's context window.
     */
    private Mono<List<Anomaly>> incidentAnomalies(Incident incident) {
        if (incident.getEntityId() == null) {
            return Mono.just(List.of());
        }
        TimeRange window = collector.contextWindow(incident);
        return collector.fetchMetricSeries(incident.getEntityId(), window)
                .map(rows -> anomalyDetector.detect(rows, incident.getEntityId(),
                        incident.getEntityName() != null ? incident.getEntityName() : incident.getEntityId()))
                .doOnNext(anomalies -> metrics.recordAnomalies(anomalies.size()));
    }

    public Mono<ActionPlan> generateActionPlan(AnalysisResult analysis) {
        return stages.run(AnalysisStage.ACTION_PLAN, analysis.getIncident().getId(), () ->
                Mono.fromCallable(() -> recommendationEngine.actionPlan(analysis)));
    }

    // ========== Cascade ==========

    public Mono<CascadeAnalysis> analyzeCascadeFailure(Incident incident) {
        return stages.run(AnalysisStage.CASCADE_ANALYSIS, incident.getId(), () ->
                incidentAnalyzer.analyzeIncident(incident.getId())
                        .map(cascadeAnalyzer::analyze)
                        .doOnNext(cascade -> log.info("Completed cascade failure analysis: incidentId={}, primaryFailure={}, cascadeSteps={}",
                                incident.getId(), cascade.getPrimaryFailure(), cascade.getCascadeChain().size())));
    }

    public Mono<List<FailurePoint>> identifyFailurePoints(Incident incident) {
        return stages.run(AnalysisStage.FAILURE_POINTS, incident.getId(), () ->
                incidentAnalyzer.analyzeIncident(incident.getId())
                        .map(cascadeAnalyzer::failurePoints));
    }

    // ========== Learning ==========

    /**
     * Feed a resolved incident back into the registry. Detected patterns record the occurrence;
     * an incident nothing explains is offered to the {@link PatternExtractionStrategy}.
     */
    public Mono<Void> learnFromIncident(Incident incident, String resolution) {
        String incidentId = incident.getId();
        return stages.run(AnalysisStage.LEARNING, incidentId, () ->
                performComprehensiveAnalysis(incident, true)
                        .doOnNext(analysis -> learn(incident, analysis, resolution))
                        .then());
    }

    private void learn(Incident incident, AnalysisResult analysis, String resolution) {
        Instant now = clock.instant();
        FaultExample example = PatternMatcher.exampleOf(incident, now, resolution);

        for (FaultPattern detected : analysis.getDetectedPatterns()) {
            registry.recordOccurrence(detected.getId(), example, now).ifPresent(updated -> {
                metrics.recordPatternLearned();
                structuredLogger.logPatternEvent(updated.getId(), PatternEventType.OCCURRENCE_RECORDED,
                        "Recorded pattern occurrence",
                        Map.of("incidentId", incident.getId(),
                                "frequency", updated.getFrequency(),
                                "examples", updated.getExamples().size()));
            });
        }

        if (analysis.getDetectedPatterns().isEmpty() && analysis.getConfidence() < EXTRACTION_CONFIDENCE_CEILING) {
            extractionStrategy.extract(incident, analysis, resolution)
                    .ifPresent(pattern -> {
                        registry.upsertAll(List.of(pattern));
                        metrics.recordPatternLearned();
                        structuredLogger.logPatternEvent(pattern.getId(), PatternEventType.PATTERN_ADDED,
                                "Extracted new fault pattern", Map.of("incidentId", incident.getId()));
                    });
        }
        log.info("Completed learning from incident: incidentId={}, detectedPatterns={}",
                incident.getId(), analysis.getDetectedPatterns().size());
    }

    /**
     * Replace registered patterns by id and append new ones, then refresh the cached pattern database.
     * An update holding any invalid pattern is rejected whole and leaves the registry untouched.
     */
    public Mono<Void> updatePatternDatabase(List<FaultPattern> patterns) {
        return stages.run(AnalysisStage.PATTERN_DATABASE_UPDATE, null, () -> Mono.fromRunnable(() -> {
            FaultPatternValidator.validate(patterns);
            Set<String> known = new HashSet<>();
            registry.snapshot().forEach(pattern -> known.add(pattern.getId()));

            List<FaultPattern> updated = registry.upsertAll(patterns);
            cache.set(CacheKeys.PATTERN_DATABASE, updated, properties.getCache().getPatternTtl());

            for (FaultPattern pattern : patterns) {
                structuredLogger.logPatternEvent(pattern.getId(),
                        known.contains(pattern.getId()) ? PatternEventType.PATTERN_REPLACED : PatternEventType.PATTERN_ADDED,
                        "Updated pattern database", Map.of("totalPatterns", updated.size()));
            }
        }));
    }
}
