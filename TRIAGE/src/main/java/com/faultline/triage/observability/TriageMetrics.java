package com.faultline.triage.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for the TRIAGE engine.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Analysis throughput, latency and confidence per operation</li>
 *     <li>Detection output (anomalies, fault patterns)</li>
 *     <li>Telemetry query latency and partial-data degradations</li>
 *     <li>Result cache effectiveness and shared in-flight requests</li>
 * </ul>
 */
@Component
public class TriageMetrics {

    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter analysesStarted;
    @Getter
    private final Counter analysesCompleted;
    @Getter
    private final Counter analysesFailed;
    private final DistributionSummary analysisConfidence;
    private final Map<String, Timer> latencyByOperation = new ConcurrentHashMap<>();

    @Getter
    private final Counter anomaliesDetected;
    @Getter
    private final Counter patternsDetected;
    @Getter
    private final Counter patternsLearned;

    private final Timer queryLatency;
    @Getter
    private final Counter queryFailures;
    private final Map<String, Counter> partialDataBySource = new ConcurrentHashMap<>();

    @Getter
    private final Counter cacheHits;
    @Getter
    private final Counter cacheMisses;
    @Getter
    private final Counter sharedInFlight;

    public TriageMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.analysesStarted = Counter.builder("triage.analysis.started")
                .description("Analysis operations started")
                .register(meterRegistry);
        this.analysesCompleted = Counter.builder("triage.analysis.completed")
                .description("Analysis operations completed successfully")
                .register(meterRegistry);
        this.analysesFailed = Counter.builder("triage.analysis.failed")
                .description("Analysis operations failed")
                .register(meterRegistry);
        this.analysisConfidence = DistributionSummary.builder("triage.analysis.confidence")
                .description("Aggregate confidence of completed analyses")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);

        this.anomaliesDetected = Counter.builder("triage.anomalies.detected")
                .description("Statistical anomalies detected")
                .register(meterRegistry);
        this.patternsDetected = Counter.builder("triage.patterns.detected")
                .description("Fault patterns detected above the confidence threshold")
                .register(meterRegistry);
        this.patternsLearned = Counter.builder("triage.patterns.learned")
                .description("Pattern occurrences recorded by the learning path")
                .register(meterRegistry);

        this.queryLatency = Timer.builder("triage.telemetry.query.latency")
                .description("Telemetry query latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.queryFailures = Counter.builder("triage.telemetry.query.failed")
                .description("Telemetry queries that failed")
                .register(meterRegistry);

        this.cacheHits = Counter.builder("triage.cache.hits")
                .description("Result cache hits")
                .register(meterRegistry);
        this.cacheMisses = Counter.builder("triage.cache.misses")
                .description("Result cache misses")
                .register(meterRegistry);
        this.sharedInFlight = Counter.builder("triage.inflight.shared")
                .description("Callers joined onto an analysis already in flight")
                .register(meterRegistry);
    }

    // ========== Analysis Methods ==========

    public Timer.Sample startAnalysisTimer() {
        analysesStarted.increment();
        return Timer.start(meterRegistry);
    }

    public void recordAnalysisCompleted(Timer.Sample sample, String operation) {
        sample.stop(latencyTimer(operation));
        analysesCompleted.increment();
    }

    public void recordAnalysisFailed(Timer.Sample sample, String operation) {
        sample.stop(latencyTimer(operation));
        analysesFailed.increment();
    }

    public void recordConfidence(double confidence) {
        analysisConfidence.record(confidence);
    }

    public void recordAnomalies(int count) {
        anomaliesDetected.increment(count);
    }

    public void recordPatternsDetected(int count) {
        patternsDetected.increment(count);
    }

    public void recordPatternLearned() {
        patternsLearned.increment();
    }

    // ========== Telemetry Methods ==========

    public void recordQuery(Duration duration, boolean success) {
        queryLatency.record(duration);
        if (!success) {
            queryFailures.increment();
        }
    }

    public void recordPartialData(String source) {
        partialDataBySource.computeIfAbsent(source, s -> Counter.builder("triage.collection.partial")
                .description("Telemetry sub-fetches replaced with empty data")
                .tag("source", s)
                .register(meterRegistry))
                .increment();
    }

    // ========== Cache Methods ==========

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordSharedInFlight() {
        sharedInFlight.increment();
    }

    private Timer latencyTimer(String operation) {
        return latencyByOperation.computeIfAbsent(operation, op -> Timer.builder("triage.analysis.latency")
                .description("Analysis latency by operation")
                .tag("operation", op)
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry));
    }
}
