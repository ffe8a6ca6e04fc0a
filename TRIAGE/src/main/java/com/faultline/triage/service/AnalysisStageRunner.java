package com.faultline.triage.service;

import com.faultline.triage.cache.ResultCache;
import com.faultline.triage.observability.TriageMetrics;
import com.faultline.triage.observability.TriageStructuredLogger;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Shared execution wrapper for exposed analysis operations.
 * <p>
 * Every operation runs through {@link #run} so that it is timed, counted, and its
 * failures carry the stage and incident id. {@link #cached} layers the result cache
 * on top for the operations that memoize.
 */
@Slf4j
@Component
public class AnalysisStageRunner {

    private final ResultCache cache;
    private final TriageMetrics metrics;
    private final TriageStructuredLogger structuredLogger;

    public AnalysisStageRunner(ResultCache cache,
                               TriageMetrics metrics,
                               TriageStructuredLogger structuredLogger) {
        this.cache = cache;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    public <T> Mono<T> run(AnalysisStage stage, String incidentId, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            Timer.Sample sample = metrics.startAnalysisTimer();
            String operation = stage.name().toLowerCase(Locale.ROOT);
            log.debug("{} started: incidentId={}", stage.getDescription(), incidentId);

            return Mono.defer(work)
                    .doOnSuccess(result -> metrics.recordAnalysisCompleted(sample, operation))
                    .onErrorMap(error -> AnalysisException.wrap(stage, incidentId, error))
                    .doOnError(error -> {
                        metrics.recordAnalysisFailed(sample, operation);
                        Map<String, Object> details = new LinkedHashMap<>();
                        details.put("stage", operation);
                        details.put("error", error.getClass().getSimpleName());
                        structuredLogger.logAnalysisEvent(incidentId,
                                TriageStructuredLogger.AnalysisEventType.FAILED,
                                String.valueOf(error.getMessage()), details);
                    });
        });
    }

    /**
     * Serve {@code key} from the cache unless {@code forceRefresh}; otherwise compute and store with {@code ttl}.
     */
    public <T> Mono<T> cached(String key, Duration ttl, boolean forceRefresh,
                              String incidentId, Supplier<Mono<T>> compute) {
        return Mono.defer(() -> {
            if (!forceRefresh) {
                Optional<T> hit = cache.get(key);
                if (hit.isPresent()) {
                    metrics.recordCacheHit();
                    structuredLogger.logAnalysisEvent(incidentId,
                            TriageStructuredLogger.AnalysisEventType.CACHE_HIT,
                            "Served from cache", Map.of("key", key));
                    return Mono.just(hit.get());
                }
            }
            metrics.recordCacheMiss();
            return Mono.defer(compute)
                    .doOnNext(value -> cache.set(key, value, ttl));
        });
    }
}
