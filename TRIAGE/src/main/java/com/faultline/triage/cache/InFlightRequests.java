package com.faultline.triage.cache;

import com.faultline.triage.observability.TriageMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Collapses concurrent requests for the same key onto one shared execution.
 * <p>
 * The first caller for a key starts the work; callers arriving before it terminates
 * receive the same result or error. The entry is removed on termination, so the next
 * caller after completion starts fresh (and normally hits the result cache instead).
 */
@Slf4j
@Component
public class InFlightRequests {

    private final ConcurrentMap<String, Mono<?>> inFlight = new ConcurrentHashMap<>();
    private final TriageMetrics metrics;

    public InFlightRequests(TriageMetrics metrics) {
        this.metrics = metrics;
    }

    public <T> Mono<T> join(String key, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            AtomicReference<Mono<T>> created = new AtomicReference<>();
            Mono<?> shared = inFlight.computeIfAbsent(key, k -> {
                Mono<T> execution = Mono.defer(work)
                        .doFinally(signal -> inFlight.remove(k, created.get()))
                        .cache();
                created.set(execution);
                return execution;
            });
            if (created.get() == null) {
                metrics.recordSharedInFlight();
                log.debug("Joined in-flight request: key={}", key);
            }
            return typed(shared);
        });
    }

    // one key always maps to executions of one result type
    @SuppressWarnings("unchecked")
    private static <T> Mono<T> typed(Mono<?> shared) {
        return (Mono<T>) shared;
    }

    public int size() {
        return inFlight.size();
    }
}
