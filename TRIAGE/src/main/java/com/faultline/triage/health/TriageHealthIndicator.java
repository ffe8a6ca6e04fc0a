package com.faultline.triage.health;

import com.faultline.triage.cache.InFlightRequests;
import com.faultline.triage.cache.ResultCache;
import com.faultline.triage.client.TelemetryClient;
import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.detection.FaultPatternRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for TRIAGE.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Fault pattern registry size</li>
 *     <li>Result cache size and in-flight analyses</li>
 *     <li>Telemetry client mode</li>
 * </ul>
 * An empty pattern registry reports DOWN: no pattern can ever be detected.
 */
@Slf4j
@Component
public class TriageHealthIndicator implements ReactiveHealthIndicator {

    private final FaultPatternRegistry registry;
    private final ResultCache cache;
    private final InFlightRequests inFlight;
    private final TelemetryClient telemetryClient;
    private final TriageProperties properties;

    public TriageHealthIndicator(FaultPatternRegistry registry,
                                 ResultCache cache,
                                 InFlightRequests inFlight,
                                 TelemetryClient telemetryClient,
                                 TriageProperties properties) {
        this.registry = registry;
        this.cache = cache;
        this.inFlight = inFlight;
        this.telemetryClient = telemetryClient;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();

        int patterns = registry.size();
        details.put("patternRegistry.size", patterns);
        details.put("cache.size", cache.size());
        details.put("cache.maximumSize", properties.getCache().getMaximumSize());
        details.put("analyses.inFlight", inFlight.size());
        details.put("telemetry.mode", telemetryClient.isStubMode() ? "STUB" : "LIVE");

        if (patterns == 0) {
            log.warn("Fault pattern registry is empty");
            details.put("patternRegistry.error", "No fault patterns registered");
            return Health.down().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }
}
