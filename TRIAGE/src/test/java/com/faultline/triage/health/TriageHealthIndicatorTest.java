package com.faultline.triage.health;

import com.faultline.triage.cache.CaffeineResultCache;
import com.faultline.triage.cache.InFlightRequests;
import com.faultline.triage.client.TelemetryClient;
import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.detection.FaultPatternRegistry;
import com.faultline.triage.observability.TriageMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import static com.faultline.triage.support.IncidentFixtures.fixedClock;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TriageHealthIndicatorTest {

    @Mock
    private TelemetryClient telemetryClient;

    private final TriageProperties properties = new TriageProperties();

    private TriageHealthIndicator indicator(FaultPatternRegistry registry) {
        return new TriageHealthIndicator(registry, new CaffeineResultCache(properties),
                new InFlightRequests(new TriageMetrics(new SimpleMeterRegistry())), telemetryClient, properties);
    }

    @Test
    void upWithStarterPatterns() {
        when(telemetryClient.isStubMode()).thenReturn(true);

        StepVerifier.create(indicator(new FaultPatternRegistry(properties, fixedClock())).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("telemetry.mode", "STUB")
                            .containsEntry("analyses.inFlight", 0)
                            .containsEntry("cache.maximumSize", 10_000L);
                    assertThat((Integer) health.getDetails().get("patternRegistry.size")).isPositive();
                })
                .verifyComplete();
    }

    @Test
    void downWhenRegistryIsEmpty() {
        FaultPatternRegistry registry = mock(FaultPatternRegistry.class);
        when(registry.size()).thenReturn(0);
        when(telemetryClient.isStubMode()).thenReturn(false);

        StepVerifier.create(indicator(registry).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("telemetry.mode", "LIVE")
                            .containsKey("patternRegistry.error");
                })
                .verifyComplete();
    }
}
