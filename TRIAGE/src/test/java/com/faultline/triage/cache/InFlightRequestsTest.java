package com.faultline.triage.cache;

import com.faultline.triage.observability.TriageMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class InFlightRequestsTest {

    private SimpleMeterRegistry meterRegistry;
    private InFlightRequests inFlight;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        inFlight = new InFlightRequests(new TriageMetrics(meterRegistry));
    }

    @Test
    void concurrentCallersShareOneExecution() {
        AtomicInteger executions = new AtomicInteger();
        Sinks.One<String> result = Sinks.one();

        Mono<String> first = inFlight.join("incident_analysis:INC-1", () -> {
            executions.incrementAndGet();
            return result.asMono();
        });
        Mono<String> second = inFlight.join("incident_analysis:INC-1", () -> {
            executions.incrementAndGet();
            return Mono.just("other");
        });

        StepVerifier.create(Mono.zip(first, second))
                .then(() -> {
                    assertThat(inFlight.size()).isEqualTo(1);
                    result.tryEmitValue("analysis");
                })
                .assertNext(pair -> {
                    assertThat(pair.getT1()).isEqualTo("analysis");
                    assertThat(pair.getT2()).isEqualTo("analysis");
                })
                .verifyComplete();

        assertThat(executions).hasValue(1);
        assertThat(inFlight.size()).isZero();
    }

    @Test
    void errorsAreSharedAndEntryIsReleased() {
        AtomicInteger executions = new AtomicInteger();

        StepVerifier.create(inFlight.join("k", () -> {
                    executions.incrementAndGet();
                    return Mono.<String>error(new IllegalStateException("boom"));
                }))
                .expectErrorMessage("boom")
                .verify();

        StepVerifier.create(inFlight.join("k", () -> {
                    executions.incrementAndGet();
                    return Mono.just("recovered");
                }))
                .expectNext("recovered")
                .verifyComplete();

        assertThat(executions).hasValue(2);
    }

    @Test
    void distinctKeysRunIndependently() {
        AtomicInteger executions = new AtomicInteger();

        StepVerifier.create(Mono.zip(
                        inFlight.join("a", () -> Mono.fromCallable(executions::incrementAndGet)),
                        inFlight.join("b", () -> Mono.fromCallable(executions::incrementAndGet))))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(executions).hasValue(2);
    }

    @Test
    void onlyJoiningCallersCountAsShared() {
        Sinks.One<String> result = Sinks.one();

        StepVerifier.create(inFlight.join("k", result::asMono))
                .then(() -> {
                    assertThat(sharedCount()).isZero();
                    inFlight.join("k", () -> Mono.just("ignored")).subscribe();
                    assertThat(sharedCount()).isEqualTo(1.0);
                    result.tryEmitValue("done");
                })
                .expectNext("done")
                .verifyComplete();

        StepVerifier.create(inFlight.join("k", () -> Mono.just("fresh")))
                .expectNext("fresh")
                .verifyComplete();
        assertThat(sharedCount()).isEqualTo(1.0);
        assertThat(inFlight.size()).isZero();
    }

    private double sharedCount() {
        return meterRegistry.get("triage.inflight.shared").counter().count();
    }
}
