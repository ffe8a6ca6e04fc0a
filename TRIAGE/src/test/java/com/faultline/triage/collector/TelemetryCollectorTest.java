package com.faultline.triage.collector;

import com.faultline.triage.client.NrqlResult;
import com.faultline.triage.client.TelemetryClient;
import com.faultline.triage.client.TelemetryClientException;
import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.*;
import com.faultline.triage.observability.TriageMetrics;
import com.faultline.triage.observability.TriageStructuredLogger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.faultline.triage.support.IncidentFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelemetryCollectorTest {

    @Mock
    private TelemetryClient telemetryClient;

    private SimpleMeterRegistry meterRegistry;
    private TelemetryCollector collector;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        collector = new TelemetryCollector(telemetryClient, new TriageProperties(),
                new TriageStructuredLogger(), new TriageMetrics(meterRegistry), fixedClock());
    }

    @SafeVarargs
    private static NrqlResult rows(Map<String, Object>... rows) {
        return NrqlResult.builder().results(List.of(rows)).build();
    }

    @Test
    @DisplayName("open incident window runs from lookback before open to lookahead after now")
    void contextWindowForOpenIncident() {
        TimeRange range = collector.contextWindow(openIncident());

        assertThat(range.since()).isEqualTo(OPENED_AT.minus(Duration.ofMinutes(30)));
        assertThat(range.until()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
    }

    @Test
    void contextWindowForClosedIncidentEndsAfterClose() {
        Incident closed = incident(INCIDENT_ID).closedAt(OPENED_AT.plus(Duration.ofMinutes(20))).build();

        assertThat(collector.contextWindow(closed).until()).isEqualTo(OPENED_AT.plus(Duration.ofMinutes(35)));
    }

    @Test
    void timelineIsOrderedAndIncludesLifecycle() {
        Incident incident = incident(INCIDENT_ID)
                .closedAt(OPENED_AT.plus(Duration.ofMinutes(40)))
                .acknowledgement(Incident.Acknowledgement.builder()
                        .acknowledgedAt(OPENED_AT.plus(Duration.ofMinutes(3)))
                        .acknowledgedBy("oncall")
                        .build())
                .build();

        List<TimelineEvent> timeline = collector.buildTimeline(incident);

        assertThat(timeline).extracting(TimelineEvent::getType)
                .containsExactly("incident_opened", "incident_acknowledged", "incident_closed");
        assertThat(timeline.get(1).getDescription()).isEqualTo("Incident acknowledged by oncall");
    }

    @Test
    @DisplayName("failing sub-fetches degrade to empty data instead of failing the collection")
    void partialFailureYieldsEmptyLists() {
        when(telemetryClient.executeQuery(anyString())).thenAnswer(invocation -> {
            String query = invocation.getArgument(0);
            if (query.contains("FROM Deployment") || query.contains("FROM InfrastructureEvent")) {
                return Mono.error(new TelemetryClientException("query timed out"));
            }
            if (query.contains("FROM TransactionError")) {
                return Mono.just(rows(Map.of("message", "Timeout calling payments",
                        "appId", ENTITY_ID, "timestamp", OPENED_AT.toEpochMilli())));
            }
            if (query.contains("TIMESERIES")) {
                return Mono.just(rows(
                        Map.of("beginTimeSeconds", OPENED_AT.getEpochSecond(), "responseTime", 250.0),
                        Map.of("beginTimeSeconds", OPENED_AT.minusSeconds(300).getEpochSecond(), "responseTime", 210.0)));
            }
            return Mono.just(rows(Map.of("responseTime", 1800.0, "errorRate", 7.5, "throughput", 90.0)));
        });

        StepVerifier.create(collector.collect(openIncident()))
                .assertNext(collection -> {
                    assertThat(collection.getDeploymentEvents()).isEmpty();
                    assertThat(collection.getInfrastructureEvents()).isEmpty();
                    assertThat(collection.getErrorEvents()).singleElement()
                            .satisfies(error -> assertThat(error.getEntityName()).isEqualTo(ENTITY_NAME));
                    assertThat(collection.getAffectedEntities()).singleElement().satisfies(entity -> {
                        assertThat(entity.getGuid()).isEqualTo(ENTITY_ID);
                        assertThat(entity.getImpactLevel()).isEqualTo(Severity.HIGH);
                        assertThat(entity.getMetrics().getErrorRate()).isEqualTo(7.5);
                        assertThat(entity.getMetrics().getMemoryUsage()).isNull();
                    });
                    assertThat(collection.getPerformanceData()).extracting(PerformanceSnapshot::getResponseTime)
                            .containsExactly(210.0, 250.0);
                    assertThat(collection.getTimeline()).extracting(TimelineEvent::getType)
                            .containsExactly("incident_opened");
                })
                .verifyComplete();

        assertThat(meterRegistry.find("triage.collection.partial").counters()).isNotEmpty();
    }

    @Test
    void entityMetricsFailureFallsBackToEmptyMetrics() {
        when(telemetryClient.executeQuery(anyString()))
                .thenReturn(Mono.error(new TelemetryClientException("unavailable")));

        StepVerifier.create(collector.identifyAffectedEntities(openIncident()))
                .assertNext(entities -> assertThat(entities).singleElement()
                        .satisfies(entity -> assertThat(entity.getMetrics().getResponseTime()).isZero()))
                .verifyComplete();
    }

    @Test
    void incidentWithoutEntitiesSkipsEntityQueries() {
        Incident bare = incident(INCIDENT_ID).entityId(null).entityName(null).build();
        TimeRange range = collector.contextWindow(bare);

        StepVerifier.create(collector.collectErrorEvents(bare, range))
                .assertNext(errors -> assertThat(errors).isEmpty())
                .verifyComplete();
        StepVerifier.create(collector.collectDeploymentEvents(bare, range))
                .assertNext(deployments -> assertThat(deployments).isEmpty())
                .verifyComplete();
    }
}
