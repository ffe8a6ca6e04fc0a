package com.faultline.triage.service;

import com.faultline.triage.client.IncidentFilters;
import com.faultline.triage.client.NrqlResult;
import com.faultline.triage.client.TelemetryClient;
import com.faultline.triage.client.TelemetryClientException;
import com.faultline.triage.domain.model.*;
import com.faultline.triage.support.TriageWiring;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.faultline.triage.support.IncidentFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IncidentAnalyzerTest {

    @Mock
    private TelemetryClient telemetryClient;

    private TriageWiring wiring;
    private IncidentAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        wiring = new TriageWiring(telemetryClient);
        analyzer = wiring.incidentAnalyzer;
        lenient().when(telemetryClient.executeQuery(anyString())).thenReturn(Mono.just(NrqlResult.empty()));
    }

    @Nested
    @DisplayName("incident lookup")
    class Lookup {

        @Test
        void unknownIncidentFailsWithNotFound() {
            when(telemetryClient.getIncident("INC-404")).thenReturn(Mono.empty());

            StepVerifier.create(analyzer.analyzeIncident("INC-404"))
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(IncidentNotFoundException.class)
                            .hasMessage("Incident INC-404 not found"))
                    .verify();
        }

        @Test
        void missingDetailsCompleteEmpty() {
            when(telemetryClient.getIncident("INC-404")).thenReturn(Mono.empty());

            StepVerifier.create(analyzer.getIncidentDetails("INC-404")).verifyComplete();
        }

        @Test
        void listingsAreCachedPerFilter() {
            when(telemetryClient.listIncidents(any())).thenReturn(Mono.just(List.of(openIncident())));
            IncidentFilters filters = IncidentFilters.builder().onlyOpen(true).build();

            StepVerifier.create(analyzer.getIncidents(filters)).expectNextCount(1).verifyComplete();
            StepVerifier.create(analyzer.getIncidents(IncidentFilters.builder().onlyOpen(true).build()))
                    .expectNextCount(1).verifyComplete();

            verify(telemetryClient, times(1)).listIncidents(any());
        }
    }

    @Nested
    @DisplayName("incident analysis")
    class Analysis {

        @BeforeEach
        void incidentExists() {
            lenient().when(telemetryClient.getIncident(INCIDENT_ID)).thenReturn(Mono.just(openIncident()));
        }

        @Test
        void analysisIsServedFromCacheUntilForced() {
            IncidentAnalysis first = analyzer.analyzeIncident(INCIDENT_ID).block();
            IncidentAnalysis second = analyzer.analyzeIncident(INCIDENT_ID).block();
            IncidentAnalysis forced = analyzer.analyzeIncident(INCIDENT_ID, true).block();

            assertThat(second).isSameAs(first);
            assertThat(forced).isNotSameAs(first);
            assertThat(first.getAnalysisMethod()).isEqualTo("automated_correlation_analysis");
            assertThat(first.getGeneratedAt()).isEqualTo(NOW);
            assertThat(first.getMetrics().getDurationMinutes()).isEqualTo(45);
            verify(telemetryClient, times(1)).getIncident(INCIDENT_ID);
            assertThat(wiring.meterRegistry.get("triage.cache.hits").counter().count()).isPositive();
        }

        @Test
        @DisplayName("concurrent analyses of one incident share a single execution")
        void concurrentAnalysesShareExecution() {
            Sinks.One<Incident> incident = Sinks.one();
            when(telemetryClient.getIncident(INCIDENT_ID)).thenReturn(incident.asMono());

            StepVerifier.create(Mono.zip(analyzer.analyzeIncident(INCIDENT_ID), analyzer.analyzeIncident(INCIDENT_ID)))
                    .then(() -> incident.tryEmitValue(openIncident()))
                    .assertNext(pair -> assertThat(pair.getT1()).isSameAs(pair.getT2()))
                    .verifyComplete();

            verify(telemetryClient, times(1)).getIncident(INCIDENT_ID);
        }

        @Test
        void analysisCorrelatesRecentDeployment() {
            when(telemetryClient.executeQuery(anyString())).thenAnswer(invocation -> {
                String query = invocation.getArgument(0);
                if (query.contains("FROM Deployment")) {
                    return Mono.just(NrqlResult.builder().results(List.of(Map.<String, Object>of(
                            "timestamp", OPENED_AT.minus(Duration.ofMinutes(10)).toEpochMilli(),
                            "appId", ENTITY_ID, "appName", ENTITY_NAME, "revision", "a1b2c3d"))).build());
                }
                return Mono.just(NrqlResult.empty());
            });

            StepVerifier.create(analyzer.analyzeIncident(INCIDENT_ID))
                    .assertNext(analysis -> {
                        assertThat(analysis.getCorrelatedEvents()).singleElement()
                                .satisfies(event -> assertThat(event.getCorrelationScore()).isGreaterThan(0.5));
                        assertThat(analysis.getRecommendations()).extracting(Recommendation::getTitle)
                                .contains("Consider Deployment Rollback");
                        assertThat(analysis.getPossibleCauses()).extracting(PossibleCause::getType)
                                .contains(CauseType.CODE_DEPLOYMENT);
                    })
                    .verifyComplete();
        }

        @Test
        void openIncidentReportIsStillOpen() {
            StepVerifier.create(analyzer.createIncidentReport(INCIDENT_ID))
                    .assertNext(report -> {
                        assertThat(report.getGeneratedBy()).isEqualTo("TRIAGE");
                        assertThat(report.getResolutionSummary().getResolutionMethod()).isEqualTo("Incident still open");
                        assertThat(report.getRootCause()).isNotNull();
                        assertThat(report.getActionItems()).isNotEmpty();
                        assertThat(report.getImpactAssessment().getAffectedUsers()).isZero();
                    })
                    .verifyComplete();
        }
    }

    @Test
    void closedIncidentResolvesAutomatically() {
        Incident closed = incident(INCIDENT_ID).closedAt(OPENED_AT.plus(Duration.ofMinutes(25))).build();

        IncidentReport.ResolutionSummary summary = analyzer.resolutionSummary(closed);

        assertThat(summary.getResolutionMethod()).isEqualTo("Automatic resolution");
        assertThat(summary.getResolvedBy()).isEqualTo("Unknown");
        assertThat(summary.getTimeToResolveMinutes()).isEqualTo(25);
        assertThat(summary.getStepsToResolve()).containsExactly("Incident resolved automatically");
    }

    @Test
    void blankBusinessImpactIsPending() {
        IncidentAnalysis analysis = analysis(openIncident(), List.of(entity(ENTITY_ID, ENTITY_NAME, 300, 2)),
                IncidentMetrics.IncidentSeverity.CRITICAL, 45);
        analysis.getMetrics().setBusinessImpact(" ");

        IncidentReport.ImpactAssessment impact = analyzer.impactAssessment(analysis);

        assertThat(impact.getBusinessImpact()).isEqualTo("Impact assessment pending");
        assertThat(impact.getReputationalImpact()).isEqualTo("Potential customer impact");
        assertThat(impact.getAffectedServices()).containsExactly(ENTITY_NAME);
    }

    @Test
    @DisplayName("telemetry failures surface with the failing stage attached")
    void anomalyDetectionFailureCarriesStage() {
        when(telemetryClient.executeQuery(anyString()))
                .thenReturn(Mono.error(new TelemetryClientException("rate limited")));

        StepVerifier.create(analyzer.detectAnomalies(ENTITY_ID, new TimeRange(OPENED_AT, NOW)))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(AnalysisException.class)
                            .hasMessage("Anomaly detection failed: rate limited")
                            .hasCauseInstanceOf(TelemetryClientException.class);
                    assertThat(((AnalysisException) error).getStage()).isEqualTo(AnalysisStage.ANOMALY_DETECTION);
                })
                .verify();
    }

    @Test
    void similarIncidentSearchLooksBackFromNow() {
        when(telemetryClient.listIncidents(any())).thenReturn(Mono.just(List.of()));

        StepVerifier.create(analyzer.findSimilarIncidents(openIncident()))
                .assertNext(similar -> assertThat(similar).isEmpty())
                .verifyComplete();

        ArgumentCaptor<IncidentFilters> filters = ArgumentCaptor.forClass(IncidentFilters.class);
        verify(telemetryClient).listIncidents(filters.capture());
        assertThat(filters.getValue().getEntityId()).isEqualTo(ENTITY_ID);
        // truncated to the ten-minute listing TTL
        assertThat(filters.getValue().getSince()).isEqualTo(NOW.minus(Duration.ofDays(90)).minus(Duration.ofMinutes(5)));
    }

    @Test
    void similarIncidentSearchReusesListingWithinTtlBucket() {
        AtomicReference<Instant> now = new AtomicReference<>(NOW);
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(invocation -> now.get());
        IncidentAnalyzer ticking = new TriageWiring(telemetryClient, null, clock).incidentAnalyzer;
        when(telemetryClient.listIncidents(any())).thenReturn(Mono.just(List.of()));

        StepVerifier.create(ticking.findSimilarIncidents(openIncident())).expectNextCount(1).verifyComplete();
        now.set(NOW.plus(Duration.ofMinutes(3)));
        StepVerifier.create(ticking.findSimilarIncidents(openIncident())).expectNextCount(1).verifyComplete();

        verify(telemetryClient, times(1)).listIncidents(any());
    }

    @Test
    void recommendationsForExistingAnalysisIgnoreDeployments() {
        IncidentAnalysis analysis = analysis(openIncident(), List.of(entity(ENTITY_ID, ENTITY_NAME, 300, 9)),
                IncidentMetrics.IncidentSeverity.WARNING, 45);

        StepVerifier.create(analyzer.generateRecommendations(analysis))
                .assertNext(recommendations -> assertThat(recommendations).extracting(Recommendation::getTitle)
                        .containsExactly("Acknowledge and Assess Impact", "Address High Error Rates",
                                "Improve Monitoring and Alerting"))
                .verifyComplete();
    }

    @Test
    void deploymentTenMinutesBeforeOnSameEntityIsLikelyCause() {
        when(telemetryClient.executeQuery(anyString())).thenAnswer(invocation -> {
            String query = invocation.getArgument(0);
            if (query.contains("FROM Deployment")) {
                return Mono.just(NrqlResult.builder().results(List.of(Map.<String, Object>of(
                        "timestamp", OPENED_AT.minus(Duration.ofMinutes(10)).toEpochMilli(),
                        "appId", ENTITY_ID, "appName", ENTITY_NAME, "revision", "a1b2c3d"))).build());
            }
            return Mono.just(NrqlResult.empty());
        });

        StepVerifier.create(analyzer.analyzeDeploymentCorrelation(openIncident()))
                .assertNext(correlations -> assertThat(correlations).singleElement().satisfies(correlation -> {
                    assertThat(correlation.getImpact()).isEqualTo(DeploymentCorrelation.Impact.LIKELY_CAUSE);
                    assertThat(correlation.getTimeGapMinutes()).isEqualTo(10.0);
                    assertThat(correlation.getConfidence()).isEqualTo(0.9);
                }))
                .verifyComplete();
    }

    @Test
    void criticalHostEventJustAfterOpeningIsDirectCause() {
        when(telemetryClient.executeQuery(anyString())).thenAnswer(invocation -> {
            String query = invocation.getArgument(0);
            if (query.contains("FROM InfrastructureEvent")) {
                return Mono.just(NrqlResult.builder().results(List.of(Map.<String, Object>of(
                        "timestamp", OPENED_AT.plus(Duration.ofMinutes(5)).toEpochMilli(),
                        "type", "host_down", "hostname", "checkout-3",
                        "description", "Host unreachable", "severity", "critical"))).build());
            }
            return Mono.just(NrqlResult.empty());
        });

        StepVerifier.create(analyzer.analyzeInfrastructureCorrelation(openIncident()))
                .assertNext(correlations -> assertThat(correlations).singleElement().satisfies(correlation -> {
                    assertThat(correlation.getImpact()).isEqualTo(InfrastructureCorrelation.Impact.DIRECT_CAUSE);
                    assertThat(correlation.getEvent().getSeverity()).isEqualTo(Severity.CRITICAL);
                }))
                .verifyComplete();
    }
}
