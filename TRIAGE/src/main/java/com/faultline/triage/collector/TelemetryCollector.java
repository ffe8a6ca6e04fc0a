package com.faultline.triage.collector;

import com.faultline.triage.client.NrqlResult;
import com.faultline.triage.client.NrqlRows;
import com.faultline.triage.client.TelemetryClient;
import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.AffectedEntity;
import com.faultline.triage.domain.model.DeploymentEvent;
import com.faultline.triage.domain.model.EntityMetrics;
import com.faultline.triage.domain.model.ErrorEvent;
import com.faultline.triage.domain.model.Incident;
import com.faultline.triage.domain.model.IncidentDataCollection;
import com.faultline.triage.domain.model.InfrastructureEvent;
import com.faultline.triage.domain.model.PerformanceSnapshot;
import com.faultline.triage.domain.model.Severity;
import com.faultline.triage.domain.model.TimeRange;
import com.faultline.triage.domain.model.TimelineEvent;
import com.faultline.triage.observability.TriageMetrics;
import com.faultline.triage.observability.TriageStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Collects the telemetry context of an incident.
 * <p>
 * The context window starts before the incident opened and ends after it closed (or now).
 * Sub-fetches run concurrently; a failing sub-fetch is logged and replaced with empty data
 * so one unavailable source never aborts the whole collection.
 */
@Slf4j
@Component
public class TelemetryCollector {

    private static final String ALERTS_SOURCE = "Alerts";

    private final TelemetryClient telemetryClient;
    private final TriageProperties.Collection config;
    private final TriageStructuredLogger structuredLogger;
    private final TriageMetrics metrics;
    private final Clock clock;

    public TelemetryCollector(TelemetryClient telemetryClient,
                              TriageProperties properties,
                              TriageStructuredLogger structuredLogger,
                              TriageMetrics metrics,
                              Clock clock) {
        this.telemetryClient = telemetryClient;
        this.config = properties.getCollection();
        this.structuredLogger = structuredLogger;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Collect timeline, entities, performance, errors, deployments and infrastructure events.
     */
    public Mono<IncidentDataCollection> collect(Incident incident) {
        TimeRange range = contextWindow(incident);
        log.info("Collecting incident data: incidentId={}, since={}, until={}",
                incident.getId(), range.since(), range.until());

        return Mono.zip(
                        Mono.fromCallable(() -> buildTimeline(incident)),
                        identifyAffectedEntities(incident),
                        collectPerformanceData(incident, range),
                        collectErrorEvents(incident, range),
                        collectDeploymentEvents(incident, range),
                        collectInfrastructureEvents(incident, range))
                .map(parts -> IncidentDataCollection.builder()
                        .incident(incident)
                        .timeRange(range)
                        .timeline(List.copyOf(parts.getT1()))
                        .affectedEntities(List.copyOf(parts.getT2()))
                        .performanceData(List.copyOf(parts.getT3()))
                        .errorEvents(List.copyOf(parts.getT4()))
                        .deploymentEvents(List.copyOf(parts.getT5()))
                        .infrastructureEvents(List.copyOf(parts.getT6()))
                        .build())
                .doOnNext(collection -> log.info(
                        "Completed incident data collection: incidentId={}, timelineEvents={}, entities={}, snapshots={}, errors={}, deployments={}, infraEvents={}",
                        incident.getId(),
                        collection.getTimeline().size(),
                        collection.getAffectedEntities().size(),
                        collection.getPerformanceData().size(),
                        collection.getErrorEvents().size(),
                        collection.getDeploymentEvents().size(),
                        collection.getInfrastructureEvents().size()));
    }

    public TimeRange contextWindow(Incident incident) {
        Instant end = incident.getClosedAt() != null ? incident.getClosedAt() : clock.instant();
        return new TimeRange(
                incident.getOpenedAt().minus(config.getLookback()),
                end.plus(config.getLookahead()));
    }

    /**
     * Window around the open time used for deployment and infrastructure correlation.
     */
    public TimeRange correlationWindow(Incident incident) {
        return new TimeRange(
                incident.getOpenedAt().minus(config.getCorrelationLookback()),
                incident.getOpenedAt().plus(config.getCorrelationLookahead()));
    }

    public TimeRange deploymentWindow(Incident incident) {
        return new TimeRange(
                incident.getOpenedAt().minus(config.getDeploymentLookback()),
                incident.getOpenedAt().plus(config.getCorrelationLookahead()));
    }

    /**
     * Incident lifecycle events in time order.
     */
    public List<TimelineEvent> buildTimeline(Incident incident) {
        List<TimelineEvent> timeline = new ArrayList<>();

        timeline.add(TimelineEvent.builder()
                .timestamp(incident.getOpenedAt())
                .type("incident_opened")
                .description("Incident opened: " + Objects.toString(incident.getDescription(), ""))
                .source(ALERTS_SOURCE)
                .build());

        for (Incident.Violation violation : incident.getViolations()) {
            if (violation.getOpenedAt() != null) {
                Map<String, Object> metadata = new HashMap<>();
                metadata.put("violationId", violation.getId());
                metadata.put("metricName", violation.getMetricName());
                timeline.add(TimelineEvent.builder()
                        .timestamp(violation.getOpenedAt())
                        .type("violation_started")
                        .description("Violation started: " + violation.getLabel())
                        .source(ALERTS_SOURCE)
                        .metadata(metadata)
                        .build());
            }
            if (violation.getClosedAt() != null) {
                Map<String, Object> metadata = new HashMap<>();
                metadata.put("violationId", violation.getId());
                timeline.add(TimelineEvent.builder()
                        .timestamp(violation.getClosedAt())
                        .type("violation_ended")
                        .description("Violation ended: " + violation.getLabel())
                        .source(ALERTS_SOURCE)
                        .metadata(metadata)
                        .build());
            }
        }

        Incident.Acknowledgement acknowledgement = incident.getAcknowledgement();
        if (acknowledgement != null && acknowledgement.getAcknowledgedAt() != null) {
            timeline.add(TimelineEvent.builder()
                    .timestamp(acknowledgement.getAcknowledgedAt())
                    .type("incident_acknowledged")
                    .description("Incident acknowledged by " + acknowledgement.getAcknowledgedBy())
                    .source(ALERTS_SOURCE)
                    .build());
        }

        if (incident.getClosedAt() != null) {
            timeline.add(TimelineEvent.builder()
                    .timestamp(incident.getClosedAt())
                    .type("incident_closed")
                    .description("Incident closed")
                    .source(ALERTS_SOURCE)
                    .build());
        }

        timeline.sort(Comparator.comparing(TimelineEvent::getTimestamp));
        return timeline;
    }

    /**
     * The incident's primary entity first, then any other entity named by its violations.
     */
    public Mono<List<AffectedEntity>> identifyAffectedEntities(Incident incident) {
        return Flux.fromIterable(entityRefs(incident))
                .flatMapSequential(ref -> fetchEntityMetrics(incident.getId(), ref.id())
                        .map(entityMetrics -> AffectedEntity.builder()
                                .guid(ref.id())
                                .name(ref.name())
                                .type(ref.type())
                                .impactLevel(ref.primary() ? Severity.HIGH : Severity.MEDIUM)
                                .metrics(entityMetrics)
                                .build()))
                .collectList();
    }

    public Mono<List<PerformanceSnapshot>> collectPerformanceData(Incident incident, TimeRange range) {
        return Flux.fromIterable(entityRefs(incident))
                .flatMapSequential(ref -> orEmpty(incident.getId(), "performance data",
                        telemetryClient.executeQuery(NrqlQueries.performanceSeries(
                                        ref.id(), range, config.getPerformanceBucketMinutes()))
                                .map(result -> toSnapshots(result, ref))))
                .flatMapIterable(snapshots -> snapshots)
                .sort(Comparator.comparing(PerformanceSnapshot::getTimestamp))
                .collectList();
    }

    public Mono<List<ErrorEvent>> collectErrorEvents(Incident incident, TimeRange range) {
        List<String> entityIds = entityIds(incident);
        if (entityIds.isEmpty()) {
            return Mono.just(List.of());
        }
        return orEmpty(incident.getId(), "error events",
                telemetryClient.executeQuery(NrqlQueries.errorEvents(entityIds, range, config.getErrorEventLimit()))
                        .map(result -> toErrorEvents(result, incident)));
    }

    public Mono<List<DeploymentEvent>> collectDeploymentEvents(Incident incident, TimeRange range) {
        List<String> entityIds = entityIds(incident);
        if (entityIds.isEmpty()) {
            return Mono.just(List.of());
        }
        return orEmpty(incident.getId(), "deployment events",
                telemetryClient.executeQuery(NrqlQueries.deployments(entityIds, range, config.getEventLimit()))
                        .map(this::toDeploymentEvents));
    }

    public Mono<List<InfrastructureEvent>> collectInfrastructureEvents(Incident incident, TimeRange range) {
        return orEmpty(incident.getId(), "infrastructure events",
                telemetryClient.executeQuery(NrqlQueries.infrastructureEvents(range, config.getEventLimit()))
                        .map(this::toInfrastructureEvents));
    }

    /**
     * Raw time-bucketed series for anomaly detection. Failures propagate to the caller.
     */
    public Mono<List<Map<String, Object>>> fetchMetricSeries(String entityId, TimeRange range) {
        return telemetryClient.executeQuery(
                        NrqlQueries.anomalySeries(entityId, range, config.getPerformanceBucketMinutes()))
                .map(NrqlResult::getResults);
    }

    private Mono<EntityMetrics> fetchEntityMetrics(String incidentId, String entityId) {
        return telemetryClient.executeQuery(NrqlQueries.entityMetrics(entityId, config.getEntityMetricsSince()))
                .map(result -> {
                    Map<String, Object> row = result.getResults().isEmpty() ? Map.of() : result.getResults().get(0);
                    return EntityMetrics.builder()
                            .responseTime(NrqlRows.number(row, "responseTime"))
                            .throughput(NrqlRows.number(row, "throughput"))
                            .errorRate(NrqlRows.number(row, "errorRate"))
                            .apdexScore(NrqlRows.number(row, "apdexScore"))
                            .cpuUsage(NrqlRows.optionalNumber(row, "cpuUsage"))
                            .memoryUsage(NrqlRows.optionalNumber(row, "memoryUsage"))
                            .build();
                })
                .onErrorResume(e -> {
                    degraded(incidentId, "entity metrics", e);
                    return Mono.just(EntityMetrics.empty());
                });
    }

    private <T> Mono<List<T>> orEmpty(String incidentId, String source, Mono<List<T>> fetch) {
        return fetch.onErrorResume(e -> {
            degraded(incidentId, source, e);
            return Mono.just(List.of());
        });
    }

    private void degraded(String incidentId, String source, Throwable error) {
        structuredLogger.logPartialData(incidentId, source, error);
        metrics.recordPartialData(source);
    }

    private List<PerformanceSnapshot> toSnapshots(NrqlResult result, EntityRef ref) {
        return result.getResults().stream()
                .filter(row -> NrqlRows.timestamp(row) != null)
                .map(row -> PerformanceSnapshot.builder()
                        .timestamp(NrqlRows.timestamp(row))
                        .entityId(ref.id())
                        .entityName(ref.name())
                        .responseTime(NrqlRows.optionalNumber(row, "responseTime"))
                        .throughput(NrqlRows.optionalNumber(row, "throughput"))
                        .errorRate(NrqlRows.optionalNumber(row, "errorRate"))
                        .apdexScore(NrqlRows.optionalNumber(row, "apdexScore"))
                        .cpuUsage(NrqlRows.optionalNumber(row, "cpuUsage"))
                        .memoryUsage(NrqlRows.optionalNumber(row, "memoryUsage"))
                        .build())
                .collect(Collectors.toList());
    }

    private List<ErrorEvent> toErrorEvents(NrqlResult result, Incident incident) {
        return result.getResults().stream()
                .map(row -> {
                    Map<String, Object> attributes = new HashMap<>();
                    attributes.put("errorClass", row.get("error.class"));
                    attributes.put("transactionName", row.get("transactionName"));
                    return ErrorEvent.builder()
                            .timestamp(NrqlRows.timestamp(row))
                            .message(NrqlRows.text(row, "message", "Unknown error"))
                            .stackTrace("")
                            .entityGuid(NrqlRows.text(row, "appId", incident.getEntityId()))
                            .entityName(NrqlRows.text(row, "appName",
                                    Objects.toString(incident.getEntityName(), "Unknown")))
                            .attributes(attributes)
                            .build();
                })
                .collect(Collectors.toList());
    }

    private List<DeploymentEvent> toDeploymentEvents(NrqlResult result) {
        return result.getResults().stream()
                .filter(row -> NrqlRows.timestamp(row) != null)
                .map(row -> DeploymentEvent.builder()
                        .timestamp(NrqlRows.timestamp(row))
                        .applicationId(NrqlRows.text(row, "appId", null))
                        .applicationName(NrqlRows.text(row, "appName", "Unknown"))
                        .revision(NrqlRows.text(row, "revision", ""))
                        .description(NrqlRows.text(row, "description", null))
                        .user(NrqlRows.text(row, "user", null))
                        .changelog(NrqlRows.text(row, "changelog", null))
                        .build())
                .collect(Collectors.toList());
    }

    private List<InfrastructureEvent> toInfrastructureEvents(NrqlResult result) {
        return result.getResults().stream()
                .filter(row -> NrqlRows.timestamp(row) != null)
                .map(row -> InfrastructureEvent.builder()
                        .timestamp(NrqlRows.timestamp(row))
                        .type(NrqlRows.text(row, "type", "unknown"))
                        .hostname(NrqlRows.text(row, "hostname", "unknown"))
                        .description(NrqlRows.text(row, "description", ""))
                        .severity(Severity.fromValue(NrqlRows.text(row, "severity", null)))
                        .build())
                .collect(Collectors.toList());
    }

    private List<String> entityIds(Incident incident) {
        return entityRefs(incident).stream().map(EntityRef::id).collect(Collectors.toList());
    }

    private List<EntityRef> entityRefs(Incident incident) {
        Map<String, EntityRef> refs = new LinkedHashMap<>();
        if (incident.getEntityId() != null && incident.getEntityName() != null) {
            refs.put(incident.getEntityId(), new EntityRef(incident.getEntityId(), incident.getEntityName(),
                    Objects.toString(incident.getEntityType(), "APPLICATION"), true));
        }
        for (Incident.Violation violation : incident.getViolations()) {
            if (violation.getEntityId() != null && !refs.containsKey(violation.getEntityId())) {
                refs.put(violation.getEntityId(), new EntityRef(violation.getEntityId(),
                        Objects.toString(violation.getEntityName(), violation.getEntityId()),
                        Objects.toString(violation.getEntityType(), "APPLICATION"), false));
            }
        }
        return new ArrayList<>(refs.values());
    }

    private record EntityRef(String id, String name, String type, boolean primary) {}
}
