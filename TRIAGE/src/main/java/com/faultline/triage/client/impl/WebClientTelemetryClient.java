package com.faultline.triage.client.impl;

import com.faultline.triage.client.IncidentFilters;
import com.faultline.triage.client.NrqlResult;
import com.faultline.triage.client.TelemetryClient;
import com.faultline.triage.client.TelemetryClientException;
import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.Incident;
import com.faultline.triage.observability.TriageMetrics;
import com.faultline.triage.observability.TriageStructuredLogger;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * WebClient-based implementation of TelemetryClient.
 * <p>
 * NRQL runs through the NerdGraph GraphQL endpoint; incidents come from the alerts REST API.
 * Uses circuit breaker and retry for resilience. Without an API key the client runs in stub mode.
 */
@Slf4j
@Component
public class WebClientTelemetryClient implements TelemetryClient {

    private static final String API_KEY_HEADER = "Api-Key";

    private static final String NRQL_QUERY = """
            query($accountId: Int!, $nrql: Nrql!) {
              actor {
                account(id: $accountId) {
                  nrql(query: $nrql) {
                    results
                    metadata { eventTypes facets messages }
                  }
                }
              }
            }""";

    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};

    private final TriageProperties.Telemetry config;
    private final WebClient restClient;
    private final WebClient graphClient;
    private final ObjectMapper objectMapper;
    private final TriageStructuredLogger structuredLogger;
    private final TriageMetrics metrics;
    private final boolean stubMode;

    public WebClientTelemetryClient(WebClient.Builder webClientBuilder,
                                    TriageProperties properties,
                                    ObjectMapper objectMapper,
                                    TriageStructuredLogger structuredLogger,
                                    TriageMetrics metrics) {
        this.config = properties.getTelemetry();
        this.objectMapper = objectMapper;
        this.structuredLogger = structuredLogger;
        this.metrics = metrics;
        this.stubMode = config.getApiKey() == null || config.getApiKey().isBlank();

        this.restClient = webClientBuilder.clone()
                .baseUrl(config.getRestBaseUrl())
                .defaultHeader(API_KEY_HEADER, nullToEmpty(config.getApiKey()))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.graphClient = webClientBuilder.clone()
                .baseUrl(config.getGraphqlUrl())
                .defaultHeader(API_KEY_HEADER, nullToEmpty(config.getApiKey()))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();

        if (stubMode) {
            log.warn("Telemetry client running in stub mode - no API key configured");
        }
    }

    @Override
    @CircuitBreaker(name = "telemetry")
    @Retry(name = "telemetry")
    public Mono<NrqlResult> executeQuery(String nrql) {
        if (stubMode) {
            return Mono.just(NrqlResult.empty());
        }

        Map<String, Object> body = Map.of(
                "query", NRQL_QUERY,
                "variables", Map.of("accountId", config.getAccountId(), "nrql", nrql));

        return Mono.defer(() -> {
            long started = System.nanoTime();
            return graphClient.post()
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(config.getTimeout())
                    .map(this::toNrqlResult)
                    .doOnSuccess(result -> {
                        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                        metrics.recordQuery(elapsed, true);
                        structuredLogger.logQueryExecution(nrql, result.getResults().size(), elapsed.toMillis());
                    })
                    .doOnError(e -> {
                        metrics.recordQuery(Duration.ofNanos(System.nanoTime() - started), false);
                        log.error("NRQL query failed: {}", e.getMessage());
                    })
                    .onErrorMap(e -> !(e instanceof TelemetryClientException),
                            e -> new TelemetryClientException("NRQL query failed: " + e.getMessage(), e));
        });
    }

    @Override
    @CircuitBreaker(name = "telemetry")
    @Retry(name = "telemetry")
    public Mono<Incident> getIncident(String incidentId) {
        if (stubMode) {
            return Mono.empty();
        }

        return restClient.get()
                .uri("/alerts_incidents/{id}.json", incidentId)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(response -> IncidentJsonMapper.toIncident(response.path("incident")))
                .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                    log.debug("Incident {} not found on telemetry platform", incidentId);
                    return Mono.empty();
                })
                .doOnError(e -> log.error("Failed to get incident {}: {}", incidentId, e.getMessage()))
                .onErrorMap(e -> !(e instanceof TelemetryClientException),
                        e -> new TelemetryClientException("Failed to get incident details: " + e.getMessage(), e));
    }

    @Override
    @CircuitBreaker(name = "telemetry")
    @Retry(name = "telemetry")
    public Mono<List<Incident>> listIncidents(IncidentFilters filters) {
        if (stubMode) {
            return Mono.just(List.of());
        }

        return restClient.get()
                .uri(builder -> {
                    builder.path("/alerts_incidents.json");
                    if (filters.isOnlyOpen()) {
                        builder.queryParam("only_open", true);
                    }
                    if (filters.isExcludeViolations()) {
                        builder.queryParam("exclude_violations", true);
                    }
                    if (filters.getSince() != null) {
                        builder.queryParam("since", filters.getSince().toString());
                    }
                    if (filters.getUntil() != null) {
                        builder.queryParam("until", filters.getUntil().toString());
                    }
                    return builder.build();
                })
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(response -> IncidentJsonMapper.toIncidents(response.path("incidents")).stream()
                        .filter(incident -> filters.getEntityId() == null
                                || filters.getEntityId().equals(incident.getEntityId()))
                        .collect(Collectors.toList()))
                .doOnSuccess(incidents -> log.debug("Retrieved {} incidents", incidents.size()))
                .doOnError(e -> log.error("Failed to list incidents: {}", e.getMessage()))
                .onErrorMap(e -> !(e instanceof TelemetryClientException),
                        e -> new TelemetryClientException("Failed to get incidents: " + e.getMessage(), e));
    }

    @Override
    public boolean isStubMode() {
        return stubMode;
    }

    private NrqlResult toNrqlResult(JsonNode response) {
        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> messages = new ArrayList<>();
            errors.forEach(error -> messages.add(error.path("message").asText()));
            throw new TelemetryClientException("NRQL query rejected: " + String.join("; ", messages));
        }

        JsonNode nrql = response.path("data").path("actor").path("account").path("nrql");
        JsonNode results = nrql.path("results");
        JsonNode metadata = nrql.path("metadata");
        return NrqlResult.builder()
                .results(results.isArray() ? objectMapper.convertValue(results, ROWS) : new ArrayList<>())
                .metadata(metadata.isObject() ? objectMapper.convertValue(metadata, OBJECT) : Map.of())
                .build();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
