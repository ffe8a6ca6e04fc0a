package com.faultline.triage.client;

import com.faultline.triage.domain.model.Incident;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for the telemetry platform that owns incidents and time-series data.
 */
public interface TelemetryClient {

    /**
     * Execute an NRQL query against the configured account.
     */
    Mono<NrqlResult> executeQuery(String nrql);

    /**
     * Incident details including violations, or empty when the platform has no such incident.
     */
    Mono<Incident> getIncident(String incidentId);

    Mono<List<Incident>> listIncidents(IncidentFilters filters);

    /**
     * True when no platform credentials are configured and every call returns empty data.
     */
    boolean isStubMode();
}
