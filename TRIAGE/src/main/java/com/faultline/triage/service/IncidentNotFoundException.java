package com.faultline.triage.service;

/**
 * The telemetry platform has no incident with the requested id.
 */
public class IncidentNotFoundException extends RuntimeException {

    private final String incidentId;

    public IncidentNotFoundException(String incidentId) {
        super("Incident " + incidentId + " not found");
        this.incidentId = incidentId;
    }

    public String getIncidentId() {
        return incidentId;
    }
}
