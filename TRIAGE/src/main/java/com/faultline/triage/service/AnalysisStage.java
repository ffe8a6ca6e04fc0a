package com.faultline.triage.service;

/**
 * Named stages of the analysis pipeline, used to give failures context.
 */
public enum AnalysisStage {
    INCIDENT_LISTING("Incident listing"),
    INCIDENT_LOOKUP("Incident lookup"),
    DATA_COLLECTION("Incident data collection"),
    INCIDENT_ANALYSIS("Incident analysis"),
    ROOT_CAUSE_ANALYSIS("Root cause analysis"),
    RECOMMENDATIONS("Recommendation generation"),
    INCIDENT_REPORT("Incident report creation"),
    ANOMALY_DETECTION("Anomaly detection"),
    SIMILAR_INCIDENTS("Similar incident search"),
    ERROR_PATTERNS("Error pattern analysis"),
    EVENT_CORRELATION("Event correlation"),
    DEPLOYMENT_CORRELATION("Deployment correlation"),
    INFRASTRUCTURE_CORRELATION("Infrastructure correlation"),
    PATTERN_DETECTION("Fault pattern detection"),
    FAULT_PROGRESSION("Fault progression analysis"),
    ROOT_CAUSE_CHAIN("Root cause chain identification"),
    RISK_ASSESSMENT("Risk assessment"),
    ESCALATION_PREDICTION("Escalation prediction"),
    BUSINESS_IMPACT("Business impact calculation"),
    COMPREHENSIVE_ANALYSIS("Comprehensive analysis"),
    ACTION_PLAN("Action plan generation"),
    CASCADE_ANALYSIS("Cascade failure analysis"),
    FAILURE_POINTS("Failure point identification"),
    LEARNING("Learning from incident"),
    PATTERN_DATABASE_UPDATE("Pattern database update");

    private final String description;

    AnalysisStage(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
