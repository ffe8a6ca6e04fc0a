package com.faultline.triage.service;

/**
 * Unexpected failure inside an analysis stage, carrying the stage and incident it happened in.
 */
public class AnalysisException extends RuntimeException {

    private final AnalysisStage stage;
    private final String incidentId;

    public AnalysisException(AnalysisStage stage, String incidentId, Throwable cause) {
        super(formatMessage(stage, incidentId, cause), cause);
        this.stage = stage;
        this.incidentId = incidentId;
    }

    public AnalysisStage getStage() {
        return stage;
    }

    public String getIncidentId() {
        return incidentId;
    }

    /**
     * Wrap {@code error} with stage context. Errors that already carry context pass through unchanged.
     */
    public static Throwable wrap(AnalysisStage stage, String incidentId, Throwable error) {
        if (error instanceof AnalysisException || error instanceof IncidentNotFoundException) {
            return error;
        }
        return new AnalysisException(stage, incidentId, error);
    }

    private static String formatMessage(AnalysisStage stage, String incidentId, Throwable cause) {
        String subject = incidentId != null ? " for incident " + incidentId : "";
        String reason = cause != null && cause.getMessage() != null ? cause.getMessage()
                : cause != null ? cause.getClass().getSimpleName() : "unknown error";
        return stage.getDescription() + " failed" + subject + ": " + reason;
    }
}
