package com.faultline.triage.client;

/**
 * Transport, HTTP or query-level failure talking to the telemetry platform.
 */
public class TelemetryClientException extends RuntimeException {

    public TelemetryClientException(String message) {
        super(message);
    }

    public TelemetryClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
