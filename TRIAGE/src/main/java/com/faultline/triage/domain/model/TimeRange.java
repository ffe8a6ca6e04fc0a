package com.faultline.triage.domain.model;

import java.time.Instant;

/**
 * Closed time interval used for telemetry queries.
 */
public record TimeRange(Instant since, Instant until) {

    public TimeRange {
        if (since == null || until == null) {
            throw new IllegalArgumentException("Time range bounds are required");
        }
        if (until.isBefore(since)) {
            throw new IllegalArgumentException("Time range ends before it starts: " + since + " > " + until);
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(since) && !instant.isAfter(until);
    }
}
