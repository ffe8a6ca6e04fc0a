package com.faultline.triage.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentFilters {

    private boolean onlyOpen;
    private boolean excludeViolations;
    private Instant since;
    private Instant until;

    /** Applied client-side; the incidents endpoint cannot filter by entity */
    private String entityId;

    public static IncidentFilters none() {
        return new IncidentFilters();
    }

    /**
     * Stable key for caching listings by filter.
     */
    public String cacheKey() {
        return "open=" + onlyOpen
                + ",excludeViolations=" + excludeViolations
                + ",since=" + (since != null ? since.toEpochMilli() : "")
                + ",until=" + (until != null ? until.toEpochMilli() : "")
                + ",entity=" + (entityId != null ? entityId : "");
    }
}
