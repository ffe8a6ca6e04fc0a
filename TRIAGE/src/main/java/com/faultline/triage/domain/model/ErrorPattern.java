package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Cluster of error events sharing a normalized message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorPattern {

    /** Message with identifiers replaced by placeholders */
    private String pattern;

    private int frequency;
    private Instant firstSeen;
    private Instant lastSeen;

    @Builder.Default
    private List<String> affectedEntities = new ArrayList<>();

    private Severity severity;
    private Category category;

    @Builder.Default
    private List<ErrorEvent> examples = new ArrayList<>();

    public enum Category {
        APPLICATION, INFRASTRUCTURE, NETWORK, DATABASE
    }
}
