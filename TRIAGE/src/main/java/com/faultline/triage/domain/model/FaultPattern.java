package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Named, weighted signature of a known failure mode.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FaultPattern {

    private String id;
    private String name;
    private String description;
    private FaultCategory type;

    @Builder.Default
    private List<PatternIndicator> indicators = new ArrayList<>();

    /** Running confidence, or the match confidence on a detected copy */
    private double confidence;

    /** Number of incidents this pattern has been learned from */
    private int frequency;

    private Instant lastSeen;

    /** Most recent matches, newest first */
    @Builder.Default
    private List<FaultExample> examples = new ArrayList<>();

    /**
     * Deep copy, so callers never share mutable lists with the registry.
     */
    public FaultPattern copy() {
        return toBuilder()
                .indicators(new ArrayList<>(indicators))
                .examples(new ArrayList<>(examples))
                .build();
    }

    /**
     * Examples with {@code example} added, ordered newest first and capped at {@code maxExamples}.
     */
    public List<FaultExample> examplesWith(FaultExample example, int maxExamples) {
        List<FaultExample> merged = new ArrayList<>(examples.size() + 1);
        merged.add(example);
        merged.addAll(examples);
        merged.sort(Comparator.comparing(FaultExample::getTimestamp,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return new ArrayList<>(merged.subList(0, Math.min(maxExamples, merged.size())));
    }

    public double totalWeight() {
        return indicators.stream().mapToDouble(PatternIndicator::getWeight).sum();
    }
}
