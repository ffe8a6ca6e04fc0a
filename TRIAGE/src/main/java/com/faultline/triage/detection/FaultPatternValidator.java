package com.faultline.triage.detection;

import com.faultline.triage.domain.model.FaultPattern;
import com.faultline.triage.domain.model.PatternIndicator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Structural checks a fault pattern must pass before it may enter the registry.
 */
public final class FaultPatternValidator {

    private FaultPatternValidator() {
    }

    /**
     * @throws IllegalArgumentException naming every problem found, if any pattern is invalid
     */
    public static void validate(Collection<FaultPattern> patterns) {
        if (patterns == null) {
            throw new IllegalArgumentException("Pattern list must not be null");
        }
        List<String> problems = new ArrayList<>();
        int index = 0;
        for (FaultPattern pattern : patterns) {
            problems.addAll(problems(pattern, index++));
        }
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid fault patterns: " + String.join("; ", problems));
        }
    }

    static List<String> problems(FaultPattern pattern, int index) {
        String label = "pattern[" + index + "]";
        List<String> problems = new ArrayList<>();
        if (pattern == null) {
            problems.add(label + " is null");
            return problems;
        }
        if (pattern.getId() == null || pattern.getId().isBlank()) {
            problems.add(label + " has no id");
        } else {
            label = "pattern " + pattern.getId();
        }
        if (!inUnitRange(pattern.getConfidence())) {
            problems.add(label + " confidence " + pattern.getConfidence() + " is outside [0, 1]");
        }
        if (pattern.getExamples() == null) {
            problems.add(label + " has null examples");
        }
        if (pattern.getIndicators() == null) {
            problems.add(label + " has null indicators");
            return problems;
        }
        for (PatternIndicator indicator : pattern.getIndicators()) {
            if (indicator == null) {
                problems.add(label + " has a null indicator");
            } else if (indicator.getMetric() == null || indicator.getCondition() == null) {
                problems.add(label + " has an indicator without metric or condition");
            } else if (!inUnitRange(indicator.getWeight())) {
                problems.add(label + " indicator " + indicator.getMetric() + " weight "
                        + indicator.getWeight() + " is outside [0, 1]");
            }
        }
        return problems;
    }

    private static boolean inUnitRange(double value) {
        return value >= 0 && value <= 1;
    }
}
