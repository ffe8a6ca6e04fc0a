package com.faultline.triage.domain.model;

import java.util.Locale;

/**
 * Four-tier severity scale shared by anomalies, risk factors, causes and plan actions.
 */
public enum Severity {
    LOW(1, 0.25),
    MEDIUM(2, 0.5),
    HIGH(3, 0.75),
    CRITICAL(4, 1.0);

    private final int rank;
    private final double impactScore;

    Severity(int rank, double impactScore) {
        this.rank = rank;
        this.impactScore = impactScore;
    }

    /** Weight used when ranking failure points by probability x impact */
    public double getImpactScore() {
        return impactScore;
    }

    public boolean isAtLeast(Severity other) {
        return rank >= other.rank;
    }

    public static Severity max(Severity a, Severity b) {
        return a.rank >= b.rank ? a : b;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
