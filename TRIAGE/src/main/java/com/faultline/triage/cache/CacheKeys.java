package com.faultline.triage.cache;

/**
 * Cache key layout, one prefix per analysis stage.
 */
public final class CacheKeys {

    public static final String PATTERN_DATABASE = "fault_patterns_database";

    private CacheKeys() {
    }

    public static String incidents(String filterKey) {
        return "incidents_" + filterKey;
    }

    public static String incidentDetails(String incidentId) {
        return "incident_details_" + incidentId;
    }

    public static String collection(String incidentId) {
        return "incident_collection_" + incidentId;
    }

    public static String analysis(String incidentId) {
        return "incident_analysis_" + incidentId;
    }

    public static String faultPatterns(String incidentId) {
        return "fault_patterns_" + incidentId;
    }

    public static String comprehensiveAnalysis(String incidentId) {
        return "comprehensive_analysis_" + incidentId;
    }
}
