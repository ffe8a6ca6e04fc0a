package com.faultline.triage.client.impl;

import com.faultline.triage.client.NrqlRows;
import com.faultline.triage.domain.model.Incident;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps incident payloads of the alerts REST API onto {@link Incident}.
 */
final class IncidentJsonMapper {

    private IncidentJsonMapper() {
    }

    static Incident toIncident(JsonNode node) {
        JsonNode links = node.path("links");
        return Incident.builder()
                .id(text(node, "id"))
                .openedAt(instant(node.get("opened_at")))
                .closedAt(instant(node.get("closed_at")))
                .description(textOr(node, "description", ""))
                .state(Incident.IncidentState.fromValue(textOr(node, "state", null)))
                .priority(Incident.IncidentPriority.fromValue(textOr(node, "priority", null)))
                .policyId(firstText(node, "policy_id", links, "policy_id"))
                .policyName(textOr(node, "policy_name", ""))
                .conditionId(firstText(node, "condition_id", links, "condition_id"))
                .conditionName(textOr(node, "condition_name", ""))
                .violationUrl(textOr(node, "violation_url", ""))
                .entityId(text(node, "entity_id"))
                .entityName(text(node, "entity_name"))
                .entityType(text(node, "entity_type"))
                .violations(violations(node.path("violations")))
                .acknowledgement(acknowledgement(node.path("acknowledgement")))
                .build();
    }

    static List<Incident> toIncidents(JsonNode incidents) {
        List<Incident> result = new ArrayList<>();
        if (incidents.isArray()) {
            incidents.forEach(node -> result.add(toIncident(node)));
        }
        return result;
    }

    private static List<Incident.Violation> violations(JsonNode array) {
        List<Incident.Violation> violations = new ArrayList<>();
        if (!array.isArray()) {
            return violations;
        }
        for (JsonNode node : array) {
            JsonNode entity = node.path("entity");
            violations.add(Incident.Violation.builder()
                    .id(text(node, "id"))
                    .label(textOr(node, "label", ""))
                    .durationSeconds(node.path("duration").asLong(0))
                    .openedAt(instant(node.get("opened_at")))
                    .closedAt(instant(node.get("closed_at")))
                    .metricName(textOr(node, "metric_name", ""))
                    .metricValue(node.path("metric_value").asDouble(0))
                    .thresholdValue(node.path("threshold_value").asDouble(0))
                    .entityId(text(entity, "id"))
                    .entityName(text(entity, "name"))
                    .entityType(text(entity, "type"))
                    .build());
        }
        return violations;
    }

    private static Incident.Acknowledgement acknowledgement(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        return Incident.Acknowledgement.builder()
                .acknowledgedAt(instant(node.get("acknowledged_at")))
                .acknowledgedBy(text(node, "acknowledged_by"))
                .build();
    }

    private static Instant instant(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return NrqlRows.instant(node.isNumber() ? (Object) node.asLong() : node.asText());
    }

    private static String text(JsonNode node, String field) {
        return textOr(node, field, null);
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    private static String firstText(JsonNode node, String field, JsonNode fallbackNode, String fallbackField) {
        String value = text(node, field);
        return value != null ? value : textOr(fallbackNode, fallbackField, "");
    }
}
