package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything collected around one incident for a single analysis pass.
 * Built once by the collector and not modified afterwards.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IncidentDataCollection {

    private Incident incident;

    /** Window the telemetry was collected over */
    private TimeRange timeRange;

    @Builder.Default
    private List<TimelineEvent> timeline = List.of();

    @Builder.Default
    private List<AffectedEntity> affectedEntities = List.of();

    /** Ordered by timestamp */
    @Builder.Default
    private List<PerformanceSnapshot> performanceData = List.of();

    @Builder.Default
    private List<ErrorEvent> errorEvents = List.of();

    @Builder.Default
    private List<DeploymentEvent> deploymentEvents = List.of();

    @Builder.Default
    private List<InfrastructureEvent> infrastructureEvents = List.of();
}
