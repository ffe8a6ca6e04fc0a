package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffectedEntity {

    private String guid;
    private String name;
    private String type;

    @Builder.Default
    private Severity impactLevel = Severity.HIGH;

    @Builder.Default
    private EntityMetrics metrics = EntityMetrics.empty();
}
