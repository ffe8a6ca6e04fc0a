package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentEvent {

    private Instant timestamp;
    private String applicationId;
    private String applicationName;
    private String revision;
    private String description;
    private String user;
    private String changelog;
}
