package com.faultline.triage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * TRIAGE - Incident analysis and fault-correlation engine.
 *
 * <p>TRIAGE provides:
 * <ul>
 *   <li>Telemetry collection - time-windowed incident context from the telemetry platform</li>
 *   <li>Detection - statistical anomalies, error clusters and known fault signatures</li>
 *   <li>Correlation - deployment, infrastructure and historical incident relatedness</li>
 *   <li>Root cause and risk - evidence chains, escalation and business impact scoring</li>
 *   <li>Planning - cascade containment, recovery ordering and prioritized action plans</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class TriageApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriageApplication.class, args);
    }
}
