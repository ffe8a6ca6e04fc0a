package com.faultline.triage.rca;

import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.*;
import com.faultline.triage.domain.model.ProgressionAnalysis.ProgressionStage;
import com.faultline.triage.domain.model.ProgressionAnalysis.Speed;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.faultline.triage.support.IncidentFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class ProgressionAnalyzerTest {

    private final ProgressionAnalyzer analyzer = new ProgressionAnalyzer(new TriageProperties());

    @Test
    void quietIncidentStaysInDetection() {
        ProgressionAnalysis progression = analyzer.analyze(collection(openIncident(), List.of(), healthySnapshots(6)));

        assertThat(progression.getStages()).extracting(ProgressionStage::getName).containsExactly("Detection");
        assertThat(progression.getCurrentStage()).isEqualTo("Detection");
        assertThat(progression.getNextLikelyStage()).isEqualTo("Degradation");
        assertThat(progression.getProgressionSpeed()).isEqualTo(Speed.SLOW);
        assertThat(progression.getInterventionPoints()).singleElement()
                .satisfies(point -> assertThat(point.getEffectiveness()).isEqualTo(0.6));
    }

    @Test
    void detectsResponseTimeAndErrorRateJumps() {
        List<PerformanceSnapshot> snapshots = List.of(
                snapshot(OPENED_AT, 200, 1, 100, null),
                snapshot(OPENED_AT.plus(Duration.ofMinutes(5)), 400, 1, 100, null),
                snapshot(OPENED_AT.plus(Duration.ofMinutes(10)), 400, 8, 100, null));

        ProgressionAnalysis progression = analyzer.analyze(collection(openIncident(), List.of(), snapshots));

        assertThat(progression.getStages()).extracting(ProgressionStage::getName)
                .containsExactly("Detection", "Degradation", "Degradation");
        assertThat(progression.getStages().get(1).getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(progression.getStages().get(1).getIndicators()).containsExactly("response_time increased by 100.0%");
        assertThat(progression.getStages().get(2).getIndicators()).containsExactly("error_rate increased by 7.0 points");
        assertThat(progression.getNextLikelyStage()).isEqualTo("Error Escalation");
        assertThat(progression.getProgressionSpeed()).isEqualTo(Speed.CRITICAL);
        assertThat(progression.getInterventionPoints()).hasSize(2);
    }

    @Test
    void jumpsAreComparedWithinOneEntity() {
        PerformanceSnapshot fast = snapshot(OPENED_AT, 100, 1, 100, null);
        PerformanceSnapshot slowOther = snapshot(OPENED_AT.plus(Duration.ofMinutes(1)), 900, 1, 100, null);
        slowOther.setEntityId("app-other");
        PerformanceSnapshot fastAgain = snapshot(OPENED_AT.plus(Duration.ofMinutes(2)), 110, 1, 100, null);

        assertThat(analyzer.degradationPoints(List.of(fast, slowOther, fastAgain))).isEmpty();
    }

    @Test
    void errorBurstBecomesEscalationStage() {
        List<ErrorEvent> errors = new ArrayList<>();
        errors.add(error("a", ENTITY_ID, OPENED_AT.plus(Duration.ofMinutes(1))));
        errors.add(error("b", ENTITY_ID, OPENED_AT.plus(Duration.ofMinutes(6))));
        for (int i = 0; i < 10; i++) {
            errors.add(error("c", ENTITY_ID, OPENED_AT.plus(Duration.ofMinutes(21)).plusSeconds(i)));
        }
        IncidentDataCollection data = collection(openIncident(), List.of(), List.of()).toBuilder()
                .errorEvents(errors)
                .build();

        ProgressionAnalysis progression = analyzer.analyze(data);

        assertThat(progression.getCurrentStage()).isEqualTo("Error Escalation");
        assertThat(progression.getNextLikelyStage()).isEqualTo("Service Failure");
        assertThat(progression.getStages().get(1).getIndicators()).containsExactly("10 errors in 5 minutes");
    }

    @Test
    void simultaneousStagesCountAsCriticalSpeed() {
        ProgressionStage first = ProgressionStage.builder().name("Detection").timestamp(OPENED_AT).build();
        ProgressionStage second = ProgressionStage.builder().name("Degradation").timestamp(OPENED_AT).build();

        assertThat(analyzer.speed(List.of(first, second))).isEqualTo(Speed.CRITICAL);
    }

    @Test
    void severityScalesWithChangeMagnitude() {
        assertThat(analyzer.severityFromChange(250)).isEqualTo(Severity.CRITICAL);
        assertThat(analyzer.severityFromChange(-150)).isEqualTo(Severity.HIGH);
        assertThat(analyzer.severityFromChange(60)).isEqualTo(Severity.MEDIUM);
        assertThat(analyzer.severityFromChange(6)).isEqualTo(Severity.LOW);
    }

    @Test
    void snapshotsWithoutTimestampOrValueAreSkipped() {
        List<PerformanceSnapshot> snapshots = new ArrayList<>(List.of(
                snapshot(OPENED_AT, 200, 1, 100, null),
                snapshot(null, 900, 1, 100, null),
                PerformanceSnapshot.builder().timestamp(OPENED_AT.plusSeconds(300))
                        .entityId(ENTITY_ID).errorRate(1.0).build(),
                snapshot(OPENED_AT.plusSeconds(600), 210, 1, 100, null)));

        ProgressionAnalysis progression = analyzer.analyze(collection(openIncident(), List.of(), snapshots));

        assertThat(progression.getStages()).extracting(ProgressionStage::getName).containsExactly("Detection");
    }

    @Test
    void jumpThresholdComesFromProperties() {
        TriageProperties properties = new TriageProperties();
        properties.getProgression().setResponseTimeJumpPercent(20);
        ProgressionAnalyzer sensitive = new ProgressionAnalyzer(properties);
        List<PerformanceSnapshot> snapshots = List.of(
                snapshot(OPENED_AT.plusSeconds(300), 200, 1, 100, null),
                snapshot(OPENED_AT.plusSeconds(600), 260, 1, 100, null));

        assertThat(analyzer.degradationPoints(snapshots)).isEmpty();
        assertThat(sensitive.degradationPoints(snapshots)).singleElement()
                .satisfies(point -> assertThat(point.metric()).isEqualTo("response_time"));
    }
}
