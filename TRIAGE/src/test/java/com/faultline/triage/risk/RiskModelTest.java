package com.faultline.triage.risk;

import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.*;
import com.faultline.triage.domain.model.EscalationPrediction.TriggerKind;
import com.faultline.triage.domain.model.IncidentMetrics.IncidentSeverity;
import com.faultline.triage.domain.model.RiskAssessment.BusinessImpact;
import com.faultline.triage.domain.model.RiskAssessment.ImpactLevel;
import com.faultline.triage.domain.model.RiskAssessment.UserImpact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.faultline.triage.support.IncidentFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class RiskModelTest {

    private RiskModel model;

    @BeforeEach
    void setUp() {
        model = new RiskModel(new TriageProperties());
    }

    @Nested
    @DisplayName("Incident metrics")
    class IncidentMetricsTests {

        @Test
        void highErrorRateIsCritical() {
            IncidentMetrics metrics = model.incidentMetrics(openIncident(),
                    List.of(entity(ENTITY_ID, ENTITY_NAME, 300, 12)), NOW);

            assertThat(metrics.getSeverity()).isEqualTo(IncidentSeverity.CRITICAL);
            assertThat(metrics.getDurationMinutes()).isEqualTo(45);
            assertThat(metrics.getImpactScore()).isEqualTo(39);
            assertThat(metrics.getBusinessImpact()).isEqualTo("High business impact due to service degradation");
        }

        @Test
        void twoEntitiesAreAWarning() {
            IncidentMetrics metrics = model.incidentMetrics(openIncident(),
                    List.of(entity("a", "a", 100, 0), entity("b", "b", 100, 1)), NOW);

            assertThat(metrics.getSeverity()).isEqualTo(IncidentSeverity.WARNING);
        }

        @Test
        void analysisConfidenceBlendsCausesAndCorrelation() {
            List<PossibleCause> causes = List.of(cause(CauseType.CODE_DEPLOYMENT, 0.8), cause(CauseType.RESOURCE_EXHAUSTION, 0.6));
            List<CorrelatedEvent> events = List.of(CorrelatedEvent.builder().correlationScore(1.0).build());

            assertThat(model.analysisConfidence(List.of(), events)).isEqualTo(0.1);
            assertThat(model.analysisConfidence(causes, events)).isCloseTo(0.4 + 0.03 + 0.2, offset(1e-9));
        }
    }

    @Nested
    @DisplayName("Risk assessment")
    class AssessmentTests {

        @Test
        @DisplayName("escalation probability never exceeds the cap")
        void escalationIsCapped() {
            List<AffectedEntity> entities = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                entities.add(entity("e" + i, "svc-" + i, 4000, 50));
            }
            IncidentAnalysis analysis = analysis(openIncident(), entities, IncidentSeverity.CRITICAL, 300);

            RiskAssessment risk = model.assess(analysis);

            assertThat(risk.getEscalationProbability()).isEqualTo(0.95);
            assertThat(risk.getCurrentRisk()).isEqualTo(Severity.CRITICAL);
            assertThat(risk.getRiskFactors()).hasSize(4);
        }

        @Test
        @DisplayName("escalation probability never drops below the base")
        void escalationHasFloor() {
            IncidentAnalysis analysis = analysis(openIncident(), List.of(entity("a", "a", 100, 0)),
                    IncidentSeverity.INFO, 5);

            RiskAssessment risk = model.assess(analysis);

            assertThat(risk.getEscalationProbability()).isEqualTo(0.1);
            assertThat(risk.getCurrentRisk()).isEqualTo(Severity.LOW);
            assertThat(risk.getRiskFactors()).isEmpty();
        }

        @Test
        void businessImpactClassifiesFourAxes() {
            IncidentAnalysis analysis = analysis(openIncident(),
                    List.of(entity("a", "a", 100, 25), entity("b", "b", 100, 1), entity("c", "c", 100, 1)),
                    IncidentSeverity.CRITICAL, 90);

            BusinessImpact impact = model.businessImpact(analysis);

            assertThat(impact.getUserImpact()).isEqualTo(UserImpact.SEVERE);
            assertThat(impact.getRevenueImpact()).isEqualTo(ImpactLevel.HIGH);
            assertThat(impact.getReputationImpact()).isEqualTo(ImpactLevel.HIGH);
            assertThat(impact.getComplianceRisk()).isEqualTo(ImpactLevel.MEDIUM);
        }

        @Test
        void deploymentCauseShortensResolutionEstimate() {
            IncidentAnalysis analysis = analysis(openIncident(),
                    List.of(entity("a", "a", 100, 1), entity("b", "b", 100, 1)), IncidentSeverity.CRITICAL, 20);
            analysis.setPossibleCauses(new ArrayList<>(List.of(cause(CauseType.CODE_DEPLOYMENT, 0.8))));

            assertThat(model.timeToResolution(analysis).getEstimatedMinutes()).isEqualTo(105);
        }
    }

    @Nested
    @DisplayName("Escalation prediction")
    class EscalationTests {

        @Test
        void triggersProjectTimeToThreshold() {
            IncidentAnalysis analysis = analysis(openIncident(), List.of(entity("a", "a", 1500, 8)),
                    IncidentSeverity.WARNING, 45);

            EscalationPrediction prediction = model.predictEscalation(analysis, model.assess(analysis));

            assertThat(prediction.getTriggers()).extracting(EscalationPrediction.Trigger::getKind)
                    .containsExactly(TriggerKind.ERROR_RATE, TriggerKind.RESPONSE_TIME, TriggerKind.DURATION);
            assertThat(prediction.getTimeframeMinutes()).isEqualTo(60);
            assertThat(prediction.getPreventionActions()).hasSize(6).doesNotHaveDuplicates();
        }

        @Test
        void exceededThresholdsHaveNoProjection() {
            IncidentAnalysis analysis = analysis(openIncident(), List.of(entity("a", "a", 200, 20)),
                    IncidentSeverity.CRITICAL, 150);

            EscalationPrediction prediction = model.predictEscalation(analysis, model.assess(analysis));

            assertThat(prediction.getTriggers().get(0).getTimeToThresholdMinutes()).isNull();
            assertThat(prediction.getTimeframeMinutes()).isZero();
        }
    }

    @Nested
    @DisplayName("Configured tables")
    class ConfiguredTableTests {

        @Test
        void riskFactorWeightsComeFromProperties() {
            TriageProperties properties = new TriageProperties();
            properties.getRisk().getFactors().getCriticalSeverity().setLikelihood(0.5);
            RiskModel tuned = new RiskModel(properties);
            IncidentAnalysis analysis = analysis(openIncident(), List.of(entity("a", "a", 200, 1)),
                    IncidentSeverity.CRITICAL, 20);

            RiskAssessment defaults = model.assess(analysis);
            RiskAssessment assessed = tuned.assess(analysis);

            assertThat(defaults.getRiskFactors().get(0).getLikelihood()).isEqualTo(0.9);
            assertThat(assessed.getRiskFactors().get(0).getLikelihood()).isEqualTo(0.5);
            assertThat(assessed.getEscalationProbability()).isLessThan(defaults.getEscalationProbability());
        }

        @Test
        void escalationTriggerThresholdsComeFromProperties() {
            TriageProperties properties = new TriageProperties();
            properties.getRisk().getTriggers().setErrorRateTrigger(2);
            properties.getRisk().getTriggers().setErrorRateThreshold(12.5);
            RiskModel tuned = new RiskModel(properties);
            IncidentAnalysis analysis = analysis(openIncident(), List.of(entity("a", "a", 200, 3)),
                    IncidentSeverity.WARNING, 45);

            EscalationPrediction defaults = model.predictEscalation(analysis, model.assess(analysis));
            EscalationPrediction prediction = tuned.predictEscalation(analysis, tuned.assess(analysis));

            assertThat(defaults.getTriggers()).extracting(EscalationPrediction.Trigger::getCondition)
                    .containsExactly("Incident duration exceeds 2 hours");
            assertThat(prediction.getTriggers()).extracting(EscalationPrediction.Trigger::getCondition)
                    .containsExactly("Error rate exceeds 12.5%", "Incident duration exceeds 2 hours");
        }
    }

    @Test
    void comprehensiveConfidenceStartsAtBaseline() {
        assertThat(model.comprehensiveConfidence(List.of(), List.of(), List.of())).isEqualTo(0.3);
    }

    private static PossibleCause cause(CauseType type, double probability) {
        return PossibleCause.builder()
                .type(type)
                .probability(probability)
                .evidence(new ArrayList<>(List.of(Evidence.builder().description("e").build())))
                .build();
    }
}
