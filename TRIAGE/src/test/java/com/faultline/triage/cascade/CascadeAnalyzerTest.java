package com.faultline.triage.cascade;

import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.domain.model.*;
import com.faultline.triage.domain.model.CascadeAnalysis.CascadeStep;
import com.faultline.triage.domain.model.CascadeAnalysis.RecoveryStep;
import com.faultline.triage.domain.model.IncidentMetrics.IncidentSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.faultline.triage.support.IncidentFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class CascadeAnalyzerTest {

    private CascadeAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new CascadeAnalyzer(new TriageProperties());
    }

    @Test
    @DisplayName("three entities cascade linearly and recover in reverse order")
    void linearCascadeRecoversInReverse() {
        IncidentAnalysis analysis = analysis(openIncident(),
                List.of(entity("a", "A", 100, 1), entity("b", "B", 100, 1), entity("c", "C", 100, 1)),
                IncidentSeverity.WARNING, 30);

        CascadeAnalysis cascade = analyzer.analyze(analysis);

        assertThat(cascade.getCascadeChain()).extracting(CascadeStep::getSystem).containsExactly("A", "B", "C");
        assertThat(cascade.getCascadeChain().get(0).getDependencies()).isEmpty();
        assertThat(cascade.getCascadeChain().get(2).getDependencies()).containsExactly("B");

        List<RecoveryStep> plan = cascade.getRecoveryPlan();
        assertThat(plan).hasSameSizeAs(cascade.getCascadeChain());
        assertThat(plan).extracting(RecoveryStep::getSystem).containsExactly("C", "B", "A");
        assertThat(plan).extracting(RecoveryStep::getOrder).containsExactly(1, 2, 3);
        assertThat(plan.get(0).getDependencies()).isEmpty();
        assertThat(plan.get(2).getDependencies()).containsExactly(plan.get(1).getSystem());
        assertThat(plan).allSatisfy(step -> assertThat(step.getEstimatedTimeMinutes()).isEqualTo(15));

        assertThat(cascade.getAffectedSystems()).containsExactly("A", "B", "C");
        assertThat(cascade.getPrimaryFailure()).isEqualTo("A");
        assertThat(cascade.getContainmentStrategies()).hasSize(5)
                .contains("Implement circuit breakers on dependent services");
    }

    @Test
    void singleSystemGetsOnlyGeneralContainment() {
        IncidentAnalysis analysis = analysis(openIncident(), List.of(entity("a", "A", 100, 1)),
                IncidentSeverity.INFO, 10);
        analysis.setPossibleCauses(new ArrayList<>(List.of(PossibleCause.builder()
                .type(CauseType.RESOURCE_EXHAUSTION).probability(0.6).build())));

        CascadeAnalysis cascade = analyzer.analyze(analysis);

        assertThat(cascade.getPrimaryFailure()).isEqualTo("resource_exhaustion");
        assertThat(cascade.getContainmentStrategies()).containsExactly(
                "Monitor system boundaries for early cascade detection",
                "Prepare rollback procedures for recent changes");
    }

    @Test
    void noEntitiesMeansEmptyChainAndPlan() {
        CascadeAnalysis cascade = analyzer.analyze(analysis(openIncident(), List.of(), IncidentSeverity.INFO, 10));

        assertThat(cascade.getPrimaryFailure()).isEqualTo("Unknown primary failure");
        assertThat(cascade.getCascadeChain()).isEmpty();
        assertThat(cascade.getRecoveryPlan()).isEmpty();
    }

    @Test
    void failurePointsRankedByProbabilityTimesImpact() {
        AffectedEntity strained = entity("a", "checkout-api", 2500, 8);
        strained.getMetrics().setMemoryUsage(90.0);
        IncidentAnalysis analysis = analysis(openIncident(),
                List.of(strained, entity("b", "healthy", 100, 0)), IncidentSeverity.CRITICAL, 30);

        List<FailurePoint> points = analyzer.failurePoints(analysis);

        assertThat(points).extracting(FailurePoint::getComponent)
                .containsExactly("Memory Management", "Application Logic", "Database");
        assertThat(points).allSatisfy(point -> assertThat(point.getSystem()).isEqualTo("checkout-api"));
    }
}
