package com.faultline.triage.rca;

import com.faultline.triage.config.TriageProperties;
import com.faultline.triage.detection.ErrorPatternAnalyzer;
import com.faultline.triage.domain.model.*;
import com.faultline.triage.recommendation.RecommendationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.faultline.triage.support.IncidentFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class RootCauseChainBuilderTest {

    private RootCauseChainBuilder builder;

    @BeforeEach
    void setUp() {
        TriageProperties properties = new TriageProperties();
        builder = new RootCauseChainBuilder(new ErrorPatternAnalyzer(),
                new RecommendationEngine(properties), properties);
    }

    @Test
    void ranksDeploymentErrorAndDegradationCauses() {
        List<PossibleCause> causes = builder.possibleCauses(noisyCollection());

        assertThat(causes).extracting(PossibleCause::getType).containsExactly(
                CauseType.CODE_DEPLOYMENT, CauseType.EXTERNAL_DEPENDENCY, CauseType.RESOURCE_EXHAUSTION);
        assertThat(causes).extracting(PossibleCause::getProbability).containsExactly(0.8, 0.7, 0.6);
        assertThat(causes.get(2).getEvidence().get(0).getDescription())
                .isEqualTo("4 out of 4 snapshots show degraded performance");
    }

    @Test
    void deploymentsMoreThanAnHourAwayAreNotCauses() {
        Incident incident = openIncident();
        IncidentDataCollection data = collection(incident, List.of(), healthySnapshots(4)).toBuilder()
                .deploymentEvents(List.of(deployment(ENTITY_ID, OPENED_AT.minus(Duration.ofMinutes(61)))))
                .build();

        assertThat(builder.possibleCauses(data)).isEmpty();
    }

    @Test
    void analysisBlendsProbabilityWithEvidence() {
        RootCauseAnalysis analysis = builder.analyze(noisyCollection());

        assertThat(analysis.getPrimaryCause().getType()).isEqualTo(CauseType.CODE_DEPLOYMENT);
        assertThat(analysis.getPrimaryCause().getImpact()).isEqualTo(Severity.HIGH);
        assertThat(analysis.getContributingFactors()).hasSize(2);
        assertThat(analysis.getEvidenceChain()).hasSize(2);
        assertThat(analysis.getConfidenceScore()).isCloseTo(0.8 * 0.6 + 0.4 * 0.4, offset(1e-9));
        assertThat(analysis.getAnalysisMethod()).isEqualTo("correlation_and_pattern_analysis");
        assertThat(analysis.getRecommendations()).hasSize(3);
        assertThat(analysis.getPreventionStrategies()).extracting(PreventionStrategy::getType).containsExactly("testing");
    }

    @Test
    void quietIncidentFallsBackToUnknownCause() {
        RootCauseAnalysis analysis = builder.analyze(collection(openIncident(), List.of(), healthySnapshots(4)));

        assertThat(analysis.getPrimaryCause().getType()).isEqualTo(CauseType.UNKNOWN);
        assertThat(analysis.getPrimaryCause().getProbability()).isEqualTo(0.1);
        assertThat(analysis.getContributingFactors()).isEmpty();
        assertThat(analysis.getPreventionStrategies()).isEmpty();
        assertThat(analysis.getConfidenceScore()).isCloseTo(0.1 * 0.6 + 0.2 * 0.4, offset(1e-9));
    }

    @Test
    void deploymentChainReachesUserImpactWithAlternatives() {
        IncidentDataCollection data = noisyCollection();
        IncidentAnalysis analysis = IncidentAnalysis.builder()
                .incident(data.getIncident())
                .possibleCauses(builder.possibleCauses(data))
                .build();

        CauseChain chain = builder.causeChain(analysis);

        assertThat(chain.getRootCause()).isEqualTo("code_deployment");
        assertThat(chain.getConfidence()).isEqualTo(0.8);
        assertThat(chain.getChain()).extracting(CauseChain.ChainLink::getEffect)
                .containsExactly("Performance degradation", "User impact");
        assertThat(chain.getAlternativeChains()).hasSize(2);
        assertThat(chain.getAlternativeChains().get(0)).singleElement()
                .extracting(CauseChain.ChainLink::getCause)
                .isEqualTo("external_dependency");
    }

    @Test
    void chainWithoutCausesIsUnknown() {
        CauseChain chain = builder.causeChain(IncidentAnalysis.builder().incident(openIncident()).build());

        assertThat(chain.getRootCause()).isEqualTo("Unknown");
        assertThat(chain.getConfidence()).isEqualTo(0.1);
        assertThat(chain.getChain()).isEmpty();
        assertThat(chain.getAlternativeChains()).isEmpty();
    }

    private static IncidentDataCollection noisyCollection() {
        Incident incident = openIncident();
        List<ErrorEvent> errors = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            errors.add(error("Upstream payment gateway returned 503 after " + i + " ms", ENTITY_ID,
                    OPENED_AT.plusSeconds(i)));
        }
        List<PerformanceSnapshot> degraded = List.of(
                snapshot(OPENED_AT, 2500, 1, 100, null),
                snapshot(OPENED_AT.plusSeconds(300), 2600, 1, 100, null),
                snapshot(OPENED_AT.plusSeconds(600), 400, 12, 100, null),
                snapshot(OPENED_AT.plusSeconds(900), 3100, 14, 100, null));

        return collection(incident, List.of(), degraded).toBuilder()
                .deploymentEvents(List.of(deployment(ENTITY_ID, OPENED_AT.minus(Duration.ofMinutes(10)))))
                .errorEvents(errors)
                .build();
    }
}
