package com.faultline.triage.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisExceptionTest {

    @Test
    void wrapsWithStageAndIncident() {
        Throwable wrapped = AnalysisException.wrap(AnalysisStage.RISK_ASSESSMENT, "INC-7",
                new IllegalStateException("no metrics"));

        assertThat(wrapped).isInstanceOf(AnalysisException.class)
                .hasMessage("Risk assessment failed for incident INC-7: no metrics")
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(((AnalysisException) wrapped).getStage()).isEqualTo(AnalysisStage.RISK_ASSESSMENT);
        assertThat(((AnalysisException) wrapped).getIncidentId()).isEqualTo("INC-7");
    }

    @Test
    void causeWithoutMessageFallsBackToTypeName() {
        assertThat(AnalysisException.wrap(AnalysisStage.ERROR_PATTERNS, null, new TimeoutException()))
                .hasMessage("Error pattern analysis failed: TimeoutException");
    }

    @Test
    void contextualErrorsPassThrough() {
        IncidentNotFoundException notFound = new IncidentNotFoundException("INC-9");
        AnalysisException inner = new AnalysisException(AnalysisStage.DATA_COLLECTION, "INC-9", notFound);

        assertThat(AnalysisException.wrap(AnalysisStage.INCIDENT_ANALYSIS, "INC-9", notFound)).isSameAs(notFound);
        assertThat(AnalysisException.wrap(AnalysisStage.INCIDENT_REPORT, "INC-9", inner)).isSameAs(inner);
    }
}
