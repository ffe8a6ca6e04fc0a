package com.faultline.triage.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Cause-to-effect chain for the primary cause, with chains for the runners-up.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CauseChain {

    private String rootCause;

    @Builder.Default
    private List<ChainLink> chain = new ArrayList<>();

    private double confidence;

    @Builder.Default
    private List<List<ChainLink>> alternativeChains = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChainLink {
        private String cause;
        private String effect;

        @Builder.Default
        private List<Evidence> evidence = new ArrayList<>();

        private double confidence;
        private Instant timestamp;
    }
}
