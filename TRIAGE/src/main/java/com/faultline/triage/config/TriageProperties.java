package com.faultline.triage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the TRIAGE engine.
 * <p>
 * Scoring thresholds used by the detectors and models are tabulated here so they can be
 * tuned and tested independently of the algorithms that consume them:
 * <ul>
 *     <li>Telemetry platform connection settings</li>
 *     <li>Collection windows and result cache TTLs</li>
 *     <li>Anomaly, pattern and correlation thresholds</li>
 *     <li>Cause probabilities and fault progression tiers</li>
 *     <li>Risk, escalation and resolution-time tables</li>
 * </ul>
 * Descriptive text, stage names and recommendation wording stay with the code.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "triage")
public class TriageProperties {

    private final Telemetry telemetry = new Telemetry();
    private final Collection collection = new Collection();
    private final Cache cache = new Cache();
    private final Anomaly anomaly = new Anomaly();
    private final Patterns patterns = new Patterns();
    private final Correlation correlation = new Correlation();
    private final Similarity similarity = new Similarity();
    private final Rca rca = new Rca();
    private final Progression progression = new Progression();
    private final Risk risk = new Risk();
    private final Recommendations recommendations = new Recommendations();
    private final Cascade cascade = new Cascade();

    /**
     * Telemetry platform client configuration. An empty API key puts the client in stub mode.
     */
    @Data
    public static class Telemetry {
        @NotBlank
        private String restBaseUrl = "https://api.newrelic.com/v2";

        @NotBlank
        private String graphqlUrl = "https://api.newrelic.com/graphql";

        private String apiKey = "";

        private long accountId;

        private Duration timeout = Duration.ofSeconds(30);
    }

    /**
     * Time windows around an incident.
     */
    @Data
    public static class Collection {
        /** Context collected before the incident opened */
        private Duration lookback = Duration.ofMinutes(30);

        /** Context collected after the incident closed (or now) */
        private Duration lookahead = Duration.ofMinutes(15);

        @Positive
        private int performanceBucketMinutes = 5;

        @Positive
        private int errorEventLimit = 100;

        @Positive
        private int eventLimit = 100;

        /** Window for nearby deployment and infrastructure events */
        private Duration correlationLookback = Duration.ofMinutes(60);
        private Duration correlationLookahead = Duration.ofMinutes(30);

        /** Deployment causal analysis looks further back */
        private Duration deploymentLookback = Duration.ofMinutes(120);

        /** Aggregation window for current entity metrics, in NRQL SINCE syntax */
        @NotBlank
        private String entityMetricsSince = "1 hour ago";
    }

    @Data
    public static class Cache {
        private Duration collectionTtl = Duration.ofMinutes(10);
        private Duration analysisTtl = Duration.ofMinutes(30);
        private Duration engineTtl = Duration.ofMinutes(15);
        private Duration patternTtl = Duration.ofMinutes(60);

        @Positive
        private long maximumSize = 10_000;
    }

    @Data
    public static class Anomaly {
        @Positive
        private int minimumSamples = 10;

        /** Deviations (in standard deviations) strictly above this are anomalous */
        private double threshold = 2.0;
        private double mediumAbove = 2.5;
        private double highAbove = 3.0;
        private double criticalAbove = 4.0;

        /** Deviation at which confidence saturates at 1 */
        @Positive
        private double confidenceScale = 4.0;
    }

    @Data
    public static class Patterns {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double detectionThreshold = 0.5;

        private double spikeFactor = 1.5;
        private double dropFactor = 0.5;
        private double equalsTolerance = 0.1;

        @Positive
        private int maxExamples = 10;
    }

    @Data
    public static class Correlation {
        private final EventWindow deployment = new EventWindow(Duration.ofMinutes(120), 1.2);
        private final EventWindow infrastructure = new EventWindow(Duration.ofMinutes(60), 1.1);

        /** Events scoring strictly above this are reported */
        private double reportThreshold = 0.3;

        private final DeploymentTiers deploymentTiers = new DeploymentTiers();
        private final InfrastructureTiers infrastructureTiers = new InfrastructureTiers();
    }

    /**
     * Linear decay window and causal-weight multiplier for one event type.
     */
    @Data
    public static class EventWindow {
        private Duration window;
        private double multiplier;

        public EventWindow() {
        }

        public EventWindow(Duration window, double multiplier) {
            this.window = window;
            this.multiplier = multiplier;
        }
    }

    @Data
    public static class DeploymentTiers {
        private Duration window = Duration.ofMinutes(120);
        private double sameEntityBoost = 1.5;
        private double likelyCauseMaxGapMinutes = 30;
        private double likelyCauseMinScore = 0.8;
        private double possibleCauseMaxGapMinutes = 60;
        private double possibleCauseMinScore = 0.5;

        private List<ConfidenceTier> confidenceTiers = new ArrayList<>(List.of(
                new ConfidenceTier(15, 0.8, 0.9),
                new ConfidenceTier(30, 0.6, 0.7),
                new ConfidenceTier(60, 0.4, 0.5)));

        /** Confidence when no tier applies */
        private double confidenceFloor = 0.3;
    }

    @Data
    public static class InfrastructureTiers {
        private Duration window = Duration.ofMinutes(60);
        private double criticalMultiplier = 1.3;
        private double highMultiplier = 1.1;
        private double directCauseMaxGapMinutes = 15;
        private double directCauseMinScore = 0.8;
        private double contributingMaxGapMinutes = 30;
        private double contributingMinScore = 0.5;

        /** Confidence is {@code score * confidenceWeight}, boosted for critical or close events, capped at 1 */
        private double confidenceWeight = 0.8;
        private double criticalConfidenceBoost = 1.2;
        private double closeGapMinutes = 10;
        private double closeGapConfidenceBoost = 1.1;
    }

    /**
     * First tier whose gap is strictly under {@code maxGapMinutes} and score strictly above
     * {@code minScore} supplies the confidence.
     */
    @Data
    public static class ConfidenceTier {
        private double maxGapMinutes;
        private double minScore;
        private double confidence;

        public ConfidenceTier() {
        }

        public ConfidenceTier(double maxGapMinutes, double minScore, double confidence) {
            this.maxGapMinutes = maxGapMinutes;
            this.minScore = minScore;
            this.confidence = confidence;
        }
    }

    @Data
    public static class Similarity {
        private double sameEntityWeight = 0.3;
        private double sameConditionWeight = 0.4;
        private double samePolicyWeight = 0.2;
        private double timeOfDayWeight = 0.1;
        private int timeOfDayWindowHours = 2;
        private double threshold = 0.5;
        private Duration lookback = Duration.ofDays(90);

        @Positive
        private int maxResults = 5;
    }

    /**
     * Candidate cause heuristics and root-cause confidence.
     */
    @Data
    public static class Rca {
        private double deploymentProbability = 0.8;
        private double errorPatternProbability = 0.7;
        private double degradationProbability = 0.6;
        private double unknownProbability = 0.1;

        /** A snapshot is degraded when response time or error rate is strictly above these */
        private double degradedResponseTime = 2000;
        private double degradedErrorRate = 10;

        /** Share of degraded snapshots strictly above which degradation becomes a cause */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double degradedSnapshotShare = 0.5;

        /** Confidence of the degradation to user impact link after a deployment */
        private double deploymentImpactLinkConfidence = 0.8;

        /** Root-cause confidence is {@code probability * causeWeight + min(evidence / saturation, 1) * evidenceWeight} */
        private double causeWeight = 0.6;
        private double evidenceWeight = 0.4;

        @Positive
        private int evidenceSaturation = 5;

        /** Cause impact is high strictly above the first, medium strictly above the second */
        private double highImpactProbability = 0.7;
        private double mediumImpactProbability = 0.4;
    }

    /**
     * Degradation, error spike and speed tiers for fault progression.
     */
    @Data
    public static class Progression {
        /** Consecutive snapshot jumps strictly above these mark degradation */
        private double responseTimeJumpPercent = 50;
        private double errorRateJumpPoints = 5;

        @Positive
        private int spikeWindowMinutes = 5;

        /** A window is a spike when it holds more than this multiple of the average window */
        private double spikeFactor = 2;
        private int spikeHighCount = 50;
        private int spikeCriticalCount = 100;

        /** Degradation severity by absolute change */
        private double mediumChange = 50;
        private double highChange = 100;
        private double criticalChange = 200;

        /** Speed by stages per hour */
        private double moderatePerHour = 1;
        private double fastPerHour = 3;
        private double criticalPerHour = 6;

        private int interventionWindowMinutes = 15;
        private double highInterventionEffectiveness = 0.8;
        private double mediumInterventionEffectiveness = 0.6;
    }

    /**
     * Likelihood and impact of one risk factor.
     */
    @Data
    public static class FactorWeight {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double likelihood;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double impact;

        public FactorWeight() {
        }

        public FactorWeight(double likelihood, double impact) {
            this.likelihood = likelihood;
            this.impact = impact;
        }
    }

    @Data
    public static class RiskFactors {
        private final FactorWeight criticalSeverity = new FactorWeight(0.9, 0.9);
        private final FactorWeight multipleSystems = new FactorWeight(0.7, 0.8);
        private final FactorWeight severeUserImpact = new FactorWeight(0.8, 0.9);
        private final FactorWeight extendedDuration = new FactorWeight(0.6, 0.7);

        /** Affected entities strictly above this count as multiple systems */
        private int multipleSystemsEntityCount = 3;
    }

    /**
     * Incident severity tiers and the 0-100 impact score.
     */
    @Data
    public static class IncidentSeverityTiers {
        /** Error rate or affected entity count strictly above these */
        private double criticalErrorRate = 10;
        private int criticalEntityCount = 3;
        private double warningErrorRate = 5;
        private int warningEntityCount = 1;

        private double errorRateScoreWeight = 2;
        private double errorRateScoreCap = 40;
        private double entityScoreWeight = 10;
        private double entityScoreCap = 30;
        private double minutesPerDurationPoint = 10;
        private double durationScoreCap = 30;
    }

    @Data
    public static class BusinessImpactTiers {
        /** Revenue: high when critical with more entities, medium when critical or more entities */
        private int revenueHighEntityCount = 2;
        private int revenueMediumEntityCount = 1;

        private long reputationHighDurationMinutes = 60;
        private long reputationMediumDurationMinutes = 120;
        private long complianceHighDurationMinutes = 240;
    }

    @Data
    public static class EscalationTriggers {
        /** Error rate trigger fires strictly above {@code errorRateTrigger}, projecting to {@code errorRateThreshold} */
        private double errorRateTrigger = 5;
        private double errorRateThreshold = 15;
        private double responseTimeTrigger = 1000;
        private double responseTimeThreshold = 5000;
        private long durationThresholdMinutes = 120;

        /** Minutes assumed to reach a threshold not yet exceeded */
        private long projectedMinutesToThreshold = 60;
        private long defaultTimeframeMinutes = 120;
    }

    /**
     * Incident analysis confidence: {@code cause * causeWeight + avgEvidence * evidencePerItem * evidenceWeight
     * + correlation * correlationWeight}, capped.
     */
    @Data
    public static class AnalysisConfidence {
        private double withoutCauses = 0.1;
        private double causeWeight = 0.5;
        private double evidencePerItem = 0.1;
        private double evidenceWeight = 0.3;
        private double correlationWeight = 0.2;
        private double cap = 0.95;
    }

    /**
     * Comprehensive analysis confidence: base plus strongest pattern, anomaly count and strongest correlation.
     */
    @Data
    public static class ComprehensiveConfidence {
        private double base = 0.3;
        private double patternWeight = 0.4;

        @Positive
        private double anomaliesPerPoint = 10;
        private double anomalyCap = 0.2;
        private double correlationWeight = 0.2;
        private double cap = 0.95;
    }

    @Data
    public static class Risk {
        private final IncidentSeverityTiers severity = new IncidentSeverityTiers();
        private final RiskFactors factors = new RiskFactors();
        private final BusinessImpactTiers businessImpact = new BusinessImpactTiers();
        private final EscalationTriggers triggers = new EscalationTriggers();
        private final AnalysisConfidence analysisConfidence = new AnalysisConfidence();
        private final ComprehensiveConfidence comprehensiveConfidence = new ComprehensiveConfidence();

        private double escalationBase = 0.1;
        private double escalationCap = 0.95;
        private double criticalSeverityIncrement = 0.4;
        private double warningSeverityIncrement = 0.2;
        private long longDurationMinutes = 60;
        private double longDurationIncrement = 0.3;
        private long mediumDurationMinutes = 30;
        private double mediumDurationIncrement = 0.1;
        private double riskFactorWeight = 0.1;

        /** Escalation probability above which contingency plans are drafted */
        private double contingencyThreshold = 0.7;

        private double severeUserErrorRate = 20;
        private double moderateUserErrorRate = 10;
        private double minimalUserErrorRate = 2;

        private double baselineResolutionMinutes = 60;
        private double criticalResolutionMultiplier = 2.0;
        private double warningResolutionMultiplier = 1.5;
        private double minutesPerAffectedEntity = 15;
        private double deploymentCauseMultiplier = 0.7;
        private double resourceExhaustionMultiplier = 1.3;
        private double resolutionEstimateConfidence = 0.6;
    }

    @Data
    public static class Recommendations {
        /** Entities with an error rate strictly above this get an error-rate recommendation */
        private double highErrorRate = 5.0;

        /** Deployments strictly closer than this to the incident opening count as recent */
        private Duration recentDeployment = Duration.ofHours(1);
    }

    @Data
    public static class Cascade {
        @Positive
        private int recoveryStepMinutes = 15;
    }
}
