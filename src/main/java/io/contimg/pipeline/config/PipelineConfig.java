package io.contimg.pipeline.config;

import io.contimg.pipeline.model.FileKind;
import io.contimg.pipeline.model.UpstreamStatus;
import io.contimg.pipeline.service.pipeline.PipelineStage;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds application properties under the "app.pipeline" prefix to a strongly-typed
 * configuration object covering the registry, locking, resilience, detection and the
 * quality thresholds of the calibration and mosaic stages.
 */
@Data
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineConfig {

    private Registry registry = new Registry();
    private Lock lock = new Lock();
    private Retry retry = new Retry();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Stages stages = new Stages();
    private Detection detection = new Detection();
    private SelfCal selfcal = new SelfCal();
    private Mosaic mosaic = new Mosaic();
    private Engine engine = new Engine();

    @Data
    public static class Registry {
        /**
         * Publish attempts after which a failing artifact is parked in FAILED.
         */
        private int maxAttempts = 3;
        /**
         * When set, stage outputs are moved here on publish. Left empty, outputs stay where the stage wrote them.
         */
        private String publishedRoot;
    }

    @Data
    public static class Lock {
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofMillis(200);
        private Duration staleAfter = Duration.ofMinutes(5);
    }

    @Data
    public static class Retry {
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(60);
        private boolean jitter = true;
    }

    @Data
    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private Duration cooldown = Duration.ofSeconds(60);
    }

    @Data
    public static class Stages {
        private Duration defaultTimeout = Duration.ofMinutes(30);
        private Map<PipelineStage, Duration> timeouts = new EnumMap<>(PipelineStage.class);

        public Duration timeoutFor(PipelineStage stage) {
            return timeouts.getOrDefault(stage, defaultTimeout);
        }
    }

    @Data
    public static class Detection {
        private boolean enabled = true;
        /**
         * Directory scanned for subband files on startup. Empty disables the bootstrap scan.
         */
        private String inputDirectory;
        private Duration clusterTolerance = Duration.ofSeconds(60);
        /**
         * Group key of every subband in the arrival index.
         */
        private String streamKey = "obs";
        /**
         * Group key under which finished images are indexed for mosaic detection.
         */
        private String mosaicGroupKey = "mosaic";
        private Profile subband = new Profile(FileKind.SUBBAND, UpstreamStatus.ARRIVED, 16, 2, 30);
        private Profile mosaic = new Profile(FileKind.IMAGE, UpstreamStatus.IMAGED, 12, 60, 24 * 60);

        public Profile profileFor(FileKind kind) {
            return kind == FileKind.SUBBAND ? subband : mosaic;
        }
    }

    /**
     * One detection profile: which index entries are eligible and what makes a complete group.
     */
    @Data
    public static class Profile {
        private FileKind kind;
        private UpstreamStatus requiredStatus;
        private int expectedMembers;
        private long windowMinutes;
        private long maxAgeMinutes;

        public Profile() {
        }

        public Profile(FileKind kind, UpstreamStatus requiredStatus, int expectedMembers, long windowMinutes,
                       long maxAgeMinutes) {
            this.kind = kind;
            this.requiredStatus = requiredStatus;
            this.expectedMembers = expectedMembers;
            this.windowMinutes = windowMinutes;
            this.maxAgeMinutes = maxAgeMinutes;
        }
    }

    @Data
    public static class SelfCal {
        private boolean enabled = true;
        private int maxIterations = 5;
        private double minSnrImprovement = 1.05;
        /**
         * An iteration whose SNR falls below this fraction of the best SNR is treated as divergence.
         */
        private double divergenceFraction = 0.9;
        private boolean stopOnDivergence = true;
        private List<String> phaseSolints = new ArrayList<>(List.of("inf", "60s", "30s"));
        private boolean amplitudePass = true;
        private String amplitudeSolint = "inf";
        private double minInitialSnr = 10.0;
        private double maxFlaggedFraction = 0.5;
        /**
         * Best SNR a run has to reach to count as a success. Zero disables the floor.
         */
        private double qualityFloorSnr = 0.0;
    }

    @Data
    public static class Mosaic {
        private int minTiles = 2;
        private int overlapMarginPixels = 10;
        private double pixelScaleDeg = 0.001;
        private double maxRmsNoise = 0.01;
        private double maxNoiseFactor = 5.0;
        private double minCoverageFraction = 0.1;
        private double minDynamicRange = 5.0;
        private Validation validation = new Validation();

        @Data
        public static class Validation {
            private double minCoverageFraction = 0.5;
            private int gridSize = 4;
            private double maxRmsRatio = 3.0;
            private double bowlSigma = 5.0;
            private double outlierSigma = 10.0;
            private double maxOutlierFraction = 0.01;
        }
    }

    @Data
    public static class Engine {
        private List<String> command = new ArrayList<>(List.of("contimg-engine"));
        private Duration processTimeout = Duration.ofMinutes(20);
        private Set<Integer> transientExitCodes = Set.of(75, 124);
        private int readRetryAttempts = 3;
        private long readRetryDelayMs = 500;
    }
}
