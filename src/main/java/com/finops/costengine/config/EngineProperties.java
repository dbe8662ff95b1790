package com.finops.costengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private Anomaly anomaly = new Anomaly();

    private RightSizing rightSizing = new RightSizing();

    @Data
    public static class Anomaly {
        // Training needs at least this many daily observations.
        private int minTrainingObservations = 90;

        // Below this, rolling statistics run on a truncated context and a warning is logged.
        private int minScoringObservations = 7;

        // Share of training points treated as outliers when placing the decision boundary.
        private double contamination = 0.1;

        private int numTrees = 100;
        private int sampleSize = 256;
        private long seed = 42L;

        // Number of services reported as affected by an anomaly.
        private int affectedServicesLimit = 3;
    }

    @Data
    public static class RightSizing {
        // Safety margin on top of observed p99 utilization (0.2 = 20%).
        private double headroom = 0.2;

        private double minVcpuFloor = 1.0;
        private double minMemoryGbFloor = 0.5;

        // Only consider types from the current type's family (m5 -> m5.*).
        private boolean sameFamilyOnly = true;

        // Recommendations saving less than this share of current cost are dropped. 0 keeps any saving.
        private double minSavingsPct = 0.0;

        // Profiles built from fewer observations get at most MEDIUM confidence.
        private int minUtilizationObservations = 14;
    }
}
