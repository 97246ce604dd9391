package com.eainde.ace.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized ACE settings bound from the {@code ace.*} namespace.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ace")
public class AceProperties {

    /** When false every non hard-ceiling action runs as if bypass mode were {@code disabled}. */
    private boolean enabled = true;

    /** Standing bypass mode: {@code off}, {@code log-only} or {@code disabled}. */
    private String bypassMode = "off";

    private Weights weights = new Weights();
    private Thresholds thresholds = new Thresholds();
    private Decay decay = new Decay();
    private Audit audit = new Audit();
    private Storage storage = new Storage();

    @Getter
    @Setter
    public static class Weights {
        private double reversibility = 0.30;
        private double precedent = 0.35;
        private double blastRadius = 0.35;
    }

    @Getter
    @Setter
    public static class Thresholds {
        private double act = 0.70;
        private double escalate = 0.40;
    }

    @Getter
    @Setter
    public static class Decay {
        /** Per-day exponential decay constant. 0.01 halves an unused score in about 69 days. */
        private double lambda = 0.01;
    }

    @Getter
    @Setter
    public static class Audit {
        private int rubberStampThreshold = 10;
        private int intervalDays = 7;
        private double driftWarningRate = 0.20;
        private int driftMinimumSamples = 5;
    }

    @Getter
    @Setter
    public static class Storage {
        /** {@code file} or {@code memory}. */
        private String type = "file";
        private String basePath = "ace-data";
    }
}
