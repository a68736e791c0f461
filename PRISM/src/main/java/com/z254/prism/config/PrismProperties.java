package com.z254.prism.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import java.time.Duration;

/**
 * Configuration properties for the PRISM correlation engine.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Alert store capacity and deduplication</li>
 *     <li>Correlation windows, deadlines and the periodic pass</li>
 *     <li>Default correlation rules</li>
 *     <li>Noise suppression and pattern learning</li>
 *     <li>Prediction and incident analysis</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "prism")
public class PrismProperties {

    private final Store store = new Store();
    private final Correlation correlation = new Correlation();
    private final Rules rules = new Rules();
    private final Noise noise = new Noise();
    private final Prediction prediction = new Prediction();
    private final Analysis analysis = new Analysis();

    /**
     * Alert store configuration.
     */
    @Data
    public static class Store {
        /** Maximum alerts held in memory; oldest are evicted first */
        @Positive
        private int capacity = 10_000;

        /** Repeat window within which a matching firing alert is treated as a duplicate */
        private Duration dedupRepeatWindow = Duration.ofMinutes(5);
    }

    /**
     * Correlation pass configuration.
     */
    @Data
    public static class Correlation {
        /** Window used when the caller does not supply one */
        private Duration defaultWindow = Duration.ofMinutes(15);

        /** Smallest window that yields clusters */
        private Duration minWindow = Duration.ofSeconds(60);

        /** Largest window that yields clusters */
        private Duration maxWindow = Duration.ofHours(24);

        /** Deadline applied to a pass when the caller does not supply one */
        private Duration defaultDeadline = Duration.ofSeconds(30);

        /** Run the default query on a schedule */
        private boolean periodicEnabled = true;

        /** Delay between periodic passes */
        private Duration periodicInterval = Duration.ofMinutes(1);
    }

    /**
     * Correlation rule registry configuration.
     */
    @Data
    public static class Rules {
        /** Register the built-in burst, locality, text and cascade rules at startup */
        private boolean registerDefaults = true;
    }

    /**
     * Noise suppression and pattern learning configuration.
     */
    @Data
    public static class Noise {
        /** Enable pattern learning and noise suppression */
        private boolean learningEnabled = true;

        /** Share of all alerts in the horizon above which a pattern counts as noise */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double frequencyThreshold = 0.1;

        /** Trailing horizon for frequency computation */
        private Duration horizon = Duration.ofHours(1);

        /** Prior occurrences a pattern needs before it can be judged noise */
        @Positive
        private int minOccurrences = 6;

        /** Upper bound on occurrence history kept per pattern */
        @Positive
        private int maxOccurrencesPerPattern = 5_000;

        /** Delay between re-evaluations of suppressed alerts */
        private Duration reevaluationInterval = Duration.ofMinutes(5);
    }

    /**
     * Prediction configuration.
     */
    @Data
    public static class Prediction {
        /** History considered by the predictor and retained by the pattern library */
        private Duration lookback = Duration.ofDays(7);

        /** Horizon used when the caller does not supply one */
        private Duration defaultHorizon = Duration.ofHours(1);
    }

    /**
     * Incident analysis configuration.
     */
    @Data
    public static class Analysis {
        /** How long an incident analysis stays cached per cluster */
        private Duration cacheTtl = Duration.ofMinutes(5);

        /** Maximum cached analyses */
        @Positive
        private int cacheSize = 500;
    }
}
