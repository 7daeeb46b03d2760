package com.hiring.refnet.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;

import lombok.Data;

/**
 * POJO representation of the engine configuration.
 *
 * <p>
 * Field initialisers hold the built-in defaults, so a partially specified file
 * only overrides the keys it names. See {@link ConfigLoader}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RefNetConfig {
    @JsonMerge
    private Simulation simulation = new Simulation();
    @JsonMerge
    private Bonus bonus = new Bonus();

    /** Population model used by the growth simulator. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Simulation {
        private int initialReferrers = 100;
        private int capacity = 10;
        private int maxDays = 1000;
        /** Seed for the stochastic variant; null draws from a fresh generator. */
        private Long seed;
    }

    /** Search space of the bonus optimizer. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Bonus {
        private int increment = 10;
        private int maxBonus = 10_000;
    }

    /**
     * Checks value ranges.
     *
     * @return this config
     * @throws IllegalArgumentException on the first invalid value
     */
    public RefNetConfig validate() {
        if (simulation == null || bonus == null)
            throw new IllegalArgumentException("Both 'simulation' and 'bonus' sections are required");
        if (simulation.initialReferrers <= 0)
            throw new IllegalArgumentException("simulation.initialReferrers must be positive: "
                    + simulation.initialReferrers);
        if (simulation.capacity <= 0)
            throw new IllegalArgumentException("simulation.capacity must be positive: " + simulation.capacity);
        if (simulation.maxDays <= 0)
            throw new IllegalArgumentException("simulation.maxDays must be positive: " + simulation.maxDays);
        if (simulation.seed != null && simulation.seed < 0)
            throw new IllegalArgumentException("simulation.seed must be non-negative: " + simulation.seed);
        if (bonus.increment <= 0)
            throw new IllegalArgumentException("bonus.increment must be positive: " + bonus.increment);
        if (bonus.maxBonus < bonus.increment)
            throw new IllegalArgumentException("bonus.maxBonus must be at least bonus.increment: " + bonus.maxBonus);
        return this;
    }
}
