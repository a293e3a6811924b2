package com.hellblazer.hexcrawl.simulation.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Settings of one encounter's round loop.
 * <p>
 * The round limit, random seed and per-round validation drive the loop itself. The turn timeout and the
 * auto-progress delay are carried for the host that schedules {@code processRound} calls; the loop never reads
 * them, it only resolves a round when asked.
 * <p>
 * Out of range values never fail the build; they fall back to "no limit" and log a warning:
 * <pre>
 * var config = GameLoopConfig.builder()
 *                            .withMaxRounds(30)
 *                            .withRandomSeed(7L)
 *                            .build();
 * </pre>
 *
 * @author hal.hildebrand
 */
public class GameLoopConfig {
    public static final int      DEFAULT_MAX_ROUNDS          = 20;
    public static final Duration DEFAULT_TURN_TIMEOUT        = Duration.ofSeconds(30);
    public static final Duration DEFAULT_AUTO_PROGRESS_AFTER = Duration.ofSeconds(5);
    public static final long     DEFAULT_RANDOM_SEED         = 42L;

    private static final Logger log = LoggerFactory.getLogger(GameLoopConfig.class);

    private final int      maxRounds;
    private final Duration turnTimeout;
    private final Duration autoProgressAfter;
    private final long     randomSeed;
    private final boolean  validateEachRound;

    private GameLoopConfig(Builder builder) {
        this.maxRounds = builder.maxRounds;
        this.turnTimeout = builder.turnTimeout;
        this.autoProgressAfter = builder.autoProgressAfter;
        this.randomSeed = builder.randomSeed;
        this.validateEachRound = builder.validateEachRound;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GameLoopConfig defaultConfig() {
        return builder().build();
    }

    /**
     * @return last round that is played, 0 when unlimited
     */
    public int getMaxRounds() {
        return maxRounds;
    }

    public boolean isRoundLimitEnabled() {
        return maxRounds > 0;
    }

    /**
     * @return how long a host waits for submissions, {@link Duration#ZERO} for no timeout
     */
    public Duration getTurnTimeout() {
        return turnTimeout;
    }

    public boolean isTurnTimeoutEnabled() {
        return !turnTimeout.isZero();
    }

    /**
     * @return delay after which a host may process the round once every living player has submitted
     */
    public Duration getAutoProgressAfter() {
        return autoProgressAfter;
    }

    /**
     * @return seed of the random source used for status effect chances
     */
    public long getRandomSeed() {
        return randomSeed;
    }

    /**
     * @return true if the loop runs its consistency check after every round
     */
    public boolean isValidateEachRound() {
        return validateEachRound;
    }

    public Builder toBuilder() {
        return builder().withMaxRounds(maxRounds)
                        .withTurnTimeout(turnTimeout)
                        .withAutoProgressAfter(autoProgressAfter)
                        .withRandomSeed(randomSeed)
                        .withValidateEachRound(validateEachRound);
    }

    public static class Builder {
        private int      maxRounds         = DEFAULT_MAX_ROUNDS;
        private Duration turnTimeout       = DEFAULT_TURN_TIMEOUT;
        private Duration autoProgressAfter = DEFAULT_AUTO_PROGRESS_AFTER;
        private long     randomSeed        = DEFAULT_RANDOM_SEED;
        private boolean  validateEachRound = true;

        private Builder() {
        }

        /**
         * @param maxRounds last round played; zero or negative disables the limit
         */
        public Builder withMaxRounds(int maxRounds) {
            if (maxRounds < 0) {
                log.warn("Invalid max rounds {}, round limit disabled", maxRounds);
            }
            this.maxRounds = Math.max(0, maxRounds);
            return this;
        }

        public Builder withTurnTimeout(Duration timeout) {
            this.turnTimeout = nonNegative("turn timeout", timeout);
            return this;
        }

        public Builder withAutoProgressAfter(Duration delay) {
            this.autoProgressAfter = nonNegative("auto progress delay", delay);
            return this;
        }

        public Builder withRandomSeed(long seed) {
            this.randomSeed = seed;
            return this;
        }

        public Builder withValidateEachRound(boolean validate) {
            this.validateEachRound = validate;
            return this;
        }

        public GameLoopConfig build() {
            return new GameLoopConfig(this);
        }

        private static Duration nonNegative(String name, Duration value) {
            if (value == null || value.isNegative()) {
                log.warn("Invalid {} {}, disabled", name, value);
                return Duration.ZERO;
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return String.format("GameLoopConfig[maxRounds=%d, turnTimeout=%s, autoProgress=%s, seed=%d, validate=%s]",
                             maxRounds, turnTimeout, autoProgressAfter, randomSeed, validateEachRound);
    }
}
