package com.hellblazer.hexcrawl.simulation.threat;

/**
 * Tuning for a monster's threat table and target selection.
 *
 * @author hal.hildebrand
 */
public class ThreatConfig {

    private final boolean enabled;
    private final double decayRate;
    private final double healingMultiplier;
    private final double damageMultiplier;
    private final double armorMultiplier;
    private final int avoidLastTargetRounds;
    private final boolean fallbackToLowestHp;
    private final boolean enableTiebreaker;

    private ThreatConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.decayRate = builder.decayRate;
        this.healingMultiplier = builder.healingMultiplier;
        this.damageMultiplier = builder.damageMultiplier;
        this.armorMultiplier = builder.armorMultiplier;
        this.avoidLastTargetRounds = builder.avoidLastTargetRounds;
        this.fallbackToLowestHp = builder.fallbackToLowestHp;
        this.enableTiebreaker = builder.enableTiebreaker;
    }

    /**
     * @return false if the table ignores updates and selection never picks a target
     */
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return fraction of every score removed at the end of each round
     */
    public double getDecayRate() {
        return decayRate;
    }

    public double getHealingMultiplier() {
        return healingMultiplier;
    }

    public double getDamageMultiplier() {
        return damageMultiplier;
    }

    /**
     * @return weight of (player armor x damage to this monster), which makes tanky attackers sticky
     */
    public double getArmorMultiplier() {
        return armorMultiplier;
    }

    /**
     * @return number of rounds a selected target is skipped for when alternatives exist, 0 disables
     */
    public int getAvoidLastTargetRounds() {
        return avoidLastTargetRounds;
    }

    public boolean isFallbackToLowestHp() {
        return fallbackToLowestHp;
    }

    public boolean isEnableTiebreaker() {
        return enableTiebreaker;
    }

    public Builder toBuilder() {
        return builder().withEnabled(enabled)
                        .withDecayRate(decayRate)
                        .withHealingMultiplier(healingMultiplier)
                        .withDamageMultiplier(damageMultiplier)
                        .withArmorMultiplier(armorMultiplier)
                        .withAvoidLastTargetRounds(avoidLastTargetRounds)
                        .withFallbackToLowestHp(fallbackToLowestHp)
                        .withTiebreaker(enableTiebreaker);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Enabled, 10% decay, healing x1.5, damage x1.0, armor x0.5, avoid last target for 1 round, lowest HP fallback
     * and tie breaking on.
     */
    public static ThreatConfig defaultConfig() {
        return builder().build();
    }

    public static class Builder {
        private boolean enabled = true;
        private double decayRate = 0.1;
        private double healingMultiplier = 1.5;
        private double damageMultiplier = 1.0;
        private double armorMultiplier = 0.5;
        private int avoidLastTargetRounds = 1;
        private boolean fallbackToLowestHp = true;
        private boolean enableTiebreaker = true;

        private Builder() {
        }

        public Builder withEnabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * @throws IllegalArgumentException if rate is outside [0, 1]
         */
        public Builder withDecayRate(double rate) {
            if (!(rate >= 0.0 && rate <= 1.0)) {
                throw new IllegalArgumentException("Decay rate must be within [0, 1]: " + rate);
            }
            this.decayRate = rate;
            return this;
        }

        /**
         * @throws IllegalArgumentException if multiplier is negative
         */
        public Builder withHealingMultiplier(double multiplier) {
            this.healingMultiplier = requireMultiplier("Healing", multiplier);
            return this;
        }

        /**
         * @throws IllegalArgumentException if multiplier is negative
         */
        public Builder withDamageMultiplier(double multiplier) {
            this.damageMultiplier = requireMultiplier("Damage", multiplier);
            return this;
        }

        /**
         * @throws IllegalArgumentException if multiplier is negative
         */
        public Builder withArmorMultiplier(double multiplier) {
            this.armorMultiplier = requireMultiplier("Armor", multiplier);
            return this;
        }

        /**
         * @throws IllegalArgumentException if rounds is negative
         */
        public Builder withAvoidLastTargetRounds(int rounds) {
            if (rounds < 0) {
                throw new IllegalArgumentException("Avoid last target rounds must be non-negative: " + rounds);
            }
            this.avoidLastTargetRounds = rounds;
            return this;
        }

        public Builder withFallbackToLowestHp(boolean fallback) {
            this.fallbackToLowestHp = fallback;
            return this;
        }

        public Builder withTiebreaker(boolean tiebreaker) {
            this.enableTiebreaker = tiebreaker;
            return this;
        }

        public ThreatConfig build() {
            return new ThreatConfig(this);
        }

        private static double requireMultiplier(String name, double multiplier) {
            if (!(multiplier >= 0.0) || Double.isInfinite(multiplier)) {
                throw new IllegalArgumentException(name + " multiplier must be a non-negative number: " + multiplier);
            }
            return multiplier;
        }
    }

    @Override
    public String toString() {
        return String.format(
        "ThreatConfig[enabled=%s, decay=%.2f, healing=%.2f, damage=%.2f, armor=%.2f, avoidRounds=%d, lowestHp=%s, tiebreaker=%s]",
        enabled, decayRate, healingMultiplier, damageMultiplier, armorMultiplier, avoidLastTargetRounds,
        fallbackToLowestHp, enableTiebreaker);
    }
}
