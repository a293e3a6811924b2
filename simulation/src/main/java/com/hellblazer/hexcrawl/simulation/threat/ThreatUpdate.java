package com.hellblazer.hexcrawl.simulation.threat;

import java.util.Objects;

/**
 * One threat-producing event attributed to a player.
 *
 * @param targetId         the player that caused the event
 * @param damageToMonster  damage the player dealt to the monster that owns the table
 * @param totalDamageDealt damage dealt across all targets by the event
 * @param healingDone      healing (or support value) produced by the event
 * @param playerArmor      the player's effective armor when the event happened
 * @param source           label such as "attack" or "ability:fireball"
 * @author hal.hildebrand
 */
public record ThreatUpdate(String targetId, double damageToMonster, double totalDamageDealt, double healingDone,
                           double playerArmor, String source) {

    public ThreatUpdate {
        Objects.requireNonNull(targetId, "targetId");
        source = source == null ? "unknown" : source;
    }

    /**
     * Raw threat this event produces under the given multipliers.
     * <p>
     * armor x damageToMonster x armorMultiplier + totalDamageDealt x damageMultiplier + healingDone x
     * healingMultiplier
     */
    public double rawThreat(ThreatConfig config) {
        return playerArmor * damageToMonster * config.getArmorMultiplier()
               + totalDamageDealt * config.getDamageMultiplier() + healingDone * config.getHealingMultiplier();
    }
}
