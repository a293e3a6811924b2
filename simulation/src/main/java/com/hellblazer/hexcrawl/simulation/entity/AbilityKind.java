package com.hellblazer.hexcrawl.simulation.entity;

/**
 * @author hal.hildebrand
 */
public enum AbilityKind {
    /** Deals damage to the target */
    ATTACK,
    /** Protects the caster or an ally, usually through status effects */
    DEFENSE,
    /** Movement, buffs and other effects without direct damage or healing */
    UTILITY,
    /** Restores hit points to the target */
    HEALING
}
