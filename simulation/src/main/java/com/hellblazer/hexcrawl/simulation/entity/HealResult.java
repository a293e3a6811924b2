package com.hellblazer.hexcrawl.simulation.entity;

/**
 * @param healed hit points actually restored
 * @param newHp  hit points after healing
 * @author hal.hildebrand
 */
public record HealResult(int healed, int newHp) {
}
