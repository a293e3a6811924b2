package com.hellblazer.hexcrawl.simulation.entity;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;

import java.util.Objects;

/**
 * A player-controlled combatant.
 *
 * @author hal.hildebrand
 */
public class Player extends AbstractCombatEntity {

    private final PlayerSpecialization specialization;

    public Player(String id, String name, PlayerSpecialization specialization, HexCoordinate position) {
        super(id, name, EntityKind.PLAYER, Objects.requireNonNull(specialization, "specialization").stats(),
              specialization.abilities(), position);
        this.specialization = specialization;
    }

    public PlayerSpecialization getSpecialization() {
        return specialization;
    }
}
