package com.hellblazer.hexcrawl.simulation.ai;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.entity.CombatEntity;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Everything a monster can see when deciding.
 *
 * @param allies    other monsters, the deciding monster excluded
 * @param enemies   players
 * @param obstacles impassable, sight-blocking terrain
 * @param occupied  hexes held by living entities, the deciding monster included
 * @param round     current round number
 * @author hal.hildebrand
 */
public record DecisionContext(List<CombatEntity> allies, List<CombatEntity> enemies, Set<HexCoordinate> obstacles,
                              Set<HexCoordinate> occupied, int round) {

    public DecisionContext {
        allies = List.copyOf(allies);
        enemies = List.copyOf(enemies);
        obstacles = Set.copyOf(obstacles);
        occupied = Set.copyOf(occupied);
    }

    /**
     * @return living enemies that can be targeted, in roster order
     */
    public List<CombatEntity> targetableEnemies() {
        return enemies.stream().filter(CombatEntity::canBeTargeted).toList();
    }

    public List<CombatEntity> livingAllies() {
        return allies.stream().filter(CombatEntity::isAlive).toList();
    }

    /**
     * @return obstacles plus every occupied hex except the given ones
     */
    public Set<HexCoordinate> blockedExcept(HexCoordinate... passable) {
        var blocked = new HashSet<>(obstacles);
        blocked.addAll(occupied);
        for (var hex : passable) {
            blocked.remove(hex);
        }
        return blocked;
    }
}
