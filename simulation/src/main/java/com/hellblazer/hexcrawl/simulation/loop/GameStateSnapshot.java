package com.hellblazer.hexcrawl.simulation.loop;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.entity.CombatEntity;
import com.hellblazer.hexcrawl.simulation.entity.EntityKind;
import com.hellblazer.hexcrawl.simulation.entity.StatusEffect;
import com.hellblazer.hexcrawl.simulation.entity.StatusEffectType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of an encounter at one point in time.
 *
 * @author hal.hildebrand
 */
public record GameStateSnapshot(int round, GamePhase phase, Winner winner, String endReason,
                                List<EntitySnapshot> players, List<EntitySnapshot> monsters,
                                Set<HexCoordinate> occupied, Set<HexCoordinate> obstacles,
                                Map<String, PlayerAction> submittedActions) {

    public GameStateSnapshot {
        players = List.copyOf(players);
        monsters = List.copyOf(monsters);
        occupied = Set.copyOf(occupied);
        obstacles = Set.copyOf(obstacles);
        submittedActions = Map.copyOf(submittedActions);
    }

    public boolean isEnded() {
        return phase == GamePhase.ENDED;
    }

    public boolean isRunning() {
        return phase == GamePhase.PLAYING;
    }

    public Optional<Winner> getWinner() {
        return Optional.ofNullable(winner);
    }

    public Optional<EntitySnapshot> entity(String id) {
        return players.stream()
                      .filter(e -> e.id().equals(id))
                      .findFirst()
                      .or(() -> monsters.stream().filter(e -> e.id().equals(id)).findFirst());
    }

    /**
     * @param statusEffects stacks of each active effect
     */
    public record EntitySnapshot(String id, String name, EntityKind kind, HexCoordinate position, int currentHp,
                                 int maxHp, boolean alive, int armor, Map<StatusEffectType, Integer> statusEffects) {

        public EntitySnapshot {
            statusEffects = Map.copyOf(statusEffects);
        }

        public static EntitySnapshot of(CombatEntity entity) {
            var effects = new EnumMap<StatusEffectType, Integer>(StatusEffectType.class);
            for (StatusEffect effect : entity.getStatusEffects().getActive()) {
                effects.put(effect.type(), effect.stacks());
            }
            return new EntitySnapshot(entity.getId(), entity.getName(), entity.getKind(), entity.getPosition(),
                                      entity.getCurrentHp(), entity.getMaxHp(), entity.isAlive(),
                                      entity.getEffectiveArmor(), effects);
        }
    }
}
