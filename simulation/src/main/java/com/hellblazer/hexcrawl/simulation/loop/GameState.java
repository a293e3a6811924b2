package com.hellblazer.hexcrawl.simulation.loop;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.entity.CombatEntity;
import com.hellblazer.hexcrawl.simulation.entity.Monster;
import com.hellblazer.hexcrawl.simulation.entity.Player;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The mutable aggregate of one encounter: round counter, phase, rosters, terrain, the occupied-position index and the
 * actions buffered for the current round.
 * <p>
 * Owned and mutated by {@link GameLoop} only; everything handed out is either a copy or a read-only view.
 *
 * @author hal.hildebrand
 */
public class GameState {

    private final List<Player>              players;
    private final List<Monster>             monsters;
    private final Set<HexCoordinate>        obstacles;
    private final Set<HexCoordinate>        occupied  = new HashSet<>();
    private final Map<String, PlayerAction> submitted = new LinkedHashMap<>();

    private int       round;
    private GamePhase phase = GamePhase.SETUP;
    private Winner    winner;
    private String    endReason;

    GameState(Collection<? extends Player> players, Collection<? extends Monster> monsters,
              Collection<HexCoordinate> obstacles) {
        this.players = List.copyOf(players);
        this.monsters = List.copyOf(monsters);
        this.obstacles = Set.copyOf(obstacles);
        rebuildOccupied();
    }

    public int getRound() {
        return round;
    }

    public GamePhase getPhase() {
        return phase;
    }

    public Optional<Winner> getWinner() {
        return Optional.ofNullable(winner);
    }

    public Optional<String> getEndReason() {
        return Optional.ofNullable(endReason);
    }

    public List<Player> getPlayers() {
        return players;
    }

    public List<Monster> getMonsters() {
        return monsters;
    }

    public List<Player> getLivingPlayers() {
        return players.stream().filter(Player::isAlive).toList();
    }

    public List<Monster> getLivingMonsters() {
        return monsters.stream().filter(Monster::isAlive).toList();
    }

    /**
     * @return players then monsters, in roster order
     */
    public List<CombatEntity> getAllEntities() {
        return Stream.concat(players.stream(), monsters.stream()).map(CombatEntity.class::cast).toList();
    }

    public Optional<CombatEntity> findEntity(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return getAllEntities().stream().filter(e -> e.getId().equals(id)).findFirst();
    }

    public Optional<Player> findPlayer(String id) {
        return players.stream().filter(p -> p.getId().equals(id)).findFirst();
    }

    public Set<HexCoordinate> getObstacles() {
        return obstacles;
    }

    /**
     * @return read-only view of the hexes held by living entities
     */
    public Set<HexCoordinate> getOccupied() {
        return Collections.unmodifiableSet(occupied);
    }

    public Map<String, PlayerAction> getSubmitted() {
        return Collections.unmodifiableMap(submitted);
    }

    public GameStateSnapshot snapshot() {
        return new GameStateSnapshot(round, phase, winner, endReason,
                                     players.stream().map(GameStateSnapshot.EntitySnapshot::of).toList(),
                                     monsters.stream().map(GameStateSnapshot.EntitySnapshot::of).toList(), occupied,
                                     obstacles, submitted);
    }

    /**
     * Duplicate ids, stacked entities, drift of the occupied index, HP outside [0, max] and phase/round mismatches.
     */
    public StateValidation validate() {
        var issues = new ArrayList<String>();
        var entities = getAllEntities();

        var ids = new HashSet<String>();
        for (var entity : entities) {
            if (!ids.add(entity.getId())) {
                issues.add("Duplicate entity id: " + entity.getId());
            }
        }

        var holders = new HashMap<HexCoordinate, List<String>>();
        for (var entity : entities) {
            if (entity.isAlive()) {
                holders.computeIfAbsent(entity.getPosition(), k -> new ArrayList<>()).add(entity.getId());
            }
            if (entity.getCurrentHp() < 0 || entity.getCurrentHp() > entity.getMaxHp()) {
                issues.add(String.format("Entity %s has HP %d outside [0, %d]", entity.getId(),
                                         entity.getCurrentHp(), entity.getMaxHp()));
            }
        }
        holders.forEach((hex, held) -> {
            if (held.size() > 1) {
                issues.add("Multiple entities at " + hex.toDisplayString() + ": " + String.join(", ", held));
            }
        });
        if (!holders.keySet().equals(occupied)) {
            issues.add("Occupied index does not match living entity positions");
        }

        if (phase == GamePhase.SETUP && round > 0) {
            issues.add("Round counter advanced but game still in setup");
        }
        if ((phase == GamePhase.PLAYING || phase == GamePhase.PAUSED) && round < 1) {
            issues.add("Game running without a round");
        }
        if (phase == GamePhase.ENDED && winner == null) {
            issues.add("Game ended without a winner");
        }
        return new StateValidation(issues);
    }

    void rebuildOccupied() {
        occupied.clear();
        for (var entity : getAllEntities()) {
            if (entity.isAlive()) {
                occupied.add(entity.getPosition());
            }
        }
    }

    boolean submit(PlayerAction action) {
        return submitted.putIfAbsent(action.playerId(), action) == null;
    }

    boolean clearSubmission(String playerId) {
        return submitted.remove(playerId) != null;
    }

    Optional<PlayerAction> submission(String playerId) {
        return Optional.ofNullable(submitted.get(playerId));
    }

    void clearSubmissions() {
        submitted.clear();
    }

    void setPhase(GamePhase phase) {
        this.phase = phase;
    }

    void startRounds() {
        round = 1;
    }

    void advanceRound() {
        round++;
    }

    void end(Winner winner, String reason) {
        this.phase = GamePhase.ENDED;
        this.winner = winner;
        this.endReason = reason;
    }

    /**
     * Back to setup with round 0; entities are reset by the caller.
     */
    void reset() {
        round = 0;
        phase = GamePhase.SETUP;
        winner = null;
        endReason = null;
        submitted.clear();
        rebuildOccupied();
    }
}
