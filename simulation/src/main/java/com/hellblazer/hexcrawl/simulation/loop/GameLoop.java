package com.hellblazer.hexcrawl.simulation.loop;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.simulation.ai.AIDecision;
import com.hellblazer.hexcrawl.simulation.ai.DecisionContext;
import com.hellblazer.hexcrawl.simulation.config.GameLoopConfig;
import com.hellblazer.hexcrawl.simulation.entity.CombatEntity;
import com.hellblazer.hexcrawl.simulation.entity.Monster;
import com.hellblazer.hexcrawl.simulation.entity.Player;
import com.hellblazer.hexcrawl.simulation.entity.RoundUpkeep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Round state machine of one encounter.
 * <p>
 * Lifecycle {@code SETUP -> PLAYING <-> PAUSED -> ENDED}. Players submit one action each per round; {@link
 * #processRound()} then lets every living monster decide, resolves players in roster order followed by monsters in
 * roster order, runs end of round upkeep and checks the win conditions:
 * <ol>
 * <li>both sides dead - draw</li>
 * <li>all monsters dead - players win</li>
 * <li>all players dead - monsters win</li>
 * <li>the next round would exceed the round limit - draw</li>
 * </ol>
 *
 * <pre>
 * var loop = new GameLoop(players, monsters, GameLoopConfig.defaultConfig());
 * loop.startGame();
 * loop.submitPlayerAction(PlayerAction.attack("hero", "goblin_1"));
 * var result = loop.processRound();
 * </pre>
 * <p>
 * Not thread safe; callers serialize access.
 *
 * @author hal.hildebrand
 */
public class GameLoop {
    private static final Logger log = LoggerFactory.getLogger(GameLoop.class);

    private final GameLoopConfig    config;
    private final GameState         state;
    private final List<RoundResult> roundHistory = new ArrayList<>();
    private       Random            random;
    private       ActionResolver    resolver;

    public GameLoop(Collection<? extends Player> players, Collection<? extends Monster> monsters) {
        this(players, monsters, GameLoopConfig.defaultConfig());
    }

    public GameLoop(Collection<? extends Player> players, Collection<? extends Monster> monsters,
                    GameLoopConfig config) {
        this(players, monsters, config, Set.of());
    }

    /**
     * @param obstacles impassable, sight-blocking terrain
     */
    public GameLoop(Collection<? extends Player> players, Collection<? extends Monster> monsters,
                    GameLoopConfig config, Collection<HexCoordinate> obstacles) {
        this.config = config == null ? GameLoopConfig.defaultConfig() : config;
        this.state = new GameState(players, monsters, obstacles);
        this.random = new Random(this.config.getRandomSeed());
        this.resolver = new ActionResolver(state, random);
        checkInitialSides();
    }

    /**
     * SETUP to PLAYING at round 1. Ignored in any other phase.
     */
    public void startGame() {
        if (state.getPhase() != GamePhase.SETUP) {
            log.debug("Start ignored in phase {}", state.getPhase());
            return;
        }
        state.setPhase(GamePhase.PLAYING);
        state.startRounds();
        log.info("Encounter started: {} players vs {} monsters, {}", state.getPlayers().size(),
                 state.getMonsters().size(), config);
    }

    /**
     * Suspend round processing; buffered actions are kept.
     */
    public void pause() {
        if (state.getPhase() == GamePhase.PLAYING) {
            state.setPhase(GamePhase.PAUSED);
            log.info("Encounter paused at round {}", state.getRound());
        }
    }

    public void resume() {
        if (state.getPhase() == GamePhase.PAUSED) {
            state.setPhase(GamePhase.PLAYING);
            log.info("Encounter resumed at round {}", state.getRound());
        }
    }

    /**
     * End the encounter as a draw. Later rounds are no-ops and submissions are rejected.
     */
    public void stop() {
        if (state.getPhase() != GamePhase.ENDED) {
            end(Winner.DRAW, "Game stopped");
        }
    }

    /**
     * Buffer a player's action for the current round. The first submission of a round wins unless it is cleared.
     */
    public SubmissionResult submitPlayerAction(PlayerAction action) {
        if (state.getPhase() != GamePhase.PLAYING) {
            return SubmissionResult.rejected("Game is not running");
        }
        if (action == null || action.playerId() == null) {
            return SubmissionResult.rejected("Action requires a player id");
        }
        var player = state.findPlayer(action.playerId());
        if (player.isEmpty()) {
            return SubmissionResult.rejected("Player " + action.playerId() + " not found");
        }
        if (!player.get().isAlive()) {
            return SubmissionResult.rejected("Player " + action.playerId() + " is dead");
        }
        if (action.kind() == null) {
            return SubmissionResult.rejected("Action requires a kind");
        }
        var missing = switch (action.kind()) {
            case MOVE -> action.destination() == null ? "Move action requires a destination" : null;
            case ATTACK -> action.targetId() == null ? "Attack action requires a target id" : null;
            case ABILITY -> action.abilityId() == null ? "Ability action requires an ability id" : null;
            case WAIT -> null;
        };
        if (missing != null) {
            return SubmissionResult.rejected(missing);
        }
        if (!state.submit(action)) {
            return SubmissionResult.rejected("Action already submitted this round");
        }
        log.debug("{} submitted {}", action.playerId(), action.kind());
        return SubmissionResult.accepted();
    }

    /**
     * @return true if a buffered action was removed
     */
    public boolean clearPlayerAction(String playerId) {
        return state.clearSubmission(playerId);
    }

    /**
     * Resolve the current round. Returns an empty result, leaving the round unchanged, unless the game is PLAYING.
     */
    public RoundResult processRound() {
        if (state.getPhase() != GamePhase.PLAYING) {
            return RoundResult.empty(state.getRound());
        }
        var round = state.getRound();
        log.debug("Processing round {}", round);

        var livingPlayerIds = state.getLivingPlayers().stream().map(Player::getId).collect(Collectors.toSet());
        for (var monster : state.getMonsters()) {
            monster.getThreatManager().retainTargets(livingPlayerIds);
        }

        var decisions = decide(round);
        var actions = new ArrayList<ActionResult>();
        for (var player : state.getPlayers()) {
            if (player.isAlive()) {
                var action = state.submission(player.getId()).orElseGet(() -> PlayerAction.waitTurn(player.getId()));
                actions.add(resolver.resolve(player, action));
            }
        }
        for (var monster : state.getMonsters()) {
            var decision = decisions.get(monster.getId());
            if (decision != null && monster.isAlive()) {
                actions.add(resolver.resolve(monster, decision));
            }
        }

        var upkeep = new ArrayList<RoundUpkeep>();
        for (var entity : state.getAllEntities()) {
            if (entity.isAlive()) {
                upkeep.add(upkeep(entity));
            }
        }
        state.rebuildOccupied();

        if (config.isValidateEachRound()) {
            var validation = state.validate();
            if (!validation.valid()) {
                log.warn("Round {} left inconsistent state: {}", round, validation.issues());
            }
        }

        var ending = checkEnd(round);
        state.clearSubmissions();
        state.advanceRound();
        ending.ifPresent(e -> end(e.winner(), e.reason()));

        var result = new RoundResult(round, actions, upkeep, ending.isPresent(),
                                     ending.map(Ending::winner).orElse(null),
                                     ending.map(Ending::reason).orElse(null));
        roundHistory.add(result);
        return result;
    }

    /**
     * Back to SETUP at round 0 with every entity healed, cleared and returned to its starting position.
     */
    public void resetForNewEncounter() {
        for (var player : state.getPlayers()) {
            player.resetForEncounter(null);
        }
        for (var monster : state.getMonsters()) {
            monster.resetForEncounter(null);
        }
        state.reset();
        roundHistory.clear();
        random = new Random(config.getRandomSeed());
        resolver = new ActionResolver(state, random);
        log.info("Encounter reset");
        checkInitialSides();
    }

    public StateValidation validateState() {
        return state.validate();
    }

    public int getCurrentRound() {
        return state.getRound();
    }

    public GamePhase getPhase() {
        return state.getPhase();
    }

    public boolean isGameEnded() {
        return state.getPhase() == GamePhase.ENDED;
    }

    public Optional<Winner> getWinner() {
        return state.getWinner();
    }

    public List<Player> getAlivePlayers() {
        return new ArrayList<>(state.getLivingPlayers());
    }

    public List<Monster> getAliveMonsters() {
        return new ArrayList<>(state.getLivingMonsters());
    }

    /**
     * @return players then monsters, dead ones included
     */
    public List<CombatEntity> getAllEntities() {
        return new ArrayList<>(state.getAllEntities());
    }

    public Optional<CombatEntity> getEntityById(String id) {
        return state.findEntity(id);
    }

    public GameStateSnapshot getGameState() {
        return state.snapshot();
    }

    public List<RoundResult> getRoundHistory() {
        return List.copyOf(roundHistory);
    }

    public Map<String, PlayerAction> getSubmittedActions() {
        return new LinkedHashMap<>(state.getSubmitted());
    }

    public GameLoopConfig getConfig() {
        return config;
    }

    private Map<String, AIDecision> decide(int round) {
        var decisions = new LinkedHashMap<String, AIDecision>();
        List<CombatEntity> enemies = new ArrayList<>(state.getPlayers());
        for (var monster : state.getLivingMonsters()) {
            List<CombatEntity> allies = state.getMonsters()
                                             .stream()
                                             .filter(m -> m != monster)
                                             .map(CombatEntity.class::cast)
                                             .toList();
            var context = new DecisionContext(allies, enemies, state.getObstacles(), state.getOccupied(), round);
            try {
                decisions.put(monster.getId(), monster.decide(context));
            } catch (RuntimeException e) {
                log.warn("Decision of {} failed, waiting instead", monster.getId(), e);
                decisions.put(monster.getId(), AIDecision.idle("Decision failed"));
            }
        }
        return decisions;
    }

    private RoundUpkeep upkeep(CombatEntity entity) {
        try {
            var upkeep = entity.processRound();
            if (upkeep.died()) {
                log.debug("{} died to effects over time", entity.getId());
            }
            return upkeep;
        } catch (RuntimeException e) {
            log.warn("Round upkeep of {} failed", entity.getId(), e);
            return RoundUpkeep.failed(entity.getId());
        }
    }

    private Optional<Ending> checkEnd(int round) {
        var playersAlive = !state.getLivingPlayers().isEmpty();
        var monstersAlive = !state.getLivingMonsters().isEmpty();
        if (!playersAlive && !monstersAlive) {
            return Optional.of(new Ending(Winner.DRAW, "Both sides defeated"));
        }
        if (!monstersAlive) {
            return Optional.of(new Ending(Winner.PLAYERS, "All monsters defeated"));
        }
        if (!playersAlive) {
            return Optional.of(new Ending(Winner.MONSTERS, "All players defeated"));
        }
        if (config.isRoundLimitEnabled() && round + 1 > config.getMaxRounds()) {
            return Optional.of(new Ending(Winner.DRAW, "Maximum rounds reached (" + config.getMaxRounds() + ")"));
        }
        return Optional.empty();
    }

    private void checkInitialSides() {
        var playersAlive = !state.getLivingPlayers().isEmpty();
        var monstersAlive = !state.getLivingMonsters().isEmpty();
        if (!playersAlive && !monstersAlive) {
            end(Winner.DRAW, "No combatants");
        } else if (!monstersAlive) {
            end(Winner.PLAYERS, "No monsters to fight");
        } else if (!playersAlive) {
            end(Winner.MONSTERS, "No players to fight");
        }
    }

    private void end(Winner winner, String reason) {
        state.end(winner, reason);
        log.info("Encounter ended at round {}: {} ({})", state.getRound(), winner, reason);
    }

    private record Ending(Winner winner, String reason) {
    }
}
