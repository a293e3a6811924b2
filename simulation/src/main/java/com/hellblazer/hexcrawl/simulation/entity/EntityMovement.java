package com.hellblazer.hexcrawl.simulation.entity;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.grid.HexRanges;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Position and per-round movement allowance of one entity.
 * <p>
 * A move succeeds when the entity has not moved this round, the destination is within movement range, neither
 * occupied nor an obstacle, and reachable within range without passing through obstacles or other entities.
 *
 * @author hal.hildebrand
 */
public class EntityMovement {

    private final int                 movementRange;
    private final List<HexCoordinate> history = new ArrayList<>();
    private HexCoordinate startingPosition;
    private HexCoordinate position;
    private boolean       movedThisRound;

    public EntityMovement(HexCoordinate startingPosition, int movementRange) {
        this.startingPosition = Objects.requireNonNull(startingPosition, "startingPosition");
        this.position = startingPosition;
        this.movementRange = movementRange;
        history.add(startingPosition);
    }

    /**
     * @param destination hex to move to
     * @param occupied    hexes held by other entities; the mover's own hex is ignored
     * @param obstacles   impassable terrain
     */
    public MovementResult moveTo(HexCoordinate destination, Set<HexCoordinate> occupied,
                                 Set<HexCoordinate> obstacles) {
        if (movedThisRound) {
            return MovementResult.refused(position, "Already moved this round");
        }
        var distance = position.distance(destination);
        if (distance > movementRange) {
            return MovementResult.refused(position, String.format("Position too far (distance: %d, max: %d)",
                                                                  distance, movementRange));
        }
        if (destination.equals(position)) {
            return MovementResult.refused(position, "Already at position");
        }
        if (occupied.contains(destination)) {
            return MovementResult.refused(position, "Position is occupied");
        }
        if (obstacles.contains(destination)) {
            return MovementResult.refused(position, "Position is blocked by obstacle");
        }
        var blocked = new HashSet<>(obstacles);
        blocked.addAll(occupied);
        blocked.remove(position);
        var steps = HexRanges.reachable(position, movementRange, blocked).get(destination);
        if (steps == null) {
            return MovementResult.refused(position, "No open path within movement range");
        }
        position = destination;
        movedThisRound = true;
        history.add(destination);
        return MovementResult.moved(destination, steps);
    }

    /**
     * @return hexes reachable this round around the given blockers, the current hex included
     */
    public Set<HexCoordinate> getReachablePositions(Set<HexCoordinate> blocked) {
        return HexRanges.reachable(position, movedThisRound ? 0 : movementRange, blocked).keySet();
    }

    public HexCoordinate getPosition() {
        return position;
    }

    /**
     * Place the entity without movement rules, used for setup.
     */
    public void place(HexCoordinate hex) {
        position = Objects.requireNonNull(hex, "hex");
        history.add(hex);
    }

    public HexCoordinate getStartingPosition() {
        return startingPosition;
    }

    public int getMovementRange() {
        return movementRange;
    }

    public boolean hasMovedThisRound() {
        return movedThisRound;
    }

    public List<HexCoordinate> getHistory() {
        return List.copyOf(history);
    }

    public void resetForNewRound() {
        movedThisRound = false;
    }

    /**
     * Return to the starting position, or adopt a new one.
     */
    public void resetForEncounter(HexCoordinate newStart) {
        if (newStart != null) {
            startingPosition = newStart;
        }
        position = startingPosition;
        movedThisRound = false;
        history.clear();
        history.add(startingPosition);
    }
}
