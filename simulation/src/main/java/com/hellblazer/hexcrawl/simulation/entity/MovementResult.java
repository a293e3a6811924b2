package com.hellblazer.hexcrawl.simulation.entity;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;

/**
 * Outcome of a move request.
 *
 * @param success     whether the entity moved
 * @param position    position after the request
 * @param distance    hexes travelled, 0 on failure
 * @param reason      why the move was refused, null on success
 * @author hal.hildebrand
 */
public record MovementResult(boolean success, HexCoordinate position, int distance, String reason) {

    public static MovementResult moved(HexCoordinate position, int distance) {
        return new MovementResult(true, position, distance, null);
    }

    public static MovementResult refused(HexCoordinate position, String reason) {
        return new MovementResult(false, position, 0, reason);
    }
}
