/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Hexcrawl.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.hexcrawl.grid;

import com.hellblazer.hexcrawl.geometry.HexCoordinate;
import com.hellblazer.hexcrawl.geometry.HexDirection;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Area enumeration on the hex grid: filled ranges, rings, bounded reachability and tactical positions.
 * <p>
 * All enumerations are deterministic. Filled ranges are ordered by q then r, rings are ordered along the walk
 * starting west of the center, and reachability is ordered breadth first using the canonical neighbor order.
 *
 * @author hal.hildebrand
 */
public final class HexRanges {

    /** Maximum distance to the target for an aggressive position */
    public static final int AGGRESSIVE_DISTANCE = 2;

    /** Minimum distance to the target for a defensive position */
    public static final int DEFENSIVE_DISTANCE = 3;

    private HexRanges() {
    }

    /**
     * Every hex within {@code radius} steps of {@code center}, the center included.
     *
     * @param center the center
     * @param radius non-negative radius
     * @return 1 + 3 * radius * (radius + 1) distinct hexes
     * @throws IllegalArgumentException if radius is negative
     */
    public static List<HexCoordinate> hexesInRange(HexCoordinate center, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Range cannot be negative: " + radius);
        }
        var result = new ArrayList<HexCoordinate>(1 + 3 * radius * (radius + 1));
        for (int dq = -radius; dq <= radius; dq++) {
            var minR = Math.max(-radius, -dq - radius);
            var maxR = Math.min(radius, -dq + radius);
            for (int dr = minR; dr <= maxR; dr++) {
                result.add(HexCoordinate.of(center.q + dq, center.r + dr));
            }
        }
        return result;
    }

    /**
     * Every hex at exactly {@code radius} steps from {@code center}.
     *
     * @param center the center
     * @param radius non-negative radius
     * @return 6 * radius hexes, or just the center for radius 0
     * @throws IllegalArgumentException if radius is negative
     */
    public static List<HexCoordinate> ring(HexCoordinate center, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Ring radius cannot be negative: " + radius);
        }
        if (radius == 0) {
            return List.of(center);
        }
        var result = new ArrayList<HexCoordinate>(6 * radius);
        var current = center.move(HexDirection.WEST, radius);
        for (var direction : HexDirection.values()) {
            for (int step = 0; step < radius; step++) {
                result.add(current);
                current = current.neighbor(direction);
            }
        }
        return result;
    }

    public static boolean isInRing(HexCoordinate hex, HexCoordinate center, int radius) {
        return hex.distance(center) == radius;
    }

    public static boolean isInRange(HexCoordinate hex, HexCoordinate center, int radius) {
        return hex.distance(center) <= radius;
    }

    /**
     * Hexes reachable from {@code start} in at most {@code maxSteps} unit moves without entering a blocked hex.
     * <p>
     * The start itself is always included at step 0 even if it appears in {@code blocked}.
     *
     * @param start    origin of the walk
     * @param maxSteps movement budget, negative treated as zero
     * @param blocked  impassable hexes
     * @return hex to minimal step count, in breadth first order
     */
    public static Map<HexCoordinate, Integer> reachable(HexCoordinate start, int maxSteps,
                                                        Set<HexCoordinate> blocked) {
        var steps = new LinkedHashMap<HexCoordinate, Integer>();
        steps.put(start, 0);
        var frontier = new ArrayDeque<HexCoordinate>();
        frontier.add(start);
        while (!frontier.isEmpty()) {
            var current = frontier.poll();
            var depth = steps.get(current);
            if (depth >= maxSteps) {
                continue;
            }
            for (var neighbor : current.neighbors()) {
                if (steps.containsKey(neighbor) || blocked.contains(neighbor)) {
                    continue;
                }
                steps.put(neighbor, depth + 1);
                frontier.add(neighbor);
            }
        }
        return Collections.unmodifiableMap(steps);
    }

    /**
     * Partition the hexes within movement range of {@code current} by their distance to {@code target}.
     *
     * @param current       mover position
     * @param target        hex being approached or avoided
     * @param movementRange non-negative movement range
     * @return aggressive (distance to target at most 2, ascending) and defensive (at least 3, descending)
     */
    public static TacticalPositions tacticalPositions(HexCoordinate current, HexCoordinate target,
                                                      int movementRange) {
        var candidates = hexesInRange(current, movementRange);
        Comparator<HexCoordinate> byDistance = Comparator.comparingInt(hex -> hex.distance(target));

        var aggressive = candidates.stream()
                                   .filter(hex -> hex.distance(target) <= AGGRESSIVE_DISTANCE)
                                   .sorted(byDistance)
                                   .toList();
        var defensive = candidates.stream()
                                  .filter(hex -> hex.distance(target) >= DEFENSIVE_DISTANCE)
                                  .sorted(byDistance.reversed())
                                  .toList();
        return new TacticalPositions(aggressive, defensive);
    }
}
