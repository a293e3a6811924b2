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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * A* search over the unbounded hex grid.
 * <p>
 * Edges have unit cost and the heuristic is hex distance, which is consistent, so every path returned is a shortest
 * path around the given obstacles. The search is bounded three ways:
 * - start and goal further apart than {@code maxSearchDistance} are rejected up front
 * - at most {@code maxIterations} nodes are expanded
 * - path reconstruction stops at {@code maxPathLength} hexes or on a repeated hex
 * <p>
 * Every bound that trips yields {@link Optional#empty()}. Ties in the open set are broken by lower heuristic, then by
 * insertion order, so results are reproducible.
 * <p>
 * Usage:
 * <pre>
 * var pathfinder = new HexPathfinder();
 * pathfinder.findPath(start, goal, obstacles).ifPresent(path -> ...);
 * </pre>
 *
 * @author hal.hildebrand
 */
public class HexPathfinder {
    private static final Logger log = LoggerFactory.getLogger(HexPathfinder.class);

    /** Default limit on the straight-line distance between start and goal */
    public static final int MAX_SEARCH_DISTANCE = 50;

    /** Default limit on node expansions */
    public static final int MAX_ITERATIONS = 1000;

    /** Default limit on reconstructed path length */
    public static final int MAX_PATH_LENGTH = 1000;

    private final int maxSearchDistance;
    private final int maxIterations;
    private final int maxPathLength;

    public HexPathfinder() {
        this(MAX_SEARCH_DISTANCE, MAX_ITERATIONS, MAX_PATH_LENGTH);
    }

    /**
     * @throws IllegalArgumentException if any bound is not positive
     */
    public HexPathfinder(int maxSearchDistance, int maxIterations, int maxPathLength) {
        if (maxSearchDistance <= 0 || maxIterations <= 0 || maxPathLength <= 0) {
            throw new IllegalArgumentException(
            String.format("Pathfinder bounds must be positive: distance=%d, iterations=%d, length=%d",
                          maxSearchDistance, maxIterations, maxPathLength));
        }
        this.maxSearchDistance = maxSearchDistance;
        this.maxIterations = maxIterations;
        this.maxPathLength = maxPathLength;
    }

    /**
     * Shortest path from start to goal.
     *
     * @param start     first hex of the path
     * @param goal      last hex of the path
     * @param obstacles impassable hexes; the start is never treated as blocked
     * @return the path including both endpoints, or empty when the goal is blocked, too far, unreachable within the
     * iteration budget, or the predecessor chain is corrupt
     */
    public Optional<List<HexCoordinate>> findPath(HexCoordinate start, HexCoordinate goal,
                                                  Set<HexCoordinate> obstacles) {
        if (start.distance(goal) > maxSearchDistance) {
            log.debug("Path {} -> {} exceeds search distance {}", start, goal, maxSearchDistance);
            return Optional.empty();
        }
        if (obstacles.contains(goal)) {
            return Optional.empty();
        }

        var open = new PriorityQueue<Node>(
        Comparator.comparingInt(Node::f).thenComparingInt(Node::h).thenComparingLong(Node::sequence));
        var closed = new HashSet<HexCoordinate>();
        var cameFrom = new HashMap<HexCoordinate, HexCoordinate>();
        var gScore = new HashMap<HexCoordinate, Integer>();

        long sequence = 0;
        gScore.put(start, 0);
        open.add(new Node(start, 0, start.distance(goal), sequence++));

        int iterations = 0;
        while (!open.isEmpty() && iterations < maxIterations) {
            var node = open.poll();
            var current = node.hex();
            if (closed.contains(current) || node.g() > gScore.get(current)) {
                continue;
            }
            iterations++;

            if (current.equals(goal)) {
                return reconstructPath(cameFrom, start, current);
            }
            closed.add(current);

            for (var neighbor : current.neighbors()) {
                if (closed.contains(neighbor) || obstacles.contains(neighbor)) {
                    continue;
                }
                var tentative = node.g() + 1;
                var known = gScore.get(neighbor);
                if (known == null || tentative < known) {
                    cameFrom.put(neighbor, current);
                    gScore.put(neighbor, tentative);
                    var h = neighbor.distance(goal);
                    open.add(new Node(neighbor, tentative, h, sequence++));
                }
            }
        }
        log.debug("No path {} -> {} after {} iterations", start, goal, iterations);
        return Optional.empty();
    }

    /**
     * Walk a predecessor map back from {@code end} to {@code start}.
     *
     * @param cameFrom hex to its predecessor
     * @param start    expected first hex
     * @param end      last hex
     * @return the path from start to end, or empty if the chain loops, exceeds the length cap, or does not lead back
     * to start
     */
    public Optional<List<HexCoordinate>> reconstructPath(Map<HexCoordinate, HexCoordinate> cameFrom,
                                                         HexCoordinate start, HexCoordinate end) {
        var path = new ArrayList<HexCoordinate>();
        var visited = new HashSet<HexCoordinate>();
        var current = end;
        path.add(current);
        visited.add(current);
        while (cameFrom.containsKey(current)) {
            current = cameFrom.get(current);
            if (!visited.add(current)) {
                log.warn("Cycle detected at {} while reconstructing path to {}", current, end);
                return Optional.empty();
            }
            path.add(current);
            if (path.size() > maxPathLength) {
                log.warn("Path to {} exceeded maximum length {}", end, maxPathLength);
                return Optional.empty();
            }
        }
        if (!current.equals(start)) {
            log.warn("Predecessor chain for {} ends at {} instead of {}", end, current, start);
            return Optional.empty();
        }
        Collections.reverse(path);
        return Optional.of(Collections.unmodifiableList(path));
    }

    public int getMaxSearchDistance() {
        return maxSearchDistance;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getMaxPathLength() {
        return maxPathLength;
    }

    private record Node(HexCoordinate hex, int g, int h, long sequence) {
        int f() {
            return g + h;
        }
    }
}
