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
import com.hellblazer.hexcrawl.geometry.HexMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Straight lines and line of sight between hexes.
 * <p>
 * A line from a to b samples the cube-space segment at distance(a, b) + 1 evenly spaced points and rounds each to
 * the nearest hex. Line of sight is blocked only by obstacles on interior samples; the endpoints never block, and
 * adjacent hexes always see each other.
 *
 * @author hal.hildebrand
 */
public final class HexLines {

    private HexLines() {
    }

    /**
     * @return distance(from, to) + 1 hexes, first is {@code from}, last is {@code to}
     */
    public static List<HexCoordinate> line(HexCoordinate from, HexCoordinate to) {
        var distance = from.distance(to);
        var result = new ArrayList<HexCoordinate>(distance + 1);
        for (int i = 0; i <= distance; i++) {
            var t = distance == 0 ? 0.0 : (double) i / distance;
            result.add(HexMath.round(HexMath.lerp(from, to, t)));
        }
        return result;
    }

    /**
     * @param obstacles hexes that block sight
     * @return true if no interior hex of {@link #line} is an obstacle
     */
    public static boolean hasLineOfSight(HexCoordinate from, HexCoordinate to, Set<HexCoordinate> obstacles) {
        if (from.distance(to) <= 1) {
            return true;
        }
        var line = line(from, to);
        for (int i = 1; i < line.size() - 1; i++) {
            if (obstacles.contains(line.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Range and sight check for a targeted ability.
     *
     * @return true if the target is within {@code range} and visible from the caster
     */
    public static boolean isValidAbilityTarget(HexCoordinate caster, HexCoordinate target, int range,
                                               Set<HexCoordinate> obstacles) {
        return caster.distance(target) <= range && hasLineOfSight(caster, target, obstacles);
    }
}
