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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HexLinesTest {

    @Test
    void testStraightLineAlongAxis() {
        var line = HexLines.line(HexCoordinate.ORIGIN, HexCoordinate.of(3, 0));
        assertEquals(List.of(HexCoordinate.of(0, 0), HexCoordinate.of(1, 0), HexCoordinate.of(2, 0),
                             HexCoordinate.of(3, 0)), line);
    }

    @Test
    void testLineEndpointsAndContinuity() {
        var from = HexCoordinate.of(-3, 5);
        var to = HexCoordinate.of(4, -2);
        var line = HexLines.line(from, to);

        assertEquals(from.distance(to) + 1, line.size());
        assertEquals(from, line.get(0));
        assertEquals(to, line.get(line.size() - 1));
        for (int i = 1; i < line.size(); i++) {
            assertEquals(1, line.get(i - 1).distance(line.get(i)));
        }
    }

    @Test
    void testDegenerateLine() {
        var hex = HexCoordinate.of(2, 2);
        assertEquals(List.of(hex), HexLines.line(hex, hex));
    }

    @Test
    void testLineOfSightBlockedByInteriorObstacle() {
        var from = HexCoordinate.ORIGIN;
        var to = HexCoordinate.of(3, 0);

        assertTrue(HexLines.hasLineOfSight(from, to, Set.of()));
        assertFalse(HexLines.hasLineOfSight(from, to, Set.of(HexCoordinate.of(1, 0))));
        // Obstacle off the line does not block
        assertTrue(HexLines.hasLineOfSight(from, to, Set.of(HexCoordinate.of(0, 1))));
        // Endpoints never block
        assertTrue(HexLines.hasLineOfSight(from, to, Set.of(from, to)));
    }

    @Test
    void testAdjacentHexesAlwaysSeeEachOther() {
        var from = HexCoordinate.ORIGIN;
        var to = HexCoordinate.of(1, 0);
        assertTrue(HexLines.hasLineOfSight(from, to, Set.of(from, to)));
    }

    @Test
    void testAbilityTargetRequiresRangeAndSight() {
        var caster = HexCoordinate.ORIGIN;
        var target = HexCoordinate.of(0, 3);
        var wall = Set.of(HexCoordinate.of(0, 2));

        assertTrue(HexLines.isValidAbilityTarget(caster, target, 3, Set.of()));
        assertFalse(HexLines.isValidAbilityTarget(caster, target, 2, Set.of()));
        assertFalse(HexLines.isValidAbilityTarget(caster, target, 3, wall));
    }
}
