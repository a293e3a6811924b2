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
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import org.junit.jupiter.api.DisplayName;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Hex Grid Property-Based Tests")
class HexGridPropertyTest {

    private final HexPathfinder pathfinder = new HexPathfinder();

    @Property(tries = 50)
    @Label("Filled range has 1 + 3n(n+1) distinct hexes")
    void rangeCardinality(@ForAll("hexes") HexCoordinate center, @ForAll @IntRange(min = 0, max = 12) int radius) {
        var hexes = HexRanges.hexesInRange(center, radius);
        assertEquals(1 + 3 * radius * (radius + 1), new HashSet<>(hexes).size());
    }

    @Property(tries = 50)
    @Label("Ring has 6n hexes at exactly distance n")
    void ringCardinality(@ForAll("hexes") HexCoordinate center, @ForAll @IntRange(min = 1, max = 12) int radius) {
        var ring = HexRanges.ring(center, radius);
        assertEquals(6 * radius, new HashSet<>(ring).size());
        assertTrue(ring.stream().allMatch(h -> h.distance(center) == radius));
    }

    @Property
    @Label("Line of sight with no obstacles is always clear")
    void clearSightWithoutObstacles(@ForAll("hexes") HexCoordinate a, @ForAll("hexes") HexCoordinate b) {
        assertTrue(HexLines.hasLineOfSight(a, b, Set.of()));
    }

    @Property
    @Label("An interior obstacle always blocks sight")
    void interiorObstacleBlocks(@ForAll("hexes") HexCoordinate a, @ForAll("hexes") HexCoordinate b) {
        var line = HexLines.line(a, b);
        Assume.that(line.size() > 2);
        var blocker = line.get(line.size() / 2);
        assertFalse(HexLines.hasLineOfSight(a, b, Set.of(blocker)));
    }

    @Property(tries = 100)
    @Label("Open grid path length is distance + 1")
    void openPathIsShortest(@ForAll("nearHexes") HexCoordinate a, @ForAll("nearHexes") HexCoordinate b) {
        var path = pathfinder.findPath(a, b, Set.of()).orElseThrow();
        assertEquals(a.distance(b) + 1, path.size());
        assertEquals(a, path.get(0));
        assertEquals(b, path.get(path.size() - 1));
    }

    @Provide
    Arbitrary<HexCoordinate> hexes() {
        var q = Arbitraries.integers().between(-30, 30);
        var r = Arbitraries.integers().between(-30, 30);
        return Combinators.combine(q, r).as(HexCoordinate::of);
    }

    @Provide
    Arbitrary<HexCoordinate> nearHexes() {
        var q = Arbitraries.integers().between(-10, 10);
        var r = Arbitraries.integers().between(-10, 10);
        return Combinators.combine(q, r).as(HexCoordinate::of);
    }
}
