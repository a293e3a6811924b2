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
package com.hellblazer.hexcrawl.geometry;

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;

import static org.junit.jupiter.api.Assertions.*;

class HexMathTest {

    @Test
    void testIsValid() {
        assertTrue(HexMath.isValid(1.5, -0.5, -1.0));
        assertTrue(HexMath.isValid(new Point3d(0.1, 0.2, -0.3)));
        assertFalse(HexMath.isValid(1.0, 1.0, 1.0));
        assertFalse(HexMath.isValid(0.0, 0.0, 1e-6));
    }

    @Test
    void testRoundRecomputesLargestError() {
        // q has the largest error (0.4) so it is recomputed from r and s
        assertEquals(HexCoordinate.of(2, 1, -3), HexMath.round(1.4, 1.3, -2.7));

        // r has the largest error
        assertEquals(HexCoordinate.of(1, -1, 0), HexMath.round(0.6, -0.45, -0.15));

        // Ties fall through to recomputing s
        assertEquals(HexCoordinate.of(1, 0, -1), HexMath.round(1.0, -0.5, -0.5));
    }

    @Test
    void testLerpEndpoints() {
        var a = HexCoordinate.of(-2, 1);
        var b = HexCoordinate.of(4, -3);
        assertEquals(a, HexMath.round(HexMath.lerp(a, b, 0.0)));
        assertEquals(b, HexMath.round(HexMath.lerp(a, b, 1.0)));

        var mid = HexMath.lerp(a, b, 0.5);
        assertEquals(1.0, mid.x, 1e-12);
        assertEquals(-1.0, mid.y, 1e-12);
        assertEquals(0.0, mid.z, 1e-12);
        assertTrue(HexMath.isValid(mid));
    }
}
