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

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;

/**
 * Fractional cube coordinate operations.
 * <p>
 * Fractional coordinates are carried as vecmath tuples with x = q, y = r, z = s. All rounding goes through
 * StrictMath so line sampling is identical on every platform.
 * <p>
 * Usage:
 * <pre>
 * var mid = HexMath.lerp(HexCoordinate.ORIGIN, HexCoordinate.of(3, 0), 0.5);
 * var hex = HexMath.round(mid);
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class HexMath {

    /** Tolerance for the cube-sum check on fractional coordinates */
    public static final double EPSILON = 1e-9;

    private HexMath() {
    }

    /**
     * @return true if |q + r + s| is within {@link #EPSILON}
     */
    public static boolean isValid(double q, double r, double s) {
        return StrictMath.abs(q + r + s) < EPSILON;
    }

    public static boolean isValid(Tuple3d cube) {
        return isValid(cube.x, cube.y, cube.z);
    }

    /**
     * Round a fractional cube coordinate to the containing hex.
     * <p>
     * Each component is rounded independently, then the component with the largest rounding error is recomputed
     * from the other two so the result satisfies the cube invariant.
     *
     * @return the nearest hex
     */
    public static HexCoordinate round(double q, double r, double s) {
        var rq = roundHalfUp(q);
        var rr = roundHalfUp(r);
        var rs = roundHalfUp(s);

        var qDiff = StrictMath.abs(rq - q);
        var rDiff = StrictMath.abs(rr - r);
        var sDiff = StrictMath.abs(rs - s);

        if (qDiff > rDiff && qDiff > sDiff) {
            rq = -rr - rs;
        } else if (rDiff > sDiff) {
            rr = -rq - rs;
        } else {
            rs = -rq - rr;
        }
        return HexCoordinate.of((int) rq, (int) rr, (int) rs);
    }

    public static HexCoordinate round(Tuple3d cube) {
        return round(cube.x, cube.y, cube.z);
    }

    /**
     * Linear interpolation between two hexes in cube space.
     *
     * @param a start, returned exactly at t = 0
     * @param b end, returned exactly at t = 1
     * @param t interpolation factor
     * @return fractional cube coordinate
     */
    public static Point3d lerp(HexCoordinate a, HexCoordinate b, double t) {
        return new Point3d(lerp(a.q, b.q, t), lerp(a.r, b.r, t), lerp(a.s, b.s, t));
    }

    public static double lerp(double a, double b, double t) {
        return a + (b - a) * t;
    }

    /**
     * @return the cube coordinate as a vecmath point
     */
    public static Point3d toPoint(HexCoordinate hex) {
        return new Point3d(hex.q, hex.r, hex.s);
    }

    // Half rounds toward positive infinity
    private static double roundHalfUp(double value) {
        return StrictMath.floor(value + 0.5);
    }
}
