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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable cube coordinate on a hexagonal grid.
 * <p>
 * The three axes always satisfy q + r + s = 0. The two-argument factory derives s, so the invariant holds by
 * construction; the three-argument factory is the boundary for untrusted input and rejects any triple that violates
 * it. Equality is structural and instances are safe to use directly as hash keys.
 * <p>
 * Usage:
 * <pre>
 * var a = HexCoordinate.of(0, 0);
 * var b = HexCoordinate.of(2, -1);
 * int steps = a.distance(b);           // 2
 * var east = a.neighbor(HexDirection.EAST);
 * var same = HexCoordinate.fromKey(b.key());
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class HexCoordinate {

    /** The grid origin (0, 0, 0) */
    public static final HexCoordinate ORIGIN = new HexCoordinate(0, 0, 0);

    /** Axial q */
    public final int q;

    /** Axial r */
    public final int r;

    /** Derived s, always -q - r */
    public final int s;

    private HexCoordinate(int q, int r, int s) {
        this.q = q;
        this.r = r;
        this.s = s;
    }

    /**
     * Create a coordinate from its two axial components.
     *
     * @param q q component
     * @param r r component
     * @return coordinate with s = -q - r
     */
    public static HexCoordinate of(int q, int r) {
        return new HexCoordinate(q, r, -q - r);
    }

    /**
     * Create a coordinate from all three cube components.
     *
     * @param q q component
     * @param r r component
     * @param s s component
     * @return the coordinate
     * @throws IllegalArgumentException if q + r + s != 0
     */
    public static HexCoordinate of(int q, int r, int s) {
        if (q + r + s != 0) {
            throw new IllegalArgumentException(
            String.format("Cube coordinate (%d, %d, %d) violates q + r + s = 0", q, r, s));
        }
        return new HexCoordinate(q, r, s);
    }

    /**
     * Parse the canonical key produced by {@link #key()}.
     *
     * @param key "q,r,s"
     * @return the coordinate
     * @throws IllegalArgumentException if the key is malformed or violates the cube invariant
     */
    public static HexCoordinate fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Coordinate key cannot be null");
        }
        var parts = key.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed coordinate key: " + key);
        }
        try {
            return of(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                      Integer.parseInt(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed coordinate key: " + key, e);
        }
    }

    /**
     * Number of steps between two coordinates.
     *
     * @return max(|dq|, |dr|, |ds|)
     */
    public static int distance(HexCoordinate a, HexCoordinate b) {
        return Math.max(Math.abs(a.q - b.q), Math.max(Math.abs(a.r - b.r), Math.abs(a.s - b.s)));
    }

    public int distance(HexCoordinate other) {
        return distance(this, other);
    }

    /**
     * @return distance from the origin
     */
    public int length() {
        return distance(this, ORIGIN);
    }

    public HexCoordinate add(HexCoordinate other) {
        return new HexCoordinate(q + other.q, r + other.r, s + other.s);
    }

    public HexCoordinate subtract(HexCoordinate other) {
        return new HexCoordinate(q - other.q, r - other.r, s - other.s);
    }

    public HexCoordinate scale(int factor) {
        return new HexCoordinate(q * factor, r * factor, s * factor);
    }

    /**
     * Step in a direction.
     *
     * @param direction the direction
     * @param steps     number of steps, may be negative
     * @return the coordinate reached
     */
    public HexCoordinate move(HexDirection direction, int steps) {
        return new HexCoordinate(q + direction.dq * steps, r + direction.dr * steps, s + direction.ds * steps);
    }

    public HexCoordinate neighbor(HexDirection direction) {
        return move(direction, 1);
    }

    /**
     * The six adjacent coordinates in canonical order NE, E, SE, SW, W, NW.
     *
     * @return a new mutable list
     */
    public List<HexCoordinate> neighbors() {
        var result = new ArrayList<HexCoordinate>(6);
        for (var direction : HexDirection.values()) {
            result.add(neighbor(direction));
        }
        return result;
    }

    public boolean isAdjacentTo(HexCoordinate other) {
        return distance(other) == 1;
    }

    /**
     * @return canonical string key "q,r,s"
     */
    public String key() {
        return q + "," + r + "," + s;
    }

    /**
     * @return "(q, r)" for log and combat messages
     */
    public String toDisplayString() {
        return "(" + q + ", " + r + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof HexCoordinate other)) {
            return false;
        }
        return q == other.q && r == other.r;
    }

    @Override
    public int hashCode() {
        return Objects.hash(q, r);
    }

    @Override
    public String toString() {
        return String.format("Hex(%d, %d, %d)", q, r, s);
    }
}
