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

/**
 * The six unit steps of a pointy-top cube coordinate grid.
 * <p>
 * Declaration order is the canonical neighbor order used everywhere a deterministic enumeration is required:
 * NE, E, SE, SW, W, NW. Every offset satisfies dq + dr + ds = 0.
 *
 * @author hal.hildebrand
 */
public enum HexDirection {
    NORTH_EAST(1, -1, 0),
    EAST(1, 0, -1),
    SOUTH_EAST(0, 1, -1),
    SOUTH_WEST(-1, 1, 0),
    WEST(-1, 0, 1),
    NORTH_WEST(0, -1, 1);

    private static final HexDirection[] VALUES = values();

    public final int dq;
    public final int dr;
    public final int ds;

    HexDirection(int dq, int dr, int ds) {
        this.dq = dq;
        this.dr = dr;
        this.ds = ds;
    }

    /**
     * Direction by index, wrapping modulo six
     *
     * @param index any integer, negative values wrap backwards
     * @return the direction at that position in the canonical order
     */
    public static HexDirection of(int index) {
        return VALUES[Math.floorMod(index, VALUES.length)];
    }

    /**
     * @return the direction pointing the other way
     */
    public HexDirection opposite() {
        return of(ordinal() + 3);
    }

    /**
     * @return the unit offset as a coordinate
     */
    public HexCoordinate offset() {
        return HexCoordinate.of(dq, dr);
    }
}
