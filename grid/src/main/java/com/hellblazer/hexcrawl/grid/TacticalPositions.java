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

import java.util.List;

/**
 * Candidate positions around a target, partitioned by intent.
 *
 * @param aggressive hexes within {@link HexRanges#AGGRESSIVE_DISTANCE} of the target, nearest first
 * @param defensive  hexes at least {@link HexRanges#DEFENSIVE_DISTANCE} from the target, farthest first
 * @author hal.hildebrand
 */
public record TacticalPositions(List<HexCoordinate> aggressive, List<HexCoordinate> defensive) {

    public TacticalPositions {
        aggressive = List.copyOf(aggressive);
        defensive = List.copyOf(defensive);
    }

    public boolean isEmpty() {
        return aggressive.isEmpty() && defensive.isEmpty();
    }
}
