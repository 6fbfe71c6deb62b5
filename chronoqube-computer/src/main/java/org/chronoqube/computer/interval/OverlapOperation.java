/**
 * chronoqube: Time-aligned table views over heterogeneous data streams.
 *
 * Copyright (C) 2026 The chronoqube authors
 *
 * This file is part of chronoqube.
 *
 * chronoqube is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.chronoqube.computer.interval;

/**
 * What {@link IntervalOverlapComputer} computes.
 *
 * @author The chronoqube authors
 */
public enum OverlapOperation {
  /** Index of the last source interval fully containing the row interval, -1 if none. */
  ASSIGN_ID,
  /** Number of source intervals overlapping the row interval. */
  COUNT_OVERLAPS,
  /** Start of the interval found by {@link #ASSIGN_ID} in destination frame indices, -1 if none. */
  ASSIGN_ID_START,
  /** End of the interval found by {@link #ASSIGN_ID} in destination frame indices, -1 if none. */
  ASSIGN_ID_END;
}
