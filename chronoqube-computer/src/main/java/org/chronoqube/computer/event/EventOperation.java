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
package org.chronoqube.computer.event;

import org.chronoqube.data.column.ColumnType;

/**
 * What {@link EventInIntervalComputer} computes for the events inside a row interval.
 *
 * @author The chronoqube authors
 */
public enum EventOperation {
  /** Whether there is at least one event. */
  PRESENCE(ColumnType.BOOL),
  /** Number of events. */
  COUNT(ColumnType.INT),
  /** Positions of all events. */
  GATHER(ColumnType.FLOAT_VECTOR),
  /** Positions of all events relative to the interval midpoint. */
  GATHER_CENTER(ColumnType.FLOAT_VECTOR);

  private final ColumnType<?> outputType;

  private EventOperation(ColumnType<?> outputType) {
    this.outputType = outputType;
  }

  public ColumnType<?> getOutputType() {
    return outputType;
  }
}
