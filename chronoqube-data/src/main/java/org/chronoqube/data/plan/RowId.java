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
package org.chronoqube.data.plan;

import org.chronoqube.data.time.TimeFrameIndex;

import com.google.common.base.Preconditions;

/**
 * A row of an entity-expanded {@link ExecutionPlan}: the n-th entity at a specific timestamp.
 *
 * @author The chronoqube authors
 */
public final class RowId {
  private final TimeFrameIndex timeIndex;
  private final int entityOrdinal;

  public RowId(TimeFrameIndex timeIndex, int entityOrdinal) {
    Preconditions.checkArgument(entityOrdinal >= 0, "Entity ordinal must not be negative");
    this.timeIndex = Preconditions.checkNotNull(timeIndex);
    this.entityOrdinal = entityOrdinal;
  }

  public TimeFrameIndex getTimeIndex() {
    return timeIndex;
  }

  public int getEntityOrdinal() {
    return entityOrdinal;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof RowId))
      return false;
    RowId other = (RowId) obj;
    return timeIndex.equals(other.timeIndex) && entityOrdinal == other.entityOrdinal;
  }

  @Override
  public int hashCode() {
    return 31 * timeIndex.hashCode() + entityOrdinal;
  }

  @Override
  public String toString() {
    return timeIndex.getValue() + "#" + entityOrdinal;
  }
}
