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
package org.chronoqube.execution;

import java.util.Objects;

import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.data.time.TimeFrameInterval;

/**
 * Describes where a single row of a {@link TableView} comes from.
 * 
 * <p>
 * Exactly one of {@link #getTimeIndex()} and {@link #getInterval()} is non-null. The entity ordinal is -1 for rows that
 * were not expanded by entity.
 *
 * @author The chronoqube authors
 */
public final class RowDescriptor {
  public static final int NO_ENTITY = -1;

  private final TimeFrameIndex timeIndex;
  private final TimeFrameInterval interval;
  private final int entityOrdinal;

  private RowDescriptor(TimeFrameIndex timeIndex, TimeFrameInterval interval, int entityOrdinal) {
    this.timeIndex = timeIndex;
    this.interval = interval;
    this.entityOrdinal = entityOrdinal;
  }

  public static RowDescriptor ofIndex(TimeFrameIndex index) {
    return new RowDescriptor(index, null, NO_ENTITY);
  }

  public static RowDescriptor ofInterval(TimeFrameInterval interval) {
    return new RowDescriptor(null, interval, NO_ENTITY);
  }

  public static RowDescriptor ofEntity(TimeFrameIndex index, int entityOrdinal) {
    return new RowDescriptor(index, null, entityOrdinal);
  }

  public TimeFrameIndex getTimeIndex() {
    return timeIndex;
  }

  public TimeFrameInterval getInterval() {
    return interval;
  }

  public int getEntityOrdinal() {
    return entityOrdinal;
  }

  public boolean isEntityRow() {
    return entityOrdinal != NO_ENTITY;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof RowDescriptor))
      return false;
    RowDescriptor o = (RowDescriptor) obj;
    return Objects.equals(timeIndex, o.timeIndex) && Objects.equals(interval, o.interval)
        && entityOrdinal == o.entityOrdinal;
  }

  @Override
  public int hashCode() {
    return Objects.hash(timeIndex, interval, entityOrdinal);
  }

  @Override
  public String toString() {
    if (interval != null)
      return "Row[" + interval + "]";
    if (isEntityRow())
      return "Row[" + timeIndex + "#" + entityOrdinal + "]";
    return "Row[" + timeIndex + "]";
  }
}
