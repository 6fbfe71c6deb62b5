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
package org.chronoqube.data.source;

import org.chronoqube.data.time.TimeFrameInterval;

import com.google.common.base.Preconditions;

/**
 * An interval of an {@link IntervalSource} together with the entity id of its raw record.
 *
 * @author The chronoqube authors
 */
public final class IntervalWithId {
  private final TimeFrameInterval interval;
  private final long entityId;

  public IntervalWithId(TimeFrameInterval interval, long entityId) {
    this.interval = Preconditions.checkNotNull(interval);
    this.entityId = entityId;
  }

  public TimeFrameInterval getInterval() {
    return interval;
  }

  public long getEntityId() {
    return entityId;
  }

  @Override
  public String toString() {
    return interval + "#" + entityId;
  }
}
