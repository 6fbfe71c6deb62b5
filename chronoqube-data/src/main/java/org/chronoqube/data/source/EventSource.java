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

import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;

/**
 * Discrete events. Each event has a position in index units of the source's own {@link TimeFrame} (which may be
 * fractional) and optionally an entity id identifying the raw record.
 *
 * @author The chronoqube authors
 */
public interface EventSource extends DataSource {
  /**
   * @return Positions of all events, sorted ascending, in index units of the source's TimeFrame.
   */
  double[] getEvents();

  /**
   * @return Entity ids of the events, parallel to {@link #getEvents()}. Empty if the source has no entity ids.
   */
  long[] getEntityIds();

  /**
   * @return Positions of all events between start and end (both inclusive, relative to <code>callerFrame</code>),
   *         expressed in index units of the source's TimeFrame.
   */
  double[] getEventsInRange(TimeFrameIndex start, TimeFrameIndex end, TimeFrame callerFrame);

  @Override
  default SourceKind getKind() {
    return SourceKind.EVENT;
  }
}
