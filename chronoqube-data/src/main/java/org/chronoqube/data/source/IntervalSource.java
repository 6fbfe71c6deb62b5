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

import java.util.List;

import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;

/**
 * Closed intervals of the source's own {@link TimeFrame}, each with an entity id.
 *
 * @author The chronoqube authors
 */
public interface IntervalSource extends DataSource {
  /**
   * @return All intervals, sorted by start, relative to the source's TimeFrame.
   */
  List<IntervalWithId> getIntervals();

  /**
   * @return All intervals that overlap <code>[start, end]</code> (relative to <code>callerFrame</code>), sorted by
   *         start. The returned intervals are relative to the source's own TimeFrame.
   */
  List<IntervalWithId> getIntervalsInRange(TimeFrameIndex start, TimeFrameIndex end, TimeFrame callerFrame);

  @Override
  default SourceKind getKind() {
    return SourceKind.INTERVAL;
  }
}
