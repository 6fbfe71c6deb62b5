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
package org.chronoqube.data.raw;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Raw point data: at each index of a {@link TimeFrame} any number of 2D points. Not a source itself, it needs to be
 * wrapped by an adapter.
 *
 * @author The chronoqube authors
 */
public final class PointSeries {
  private final TimeFrame timeFrame;
  private final NavigableMap<TimeFrameIndex, List<Point>> points = new TreeMap<>();

  public PointSeries(TimeFrame timeFrame, Map<TimeFrameIndex, List<Point>> points) {
    this.timeFrame = Preconditions.checkNotNull(timeFrame);
    for (Map.Entry<TimeFrameIndex, List<Point>> e : points.entrySet())
      this.points.put(e.getKey(), ImmutableList.copyOf(e.getValue()));
  }

  public TimeFrame getTimeFrame() {
    return timeFrame;
  }

  /**
   * @return Unmodifiable view, sorted by index.
   */
  public NavigableMap<TimeFrameIndex, List<Point>> getPoints() {
    return Collections.unmodifiableNavigableMap(points);
  }
}
