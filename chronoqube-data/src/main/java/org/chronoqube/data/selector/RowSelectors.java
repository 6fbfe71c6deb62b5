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
package org.chronoqube.data.selector;

import java.util.ArrayList;
import java.util.List;

import org.chronoqube.data.source.EventSource;
import org.chronoqube.data.source.IntervalSource;
import org.chronoqube.data.source.IntervalWithId;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.data.time.TimeFrameInterval;

import com.google.common.base.Preconditions;

/**
 * Builds {@link RowSelector}s from the full content of a source or a {@link TimeFrame}.
 * 
 * <p>
 * The resulting selectors are relative to the TimeFrame of the source they have been built from.
 *
 * @author The chronoqube authors
 */
public class RowSelectors {
  private RowSelectors() {

  }

  /**
   * One row per interval of the given source.
   * 
   * @throws IllegalArgumentException
   *           if the source has no intervals.
   */
  public static IntervalSelector fromIntervalSource(IntervalSource source) throws IllegalArgumentException {
    Preconditions.checkNotNull(source, "Interval source must not be null");
    Preconditions.checkNotNull(source.getTimeFrame(), "Interval source %s has no TimeFrame", source.getName());
    List<TimeFrameInterval> intervals = new ArrayList<>();
    for (IntervalWithId i : source.getIntervals())
      intervals.add(i.getInterval());
    if (intervals.isEmpty())
      throw new IllegalArgumentException("Interval source '" + source.getName() + "' does not contain any intervals.");
    return new IntervalSelector(intervals, source.getTimeFrame());
  }

  /**
   * One row per event of the given source, fractional event positions are truncated.
   * 
   * @throws IllegalArgumentException
   *           if the source has no events.
   */
  public static TimestampSelector fromEventSource(EventSource source) throws IllegalArgumentException {
    Preconditions.checkNotNull(source, "Event source must not be null");
    Preconditions.checkNotNull(source.getTimeFrame(), "Event source %s has no TimeFrame", source.getName());
    double[] events = source.getEvents();
    if (events.length == 0)
      throw new IllegalArgumentException("Event source '" + source.getName() + "' does not contain any events.");
    List<TimeFrameIndex> indices = new ArrayList<>(events.length);
    for (double e : events)
      indices.add(TimeFrameIndex.of((long) e));
    return new TimestampSelector(indices, source.getTimeFrame());
  }

  /**
   * One row per index of the given TimeFrame.
   */
  public static TimestampSelector fromTimeFrame(TimeFrame timeFrame) {
    Preconditions.checkNotNull(timeFrame, "TimeFrame must not be null");
    List<TimeFrameIndex> indices = new ArrayList<>(timeFrame.getTotalFrameCount());
    for (int i = 0; i < timeFrame.getTotalFrameCount(); i++)
      indices.add(TimeFrameIndex.of(i));
    return new TimestampSelector(indices, timeFrame);
  }
}
