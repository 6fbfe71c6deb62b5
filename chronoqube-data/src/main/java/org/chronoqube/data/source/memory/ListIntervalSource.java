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
package org.chronoqube.data.source.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.chronoqube.data.source.IntervalSource;
import org.chronoqube.data.source.IntervalWithId;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.data.time.TimeFrameInterval;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * {@link IntervalSource} backed by a list.
 *
 * @author The chronoqube authors
 */
public class ListIntervalSource implements IntervalSource {
  private final String name;
  private final TimeFrame timeFrame;
  private final List<IntervalWithId> intervals;

  public ListIntervalSource(String name, TimeFrame timeFrame, List<IntervalWithId> intervals) {
    this.name = Preconditions.checkNotNull(name);
    this.timeFrame = Preconditions.checkNotNull(timeFrame, "TimeFrame of source %s must not be null", name);
    List<IntervalWithId> sorted = new ArrayList<>(intervals);
    sorted.sort(Comparator.comparing((IntervalWithId i) -> i.getInterval().getStart()));
    this.intervals = ImmutableList.copyOf(sorted);
  }

  /**
   * Creates a source whose entity ids are the positions of the intervals in the given list.
   */
  public static ListIntervalSource ofIntervals(String name, TimeFrame timeFrame, List<TimeFrameInterval> intervals) {
    List<IntervalWithId> withIds = new ArrayList<>();
    for (int i = 0; i < intervals.size(); i++)
      withIds.add(new IntervalWithId(intervals.get(i), i));
    return new ListIntervalSource(name, timeFrame, withIds);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public TimeFrame getTimeFrame() {
    return timeFrame;
  }

  @Override
  public List<IntervalWithId> getIntervals() {
    return intervals;
  }

  @Override
  public List<IntervalWithId> getIntervalsInRange(TimeFrameIndex start, TimeFrameIndex end, TimeFrame callerFrame) {
    TimeFrameIndex ownStart = timeFrame.convertIndex(start, callerFrame);
    TimeFrameIndex ownEnd = timeFrame.convertIndex(end, callerFrame);
    List<IntervalWithId> res = new ArrayList<>();
    for (IntervalWithId i : intervals) {
      if (i.getInterval().getStart().compareTo(ownEnd) > 0)
        break;
      if (i.getInterval().getEnd().compareTo(ownStart) >= 0)
        res.add(i);
    }
    return res;
  }
}
