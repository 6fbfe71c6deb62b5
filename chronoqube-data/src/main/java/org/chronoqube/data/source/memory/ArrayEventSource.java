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

import java.util.Arrays;

import org.chronoqube.data.source.EventSearch;
import org.chronoqube.data.source.EventSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;

import com.google.common.base.Preconditions;

/**
 * {@link EventSource} backed by a sorted array.
 *
 * @author The chronoqube authors
 */
public class ArrayEventSource implements EventSource {
  private final String name;
  private final TimeFrame timeFrame;
  private final double[] events;
  private final long[] entityIds;

  public ArrayEventSource(String name, TimeFrame timeFrame, double[] events) {
    this(name, timeFrame, events, new long[0]);
  }

  /**
   * @param events
   *          positions in index units of <code>timeFrame</code>, ascending.
   * @param entityIds
   *          either empty or one id per event.
   */
  public ArrayEventSource(String name, TimeFrame timeFrame, double[] events, long[] entityIds) {
    this.name = Preconditions.checkNotNull(name);
    this.timeFrame = Preconditions.checkNotNull(timeFrame, "TimeFrame of source %s must not be null", name);
    Preconditions.checkArgument(entityIds.length == 0 || entityIds.length == events.length,
        "Need either no entity ids or one per event");
    for (int i = 1; i < events.length; i++)
      Preconditions.checkArgument(events[i - 1] <= events[i], "Events must be sorted ascending");
    this.events = events.clone();
    this.entityIds = entityIds.clone();
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
  public double[] getEvents() {
    return events.clone();
  }

  @Override
  public long[] getEntityIds() {
    return entityIds.clone();
  }

  @Override
  public double[] getEventsInRange(TimeFrameIndex start, TimeFrameIndex end, TimeFrame callerFrame) {
    long ownStart = timeFrame.convertIndex(start, callerFrame).getValue();
    long ownEnd = timeFrame.convertIndex(end, callerFrame).getValue();
    int from = EventSearch.lowerBound(events, ownStart);
    int to = EventSearch.upperBound(events, ownEnd);
    if (from >= to)
      return new double[0];
    return Arrays.copyOfRange(events, from, to);
  }
}
