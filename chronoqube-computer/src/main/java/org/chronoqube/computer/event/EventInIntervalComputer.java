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

import java.util.ArrayList;
import java.util.List;

import org.chronoqube.computer.AbstractColumnComputer;
import org.chronoqube.computer.ColumnComputer;
import org.chronoqube.computer.ComputerResult;
import org.chronoqube.data.column.ColumnEntityIds;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowKind;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.EventSearch;
import org.chronoqube.data.source.EventSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.data.time.TimeFrameInterval;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Longs;

/**
 * Inspects the events of an {@link EventSource} that fall into each row interval (both ends inclusive), see
 * {@link EventOperation}.
 * 
 * <p>
 * Gathered event positions are in index units of the event source's TimeFrame, as float. For
 * {@link EventOperation#GATHER_CENTER} the source index of the interval midpoint is subtracted.
 *
 * @author The chronoqube authors
 */
public class EventInIntervalComputer<T> extends AbstractColumnComputer<EventSource, T> implements ColumnComputer<T> {
  private final EventOperation operation;

  /**
   * @throws IllegalArgumentException
   *           if the operation does not produce values of the given output type.
   */
  public EventInIntervalComputer(EventSource source, EventOperation operation, ColumnType<T> outputType)
      throws IllegalArgumentException {
    super(source, outputType, RowSelectorType.INTERVAL);
    Preconditions.checkArgument(operation.getOutputType() == outputType,
        "Event operation %s produces %s, but %s was requested", operation, operation.getOutputType(), outputType);
    this.operation = operation;
  }

  public EventOperation getOperation() {
    return operation;
  }

  @Override
  @SuppressWarnings("unchecked")
  public ComputerResult<T> compute(ExecutionPlan plan) {
    plan.requireRowKind(describe(), RowKind.INTERVALS);
    List<TimeFrameInterval> intervals = plan.getIntervals();

    TimeFrame destFrame = plan.getTimeFrame();
    TimeFrame sourceFrame = source.getTimeFrame();
    double[] events = source.getEvents();
    long[] entityIds = source.getEntityIds();

    List<Object> values = new ArrayList<>(intervals.size());
    List<List<Long>> ids = new ArrayList<>(intervals.size());
    for (TimeFrameInterval interval : intervals) {
      long start = sourceFrame.convertIndex(interval.getStart(), destFrame).getValue();
      long end = sourceFrame.convertIndex(interval.getEnd(), destFrame).getValue();
      int from = EventSearch.lowerBound(events, start);
      int to = Math.max(from, EventSearch.upperBound(events, end));

      switch (operation) {
      case PRESENCE:
        values.add(to > from);
        break;
      case COUNT:
        values.add(to - from);
        break;
      case GATHER:
        values.add(gather(events, from, to, 0));
        break;
      case GATHER_CENTER:
        TimeFrameIndex mid =
            TimeFrameIndex.of((interval.getStart().getValue() + interval.getEnd().getValue()) / 2);
        values.add(gather(events, from, to, sourceFrame.convertIndex(mid, destFrame).getValue()));
        break;
      }

      if (entityIds.length > 0)
        ids.add(Longs.asList(entityIds).subList(from, to));
    }

    ColumnEntityIds columnEntityIds = (entityIds.length > 0) ? ColumnEntityIds.complex(ids) : ColumnEntityIds.none();
    return new ComputerResult<>((List<T>) (List<?>) values, columnEntityIds);
  }

  /**
   * Positions are narrowed to float only after subtracting the center.
   */
  private List<Float> gather(double[] events, int from, int to, long center) {
    List<Float> res = new ArrayList<>(to - from);
    for (int i = from; i < to; i++)
      res.add((float) (events[i] - center));
    return res;
  }
}
