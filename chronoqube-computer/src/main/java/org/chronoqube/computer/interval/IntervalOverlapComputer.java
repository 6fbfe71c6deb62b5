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
package org.chronoqube.computer.interval;

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
import org.chronoqube.data.source.IntervalSource;
import org.chronoqube.data.source.IntervalWithId;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameInterval;

/**
 * Relates each row interval to the intervals of an {@link IntervalSource}, see {@link OverlapOperation}.
 * 
 * <p>
 * Intervals are compared in absolute time. Two closed intervals a and b overlap iff
 * <code>a.start &lt;= b.end && b.start &lt;= a.end</code>.
 *
 * @author The chronoqube authors
 */
public class IntervalOverlapComputer extends AbstractColumnComputer<IntervalSource, Long>
    implements ColumnComputer<Long> {
  private final OverlapOperation operation;

  public IntervalOverlapComputer(IntervalSource source, OverlapOperation operation) {
    super(source, ColumnType.LONG, RowSelectorType.INTERVAL);
    this.operation = operation;
  }

  @Override
  public ComputerResult<Long> compute(ExecutionPlan plan) {
    plan.requireRowKind(describe(), RowKind.INTERVALS);
    TimeFrame destFrame = plan.getTimeFrame();
    TimeFrame sourceFrame = source.getTimeFrame();

    List<IntervalWithId> columnIntervals = source.getIntervals();
    long[] columnStarts = new long[columnIntervals.size()];
    long[] columnEnds = new long[columnIntervals.size()];
    for (int i = 0; i < columnIntervals.size(); i++) {
      columnStarts[i] = sourceFrame.getTimeAtIndex(columnIntervals.get(i).getInterval().getStart());
      columnEnds[i] = sourceFrame.getTimeAtIndex(columnIntervals.get(i).getInterval().getEnd());
    }

    List<Long> values = new ArrayList<>();
    List<Long> simpleIds = new ArrayList<>();
    List<List<Long>> complexIds = new ArrayList<>();
    for (TimeFrameInterval row : plan.getIntervals()) {
      long rowStart = destFrame.getTimeAtIndex(row.getStart());
      long rowEnd = destFrame.getTimeAtIndex(row.getEnd());

      if (operation == OverlapOperation.COUNT_OVERLAPS) {
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < columnStarts.length; i++)
          if (columnStarts[i] <= rowEnd && rowStart <= columnEnds[i])
            ids.add(columnIntervals.get(i).getEntityId());
        values.add((long) ids.size());
        complexIds.add(ids);
        continue;
      }

      int container = -1;
      for (int i = 0; i < columnStarts.length; i++)
        if (columnStarts[i] <= rowStart && rowEnd <= columnEnds[i])
          container = i;

      simpleIds.add(container >= 0 ? columnIntervals.get(container).getEntityId() : null);
      if (container < 0)
        values.add(-1L);
      else if (operation == OverlapOperation.ASSIGN_ID)
        values.add((long) container);
      else if (operation == OverlapOperation.ASSIGN_ID_START)
        values.add(destFrame.getIndexAtTime(columnStarts[container]).getValue());
      else
        values.add(destFrame.getIndexAtTime(columnEnds[container]).getValue());
    }

    if (operation == OverlapOperation.COUNT_OVERLAPS)
      return new ComputerResult<>(values, ColumnEntityIds.complex(complexIds));
    return new ComputerResult<>(values, ColumnEntityIds.simple(simpleIds));
  }
}
