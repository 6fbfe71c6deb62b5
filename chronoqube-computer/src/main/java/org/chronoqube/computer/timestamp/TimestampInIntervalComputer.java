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
package org.chronoqube.computer.timestamp;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.chronoqube.computer.AbstractColumnComputer;
import org.chronoqube.computer.ColumnComputer;
import org.chronoqube.computer.ComputerResult;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowKind;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.IntervalSource;
import org.chronoqube.data.source.IntervalWithId;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.data.time.TimeFrameInterval;

/**
 * Whether each row timestamp lies inside any interval of an {@link IntervalSource}, both ends inclusive.
 *
 * @author The chronoqube authors
 */
public class TimestampInIntervalComputer extends AbstractColumnComputer<IntervalSource, Boolean>
    implements ColumnComputer<Boolean> {

  public TimestampInIntervalComputer(IntervalSource source) {
    super(source, ColumnType.BOOL, RowSelectorType.TIMESTAMP);
  }

  @Override
  public ComputerResult<Boolean> compute(ExecutionPlan plan) {
    plan.requireRowKind(describe(), RowKind.INDICES);
    TimeFrame destFrame = plan.getTimeFrame();

    List<TimeFrameInterval> converted = new ArrayList<>();
    for (IntervalWithId i : source.getIntervals())
      converted.add(destFrame.convertInterval(i.getInterval(), source.getTimeFrame()));
    converted.sort(Comparator.comparing(TimeFrameInterval::getStart));

    long[] starts = new long[converted.size()];
    // maxEnds[i]: maximum end of intervals 0..i
    long[] maxEnds = new long[converted.size()];
    for (int i = 0; i < converted.size(); i++) {
      starts[i] = converted.get(i).getStart().getValue();
      maxEnds[i] = Math.max(converted.get(i).getEnd().getValue(), i > 0 ? maxEnds[i - 1] : Long.MIN_VALUE);
    }

    List<Boolean> res = new ArrayList<>();
    for (TimeFrameIndex index : plan.getIndices()) {
      long t = index.getValue();
      int numStartedBefore = upperBound(starts, t);
      res.add(numStartedBefore > 0 && maxEnds[numStartedBefore - 1] >= t);
    }
    return ComputerResult.withoutEntityIds(res);
  }

  private int upperBound(long[] values, long value) {
    int lo = 0;
    int hi = values.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (values[mid] <= value)
        lo = mid + 1;
      else
        hi = mid;
    }
    return lo;
  }
}
