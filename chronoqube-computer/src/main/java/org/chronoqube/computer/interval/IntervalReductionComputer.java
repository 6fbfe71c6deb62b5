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
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowKind;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.AnalogSource;
import org.chronoqube.data.time.TimeFrameInterval;

/**
 * Reduces the analog samples inside each row interval to a single value.
 * 
 * <p>
 * The standard deviation is the population standard deviation. Intervals without samples result in NaN for mean, max,
 * min and standard deviation and in 0 for sum and count.
 *
 * @author The chronoqube authors
 */
public class IntervalReductionComputer extends AbstractColumnComputer<AnalogSource, Double>
    implements ColumnComputer<Double> {
  private final ReductionType reductionType;

  public IntervalReductionComputer(AnalogSource source, ReductionType reductionType) {
    super(source, ColumnType.DOUBLE, RowSelectorType.INTERVAL);
    this.reductionType = reductionType;
  }

  @Override
  public ComputerResult<Double> compute(ExecutionPlan plan) {
    plan.requireRowKind(describe(), RowKind.INTERVALS);

    List<Double> res = new ArrayList<>();
    for (TimeFrameInterval interval : plan.getIntervals())
      res.add(reduce(source.getDataInRange(interval.getStart(), interval.getEnd(), plan.getTimeFrame())));
    return ComputerResult.withoutEntityIds(res);
  }

  private double reduce(float[] data) {
    if (data.length == 0) {
      if (reductionType == ReductionType.SUM || reductionType == ReductionType.COUNT)
        return 0.;
      return Double.NaN;
    }

    switch (reductionType) {
    case COUNT:
      return data.length;
    case SUM:
      return sum(data);
    case MEAN:
      return sum(data) / data.length;
    case MAX: {
      double max = Double.NEGATIVE_INFINITY;
      for (float f : data)
        max = Math.max(max, f);
      return max;
    }
    case MIN: {
      double min = Double.POSITIVE_INFINITY;
      for (float f : data)
        min = Math.min(min, f);
      return min;
    }
    default: {
      double mean = sum(data) / data.length;
      double squares = 0.;
      for (float f : data)
        squares += (f - mean) * (f - mean);
      return Math.sqrt(squares / data.length);
    }
    }
  }

  private double sum(float[] data) {
    double res = 0.;
    for (float f : data)
      res += f;
    return res;
  }
}
