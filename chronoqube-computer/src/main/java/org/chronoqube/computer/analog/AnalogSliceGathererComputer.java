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
package org.chronoqube.computer.analog;

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

import com.google.common.base.Preconditions;

/**
 * All analog samples inside each row interval, as vector of doubles or floats.
 *
 * @author The chronoqube authors
 */
public class AnalogSliceGathererComputer<T> extends AbstractColumnComputer<AnalogSource, T>
    implements ColumnComputer<T> {

  /**
   * @param outputType
   *          either {@link ColumnType#DOUBLE_VECTOR} or {@link ColumnType#FLOAT_VECTOR}.
   */
  public AnalogSliceGathererComputer(AnalogSource source, ColumnType<T> outputType) {
    super(source, outputType, RowSelectorType.INTERVAL);
    Preconditions.checkArgument(outputType == ColumnType.DOUBLE_VECTOR || outputType == ColumnType.FLOAT_VECTOR,
        "Analog slices cannot be gathered into %s", outputType);
  }

  @Override
  @SuppressWarnings("unchecked")
  public ComputerResult<T> compute(ExecutionPlan plan) {
    plan.requireRowKind(describe(), RowKind.INTERVALS);
    boolean asDouble = getOutputType() == ColumnType.DOUBLE_VECTOR;

    List<Object> res = new ArrayList<>();
    for (TimeFrameInterval interval : plan.getIntervals()) {
      float[] data = source.getDataInRange(interval.getStart(), interval.getEnd(), plan.getTimeFrame());
      List<Object> slice = new ArrayList<>(data.length);
      for (float f : data) {
        if (asDouble)
          slice.add((double) f);
        else
          slice.add(f);
      }
      res.add(slice);
    }
    return ComputerResult.withoutEntityIds((List<T>) (List<?>) res);
  }
}
