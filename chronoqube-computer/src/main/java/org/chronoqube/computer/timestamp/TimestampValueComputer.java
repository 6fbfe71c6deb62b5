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
import java.util.List;

import org.chronoqube.computer.AbstractColumnComputer;
import org.chronoqube.computer.ColumnComputer;
import org.chronoqube.computer.ComputerResult;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowKind;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.AnalogSource;
import org.chronoqube.data.time.TimeFrameIndex;

/**
 * Value of an analog source at each row timestamp, NaN where the source has no sample.
 *
 * @author The chronoqube authors
 */
public class TimestampValueComputer extends AbstractColumnComputer<AnalogSource, Double>
    implements ColumnComputer<Double> {

  public TimestampValueComputer(AnalogSource source) {
    super(source, ColumnType.DOUBLE, RowSelectorType.TIMESTAMP);
  }

  @Override
  public ComputerResult<Double> compute(ExecutionPlan plan) {
    plan.requireRowKind(describe(), RowKind.INDICES);

    List<Double> res = new ArrayList<>();
    for (TimeFrameIndex index : plan.getIndices())
      res.add(source.getValueAt(index, plan.getTimeFrame()));
    return ComputerResult.withoutEntityIds(res);
  }
}
