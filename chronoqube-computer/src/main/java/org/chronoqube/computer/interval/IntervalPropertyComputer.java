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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.chronoqube.computer.AbstractColumnComputer;
import org.chronoqube.computer.ColumnComputer;
import org.chronoqube.computer.ComputerResult;
import org.chronoqube.computer.NumericValues;
import org.chronoqube.data.column.ColumnEntityIds;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowKind;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.IntervalSource;
import org.chronoqube.data.source.IntervalWithId;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameInterval;

import com.google.common.base.Preconditions;

/**
 * Start, end or duration of each row interval, in index units of the destination TimeFrame.
 * 
 * <p>
 * The entity id of a row is the id of the source interval that equals the row interval (after conversion into the
 * destination frame), if there is one.
 *
 * @author The chronoqube authors
 */
public class IntervalPropertyComputer<T> extends AbstractColumnComputer<IntervalSource, T>
    implements ColumnComputer<T> {
  private final IntervalProperty property;

  public IntervalPropertyComputer(IntervalSource source, IntervalProperty property, ColumnType<T> outputType) {
    super(source, outputType, RowSelectorType.INTERVAL);
    Preconditions.checkArgument(outputType.isNumericScalar(), "Interval properties cannot be of type %s", outputType);
    this.property = property;
  }

  @Override
  public ComputerResult<T> compute(ExecutionPlan plan) {
    plan.requireRowKind(describe(), RowKind.INTERVALS);
    TimeFrame destFrame = plan.getTimeFrame();

    Map<TimeFrameInterval, Long> idsByInterval = new HashMap<>();
    for (IntervalWithId i : source.getIntervals())
      idsByInterval.putIfAbsent(destFrame.convertInterval(i.getInterval(), source.getTimeFrame()), i.getEntityId());

    List<T> values = new ArrayList<>();
    List<Long> ids = new ArrayList<>();
    for (TimeFrameInterval interval : plan.getIntervals()) {
      long value;
      switch (property) {
      case START:
        value = interval.getStart().getValue();
        break;
      case END:
        value = interval.getEnd().getValue();
        break;
      default:
        value = interval.getLength();
        break;
      }
      values.add(NumericValues.convert(getOutputType(), value));
      ids.add(idsByInterval.get(interval));
    }

    return new ComputerResult<>(values, ColumnEntityIds.simple(ids));
  }
}
