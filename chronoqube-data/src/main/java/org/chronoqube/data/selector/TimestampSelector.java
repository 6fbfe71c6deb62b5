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

import java.util.List;

import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Rows are single points in time, given as indices of a {@link TimeFrame}.
 *
 * @author The chronoqube authors
 */
public class TimestampSelector implements RowSelector {
  private final List<TimeFrameIndex> indices;
  private final TimeFrame timeFrame;

  public TimestampSelector(List<TimeFrameIndex> indices, TimeFrame timeFrame) {
    this.indices = ImmutableList.copyOf(indices);
    this.timeFrame = Preconditions.checkNotNull(timeFrame, "TimeFrame of timestamp selector must not be null");
  }

  @Override
  public RowSelectorType getType() {
    return RowSelectorType.TIMESTAMP;
  }

  @Override
  public TimeFrame getTimeFrame() {
    return timeFrame;
  }

  @Override
  public int getRowCount() {
    return indices.size();
  }

  public List<TimeFrameIndex> getIndices() {
    return indices;
  }

  @Override
  public ExecutionPlan toExecutionPlan() {
    return ExecutionPlan.ofIndices(indices, timeFrame);
  }
}
