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
package org.chronoqube.data.plan;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.data.time.TimeFrameInterval;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Immutable description of the rows of a table that is being built.
 * 
 * <p>
 * Exactly one of indices, intervals or entity rows is available, see {@link #getRowKind()}. All of them are relative to
 * the destination {@link TimeFrame} of the plan, which is what the output of computers is expressed against.
 *
 * @author The chronoqube authors
 */
public final class ExecutionPlan {
  private final RowKind rowKind;
  private final TimeFrame timeFrame;
  private final List<TimeFrameIndex> indices;
  private final List<TimeFrameInterval> intervals;
  private final List<RowId> rows;

  private ExecutionPlan(RowKind rowKind, TimeFrame timeFrame, List<TimeFrameIndex> indices,
      List<TimeFrameInterval> intervals, List<RowId> rows) {
    this.rowKind = rowKind;
    this.timeFrame =
        Preconditions.checkNotNull(timeFrame, "Destination TimeFrame of an ExecutionPlan must not be null");
    this.indices = indices;
    this.intervals = intervals;
    this.rows = rows;
  }

  public static ExecutionPlan ofIndices(List<TimeFrameIndex> indices, TimeFrame timeFrame) {
    return new ExecutionPlan(RowKind.INDICES, timeFrame, ImmutableList.copyOf(indices), null, null);
  }

  public static ExecutionPlan ofIntervals(List<TimeFrameInterval> intervals, TimeFrame timeFrame) {
    return new ExecutionPlan(RowKind.INTERVALS, timeFrame, null, ImmutableList.copyOf(intervals), null);
  }

  public static ExecutionPlan ofRows(List<RowId> rows, TimeFrame timeFrame) {
    return new ExecutionPlan(RowKind.ENTITY_ROWS, timeFrame, null, null, ImmutableList.copyOf(rows));
  }

  public RowKind getRowKind() {
    return rowKind;
  }

  public TimeFrame getTimeFrame() {
    return timeFrame;
  }

  public int getRowCount() {
    switch (rowKind) {
    case INDICES:
      return indices.size();
    case INTERVALS:
      return intervals.size();
    default:
      return rows.size();
    }
  }

  /**
   * @throws RowKindMismatchException
   *           if this plan does not describe indices.
   */
  public List<TimeFrameIndex> getIndices() throws RowKindMismatchException {
    requireRowKind("Indices", RowKind.INDICES);
    return indices;
  }

  /**
   * @throws RowKindMismatchException
   *           if this plan does not describe intervals.
   */
  public List<TimeFrameInterval> getIntervals() throws RowKindMismatchException {
    requireRowKind("Intervals", RowKind.INTERVALS);
    return intervals;
  }

  /**
   * @throws RowKindMismatchException
   *           if this plan does not describe entity rows.
   */
  public List<RowId> getRows() throws RowKindMismatchException {
    requireRowKind("Entity rows", RowKind.ENTITY_ROWS);
    return rows;
  }

  /**
   * Validates that this plan has one of the given row kinds.
   * 
   * @param consumer
   *          Name of whoever requires the kind, used in the exception message.
   * @throws RowKindMismatchException
   *           if the row kind does not match.
   */
  public void requireRowKind(String consumer, RowKind... acceptedKinds) throws RowKindMismatchException {
    Set<RowKind> accepted = EnumSet.copyOf(Arrays.asList(acceptedKinds));
    if (!accepted.contains(rowKind))
      throw new RowKindMismatchException(
          consumer + " requires an execution plan of kind " + accepted + " but plan is of kind " + rowKind);
  }

  @Override
  public String toString() {
    return "ExecutionPlan[" + rowKind + ", rows=" + getRowCount() + "]";
  }
}
