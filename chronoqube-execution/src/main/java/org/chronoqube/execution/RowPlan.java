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
package org.chronoqube.execution;

import java.util.ArrayList;
import java.util.List;

import org.chronoqube.computer.ColumnComputerBase;
import org.chronoqube.computer.EntityExpandingComputer;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowId;
import org.chronoqube.data.plan.RowKind;
import org.chronoqube.data.selector.RowSelector;
import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.data.time.TimeFrameInterval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * The rows of a table, decided once before any column is computed.
 * 
 * <p>
 * If all columns of a table are {@link EntityExpandingComputer}s and the row selector yields timestamps, each
 * (timestamp, entity) pair becomes a row and timestamps without any entity are dropped. In all other cases there is
 * one row per row of the selector.
 *
 * @author The chronoqube authors
 */
public final class RowPlan {
  private static final Logger logger = LoggerFactory.getLogger(RowPlan.class);

  private final ExecutionPlan plan;
  private final List<RowDescriptor> rows;
  private final boolean expanded;

  private RowPlan(ExecutionPlan plan, List<RowDescriptor> rows, boolean expanded) {
    this.plan = plan;
    this.rows = ImmutableList.copyOf(rows);
    this.expanded = expanded;
  }

  public static RowPlan negotiate(RowSelector selector, List<? extends ColumnComputerBase<?>> computers) {
    ExecutionPlan basePlan = selector.toExecutionPlan();

    boolean allExpanding = !computers.isEmpty() && basePlan.getRowKind() == RowKind.INDICES
        && computers.stream().allMatch(c -> c instanceof EntityExpandingComputer);

    if (!allExpanding) {
      List<RowDescriptor> rows = new ArrayList<>(basePlan.getRowCount());
      if (basePlan.getRowKind() == RowKind.INTERVALS) {
        for (TimeFrameInterval interval : basePlan.getIntervals())
          rows.add(RowDescriptor.ofInterval(interval));
      } else if (basePlan.getRowKind() == RowKind.INDICES) {
        for (TimeFrameIndex idx : basePlan.getIndices())
          rows.add(RowDescriptor.ofIndex(idx));
      } else {
        for (RowId row : basePlan.getRows())
          rows.add(RowDescriptor.ofEntity(row.getTimeIndex(), row.getEntityOrdinal()));
      }
      logger.debug("Using {} rows of kind {} without entity expansion", rows.size(), basePlan.getRowKind());
      return new RowPlan(basePlan, rows, false);
    }

    List<RowId> rowIds = new ArrayList<>();
    List<RowDescriptor> rows = new ArrayList<>();
    for (TimeFrameIndex idx : basePlan.getIndices()) {
      int entities = 0;
      for (ColumnComputerBase<?> computer : computers)
        entities = Math.max(entities,
            ((EntityExpandingComputer) computer).getEntityCountAt(idx, basePlan.getTimeFrame()));
      for (int entity = 0; entity < entities; entity++) {
        rowIds.add(new RowId(idx, entity));
        rows.add(RowDescriptor.ofEntity(idx, entity));
      }
    }
    logger.debug("Expanded {} timestamps to {} entity rows", basePlan.getRowCount(), rowIds.size());
    return new RowPlan(ExecutionPlan.ofRows(rowIds, basePlan.getTimeFrame()), rows, true);
  }

  /**
   * @return The plan all columns are computed with.
   */
  public ExecutionPlan getPlan() {
    return plan;
  }

  public List<RowDescriptor> getRows() {
    return rows;
  }

  public boolean isExpanded() {
    return expanded;
  }
}
