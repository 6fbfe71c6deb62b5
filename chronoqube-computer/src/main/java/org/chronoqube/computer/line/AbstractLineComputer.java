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
package org.chronoqube.computer.line;

import java.util.ArrayList;
import java.util.List;

import org.chronoqube.computer.AbstractColumnComputer;
import org.chronoqube.computer.EntityExpandingComputer;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowId;
import org.chronoqube.data.plan.RowKind;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.LineSource;
import org.chronoqube.data.source.LineWithId;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;

/**
 * Base of entity-expanding computers on a {@link LineSource}.
 * 
 * <p>
 * For index plans the first line at each timestamp is used, for entity-row plans the line with the row's entity
 * ordinal. Rows without such a line are passed as <code>null</code> line to subclasses.
 *
 * @author The chronoqube authors
 */
public abstract class AbstractLineComputer<T> extends AbstractColumnComputer<LineSource, T>
    implements EntityExpandingComputer {

  protected AbstractLineComputer(LineSource source, ColumnType<T> outputType) {
    super(source, outputType, RowSelectorType.TIMESTAMP);
  }

  @Override
  public int getEntityCountAt(TimeFrameIndex index, TimeFrame callerFrame) {
    return source.getEntityCountAt(index, callerFrame);
  }

  /**
   * @return The rows of the plan as entity rows.
   */
  protected List<RowId> resolveRows(ExecutionPlan plan) {
    plan.requireRowKind(describe(), RowKind.INDICES, RowKind.ENTITY_ROWS);
    if (plan.getRowKind() == RowKind.ENTITY_ROWS)
      return plan.getRows();

    List<RowId> res = new ArrayList<>(plan.getRowCount());
    for (TimeFrameIndex index : plan.getIndices())
      res.add(new RowId(index, 0));
    return res;
  }

  /**
   * @return The line of the given row or <code>null</code> if there is none.
   */
  protected LineWithId lineOf(RowId row, TimeFrame destFrame) {
    List<LineWithId> lines = source.getLinesAt(row.getTimeIndex(), destFrame);
    if (row.getEntityOrdinal() < lines.size())
      return lines.get(row.getEntityOrdinal());
    return null;
  }
}
