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

import org.chronoqube.computer.ColumnComputer;
import org.chronoqube.computer.ComputerResult;
import org.chronoqube.data.column.ColumnEntityIds;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowId;
import org.chronoqube.data.source.LineSource;
import org.chronoqube.data.source.LineWithId;

/**
 * The timestamp (destination frame index) of each row that has a line, 0 for rows without line.
 * 
 * <p>
 * Useful next to {@link LineSamplingMultiComputer} to know which timestamp an expanded row belongs to.
 *
 * @author The chronoqube authors
 */
public class LineTimestampComputer extends AbstractLineComputer<Long> implements ColumnComputer<Long> {

  public LineTimestampComputer(LineSource source) {
    super(source, ColumnType.LONG);
  }

  @Override
  public ComputerResult<Long> compute(ExecutionPlan plan) {
    List<RowId> rows = resolveRows(plan);

    List<Long> values = new ArrayList<>(rows.size());
    List<Long> ids = new ArrayList<>(rows.size());
    for (RowId row : rows) {
      LineWithId line = lineOf(row, plan.getTimeFrame());
      values.add(line != null ? row.getTimeIndex().getValue() : ColumnType.LONG.getNeutralValue());
      ids.add(line != null ? line.getEntityId() : null);
    }
    return new ComputerResult<>(values, ColumnEntityIds.simple(ids));
  }
}
