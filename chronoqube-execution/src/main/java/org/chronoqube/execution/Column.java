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

import java.util.List;

import org.chronoqube.data.column.ColumnEntityIds;
import org.chronoqube.data.column.ColumnType;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A named, typed and fully materialized column of a {@link TableView}.
 *
 * @author The chronoqube authors
 */
public final class Column<T> {
  private final String name;
  private final ColumnType<T> type;
  private final List<T> values;
  private final ColumnEntityIds entityIds;
  private final String sourceDependency;

  public Column(String name, ColumnType<T> type, List<T> values, ColumnEntityIds entityIds,
      String sourceDependency) {
    this.name = Preconditions.checkNotNull(name);
    this.type = Preconditions.checkNotNull(type);
    this.values = ImmutableList.copyOf(values);
    this.entityIds = Preconditions.checkNotNull(entityIds);
    this.sourceDependency = sourceDependency;
  }

  public String getName() {
    return name;
  }

  public ColumnType<T> getType() {
    return type;
  }

  public List<T> getValues() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public ColumnEntityIds getEntityIds() {
    return entityIds;
  }

  /**
   * @return Name of the data source the values were computed from, <code>null</code> for derived columns.
   */
  public String getSourceDependency() {
    return sourceDependency;
  }

  /**
   * @return A new column containing only the given rows, in the given order.
   */
  public Column<T> selectRows(List<Integer> rows) {
    ImmutableList.Builder<T> res = ImmutableList.builder();
    for (int row : rows)
      res.add(values.get(row));
    return new Column<>(name, type, res.build(), entityIds.selectRows(rows), sourceDependency);
  }
}
