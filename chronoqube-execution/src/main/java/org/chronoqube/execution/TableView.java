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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.chronoqube.data.column.ColumnEntityIds;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.time.TimeFrame;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A built table: an ordered set of named, typed columns which all have the same number of rows.
 * 
 * <p>
 * Instances are immutable. Build them using {@link TableViewBuilder}.
 *
 * @author The chronoqube authors
 */
public final class TableView {
  private final Map<String, Column<?>> columns;
  private final List<RowDescriptor> rows;
  private final TimeFrame timeFrame;

  /**
   * @throws IllegalArgumentException
   *           if column names are not unique or a column does not have one value per row.
   */
  public TableView(List<Column<?>> columns, List<RowDescriptor> rows, TimeFrame timeFrame)
      throws IllegalArgumentException {
    this.rows = ImmutableList.copyOf(rows);
    this.timeFrame = timeFrame;
    this.columns = new LinkedHashMap<>();
    for (Column<?> col : columns) {
      if (this.columns.containsKey(col.getName()))
        throw new IllegalArgumentException("Duplicate column name '" + col.getName() + "'");
      if (col.size() != rows.size())
        throw new IllegalArgumentException("Column '" + col.getName() + "' has " + col.size()
            + " values, but the table has " + rows.size() + " rows.");
      this.columns.put(col.getName(), col);
    }
  }

  public int getRowCount() {
    return rows.size();
  }

  public int getColumnCount() {
    return columns.size();
  }

  /**
   * @return Column names in insertion order.
   */
  public List<String> getColumnNames() {
    return new ArrayList<>(columns.keySet());
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  /**
   * @throws IllegalArgumentException
   *           if there is no such column.
   */
  public Column<?> getColumn(String name) throws IllegalArgumentException {
    Column<?> res = columns.get(name);
    if (res == null)
      throw new IllegalArgumentException("Table has no column '" + name + "'");
    return res;
  }

  public ColumnType<?> getColumnType(String name) throws IllegalArgumentException {
    return getColumn(name).getType();
  }

  /**
   * Typed access to the values of a column.
   * 
   * @throws IllegalArgumentException
   *           if there is no such column or its type is not the requested one.
   */
  @SuppressWarnings("unchecked")
  public <T> List<T> getColumnValues(String name, ColumnType<T> type) throws IllegalArgumentException {
    Column<?> col = getColumn(name);
    if (col.getType() != type)
      throw new IllegalArgumentException(
          "Column '" + name + "' is of type " + col.getType() + ", requested was " + type);
    return ((Column<T>) col).getValues();
  }

  public ColumnEntityIds getColumnEntityIds(String name) throws IllegalArgumentException {
    return getColumn(name).getEntityIds();
  }

  public RowDescriptor getRowDescriptor(int row) {
    Preconditions.checkElementIndex(row, rows.size());
    return rows.get(row);
  }

  public List<RowDescriptor> getRowDescriptors() {
    return rows;
  }

  /**
   * @return The TimeFrame the row descriptors are relative to.
   */
  public TimeFrame getTimeFrame() {
    return timeFrame;
  }

  @Override
  public String toString() {
    return "TableView[rows=" + rows.size() + ",columns=" + columns.keySet() + "]";
  }
}
