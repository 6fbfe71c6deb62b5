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
package org.chronoqube.pipeline.config;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A validated description of one table: its id, the rows, the columns and transforms that derive further tables from
 * it.
 *
 * @author The chronoqube authors
 */
public final class TableConfiguration {
  private final String tableId;
  private final String name;
  private final String description;
  private final List<String> tags;
  private final RowSelectorConfiguration rowSelector;
  private final List<ColumnConfiguration> columns;
  private final List<TransformConfiguration> transforms;

  public TableConfiguration(String tableId, String name, String description, List<String> tags,
      RowSelectorConfiguration rowSelector, List<ColumnConfiguration> columns,
      List<TransformConfiguration> transforms) {
    this.tableId = tableId;
    this.name = name;
    this.description = description;
    this.tags = ImmutableList.copyOf(tags);
    this.rowSelector = rowSelector;
    this.columns = ImmutableList.copyOf(columns);
    this.transforms = ImmutableList.copyOf(transforms);
  }

  public String getTableId() {
    return tableId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public List<String> getTags() {
    return tags;
  }

  public RowSelectorConfiguration getRowSelector() {
    return rowSelector;
  }

  public List<ColumnConfiguration> getColumns() {
    return columns;
  }

  public List<TransformConfiguration> getTransforms() {
    return transforms;
  }

  @Override
  public String toString() {
    return "TableConfiguration[" + tableId + "]";
  }
}
