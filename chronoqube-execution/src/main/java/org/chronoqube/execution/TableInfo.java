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

import com.google.common.collect.ImmutableList;

/**
 * Metadata of a table in the {@link TableRegistry}.
 *
 * @author The chronoqube authors
 */
public final class TableInfo {
  private final String id;
  private final String name;
  private final String description;
  private final List<String> tags;
  private final List<String> columnNames;

  public TableInfo(String id, String name, String description, List<String> tags, List<String> columnNames) {
    this.id = id;
    this.name = name;
    this.description = description;
    this.tags = ImmutableList.copyOf(tags);
    this.columnNames = ImmutableList.copyOf(columnNames);
  }

  public String getId() {
    return id;
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

  /**
   * @return Names of the columns of the built table, empty if it was not built yet.
   */
  public List<String> getColumnNames() {
    return columnNames;
  }

  TableInfo withColumnNames(List<String> newColumnNames) {
    return new TableInfo(id, name, description, tags, newColumnNames);
  }

  @Override
  public String toString() {
    return "TableInfo[id=" + id + ",name=" + name + "]";
  }
}
