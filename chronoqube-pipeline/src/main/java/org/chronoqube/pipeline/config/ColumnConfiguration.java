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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * One entry of the <code>columns</code> of a table configuration.
 *
 * @author The chronoqube authors
 */
public final class ColumnConfiguration {
  private final String name;
  private final String computer;
  private final DataSourceReference dataSource;
  private final Map<String, String> parameters;

  public ColumnConfiguration(String name, String computer, DataSourceReference dataSource,
      Map<String, String> parameters) {
    this.name = name;
    this.computer = computer;
    this.dataSource = dataSource;
    this.parameters = ImmutableMap.copyOf(parameters);
  }

  public String getName() {
    return name;
  }

  public String getComputer() {
    return computer;
  }

  public DataSourceReference getDataSource() {
    return dataSource;
  }

  /**
   * @return Parameters of the computer. Values that were no strings in the JSON are contained as JSON text.
   */
  public Map<String, String> getParameters() {
    return parameters;
  }
}
