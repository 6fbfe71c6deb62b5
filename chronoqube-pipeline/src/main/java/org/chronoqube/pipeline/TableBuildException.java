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
package org.chronoqube.pipeline;

/**
 * A table of a pipeline could not be built.
 *
 * @author The chronoqube authors
 */
public class TableBuildException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String columnName;

  public TableBuildException(String msg) {
    this(null, msg, null);
  }

  public TableBuildException(String columnName, String msg) {
    this(columnName, msg, null);
  }

  public TableBuildException(String columnName, String msg, Throwable cause) {
    super(msg, cause);
    this.columnName = columnName;
  }

  /**
   * @return Name of the column that failed or <code>null</code> if the failure is not specific to a column.
   */
  public String getColumnName() {
    return columnName;
  }
}
