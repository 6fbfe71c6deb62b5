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
 * Outcome of building a single table of a pipeline.
 *
 * @author The chronoqube authors
 */
public final class TableBuildResult {
  private final String tableId;
  private final boolean success;
  private final String errorMessage;
  private final int columnsBuilt;
  private final int totalColumns;
  private final double buildTimeMs;

  public TableBuildResult(String tableId, boolean success, String errorMessage, int columnsBuilt, int totalColumns,
      double buildTimeMs) {
    this.tableId = tableId;
    this.success = success;
    this.errorMessage = errorMessage;
    this.columnsBuilt = columnsBuilt;
    this.totalColumns = totalColumns;
    this.buildTimeMs = buildTimeMs;
  }

  public String getTableId() {
    return tableId;
  }

  public boolean isSuccess() {
    return success;
  }

  /**
   * @return <code>null</code> on success.
   */
  public String getErrorMessage() {
    return errorMessage;
  }

  public int getColumnsBuilt() {
    return columnsBuilt;
  }

  public int getTotalColumns() {
    return totalColumns;
  }

  public double getBuildTimeMs() {
    return buildTimeMs;
  }

  @Override
  public String toString() {
    return "TableBuildResult[" + tableId + "," + (success ? "ok" : errorMessage) + "," + columnsBuilt + "/"
        + totalColumns + "]";
  }
}
