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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Outcome of {@link TablePipeline#execute(ProgressCallback)}.
 *
 * @author The chronoqube authors
 */
public final class PipelineResult {
  private final boolean success;
  private final String errorMessage;
  private final int tablesCompleted;
  private final int totalTables;
  private final List<TableBuildResult> tableResults;
  private final double totalTimeMs;

  public PipelineResult(boolean success, String errorMessage, int tablesCompleted, int totalTables,
      List<TableBuildResult> tableResults, double totalTimeMs) {
    this.success = success;
    this.errorMessage = errorMessage;
    this.tablesCompleted = tablesCompleted;
    this.totalTables = totalTables;
    this.tableResults = ImmutableList.copyOf(tableResults);
    this.totalTimeMs = totalTimeMs;
  }

  public boolean isSuccess() {
    return success;
  }

  /**
   * @return Message of the first failed table, <code>null</code> on success.
   */
  public String getErrorMessage() {
    return errorMessage;
  }

  public int getTablesCompleted() {
    return tablesCompleted;
  }

  public int getTotalTables() {
    return totalTables;
  }

  /**
   * @return One entry per table that was attempted, in configuration order.
   */
  public List<TableBuildResult> getTableResults() {
    return tableResults;
  }

  public double getTotalTimeMs() {
    return totalTimeMs;
  }
}
