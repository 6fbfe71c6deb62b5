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
 * Informed about the progress of {@link TablePipeline#execute(ProgressCallback)}. Called on the thread executing the
 * pipeline; throwing from the callback aborts the current table.
 *
 * @author The chronoqube authors
 */
public interface ProgressCallback {
  /**
   * @param tableIndex
   *          index of the table currently being built.
   * @param tableProgress
   *          percentage of the columns of the current table that are built.
   * @param overallProgress
   *          percentage of the tables that are built.
   */
  void progress(int tableIndex, String tableName, int tableProgress, int overallProgress);
}
