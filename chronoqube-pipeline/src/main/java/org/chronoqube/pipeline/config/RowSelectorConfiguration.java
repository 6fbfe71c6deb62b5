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

import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.time.TimeFrameInterval;

import com.google.common.collect.ImmutableList;

/**
 * The <code>row_selector</code> of a table configuration.
 * 
 * <p>
 * Depending on the type, rows are either taken from a named source or given literally. Literal rows are relative to
 * the named TimeFrame, or to the default TimeFrame if none is named.
 *
 * @author The chronoqube authors
 */
public final class RowSelectorConfiguration {
  private final RowSelectorType type;
  private final String source;
  private final String timeFrame;
  private final List<TimeFrameInterval> intervals;
  private final List<Long> timestamps;

  public RowSelectorConfiguration(RowSelectorType type, String source, String timeFrame,
      List<TimeFrameInterval> intervals, List<Long> timestamps) {
    this.type = type;
    this.source = source;
    this.timeFrame = timeFrame;
    this.intervals = intervals == null ? null : ImmutableList.copyOf(intervals);
    this.timestamps = timestamps == null ? null : ImmutableList.copyOf(timestamps);
  }

  public RowSelectorType getType() {
    return type;
  }

  /**
   * @return Name of the source (or TimeFrame) to take all rows from, <code>null</code> if rows are given literally.
   */
  public String getSource() {
    return source;
  }

  /**
   * @return Key of the TimeFrame of literal rows, <code>null</code> to use the default.
   */
  public String getTimeFrame() {
    return timeFrame;
  }

  /**
   * @return Literal intervals or <code>null</code>.
   */
  public List<TimeFrameInterval> getIntervals() {
    return intervals;
  }

  /**
   * @return Literal timestamps (or indices for index selectors), or <code>null</code>.
   */
  public List<Long> getTimestamps() {
    return timestamps;
  }
}
