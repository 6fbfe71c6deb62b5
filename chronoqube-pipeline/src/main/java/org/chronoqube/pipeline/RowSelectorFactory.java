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

import java.util.ArrayList;
import java.util.List;

import org.chronoqube.data.selector.IndexSelector;
import org.chronoqube.data.selector.IntervalSelector;
import org.chronoqube.data.selector.RowSelector;
import org.chronoqube.data.selector.RowSelectors;
import org.chronoqube.data.selector.TimestampSelector;
import org.chronoqube.data.source.EventSource;
import org.chronoqube.data.source.IntervalSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.pipeline.catalog.DataSourceCatalog;
import org.chronoqube.pipeline.config.RowSelectorConfiguration;

/**
 * Creates the {@link RowSelector} of a table from its {@link RowSelectorConfiguration}.
 * 
 * <ul>
 * <li>interval rows with a source: all intervals of that interval source.
 * <li>timestamp rows with a source: all events of that event source, or else all indices of the TimeFrame with that
 * key.
 * <li>literal intervals, timestamps or indices: relative to the given or the default TimeFrame.
 * </ul>
 *
 * @author The chronoqube authors
 */
public class RowSelectorFactory {
  private final DataSourceCatalog catalog;
  private final String defaultTimeFrameKey;

  public RowSelectorFactory(DataSourceCatalog catalog, String defaultTimeFrameKey) {
    this.catalog = catalog;
    this.defaultTimeFrameKey = defaultTimeFrameKey;
  }

  public RowSelector create(RowSelectorConfiguration config) throws TableBuildException {
    try {
      switch (config.getType()) {
      case INTERVAL:
        if (config.getSource() != null) {
          IntervalSource source = catalog.getIntervalSource(config.getSource());
          if (source == null)
            throw new TableBuildException("Cannot resolve interval source '" + config.getSource() + "'");
          return RowSelectors.fromIntervalSource(source);
        }
        return new IntervalSelector(config.getIntervals(), resolveTimeFrame(config.getTimeFrame()));
      case TIMESTAMP:
        if (config.getTimestamps() != null)
          return new TimestampSelector(toIndices(config.getTimestamps()), resolveTimeFrame(config.getTimeFrame()));
        EventSource events = catalog.getEventSource(config.getSource());
        if (events != null)
          return RowSelectors.fromEventSource(events);
        TimeFrame frame = catalog.getTimeFrame(config.getSource());
        if (frame != null)
          return RowSelectors.fromTimeFrame(frame);
        throw new TableBuildException(
            "Cannot resolve '" + config.getSource() + "' as event source or TimeFrame for timestamp rows");
      case INDEX:
      default:
        return new IndexSelector(toIndices(config.getTimestamps()), resolveTimeFrame(config.getTimeFrame()));
      }
    } catch (IllegalArgumentException e) {
      throw new TableBuildException(null, "Invalid row selector: " + e.getMessage(), e);
    }
  }

  private TimeFrame resolveTimeFrame(String key) throws TableBuildException {
    String effectiveKey = key != null ? key : defaultTimeFrameKey;
    TimeFrame res = catalog.getTimeFrame(effectiveKey);
    if (res == null)
      throw new TableBuildException("Cannot resolve TimeFrame '" + effectiveKey + "'"
          + (key == null ? " which is the default TimeFrame" : ""));
    return res;
  }

  private List<TimeFrameIndex> toIndices(List<Long> values) {
    List<TimeFrameIndex> res = new ArrayList<>(values.size());
    for (long v : values)
      res.add(TimeFrameIndex.of(v));
    return res;
  }
}
