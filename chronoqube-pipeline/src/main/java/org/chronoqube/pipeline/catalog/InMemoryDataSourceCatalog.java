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
package org.chronoqube.pipeline.catalog;

import java.util.HashMap;
import java.util.Map;

import org.chronoqube.data.source.AnalogSource;
import org.chronoqube.data.source.DataSource;
import org.chronoqube.data.source.EventSource;
import org.chronoqube.data.source.IntervalSource;
import org.chronoqube.data.source.LineSource;
import org.chronoqube.data.time.TimeFrame;

import com.google.common.base.Preconditions;

/**
 * {@link DataSourceCatalog} holding everything in maps. Sources are registered under their name.
 *
 * @author The chronoqube authors
 */
public class InMemoryDataSourceCatalog implements DataSourceCatalog {
  private final Map<String, AnalogSource> analogSources = new HashMap<>();
  private final Map<String, EventSource> eventSources = new HashMap<>();
  private final Map<String, IntervalSource> intervalSources = new HashMap<>();
  private final Map<String, LineSource> lineSources = new HashMap<>();
  private final Map<String, TimeFrame> timeFrames = new HashMap<>();
  private final Map<String, Object> rawData = new HashMap<>();

  /**
   * Registers a source under its name.
   */
  public InMemoryDataSourceCatalog addSource(DataSource source) {
    Preconditions.checkNotNull(source);
    switch (source.getKind()) {
    case ANALOG:
      analogSources.put(source.getName(), (AnalogSource) source);
      break;
    case EVENT:
      eventSources.put(source.getName(), (EventSource) source);
      break;
    case INTERVAL:
      intervalSources.put(source.getName(), (IntervalSource) source);
      break;
    case LINE:
      lineSources.put(source.getName(), (LineSource) source);
      break;
    }
    return this;
  }

  public InMemoryDataSourceCatalog addTimeFrame(String key, TimeFrame timeFrame) {
    timeFrames.put(key, Preconditions.checkNotNull(timeFrame));
    return this;
  }

  public InMemoryDataSourceCatalog addRawData(String key, Object data) {
    rawData.put(key, Preconditions.checkNotNull(data));
    return this;
  }

  @Override
  public AnalogSource getAnalogSource(String key) {
    return analogSources.get(key);
  }

  @Override
  public EventSource getEventSource(String key) {
    return eventSources.get(key);
  }

  @Override
  public IntervalSource getIntervalSource(String key) {
    return intervalSources.get(key);
  }

  @Override
  public LineSource getLineSource(String key) {
    return lineSources.get(key);
  }

  @Override
  public TimeFrame getTimeFrame(String key) {
    return timeFrames.get(key);
  }

  @Override
  public Object getRawData(String key) {
    return rawData.get(key);
  }
}
