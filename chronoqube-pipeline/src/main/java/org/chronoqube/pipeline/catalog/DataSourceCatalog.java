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

import org.chronoqube.data.source.AnalogSource;
import org.chronoqube.data.source.EventSource;
import org.chronoqube.data.source.IntervalSource;
import org.chronoqube.data.source.LineSource;
import org.chronoqube.data.time.TimeFrame;

/**
 * Provides the sources, TimeFrames and raw data a pipeline refers to by key.
 * 
 * <p>
 * All lookup methods return <code>null</code> if there is nothing of the requested kind under that key.
 *
 * @author The chronoqube authors
 */
public interface DataSourceCatalog {
  AnalogSource getAnalogSource(String key);

  EventSource getEventSource(String key);

  IntervalSource getIntervalSource(String key);

  LineSource getLineSource(String key);

  TimeFrame getTimeFrame(String key);

  /**
   * @return Raw data that needs an adapter to become a source, e.g. a {@link org.chronoqube.data.raw.PointSeries}.
   */
  Object getRawData(String key);
}
