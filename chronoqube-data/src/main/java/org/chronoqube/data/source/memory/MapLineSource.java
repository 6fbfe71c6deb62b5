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
package org.chronoqube.data.source.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.chronoqube.data.source.Line;
import org.chronoqube.data.source.LineSource;
import org.chronoqube.data.source.LineWithId;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * {@link LineSource} backed by a map from index to the lines at that index.
 *
 * @author The chronoqube authors
 */
public class MapLineSource implements LineSource {
  private final String name;
  private final TimeFrame timeFrame;
  private final NavigableMap<TimeFrameIndex, List<LineWithId>> lines = new TreeMap<>();

  public MapLineSource(String name, TimeFrame timeFrame, Map<TimeFrameIndex, List<LineWithId>> lines) {
    this.name = Preconditions.checkNotNull(name);
    this.timeFrame = Preconditions.checkNotNull(timeFrame, "TimeFrame of source %s must not be null", name);
    for (Map.Entry<TimeFrameIndex, List<LineWithId>> e : lines.entrySet())
      if (!e.getValue().isEmpty())
        this.lines.put(e.getKey(), ImmutableList.copyOf(e.getValue()));
  }

  /**
   * Creates a source whose entity ids are assigned sequentially over all lines, in index order.
   */
  public static MapLineSource ofLines(String name, TimeFrame timeFrame, Map<TimeFrameIndex, List<Line>> lines) {
    Map<TimeFrameIndex, List<LineWithId>> withIds = new TreeMap<>();
    long nextId = 0;
    for (Map.Entry<TimeFrameIndex, List<Line>> e : new TreeMap<>(lines).entrySet()) {
      List<LineWithId> l = new ArrayList<>();
      for (Line line : e.getValue())
        l.add(new LineWithId(line, nextId++));
      withIds.put(e.getKey(), l);
    }
    return new MapLineSource(name, timeFrame, withIds);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public TimeFrame getTimeFrame() {
    return timeFrame;
  }

  @Override
  public List<LineWithId> getLinesAt(TimeFrameIndex index, TimeFrame callerFrame) {
    if (!callerFrame.contains(index))
      return Collections.emptyList();
    List<LineWithId> res = lines.get(timeFrame.convertIndex(index, callerFrame));
    if (res == null)
      return Collections.emptyList();
    return res;
  }
}
