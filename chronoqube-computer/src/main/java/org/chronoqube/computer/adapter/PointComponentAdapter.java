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
package org.chronoqube.computer.adapter;

import java.util.List;
import java.util.Map;

import org.chronoqube.data.raw.Point;
import org.chronoqube.data.raw.PointSeries;
import org.chronoqube.data.source.AnalogSource;
import org.chronoqube.data.source.memory.ArrayAnalogSource;
import org.chronoqube.data.time.TimeFrameIndex;

/**
 * Exposes one coordinate of {@link PointSeries} as {@link AnalogSource}. Each index having at least one point gets a
 * sample, which is the coordinate of the first point at that index.
 *
 * @author The chronoqube authors
 */
public class PointComponentAdapter {
  /**
   * Coordinate of a point.
   */
  public enum Component {
    X, Y;
  }

  private PointComponentAdapter() {

  }

  public static AnalogSource adapt(PointSeries points, Component component, String sourceName) {
    int size = 0;
    for (List<Point> p : points.getPoints().values())
      if (!p.isEmpty())
        size++;

    long[] indices = new long[size];
    float[] values = new float[size];
    int pos = 0;
    for (Map.Entry<TimeFrameIndex, List<Point>> e : points.getPoints().entrySet()) {
      if (e.getValue().isEmpty())
        continue;
      Point first = e.getValue().get(0);
      indices[pos] = e.getKey().getValue();
      values[pos] = (component == Component.X) ? first.getX() : first.getY();
      pos++;
    }
    return new ArrayAnalogSource(sourceName, points.getTimeFrame(), indices, values);
  }
}
