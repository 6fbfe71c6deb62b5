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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.chronoqube.computer.adapter.PointComponentAdapter.Component;
import org.chronoqube.data.raw.LineSeries;
import org.chronoqube.data.raw.Point;
import org.chronoqube.data.raw.PointSeries;
import org.chronoqube.data.source.AnalogSource;
import org.chronoqube.data.source.Line;
import org.chronoqube.data.source.LineSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link PointComponentAdapter} and {@link LineSeriesAdapter}.
 *
 * @author The chronoqube authors
 */
public class PointComponentAdapterTest {
  private static final TimeFrame FRAME = TimeFrame.ofRange(0, 5, 1);

  private PointSeries points() {
    Map<TimeFrameIndex, List<Point>> p = new HashMap<>();
    p.put(TimeFrameIndex.of(1), Arrays.asList(new Point(1f, 10f), new Point(2f, 20f)));
    p.put(TimeFrameIndex.of(2), Collections.emptyList());
    p.put(TimeFrameIndex.of(4), Arrays.asList(new Point(4f, 40f)));
    return new PointSeries(FRAME, p);
  }

  @Test
  public void firstPointPerIndex() {
    // WHEN
    AnalogSource x = PointComponentAdapter.adapt(points(), Component.X, "px");
    AnalogSource y = PointComponentAdapter.adapt(points(), Component.Y, "py");

    // THEN
    Assert.assertEquals(x.getName(), "px", "Wrong name");
    Assert.assertEquals(x.getSampleCount(), 2, "Expected samples only at indices with points");
    Assert.assertEquals(x.getValueAt(TimeFrameIndex.of(1), FRAME), 1., "Expected x of first point");
    Assert.assertEquals(y.getValueAt(TimeFrameIndex.of(1), FRAME), 10., "Expected y of first point");
    Assert.assertEquals(y.getValueAt(TimeFrameIndex.of(4), FRAME), 40., "Wrong y");
    Assert.assertTrue(Double.isNaN(x.getValueAt(TimeFrameIndex.of(2), FRAME)), "Expected NaN without points");
    Assert.assertSame(x.getTimeFrame(), FRAME, "Expected TimeFrame of the points");
  }

  @Test
  public void lineEntityIdsInIndexOrder() {
    // GIVEN
    Map<TimeFrameIndex, List<Line>> l = new HashMap<>();
    l.put(TimeFrameIndex.of(3), Arrays.asList(Line.of(0f, 0f, 1f, 1f)));
    l.put(TimeFrameIndex.of(1), Arrays.asList(Line.of(0f, 0f, 2f, 0f), Line.of(0f, 0f, 0f, 3f)));

    // WHEN
    LineSource source = LineSeriesAdapter.adapt(new LineSeries(FRAME, l), "whiskers");

    // THEN
    Assert.assertEquals(source.getEntityCountAt(TimeFrameIndex.of(1), FRAME), 2, "Wrong line count");
    Assert.assertEquals(source.getLinesAt(TimeFrameIndex.of(1), FRAME).get(1).getEntityId(), 1L, "Wrong entity id");
    Assert.assertEquals(source.getLinesAt(TimeFrameIndex.of(3), FRAME).get(0).getEntityId(), 2L, "Wrong entity id");
    Assert.assertTrue(source.getLinesAt(TimeFrameIndex.of(2), FRAME).isEmpty(), "Expected no lines");
  }
}
