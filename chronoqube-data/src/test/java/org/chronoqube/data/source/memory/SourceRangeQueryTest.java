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

import java.util.Arrays;

import org.chronoqube.data.source.IntervalWithId;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.data.time.TimeFrameInterval;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests range queries of the in-memory sources with caller frames different to the source frames.
 *
 * @author The chronoqube authors
 */
public class SourceRangeQueryTest {
  private static final TimeFrame FINE = TimeFrame.ofRange(0, 100, 1);
  private static final TimeFrame COARSE = TimeFrame.ofRange(0, 100, 2);

  @Test
  public void eventsOfCoarseSourceInFineRange() {
    // GIVEN
    ArrayEventSource source = new ArrayEventSource("events", COARSE, new double[] { 2, 6, 20 });

    // WHEN
    double[] res = source.getEventsInRange(TimeFrameIndex.of(10), TimeFrameIndex.of(14), FINE);

    // THEN
    Assert.assertEquals(res, new double[] { 6 }, "Expected event at coarse index 6 (time 12)");
  }

  @Test
  public void analogRangeAndPointLookup() {
    // GIVEN
    ArrayAnalogSource source =
        new ArrayAnalogSource("analog", COARSE, new long[] { 1, 2, 4 }, new float[] { 10f, 20f, 40f });

    // WHEN/THEN
    Assert.assertEquals(source.getDataInRange(TimeFrameIndex.of(2), TimeFrameIndex.of(6), FINE),
        new float[] { 10f, 20f }, "Expected samples at coarse index 1 and 2");
    Assert.assertEquals(source.getValueAt(TimeFrameIndex.of(8), FINE), 40., 1e-9, "Expected sample at coarse 4");
    Assert.assertTrue(Double.isNaN(source.getValueAt(TimeFrameIndex.of(6), FINE)), "Expected NaN without sample");
  }

  @Test
  public void intervalsOverlappingRange() {
    // GIVEN
    ListIntervalSource source = new ListIntervalSource("intervals", FINE, Arrays.asList(
        new IntervalWithId(TimeFrameInterval.of(6, 8), 7), new IntervalWithId(TimeFrameInterval.of(1, 3), 3)));

    // WHEN/THEN
    Assert.assertEquals(source.getIntervals().get(0).getEntityId(), 3L, "Expected intervals sorted by start");
    Assert.assertEquals(source.getIntervalsInRange(TimeFrameIndex.of(3), TimeFrameIndex.of(6), FINE).size(), 2,
        "Expected both intervals to overlap");
    Assert.assertEquals(source.getIntervalsInRange(TimeFrameIndex.of(4), TimeFrameIndex.of(5), FINE).size(), 0,
        "Expected no overlapping interval");
  }
}
