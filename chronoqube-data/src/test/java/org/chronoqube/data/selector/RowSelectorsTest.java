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
package org.chronoqube.data.selector;

import java.util.Arrays;
import java.util.Collections;

import org.chronoqube.data.plan.RowKind;
import org.chronoqube.data.source.memory.ArrayEventSource;
import org.chronoqube.data.source.memory.ListIntervalSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.data.time.TimeFrameInterval;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link RowSelectors}.
 *
 * @author The chronoqube authors
 */
public class RowSelectorsTest {
  private static final TimeFrame FRAME = TimeFrame.ofRange(0, 20, 2);

  @Test
  public void selectorFromIntervalSourceUsesSourceFrame() {
    // GIVEN
    ListIntervalSource source =
        ListIntervalSource.ofIntervals("trials", FRAME, Arrays.asList(TimeFrameInterval.of(1, 2)));

    // WHEN
    IntervalSelector selector = RowSelectors.fromIntervalSource(source);

    // THEN
    Assert.assertSame(selector.getTimeFrame(), FRAME, "Expected frame of source");
    Assert.assertEquals(selector.toExecutionPlan().getRowKind(), RowKind.INTERVALS, "Expected interval plan");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void emptyIntervalSourceFails() {
    RowSelectors.fromIntervalSource(ListIntervalSource.ofIntervals("trials", FRAME, Collections.emptyList()));
  }

  @Test
  public void selectorFromEventsTruncates() {
    // GIVEN
    ArrayEventSource source = new ArrayEventSource("licks", FRAME, new double[] { 1.7, 3 });

    // WHEN
    TimestampSelector selector = RowSelectors.fromEventSource(source);

    // THEN
    Assert.assertEquals(selector.getIndices().get(0), TimeFrameIndex.of(1), "Expected truncated event position");
    Assert.assertEquals(selector.getRowCount(), 2, "Expected one row per event");
  }

  @Test
  public void selectorFromEventsKeepsLargeIndices() {
    // GIVEN
    ArrayEventSource source = new ArrayEventSource("spikes", FRAME, new double[] { 16_777_217, 16_777_219.5 });

    // WHEN
    TimestampSelector selector = RowSelectors.fromEventSource(source);

    // THEN
    Assert.assertEquals(selector.getIndices(),
        Arrays.asList(TimeFrameIndex.of(16_777_217), TimeFrameIndex.of(16_777_219)),
        "Expected exact indices above 2^24");
  }

  @Test
  public void selectorFromTimeFrameHasAllIndices() {
    // WHEN
    TimestampSelector selector = RowSelectors.fromTimeFrame(FRAME);

    // THEN
    Assert.assertEquals(selector.getRowCount(), 11, "Expected one row per index");
  }

  @Test
  public void indexRowsFeedTimestampComputers() {
    Assert.assertTrue(RowSelectorType.INDEX.canFeed(RowSelectorType.TIMESTAMP), "Index should feed timestamp");
    Assert.assertFalse(RowSelectorType.TIMESTAMP.canFeed(RowSelectorType.INTERVAL), "Timestamp must not feed interval");
    Assert.assertFalse(RowSelectorType.INTERVAL.canFeed(RowSelectorType.TIMESTAMP), "Interval must not feed timestamp");
  }
}
