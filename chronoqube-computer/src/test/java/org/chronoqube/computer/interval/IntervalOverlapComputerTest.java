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
package org.chronoqube.computer.interval;

import java.util.Arrays;
import java.util.List;

import org.chronoqube.computer.ComputerResult;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.source.IntervalWithId;
import org.chronoqube.data.source.memory.ListIntervalSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameInterval;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link IntervalOverlapComputer}.
 *
 * @author The chronoqube authors
 */
public class IntervalOverlapComputerTest {
  private static final TimeFrame FRAME = TimeFrame.ofRange(0, 20, 1);

  @Test
  public void countOverlaps() {
    // GIVEN
    ListIntervalSource source = ListIntervalSource.ofIntervals("col", FRAME,
        Arrays.asList(TimeFrameInterval.of(1, 3), TimeFrameInterval.of(6, 8)));
    ExecutionPlan plan = ExecutionPlan.ofIntervals(
        Arrays.asList(TimeFrameInterval.of(0, 2), TimeFrameInterval.of(2, 4), TimeFrameInterval.of(9, 9),
            TimeFrameInterval.of(3, 6)), FRAME);

    // WHEN
    ComputerResult<Long> res = new IntervalOverlapComputer(source, OverlapOperation.COUNT_OVERLAPS).compute(plan);

    // THEN
    Assert.assertEquals(res.getValues(), Arrays.asList(1L, 1L, 0L, 2L), "Wrong overlap counts");
    Assert.assertEquals(res.getEntityIds().getIdsOfRow(3), Arrays.asList(0L, 1L), "Wrong overlapping ids");
  }

  @Test
  public void assignIdTakesLastContainingInterval() {
    // GIVEN
    ListIntervalSource source = new ListIntervalSource("col", FRAME,
        Arrays.asList(new IntervalWithId(TimeFrameInterval.of(0, 10), 100),
            new IntervalWithId(TimeFrameInterval.of(2, 6), 200)));
    ExecutionPlan plan = ExecutionPlan.ofIntervals(
        Arrays.asList(TimeFrameInterval.of(3, 4), TimeFrameInterval.of(8, 9), TimeFrameInterval.of(9, 12)), FRAME);

    // WHEN
    ComputerResult<Long> ids = new IntervalOverlapComputer(source, OverlapOperation.ASSIGN_ID).compute(plan);
    List<Long> starts = new IntervalOverlapComputer(source, OverlapOperation.ASSIGN_ID_START).compute(plan).getValues();
    List<Long> ends = new IntervalOverlapComputer(source, OverlapOperation.ASSIGN_ID_END).compute(plan).getValues();

    // THEN
    Assert.assertEquals(ids.getValues(), Arrays.asList(1L, 0L, -1L), "Wrong assigned ids");
    Assert.assertEquals(ids.getEntityIds().getIdsOfRow(0), Arrays.asList(200L), "Wrong entity id");
    Assert.assertEquals(starts, Arrays.asList(2L, 0L, -1L), "Wrong starts");
    Assert.assertEquals(ends, Arrays.asList(6L, 10L, -1L), "Wrong ends");
  }

  @Test
  public void overlapsAreComparedInAbsoluteTime() {
    // GIVEN
    TimeFrame coarse = TimeFrame.ofRange(0, 20, 2);
    // [4,6] in time
    ListIntervalSource source =
        ListIntervalSource.ofIntervals("col", coarse, Arrays.asList(TimeFrameInterval.of(2, 3)));
    ExecutionPlan plan =
        ExecutionPlan.ofIntervals(Arrays.asList(TimeFrameInterval.of(6, 7), TimeFrameInterval.of(7, 8)), FRAME);

    // WHEN
    List<Long> res = new IntervalOverlapComputer(source, OverlapOperation.COUNT_OVERLAPS).compute(plan).getValues();

    // THEN
    Assert.assertEquals(res, Arrays.asList(1L, 0L), "Wrong overlap counts");
  }
}
