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
package org.chronoqube.computer.line;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.chronoqube.computer.ComputerResult;
import org.chronoqube.computer.MultiComputerResult;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowId;
import org.chronoqube.data.source.Line;
import org.chronoqube.data.source.memory.MapLineSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link LineSamplingMultiComputer} and {@link LineTimestampComputer}.
 *
 * @author The chronoqube authors
 */
public class LineSamplingMultiComputerTest {
  private static final TimeFrame FRAME = TimeFrame.ofRange(0, 10, 1);

  private MapLineSource source;

  @BeforeMethod
  public void setUp() {
    Map<TimeFrameIndex, List<Line>> lines = new HashMap<>();
    lines.put(TimeFrameIndex.of(1), Arrays.asList(Line.of(0, 0, 10, 0)));
    lines.put(TimeFrameIndex.of(2), Arrays.asList(Line.of(0, 0, 0, 4, 3, 4), Line.of(5, 5)));
    source = MapLineSource.ofLines("whisker", FRAME, lines);
  }

  @Test
  public void suffixes() {
    // WHEN
    LineSamplingMultiComputer computer = new LineSamplingMultiComputer(source, 2);

    // THEN
    Assert.assertEquals(computer.getOutputSuffixes(),
        Arrays.asList("x@0.000", "y@0.000", "x@0.500", "y@0.500", "x@1.000", "y@1.000"), "Wrong suffixes");
  }

  @Test
  public void sampleAlongArcLength() {
    // GIVEN
    LineSamplingMultiComputer computer = new LineSamplingMultiComputer(source, 2);
    ExecutionPlan plan = ExecutionPlan.ofRows(Arrays.asList(new RowId(TimeFrameIndex.of(1), 0),
        new RowId(TimeFrameIndex.of(2), 0), new RowId(TimeFrameIndex.of(2), 1)), FRAME);

    // WHEN
    MultiComputerResult<Double> res = computer.computeBatch(plan);

    // THEN
    Assert.assertEquals(res.getValues().get(2).get(0), 5., 1e-6, "Expected midpoint x of horizontal line");
    Assert.assertEquals(res.getValues().get(3).get(0), 0., 1e-6, "Expected midpoint y of horizontal line");
    // length 7, midpoint at 3.5 on the first segment
    Assert.assertEquals(res.getValues().get(2).get(1), 0., 1e-6, "Wrong midpoint x of bent line");
    Assert.assertEquals(res.getValues().get(3).get(1), 3.5, 1e-6, "Wrong midpoint y of bent line");
    Assert.assertEquals(res.getValues().get(4).get(1), 3., 1e-6, "Wrong end x of bent line");
    Assert.assertEquals(res.getValues().get(5).get(2), 5., 1e-6, "Expected single point line to stay at point");
    Assert.assertEquals(res.getEntityIds().getIdsOfRow(2), Arrays.asList(2L), "Wrong entity id");
  }

  @Test
  public void indexPlanUsesFirstEntityAndZeroFills() {
    // GIVEN
    LineSamplingMultiComputer computer = new LineSamplingMultiComputer(source, 1);
    ExecutionPlan plan = ExecutionPlan.ofIndices(Arrays.asList(TimeFrameIndex.of(0), TimeFrameIndex.of(1)), FRAME);

    // WHEN
    MultiComputerResult<Double> res = computer.computeBatch(plan);

    // THEN
    Assert.assertEquals(res.getValues().get(2), Arrays.asList(0., 10.), "Expected zero fill and end x");
    Assert.assertTrue(res.getEntityIds().getIdsOfRow(0).isEmpty(), "Expected no entity without line");
  }

  @Test
  public void lineTimestamp() {
    // GIVEN
    LineTimestampComputer computer = new LineTimestampComputer(source);
    ExecutionPlan plan = ExecutionPlan.ofRows(Arrays.asList(new RowId(TimeFrameIndex.of(2), 1),
        new RowId(TimeFrameIndex.of(3), 0)), FRAME);

    // WHEN
    ComputerResult<Long> res = computer.compute(plan);

    // THEN
    Assert.assertEquals(res.getValues(), Arrays.asList(2L, 0L), "Wrong timestamps");
    Assert.assertEquals(computer.getEntityCountAt(TimeFrameIndex.of(2), FRAME), 2, "Wrong entity count");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void zeroSegmentsFail() {
    new LineSamplingMultiComputer(source, 0);
  }
}
