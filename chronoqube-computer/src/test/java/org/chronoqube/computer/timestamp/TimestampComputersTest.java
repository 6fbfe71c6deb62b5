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
package org.chronoqube.computer.timestamp;

import java.util.Arrays;
import java.util.List;

import org.chronoqube.computer.MultiComputerResult;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.source.memory.ArrayAnalogSource;
import org.chronoqube.data.source.memory.ListIntervalSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.data.time.TimeFrameInterval;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests the computers in the timestamp package.
 *
 * @author The chronoqube authors
 */
public class TimestampComputersTest {
  private static final TimeFrame FINE = TimeFrame.ofRange(0, 100, 1);
  private static final TimeFrame COARSE = TimeFrame.ofRange(0, 100, 2);

  private ExecutionPlan plan(TimeFrame frame, long... indices) {
    TimeFrameIndex[] res = new TimeFrameIndex[indices.length];
    for (int i = 0; i < indices.length; i++)
      res[i] = TimeFrameIndex.of(indices[i]);
    return ExecutionPlan.ofIndices(Arrays.asList(res), frame);
  }

  @Test
  public void valueLookupReturnsNaNWithoutSample() {
    // GIVEN
    ArrayAnalogSource source = new ArrayAnalogSource("signal", COARSE, new long[] { 0, 5 }, new float[] { 1f, 2f });

    // WHEN
    List<Double> res = new TimestampValueComputer(source).compute(plan(FINE, 0, 10, 4)).getValues();

    // THEN
    Assert.assertEquals(res.get(0), 1., 1e-9, "Wrong value at time 0");
    Assert.assertEquals(res.get(1), 2., 1e-9, "Wrong value at time 10");
    Assert.assertTrue(Double.isNaN(res.get(2)), "Expected NaN at time 4");
  }

  @Test
  public void valueLookupOutsideCallerFrameIsNaNInAnyFrame() {
    // GIVEN
    // COARSE index 50 is time 100, the last time of both frames
    ArrayAnalogSource source = new ArrayAnalogSource("signal", COARSE, new long[] { 50 }, new float[] { 7f });

    // WHEN
    List<Double> crossFrame = new TimestampValueComputer(source).compute(plan(FINE, 100, 150)).getValues();
    List<Double> sameFrame = new TimestampValueComputer(source).compute(plan(COARSE, 50, 75)).getValues();

    // THEN
    Assert.assertEquals(crossFrame.get(0), 7., 1e-9, "Wrong value at last index of caller frame");
    Assert.assertTrue(Double.isNaN(crossFrame.get(1)), "Expected NaN past the end of a different caller frame");
    Assert.assertEquals(sameFrame.get(0), 7., 1e-9, "Wrong value at last index of source frame");
    Assert.assertTrue(Double.isNaN(sameFrame.get(1)), "Expected NaN past the end of the source frame");
  }

  @Test
  public void timestampInIntervalAcrossFrames() {
    // GIVEN
    // times [4,8] and [20,20]
    ListIntervalSource source = ListIntervalSource.ofIntervals("periods", COARSE,
        Arrays.asList(TimeFrameInterval.of(10, 10), TimeFrameInterval.of(2, 4)));

    // WHEN
    List<Boolean> res = new TimestampInIntervalComputer(source).compute(plan(FINE, 3, 4, 8, 9, 20, 21)).getValues();

    // THEN
    Assert.assertEquals(res, Arrays.asList(false, true, true, false, true, false), "Wrong membership");
  }

  @Test
  public void nestedIntervalsDoNotHideOuterOnes() {
    // GIVEN
    ListIntervalSource source = ListIntervalSource.ofIntervals("periods", FINE,
        Arrays.asList(TimeFrameInterval.of(0, 50), TimeFrameInterval.of(10, 12)));

    // WHEN
    List<Boolean> res = new TimestampInIntervalComputer(source).compute(plan(FINE, 13, 51)).getValues();

    // THEN
    Assert.assertEquals(res, Arrays.asList(true, false), "Wrong membership");
  }

  @Test
  public void offsets() {
    // GIVEN
    ArrayAnalogSource source = new ArrayAnalogSource("signal", FINE, new float[] { 0f, 10f, 20f, 30f, 40f });
    AnalogTimestampOffsetsMultiComputer computer =
        new AnalogTimestampOffsetsMultiComputer(source, Arrays.asList(-1, 0, 2));

    // WHEN
    MultiComputerResult<Double> res = computer.computeBatch(plan(FINE, 1, 3));

    // THEN
    Assert.assertEquals(computer.getOutputSuffixes(), Arrays.asList("t-1", "t+0", "t+2"), "Wrong suffixes");
    Assert.assertEquals(res.getValues().get(0), Arrays.asList(0., 20.), "Wrong values at offset -1");
    Assert.assertEquals(res.getValues().get(1), Arrays.asList(10., 30.), "Wrong values at offset 0");
    Assert.assertEquals(res.getValues().get(2).get(0), 30., 1e-9, "Wrong value at offset 2");
    Assert.assertTrue(Double.isNaN(res.getValues().get(2).get(1)), "Expected NaN after last sample");
  }
}
