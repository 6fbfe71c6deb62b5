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

import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.source.memory.ArrayAnalogSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameInterval;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

/**
 * Tests {@link IntervalReductionComputer}.
 *
 * @author The chronoqube authors
 */
public class IntervalReductionComputerTest {
  private static final TimeFrame FRAME = TimeFrame.ofRange(0, 20, 1);

  private ArrayAnalogSource source;
  private ExecutionPlan plan;

  @BeforeMethod
  public void setUp() {
    // samples only at indices 0..9
    source = new ArrayAnalogSource("signal", FRAME, new float[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 });
    plan = ExecutionPlan.ofIntervals(Arrays.asList(TimeFrameInterval.of(0, 3), TimeFrameInterval.of(5, 5),
        TimeFrameInterval.of(15, 18)), FRAME);
  }

  @DataProvider(name = "reductions")
  public Object[][] reductions() {
    return new Object[][] { //
        { ReductionType.MEAN, new double[] { 2.5, 6., Double.NaN } }, //
        { ReductionType.MAX, new double[] { 4., 6., Double.NaN } }, //
        { ReductionType.MIN, new double[] { 1., 6., Double.NaN } }, //
        { ReductionType.SUM, new double[] { 10., 6., 0. } }, //
        { ReductionType.COUNT, new double[] { 4., 1., 0. } }, //
        { ReductionType.STD_DEV, new double[] { Math.sqrt(1.25), 0., Double.NaN } }, //
    };
  }

  @Test(dataProvider = "reductions")
  public void reduce(ReductionType type, double[] expected) {
    // WHEN
    List<Double> res = new IntervalReductionComputer(source, type).compute(plan).getValues();

    // THEN
    Assert.assertEquals(res.size(), expected.length, "Wrong number of rows");
    for (int i = 0; i < expected.length; i++) {
      if (Double.isNaN(expected[i]))
        Assert.assertTrue(Double.isNaN(res.get(i)), "Expected NaN for empty interval, row " + i);
      else
        Assert.assertEquals(res.get(i), expected[i], 1e-6, "Wrong " + type + " in row " + i);
    }
  }
}
