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
package org.chronoqube.computer.analog;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.source.memory.ArrayAnalogSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameInterval;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link AnalogSliceGathererComputer}.
 *
 * @author The chronoqube authors
 */
public class AnalogSliceGathererComputerTest {
  private static final TimeFrame SOURCE_FRAME = TimeFrame.ofRange(0, 100, 10);
  private static final TimeFrame CALLER_FRAME = TimeFrame.ofRange(0, 100, 1);

  private ArrayAnalogSource source() {
    float[] values = new float[11];
    for (int i = 0; i < values.length; i++)
      values[i] = i * 1.5f;
    return new ArrayAnalogSource("voltage", SOURCE_FRAME, values);
  }

  @Test
  public void doubleSlicesAcrossFrames() {
    // GIVEN
    AnalogSliceGathererComputer<List<Double>> computer =
        new AnalogSliceGathererComputer<>(source(), ColumnType.DOUBLE_VECTOR);
    // 15 is exactly between samples at 10 and 20 and resolves to the earlier one.
    ExecutionPlan plan = ExecutionPlan.ofIntervals(
        Arrays.asList(TimeFrameInterval.of(15, 42), TimeFrameInterval.of(100, 100)), CALLER_FRAME);

    // WHEN
    List<List<Double>> res = computer.compute(plan).getValues();

    // THEN
    Assert.assertEquals(res.get(0), Arrays.asList(1.5, 3., 4.5, 6.), "Wrong first slice");
    Assert.assertEquals(res.get(1), Arrays.asList(15.), "Wrong last slice");
  }

  @Test
  public void floatSlicesSameFrame() {
    // GIVEN
    AnalogSliceGathererComputer<List<Float>> computer =
        new AnalogSliceGathererComputer<>(source(), ColumnType.FLOAT_VECTOR);
    ExecutionPlan plan = ExecutionPlan.ofIntervals(Arrays.asList(TimeFrameInterval.of(2, 3)), SOURCE_FRAME);

    // WHEN
    List<List<Float>> res = computer.compute(plan).getValues();

    // THEN
    Assert.assertEquals(res, Collections.singletonList(Arrays.asList(3f, 4.5f)), "Wrong slice");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void scalarOutputRejected() {
    new AnalogSliceGathererComputer<>(source(), ColumnType.DOUBLE);
  }
}
