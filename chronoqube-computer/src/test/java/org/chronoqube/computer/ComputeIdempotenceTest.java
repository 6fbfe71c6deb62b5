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
package org.chronoqube.computer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.chronoqube.computer.registry.BuiltInComputers;
import org.chronoqube.computer.registry.ComputerInfo;
import org.chronoqube.computer.registry.ComputerRegistry;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.DataSourceVariant;
import org.chronoqube.data.source.IntervalWithId;
import org.chronoqube.data.source.Line;
import org.chronoqube.data.source.memory.ArrayAnalogSource;
import org.chronoqube.data.source.memory.ArrayEventSource;
import org.chronoqube.data.source.memory.ListIntervalSource;
import org.chronoqube.data.source.memory.MapLineSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.data.time.TimeFrameInterval;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

/**
 * Validates that all built-in computers return the same values when computing the same plan twice.
 *
 * @author The chronoqube authors
 */
public class ComputeIdempotenceTest {
  private static final TimeFrame FRAME = TimeFrame.ofRange(0, 10, 1);
  private static final ComputerRegistry REGISTRY = BuiltInComputers.buildRegistry();

  private static DataSourceVariant sourceFor(ComputerInfo info) {
    switch (info.getRequiredSourceKind()) {
    case ANALOG:
      return DataSourceVariant
          .of(new ArrayAnalogSource("a", FRAME, new float[] { 1f, 3f, 2f, 5f, 4f, 0f, 7f, 6f, 2f, 1f, 8f }));
    case EVENT:
      return DataSourceVariant.of(new ArrayEventSource("e", FRAME, new double[] { 1, 2.5, 4, 4, 9 }));
    case INTERVAL:
      return DataSourceVariant.of(new ListIntervalSource("i", FRAME, Arrays.asList(
          new IntervalWithId(TimeFrameInterval.of(1, 2), 0), new IntervalWithId(TimeFrameInterval.of(4, 7), 1))));
    default:
      Map<TimeFrameIndex, List<Line>> lines = new HashMap<>();
      lines.put(TimeFrameIndex.of(1), Arrays.asList(new Line(new float[] { 0f, 1f, 2f }, new float[] { 0f, 1f, 4f }),
          new Line(new float[] { 5f, 6f }, new float[] { 5f, 5f })));
      lines.put(TimeFrameIndex.of(5), Arrays.asList(new Line(new float[] { 1f, 3f }, new float[] { 2f, 2f })));
      return DataSourceVariant.of(MapLineSource.ofLines("l", FRAME, lines));
    }
  }

  private static ExecutionPlan planFor(ComputerInfo info) {
    if (info.getRequiredSelectorType() == RowSelectorType.INTERVAL)
      return ExecutionPlan.ofIntervals(
          Arrays.asList(TimeFrameInterval.of(0, 3), TimeFrameInterval.of(2, 6), TimeFrameInterval.of(8, 10)), FRAME);
    return ExecutionPlan.ofIndices(Arrays.asList(TimeFrameIndex.of(1), TimeFrameIndex.of(4), TimeFrameIndex.of(5)),
        FRAME);
  }

  @DataProvider(name = "computers")
  public Object[][] computers() {
    List<Object[]> res = new ArrayList<>();
    for (String name : REGISTRY.getAllComputerNames())
      res.add(new Object[] { name });
    return res.toArray(new Object[res.size()][]);
  }

  @Test(dataProvider = "computers")
  public void computingTwiceYieldsSameValues(String computerName) throws Exception {
    // GIVEN
    ComputerInfo info = REGISTRY.findComputerInfo(computerName);
    TypedComputer<?> computer = REGISTRY.createComputer(computerName, sourceFor(info), Collections.emptyMap());
    ExecutionPlan plan = planFor(info);

    // WHEN
    Object first = valuesOf(computer, plan);
    Object second = valuesOf(computer, plan);

    // THEN
    Assert.assertEquals(second, first, "Expected " + computerName + " to return the same values on the second run");
  }

  private Object valuesOf(TypedComputer<?> computer, ExecutionPlan plan) {
    if (computer.isMultiOutput())
      return computer.getMulti().computeBatch(plan).getValues();
    return computer.getSingle().compute(plan).getValues();
  }
}
