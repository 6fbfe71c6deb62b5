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

import org.chronoqube.computer.registry.BuiltInComputers;
import org.chronoqube.computer.registry.ComputerInfo;
import org.chronoqube.computer.registry.ComputerRegistry;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowKindMismatchException;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.DataSourceVariant;
import org.chronoqube.data.source.IntervalWithId;
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
 * Validates that all built-in computers fail on plans with the wrong kind of rows.
 *
 * @author The chronoqube authors
 */
public class RowKindMismatchTest {
  private static final TimeFrame FRAME = TimeFrame.ofRange(0, 10, 1);
  private static final ComputerRegistry REGISTRY = BuiltInComputers.buildRegistry();

  private static DataSourceVariant sourceFor(ComputerInfo info) {
    switch (info.getRequiredSourceKind()) {
    case ANALOG:
      return DataSourceVariant.of(new ArrayAnalogSource("a", FRAME, new float[] { 1f, 2f }));
    case EVENT:
      return DataSourceVariant.of(new ArrayEventSource("e", FRAME, new double[] { 1 }));
    case INTERVAL:
      return DataSourceVariant.of(new ListIntervalSource("i", FRAME,
          Arrays.asList(new IntervalWithId(TimeFrameInterval.of(1, 2), 0))));
    default:
      return DataSourceVariant.of(MapLineSource.ofLines("l", FRAME, new HashMap<>()));
    }
  }

  @DataProvider(name = "computers")
  public Object[][] computers() {
    List<Object[]> res = new ArrayList<>();
    for (String name : REGISTRY.getAllComputerNames())
      res.add(new Object[] { name });
    return res.toArray(new Object[res.size()][]);
  }

  @Test(dataProvider = "computers")
  public void wrongRowKindFails(String computerName) throws Exception {
    // GIVEN
    ComputerInfo info = REGISTRY.findComputerInfo(computerName);
    TypedComputer<?> computer = REGISTRY.createComputer(computerName, sourceFor(info), Collections.emptyMap());
    ExecutionPlan wrongPlan;
    if (info.getRequiredSelectorType() == RowSelectorType.INTERVAL)
      wrongPlan = ExecutionPlan.ofIndices(Arrays.asList(TimeFrameIndex.of(1)), FRAME);
    else
      wrongPlan = ExecutionPlan.ofIntervals(Arrays.asList(TimeFrameInterval.of(1, 2)), FRAME);

    // WHEN
    try {
      if (computer.isMultiOutput())
        computer.getMulti().computeBatch(wrongPlan);
      else
        computer.getSingle().compute(wrongPlan);
      Assert.fail("Expected " + computerName + " to fail on plan " + wrongPlan);
    } catch (RowKindMismatchException e) {
      // THEN: expected.
    }
  }
}
