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
package org.chronoqube.computer.registry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.chronoqube.computer.TypedComputer;
import org.chronoqube.computer.event.EventInIntervalComputer;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.raw.Point;
import org.chronoqube.data.raw.PointSeries;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.AnalogSource;
import org.chronoqube.data.source.DataSourceVariant;
import org.chronoqube.data.source.SourceKind;
import org.chronoqube.data.source.memory.ArrayAnalogSource;
import org.chronoqube.data.source.memory.ArrayEventSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableMap;

/**
 * Tests {@link ComputerRegistry} with the built-in computers.
 *
 * @author The chronoqube authors
 */
public class ComputerRegistryTest {
  private static final TimeFrame FRAME = TimeFrame.ofRange(0, 10, 1);
  private static final ComputerRegistry REGISTRY = BuiltInComputers.buildRegistry();

  private static final DataSourceVariant EVENTS =
      DataSourceVariant.of(new ArrayEventSource("licks", FRAME, new double[] { 1, 4 }));
  private static final DataSourceVariant ANALOG =
      DataSourceVariant.of(new ArrayAnalogSource("signal", FRAME, new float[] { 1f, 4f }));

  @DataProvider(name = "typeAndComputer")
  public Object[][] typeAndComputer() {
    List<Object[]> res = new ArrayList<>();
    for (ColumnType<?> type : ColumnType.values())
      for (String name : Arrays.asList("Event Presence", "Event Count", "Event Gather"))
        res.add(new Object[] { type, name });
    return res.toArray(new Object[res.size()][]);
  }

  @Test(dataProvider = "typeAndComputer")
  public void typedCreationChecksOutputType(ColumnType<?> type, String computerName) {
    // WHEN
    Optional<? extends TypedComputer<?>> res =
        REGISTRY.createTypedComputer(computerName, type, EVENTS, Collections.emptyMap());

    // THEN
    boolean typeMatches = REGISTRY.findComputerInfo(computerName).getOutputType() == type;
    Assert.assertEquals(res.isPresent(), typeMatches,
        "Expected typed creation of " + computerName + " as " + type + " to succeed iff types match");
    if (typeMatches)
      Assert.assertSame(res.get().getOutputType(), type, "Wrong output type");
  }

  @Test
  public void typedCreationOfEveryComputerFailsForEveryOtherType() {
    for (String name : REGISTRY.getAllComputerNames()) {
      ComputerInfo info = REGISTRY.findComputerInfo(name);
      for (ColumnType<?> type : ColumnType.values()) {
        if (type == info.getOutputType())
          continue;
        // WHEN
        Optional<?> res = REGISTRY.createTypedComputer(name, type, EVENTS, Collections.emptyMap());
        // THEN
        Assert.assertFalse(res.isPresent(), "Expected no computer for " + name + " as " + type);
      }
    }
  }

  @Test
  public void typedCreationReturnsUsableComputer() {
    // WHEN
    Optional<TypedComputer<Integer>> res =
        REGISTRY.createTypedComputer("Event Count", ColumnType.INT, EVENTS, Collections.emptyMap());

    // THEN
    Assert.assertTrue(res.isPresent(), "Expected computer");
    Assert.assertTrue(res.get().getSingle() instanceof EventInIntervalComputer, "Wrong computer class");
    Assert.assertEquals(res.get().getSingle().getSourceDependency(), "licks", "Wrong source dependency");
  }

  @Test
  public void availableComputersByCapability() {
    // WHEN
    List<String> intervalEvent = REGISTRY.getAvailableComputers(RowSelectorType.INTERVAL, EVENTS).stream()
        .map(ComputerInfo::getName).collect(Collectors.toList());
    List<String> indexAnalog = REGISTRY.getAvailableComputers(RowSelectorType.INDEX, SourceKind.ANALOG).stream()
        .map(ComputerInfo::getName).collect(Collectors.toList());

    // THEN
    Assert.assertEquals(intervalEvent, Arrays.asList("Event Presence", "Event Count", "Event Gather"),
        "Wrong event computers");
    Assert.assertTrue(indexAnalog.contains("Timestamp Value"), "Expected timestamp computers for index rows");
    Assert.assertFalse(indexAnalog.contains("Interval Mean"), "Expected no interval computers for index rows");
  }

  @Test
  public void metadataQueries() {
    Assert.assertTrue(REGISTRY.isVectorComputer("Event Gather"), "Expected vector computer");
    Assert.assertFalse(REGISTRY.isVectorComputer("Event Count"), "Expected scalar computer");
    Assert.assertFalse(REGISTRY.isVectorComputer("Does not exist"), "Expected unknown computer not to be vector");
    Assert.assertEquals(REGISTRY.getElementType("Analog Slice Gatherer"), Double.class, "Wrong element type");
    Assert.assertNull(REGISTRY.getElementType("Does not exist"), "Expected no element type");
    Assert.assertTrue(REGISTRY.getAvailableOutputTypes().contains(ColumnType.FLOAT_VECTOR), "Missing output type");
    Assert.assertEquals(
        REGISTRY.getComputersByOutputType(ColumnType.BOOL, RowSelectorType.TIMESTAMP, null).stream()
            .map(ComputerInfo::getName).collect(Collectors.toList()),
        Arrays.asList("Timestamp In Interval"), "Wrong bool computers for timestamps");
    Assert.assertTrue(REGISTRY.findComputerInfo("Line Sample XY").isMultiOutput(), "Expected multi output");
    Assert.assertTrue(REGISTRY.findComputerInfo("Line Sample XY").isEntityExpanding(), "Expected expanding");
  }

  @Test(expectedExceptions = ComputerCreationException.class)
  public void unknownComputerFails() throws ComputerCreationException {
    REGISTRY.createComputer("Does not exist", EVENTS, Collections.emptyMap());
  }

  @Test(expectedExceptions = ComputerCreationException.class)
  public void wrongSourceKindFails() throws ComputerCreationException {
    REGISTRY.createComputer("Event Count", ANALOG, Collections.emptyMap());
  }

  @Test(expectedExceptions = ComputerCreationException.class)
  public void invalidParameterFails() throws ComputerCreationException {
    REGISTRY.createComputer("Event Gather", EVENTS, ImmutableMap.of(BuiltInComputers.EVENT_GATHER_MODE, "sideways"));
  }

  @Test
  public void multiOutputSuffixesDependOnParameters() throws ComputerCreationException {
    // WHEN
    TypedComputer<?> res = REGISTRY.createComputer("Analog Timestamp Offsets", ANALOG,
        ImmutableMap.of(BuiltInComputers.ANALOG_OFFSETS, "-2, 0,3"));

    // THEN
    Assert.assertEquals(res.getMulti().getOutputSuffixes(), Arrays.asList("t-2", "t+0", "t+3"), "Wrong suffixes");
  }

  @Test
  public void duplicateRegistrationIsIgnored() {
    // GIVEN
    ComputerInfo first =
        ComputerInfo.builder("X", ColumnType.INT, RowSelectorType.INTERVAL, SourceKind.EVENT).description("1").build();
    ComputerInfo second =
        ComputerInfo.builder("X", ColumnType.BOOL, RowSelectorType.INTERVAL, SourceKind.EVENT).description("2").build();

    // WHEN
    ComputerRegistry registry = ComputerRegistry.builder().registerComputer(first, (s, p) -> null)
        .registerComputer(second, (s, p) -> null).build();

    // THEN
    Assert.assertEquals(registry.findComputerInfo("X").getDescription(), "1", "Expected first registration to win");
  }

  @Test
  public void pointAdapter() throws ComputerCreationException {
    // GIVEN
    Map<TimeFrameIndex, List<Point>> points = new HashMap<>();
    points.put(TimeFrameIndex.of(2), Arrays.asList(new Point(3f, 4f), new Point(7f, 8f)));
    PointSeries series = new PointSeries(FRAME, points);

    // WHEN
    DataSourceVariant res = REGISTRY.createAdapter("Point Y Component", series, "nose.y", Collections.emptyMap());

    // THEN
    Assert.assertEquals(REGISTRY.getAvailableAdapters(PointSeries.class).size(), 2, "Expected both point adapters");
    AnalogSource analog = res.getAnalogSource();
    Assert.assertEquals(analog.getName(), "nose.y", "Wrong name");
    Assert.assertEquals(analog.getValueAt(TimeFrameIndex.of(2), FRAME), 4., 1e-9, "Expected y of first point");
    Assert.assertTrue(Double.isNaN(analog.getValueAt(TimeFrameIndex.of(3), FRAME)), "Expected no sample");
  }

  @Test(expectedExceptions = ComputerCreationException.class)
  public void adapterWithWrongRawTypeFails() throws ComputerCreationException {
    REGISTRY.createAdapter("Line Data", "not lines", "x", Collections.emptyMap());
  }
}
