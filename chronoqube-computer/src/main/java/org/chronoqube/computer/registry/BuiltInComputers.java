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

import java.util.Arrays;

import org.chronoqube.computer.TypedComputer;
import org.chronoqube.computer.adapter.LineSeriesAdapter;
import org.chronoqube.computer.adapter.PointComponentAdapter;
import org.chronoqube.computer.adapter.PointComponentAdapter.Component;
import org.chronoqube.computer.analog.AnalogSliceGathererComputer;
import org.chronoqube.computer.event.EventInIntervalComputer;
import org.chronoqube.computer.event.EventOperation;
import org.chronoqube.computer.interval.IntervalOverlapComputer;
import org.chronoqube.computer.interval.IntervalProperty;
import org.chronoqube.computer.interval.IntervalPropertyComputer;
import org.chronoqube.computer.interval.IntervalReductionComputer;
import org.chronoqube.computer.interval.OverlapOperation;
import org.chronoqube.computer.interval.ReductionType;
import org.chronoqube.computer.line.LineSamplingMultiComputer;
import org.chronoqube.computer.line.LineTimestampComputer;
import org.chronoqube.computer.timestamp.AnalogTimestampOffsetsMultiComputer;
import org.chronoqube.computer.timestamp.TimestampInIntervalComputer;
import org.chronoqube.computer.timestamp.TimestampValueComputer;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.raw.LineSeries;
import org.chronoqube.data.raw.PointSeries;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.DataSourceVariant;
import org.chronoqube.data.source.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers all built-in computers and adapters.
 *
 * @author The chronoqube authors
 */
public class BuiltInComputers {
  private static final Logger logger = LoggerFactory.getLogger(BuiltInComputers.class);

  public static final String EVENT_GATHER_MODE = "mode";
  public static final String LINE_SEGMENTS = "segments";
  public static final String ANALOG_OFFSETS = "offsets";

  private BuiltInComputers() {

  }

  /**
   * @return A new registry containing all built-in computers and adapters.
   */
  public static ComputerRegistry buildRegistry() {
    ComputerRegistry.Builder builder = ComputerRegistry.builder();
    registerIntervalReductions(builder);
    registerEventComputers(builder);
    registerIntervalProperties(builder);
    registerTimestampComputers(builder);
    registerLineComputers(builder);
    registerIntervalOverlaps(builder);
    registerAnalogSliceGatherers(builder);
    registerAdapters(builder);

    ComputerRegistry res = builder.build();
    logger.info("Built computer registry with {} computers and {} adapters.", res.getAllComputerNames().size(),
        res.getAllAdapterNames().size());
    return res;
  }

  private static void registerIntervalReductions(ComputerRegistry.Builder builder) {
    registerReduction(builder, "Interval Mean", ReductionType.MEAN, "Mean of the analog samples in each interval.");
    registerReduction(builder, "Interval Max", ReductionType.MAX, "Maximum of the analog samples in each interval.");
    registerReduction(builder, "Interval Min", ReductionType.MIN, "Minimum of the analog samples in each interval.");
    registerReduction(builder, "Interval Standard Deviation", ReductionType.STD_DEV,
        "Population standard deviation of the analog samples in each interval.");
    registerReduction(builder, "Interval Sum", ReductionType.SUM, "Sum of the analog samples in each interval.");
    registerReduction(builder, "Interval Count", ReductionType.COUNT,
        "Number of analog samples in each interval.");
  }

  private static void registerReduction(ComputerRegistry.Builder builder, String name, ReductionType type,
      String description) {
    builder.registerComputer(
        ComputerInfo.builder(name, ColumnType.DOUBLE, RowSelectorType.INTERVAL, SourceKind.ANALOG)
            .description(description).build(),
        (source, params) -> TypedComputer.of(new IntervalReductionComputer(source.getAnalogSource(), type)));
  }

  private static void registerEventComputers(ComputerRegistry.Builder builder) {
    builder.registerComputer(
        ComputerInfo.builder("Event Presence", ColumnType.BOOL, RowSelectorType.INTERVAL, SourceKind.EVENT)
            .description("Whether there is an event in each interval.").build(),
        (source, params) -> TypedComputer
            .of(new EventInIntervalComputer<>(source.getEventSource(), EventOperation.PRESENCE, ColumnType.BOOL)));

    builder.registerComputer(
        ComputerInfo.builder("Event Count", ColumnType.INT, RowSelectorType.INTERVAL, SourceKind.EVENT)
            .description("Number of events in each interval.").build(),
        (source, params) -> TypedComputer
            .of(new EventInIntervalComputer<>(source.getEventSource(), EventOperation.COUNT, ColumnType.INT)));

    EnumParameterDescriptor mode = new EnumParameterDescriptor(EVENT_GATHER_MODE,
        "absolute: event positions; centered: positions relative to the interval center",
        Arrays.asList("absolute", "centered"), "absolute");
    builder.registerComputer(
        ComputerInfo.builder("Event Gather", ColumnType.FLOAT_VECTOR, RowSelectorType.INTERVAL, SourceKind.EVENT)
            .description("Positions of all events in each interval.").parameters(mode).build(),
        (source, params) -> {
          EventOperation op = "centered".equals(mode.parse(params)) ? EventOperation.GATHER_CENTER
              : EventOperation.GATHER;
          return TypedComputer.of(new EventInIntervalComputer<>(source.getEventSource(), op, ColumnType.FLOAT_VECTOR));
        });
  }

  private static void registerIntervalProperties(ComputerRegistry.Builder builder) {
    registerIntervalProperty(builder, "Interval Start", IntervalProperty.START, "Start index of each interval.");
    registerIntervalProperty(builder, "Interval End", IntervalProperty.END, "End index of each interval.");
    registerIntervalProperty(builder, "Interval Duration", IntervalProperty.DURATION,
        "Duration of each interval in indices.");
  }

  private static void registerIntervalProperty(ComputerRegistry.Builder builder, String name,
      IntervalProperty property, String description) {
    builder.registerComputer(
        ComputerInfo.builder(name, ColumnType.DOUBLE, RowSelectorType.INTERVAL, SourceKind.INTERVAL)
            .description(description).build(),
        (source, params) -> TypedComputer
            .of(new IntervalPropertyComputer<>(source.getIntervalSource(), property, ColumnType.DOUBLE)));
  }

  private static void registerTimestampComputers(ComputerRegistry.Builder builder) {
    builder.registerComputer(
        ComputerInfo.builder("Timestamp Value", ColumnType.DOUBLE, RowSelectorType.TIMESTAMP, SourceKind.ANALOG)
            .description("Analog value at each timestamp, NaN if there is no sample.").build(),
        (source, params) -> TypedComputer.of(new TimestampValueComputer(source.getAnalogSource())));

    IntListParameterDescriptor offsets =
        new IntListParameterDescriptor(ANALOG_OFFSETS, "Comma separated sample offsets, e.g. -2,0,2", "0");
    builder.registerComputer(
        ComputerInfo
            .builder("Analog Timestamp Offsets", ColumnType.DOUBLE, RowSelectorType.TIMESTAMP, SourceKind.ANALOG)
            .description("Analog values at sample offsets around each timestamp.").parameters(offsets).multiOutput()
            .build(),
        (source, params) -> TypedComputer
            .ofMulti(new AnalogTimestampOffsetsMultiComputer(source.getAnalogSource(), offsets.parse(params))));

    builder.registerComputer(
        ComputerInfo.builder("Timestamp In Interval", ColumnType.BOOL, RowSelectorType.TIMESTAMP, SourceKind.INTERVAL)
            .description("Whether each timestamp lies inside any interval.").build(),
        (source, params) -> TypedComputer.of(new TimestampInIntervalComputer(source.getIntervalSource())));
  }

  private static void registerLineComputers(ComputerRegistry.Builder builder) {
    IntParameterDescriptor segments =
        new IntParameterDescriptor(LINE_SEGMENTS, "Number of equally long segments to sample", 2, 1, 1000);
    builder.registerComputer(
        ComputerInfo.builder("Line Sample XY", ColumnType.DOUBLE, RowSelectorType.TIMESTAMP, SourceKind.LINE)
            .description("x and y of each line at equally spaced positions along its length.").parameters(segments)
            .multiOutput().entityExpanding().build(),
        (source, params) -> TypedComputer
            .ofMulti(new LineSamplingMultiComputer(source.getLineSource(), segments.parse(params))));

    builder.registerComputer(
        ComputerInfo.builder("Line Timestamp", ColumnType.LONG, RowSelectorType.TIMESTAMP, SourceKind.LINE)
            .description("Timestamp of each line.").entityExpanding().build(),
        (source, params) -> TypedComputer.of(new LineTimestampComputer(source.getLineSource())));
  }

  private static void registerIntervalOverlaps(ComputerRegistry.Builder builder) {
    registerOverlap(builder, "Interval Overlap Assign ID", OverlapOperation.ASSIGN_ID,
        "Index of the last interval containing each row interval, -1 if none.");
    registerOverlap(builder, "Interval Overlap Count", OverlapOperation.COUNT_OVERLAPS,
        "Number of intervals overlapping each row interval.");
    registerOverlap(builder, "Interval Overlap Assign Start", OverlapOperation.ASSIGN_ID_START,
        "Start of the last interval containing each row interval, -1 if none.");
    registerOverlap(builder, "Interval Overlap Assign End", OverlapOperation.ASSIGN_ID_END,
        "End of the last interval containing each row interval, -1 if none.");
  }

  private static void registerOverlap(ComputerRegistry.Builder builder, String name, OverlapOperation op,
      String description) {
    builder.registerComputer(
        ComputerInfo.builder(name, ColumnType.LONG, RowSelectorType.INTERVAL, SourceKind.INTERVAL)
            .description(description).build(),
        (source, params) -> TypedComputer.of(new IntervalOverlapComputer(source.getIntervalSource(), op)));
  }

  private static void registerAnalogSliceGatherers(ComputerRegistry.Builder builder) {
    builder.registerComputer(
        ComputerInfo
            .builder("Analog Slice Gatherer", ColumnType.DOUBLE_VECTOR, RowSelectorType.INTERVAL, SourceKind.ANALOG)
            .description("All analog samples in each interval.").build(),
        (source, params) -> TypedComputer
            .of(new AnalogSliceGathererComputer<>(source.getAnalogSource(), ColumnType.DOUBLE_VECTOR)));

    builder.registerComputer(
        ComputerInfo
            .builder("Analog Slice Gatherer Float", ColumnType.FLOAT_VECTOR, RowSelectorType.INTERVAL,
                SourceKind.ANALOG)
            .description("All analog samples in each interval, as floats.").build(),
        (source, params) -> TypedComputer
            .of(new AnalogSliceGathererComputer<>(source.getAnalogSource(), ColumnType.FLOAT_VECTOR)));
  }

  private static void registerAdapters(ComputerRegistry.Builder builder) {
    builder.registerAdapter(
        new AdapterInfo("Point X Component", "x coordinate of the first point at each index.", PointSeries.class,
            SourceKind.ANALOG),
        (raw, name, params) -> DataSourceVariant.of(PointComponentAdapter.adapt((PointSeries) raw, Component.X, name)));
    builder.registerAdapter(
        new AdapterInfo("Point Y Component", "y coordinate of the first point at each index.", PointSeries.class,
            SourceKind.ANALOG),
        (raw, name, params) -> DataSourceVariant.of(PointComponentAdapter.adapt((PointSeries) raw, Component.Y, name)));
    builder.registerAdapter(
        new AdapterInfo("Line Data", "All lines at each index.", LineSeries.class, SourceKind.LINE),
        (raw, name, params) -> DataSourceVariant.of(LineSeriesAdapter.adapt((LineSeries) raw, name)));
  }
}
