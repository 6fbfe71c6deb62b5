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

import java.util.ArrayList;
import java.util.List;

import org.chronoqube.computer.AbstractColumnComputer;
import org.chronoqube.computer.MultiColumnComputer;
import org.chronoqube.computer.MultiComputerResult;
import org.chronoqube.data.column.ColumnEntityIds;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowKind;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.AnalogSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

/**
 * Samples an analog source at fixed sample offsets around each row timestamp. Offsets are counted in indices of the
 * source's TimeFrame, positions without a sample result in NaN.
 * 
 * <p>
 * One output column per offset, with suffix <code>t+N</code> or <code>t-N</code>.
 *
 * @author The chronoqube authors
 */
public class AnalogTimestampOffsetsMultiComputer extends AbstractColumnComputer<AnalogSource, Double>
    implements MultiColumnComputer<Double> {
  private final int[] offsets;
  private final List<String> suffixes;

  public AnalogTimestampOffsetsMultiComputer(AnalogSource source, List<Integer> offsets) {
    super(source, ColumnType.DOUBLE, RowSelectorType.TIMESTAMP);
    Preconditions.checkArgument(!offsets.isEmpty(), "Need at least one offset");
    this.offsets = Ints.toArray(offsets);
    ImmutableList.Builder<String> suffixBuilder = ImmutableList.builder();
    for (int offset : this.offsets)
      suffixBuilder.add(suffixOf(offset));
    this.suffixes = suffixBuilder.build();
  }

  public static String suffixOf(int offset) {
    return offset >= 0 ? "t+" + offset : "t" + offset;
  }

  @Override
  public List<String> getOutputSuffixes() {
    return suffixes;
  }

  @Override
  public MultiComputerResult<Double> computeBatch(ExecutionPlan plan) {
    plan.requireRowKind(describe(), RowKind.INDICES);
    TimeFrame sourceFrame = source.getTimeFrame();

    List<List<Double>> res = new ArrayList<>();
    for (int i = 0; i < offsets.length; i++)
      res.add(new ArrayList<>());

    for (TimeFrameIndex index : plan.getIndices()) {
      TimeFrameIndex sourceIdx = sourceFrame.convertIndex(index, plan.getTimeFrame());
      for (int i = 0; i < offsets.length; i++)
        res.get(i).add(source.getValueAt(sourceIdx.plus(offsets[i]), sourceFrame));
    }
    return new MultiComputerResult<>(res, ColumnEntityIds.none());
  }
}
