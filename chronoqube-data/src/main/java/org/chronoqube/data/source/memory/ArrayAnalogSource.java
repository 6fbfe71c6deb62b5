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
package org.chronoqube.data.source.memory;

import java.util.Arrays;

import org.chronoqube.data.source.AnalogSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;

import com.google.common.base.Preconditions;

/**
 * {@link AnalogSource} backed by arrays.
 *
 * @author The chronoqube authors
 */
public class ArrayAnalogSource implements AnalogSource {
  private final String name;
  private final TimeFrame timeFrame;
  private final long[] sampleIndices;
  private final float[] values;

  /**
   * Source with one sample at each index <code>0..values.length-1</code>.
   */
  public ArrayAnalogSource(String name, TimeFrame timeFrame, float[] values) {
    this(name, timeFrame, denseIndices(values.length), values);
  }

  /**
   * @param sampleIndices
   *          index of each sample in <code>timeFrame</code>, strictly ascending.
   */
  public ArrayAnalogSource(String name, TimeFrame timeFrame, long[] sampleIndices, float[] values) {
    this.name = Preconditions.checkNotNull(name);
    this.timeFrame = Preconditions.checkNotNull(timeFrame, "TimeFrame of source %s must not be null", name);
    Preconditions.checkArgument(sampleIndices.length == values.length, "Need one index per value");
    for (int i = 1; i < sampleIndices.length; i++)
      Preconditions.checkArgument(sampleIndices[i - 1] < sampleIndices[i], "Sample indices must be strictly ascending");
    this.sampleIndices = sampleIndices.clone();
    this.values = values.clone();
  }

  private static long[] denseIndices(int length) {
    long[] res = new long[length];
    for (int i = 0; i < length; i++)
      res[i] = i;
    return res;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public TimeFrame getTimeFrame() {
    return timeFrame;
  }

  @Override
  public int getSampleCount() {
    return values.length;
  }

  @Override
  public float[] getDataInRange(TimeFrameIndex start, TimeFrameIndex end, TimeFrame callerFrame) {
    long ownStart = timeFrame.convertIndex(start, callerFrame).getValue();
    long ownEnd = timeFrame.convertIndex(end, callerFrame).getValue();
    int from = lowerBound(ownStart);
    int to = lowerBound(ownEnd + 1);
    if (from >= to)
      return new float[0];
    return Arrays.copyOfRange(values, from, to);
  }

  @Override
  public double getValueAt(TimeFrameIndex index, TimeFrame callerFrame) {
    if (!callerFrame.contains(index))
      return Double.NaN;
    long ownIdx = timeFrame.convertIndex(index, callerFrame).getValue();
    int pos = Arrays.binarySearch(sampleIndices, ownIdx);
    if (pos < 0)
      return Double.NaN;
    return values[pos];
  }

  private int lowerBound(long index) {
    int pos = Arrays.binarySearch(sampleIndices, index);
    return pos >= 0 ? pos : -(pos + 1);
  }
}
