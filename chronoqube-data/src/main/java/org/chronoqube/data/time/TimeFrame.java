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
package org.chronoqube.data.time;

import com.google.common.base.Preconditions;

/**
 * An ordered sequence of integer time values, one per index, that defines the conversion between indices and time for
 * all data recorded against it.
 * 
 * <p>
 * The time values are non-decreasing. Instances are immutable and are shared between all sources recorded on the same
 * clock.
 * 
 * <p>
 * Lookups of a time that is not contained in the frame resolve to the nearest sample. If a time is exactly between two
 * samples, the earlier sample wins. Times before the first or after the last sample resolve to the first or last index.
 * If the same time value is contained multiple times, the first index having that time is returned.
 *
 * @author The chronoqube authors
 */
public final class TimeFrame {
  /**
   * How to resolve a time that lies between two samples.
   */
  public enum Rounding {
    /** Index of the last sample at or before the time. */
    PRECEDING,
    /** Index of the nearest sample, the earlier one on ties. */
    NEAREST,
    /** Index of the first sample at or after the time. */
    FOLLOWING
  }

  private final int[] times;

  public TimeFrame(int[] times) {
    Preconditions.checkNotNull(times, "Times must not be null");
    Preconditions.checkArgument(times.length > 0, "A TimeFrame needs at least one time value");
    for (int i = 1; i < times.length; i++)
      if (times[i] < times[i - 1])
        throw new IllegalArgumentException(
            "TimeFrame times must be non-decreasing, but time at index " + i + " is " + times[i] + " < "
                + times[i - 1]);
    this.times = times.clone();
  }

  /**
   * @return A frame with the times <code>start, start + step, ...</code> up to and including <code>end</code>.
   */
  public static TimeFrame ofRange(int start, int end, int step) {
    Preconditions.checkArgument(step > 0, "Step must be positive");
    Preconditions.checkArgument(start <= end, "Start must not be after end");
    int[] res = new int[(end - start) / step + 1];
    for (int i = 0; i < res.length; i++)
      res[i] = start + i * step;
    return new TimeFrame(res);
  }

  public int getTotalFrameCount() {
    return times.length;
  }

  /**
   * @return true if the index addresses a sample of this frame.
   */
  public boolean contains(TimeFrameIndex index) {
    return index.getValue() >= 0 && index.getValue() < times.length;
  }

  /**
   * @return The time value at the given index. Indices outside of the frame are clamped to the first/last index.
   */
  public int getTimeAtIndex(TimeFrameIndex index) {
    return times[clamp(index.getValue())];
  }

  /**
   * @return Nearest index to the given time, see class comment.
   */
  public TimeFrameIndex getIndexAtTime(double time) {
    return getIndexAtTime(time, Rounding.NEAREST);
  }

  public TimeFrameIndex getIndexAtTime(double time, Rounding rounding) {
    // first index with times[idx] >= time
    int lo = 0;
    int hi = times.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (times[mid] < time)
        lo = mid + 1;
      else
        hi = mid;
    }
    int following = lo;

    if (following < times.length && times[following] == time)
      return TimeFrameIndex.of(following);

    switch (rounding) {
    case FOLLOWING:
      return TimeFrameIndex.of(Math.min(following, times.length - 1));
    case PRECEDING:
      return TimeFrameIndex.of(Math.max(following - 1, 0));
    default:
      if (following == 0)
        return TimeFrameIndex.of(0);
      if (following == times.length)
        return TimeFrameIndex.of(times.length - 1);
      int preceding = following - 1;
      // on equal distance prefer the earlier sample. Jump to the first index of a run of equal times.
      int res = (time - times[preceding] <= times[following] - time) ? preceding : following;
      while (res > 0 && times[res - 1] == times[res])
        res--;
      return TimeFrameIndex.of(res);
    }
  }

  /**
   * Converts an index of another frame into an index of this frame by resolving its time in the other frame and then
   * finding the nearest index in this frame.
   * 
   * <p>
   * An index outside of <code>indexFrame</code> resolves to the time of its first/last sample, see
   * {@link #getTimeAtIndex(TimeFrameIndex)}. An index of the same frame is returned unchanged, even when out of range.
   * Point lookups check {@link #contains(TimeFrameIndex)} on the caller frame before converting.
   * 
   * @param index
   *          index relative to <code>indexFrame</code>.
   * @param indexFrame
   *          the frame the index is relative to. Must not be <code>null</code>.
   */
  public TimeFrameIndex convertIndex(TimeFrameIndex index, TimeFrame indexFrame) {
    Preconditions.checkNotNull(indexFrame, "TimeFrame of index must not be null");
    if (indexFrame == this)
      return index;
    return getIndexAtTime(indexFrame.getTimeAtIndex(index));
  }

  /**
   * Converts both ends of the given interval of another frame into this frame, see
   * {@link #convertIndex(TimeFrameIndex, TimeFrame)}.
   */
  public TimeFrameInterval convertInterval(TimeFrameInterval interval, TimeFrame intervalFrame) {
    return new TimeFrameInterval(convertIndex(interval.getStart(), intervalFrame),
        convertIndex(interval.getEnd(), intervalFrame));
  }

  private int clamp(long index) {
    if (index < 0)
      return 0;
    if (index >= times.length)
      return times.length - 1;
    return (int) index;
  }

  @Override
  public String toString() {
    return "TimeFrame[size=" + times.length + ", first=" + times[0] + ", last=" + times[times.length - 1] + "]";
  }

}
