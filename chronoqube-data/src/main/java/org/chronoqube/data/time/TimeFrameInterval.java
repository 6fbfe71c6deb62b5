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
 * A closed interval <code>[start, end]</code> of {@link TimeFrameIndex} values of one {@link TimeFrame}.
 *
 * @author The chronoqube authors
 */
public final class TimeFrameInterval {
  private final TimeFrameIndex start;
  private final TimeFrameIndex end;

  public TimeFrameInterval(TimeFrameIndex start, TimeFrameIndex end) {
    Preconditions.checkNotNull(start, "Interval start must not be null");
    Preconditions.checkNotNull(end, "Interval end must not be null");
    Preconditions.checkArgument(start.compareTo(end) <= 0, "Interval start %s is after end %s", start.getValue(),
        end.getValue());
    this.start = start;
    this.end = end;
  }

  public static TimeFrameInterval of(long start, long end) {
    return new TimeFrameInterval(TimeFrameIndex.of(start), TimeFrameIndex.of(end));
  }

  public TimeFrameIndex getStart() {
    return start;
  }

  public TimeFrameIndex getEnd() {
    return end;
  }

  /**
   * @return <code>end - start</code> in index units.
   */
  public long getLength() {
    return end.getValue() - start.getValue();
  }

  /**
   * @return true if the given index lies within this interval, both ends inclusive.
   */
  public boolean contains(TimeFrameIndex index) {
    return start.compareTo(index) <= 0 && index.compareTo(end) <= 0;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof TimeFrameInterval))
      return false;
    TimeFrameInterval other = (TimeFrameInterval) obj;
    return start.equals(other.start) && end.equals(other.end);
  }

  @Override
  public int hashCode() {
    return 31 * start.hashCode() + end.hashCode();
  }

  @Override
  public String toString() {
    return "[" + start.getValue() + "," + end.getValue() + "]";
  }
}
