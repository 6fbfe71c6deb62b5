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

/**
 * An index into a specific {@link TimeFrame}.
 * 
 * <p>
 * Two indices are only comparable if they are relative to the same TimeFrame. To compare indices of different frames,
 * convert one of them first using {@link TimeFrame#convertIndex(TimeFrameIndex, TimeFrame)}.
 *
 * @author The chronoqube authors
 */
public final class TimeFrameIndex implements Comparable<TimeFrameIndex> {
  private final long value;

  private TimeFrameIndex(long value) {
    this.value = value;
  }

  public static TimeFrameIndex of(long value) {
    return new TimeFrameIndex(value);
  }

  public long getValue() {
    return value;
  }

  public TimeFrameIndex plus(long offset) {
    return new TimeFrameIndex(value + offset);
  }

  @Override
  public int compareTo(TimeFrameIndex o) {
    return Long.compare(value, o.value);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof TimeFrameIndex))
      return false;
    return value == ((TimeFrameIndex) obj).value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return "TimeFrameIndex[" + value + "]";
  }
}
