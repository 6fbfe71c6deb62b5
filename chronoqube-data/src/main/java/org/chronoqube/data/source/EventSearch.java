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
package org.chronoqube.data.source;

/**
 * Binary searches over sorted event positions.
 *
 * @author The chronoqube authors
 */
public class EventSearch {
  private EventSearch() {

  }

  /**
   * @return First position whose value is <code>&gt;= value</code>, or <code>events.length</code>.
   */
  public static int lowerBound(double[] events, double value) {
    int lo = 0;
    int hi = events.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (events[mid] < value)
        lo = mid + 1;
      else
        hi = mid;
    }
    return lo;
  }

  /**
   * @return First position whose value is <code>&gt; value</code>, or <code>events.length</code>.
   */
  public static int upperBound(double[] events, double value) {
    int lo = 0;
    int hi = events.length;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (events[mid] <= value)
        lo = mid + 1;
      else
        hi = mid;
    }
    return lo;
  }
}
