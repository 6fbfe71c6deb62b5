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

import org.chronoqube.data.column.ColumnType;

/**
 * Converts numbers to values of numeric scalar {@link ColumnType}s.
 *
 * @author The chronoqube authors
 */
public class NumericValues {
  private NumericValues() {

  }

  /**
   * @throws IllegalArgumentException
   *           if the type is not a numeric scalar type.
   */
  @SuppressWarnings("unchecked")
  public static <T> T convert(ColumnType<T> type, long value) throws IllegalArgumentException {
    Object res;
    if (type == ColumnType.INT)
      res = (int) value;
    else if (type == ColumnType.LONG)
      res = value;
    else if (type == ColumnType.FLOAT)
      res = (float) value;
    else if (type == ColumnType.DOUBLE)
      res = (double) value;
    else
      throw new IllegalArgumentException("Type " + type + " is not a numeric scalar type.");
    return (T) res;
  }

  /**
   * @return The value as double. Booleans are converted to 0/1.
   * @throws IllegalArgumentException
   *           if the value is neither a number nor a boolean.
   */
  public static double toDouble(Object value) throws IllegalArgumentException {
    if (value instanceof Number)
      return ((Number) value).doubleValue();
    if (value instanceof Boolean)
      return ((Boolean) value) ? 1. : 0.;
    throw new IllegalArgumentException("Value " + value + " is not numeric.");
  }
}
