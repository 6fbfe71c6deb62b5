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
package org.chronoqube.data.column;

import java.util.Collections;
import java.util.List;

import org.chronoqube.data.time.TimeFrameIndex;

import com.google.common.collect.ImmutableList;

/**
 * The closed set of value types a column can have.
 * 
 * <p>
 * Instances are singletons and can be compared using <code>==</code>. The type parameter is the Java type of a single
 * cell value, vector types hold an unmodifiable {@link List} per cell.
 *
 * @author The chronoqube authors
 */
public final class ColumnType<T> {
  public static final ColumnType<Boolean> BOOL = new ColumnType<>("bool", Boolean.class, Boolean.class, false, false);
  public static final ColumnType<Integer> INT = new ColumnType<>("int", Integer.class, Integer.class, false, 0);
  public static final ColumnType<Long> LONG = new ColumnType<>("int64", Long.class, Long.class, false, 0L);
  public static final ColumnType<Float> FLOAT = new ColumnType<>("float", Float.class, Float.class, false, 0f);
  public static final ColumnType<Double> DOUBLE = new ColumnType<>("double", Double.class, Double.class, false, 0.);
  public static final ColumnType<List<Float>> FLOAT_VECTOR =
      new ColumnType<>("vector<float>", List.class, Float.class, true, Collections.<Float> emptyList());
  public static final ColumnType<List<Double>> DOUBLE_VECTOR =
      new ColumnType<>("vector<double>", List.class, Double.class, true, Collections.<Double> emptyList());
  public static final ColumnType<List<Integer>> INT_VECTOR =
      new ColumnType<>("vector<int>", List.class, Integer.class, true, Collections.<Integer> emptyList());
  public static final ColumnType<List<TimeFrameIndex>> INDEX_VECTOR = new ColumnType<>("vector<TimeFrameIndex>",
      List.class, TimeFrameIndex.class, true, Collections.<TimeFrameIndex> emptyList());

  private static final List<ColumnType<?>> ALL = ImmutableList.of(BOOL, INT, LONG, FLOAT, DOUBLE, FLOAT_VECTOR,
      DOUBLE_VECTOR, INT_VECTOR, INDEX_VECTOR);

  private final String name;
  private final Class<?> javaType;
  private final Class<?> elementType;
  private final boolean vector;
  private final T neutralValue;

  private ColumnType(String name, Class<?> javaType, Class<?> elementType, boolean vector, T neutralValue) {
    this.name = name;
    this.javaType = javaType;
    this.elementType = elementType;
    this.vector = vector;
    this.neutralValue = neutralValue;
  }

  /**
   * @return All column types.
   */
  public static List<ColumnType<?>> values() {
    return ALL;
  }

  /**
   * @return The type with the given name (see {@link #getName()}) or <code>null</code>.
   */
  public static ColumnType<?> fromName(String name) {
    for (ColumnType<?> t : ALL)
      if (t.name.equals(name))
        return t;
    return null;
  }

  public String getName() {
    return name;
  }

  /**
   * @return Class of a cell value. For vector types this is {@link List}.
   */
  public Class<?> getJavaType() {
    return javaType;
  }

  /**
   * @return For vector types the class of the elements, for scalar types the same as {@link #getJavaType()}.
   */
  public Class<?> getElementType() {
    return elementType;
  }

  public boolean isVector() {
    return vector;
  }

  /**
   * @return true for int, int64, float and double.
   */
  public boolean isNumericScalar() {
    return !vector && Number.class.isAssignableFrom(javaType);
  }

  /**
   * @return The value that is used for cells that do not have data, e.g. rows without an entity.
   */
  public T getNeutralValue() {
    return neutralValue;
  }

  @Override
  public String toString() {
    return name;
  }
}
