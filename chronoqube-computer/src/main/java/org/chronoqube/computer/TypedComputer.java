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

import com.google.common.base.Preconditions;

/**
 * Holds either a {@link ColumnComputer} or a {@link MultiColumnComputer} producing values of type T. This is what the
 * computer registry creates.
 *
 * @author The chronoqube authors
 */
public final class TypedComputer<T> {
  private final ColumnComputer<T> single;
  private final MultiColumnComputer<T> multi;

  private TypedComputer(ColumnComputer<T> single, MultiColumnComputer<T> multi) {
    this.single = single;
    this.multi = multi;
  }

  public static <T> TypedComputer<T> of(ColumnComputer<T> computer) {
    return new TypedComputer<>(Preconditions.checkNotNull(computer), null);
  }

  public static <T> TypedComputer<T> ofMulti(MultiColumnComputer<T> computer) {
    return new TypedComputer<>(null, Preconditions.checkNotNull(computer));
  }

  public ColumnComputerBase<T> getComputer() {
    return single != null ? single : multi;
  }

  public ColumnType<T> getOutputType() {
    return getComputer().getOutputType();
  }

  public boolean isMultiOutput() {
    return multi != null;
  }

  public boolean isEntityExpanding() {
    return getComputer() instanceof EntityExpandingComputer;
  }

  /**
   * @throws IllegalStateException
   *           if this holds a multi-output computer.
   */
  public ColumnComputer<T> getSingle() throws IllegalStateException {
    if (single == null)
      throw new IllegalStateException("Computer " + multi.getClass().getSimpleName() + " is multi-output.");
    return single;
  }

  /**
   * @throws IllegalStateException
   *           if this holds a single-output computer.
   */
  public MultiColumnComputer<T> getMulti() throws IllegalStateException {
    if (multi == null)
      throw new IllegalStateException("Computer " + single.getClass().getSimpleName() + " is single-output.");
    return multi;
  }

  /**
   * @return This instance typed to the given type or <code>null</code> if the output type is different.
   */
  @SuppressWarnings("unchecked")
  public <U> TypedComputer<U> as(ColumnType<U> type) {
    if (getOutputType() != type)
      return null;
    return (TypedComputer<U>) this;
  }
}
