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
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.DataSource;
import org.chronoqube.data.source.SourceKind;

import com.google.common.base.Preconditions;

/**
 * Base class for computers reading a single source.
 *
 * @author The chronoqube authors
 */
public abstract class AbstractColumnComputer<S extends DataSource, T> implements ColumnComputerBase<T> {
  protected final S source;
  private final ColumnType<T> outputType;
  private final RowSelectorType selectorType;

  protected AbstractColumnComputer(S source, ColumnType<T> outputType, RowSelectorType selectorType) {
    this.source = Preconditions.checkNotNull(source, "Source of %s must not be null", getClass().getSimpleName());
    Preconditions.checkNotNull(source.getTimeFrame(), "Source %s has no TimeFrame", source.getName());
    this.outputType = Preconditions.checkNotNull(outputType);
    this.selectorType = selectorType;
  }

  @Override
  public ColumnType<T> getOutputType() {
    return outputType;
  }

  @Override
  public RowSelectorType getRequiredSelectorType() {
    return selectorType;
  }

  @Override
  public SourceKind getRequiredSourceKind() {
    return source.getKind();
  }

  @Override
  public String getSourceDependency() {
    return source.getName();
  }

  /**
   * @return Name used in exception messages.
   */
  protected String describe() {
    return getClass().getSimpleName() + " on '" + source.getName() + "'";
  }
}
