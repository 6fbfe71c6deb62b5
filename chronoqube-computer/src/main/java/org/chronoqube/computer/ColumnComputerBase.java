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
import org.chronoqube.data.source.SourceKind;

/**
 * Declarations common to {@link ColumnComputer} and {@link MultiColumnComputer}.
 * 
 * <p>
 * Computers are pure functions of the execution plan, their source and their parameters. Computing the same plan
 * multiple times returns equal results.
 *
 * @author The chronoqube authors
 */
public interface ColumnComputerBase<T> {
  /**
   * @return The exact type of the values this computer produces.
   */
  ColumnType<T> getOutputType();

  /**
   * @return The kind of row selector whose rows this computer can compute values for.
   */
  RowSelectorType getRequiredSelectorType();

  SourceKind getRequiredSourceKind();

  /**
   * @return Name of the source this computer reads.
   */
  String getSourceDependency();
}
