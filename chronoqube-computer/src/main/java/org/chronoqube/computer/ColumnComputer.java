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

import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowKindMismatchException;

/**
 * Computes the values of a single column.
 *
 * @author The chronoqube authors
 */
public interface ColumnComputer<T> extends ColumnComputerBase<T> {
  /**
   * @return One value per row of the plan, in row order, plus the entity ids of the cells.
   * @throws RowKindMismatchException
   *           if the plan does not have the kind of rows this computer requires.
   */
  ComputerResult<T> compute(ExecutionPlan plan) throws RowKindMismatchException;
}
