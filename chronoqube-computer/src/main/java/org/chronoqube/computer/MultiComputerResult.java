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

import java.util.ArrayList;
import java.util.List;

import org.chronoqube.data.column.ColumnEntityIds;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Result of {@link MultiColumnComputer#computeBatch(org.chronoqube.data.plan.ExecutionPlan)}. The entity ids are
 * shared by all output columns.
 *
 * @author The chronoqube authors
 */
public final class MultiComputerResult<T> {
  private final List<List<T>> values;
  private final ColumnEntityIds entityIds;

  public MultiComputerResult(List<? extends List<T>> values, ColumnEntityIds entityIds) {
    List<List<T>> copy = new ArrayList<>(values.size());
    for (List<T> v : values)
      copy.add(ImmutableList.copyOf(v));
    this.values = ImmutableList.copyOf(copy);
    this.entityIds = Preconditions.checkNotNull(entityIds);
  }

  /**
   * @return One list per output suffix.
   */
  public List<List<T>> getValues() {
    return values;
  }

  public ColumnEntityIds getEntityIds() {
    return entityIds;
  }
}
