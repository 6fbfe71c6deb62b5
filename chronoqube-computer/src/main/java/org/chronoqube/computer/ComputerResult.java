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

import java.util.List;

import org.chronoqube.data.column.ColumnEntityIds;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Result of {@link ColumnComputer#compute(org.chronoqube.data.plan.ExecutionPlan)}.
 *
 * @author The chronoqube authors
 */
public final class ComputerResult<T> {
  private final List<T> values;
  private final ColumnEntityIds entityIds;

  public ComputerResult(List<T> values, ColumnEntityIds entityIds) {
    this.values = ImmutableList.copyOf(values);
    this.entityIds = Preconditions.checkNotNull(entityIds);
    Preconditions.checkArgument(entityIds.isEmpty() || entityIds.getRowCount() == values.size(),
        "Need entity ids for each row");
  }

  public static <T> ComputerResult<T> withoutEntityIds(List<T> values) {
    return new ComputerResult<>(values, ColumnEntityIds.none());
  }

  public List<T> getValues() {
    return values;
  }

  public ColumnEntityIds getEntityIds() {
    return entityIds;
  }
}
