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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The entity ids of the raw records each cell of a column was computed from.
 *
 * @author The chronoqube authors
 */
public final class ColumnEntityIds {
  private static final ColumnEntityIds NONE = new ColumnEntityIds(EntityIdStructure.NONE, ImmutableList.of());

  private final EntityIdStructure structure;
  private final List<List<Long>> ids;

  private ColumnEntityIds(EntityIdStructure structure, List<List<Long>> ids) {
    this.structure = structure;
    this.ids = ids;
  }

  public static ColumnEntityIds none() {
    return NONE;
  }

  /**
   * @param ids
   *          one entry per row, <code>null</code> entries denote rows without entity.
   */
  public static ColumnEntityIds simple(List<Long> ids) {
    List<List<Long>> res = new ArrayList<>(ids.size());
    for (Long id : ids)
      res.add(id == null ? ImmutableList.of() : ImmutableList.of(id));
    return new ColumnEntityIds(EntityIdStructure.SIMPLE, Collections.unmodifiableList(res));
  }

  /**
   * @param ids
   *          one entry per row.
   */
  public static ColumnEntityIds complex(List<? extends List<Long>> ids) {
    List<List<Long>> res = new ArrayList<>(ids.size());
    for (List<Long> l : ids)
      res.add(ImmutableList.copyOf(l));
    return new ColumnEntityIds(EntityIdStructure.COMPLEX, Collections.unmodifiableList(res));
  }

  public EntityIdStructure getStructure() {
    return structure;
  }

  public boolean isEmpty() {
    return structure == EntityIdStructure.NONE;
  }

  public int getRowCount() {
    return ids.size();
  }

  /**
   * @return The ids of the given row, empty if there are none.
   */
  public List<Long> getIdsOfRow(int row) {
    if (structure == EntityIdStructure.NONE)
      return ImmutableList.of();
    Preconditions.checkElementIndex(row, ids.size());
    return ids.get(row);
  }

  /**
   * @return A new instance with only the given rows, in the given order.
   */
  public ColumnEntityIds selectRows(List<Integer> rows) {
    if (structure == EntityIdStructure.NONE)
      return this;
    List<List<Long>> res = new ArrayList<>(rows.size());
    for (int row : rows)
      res.add(ids.get(row));
    return new ColumnEntityIds(structure, Collections.unmodifiableList(res));
  }

  @Override
  public String toString() {
    return "ColumnEntityIds[" + structure + "]";
  }
}
