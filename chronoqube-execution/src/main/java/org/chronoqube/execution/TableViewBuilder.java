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
package org.chronoqube.execution;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.chronoqube.computer.ColumnComputer;
import org.chronoqube.computer.ColumnComputerBase;
import org.chronoqube.computer.ComputerResult;
import org.chronoqube.computer.MultiColumnComputer;
import org.chronoqube.computer.MultiComputerResult;
import org.chronoqube.computer.TypedComputer;
import org.chronoqube.data.selector.RowSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Builds a {@link TableView} from a {@link RowSelector} and a list of named computers.
 * 
 * <p>
 * The rows of the table are negotiated once by {@link RowPlan#negotiate(RowSelector, List)}, then each column is
 * computed eagerly in the order it was added. A multi-output computer added under name <code>x</code> produces one
 * column <code>x.&lt;suffix&gt;</code> per output suffix.
 *
 * @author The chronoqube authors
 */
public class TableViewBuilder {
  private static final Logger logger = LoggerFactory.getLogger(TableViewBuilder.class);

  private RowSelector rowSelector;
  private final List<PendingColumn> pendingColumns = new ArrayList<>();
  private final Set<String> columnNames = new HashSet<>();

  public TableViewBuilder setRowSelector(RowSelector rowSelector) {
    this.rowSelector = rowSelector;
    return this;
  }

  /**
   * @throws IllegalArgumentException
   *           if a column with the given name (or one of the names the computer will produce) was added already.
   */
  public <T> TableViewBuilder addColumn(String name, ColumnComputer<T> computer) throws IllegalArgumentException {
    return addColumn(name, TypedComputer.of(computer));
  }

  public <T> TableViewBuilder addColumns(String baseName, MultiColumnComputer<T> computer)
      throws IllegalArgumentException {
    return addColumn(baseName, TypedComputer.ofMulti(computer));
  }

  public TableViewBuilder addColumn(String name, TypedComputer<?> computer) throws IllegalArgumentException {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Column name must not be empty");
    PendingColumn pending = new PendingColumn(name, computer);
    for (String outputName : pending.outputNames())
      if (columnNames.contains(outputName))
        throw new IllegalArgumentException("Column '" + outputName + "' was added already.");
    columnNames.addAll(pending.outputNames());
    pendingColumns.add(pending);
    return this;
  }

  public int getPendingColumnCount() {
    return pendingColumns.size();
  }

  public TableView build() throws IllegalStateException, ColumnComputationException {
    return build(null);
  }

  /**
   * @param listener
   *          informed after each added column was computed, may be <code>null</code>.
   * @throws IllegalStateException
   *           if no row selector is set or no columns were added.
   * @throws ColumnComputationException
   *           if any computer fails, including computers that do not accept the kind of rows of the table.
   */
  public TableView build(ColumnProgressListener listener) throws IllegalStateException, ColumnComputationException {
    if (rowSelector == null)
      throw new IllegalStateException("No row selector set.");
    if (pendingColumns.isEmpty())
      throw new IllegalStateException("No columns added.");

    List<ColumnComputerBase<?>> computers = new ArrayList<>();
    for (PendingColumn p : pendingColumns)
      computers.add(p.computer.getComputer());
    RowPlan rowPlan = RowPlan.negotiate(rowSelector, computers);

    List<Column<?>> columns = new ArrayList<>();
    int done = 0;
    for (PendingColumn pending : pendingColumns) {
      try {
        columns.addAll(pending.compute(rowPlan));
      } catch (RuntimeException e) {
        throw new ColumnComputationException(pending.name,
            "Could not compute column '" + pending.name + "': " + e.getMessage(), e);
      }
      done++;
      logger.trace("Computed column '{}' ({}/{})", pending.name, done, pendingColumns.size());
      if (listener != null)
        listener.columnComputed(pending.name, done, pendingColumns.size());
    }

    TableView res = new TableView(columns, rowPlan.getRows(), rowPlan.getPlan().getTimeFrame());
    logger.debug("Built {}", res);
    return res;
  }

  private static class PendingColumn {
    private final String name;
    private final TypedComputer<?> computer;

    PendingColumn(String name, TypedComputer<?> computer) {
      this.name = name;
      this.computer = Preconditions.checkNotNull(computer);
    }

    List<String> outputNames() {
      List<String> res = new ArrayList<>();
      if (computer.isMultiOutput()) {
        for (String suffix : computer.getMulti().getOutputSuffixes())
          res.add(name + "." + suffix);
      } else
        res.add(name);
      return res;
    }

    List<Column<?>> compute(RowPlan rowPlan) {
      return computeTyped(computer, rowPlan);
    }

    private <T> List<Column<?>> computeTyped(TypedComputer<T> typed, RowPlan rowPlan) {
      int rowCount = rowPlan.getRows().size();
      List<Column<?>> res = new ArrayList<>();
      String source = typed.getComputer().getSourceDependency();
      if (typed.isMultiOutput()) {
        MultiColumnComputer<T> multi = typed.getMulti();
        MultiComputerResult<T> result = multi.computeBatch(rowPlan.getPlan());
        List<String> suffixes = multi.getOutputSuffixes();
        if (result.getValues().size() != suffixes.size())
          throw new IllegalStateException("Computer returned " + result.getValues().size() + " outputs, but declared "
              + suffixes.size() + " suffixes.");
        for (int i = 0; i < suffixes.size(); i++) {
          List<T> values = result.getValues().get(i);
          checkRowCount(values.size(), rowCount);
          res.add(new Column<>(name + "." + suffixes.get(i), typed.getOutputType(), values, result.getEntityIds(),
              source));
        }
      } else {
        ComputerResult<T> result = typed.getSingle().compute(rowPlan.getPlan());
        checkRowCount(result.getValues().size(), rowCount);
        res.add(new Column<>(name, typed.getOutputType(), result.getValues(), result.getEntityIds(), source));
      }
      return res;
    }

    private void checkRowCount(int actual, int expected) {
      if (actual != expected)
        throw new IllegalStateException("Computer returned " + actual + " values, but the table has " + expected
            + " rows.");
    }
  }
}
