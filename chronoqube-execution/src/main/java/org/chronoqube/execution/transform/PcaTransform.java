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
package org.chronoqube.execution.transform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.chronoqube.computer.NumericValues;
import org.chronoqube.data.column.ColumnEntityIds;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.execution.Column;
import org.chronoqube.execution.RowDescriptor;
import org.chronoqube.execution.TableView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Principal component analysis over the numeric scalar columns of a table.
 * 
 * <p>
 * Produces one {@link ColumnType#DOUBLE} column <code>PC1..PCn</code> per used input column, holding the projection of
 * each row onto the principal components ordered by descending variance. Rows that contain a non-finite value in any
 * used column are dropped. Each eigenvector is oriented so that its component with the largest absolute value is
 * positive.
 *
 * @author The chronoqube authors
 */
public class PcaTransform implements TableTransform {
  private static final Logger logger = LoggerFactory.getLogger(PcaTransform.class);

  public static final String NAME = "PCA";
  public static final String COLUMN_PREFIX = "PC";

  private final PcaOptions options;

  public PcaTransform(PcaOptions options) {
    this.options = options;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public TableView apply(TableView input) throws TransformException {
    List<String> columns = selectColumns(input);
    int dim = columns.size();

    List<Integer> keptRows = new ArrayList<>();
    List<double[]> data = new ArrayList<>();
    for (int row = 0; row < input.getRowCount(); row++) {
      double[] values = new double[dim];
      boolean finite = true;
      for (int col = 0; col < dim && finite; col++) {
        values[col] = NumericValues.toDouble(input.getColumn(columns.get(col)).getValues().get(row));
        finite = Double.isFinite(values[col]);
      }
      if (finite) {
        keptRows.add(row);
        data.add(values);
      }
    }
    if (data.size() < 2)
      throw new TransformException(
          "PCA needs at least 2 rows with finite values, but there are " + data.size() + ".");
    if (data.size() < input.getRowCount())
      logger.debug("PCA dropped {} rows with non-finite values", input.getRowCount() - data.size());

    RealMatrix x = MatrixUtils.createRealMatrix(data.toArray(new double[data.size()][]));
    prepare(x);

    RealMatrix covariance = x.transpose().multiply(x).scalarMultiply(1. / (x.getRowDimension() - 1));
    EigenDecomposition eigen = new EigenDecomposition(covariance);
    double[] eigenvalues = eigen.getRealEigenvalues();
    Integer[] order = IntStream.range(0, dim).boxed().toArray(Integer[]::new);
    Arrays.sort(order, Comparator.comparingDouble((Integer i) -> eigenvalues[i]).reversed());

    RealMatrix components = MatrixUtils.createRealMatrix(dim, dim);
    for (int i = 0; i < dim; i++)
      components.setColumnVector(i, orient(eigen.getEigenvector(order[i])));

    RealMatrix scores = x.multiply(components);

    double totalVariance = Arrays.stream(eigenvalues).sum();
    if (totalVariance > 0 && logger.isDebugEnabled()) {
      String explained = Arrays.stream(order)
          .map(i -> String.format(Locale.ROOT, "%.3f", eigenvalues[i] / totalVariance))
          .collect(Collectors.joining(", "));
      logger.debug("PCA over {} explained variance ratios: {}", columns, explained);
    }

    List<Column<?>> resColumns = new ArrayList<>();
    for (int pc = 0; pc < dim; pc++) {
      List<Double> values = new ArrayList<>(scores.getRowDimension());
      for (int row = 0; row < scores.getRowDimension(); row++)
        values.add(scores.getEntry(row, pc));
      resColumns.add(new Column<>(COLUMN_PREFIX + (pc + 1), ColumnType.DOUBLE, values, ColumnEntityIds.none(), null));
    }
    List<RowDescriptor> rows = keptRows.stream().map(input::getRowDescriptor).collect(Collectors.toList());
    return new TableView(resColumns, rows, input.getTimeFrame());
  }

  private List<String> selectColumns(TableView input) throws TransformException {
    List<String> res = new ArrayList<>();
    if (!options.getInclude().isEmpty()) {
      for (String name : options.getInclude()) {
        if (!input.hasColumn(name))
          throw new TransformException("PCA input column '" + name + "' does not exist.");
        if (!input.getColumnType(name).isNumericScalar())
          throw new TransformException(
              "PCA input column '" + name + "' is of type " + input.getColumnType(name) + " which is not numeric.");
        res.add(name);
      }
    } else {
      for (String name : input.getColumnNames())
        if (input.getColumnType(name).isNumericScalar())
          res.add(name);
    }
    res.removeAll(options.getExclude());
    if (res.isEmpty())
      throw new TransformException("PCA found no numeric columns to use.");
    return res;
  }

  private void prepare(RealMatrix x) {
    int n = x.getRowDimension();
    for (int col = 0; col < x.getColumnDimension(); col++) {
      double[] values = x.getColumn(col);
      double mean = Arrays.stream(values).average().orElse(0.);
      if (options.isCenter() || options.isStandardize()) {
        for (int i = 0; i < n; i++)
          values[i] -= mean;
      }
      if (options.isStandardize()) {
        double sumSq = Arrays.stream(values).map(v -> v * v).sum();
        double std = Math.sqrt(sumSq / (n - 1));
        if (std > 0)
          for (int i = 0; i < n; i++)
            values[i] /= std;
      }
      x.setColumn(col, values);
    }
  }

  private RealVector orient(RealVector vector) {
    int maxIdx = 0;
    for (int i = 1; i < vector.getDimension(); i++)
      if (Math.abs(vector.getEntry(i)) > Math.abs(vector.getEntry(maxIdx)))
        maxIdx = i;
    return vector.getEntry(maxIdx) < 0 ? vector.mapMultiply(-1.) : vector;
  }
}
