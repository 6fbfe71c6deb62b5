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
import java.util.List;

import org.chronoqube.data.column.ColumnEntityIds;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;
import org.chronoqube.execution.Column;
import org.chronoqube.execution.RowDescriptor;
import org.chronoqube.execution.TableView;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;

/**
 * Tests {@link PcaTransform}.
 *
 * @author The chronoqube authors
 */
public class PcaTransformTest {
  private TableView table;

  @BeforeMethod
  public void setUp() {
    List<Column<?>> columns = new ArrayList<>();
    columns.add(new Column<>("a", ColumnType.DOUBLE, Arrays.asList(1., 2., 3., 4., Double.NaN),
        ColumnEntityIds.none(), "src"));
    columns.add(new Column<>("b", ColumnType.INT, Arrays.asList(2, 4, 6, 8, 10), ColumnEntityIds.none(), "src"));
    List<List<Float>> vectors = new ArrayList<>();
    for (int i = 0; i < 5; i++)
      vectors.add(ImmutableList.of((float) i));
    columns.add(new Column<>("v", ColumnType.FLOAT_VECTOR, vectors, ColumnEntityIds.none(), "src"));
    List<RowDescriptor> rows = new ArrayList<>();
    for (int i = 0; i < 5; i++)
      rows.add(RowDescriptor.ofIndex(TimeFrameIndex.of(i)));
    table = new TableView(columns, rows, TimeFrame.ofRange(0, 4, 1));
  }

  @Test
  public void correlatedColumns() throws TransformException {
    // GIVEN
    PcaTransform pca = new PcaTransform(new PcaOptions(true, false, ImmutableList.of(), ImmutableList.of()));

    // WHEN
    TableView res = pca.apply(table);

    // THEN
    Assert.assertEquals(res.getColumnNames(), Arrays.asList("PC1", "PC2"), "Expected one component per column");
    Assert.assertEquals(res.getRowCount(), 4, "Expected row with NaN to be dropped");
    List<Double> pc1 = res.getColumnValues("PC1", ColumnType.DOUBLE);
    List<Double> pc2 = res.getColumnValues("PC2", ColumnType.DOUBLE);
    // direction (1, 2) / sqrt(5), first row centered is (-1.5, -3).
    Assert.assertEquals(pc1.get(0), -7.5 / Math.sqrt(5), 1e-9, "Wrong projection onto first component");
    Assert.assertEquals(pc1.get(3), 7.5 / Math.sqrt(5), 1e-9, "Wrong projection onto first component");
    for (double v : pc2)
      Assert.assertEquals(v, 0., 1e-9, "Expected no variance on second component");
    Assert.assertEquals(res.getRowDescriptor(3), RowDescriptor.ofIndex(TimeFrameIndex.of(3)),
        "Expected row descriptors of kept rows");
  }

  @Test
  public void exclude() throws TransformException {
    // GIVEN
    PcaTransform pca = new PcaTransform(new PcaOptions(true, true, ImmutableList.of(), ImmutableList.of("b")));

    // WHEN
    TableView res = pca.apply(table);

    // THEN
    Assert.assertEquals(res.getColumnNames(), Arrays.asList("PC1"), "Expected only column a to be used");
    double sum = res.getColumnValues("PC1", ColumnType.DOUBLE).stream().mapToDouble(Double::doubleValue).sum();
    Assert.assertEquals(sum, 0., 1e-9, "Expected centered scores");
  }

  @Test(expectedExceptions = TransformException.class)
  public void includeVectorColumnFails() throws TransformException {
    new PcaTransform(new PcaOptions(true, false, ImmutableList.of("v"), ImmutableList.of())).apply(table);
  }

  @Test(expectedExceptions = TransformException.class)
  public void tooFewRowsFails() throws TransformException {
    List<Column<?>> columns = new ArrayList<>();
    columns.add(new Column<>("a", ColumnType.DOUBLE, Arrays.asList(1.), ColumnEntityIds.none(), "src"));
    TableView small = new TableView(columns, Arrays.asList(RowDescriptor.ofIndex(TimeFrameIndex.of(0))), null);

    new PcaTransform(new PcaOptions(true, false, ImmutableList.of(), ImmutableList.of())).apply(small);
  }
}
