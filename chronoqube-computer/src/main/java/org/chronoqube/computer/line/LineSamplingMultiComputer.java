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
package org.chronoqube.computer.line;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.chronoqube.computer.MultiColumnComputer;
import org.chronoqube.computer.MultiComputerResult;
import org.chronoqube.data.column.ColumnEntityIds;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.plan.ExecutionPlan;
import org.chronoqube.data.plan.RowId;
import org.chronoqube.data.source.Line;
import org.chronoqube.data.source.LineSource;
import org.chronoqube.data.source.LineWithId;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Samples x and y coordinates of a line at <code>segments + 1</code> equally spaced positions along its arc length
 * (0.0 to 1.0).
 * 
 * <p>
 * Suffixes are <code>x@0.000, y@0.000, x@0.500, y@0.500, ...</code>. Rows without a line get 0 coordinates.
 *
 * @author The chronoqube authors
 */
public class LineSamplingMultiComputer extends AbstractLineComputer<Double> implements MultiColumnComputer<Double> {
  private final int segments;
  private final List<String> suffixes;

  public LineSamplingMultiComputer(LineSource source, int segments) {
    super(source, ColumnType.DOUBLE);
    Preconditions.checkArgument(segments >= 1, "Need at least one segment, but got %s", segments);
    this.segments = segments;
    ImmutableList.Builder<String> suffixBuilder = ImmutableList.builder();
    for (int i = 0; i <= segments; i++) {
      String position = String.format(Locale.ROOT, "%.3f", position(i));
      suffixBuilder.add("x@" + position);
      suffixBuilder.add("y@" + position);
    }
    this.suffixes = suffixBuilder.build();
  }

  private double position(int sampleIdx) {
    return (double) sampleIdx / segments;
  }

  @Override
  public List<String> getOutputSuffixes() {
    return suffixes;
  }

  @Override
  public MultiComputerResult<Double> computeBatch(ExecutionPlan plan) {
    List<RowId> rows = resolveRows(plan);

    List<List<Double>> res = new ArrayList<>();
    for (int i = 0; i < suffixes.size(); i++)
      res.add(new ArrayList<>(rows.size()));
    List<Long> ids = new ArrayList<>(rows.size());

    for (RowId row : rows) {
      LineWithId line = lineOf(row, plan.getTimeFrame());
      ids.add(line != null ? line.getEntityId() : null);
      for (int i = 0; i <= segments; i++) {
        double[] xy = (line != null) ? sample(line.getLine(), position(i)) : new double[] { 0., 0. };
        res.get(2 * i).add(xy[0]);
        res.get(2 * i + 1).add(xy[1]);
      }
    }
    return new MultiComputerResult<>(res, ColumnEntityIds.simple(ids));
  }

  /**
   * @return x and y of the point at the given fraction of the arc length of the line. 0 coordinates for an empty line.
   */
  /* package */ static double[] sample(Line line, double fraction) {
    if (line.getPointCount() == 0)
      return new double[] { 0., 0. };

    double total = line.getLength();
    if (line.getPointCount() == 1 || total == 0.)
      return new double[] { line.getX(0), line.getY(0) };

    double target = fraction * total;
    double walked = 0.;
    for (int i = 1; i < line.getPointCount(); i++) {
      double segmentLength = line.segmentLength(i);
      if (segmentLength > 0. && walked + segmentLength >= target) {
        double t = (target - walked) / segmentLength;
        return new double[] { line.getX(i - 1) + t * (line.getX(i) - line.getX(i - 1)),
            line.getY(i - 1) + t * (line.getY(i) - line.getY(i - 1)) };
      }
      walked += segmentLength;
    }
    int last = line.getPointCount() - 1;
    return new double[] { line.getX(last), line.getY(last) };
  }
}
