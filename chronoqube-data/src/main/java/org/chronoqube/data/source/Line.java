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
package org.chronoqube.data.source;

import com.google.common.base.Preconditions;

/**
 * An immutable 2D polyline.
 *
 * @author The chronoqube authors
 */
public final class Line {
  private final float[] xs;
  private final float[] ys;

  public Line(float[] xs, float[] ys) {
    Preconditions.checkArgument(xs.length == ys.length, "x and y coordinates need to have the same length");
    this.xs = xs.clone();
    this.ys = ys.clone();
  }

  /**
   * @param coords
   *          alternating x and y coordinates.
   */
  public static Line of(float... coords) {
    Preconditions.checkArgument(coords.length % 2 == 0, "Need an even number of coordinates");
    float[] xs = new float[coords.length / 2];
    float[] ys = new float[coords.length / 2];
    for (int i = 0; i < xs.length; i++) {
      xs[i] = coords[2 * i];
      ys[i] = coords[2 * i + 1];
    }
    return new Line(xs, ys);
  }

  public int getPointCount() {
    return xs.length;
  }

  public float getX(int pointIdx) {
    return xs[pointIdx];
  }

  public float getY(int pointIdx) {
    return ys[pointIdx];
  }

  /**
   * @return Sum of the euclidean lengths of all segments.
   */
  public double getLength() {
    double res = 0.;
    for (int i = 1; i < xs.length; i++)
      res += segmentLength(i);
    return res;
  }

  /**
   * @return Length of the segment ending at the given point index.
   */
  public double segmentLength(int endPointIdx) {
    double dx = xs[endPointIdx] - xs[endPointIdx - 1];
    double dy = ys[endPointIdx] - ys[endPointIdx - 1];
    return Math.sqrt(dx * dx + dy * dy);
  }
}
