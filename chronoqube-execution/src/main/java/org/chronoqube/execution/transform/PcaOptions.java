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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Options of {@link PcaTransform}.
 *
 * @author The chronoqube authors
 */
public final class PcaOptions {
  private final boolean center;
  private final boolean standardize;
  private final List<String> include;
  private final List<String> exclude;

  /**
   * @param include
   *          if not empty, only these columns are used.
   * @param exclude
   *          these columns are not used.
   */
  public PcaOptions(boolean center, boolean standardize, List<String> include, List<String> exclude) {
    this.center = center;
    this.standardize = standardize;
    this.include = ImmutableList.copyOf(include);
    this.exclude = ImmutableList.copyOf(exclude);
  }

  public boolean isCenter() {
    return center;
  }

  public boolean isStandardize() {
    return standardize;
  }

  public List<String> getInclude() {
    return include;
  }

  public List<String> getExclude() {
    return exclude;
  }
}
