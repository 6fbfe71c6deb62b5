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
package org.chronoqube.computer.registry;

import java.util.Map;

/**
 * An integer parameter with inclusive bounds.
 *
 * @author The chronoqube authors
 */
public class IntParameterDescriptor extends ParameterDescriptor {
  private final int defaultValue;
  private final int min;
  private final int max;

  public IntParameterDescriptor(String name, String description, int defaultValue, int min, int max) {
    super(name, description);
    this.defaultValue = defaultValue;
    this.min = min;
    this.max = max;
  }

  /**
   * @return The value of the parameter or the default value if it is not set.
   * @throws IllegalArgumentException
   *           if the value is no integer or out of bounds.
   */
  public int parse(Map<String, String> parameters) throws IllegalArgumentException {
    String raw = rawValue(parameters);
    if (raw == null)
      return defaultValue;
    int res;
    try {
      res = Integer.parseInt(raw);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Parameter '" + getName() + "' must be an integer, but was '" + raw + "'", e);
    }
    if (res < min || res > max)
      throw new IllegalArgumentException(
          "Parameter '" + getName() + "' must be between " + min + " and " + max + ", but was " + res);
    return res;
  }

  public int getMin() {
    return min;
  }

  public int getMax() {
    return max;
  }

  @Override
  public String getDefaultValue() {
    return Integer.toString(defaultValue);
  }

  @Override
  public String getTypeName() {
    return "int " + min + ".." + max;
  }
}
