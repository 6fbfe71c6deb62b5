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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.common.base.Splitter;

/**
 * A comma separated list of integers.
 *
 * @author The chronoqube authors
 */
public class IntListParameterDescriptor extends ParameterDescriptor {
  private final String defaultValue;

  public IntListParameterDescriptor(String name, String description, String defaultValue) {
    super(name, description);
    this.defaultValue = defaultValue;
  }

  /**
   * @return The values of the parameter or the parsed default value if it is not set.
   * @throws IllegalArgumentException
   *           if an element is no integer or the list is empty.
   */
  public List<Integer> parse(Map<String, String> parameters) throws IllegalArgumentException {
    String raw = rawValue(parameters);
    if (raw == null)
      raw = defaultValue;
    List<Integer> res = new ArrayList<>();
    for (String s : Splitter.on(',').trimResults().omitEmptyStrings().split(raw)) {
      try {
        res.add(Integer.parseInt(s));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Parameter '" + getName() + "' contains invalid integer '" + s + "'", e);
      }
    }
    if (res.isEmpty())
      throw new IllegalArgumentException("Parameter '" + getName() + "' must contain at least one integer.");
    return res;
  }

  @Override
  public String getDefaultValue() {
    return defaultValue;
  }

  @Override
  public String getTypeName() {
    return "int list";
  }
}
