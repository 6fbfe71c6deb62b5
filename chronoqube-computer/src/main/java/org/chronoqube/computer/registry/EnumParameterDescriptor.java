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

import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A parameter whose value is one of a fixed set of options.
 *
 * @author The chronoqube authors
 */
public class EnumParameterDescriptor extends ParameterDescriptor {
  private final List<String> options;
  private final String defaultValue;

  public EnumParameterDescriptor(String name, String description, List<String> options, String defaultValue) {
    super(name, description);
    Preconditions.checkArgument(options.contains(defaultValue), "Default value must be one of the options");
    this.options = ImmutableList.copyOf(options);
    this.defaultValue = defaultValue;
  }

  /**
   * @return The value of the parameter or the default value if it is not set.
   * @throws IllegalArgumentException
   *           if the value is none of the options.
   */
  public String parse(Map<String, String> parameters) throws IllegalArgumentException {
    String raw = rawValue(parameters);
    if (raw == null)
      return defaultValue;
    if (!options.contains(raw))
      throw new IllegalArgumentException(
          "Parameter '" + getName() + "' must be one of " + options + ", but was '" + raw + "'");
    return raw;
  }

  public List<String> getOptions() {
    return options;
  }

  @Override
  public String getDefaultValue() {
    return defaultValue;
  }

  @Override
  public String getTypeName() {
    return Joiner.on('|').join(options);
  }
}
