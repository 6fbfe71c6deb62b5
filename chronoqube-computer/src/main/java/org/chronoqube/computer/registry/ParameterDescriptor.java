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
 * Describes a parameter of a computer or adapter. Parameters are passed as strings.
 *
 * @author The chronoqube authors
 */
public abstract class ParameterDescriptor {
  private final String name;
  private final String description;

  protected ParameterDescriptor(String name, String description) {
    this.name = name;
    this.description = description;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  /**
   * @return The default value as string.
   */
  public abstract String getDefaultValue();

  /**
   * @return Short type description, e.g. for listing computers.
   */
  public abstract String getTypeName();

  /**
   * @return The raw value of this parameter in the map, trimmed, or <code>null</code> if it is not set.
   */
  protected String rawValue(Map<String, String> parameters) {
    String res = parameters.get(name);
    if (res == null || res.trim().isEmpty())
      return null;
    return res.trim();
  }

  @Override
  public String toString() {
    return name + " (" + getTypeName() + ", default " + getDefaultValue() + ")";
  }
}
