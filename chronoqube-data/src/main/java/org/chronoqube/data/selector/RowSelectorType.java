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
package org.chronoqube.data.selector;

/**
 * The kinds of {@link RowSelector}s.
 *
 * @author The chronoqube authors
 */
public enum RowSelectorType {
  INDEX("index"), INTERVAL("interval"), TIMESTAMP("timestamp");

  private final String configName;

  private RowSelectorType(String configName) {
    this.configName = configName;
  }

  /**
   * @return The name used for this type in pipeline configurations.
   */
  public String getConfigName() {
    return configName;
  }

  /**
   * @return true if rows of this selector type can be consumed by a computer requiring the given selector type. Index
   *         rows can be consumed by computers requiring timestamp rows, as both are lowered to index plans.
   */
  public boolean canFeed(RowSelectorType requiredType) {
    return this == requiredType || (this == INDEX && requiredType == TIMESTAMP);
  }

  /**
   * @return The type with the given config name or <code>null</code> if there is none.
   */
  public static RowSelectorType fromConfigName(String configName) {
    for (RowSelectorType t : values())
      if (t.configName.equals(configName))
        return t;
    return null;
  }
}
