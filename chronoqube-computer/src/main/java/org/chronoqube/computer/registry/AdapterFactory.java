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

import org.chronoqube.data.source.DataSourceVariant;

/**
 * Wraps raw data into a source.
 * 
 * <p>
 * The raw data passed is guaranteed to be an instance of the input type of the corresponding {@link AdapterInfo}.
 *
 * @author The chronoqube authors
 */
@FunctionalInterface
public interface AdapterFactory {
  /**
   * @throws IllegalArgumentException
   *           if a parameter is invalid.
   */
  DataSourceVariant create(Object rawData, String sourceName, Map<String, String> parameters)
      throws IllegalArgumentException;
}
