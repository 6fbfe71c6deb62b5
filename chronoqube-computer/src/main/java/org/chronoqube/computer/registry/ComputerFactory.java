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

import org.chronoqube.computer.TypedComputer;
import org.chronoqube.data.source.DataSourceVariant;

/**
 * Creates a computer from a source and string parameters.
 * 
 * <p>
 * The source passed is guaranteed to be of the kind the corresponding {@link ComputerInfo} requires.
 *
 * @author The chronoqube authors
 */
@FunctionalInterface
public interface ComputerFactory {
  /**
   * @throws IllegalArgumentException
   *           if a parameter is invalid.
   */
  TypedComputer<?> create(DataSourceVariant source, Map<String, String> parameters) throws IllegalArgumentException;
}
