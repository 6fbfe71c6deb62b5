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

/**
 * A computer or adapter could not be created, e.g. because its name is unknown or its parameters are invalid.
 *
 * @author The chronoqube authors
 */
public class ComputerCreationException extends Exception {
  private static final long serialVersionUID = 1L;

  public ComputerCreationException(String msg) {
    super(msg);
  }

  public ComputerCreationException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
