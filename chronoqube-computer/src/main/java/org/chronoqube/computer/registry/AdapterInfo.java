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

import org.chronoqube.data.source.SourceKind;

import com.google.common.collect.ImmutableList;

/**
 * Metadata of an adapter registered in the {@link ComputerRegistry}. An adapter wraps raw data of a specific type into
 * a source of a specific {@link SourceKind}.
 *
 * @author The chronoqube authors
 */
public final class AdapterInfo {
  private final String name;
  private final String description;
  private final Class<?> inputType;
  private final SourceKind outputKind;
  private final List<ParameterDescriptor> parameters;

  public AdapterInfo(String name, String description, Class<?> inputType, SourceKind outputKind,
      ParameterDescriptor... parameters) {
    this.name = name;
    this.description = description;
    this.inputType = inputType;
    this.outputKind = outputKind;
    this.parameters = ImmutableList.copyOf(parameters);
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public Class<?> getInputType() {
    return inputType;
  }

  public SourceKind getOutputKind() {
    return outputKind;
  }

  public List<ParameterDescriptor> getParameters() {
    return parameters;
  }

  @Override
  public String toString() {
    return name + " [" + inputType.getSimpleName() + " -> " + outputKind + "]";
  }
}
