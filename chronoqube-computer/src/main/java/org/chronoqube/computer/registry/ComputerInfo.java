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

import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.SourceKind;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Metadata of a computer registered in the {@link ComputerRegistry}.
 *
 * @author The chronoqube authors
 */
public final class ComputerInfo {
  private final String name;
  private final String description;
  private final ColumnType<?> outputType;
  private final RowSelectorType requiredSelectorType;
  private final SourceKind requiredSourceKind;
  private final List<ParameterDescriptor> parameters;
  private final boolean multiOutput;
  private final boolean entityExpanding;

  private ComputerInfo(Builder builder) {
    this.name = Preconditions.checkNotNull(builder.name);
    this.description = builder.description;
    this.outputType = Preconditions.checkNotNull(builder.outputType);
    this.requiredSelectorType = Preconditions.checkNotNull(builder.requiredSelectorType);
    this.requiredSourceKind = Preconditions.checkNotNull(builder.requiredSourceKind);
    this.parameters = ImmutableList.copyOf(builder.parameters);
    this.multiOutput = builder.multiOutput;
    this.entityExpanding = builder.entityExpanding;
  }

  public static Builder builder(String name, ColumnType<?> outputType, RowSelectorType selectorType,
      SourceKind sourceKind) {
    return new Builder(name, outputType, selectorType, sourceKind);
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public ColumnType<?> getOutputType() {
    return outputType;
  }

  public RowSelectorType getRequiredSelectorType() {
    return requiredSelectorType;
  }

  public SourceKind getRequiredSourceKind() {
    return requiredSourceKind;
  }

  public List<ParameterDescriptor> getParameters() {
    return parameters;
  }

  public boolean isMultiOutput() {
    return multiOutput;
  }

  public boolean isEntityExpanding() {
    return entityExpanding;
  }

  public boolean isVectorType() {
    return outputType.isVector();
  }

  /**
   * @return Type of the vector elements, or the output type class for scalar computers.
   */
  public Class<?> getElementType() {
    return outputType.getElementType();
  }

  @Override
  public String toString() {
    return name + " [" + outputType + ", " + requiredSelectorType + ", " + requiredSourceKind + "]";
  }

  /**
   * Builder for {@link ComputerInfo}.
   */
  public static class Builder {
    private final String name;
    private final ColumnType<?> outputType;
    private final RowSelectorType requiredSelectorType;
    private final SourceKind requiredSourceKind;
    private String description = "";
    private List<ParameterDescriptor> parameters = ImmutableList.of();
    private boolean multiOutput = false;
    private boolean entityExpanding = false;

    private Builder(String name, ColumnType<?> outputType, RowSelectorType selectorType, SourceKind sourceKind) {
      this.name = name;
      this.outputType = outputType;
      this.requiredSelectorType = selectorType;
      this.requiredSourceKind = sourceKind;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder parameters(ParameterDescriptor... parameters) {
      this.parameters = ImmutableList.copyOf(parameters);
      return this;
    }

    public Builder multiOutput() {
      this.multiOutput = true;
      return this;
    }

    public Builder entityExpanding() {
      this.entityExpanding = true;
      return this;
    }

    public ComputerInfo build() {
      return new ComputerInfo(this);
    }
  }
}
