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
package org.chronoqube.pipeline.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * One entry of the <code>transforms</code> of a table configuration.
 *
 * @author The chronoqube authors
 */
public final class TransformConfiguration {
  private final String type;
  private final JsonNode parameters;
  private final String outputTableId;
  private final String outputName;
  private final String outputDescription;

  public TransformConfiguration(String type, JsonNode parameters, String outputTableId, String outputName,
      String outputDescription) {
    this.type = type;
    this.parameters = parameters == null ? JsonNodeFactory.instance.objectNode() : parameters.deepCopy();
    this.outputTableId = outputTableId;
    this.outputName = outputName;
    this.outputDescription = outputDescription;
  }

  public String getType() {
    return type;
  }

  public JsonNode getParameters() {
    return parameters;
  }

  /**
   * @return <code>null</code> if a unique id should be generated.
   */
  public String getOutputTableId() {
    return outputTableId;
  }

  public String getOutputName() {
    return outputName;
  }

  public String getOutputDescription() {
    return outputDescription;
  }
}
