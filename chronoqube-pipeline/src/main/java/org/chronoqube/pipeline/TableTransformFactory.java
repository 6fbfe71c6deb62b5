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
package org.chronoqube.pipeline;

import java.util.ArrayList;
import java.util.List;

import org.chronoqube.execution.transform.PcaOptions;
import org.chronoqube.execution.transform.PcaTransform;
import org.chronoqube.execution.transform.TableTransform;
import org.chronoqube.pipeline.config.PipelineConfigurationException;
import org.chronoqube.pipeline.config.TransformConfiguration;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Creates {@link TableTransform}s from their configuration.
 *
 * @author The chronoqube authors
 */
public class TableTransformFactory {
  public static final String PCA_CENTER = "center";
  public static final String PCA_STANDARDIZE = "standardize";
  public static final String PCA_INCLUDE = "include";
  public static final String PCA_EXCLUDE = "exclude";

  private final PipelineSettings settings;

  public TableTransformFactory(PipelineSettings settings) {
    this.settings = settings;
  }

  /**
   * @throws PipelineConfigurationException
   *           if the type is unknown or a parameter is invalid.
   */
  public TableTransform create(TransformConfiguration config) throws PipelineConfigurationException {
    if (PcaTransform.NAME.equalsIgnoreCase(config.getType())) {
      JsonNode params = config.getParameters();
      boolean center = booleanParam(params, PCA_CENTER, settings.isPcaCenter());
      boolean standardize = booleanParam(params, PCA_STANDARDIZE, settings.isPcaStandardize());
      return new PcaTransform(
          new PcaOptions(center, standardize, stringsParam(params, PCA_INCLUDE), stringsParam(params, PCA_EXCLUDE)));
    }
    throw new PipelineConfigurationException("Unknown transform type '" + config.getType() + "'");
  }

  private boolean booleanParam(JsonNode params, String name, boolean defaultValue)
      throws PipelineConfigurationException {
    JsonNode node = params.get(name);
    if (node == null || node.isNull())
      return defaultValue;
    if (!node.isBoolean())
      throw new PipelineConfigurationException("Transform parameter '" + name + "' must be a boolean.");
    return node.booleanValue();
  }

  private List<String> stringsParam(JsonNode params, String name) throws PipelineConfigurationException {
    List<String> res = new ArrayList<>();
    JsonNode node = params.get(name);
    if (node == null || node.isNull())
      return res;
    if (!node.isArray())
      throw new PipelineConfigurationException("Transform parameter '" + name + "' must be an array of strings.");
    for (JsonNode s : node)
      if (s.isTextual())
        res.add(s.textValue());
    return res;
  }
}
