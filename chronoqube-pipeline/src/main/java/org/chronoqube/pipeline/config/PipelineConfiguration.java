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

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

/**
 * A parsed pipeline configuration file.
 *
 * @author The chronoqube authors
 */
public final class PipelineConfiguration {
  private final JsonNode metadata;
  private final List<TableConfiguration> tables;

  public PipelineConfiguration(JsonNode metadata, List<TableConfiguration> tables) {
    this.metadata = metadata;
    this.tables = ImmutableList.copyOf(tables);
  }

  /**
   * @return The free-form <code>metadata</code> object, an empty object if there was none.
   */
  public JsonNode getMetadata() {
    return metadata;
  }

  public List<TableConfiguration> getTables() {
    return tables;
  }
}
