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
package org.chronoqube.tool.validate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.chronoqube.computer.registry.AdapterInfo;
import org.chronoqube.computer.registry.ComputerInfo;
import org.chronoqube.computer.registry.ComputerRegistry;
import org.chronoqube.pipeline.PipelineSettings;
import org.chronoqube.pipeline.TableTransformFactory;
import org.chronoqube.pipeline.config.ColumnConfiguration;
import org.chronoqube.pipeline.config.PipelineConfiguration;
import org.chronoqube.pipeline.config.PipelineConfigurationException;
import org.chronoqube.pipeline.config.PipelineConfigurationParser;
import org.chronoqube.pipeline.config.TableConfiguration;
import org.chronoqube.pipeline.config.TransformConfiguration;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a pipeline configuration against a {@link ComputerRegistry} without reading any data.
 *
 * <p>
 * Problems that can only be found with the actual data at hand (e.g. missing source keys) are not reported.
 *
 * @author The chronoqube authors
 */
public class ValidateImplementation {
  private static final Logger logger = LoggerFactory.getLogger(ValidateImplementation.class);

  private final ComputerRegistry registry;
  private final TableTransformFactory transformFactory;

  public ValidateImplementation(ComputerRegistry registry, PipelineSettings settings) {
    this.registry = registry;
    this.transformFactory = new TableTransformFactory(settings);
  }

  /**
   * @return Human readable problems, empty if the configuration is fine.
   */
  public List<String> validate(String json) {
    List<String> problems = new ArrayList<>();
    PipelineConfiguration config;
    try {
      config = new PipelineConfigurationParser().parse(json);
    } catch (PipelineConfigurationException e) {
      problems.add(e.getMessage());
      return problems;
    }

    Set<String> tableIds = new HashSet<>();
    for (TableConfiguration table : config.getTables()) {
      logger.debug("Validating table '{}' with {} columns", table.getTableId(), table.getColumns().size());
      if (!tableIds.add(table.getTableId()))
        problems.add("Table '" + table.getTableId() + "': duplicate table id.");

      RowSelectorType selectorType = table.getRowSelector().getType();
      Set<String> columnNames = new HashSet<>();
      for (ColumnConfiguration column : table.getColumns()) {
        String prefix = "Table '" + table.getTableId() + "', column '" + column.getName() + "': ";
        if (!columnNames.add(column.getName()))
          problems.add(prefix + "duplicate column name.");

        SourceKind providedKind = null;
        if (column.getDataSource().isAdapted()) {
          AdapterInfo adapter = registry.findAdapterInfo(column.getDataSource().getAdapter());
          if (adapter == null)
            problems.add(prefix + "Adapter not found: " + column.getDataSource().getAdapter());
          else
            providedKind = adapter.getOutputKind();
        }

        ComputerInfo computer = registry.findComputerInfo(column.getComputer());
        if (computer == null) {
          problems.add(prefix + "Computer not found: " + column.getComputer());
          continue;
        }
        if (!selectorType.canFeed(computer.getRequiredSelectorType()))
          problems.add(prefix + "Computer '" + computer.getName() + "' requires "
              + computer.getRequiredSelectorType().getConfigName() + " rows, but the table has "
              + selectorType.getConfigName() + " rows");
        if (providedKind != null && providedKind != computer.getRequiredSourceKind())
          problems.add(prefix + "Computer '" + computer.getName() + "' requires a " + computer.getRequiredSourceKind()
              + " source, but the adapter provides a " + providedKind + " source");
      }

      for (TransformConfiguration transform : table.getTransforms()) {
        try {
          transformFactory.create(transform);
        } catch (PipelineConfigurationException e) {
          problems.add("Table '" + table.getTableId() + "': " + e.getMessage());
        }
      }
    }
    return problems;
  }

  /**
   * @return The number of tables in the configuration, or -1 if it cannot be parsed.
   */
  public int countTables(String json) {
    try {
      return new PipelineConfigurationParser().parse(json).getTables().size();
    } catch (PipelineConfigurationException e) {
      return -1;
    }
  }
}
