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

import javax.annotation.PostConstruct;
import javax.inject.Inject;

import org.chronoqube.computer.registry.BuiltInComputers;
import org.chronoqube.computer.registry.ComputerRegistry;
import org.chronoqube.config.Config;
import org.chronoqube.config.ConfigKey;
import org.chronoqube.context.AutoInstatiate;
import org.chronoqube.execution.TableRegistry;
import org.chronoqube.pipeline.catalog.DataSourceCatalog;

/**
 * Creates {@link TablePipeline}s that store their tables in the {@link TableRegistry} of the context and use the
 * configured settings.
 *
 * @author The chronoqube authors
 */
@AutoInstatiate
public class TablePipelineFactory {
  @Config(ConfigKey.DEFAULT_TIME_FRAME_KEY)
  private String defaultTimeFrameKey;

  @Config(ConfigKey.TRANSFORM_FAIL_ON_ERROR)
  private boolean transformFailOnError;

  @Config(ConfigKey.PCA_CENTER)
  private boolean pcaCenter;

  @Config(ConfigKey.PCA_STANDARDIZE)
  private boolean pcaStandardize;

  @Inject
  private TableRegistry tableRegistry;

  private ComputerRegistry computerRegistry;

  @PostConstruct
  public void initialize() {
    computerRegistry = BuiltInComputers.buildRegistry();
  }

  public TablePipeline createTablePipeline(DataSourceCatalog catalog) {
    return new TablePipeline(computerRegistry, tableRegistry, catalog, getSettings());
  }

  public PipelineSettings getSettings() {
    return new PipelineSettings(defaultTimeFrameKey, transformFailOnError, pcaCenter, pcaStandardize);
  }

  public ComputerRegistry getComputerRegistry() {
    return computerRegistry;
  }
}
