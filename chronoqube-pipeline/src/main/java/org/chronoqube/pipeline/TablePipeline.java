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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.chronoqube.computer.TypedComputer;
import org.chronoqube.computer.registry.ComputerCreationException;
import org.chronoqube.computer.registry.ComputerInfo;
import org.chronoqube.computer.registry.ComputerRegistry;
import org.chronoqube.data.selector.RowSelector;
import org.chronoqube.data.source.DataSourceVariant;
import org.chronoqube.execution.ColumnComputationException;
import org.chronoqube.execution.TableRegistry;
import org.chronoqube.execution.TableView;
import org.chronoqube.execution.TableViewBuilder;
import org.chronoqube.execution.transform.TableTransform;
import org.chronoqube.execution.transform.TransformException;
import org.chronoqube.pipeline.catalog.DataSourceCatalog;
import org.chronoqube.pipeline.config.ColumnConfiguration;
import org.chronoqube.pipeline.config.DataSourceReference;
import org.chronoqube.pipeline.config.PipelineConfiguration;
import org.chronoqube.pipeline.config.PipelineConfigurationException;
import org.chronoqube.pipeline.config.PipelineConfigurationParser;
import org.chronoqube.pipeline.config.TableConfiguration;
import org.chronoqube.pipeline.config.TransformConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

/**
 * Builds tables from a JSON pipeline configuration and stores them in a {@link TableRegistry}.
 * 
 * <p>
 * A pipeline is first loaded using {@link #loadFromJson(String)}, which validates all table configurations. Then
 * {@link #execute(ProgressCallback)} builds the tables sequentially in configuration order. The first table that
 * fails stops the execution; a failed table is not stored, tables built before it stay available.
 * 
 * <p>
 * For each column the data source is resolved by key as analog, event, interval and line source, in that order, the
 * first match wins. Alternatively a column can name raw data and an adapter to wrap it into a source.
 * 
 * <p>
 * Instances are not thread safe. Use {@link TablePipelineFactory} to create instances.
 *
 * @author The chronoqube authors
 */
public class TablePipeline {
  private static final Logger logger = LoggerFactory.getLogger(TablePipeline.class);

  private final ComputerRegistry computerRegistry;
  private final TableRegistry tableRegistry;
  private final DataSourceCatalog catalog;
  private final PipelineSettings settings;
  private final RowSelectorFactory rowSelectorFactory;
  private final TableTransformFactory transformFactory;
  private final PipelineConfigurationParser parser = new PipelineConfigurationParser();

  private List<TableConfiguration> tables = new ArrayList<>();
  private JsonNode metadata = JsonNodeFactory.instance.objectNode();

  public TablePipeline(ComputerRegistry computerRegistry, TableRegistry tableRegistry, DataSourceCatalog catalog,
      PipelineSettings settings) {
    this.computerRegistry = computerRegistry;
    this.tableRegistry = tableRegistry;
    this.catalog = catalog;
    this.settings = settings;
    this.rowSelectorFactory = new RowSelectorFactory(catalog, settings.getDefaultTimeFrameKey());
    this.transformFactory = new TableTransformFactory(settings);
  }

  /**
   * Loads the table configurations of the given JSON, replacing any that were loaded before. If the JSON is invalid,
   * nothing is changed.
   * 
   * @throws PipelineConfigurationException
   *           if the JSON is invalid.
   */
  public void loadFromJson(String json) throws PipelineConfigurationException {
    PipelineConfiguration config = parser.parse(json);
    tables = new ArrayList<>(config.getTables());
    metadata = config.getMetadata();
    logger.info("Loaded pipeline configuration with {} tables", tables.size());
  }

  public void loadFromJsonFile(File file) throws PipelineConfigurationException {
    String json;
    try {
      json = Files.asCharSource(file, StandardCharsets.UTF_8).read();
    } catch (IOException e) {
      throw new PipelineConfigurationException("Could not read " + file.getAbsolutePath() + ": " + e.getMessage(), e);
    }
    loadFromJson(json);
  }

  public List<TableConfiguration> getTableConfigurations() {
    return ImmutableList.copyOf(tables);
  }

  public JsonNode getMetadata() {
    return metadata;
  }

  public void clear() {
    tables = new ArrayList<>();
    metadata = JsonNodeFactory.instance.objectNode();
  }

  /**
   * Builds all loaded tables. Never throws because of a failing table, but reports it in the result.
   * 
   * @param callback
   *          may be <code>null</code>.
   */
  public PipelineResult execute(ProgressCallback callback) {
    long startNanos = System.nanoTime();
    List<TableBuildResult> results = new ArrayList<>();
    int completed = 0;

    for (int i = 0; i < tables.size(); i++) {
      TableConfiguration config = tables.get(i);
      int tableIdx = i;
      int overall = (i * 100) / tables.size();
      ColumnCounter counter = new ColumnCounter();
      long tableStartNanos = System.nanoTime();
      logger.info("Building table '{}' ({}/{})", config.getTableId(), i + 1, tables.size());

      String errorMessage;
      try {
        if (callback != null)
          callback.progress(tableIdx, config.getName(), 0, overall);
        buildTable(config, (columnsDone, totalColumns) -> {
          counter.done = columnsDone;
          if (callback != null)
            callback.progress(tableIdx, config.getName(), totalColumns > 0 ? (columnsDone * 100) / totalColumns : 100,
                overall);
        });
        results.add(new TableBuildResult(config.getTableId(), true, null, counter.done, config.getColumns().size(),
            millisSince(tableStartNanos)));
        completed++;
        continue;
      } catch (TableBuildException e) {
        errorMessage = e.getColumnName() != null ? "Column '" + e.getColumnName() + "': " + e.getMessage()
            : e.getMessage();
      } catch (RuntimeException e) {
        errorMessage = e.getClass().getSimpleName() + ": " + e.getMessage();
        logger.debug("Unexpected exception while building table '{}'", config.getTableId(), e);
      }

      results.add(new TableBuildResult(config.getTableId(), false, errorMessage, counter.done,
          config.getColumns().size(), millisSince(tableStartNanos)));
      String msg = "Failed to build table '" + config.getTableId() + "': " + errorMessage;
      logger.error(msg);
      return new PipelineResult(false, msg, completed, tables.size(), results, millisSince(startNanos));
    }

    logger.info("Built {} tables in {} ms", completed, Math.round(millisSince(startNanos)));
    return new PipelineResult(true, null, completed, tables.size(), results, millisSince(startNanos));
  }

  private void buildTable(TableConfiguration config, ColumnProgress progress) throws TableBuildException {
    RowSelector rowSelector = rowSelectorFactory.create(config.getRowSelector());

    TableViewBuilder builder = new TableViewBuilder().setRowSelector(rowSelector);
    for (ColumnConfiguration column : config.getColumns()) {
      TypedComputer<?> computer = createComputer(column, rowSelector);
      try {
        builder.addColumn(column.getName(), computer);
      } catch (IllegalArgumentException e) {
        throw new TableBuildException(column.getName(), e.getMessage(), e);
      }
      logger.debug("Added column '{}' using computer '{}' on '{}'", column.getName(), column.getComputer(),
          column.getDataSource());
    }

    TableView view;
    try {
      view = builder.build((columnName, columnsDone, totalColumns) -> progress.columnsDone(columnsDone, totalColumns));
    } catch (ColumnComputationException e) {
      throw new TableBuildException(e.getColumnName(), e.getMessage(), e);
    }

    List<DerivedTable> derivedTables = applyTransforms(config, view);

    String id = config.getTableId();
    if (tableRegistry.hasTable(id))
      tableRegistry.updateTableInfo(id, config.getName(), config.getDescription(), config.getTags());
    else {
      tableRegistry.createTable(id, config.getName(), config.getDescription());
      tableRegistry.updateTableInfo(id, config.getName(), config.getDescription(), config.getTags());
    }
    tableRegistry.storeBuiltTable(id, view);

    for (DerivedTable derived : derivedTables)
      storeDerivedTable(config, derived);
  }

  private TypedComputer<?> createComputer(ColumnConfiguration column, RowSelector rowSelector)
      throws TableBuildException {
    DataSourceVariant source = resolveDataSource(column);

    ComputerInfo info = computerRegistry.findComputerInfo(column.getComputer());
    if (info == null)
      throw new TableBuildException(column.getName(), "Computer not found: " + column.getComputer());
    if (info.getRequiredSourceKind() != source.getKind())
      throw new TableBuildException(column.getName(), "Computer '" + column.getComputer() + "' requires a "
          + info.getRequiredSourceKind() + " source, but '" + source.getName() + "' is a " + source.getKind()
          + " source");
    if (!rowSelector.getType().canFeed(info.getRequiredSelectorType()))
      throw new TableBuildException(column.getName(),
          "Computer '" + column.getComputer() + "' requires " + info.getRequiredSelectorType().getConfigName()
              + " rows, but the table has " + rowSelector.getType().getConfigName() + " rows");

    Map<String, String> params = new HashMap<>(column.getParameters());
    params.put(ComputerRegistry.SOURCE_NAME_KEY, source.getName());
    try {
      return computerRegistry.createComputer(column.getComputer(), source, params);
    } catch (ComputerCreationException e) {
      throw new TableBuildException(column.getName(), e.getMessage(), e);
    }
  }

  private DataSourceVariant resolveDataSource(ColumnConfiguration column) throws TableBuildException {
    DataSourceReference ref = column.getDataSource();
    if (ref.isAdapted()) {
      Object raw = catalog.getRawData(ref.getKey());
      if (raw == null)
        throw new TableBuildException(column.getName(), "Raw data '" + ref.getKey() + "' not found");
      try {
        return computerRegistry.createAdapter(ref.getAdapter(), raw, ref.getKey(), column.getParameters());
      } catch (ComputerCreationException e) {
        throw new TableBuildException(column.getName(), e.getMessage(), e);
      }
    }

    String key = ref.getKey();
    if (catalog.getAnalogSource(key) != null)
      return DataSourceVariant.of(catalog.getAnalogSource(key));
    if (catalog.getEventSource(key) != null)
      return DataSourceVariant.of(catalog.getEventSource(key));
    if (catalog.getIntervalSource(key) != null)
      return DataSourceVariant.of(catalog.getIntervalSource(key));
    if (catalog.getLineSource(key) != null)
      return DataSourceVariant.of(catalog.getLineSource(key));
    throw new TableBuildException(column.getName(), "Data source '" + key + "' not found");
  }

  /**
   * Applies the transforms of the table. Failing transforms are skipped unless transforms are configured to fail the
   * table.
   */
  private List<DerivedTable> applyTransforms(TableConfiguration config, TableView base) throws TableBuildException {
    List<DerivedTable> res = new ArrayList<>();
    for (TransformConfiguration transformConfig : config.getTransforms()) {
      try {
        TableTransform transform = transformFactory.create(transformConfig);
        res.add(new DerivedTable(transformConfig, transform.getName(), transform.apply(base)));
      } catch (PipelineConfigurationException | TransformException e) {
        if (settings.isTransformFailOnError())
          throw new TableBuildException(null,
              "Transform '" + transformConfig.getType() + "' failed: " + e.getMessage(), e);
        logger.warn("Transform '{}' of table '{}' failed, ignoring: {}", transformConfig.getType(),
            config.getTableId(), e.getMessage());
      }
    }
    return res;
  }

  private void storeDerivedTable(TableConfiguration config, DerivedTable derived) {
    TransformConfiguration transformConfig = derived.config;
    String outId = transformConfig.getOutputTableId();
    if (outId == null)
      outId = tableRegistry
          .generateUniqueTableId(config.getTableId() + "_" + derived.transformName.toLowerCase(Locale.ROOT));
    String outName = transformConfig.getOutputName() != null ? transformConfig.getOutputName()
        : config.getName() + " (" + derived.transformName + ")";
    String outDescription = transformConfig.getOutputDescription() != null ? transformConfig.getOutputDescription()
        : derived.transformName + " of table '" + config.getTableId() + "'";

    if (!tableRegistry.createTable(outId, outName, outDescription))
      tableRegistry.updateTableInfo(outId, outName, outDescription, ImmutableList.of());
    tableRegistry.storeBuiltTable(outId, derived.view);
    logger.info("Transform '{}' of table '{}' stored as '{}'", derived.transformName, config.getTableId(), outId);
  }

  private double millisSince(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000.;
  }

  private interface ColumnProgress {
    void columnsDone(int columnsDone, int totalColumns);
  }

  private static class ColumnCounter {
    private int done = 0;
  }

  private static class DerivedTable {
    private final TransformConfiguration config;
    private final String transformName;
    private final TableView view;

    DerivedTable(TransformConfiguration config, String transformName, TableView view) {
      this.config = config;
      this.transformName = transformName;
      this.view = view;
    }
  }
}
