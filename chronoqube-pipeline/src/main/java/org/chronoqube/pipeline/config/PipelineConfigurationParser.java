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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.time.TimeFrameInterval;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Parses and validates the JSON of a pipeline configuration.
 * 
 * <p>
 * The whole input is validated before anything is returned: the first invalid table fails the parsing.
 *
 * @author The chronoqube authors
 */
public class PipelineConfigurationParser {
  private static final String JSON_METADATA = "metadata";
  private static final String JSON_TABLES = "tables";
  private static final String JSON_TABLE_ID = "table_id";
  private static final String JSON_NAME = "name";
  private static final String JSON_DESCRIPTION = "description";
  private static final String JSON_TAGS = "tags";
  private static final String JSON_ROW_SELECTOR = "row_selector";
  private static final String JSON_COLUMNS = "columns";
  private static final String JSON_TRANSFORMS = "transforms";

  private static final String JSON_TYPE = "type";
  private static final String JSON_SOURCE = "source";
  private static final String JSON_TIMEFRAME = "timeframe";
  private static final String JSON_INTERVALS = "intervals";
  private static final String JSON_TIMESTAMPS = "timestamps";
  private static final String JSON_INDICES = "indices";
  private static final String JSON_START = "start";
  private static final String JSON_END = "end";

  private static final String JSON_COMPUTER = "computer";
  private static final String JSON_DATA_SOURCE = "data_source";
  private static final String JSON_PARAMETERS = "parameters";
  private static final String JSON_KEY = "key";
  private static final String JSON_ADAPTER = "adapter";

  private static final String JSON_OUTPUT_TABLE_ID = "output_table_id";
  private static final String JSON_OUTPUT_NAME = "output_name";
  private static final String JSON_OUTPUT_DESCRIPTION = "output_description";

  private ObjectMapper mapper = new ObjectMapper(new JsonFactory());

  /**
   * @throws PipelineConfigurationException
   *           if the JSON cannot be read or is not a valid pipeline configuration.
   */
  public PipelineConfiguration parse(String json) throws PipelineConfigurationException {
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (IOException e) {
      throw new PipelineConfigurationException("Invalid JSON: " + e.getMessage(), e);
    }
    if (root == null || !root.isObject())
      throw new PipelineConfigurationException("Pipeline configuration must be a JSON object.");

    JsonNode tablesNode = root.get(JSON_TABLES);
    if (tablesNode == null || !tablesNode.isArray())
      throw new PipelineConfigurationException("Field '" + JSON_TABLES + "' must be an array.");

    List<TableConfiguration> tables = new ArrayList<>();
    for (int i = 0; i < tablesNode.size(); i++)
      tables.add(parseTable(tablesNode.get(i), JSON_TABLES + "[" + i + "]"));

    JsonNode metadata = root.get(JSON_METADATA);
    if (metadata == null || metadata.isNull())
      metadata = JsonNodeFactory.instance.objectNode();
    return new PipelineConfiguration(metadata, tables);
  }

  private TableConfiguration parseTable(JsonNode table, String path) throws PipelineConfigurationException {
    if (!table.isObject())
      throw new PipelineConfigurationException("'" + path + "' must be an object.");

    String tableId = requiredText(table, JSON_TABLE_ID, path);
    path = path + "(" + tableId + ")";
    String name = requiredText(table, JSON_NAME, path);
    String description = optionalText(table, JSON_DESCRIPTION, path);

    List<String> tags = new ArrayList<>();
    JsonNode tagsNode = table.get(JSON_TAGS);
    if (tagsNode != null && tagsNode.isArray())
      for (JsonNode tag : tagsNode)
        if (tag.isTextual())
          tags.add(tag.textValue());

    JsonNode rowSelectorNode = table.get(JSON_ROW_SELECTOR);
    if (rowSelectorNode == null || !rowSelectorNode.isObject())
      throw new PipelineConfigurationException("'" + path + "." + JSON_ROW_SELECTOR + "' is missing.");
    RowSelectorConfiguration rowSelector = parseRowSelector(rowSelectorNode, path + "." + JSON_ROW_SELECTOR);

    JsonNode columnsNode = table.get(JSON_COLUMNS);
    if (columnsNode == null || !columnsNode.isArray() || columnsNode.size() == 0)
      throw new PipelineConfigurationException("'" + path + "." + JSON_COLUMNS + "' must contain at least one column.");
    List<ColumnConfiguration> columns = new ArrayList<>();
    for (int i = 0; i < columnsNode.size(); i++)
      columns.add(parseColumn(columnsNode.get(i), path + "." + JSON_COLUMNS + "[" + i + "]"));

    List<TransformConfiguration> transforms = new ArrayList<>();
    JsonNode transformsNode = table.get(JSON_TRANSFORMS);
    if (transformsNode != null && transformsNode.isArray())
      for (int i = 0; i < transformsNode.size(); i++)
        transforms.add(parseTransform(transformsNode.get(i), path + "." + JSON_TRANSFORMS + "[" + i + "]"));

    return new TableConfiguration(tableId, name, description, tags, rowSelector, columns, transforms);
  }

  private RowSelectorConfiguration parseRowSelector(JsonNode node, String path)
      throws PipelineConfigurationException {
    String typeName = requiredText(node, JSON_TYPE, path);
    RowSelectorType type = RowSelectorType.fromConfigName(typeName);
    if (type == null)
      throw new PipelineConfigurationException("'" + path + "." + JSON_TYPE + "' has unknown value '" + typeName
          + "', expected one of interval, timestamp, index.");

    String source = optionalText(node, JSON_SOURCE, path);
    String timeFrame = optionalText(node, JSON_TIMEFRAME, path);
    if (source != null && source.isEmpty())
      source = null;
    if (timeFrame != null && timeFrame.isEmpty())
      timeFrame = null;

    switch (type) {
    case INTERVAL:
      if (source != null)
        return new RowSelectorConfiguration(type, source, timeFrame, null, null);
      return new RowSelectorConfiguration(type, null, timeFrame, parseIntervals(node, path), null);
    case TIMESTAMP:
      if (node.get(JSON_TIMESTAMPS) != null)
        return new RowSelectorConfiguration(type, null, timeFrame, null,
            parseLongs(node, JSON_TIMESTAMPS, path));
      if (source != null)
        return new RowSelectorConfiguration(type, source, timeFrame, null, null);
      throw new PipelineConfigurationException(
          "'" + path + "' needs either '" + JSON_TIMESTAMPS + "' or '" + JSON_SOURCE + "'.");
    case INDEX:
    default:
      return new RowSelectorConfiguration(type, null, timeFrame, null, parseLongs(node, JSON_INDICES, path));
    }
  }

  private List<TimeFrameInterval> parseIntervals(JsonNode node, String path) throws PipelineConfigurationException {
    JsonNode intervalsNode = node.get(JSON_INTERVALS);
    if (intervalsNode == null || !intervalsNode.isArray() || intervalsNode.size() == 0)
      throw new PipelineConfigurationException(
          "'" + path + "' needs either '" + JSON_SOURCE + "' or a non-empty '" + JSON_INTERVALS + "' array.");
    List<TimeFrameInterval> res = new ArrayList<>();
    for (int i = 0; i < intervalsNode.size(); i++) {
      JsonNode interval = intervalsNode.get(i);
      String intervalPath = path + "." + JSON_INTERVALS + "[" + i + "]";
      JsonNode start;
      JsonNode end;
      if (interval.isArray() && interval.size() == 2) {
        start = interval.get(0);
        end = interval.get(1);
      } else if (interval.isObject()) {
        start = interval.get(JSON_START);
        end = interval.get(JSON_END);
      } else
        throw new PipelineConfigurationException(
            "'" + intervalPath + "' must be a [start, end] pair or an object with start and end.");
      if (start == null || end == null || !start.isNumber() || !end.isNumber())
        throw new PipelineConfigurationException("'" + intervalPath + "' needs numeric start and end.");
      try {
        res.add(TimeFrameInterval.of(start.asLong(), end.asLong()));
      } catch (IllegalArgumentException e) {
        throw new PipelineConfigurationException("'" + intervalPath + "' is invalid: " + e.getMessage(), e);
      }
    }
    return res;
  }

  private List<Long> parseLongs(JsonNode node, String field, String path) throws PipelineConfigurationException {
    JsonNode arr = node.get(field);
    if (arr == null || !arr.isArray() || arr.size() == 0)
      throw new PipelineConfigurationException("'" + path + "." + field + "' must be a non-empty array.");
    List<Long> res = new ArrayList<>();
    for (int i = 0; i < arr.size(); i++) {
      if (!arr.get(i).isNumber())
        throw new PipelineConfigurationException("'" + path + "." + field + "[" + i + "]' must be a number.");
      // floating point values are truncated.
      res.add(arr.get(i).asLong());
    }
    return res;
  }

  private ColumnConfiguration parseColumn(JsonNode node, String path) throws PipelineConfigurationException {
    if (!node.isObject())
      throw new PipelineConfigurationException("'" + path + "' must be an object.");
    String name = requiredText(node, JSON_NAME, path);
    String computer = requiredText(node, JSON_COMPUTER, path);

    JsonNode dataSourceNode = node.get(JSON_DATA_SOURCE);
    DataSourceReference dataSource;
    if (dataSourceNode != null && dataSourceNode.isObject()) {
      String dsPath = path + "." + JSON_DATA_SOURCE;
      dataSource = DataSourceReference.ofAdapter(requiredText(dataSourceNode, JSON_KEY, dsPath),
          requiredText(dataSourceNode, JSON_ADAPTER, dsPath));
    } else
      dataSource = DataSourceReference.ofKey(requiredText(node, JSON_DATA_SOURCE, path));

    Map<String, String> parameters = new LinkedHashMap<>();
    JsonNode paramsNode = node.get(JSON_PARAMETERS);
    if (paramsNode != null && !paramsNode.isNull()) {
      if (!paramsNode.isObject())
        throw new PipelineConfigurationException("'" + path + "." + JSON_PARAMETERS + "' must be an object.");
      Iterator<Entry<String, JsonNode>> it = paramsNode.fields();
      while (it.hasNext()) {
        Entry<String, JsonNode> e = it.next();
        parameters.put(e.getKey(), e.getValue().isTextual() ? e.getValue().textValue() : e.getValue().toString());
      }
    }
    return new ColumnConfiguration(name, computer, dataSource, parameters);
  }

  private TransformConfiguration parseTransform(JsonNode node, String path) throws PipelineConfigurationException {
    if (!node.isObject())
      throw new PipelineConfigurationException("'" + path + "' must be an object.");
    String type = requiredText(node, JSON_TYPE, path);
    JsonNode params = node.get(JSON_PARAMETERS);
    if (params != null && !params.isNull() && !params.isObject())
      throw new PipelineConfigurationException("'" + path + "." + JSON_PARAMETERS + "' must be an object.");
    return new TransformConfiguration(type, params != null && params.isObject() ? params : null,
        emptyToNull(optionalText(node, JSON_OUTPUT_TABLE_ID, path)),
        emptyToNull(optionalText(node, JSON_OUTPUT_NAME, path)),
        emptyToNull(optionalText(node, JSON_OUTPUT_DESCRIPTION, path)));
  }

  private String requiredText(JsonNode node, String field, String path) throws PipelineConfigurationException {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual() || value.textValue().isEmpty())
      throw new PipelineConfigurationException("'" + path + "." + field + "' is missing or empty.");
    return value.textValue();
  }

  private String optionalText(JsonNode node, String field, String path) throws PipelineConfigurationException {
    JsonNode value = node.get(field);
    if (value == null || value.isNull())
      return null;
    if (!value.isTextual())
      throw new PipelineConfigurationException("'" + path + "." + field + "' must be a string.");
    return value.textValue();
  }

  private String emptyToNull(String s) {
    return s == null || s.isEmpty() ? null : s;
  }
}
