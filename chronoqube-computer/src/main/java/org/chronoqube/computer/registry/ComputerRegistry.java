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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.chronoqube.computer.TypedComputer;
import org.chronoqube.data.column.ColumnType;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.DataSourceVariant;
import org.chronoqube.data.source.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

/**
 * Catalog of all available computers and adapters, providing their metadata and creating instances by name.
 * 
 * <p>
 * Instances are immutable and are created using a {@link Builder}, see {@link BuiltInComputers#buildRegistry()} for the
 * registry containing all built-in computers. As they are immutable, they can be shared freely between threads.
 *
 * @author The chronoqube authors
 */
public final class ComputerRegistry {
  private static final Logger logger = LoggerFactory.getLogger(ComputerRegistry.class);

  /**
   * Parameter key that holds the name of the source a computer is created for.
   */
  public static final String SOURCE_NAME_KEY = "__source_name__";

  private final Map<String, ComputerInfo> computerInfos;
  private final Map<String, ComputerFactory> computerFactories;
  /** required selector type -> required source kind -> infos, in registration order. */
  private final Table<RowSelectorType, SourceKind, List<ComputerInfo>> computersByCapability;

  private final Map<String, AdapterInfo> adapterInfos;
  private final Map<String, AdapterFactory> adapterFactories;

  private ComputerRegistry(Builder builder) {
    computerInfos = ImmutableMap.copyOf(builder.computerInfos);
    computerFactories = ImmutableMap.copyOf(builder.computerFactories);
    adapterInfos = ImmutableMap.copyOf(builder.adapterInfos);
    adapterFactories = ImmutableMap.copyOf(builder.adapterFactories);

    Map<RowSelectorType, Map<SourceKind, List<ComputerInfo>>> capabilities = new HashMap<>();
    for (ComputerInfo info : computerInfos.values())
      capabilities.computeIfAbsent(info.getRequiredSelectorType(), k -> new HashMap<>())
          .computeIfAbsent(info.getRequiredSourceKind(), k -> new ArrayList<>()).add(info);
    ImmutableTable.Builder<RowSelectorType, SourceKind, List<ComputerInfo>> tableBuilder = ImmutableTable.builder();
    for (Map.Entry<RowSelectorType, Map<SourceKind, List<ComputerInfo>>> e : capabilities.entrySet())
      for (Map.Entry<SourceKind, List<ComputerInfo>> e2 : e.getValue().entrySet())
        tableBuilder.put(e.getKey(), e2.getKey(), ImmutableList.copyOf(e2.getValue()));
    computersByCapability = tableBuilder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return All computers that can compute columns for rows of the given selector type from the given source.
   */
  public List<ComputerInfo> getAvailableComputers(RowSelectorType selectorType, DataSourceVariant source) {
    return getAvailableComputers(selectorType, source.getKind());
  }

  public List<ComputerInfo> getAvailableComputers(RowSelectorType selectorType, SourceKind sourceKind) {
    List<ComputerInfo> res = new ArrayList<>();
    for (RowSelectorType required : RowSelectorType.values()) {
      if (!selectorType.canFeed(required))
        continue;
      List<ComputerInfo> infos = computersByCapability.get(required, sourceKind);
      if (infos != null)
        res.addAll(infos);
    }
    return res;
  }

  /**
   * @return The info of the computer with the given name or <code>null</code> if there is none.
   */
  public ComputerInfo findComputerInfo(String computerName) {
    return computerInfos.get(computerName);
  }

  public Set<String> getAllComputerNames() {
    return computerInfos.keySet();
  }

  /**
   * @return All output types of registered computers.
   */
  public Set<ColumnType<?>> getAvailableOutputTypes() {
    ImmutableSet.Builder<ColumnType<?>> res = ImmutableSet.builder();
    for (ComputerInfo info : computerInfos.values())
      res.add(info.getOutputType());
    return res.build();
  }

  /**
   * @param selectorType
   *          if not <code>null</code>, only computers that can consume rows of this selector type are returned.
   * @param sourceKind
   *          if not <code>null</code>, only computers requiring this kind of source are returned.
   */
  public List<ComputerInfo> getComputersByOutputType(ColumnType<?> outputType, RowSelectorType selectorType,
      SourceKind sourceKind) {
    List<ComputerInfo> res = new ArrayList<>();
    for (ComputerInfo info : computerInfos.values()) {
      if (info.getOutputType() != outputType)
        continue;
      if (selectorType != null && !selectorType.canFeed(info.getRequiredSelectorType()))
        continue;
      if (sourceKind != null && info.getRequiredSourceKind() != sourceKind)
        continue;
      res.add(info);
    }
    return res;
  }

  /**
   * @return true if the computer exists and produces vector values.
   */
  public boolean isVectorComputer(String computerName) {
    ComputerInfo info = computerInfos.get(computerName);
    return info != null && info.isVectorType();
  }

  /**
   * @return The element type of a vector computer, the output type class of a scalar computer or <code>null</code> if
   *         the computer is unknown.
   */
  public Class<?> getElementType(String computerName) {
    ComputerInfo info = computerInfos.get(computerName);
    return info != null ? info.getElementType() : null;
  }

  /**
   * Creates a computer.
   * 
   * @param parameters
   *          parameters of the computer. {@link #SOURCE_NAME_KEY} is filled automatically if it is missing.
   * @throws ComputerCreationException
   *           if the computer is unknown, the source is of the wrong kind or a parameter is invalid.
   */
  public TypedComputer<?> createComputer(String computerName, DataSourceVariant source, Map<String, String> parameters)
      throws ComputerCreationException {
    ComputerInfo info = computerInfos.get(computerName);
    if (info == null)
      throw new ComputerCreationException("Unknown computer '" + computerName + "'");
    if (source.getKind() != info.getRequiredSourceKind())
      throw new ComputerCreationException("Computer '" + computerName + "' requires a " + info.getRequiredSourceKind()
          + " source, but '" + source.getName() + "' is a " + source.getKind() + " source");

    Map<String, String> params = new HashMap<>(parameters);
    params.putIfAbsent(SOURCE_NAME_KEY, source.getName());

    TypedComputer<?> res;
    try {
      res = computerFactories.get(computerName).create(source, Collections.unmodifiableMap(params));
    } catch (IllegalArgumentException e) {
      throw new ComputerCreationException(
          "Could not create computer '" + computerName + "' on '" + source.getName() + "': " + e.getMessage(), e);
    }

    if (res.getOutputType() != info.getOutputType())
      throw new IllegalStateException("Computer '" + computerName + "' is registered with output type "
          + info.getOutputType() + " but its factory created a computer of type " + res.getOutputType());
    return res;
  }

  /**
   * Creates a computer whose output type is known at compile time.
   * 
   * @return The computer or an empty optional if the computer does not produce values of the requested type or cannot
   *         be created.
   */
  public <T> Optional<TypedComputer<T>> createTypedComputer(String computerName, ColumnType<T> outputType,
      DataSourceVariant source, Map<String, String> parameters) {
    ComputerInfo info = computerInfos.get(computerName);
    if (info == null) {
      logger.warn("Unknown computer '{}'", computerName);
      return Optional.empty();
    }
    if (info.getOutputType() != outputType) {
      logger.debug("Computer '{}' produces {}, not {}", computerName, info.getOutputType(), outputType);
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(createComputer(computerName, source, parameters).as(outputType));
    } catch (ComputerCreationException e) {
      logger.warn("{}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * @return Infos of the adapters that accept raw data of the given type.
   */
  public List<AdapterInfo> getAvailableAdapters(Class<?> rawDataType) {
    List<AdapterInfo> res = new ArrayList<>();
    for (AdapterInfo info : adapterInfos.values())
      if (info.getInputType().isAssignableFrom(rawDataType))
        res.add(info);
    return res;
  }

  /**
   * @return The info of the adapter with the given name or <code>null</code> if there is none.
   */
  public AdapterInfo findAdapterInfo(String adapterName) {
    return adapterInfos.get(adapterName);
  }

  public Set<String> getAllAdapterNames() {
    return adapterInfos.keySet();
  }

  /**
   * Wraps raw data into a source using the adapter with the given name.
   * 
   * @throws ComputerCreationException
   *           if the adapter is unknown, does not accept the raw data or a parameter is invalid.
   */
  public DataSourceVariant createAdapter(String adapterName, Object rawData, String sourceName,
      Map<String, String> parameters) throws ComputerCreationException {
    AdapterInfo info = adapterInfos.get(adapterName);
    if (info == null)
      throw new ComputerCreationException("Unknown adapter '" + adapterName + "'");
    if (!info.getInputType().isInstance(rawData))
      throw new ComputerCreationException("Adapter '" + adapterName + "' requires data of type "
          + info.getInputType().getSimpleName() + " but '" + sourceName + "' is "
          + (rawData == null ? "null" : rawData.getClass().getSimpleName()));
    try {
      return adapterFactories.get(adapterName).create(rawData, sourceName, parameters);
    } catch (IllegalArgumentException e) {
      throw new ComputerCreationException(
          "Could not adapt '" + sourceName + "' with adapter '" + adapterName + "': " + e.getMessage(), e);
    }
  }

  /**
   * Collects computers and adapters to build a {@link ComputerRegistry}. Not thread safe.
   */
  public static class Builder {
    private final Map<String, ComputerInfo> computerInfos = new LinkedHashMap<>();
    private final Map<String, ComputerFactory> computerFactories = new HashMap<>();
    private final Map<String, AdapterInfo> adapterInfos = new LinkedHashMap<>();
    private final Map<String, AdapterFactory> adapterFactories = new HashMap<>();

    private Builder() {
    }

    /**
     * Registers a computer. If a computer of the same name is registered already, a warning is logged and the new one
     * is ignored.
     */
    public Builder registerComputer(ComputerInfo info, ComputerFactory factory) {
      if (computerInfos.containsKey(info.getName())) {
        logger.warn("Computer '{}' is registered already, ignoring duplicate registration.", info.getName());
        return this;
      }
      computerInfos.put(info.getName(), info);
      computerFactories.put(info.getName(), factory);
      return this;
    }

    /**
     * Registers an adapter. If an adapter of the same name is registered already, a warning is logged and the new one
     * is ignored.
     */
    public Builder registerAdapter(AdapterInfo info, AdapterFactory factory) {
      if (adapterInfos.containsKey(info.getName())) {
        logger.warn("Adapter '{}' is registered already, ignoring duplicate registration.", info.getName());
        return this;
      }
      adapterInfos.put(info.getName(), info);
      adapterFactories.put(info.getName(), factory);
      return this;
    }

    public ComputerRegistry build() {
      return new ComputerRegistry(this);
    }
  }
}
