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
package org.chronoqube.tool.computers;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.chronoqube.computer.registry.AdapterInfo;
import org.chronoqube.computer.registry.ComputerInfo;
import org.chronoqube.computer.registry.ComputerRegistry;
import org.chronoqube.computer.registry.ParameterDescriptor;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.SourceKind;

/**
 *
 * @author The chronoqube authors
 */
public class ComputersImplementation {
  private final ComputerRegistry registry;
  private final PrintStream out;

  public ComputersImplementation(ComputerRegistry registry, PrintStream out) {
    this.registry = registry;
    this.out = out;
  }

  /**
   * @param selectorType
   *          <code>null</code> for all.
   * @param sourceKind
   *          <code>null</code> for all.
   */
  public void printComputers(RowSelectorType selectorType, SourceKind sourceKind) {
    List<ComputerInfo> infos = new ArrayList<>();
    for (String name : registry.getAllComputerNames()) {
      ComputerInfo info = registry.findComputerInfo(name);
      if (selectorType != null && !selectorType.canFeed(info.getRequiredSelectorType()))
        continue;
      if (sourceKind != null && info.getRequiredSourceKind() != sourceKind)
        continue;
      infos.add(info);
    }

    out.println("Computers (" + infos.size() + "):");
    for (ComputerInfo info : infos) {
      List<String> flags = new ArrayList<>();
      if (info.isMultiOutput())
        flags.add("multi-output");
      if (info.isEntityExpanding())
        flags.add("entity-expanding");
      out.println("  " + info.getName() + "\t" + info.getOutputType().getName() + "\t"
          + info.getRequiredSelectorType().getConfigName() + "\t"
          + info.getRequiredSourceKind().name().toLowerCase(Locale.ROOT)
          + (flags.isEmpty() ? "" : "\t" + String.join(",", flags)));
      if (info.getDescription() != null && !info.getDescription().isEmpty())
        out.println("      " + info.getDescription());
      printParameters(info.getParameters());
    }

    if (selectorType == null && sourceKind == null) {
      out.println("Adapters (" + registry.getAllAdapterNames().size() + "):");
      for (String name : registry.getAllAdapterNames()) {
        AdapterInfo info = registry.findAdapterInfo(name);
        out.println("  " + info.getName() + "\t" + info.getInputType().getSimpleName() + " -> "
            + info.getOutputKind().name().toLowerCase(Locale.ROOT));
        printParameters(info.getParameters());
      }
    }
  }

  private void printParameters(List<ParameterDescriptor> params) {
    if (params.isEmpty())
      return;
    out.println("      parameters: " + params.stream()
        .map(p -> p.getName() + " (" + p.getTypeName() + ", default " + p.getDefaultValue() + ")")
        .collect(Collectors.joining("; ")));
  }
}
