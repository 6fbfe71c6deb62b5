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

import java.util.Locale;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.chronoqube.computer.registry.BuiltInComputers;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.SourceKind;
import org.chronoqube.tool.ToolFunction;
import org.chronoqube.tool.ToolFunctionName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the computers and adapters that are available in pipeline configurations.
 *
 * @author The chronoqube authors
 */
@ToolFunctionName(value = Computers.FUNCTION_NAME, description = "List available computers and adapters.")
public class Computers implements ToolFunction {
  private static final Logger logger = LoggerFactory.getLogger(Computers.class);

  public static final String FUNCTION_NAME = "computers";

  private static final String OPT_HELP = "h";
  private static final String OPT_SELECTOR = "r";
  private static final String OPT_SOURCE = "s";

  @Override
  public void execute(String[] args) {
    Options cliOpt = createCliOptions();
    CommandLineParser parser = new DefaultParser();
    CommandLine cmd = null;
    boolean showHelp = false;
    try {
      cmd = parser.parse(cliOpt, args);
      showHelp |= cmd.hasOption(OPT_HELP);
    } catch (ParseException e) {
      logger.error(e.getMessage());
      showHelp = true;
    }

    RowSelectorType selectorType = null;
    SourceKind sourceKind = null;
    if (!showHelp) {
      if (cmd.hasOption(OPT_SELECTOR)) {
        selectorType = RowSelectorType.fromConfigName(cmd.getOptionValue(OPT_SELECTOR));
        if (selectorType == null) {
          logger.error("Unknown row selector type '{}'", cmd.getOptionValue(OPT_SELECTOR));
          showHelp = true;
        }
      }
      if (cmd.hasOption(OPT_SOURCE)) {
        try {
          sourceKind = SourceKind.valueOf(cmd.getOptionValue(OPT_SOURCE).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
          logger.error("Unknown source kind '{}'", cmd.getOptionValue(OPT_SOURCE));
          showHelp = true;
        }
      }
    }

    if (showHelp) {
      HelpFormatter formatter = new HelpFormatter();
      formatter.printHelp(Computers.FUNCTION_NAME + " [options]",
          "\nLists the computers and adapters that can be used in table pipelines.\n\n", cliOpt, "");
      return;
    }

    new ComputersImplementation(BuiltInComputers.buildRegistry(), System.out).printComputers(selectorType,
        sourceKind);
  }

  private Options createCliOptions() {
    Options res = new Options();
    res.addOption(Option.builder(OPT_SELECTOR).longOpt("selector").numberOfArgs(1).argName("type")
        .desc("Only show computers usable with this row selector type: interval, timestamp or index.").build());
    res.addOption(Option.builder(OPT_SOURCE).longOpt("source").numberOfArgs(1).argName("kind")
        .desc("Only show computers reading this kind of source: analog, event, interval or line.").build());
    res.addOption(Option.builder(OPT_HELP).longOpt("help").desc("Show this help.").build());
    return res;
  }
}
