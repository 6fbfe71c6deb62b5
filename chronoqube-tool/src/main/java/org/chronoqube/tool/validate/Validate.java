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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.chronoqube.context.Profiles;
import org.chronoqube.pipeline.TablePipelineFactory;
import org.chronoqube.tool.ToolFunction;
import org.chronoqube.tool.ToolFunctionName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import com.google.common.io.Files;

/**
 * Validates a pipeline configuration file.
 *
 * @author The chronoqube authors
 */
@ToolFunctionName(value = Validate.FUNCTION_NAME, description = "Check a table pipeline JSON file.")
public class Validate implements ToolFunction {
  private static final Logger logger = LoggerFactory.getLogger(Validate.class);

  public static final String FUNCTION_NAME = "validate";

  private static final String OPT_HELP = "h";
  private static final String OPT_INPUT = "i";

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

    if (showHelp) {
      HelpFormatter formatter = new HelpFormatter();
      formatter.printHelp(Validate.FUNCTION_NAME + " [options]",
          "\nValidates a table pipeline configuration file.\n\n", cliOpt, "");
      return;
    }

    File inputFile = new File(cmd.getOptionValue(OPT_INPUT));
    String json;
    try {
      json = Files.asCharSource(inputFile, StandardCharsets.UTF_8).read();
    } catch (IOException e) {
      logger.error("Could not read {}", inputFile.getAbsolutePath(), e);
      System.exit(1);
      return;
    }

    List<String> problems;
    int tableCount;
    try (AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext()) {
      ctx.getEnvironment().setActiveProfiles(Profiles.ALL);
      ctx.scan("org.chronoqube");
      ctx.refresh();

      TablePipelineFactory pipelineFactory = ctx.getBean(TablePipelineFactory.class);
      ValidateImplementation impl =
          new ValidateImplementation(pipelineFactory.getComputerRegistry(), pipelineFactory.getSettings());
      problems = impl.validate(json);
      tableCount = impl.countTables(json);
    }

    if (problems.isEmpty()) {
      logger.info("{} is valid, it defines {} tables.", inputFile.getAbsolutePath(), tableCount);
      return;
    }

    for (String problem : problems)
      logger.error(problem);
    logger.error("{} has {} problems.", inputFile.getAbsolutePath(), problems.size());
    System.exit(1);
  }

  private Options createCliOptions() {
    Options res = new Options();
    res.addOption(Option.builder(OPT_INPUT).longOpt("input").numberOfArgs(1).argName("file").required()
        .desc("The pipeline configuration JSON file.").build());
    res.addOption(Option.builder(OPT_HELP).longOpt("help").desc("Show this help.").build());
    return res;
  }
}
