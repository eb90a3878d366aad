/**
 * dcube: In-memory data cubes.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of dcube.
 *
 * dcube is free software: you can redistribute it and/or modify
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
package org.dcube.tool.importer;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.dcube.tool.ToolFunction;
import org.dcube.tool.ToolFunctionName;
import org.dcube.tool.ToolOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates data cube files from a JSON file containing rows.
 *
 * @author Bastian Gloeckle
 */
@ToolFunctionName(Import.FUNCTION_NAME)
public class Import implements ToolFunction {
  private static final Logger logger = LoggerFactory.getLogger(Import.class);

  public static final String FUNCTION_NAME = "import";

  private static final String OPT_HELP = "h";
  private static final String OPT_INPUT = "i";
  private static final String OPT_DIMENSIONS = "d";
  private static final String OPT_METRICS = "m";
  private static final String OPT_OUTPUT = "o";
  private static final String OPT_COMPRESS = "z";

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
      formatter.printHelp(Import.FUNCTION_NAME + " [options]",
          "\nReads rows from a JSON file and writes them into data cube files. The input contains either a JSON array "
              + "of objects or a sequence of objects, it may be gzip compressed. Rows with equal dimension values "
              + "are aggregated.\n\n",
          cliOpt, "");
      return;
    }

    File inputFile = new File(cmd.getOptionValue(OPT_INPUT));
    if (!inputFile.isFile() || !inputFile.exists()) {
      logger.error("{} does not exist or is a directory.", inputFile.getAbsolutePath());
      return;
    }

    List<String> dimensions = Arrays.asList(cmd.getOptionValues(OPT_DIMENSIONS));
    List<String> metrics =
        cmd.hasOption(OPT_METRICS) ? Arrays.asList(cmd.getOptionValues(OPT_METRICS)) : Collections.emptyList();
    String outputPrefix = cmd.getOptionValue(OPT_OUTPUT);
    Boolean compress = ToolOptions.compressValue(cmd, OPT_COMPRESS);

    try {
      new ImportImplementation(inputFile, dimensions, metrics, outputPrefix, compress).importCube();
    } catch (IOException | RuntimeException e) {
      logger.error("Could not import {}: {}", inputFile.getAbsolutePath(), e.getMessage());
    }
  }

  private Options createCliOptions() {
    Options res = new Options();
    res.addOption(Option.builder(OPT_INPUT).longOpt("input").numberOfArgs(1).argName("file")
        .desc("The JSON file to read rows from (required).").required().build());
    res.addOption(Option.builder(OPT_DIMENSIONS).longOpt("dimensions").numberOfArgs(Option.UNLIMITED_VALUES)
        .valueSeparator(',').argName("name,name,...").desc("Names of the dimension fields (required).").required()
        .build());
    res.addOption(Option.builder(OPT_METRICS).longOpt("metrics").numberOfArgs(Option.UNLIMITED_VALUES)
        .valueSeparator(',').argName("name,name,...").desc("Names of the metric fields.").build());
    res.addOption(Option.builder(OPT_OUTPUT).longOpt("output").numberOfArgs(1).argName("prefix")
        .desc("Prefix of the output files (required).").required().build());
    res.addOption(ToolOptions.createCompressOption(OPT_COMPRESS));
    res.addOption(Option.builder(OPT_HELP).longOpt("help").desc("Show this help.").build());
    return res;
  }
}
