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
package org.dcube.tool.select;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.dcube.file.DeserializationException;
import org.dcube.tool.ToolFunction;
import org.dcube.tool.ToolFunctionName;
import org.dcube.tool.ToolOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups a stored data cube by a subset of its dimensions, optionally filtering its rows first.
 *
 * @author Bastian Gloeckle
 */
@ToolFunctionName(Select.FUNCTION_NAME)
public class Select implements ToolFunction {
  private static final Logger logger = LoggerFactory.getLogger(Select.class);

  public static final String FUNCTION_NAME = "select";

  private static final String OPT_HELP = "h";
  private static final String OPT_INPUT = "i";
  private static final String OPT_DIMENSIONS = "d";
  private static final String OPT_WHERE = "w";
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
      formatter.printHelp(Select.FUNCTION_NAME + " [options]",
          "\nReads a data cube, keeps the rows matching all filters and sums up the metrics of rows that are equal "
              + "in the selected dimensions. The result is either printed as one JSON object per line or written "
              + "to cube files.\n\n",
          cliOpt, "");
      return;
    }

    String inputPrefix = cmd.getOptionValue(OPT_INPUT);
    List<String> dimensions =
        cmd.hasOption(OPT_DIMENSIONS) ? Arrays.asList(cmd.getOptionValues(OPT_DIMENSIONS)) : Collections.emptyList();

    Map<String, Set<String>> filters = new LinkedHashMap<>();
    if (cmd.hasOption(OPT_WHERE)) {
      for (String where : cmd.getOptionValues(OPT_WHERE)) {
        int idx = where.indexOf('=');
        if (idx <= 0) {
          logger.error("Invalid filter '{}', expected <dimension>=<value>[,<value>...]", where);
          return;
        }
        filters.computeIfAbsent(where.substring(0, idx), k -> new HashSet<>())
            .addAll(Arrays.asList(where.substring(idx + 1).split(",")));
      }
    }

    String outputPrefix = cmd.getOptionValue(OPT_OUTPUT);
    Boolean compress = ToolOptions.compressValue(cmd, OPT_COMPRESS);

    try {
      new SelectImplementation(inputPrefix, dimensions, filters, outputPrefix, compress, System.out).select();
    } catch (IOException | DeserializationException | RuntimeException e) {
      logger.error("Could not select from cube {}: {}", inputPrefix, e.getMessage());
    }
  }

  private Options createCliOptions() {
    Options res = new Options();
    res.addOption(Option.builder(OPT_INPUT).longOpt("input").numberOfArgs(1).argName("prefix")
        .desc("Prefix of the cube files to read (required).").required().build());
    res.addOption(Option.builder(OPT_DIMENSIONS).longOpt("dimensions").numberOfArgs(Option.UNLIMITED_VALUES)
        .valueSeparator(',').argName("name,name,...")
        .desc("Dimensions to group by. If none are given, the result is a single row containing the totals.").build());
    res.addOption(Option.builder(OPT_WHERE).longOpt("where").numberOfArgs(1).argName("dimension=value,value,...")
        .desc("Only keep rows whose value of the dimension is one of the given values. Can be specified "
            + "multiple times.")
        .build());
    res.addOption(Option.builder(OPT_OUTPUT).longOpt("output").numberOfArgs(1).argName("prefix")
        .desc("Prefix of the output files. If not given, the rows are printed.").build());
    res.addOption(ToolOptions.createCompressOption(OPT_COMPRESS));
    res.addOption(Option.builder(OPT_HELP).longOpt("help").desc("Show this help.").build());
    return res;
  }
}
