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
package org.dcube.tool;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.dcube.config.ConfigKey;
import org.dcube.config.ConfigurationManager;
import org.springframework.context.ApplicationContext;

/**
 * Command line options shared by multiple {@link ToolFunction}s.
 *
 * @author Bastian Gloeckle
 */
public class ToolOptions {
  private ToolOptions() {

  }

  /**
   * @return An option to choose whether output files are gzip compressed. The argument is optional.
   */
  public static Option createCompressOption(String opt) {
    return Option.builder(opt).longOpt("compress").numberOfArgs(1).optionalArg(true).argName("true|false")
        .desc("Gzip compress the output files. Defaults to the configuration value '" + ConfigKey.COMPRESS_OUTPUT
            + "'.")
        .build();
  }

  /**
   * @return Value of the option created by {@link #createCompressOption(String)} or <code>null</code> if it was not
   *         specified.
   */
  public static Boolean compressValue(CommandLine cmd, String opt) {
    if (!cmd.hasOption(opt))
      return null;
    String value = cmd.getOptionValue(opt);
    return (value == null) ? true : Boolean.parseBoolean(value);
  }

  /**
   * @return the given value or, if that is <code>null</code>, the configured default.
   */
  public static boolean resolveCompress(Boolean compress, ApplicationContext ctx) {
    if (compress != null)
      return compress;
    return Boolean.parseBoolean(ctx.getBean(ConfigurationManager.class).getValue(ConfigKey.COMPRESS_OUTPUT));
  }
}
