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

/**
 * A sub-command of the dcube command line tool, like "import", "info" or "select".
 *
 * <p>
 * Implementations are found by {@link Tool} on the classpath below the org.dcube.tool package by their
 * {@link ToolFunctionName}, and they need a public no-arg constructor. An implementation parses its own options and
 * reports problems with user input through its logger instead of throwing.
 *
 * @author Bastian Gloeckle
 */
public interface ToolFunction {
  /**
   * @param args
   *          The command line arguments following the function name.
   */
  public void execute(String[] args);
}
