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

import java.io.IOException;
import java.util.Map;

import org.dcube.tool.importer.Import;
import org.dcube.tool.info.Info;
import org.dcube.tool.select.Select;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link Tool}.
 *
 * @author Bastian Gloeckle
 */
public class ToolTest {
  @Test
  public void allFunctionsFoundTest() throws IOException, ReflectiveOperationException {
    // WHEN
    Map<String, ToolFunction> functions = Tool.findToolFunctions();

    // THEN
    Assert.assertEquals(functions.keySet().size(), 3);
    Assert.assertTrue(functions.get(Import.FUNCTION_NAME) instanceof Import);
    Assert.assertTrue(functions.get(Info.FUNCTION_NAME) instanceof Info);
    Assert.assertTrue(functions.get(Select.FUNCTION_NAME) instanceof Select);
  }
}
