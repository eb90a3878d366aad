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
package org.dcube.tool.info;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Map.Entry;

import org.dcube.context.ContextUtil;
import org.dcube.data.cube.DataCube;
import org.dcube.file.CubeFileFactory;
import org.dcube.file.DeserializationException;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

/**
 *
 * @author Bastian Gloeckle
 */
public class InfoImplementation {
  private String inputPrefix;
  private PrintStream out;

  public InfoImplementation(String inputPrefix, PrintStream out) {
    this.inputPrefix = inputPrefix;
    this.out = out;
  }

  public void printInfo() throws IOException, DeserializationException {
    try (AnnotationConfigApplicationContext ctx = ContextUtil.createContext()) {
      CubeFileFactory fileFactory = ctx.getBean(CubeFileFactory.class);

      DataCube cube = fileFactory.createCubeFileReader().read(inputPrefix);

      out.println("Dimensions:\t\t" + cube.getDimensions());
      out.println("Metrics:\t\t" + cube.getMetrics());
      out.println("Number of rows:\t\t" + cube.count());
      out.println("Distinct values:\t" + cube.getDictionaryValues().size());
      for (Entry<String, Double> total : cube.totals().entrySet())
        out.println("Total of " + total.getKey() + ":\t" + total.getValue());
    }
  }
}
