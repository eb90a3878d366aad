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
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.dcube.context.ContextUtil;
import org.dcube.data.cube.CubeRow;
import org.dcube.data.cube.DataCube;
import org.dcube.data.cube.DimensionFilter;
import org.dcube.file.CubeFileFactory;
import org.dcube.file.DeserializationException;
import org.dcube.tool.ToolOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Filters and groups a stored {@link DataCube} and either prints or writes the result.
 *
 * @author Bastian Gloeckle
 */
public class SelectImplementation {
  private static final Logger logger = LoggerFactory.getLogger(SelectImplementation.class);

  private String inputPrefix;
  private List<String> dimensions;
  private Map<String, Set<String>> filters;
  private String outputPrefix;
  private Boolean compress;
  private PrintStream out;

  /**
   * @param filters
   *          Map from dimension name to accepted values. Values are compared to the string representation of the
   *          dimension values.
   * @param outputPrefix
   *          Prefix of the files to write the result to, <code>null</code> to print the rows to out.
   * @param compress
   *          Whether to compress the output, <code>null</code> to use the configured default.
   */
  public SelectImplementation(String inputPrefix, List<String> dimensions, Map<String, Set<String>> filters,
      String outputPrefix, Boolean compress, PrintStream out) {
    this.inputPrefix = inputPrefix;
    this.dimensions = dimensions;
    this.filters = filters;
    this.outputPrefix = outputPrefix;
    this.compress = compress;
    this.out = out;
  }

  /**
   * @return The resulting cube.
   * @throws org.dcube.data.cube.UnknownDimensionException
   *           If a dimension is not part of the input cube.
   */
  public DataCube select() throws IOException, DeserializationException {
    try (AnnotationConfigApplicationContext ctx = ContextUtil.createContext()) {
      CubeFileFactory fileFactory = ctx.getBean(CubeFileFactory.class);

      DataCube cube = fileFactory.createCubeFileReader().read(inputPrefix);

      Map<String, DimensionFilter> dimensionFilters = new LinkedHashMap<>();
      for (Entry<String, Set<String>> filter : filters.entrySet()) {
        Set<String> accepted = filter.getValue();
        dimensionFilters.put(filter.getKey(), DimensionFilter.matching(v -> accepted.contains(String.valueOf(v))));
      }

      DataCube res = cube.where(dimensionFilters).select(dimensions);
      logger.info("Result contains {} rows.", res.count());

      if (outputPrefix != null) {
        fileFactory.createCubeFileWriter().write(res, outputPrefix, ToolOptions.resolveCompress(compress, ctx));
      } else {
        ObjectMapper mapper = new ObjectMapper();
        for (CubeRow row : res.getRows())
          out.println(mapper.writeValueAsString(row.asMap()));
      }
      return res;
    }
  }
}
