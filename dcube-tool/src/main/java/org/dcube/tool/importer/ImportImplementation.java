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
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import org.dcube.context.ContextUtil;
import org.dcube.data.CubeFactory;
import org.dcube.data.cube.DataCube;
import org.dcube.data.ingest.CubeRowIngester;
import org.dcube.file.CubeFileFactory;
import org.dcube.tool.ToolOptions;
import org.dcube.util.IoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Streams rows from a JSON file into a new {@link DataCube} and writes that to files.
 *
 * @author Bastian Gloeckle
 */
public class ImportImplementation {
  private static final Logger logger = LoggerFactory.getLogger(ImportImplementation.class);

  private File inputFile;
  private List<String> dimensions;
  private List<String> metrics;
  private String outputPrefix;
  private Boolean compress;

  /**
   * @param compress
   *          Whether to compress the output, <code>null</code> to use the configured default.
   */
  public ImportImplementation(File inputFile, List<String> dimensions, List<String> metrics, String outputPrefix,
      Boolean compress) {
    this.inputFile = inputFile;
    this.dimensions = dimensions;
    this.metrics = metrics;
    this.outputPrefix = outputPrefix;
    this.compress = compress;
  }

  /**
   * @return The cube that has been written.
   * @throws RuntimeException
   *           If the input cannot be parsed or a row lacks a field.
   */
  public DataCube importCube() throws IOException, RuntimeException {
    try (AnnotationConfigApplicationContext ctx = ContextUtil.createContext()) {
      CubeFactory cubeFactory = ctx.getBean(CubeFactory.class);
      CubeFileFactory fileFactory = ctx.getBean(CubeFileFactory.class);

      DataCube cube = cubeFactory.createDataCube(dimensions, metrics);
      CubeRowIngester ingester = cubeFactory.createRowIngester(cube);

      ObjectMapper mapper = new ObjectMapper().enable(DeserializationFeature.USE_LONG_FOR_INTS);
      logger.info("Reading rows from {}", inputFile.getAbsolutePath());
      try (InputStream is = IoUtils.decompressingStream(new FileInputStream(inputFile));
          MappingIterator<Map<String, Object>> rows =
              mapper.readerFor(new TypeReference<Map<String, Object>>() {
              }).readValues(is)) {
        ingester.ingest(rows);
      }
      logger.info("Read {} rows, resulting cube has {} rows.", ingester.getNumberOfRowsIngested(), cube.count());

      fileFactory.createCubeFileWriter().write(cube, outputPrefix, ToolOptions.resolveCompress(compress, ctx));
      return cube;
    }
  }
}
