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
package org.dcube.file;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.zip.GZIPOutputStream;

import org.dcube.data.cube.DataCube;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Writes a {@link DataCube} in its three-part representation: A JSON manifest (see {@link CubeManifest}), the binary
 * dimension IDs and the binary metric values.
 *
 * <p>
 * The manifest is always written first. Binary data is written row-major, little endian and without any header.
 *
 * @author Bastian Gloeckle
 */
public class CubeFileWriter {
  private static final Logger logger = LoggerFactory.getLogger(CubeFileWriter.class);

  private ObjectMapper mapper;

  /* package */ CubeFileWriter(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Write the given cube into the given streams. The streams are flushed, but not closed.
   */
  public void write(DataCube cube, OutputStream manifestOutputStream, OutputStream dimensionsOutputStream,
      OutputStream metricsOutputStream) throws IOException {
    CubeManifest manifest = new CubeManifest();
    manifest.setDimens(cube.getDimensions());
    manifest.setMetrics(cube.getMetrics());
    manifest.setCount(cube.count());
    manifest.setDimenIndexToValue(cube.getDictionaryValues());

    manifestOutputStream.write(mapper.writeValueAsBytes(manifest));
    manifestOutputStream.flush();

    cube.writeDimensionIndices(dimensionsOutputStream);
    dimensionsOutputStream.flush();

    cube.writeMetricValues(metricsOutputStream);
    metricsOutputStream.flush();
  }

  /**
   * Write the given cube into the three files of the given prefix, see {@link CubeFileNames}. Existing files are
   * overwritten.
   *
   * @param compress
   *          <code>true</code> if the files should be gzip compressed, in which case the file names receive the
   *          {@link CubeFileNames#GZIP_SUFFIX}.
   */
  public void write(DataCube cube, String prefix, boolean compress) throws IOException {
    logger.info("Writing cube with {} rows to '{}' (compressed: {})", cube.count(), prefix, compress);

    try (OutputStream manifestOutputStream = openFile(CubeFileNames.manifestFile(prefix, compress).getPath(), compress);
        OutputStream dimensionsOutputStream =
            openFile(CubeFileNames.dimensionsFile(prefix, compress).getPath(), compress);
        OutputStream metricsOutputStream = openFile(CubeFileNames.metricsFile(prefix, compress).getPath(), compress)) {
      write(cube, manifestOutputStream, dimensionsOutputStream, metricsOutputStream);
    }

    logger.info("Cube written to '{}'", prefix);
  }

  private OutputStream openFile(String fileName, boolean compress) throws IOException {
    OutputStream res = new BufferedOutputStream(new FileOutputStream(fileName));
    if (compress)
      res = new GZIPOutputStream(res);
    return res;
  }
}
