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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

import org.dcube.data.cube.DataCube;
import org.dcube.data.dictionary.ValueDictionary;
import org.dcube.util.FloatPagedBuffer;
import org.dcube.util.IntPagedBuffer;
import org.dcube.util.IoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a {@link DataCube} from its three-part representation as written by {@link CubeFileWriter}.
 *
 * <p>
 * Each of the three parts may be gzip compressed, this is identified by the data itself, not by the name of a file.
 * The binary parts are loaded directly into single-page buffers. All sizes are validated before the cube is created.
 *
 * @author Bastian Gloeckle
 */
public class CubeFileReader {
  private static final Logger logger = LoggerFactory.getLogger(CubeFileReader.class);

  private ObjectMapper mapper;
  private int pageCapacity;

  /* package */ CubeFileReader(ObjectMapper mapper, int pageCapacity) {
    this.mapper = mapper;
    this.pageCapacity = pageCapacity;
  }

  /**
   * Read a cube from the given streams. The streams are not closed.
   *
   * @throws SchemaMismatchException
   *           If the size of the binary data does not match the manifest.
   * @throws DeserializationException
   *           If the data cannot be interpreted.
   */
  public DataCube read(InputStream manifestInputStream, InputStream dimensionsInputStream,
      InputStream metricsInputStream) throws IOException, DeserializationException {
    CubeManifest manifest = readManifest(manifestInputStream);

    int rowCount = (int) manifest.getCount();

    byte[] dimensionBytes = IoUtils.readFullyDecompressing(dimensionsInputStream);
    validateSize("dimension", dimensionBytes, rowCount, manifest.getDimens().size(), IntPagedBuffer.BYTES_PER_ELEMENT);
    byte[] metricBytes = IoUtils.readFullyDecompressing(metricsInputStream);
    validateSize("metric", metricBytes, rowCount, manifest.getMetrics().size(), FloatPagedBuffer.BYTES_PER_ELEMENT);

    ValueDictionary dictionary;
    try {
      dictionary = ValueDictionary.of(manifest.getDimenIndexToValue());
    } catch (IllegalArgumentException e) {
      throw new DeserializationException("Invalid dictionary in manifest: " + e.getMessage(), e);
    }

    try {
      IntPagedBuffer dimensionIndices = new IntPagedBuffer(dimensionBytes, DataCube.BYTE_ORDER);
      FloatPagedBuffer metricValues = new FloatPagedBuffer(metricBytes, DataCube.BYTE_ORDER);
      return DataCube.fromColumnarData(manifest.getDimens(), manifest.getMetrics(), pageCapacity, dictionary,
          dimensionIndices, metricValues, rowCount);
    } catch (IllegalArgumentException e) {
      // includes InvalidBufferLayoutException and invalid schemas.
      throw new SchemaMismatchException("Data does not match manifest: " + e.getMessage(), e);
    }
  }

  /**
   * Read a cube from the three files of the given prefix. For each of the files, the uncompressed name is used if it
   * exists, the name with {@link CubeFileNames#GZIP_SUFFIX} otherwise.
   *
   * @throws SchemaMismatchException
   *           If the size of the binary data does not match the manifest.
   * @throws DeserializationException
   *           If the data cannot be interpreted.
   */
  public DataCube read(String prefix) throws IOException, DeserializationException {
    File manifestFile = CubeFileNames.resolveExisting(prefix, CubeFileNames.MANIFEST_SUFFIX);
    File dimensionsFile = CubeFileNames.resolveExisting(prefix, CubeFileNames.DIMENSIONS_SUFFIX);
    File metricsFile = CubeFileNames.resolveExisting(prefix, CubeFileNames.METRICS_SUFFIX);

    logger.info("Reading cube from '{}', '{}' and '{}'", manifestFile, dimensionsFile, metricsFile);

    try (InputStream manifestInputStream = new FileInputStream(manifestFile);
        InputStream dimensionsInputStream = new FileInputStream(dimensionsFile);
        InputStream metricsInputStream = new FileInputStream(metricsFile)) {
      DataCube res = read(manifestInputStream, dimensionsInputStream, metricsInputStream);
      logger.info("Read cube with {} rows from '{}'", res.count(), prefix);
      return res;
    }
  }

  /**
   * Read only the manifest of a serialized cube.
   *
   * @throws DeserializationException
   *           If the manifest cannot be parsed or is incomplete.
   */
  public CubeManifest readManifest(InputStream manifestInputStream) throws IOException, DeserializationException {
    CubeManifest res;
    try {
      res = mapper.readValue(IoUtils.readFullyDecompressing(manifestInputStream), CubeManifest.class);
    } catch (JsonProcessingException e) {
      throw new DeserializationException("Could not parse manifest: " + e.getOriginalMessage(), e);
    }

    if (res == null || res.getDimens() == null || res.getMetrics() == null || res.getDimenIndexToValue() == null)
      throw new DeserializationException("Manifest is incomplete.");
    if (res.getCount() < 0 || res.getCount() > Integer.MAX_VALUE)
      throw new DeserializationException("Invalid row count in manifest: " + res.getCount());

    return res;
  }

  /**
   * Read only the manifest of the cube stored with the given prefix.
   */
  public CubeManifest readManifest(String prefix) throws IOException, DeserializationException {
    try (InputStream is = new FileInputStream(CubeFileNames.resolveExisting(prefix, CubeFileNames.MANIFEST_SUFFIX))) {
      return readManifest(is);
    }
  }

  private void validateSize(String name, byte[] data, int rowCount, int columns, int bytesPerElement)
      throws SchemaMismatchException {
    if (data.length % bytesPerElement != 0)
      throw new SchemaMismatchException("Length of " + name + " data (" + data.length
          + " bytes) is not a multiple of the element width " + bytesPerElement + ".");

    long expected = (long) rowCount * columns * bytesPerElement;
    if (data.length != expected)
      throw new SchemaMismatchException("Expected " + expected + " bytes of " + name + " data for " + rowCount
          + " rows and " + columns + " columns, but got " + data.length + ".");
  }
}
