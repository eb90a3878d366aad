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
import java.io.FileNotFoundException;

/**
 * Names of the three files a data cube is stored in. All share a common prefix.
 *
 * @author Bastian Gloeckle
 */
public class CubeFileNames {
  public static final String MANIFEST_SUFFIX = ".json";
  public static final String DIMENSIONS_SUFFIX = ".dimens.bin";
  public static final String METRICS_SUFFIX = ".metrics.bin";
  /** Appended to the name of a file that is gzip compressed. */
  public static final String GZIP_SUFFIX = ".gz";

  private CubeFileNames() {

  }

  public static File manifestFile(String prefix, boolean compressed) {
    return file(prefix, MANIFEST_SUFFIX, compressed);
  }

  public static File dimensionsFile(String prefix, boolean compressed) {
    return file(prefix, DIMENSIONS_SUFFIX, compressed);
  }

  public static File metricsFile(String prefix, boolean compressed) {
    return file(prefix, METRICS_SUFFIX, compressed);
  }

  /**
   * Finds an existing file for the given prefix and suffix, preferring the uncompressed name over the compressed one.
   *
   * @throws FileNotFoundException
   *           If neither of the files exists.
   */
  public static File resolveExisting(String prefix, String suffix) throws FileNotFoundException {
    File plain = file(prefix, suffix, false);
    if (plain.isFile())
      return plain;
    File compressed = file(prefix, suffix, true);
    if (compressed.isFile())
      return compressed;
    throw new FileNotFoundException("Neither '" + plain + "' nor '" + compressed + "' exist.");
  }

  private static File file(String prefix, String suffix, boolean compressed) {
    return new File(prefix + suffix + (compressed ? GZIP_SUFFIX : ""));
  }
}
