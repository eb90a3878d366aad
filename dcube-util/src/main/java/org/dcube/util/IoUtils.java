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
package org.dcube.util;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

import com.google.common.io.ByteStreams;

/**
 *
 * @author Bastian Gloeckle
 */
public class IoUtils {
  private static final int GZIP_MAGIC_FIRST = 0x1f;
  private static final int GZIP_MAGIC_SECOND = 0x8b;

  /**
   * Read {@link InputStream} fully into a byte array, transparently decompressing it if it is gzip compressed.
   *
   * <p>
   * Whether the input is compressed is identified by the gzip magic bytes at the beginning of the stream. The given
   * stream is not closed.
   */
  public static byte[] readFullyDecompressing(InputStream is) throws IOException {
    return ByteStreams.toByteArray(decompressingStream(is));
  }

  /**
   * @return An {@link InputStream} providing the data of the given one, decompressed if it is gzip compressed.
   */
  public static InputStream decompressingStream(InputStream is) throws IOException {
    InputStream buffered = (is.markSupported()) ? is : new BufferedInputStream(is);
    buffered.mark(2);
    int first = buffered.read();
    int second = buffered.read();
    buffered.reset();

    if (first == GZIP_MAGIC_FIRST && second == GZIP_MAGIC_SECOND)
      return new GZIPInputStream(buffered);
    return buffered;
  }
}
