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

import org.dcube.config.Config;
import org.dcube.config.ConfigKey;
import org.dcube.context.AutoInstatiate;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for classes of dcube-file.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class CubeFileFactory {
  @Config(ConfigKey.PAGE_CAPACITY)
  private int pageCapacity;

  // integral dictionary values are read as Long, which is how the dictionary holds them.
  private ObjectMapper mapper = new ObjectMapper().enable(DeserializationFeature.USE_LONG_FOR_INTS);

  public CubeFileWriter createCubeFileWriter() {
    return new CubeFileWriter(mapper);
  }

  /**
   * @return A reader whose cubes use the configured page capacity when they grow.
   */
  public CubeFileReader createCubeFileReader() {
    return new CubeFileReader(mapper, pageCapacity);
  }
}
