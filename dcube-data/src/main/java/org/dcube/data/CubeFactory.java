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
package org.dcube.data;

import java.util.List;
import java.util.Map;

import org.dcube.config.Config;
import org.dcube.config.ConfigKey;
import org.dcube.context.AutoInstatiate;
import org.dcube.data.cube.DataCube;
import org.dcube.data.cube.MissingFieldException;
import org.dcube.data.ingest.CubeRowIngester;

/**
 * Factory for {@link DataCube}s and their ingestion helpers, honoring the configuration.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class CubeFactory {
  @Config(ConfigKey.PAGE_CAPACITY)
  private int pageCapacity;

  @Config(ConfigKey.INGEST_PROGRESS_INTERVAL)
  private long ingestProgressInterval;

  public DataCube createDataCube(List<String> dimensions, List<String> metrics) throws IllegalArgumentException {
    return new DataCube(dimensions, metrics, pageCapacity);
  }

  /**
   * Creates a new {@link DataCube} and adds the given rows.
   *
   * @throws MissingFieldException
   *           If a row does not contain one of the dimensions or metrics.
   */
  public DataCube fromRows(List<String> dimensions, List<String> metrics, Iterable<? extends Map<String, ?>> rows)
      throws MissingFieldException {
    DataCube res = createDataCube(dimensions, metrics);
    createRowIngester(res).ingest(rows.iterator());
    return res;
  }

  public CubeRowIngester createRowIngester(DataCube target) {
    return new CubeRowIngester(target, ingestProgressInterval);
  }

  public int getPageCapacity() {
    return pageCapacity;
  }
}
