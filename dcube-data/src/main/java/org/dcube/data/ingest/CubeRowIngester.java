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
package org.dcube.data.ingest;

import java.util.Iterator;
import java.util.Map;

import org.dcube.data.cube.DataCube;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds rows that are pulled one by one from a source to a {@link DataCube}.
 *
 * <p>
 * The next row is only pulled from the source after the previous one has been added to the cube. The first row that
 * cannot be read or added aborts the ingestion: The exception is re-thrown and no further rows are pulled.
 *
 * @author Bastian Gloeckle
 */
public class CubeRowIngester {
  private static final Logger logger = LoggerFactory.getLogger(CubeRowIngester.class);

  private DataCube target;
  private long progressInterval;
  private long numberOfRowsIngested = 0L;

  /**
   * @param progressInterval
   *          Log a progress message each time this number of rows has been ingested. Values <= 0 disable the progress
   *          messages.
   */
  public CubeRowIngester(DataCube target, long progressInterval) {
    this.target = target;
    this.progressInterval = progressInterval;
  }

  /**
   * Pull all rows from the given source and add them to the target cube.
   *
   * @return Number of rows ingested by this call.
   * @throws RuntimeException
   *           The first exception thrown by either the source or {@link DataCube#addRow(Map)}.
   */
  public long ingest(Iterator<? extends Map<String, ?>> rows) throws RuntimeException {
    long rowsBefore = numberOfRowsIngested;
    try {
      while (rows.hasNext()) {
        target.addRow(rows.next());
        numberOfRowsIngested++;
        if (progressInterval > 0 && numberOfRowsIngested % progressInterval == 0)
          logger.info("Ingested {} rows, cube contains {} rows.", numberOfRowsIngested, target.count());
      }
    } catch (RuntimeException e) {
      logger.error("Ingestion aborted at row {}: {}", numberOfRowsIngested, e.getMessage());
      throw e;
    }
    logger.debug("Ingestion done, ingested {} rows.", numberOfRowsIngested - rowsBefore);
    return numberOfRowsIngested - rowsBefore;
  }

  /**
   * @return Total number of rows ingested by this instance.
   */
  public long getNumberOfRowsIngested() {
    return numberOfRowsIngested;
  }
}
