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
package org.dcube.config;

/**
 * Configuration keys which can be used to resolve configuration values.
 *
 * <p>
 * It's easiest to use these constants with the {@link Config} annotation.
 *
 * @author Bastian Gloeckle
 */
public class ConfigKey {
  /**
   * Number of elements in each page of the paged buffers of newly created cubes.
   *
   * <p>
   * Larger pages mean fewer allocations when a cube grows, but more memory wasted by small cubes.
   */
  public static final String PAGE_CAPACITY = "pageCapacity";

  /**
   * Number of rows after which a streaming ingestion logs its progress.
   */
  public static final String INGEST_PROGRESS_INTERVAL = "ingestProgressInterval";

  /**
   * "true" if cube files written by the tool should be gzip compressed.
   */
  public static final String COMPRESS_OUTPUT = "compressOutput";
}
