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
package org.dcube.data.cube;

import java.util.List;

/**
 * An operation on a {@link DataCube} referenced dimensions that are not part of the cube.
 *
 * @author Bastian Gloeckle
 */
public class UnknownDimensionException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final List<String> unknownDimensions;

  public UnknownDimensionException(List<String> unknownDimensions, List<String> availableDimensions) {
    super("These dimensions are not part of the cube: " + unknownDimensions + ". The cube has: "
        + availableDimensions + ".");
    this.unknownDimensions = unknownDimensions;
  }

  public List<String> getUnknownDimensions() {
    return unknownDimensions;
  }
}
