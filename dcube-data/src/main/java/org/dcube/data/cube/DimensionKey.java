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

import java.util.Arrays;

/**
 * The composite key of a row in a {@link DataCube}: The ordered dictionary IDs of all dimension values of the row.
 *
 * <p>
 * Two keys are equal if their IDs are equal position by position. A key of a cube without dimensions is empty, all
 * such keys are equal.
 *
 * @author Bastian Gloeckle
 */
/* package */ final class DimensionKey {
  private final int[] ids;
  private final int hash;

  /**
   * @param ids
   *          Is not copied and must not be changed afterwards.
   */
  /* package */ DimensionKey(int[] ids) {
    this.ids = ids;
    this.hash = Arrays.hashCode(ids);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof DimensionKey))
      return false;
    DimensionKey other = (DimensionKey) obj;
    return hash == other.hash && Arrays.equals(ids, other.ids);
  }

  @Override
  public String toString() {
    return Arrays.toString(ids);
  }
}
