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

/**
 * A row that should be added to a {@link DataCube} does not contain a value for one of the dimensions or metrics of
 * the cube.
 *
 * @author Bastian Gloeckle
 */
public class MissingFieldException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String fieldName;

  public MissingFieldException(String fieldName, String msg) {
    super(msg);
    this.fieldName = fieldName;
  }

  public String getFieldName() {
    return fieldName;
  }
}
