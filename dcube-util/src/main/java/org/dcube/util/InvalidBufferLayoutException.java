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

/**
 * A binary blob cannot be interpreted as an array of fixed-width elements, because its length is no multiple of the
 * element width.
 *
 * @author Bastian Gloeckle
 */
public class InvalidBufferLayoutException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidBufferLayoutException(String msg) {
    super(msg);
  }
}
