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

/**
 * The binary data of a serialized cube does not match the element width or the schema and row count declared in its
 * manifest.
 *
 * @author Bastian Gloeckle
 */
public class SchemaMismatchException extends DeserializationException {
  private static final long serialVersionUID = 1L;

  public SchemaMismatchException(String msg) {
    super(msg);
  }

  public SchemaMismatchException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
