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
package org.dcube.context;

import org.springframework.context.annotation.AnnotationConfigApplicationContext;

/**
 * Creates the Spring contexts that wire all {@link AutoInstatiate} beans of dcube.
 *
 * @author Bastian Gloeckle
 */
public class ContextUtil {
  /** The package that is scanned for beans. */
  public static final String BASE_PKG = "org.dcube";

  /**
   * @return A new, refreshed context containing all beans found in {@link #BASE_PKG}. Needs to be closed by the
   *         caller.
   */
  public static AnnotationConfigApplicationContext createContext() {
    AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext();
    ctx.scan(BASE_PKG);
    ctx.refresh();
    return ctx;
  }
}
