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

import java.util.ArrayList;
import java.util.List;

/**
 * The textual part of a serialized data cube: its schema, its number of rows and the contents of its dictionary. It is
 * (de-)serialized as JSON.
 *
 * <p>
 * The index of a value in {@link #getDimenIndexToValue()} is the ID the binary dimension data refers to.
 *
 * @author Bastian Gloeckle
 */
public class CubeManifest {
  private List<String> dimens = new ArrayList<>();
  private List<String> metrics = new ArrayList<>();
  private long count;
  private List<Object> dimenIndexToValue = new ArrayList<>();

  public List<String> getDimens() {
    return dimens;
  }

  public void setDimens(List<String> dimens) {
    this.dimens = dimens;
  }

  public List<String> getMetrics() {
    return metrics;
  }

  public void setMetrics(List<String> metrics) {
    this.metrics = metrics;
  }

  public long getCount() {
    return count;
  }

  public void setCount(long count) {
    this.count = count;
  }

  public List<Object> getDimenIndexToValue() {
    return dimenIndexToValue;
  }

  public void setDimenIndexToValue(List<Object> dimenIndexToValue) {
    this.dimenIndexToValue = dimenIndexToValue;
  }
}
