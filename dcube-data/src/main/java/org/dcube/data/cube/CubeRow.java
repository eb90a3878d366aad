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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Set;

/**
 * A materialized row of a {@link DataCube}: An ordered mapping from field name to value.
 *
 * <p>
 * The fields of rows returned by {@link DataCube#getRows()} are the dimensions of the cube (in order, the value being
 * the dimension value) followed by the metrics of the cube (in order, the value being a {@link Double}).
 *
 * <p>
 * Two rows are equal if they contain the same fields with equal values, regardless of the order of the fields. Numbers
 * are compared by their value, so a metric value of 2.0 equals a value of 2.
 *
 * @author Bastian Gloeckle
 */
public class CubeRow {
  private final Map<String, Object> fields;

  public CubeRow() {
    fields = new LinkedHashMap<>();
  }

  public CubeRow(Map<String, ?> fields) {
    this.fields = new LinkedHashMap<>(fields);
  }

  /**
   * Create a row from alternating field names and values, e.g. <code>of("country", "us", "sales", 5)</code>.
   */
  public static CubeRow of(Object... fieldsAndValues) throws IllegalArgumentException {
    if (fieldsAndValues.length % 2 != 0)
      throw new IllegalArgumentException("Expected alternating field names and values.");
    CubeRow res = new CubeRow();
    for (int i = 0; i < fieldsAndValues.length; i += 2)
      res.set((String) fieldsAndValues[i], fieldsAndValues[i + 1]);
    return res;
  }

  /**
   * Set the value of a field. A field that is already contained keeps its position.
   *
   * @return this.
   */
  public CubeRow set(String field, Object value) {
    fields.put(field, value);
    return this;
  }

  /**
   * @return The value of the field or <code>null</code> if it is not available.
   */
  public Object get(String field) {
    return fields.get(field);
  }

  /**
   * @return The numeric value of the given field.
   * @throws IllegalArgumentException
   *           If the field is not available or not a number.
   */
  public double getNumber(String field) throws IllegalArgumentException {
    Object value = fields.get(field);
    if (!(value instanceof Number))
      throw new IllegalArgumentException("Field '" + field + "' does not contain a number but '" + value + "'.");
    return ((Number) value).doubleValue();
  }

  public boolean contains(String field) {
    return fields.containsKey(field);
  }

  public Set<String> getFieldNames() {
    return Collections.unmodifiableSet(fields.keySet());
  }

  /**
   * @return Unmodifiable view on the fields of this row.
   */
  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(fields);
  }

  @Override
  public int hashCode() {
    int res = 0;
    for (Entry<String, Object> e : fields.entrySet())
      res += e.getKey().hashCode() ^ valueHash(e.getValue());
    return res;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof CubeRow))
      return false;
    Map<String, Object> otherFields = ((CubeRow) obj).fields;
    if (fields.size() != otherFields.size())
      return false;
    for (Entry<String, Object> e : fields.entrySet()) {
      if (!otherFields.containsKey(e.getKey()) || !valueEquals(e.getValue(), otherFields.get(e.getKey())))
        return false;
    }
    return true;
  }

  private static int valueHash(Object value) {
    if (value instanceof Number)
      return Double.hashCode(((Number) value).doubleValue());
    return Objects.hashCode(value);
  }

  private static boolean valueEquals(Object a, Object b) {
    if (a instanceof Number && b instanceof Number)
      return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue()) == 0;
    return Objects.equals(a, b);
  }

  @Override
  public String toString() {
    return fields.toString();
  }
}
