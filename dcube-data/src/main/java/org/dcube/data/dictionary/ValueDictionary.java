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
package org.dcube.data.dictionary;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dictionary mapping arbitrary dimension values to dense int IDs and back.
 *
 * <p>
 * The first ID is always 0, each newly interned value receives the next free ID. The dictionary only grows, IDs are
 * never re-assigned or freed.
 *
 * <p>
 * A single dictionary is shared by all dimensions of a cube: Equal values of two different dimensions receive the same
 * ID. This is safe, as an ID is always resolved in the context of a specific row and column.
 *
 * <p>
 * Values are normalized before they are interned (see {@link #normalize(Object)}), so e.g. an {@link Integer} 1 and a
 * {@link Long} 1 map to the same ID.
 *
 * <p>
 * This class is not thread safe.
 *
 * @author Bastian Gloeckle
 */
public class ValueDictionary {
  private final List<Object> values;
  private final Map<Object, Integer> valueToId;

  public ValueDictionary() {
    values = new ArrayList<>();
    valueToId = new HashMap<>();
  }

  private ValueDictionary(List<Object> values, Map<Object, Integer> valueToId) {
    this.values = values;
    this.valueToId = valueToId;
  }

  /**
   * Create a dictionary which contains the given values, the ID of each value being its index in the list.
   *
   * @throws IllegalArgumentException
   *           If the list contains <code>null</code> or the same value twice.
   */
  public static ValueDictionary of(List<?> values) throws IllegalArgumentException {
    ValueDictionary res = new ValueDictionary();
    for (Object value : values) {
      int sizeBefore = res.size();
      if (res.intern(value) != sizeBefore)
        throw new IllegalArgumentException("Value '" + value + "' is contained multiple times.");
    }
    return res;
  }

  /**
   * Return the ID of a value, adding the value to the dictionary if it is not yet contained.
   *
   * @throws IllegalArgumentException
   *           If value is <code>null</code>.
   */
  public int intern(Object value) throws IllegalArgumentException {
    if (value == null)
      throw new IllegalArgumentException("Cannot intern null.");

    Object normalized = normalize(value);
    Integer id = valueToId.get(normalized);
    if (id != null)
      return id;

    id = values.size();
    values.add(normalized);
    valueToId.put(normalized, id);
    return id;
  }

  /**
   * @return The value of the given ID.
   * @throws IllegalArgumentException
   *           If the ID has never been assigned.
   */
  public Object valueAt(int id) throws IllegalArgumentException {
    if (id < 0 || id >= values.size())
      throw new IllegalArgumentException("ID " + id + " is not contained in the dictionary of size " + values.size());
    return values.get(id);
  }

  /**
   * @return The ID of the given value or <code>null</code> if the value is not contained.
   */
  public Integer findId(Object value) {
    if (value == null)
      return null;
    return valueToId.get(normalize(value));
  }

  public int size() {
    return values.size();
  }

  /**
   * @return Unmodifiable view on all values, the index in the list is the ID of the value.
   */
  public List<Object> getValues() {
    return Collections.unmodifiableList(values);
  }

  /**
   * @return An independent copy of this dictionary.
   */
  public ValueDictionary copy() {
    return new ValueDictionary(new ArrayList<>(values), new HashMap<>(valueToId));
  }

  /**
   * Normalizes numbers, so equal numbers end up with the same representation: Integral numbers are represented as
   * {@link Long}, other floating point numbers as {@link Double}. {@link BigInteger} and {@link BigDecimal} as well as
   * all other objects are not changed.
   */
  public static Object normalize(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte)
      return ((Number) value).longValue();
    if (value instanceof Float)
      return ((Float) value).doubleValue();
    return value;
  }
}
