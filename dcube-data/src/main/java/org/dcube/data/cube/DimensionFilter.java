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
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import org.dcube.data.dictionary.ValueDictionary;

/**
 * A filter on the values of a single dimension, used by {@link DataCube#where(java.util.Map)}.
 *
 * <p>
 * There are three kinds of filters: {@link EqualTo} accepts a single value, {@link OneOf} accepts any value of a set
 * and {@link Matching} accepts all values for which a {@link Predicate} holds. Literal values are normalized the same
 * way {@link ValueDictionary} normalizes them.
 *
 * @author Bastian Gloeckle
 */
public abstract class DimensionFilter {
  private DimensionFilter() {
  }

  /**
   * @return true if a row with the given dimension value should be included.
   */
  public abstract boolean accepts(Object value);

  public static DimensionFilter equalTo(Object value) {
    return new EqualTo(value);
  }

  public static DimensionFilter oneOf(Collection<?> values) {
    return new OneOf(values);
  }

  public static DimensionFilter oneOf(Object... values) {
    return new OneOf(Arrays.asList(values));
  }

  public static DimensionFilter matching(Predicate<Object> predicate) {
    return new Matching(predicate);
  }

  /**
   * Accepts values equal to a single literal value.
   */
  public static final class EqualTo extends DimensionFilter {
    private final Object value;

    private EqualTo(Object value) {
      this.value = ValueDictionary.normalize(value);
    }

    @Override
    public boolean accepts(Object other) {
      return Objects.equals(value, ValueDictionary.normalize(other));
    }

    public Object getValue() {
      return value;
    }

    @Override
    public String toString() {
      return "EqualTo[" + value + "]";
    }
  }

  /**
   * Accepts values contained in a set of values.
   */
  public static final class OneOf extends DimensionFilter {
    private final Set<Object> values = new HashSet<>();

    private OneOf(Collection<?> values) {
      for (Object value : values)
        this.values.add(ValueDictionary.normalize(value));
    }

    @Override
    public boolean accepts(Object other) {
      return values.contains(ValueDictionary.normalize(other));
    }

    public Set<Object> getValues() {
      return Collections.unmodifiableSet(values);
    }

    @Override
    public String toString() {
      return "OneOf" + values;
    }
  }

  /**
   * Accepts values for which a predicate holds.
   */
  public static final class Matching extends DimensionFilter {
    private final Predicate<Object> predicate;

    private Matching(Predicate<Object> predicate) {
      this.predicate = predicate;
    }

    @Override
    public boolean accepts(Object other) {
      return predicate.test(other);
    }

    public Predicate<Object> getPredicate() {
      return predicate;
    }

    @Override
    public String toString() {
      return "Matching[" + predicate + "]";
    }
  }
}
