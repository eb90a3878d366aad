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

import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link ValueDictionary}.
 *
 * @author Bastian Gloeckle
 */
public class ValueDictionaryTest {
  @Test
  public void internAssignsDenseIdsTest() {
    // GIVEN
    ValueDictionary dict = new ValueDictionary();

    // WHEN
    int a = dict.intern("a");
    int b = dict.intern("b");
    int a2 = dict.intern("a");

    // THEN
    Assert.assertEquals(a, 0);
    Assert.assertEquals(b, 1);
    Assert.assertEquals(a2, 0, "Expected existing ID to be returned");
    Assert.assertEquals(dict.size(), 2);
    Assert.assertEquals(dict.valueAt(1), "b");
    Assert.assertEquals(dict.getValues(), Arrays.asList("a", "b"));
  }

  @Test
  public void numbersAreNormalizedTest() {
    // GIVEN
    ValueDictionary dict = new ValueDictionary();

    // WHEN
    int intId = dict.intern(1);
    int longId = dict.intern(1L);
    int floatId = dict.intern(1.5f);
    int doubleId = dict.intern(1.5);

    // THEN
    Assert.assertEquals(longId, intId);
    Assert.assertEquals(doubleId, floatId);
    Assert.assertEquals(dict.valueAt(intId), 1L);
    Assert.assertEquals(dict.findId((short) 1), Integer.valueOf(intId));
    Assert.assertNull(dict.findId("1"), "Expected string not to match number");
  }

  @Test
  public void copyIsIndependentTest() {
    // GIVEN
    ValueDictionary dict = new ValueDictionary();
    dict.intern("a");

    // WHEN
    ValueDictionary copy = dict.copy();
    copy.intern("b");

    // THEN
    Assert.assertEquals(dict.size(), 1);
    Assert.assertEquals(copy.size(), 2);
    Assert.assertNull(dict.findId("b"));
  }

  @Test
  public void ofTest() {
    // WHEN
    ValueDictionary dict = ValueDictionary.of(Arrays.asList("x", 5L, "y"));

    // THEN
    Assert.assertEquals(dict.findId("y"), Integer.valueOf(2));
    Assert.assertEquals(dict.findId(5), Integer.valueOf(1));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void ofDuplicateTest() {
    // WHEN THEN
    ValueDictionary.of(Arrays.asList("x", "x"));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void unknownIdTest() {
    // GIVEN
    ValueDictionary dict = new ValueDictionary();
    dict.intern("a");

    // WHEN THEN
    dict.valueAt(1);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void internNullTest() {
    // WHEN THEN
    new ValueDictionary().intern(null);
  }
}
