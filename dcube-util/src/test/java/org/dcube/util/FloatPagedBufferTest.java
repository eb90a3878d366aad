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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteOrder;

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link FloatPagedBuffer}.
 *
 * @author Bastian Gloeckle
 */
public class FloatPagedBufferTest {
  @Test
  public void accumulateTest() {
    // GIVEN
    FloatPagedBuffer buf = new FloatPagedBuffer(2);

    // WHEN
    buf.set(3, 1.5f);
    buf.set(3, buf.getFloat(3) + 2f);

    // THEN
    Assert.assertEquals(buf.length(), 4L);
    Assert.assertEquals(buf.getFloat(3), 3.5f);
    Assert.assertEquals(buf.get(0), Float.valueOf(0f));
    Assert.assertNull(buf.get(4));
  }

  @Test
  public void bigEndianBlobTest() throws IOException {
    // GIVEN
    FloatPagedBuffer buf = new FloatPagedBuffer(3);
    buf.add(1f);
    buf.add(-2.25f);
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    buf.writeTo(baos, ByteOrder.BIG_ENDIAN);

    // WHEN
    FloatPagedBuffer read = new FloatPagedBuffer(baos.toByteArray(), ByteOrder.BIG_ENDIAN);

    // THEN
    Assert.assertEquals(read.slice(0, 2), new float[] { 1f, -2.25f });
  }

  @Test(expectedExceptions = InvalidBufferLayoutException.class)
  public void misalignedBlobTest() {
    // WHEN THEN
    new FloatPagedBuffer(new byte[] { 0, 0 }, ByteOrder.LITTLE_ENDIAN);
  }
}
