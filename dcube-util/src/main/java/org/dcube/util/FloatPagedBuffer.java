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

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * {@link AbstractPagedBuffer} of 32 bit floating point numbers.
 *
 * @author Bastian Gloeckle
 */
public class FloatPagedBuffer extends AbstractPagedBuffer<float[], FloatPagedBuffer> {
  public static final int BYTES_PER_ELEMENT = Float.BYTES;

  public FloatPagedBuffer() {
    this(DEFAULT_PAGE_CAPACITY);
  }

  public FloatPagedBuffer(int pageCapacity) {
    super(pageCapacity);
  }

  /**
   * Create a buffer that contains the elements of a binary blob in a single page. The page capacity is the number of
   * elements in the blob.
   *
   * @throws InvalidBufferLayoutException
   *           If the length of the blob is not a multiple of {@link #BYTES_PER_ELEMENT}.
   */
  public FloatPagedBuffer(byte[] blob, ByteOrder byteOrder) throws InvalidBufferLayoutException {
    super(pageCapacityForBlob(validatedElementCount(blob, BYTES_PER_ELEMENT)));
    float[] page = new float[blob.length / BYTES_PER_ELEMENT];
    ByteBuffer.wrap(blob).order(byteOrder).asFloatBuffer().get(page);
    adoptPage(page, page.length);
  }

  /**
   * @return The element at the given index or <code>null</code> if the index is not below {@link #length()}.
   */
  public Float get(long idx) {
    if (idx < 0 || idx >= length())
      return null;
    return getFloat(idx);
  }

  /**
   * @throws ArrayIndexOutOfBoundsException
   *           If the index is not below {@link #length()}.
   */
  public float getFloat(long idx) throws ArrayIndexOutOfBoundsException {
    return pageForRead(idx)[indexInPage(idx)];
  }

  /**
   * Set the value at the given index, growing the buffer if needed.
   */
  public void set(long idx, float value) {
    pageForWrite(idx)[indexInPage(idx)] = value;
  }

  /**
   * Append a value at the end of the buffer.
   */
  public void add(float value) {
    set(length(), value);
  }

  /**
   * @return The elements in the range [from, to), where to is capped to {@link #length()}.
   */
  public float[] slice(long from, long to) {
    to = Math.min(to, length());
    if (from >= to)
      return new float[0];
    float[] res = new float[(int) (to - from)];
    for (int i = 0; i < res.length; i++)
      res[i] = getFloat(from + i);
    return res;
  }

  @Override
  protected float[] allocatePage(int capacity) {
    return new float[capacity];
  }

  @Override
  protected float[] copyPage(float[] page) {
    return Arrays.copyOf(page, page.length);
  }

  @Override
  protected FloatPagedBuffer createEmpty(int pageCapacity) {
    return new FloatPagedBuffer(pageCapacity);
  }

  @Override
  protected int getBytesPerElement() {
    return BYTES_PER_ELEMENT;
  }

  @Override
  protected void putPage(float[] page, int count, ByteBuffer target) {
    for (int i = 0; i < count; i++)
      target.putFloat(page[i]);
  }
}
