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
 * {@link AbstractPagedBuffer} of 32 bit integers.
 *
 * <p>
 * The elements are plain java ints. Users that store unsigned values should interpret them using
 * {@link Integer#toUnsignedLong(int)}.
 *
 * @author Bastian Gloeckle
 */
public class IntPagedBuffer extends AbstractPagedBuffer<int[], IntPagedBuffer> {
  public static final int BYTES_PER_ELEMENT = Integer.BYTES;

  public IntPagedBuffer() {
    this(DEFAULT_PAGE_CAPACITY);
  }

  public IntPagedBuffer(int pageCapacity) {
    super(pageCapacity);
  }

  /**
   * Create a buffer that contains the elements of a binary blob in a single page. The page capacity is the number of
   * elements in the blob.
   *
   * @throws InvalidBufferLayoutException
   *           If the length of the blob is not a multiple of {@link #BYTES_PER_ELEMENT}.
   */
  public IntPagedBuffer(byte[] blob, ByteOrder byteOrder) throws InvalidBufferLayoutException {
    super(pageCapacityForBlob(validatedElementCount(blob, BYTES_PER_ELEMENT)));
    int[] page = new int[blob.length / BYTES_PER_ELEMENT];
    ByteBuffer.wrap(blob).order(byteOrder).asIntBuffer().get(page);
    adoptPage(page, page.length);
  }

  /**
   * @return The element at the given index or <code>null</code> if the index is not below {@link #length()}.
   */
  public Integer get(long idx) {
    if (idx < 0 || idx >= length())
      return null;
    return getInt(idx);
  }

  /**
   * @throws ArrayIndexOutOfBoundsException
   *           If the index is not below {@link #length()}.
   */
  public int getInt(long idx) throws ArrayIndexOutOfBoundsException {
    return pageForRead(idx)[indexInPage(idx)];
  }

  /**
   * Set the value at the given index, growing the buffer if needed.
   */
  public void set(long idx, int value) {
    pageForWrite(idx)[indexInPage(idx)] = value;
  }

  /**
   * Append a value at the end of the buffer.
   */
  public void add(int value) {
    set(length(), value);
  }

  /**
   * @return The elements in the range [from, to), where to is capped to {@link #length()}.
   */
  public int[] slice(long from, long to) {
    to = Math.min(to, length());
    if (from >= to)
      return new int[0];
    int[] res = new int[(int) (to - from)];
    for (int i = 0; i < res.length; i++)
      res[i] = getInt(from + i);
    return res;
  }

  @Override
  protected int[] allocatePage(int capacity) {
    return new int[capacity];
  }

  @Override
  protected int[] copyPage(int[] page) {
    return Arrays.copyOf(page, page.length);
  }

  @Override
  protected IntPagedBuffer createEmpty(int pageCapacity) {
    return new IntPagedBuffer(pageCapacity);
  }

  @Override
  protected int getBytesPerElement() {
    return BYTES_PER_ELEMENT;
  }

  @Override
  protected void putPage(int[] page, int count, ByteBuffer target) {
    for (int i = 0; i < count; i++)
      target.putInt(page[i]);
  }
}
