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

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * A growable array of fixed-width numeric elements, which allocates its backing arrays in pages of equal size.
 *
 * <p>
 * The buffer is accessible only using absolute indices, similar to a {@link ByteBuffer}. Element i is located in page
 * <code>i / pageCapacity</code> at offset <code>i % pageCapacity</code>. When growing, only new pages are allocated,
 * already allocated pages are never copied. All pages but the last one are fully allocated, even if not all of their
 * elements have been set.
 *
 * <p>
 * The "length" of the buffer is the number of logically assigned elements: It is one greater than the greatest index
 * that has been set. Elements below the length that have never been set hold the zero value of the element type.
 *
 * <p>
 * This class is not thread safe.
 *
 * @param <P>
 *          Type of a single page, a primitive array like int[].
 * @param <B>
 *          The implementing class.
 * @author Bastian Gloeckle
 */
public abstract class AbstractPagedBuffer<P, B extends AbstractPagedBuffer<P, B>> {
  /** Page capacity (number of elements per page) used if nothing else is specified. */
  public static final int DEFAULT_PAGE_CAPACITY = 100 * 1024;

  protected final List<P> pages = new ArrayList<>();

  private final int pageCapacity;

  private long length = 0L;

  protected AbstractPagedBuffer(int pageCapacity) throws IllegalArgumentException {
    if (pageCapacity <= 0)
      throw new IllegalArgumentException("Page capacity must be positive, but was " + pageCapacity);
    this.pageCapacity = pageCapacity;
  }

  /**
   * @return A new zero-filled page with the given number of elements.
   */
  protected abstract P allocatePage(int capacity);

  /**
   * @return A full copy of the given page.
   */
  protected abstract P copyPage(P page);

  /**
   * @return A new, empty buffer of the same type with the given page capacity.
   */
  protected abstract B createEmpty(int pageCapacity);

  /**
   * @return Number of bytes a single element takes up in its binary representation.
   */
  protected abstract int getBytesPerElement();

  /**
   * Write the first count elements of the given page into the given target buffer.
   */
  protected abstract void putPage(P page, int count, ByteBuffer target);

  /**
   * @return Number of elements that have been logically assigned.
   */
  public long length() {
    return length;
  }

  public int getPageCapacity() {
    return pageCapacity;
  }

  public int getNumberOfPages() {
    return pages.size();
  }

  /**
   * Copies elements of this buffer into another buffer. The length of the destination buffer is extended as needed.
   *
   * @param srcOffset
   *          Index of the first element in this buffer to copy.
   * @param dest
   *          The buffer to copy to, must not be this buffer.
   * @param destOffset
   *          Index in dest where the first element is copied to.
   * @param count
   *          Number of elements to copy.
   * @throws ArrayIndexOutOfBoundsException
   *           If the source range is not fully contained in this buffer.
   */
  public void copyRange(long srcOffset, B dest, long destOffset, long count) throws ArrayIndexOutOfBoundsException {
    if (count <= 0)
      return;
    if (srcOffset < 0 || srcOffset + count > length || destOffset < 0)
      throw new ArrayIndexOutOfBoundsException("Cannot copy " + count + " elements from index " + srcOffset
          + " of buffer of length " + length + " to index " + destOffset);

    dest.ensureLength(destOffset + count);

    long copied = 0;
    while (copied < count) {
      long srcIdx = srcOffset + copied;
      long destIdx = destOffset + copied;
      int srcInPage = (int) (srcIdx % pageCapacity);
      int destInPage = (int) (destIdx % dest.getPageCapacity());
      long chunk = Math.min(count - copied,
          Math.min(pageCapacity - srcInPage, dest.getPageCapacity() - destInPage));

      System.arraycopy(pages.get((int) (srcIdx / pageCapacity)), srcInPage,
          dest.pages.get((int) (destIdx / dest.getPageCapacity())), destInPage, (int) chunk);
      copied += chunk;
    }
  }

  /**
   * @return A deep copy of this buffer which does not share any storage with this buffer, using the same page
   *         capacity.
   */
  @Override
  public B clone() {
    B res = createEmpty(pageCapacity);
    for (P page : pages)
      res.pages.add(copyPage(page));
    res.setLength(length);
    return res;
  }

  /**
   * Write the logically assigned elements of this buffer page by page, the last page truncated to the length of the
   * buffer. No header is written.
   */
  public void writeTo(OutputStream outputStream, ByteOrder byteOrder) throws IOException {
    long remaining = length;
    for (P page : pages) {
      if (remaining <= 0)
        break;
      int count = (int) Math.min(remaining, pageCapacity);
      ByteBuffer buf = ByteBuffer.allocate(count * getBytesPerElement()).order(byteOrder);
      putPage(page, count, buf);
      outputStream.write(buf.array(), 0, buf.position());
      remaining -= count;
    }
  }

  /**
   * @return the page holding the given index, allocating all pages up to that one if needed. Extends the length of
   *         this buffer to include the given index.
   */
  protected P pageForWrite(long idx) throws ArrayIndexOutOfBoundsException {
    if (idx < 0)
      throw new ArrayIndexOutOfBoundsException("Tried to write index " + idx);
    ensureLength(idx + 1);
    return pages.get((int) (idx / pageCapacity));
  }

  /**
   * @return the page holding the given index.
   * @throws ArrayIndexOutOfBoundsException
   *           if the index is not below the length of this buffer.
   */
  protected P pageForRead(long idx) throws ArrayIndexOutOfBoundsException {
    if (idx < 0 || idx >= length)
      throw new ArrayIndexOutOfBoundsException("Tried to access index " + idx + " on buffer of length " + length);
    return pages.get((int) (idx / pageCapacity));
  }

  protected int indexInPage(long idx) {
    return (int) (idx % pageCapacity);
  }

  /**
   * Sets the content of an empty buffer to the given single page.
   */
  protected void adoptPage(P page, long numberOfElements) {
    pages.clear();
    if (numberOfElements > 0)
      pages.add(page);
    length = numberOfElements;
  }

  protected void ensureLength(long newLength) {
    int neededPages = (int) ((newLength + pageCapacity - 1) / pageCapacity);
    while (pages.size() < neededPages)
      pages.add(allocatePage(pageCapacity));
    if (newLength > length)
      length = newLength;
  }

  protected void setLength(long length) {
    this.length = length;
  }

  /**
   * Validates that the given binary blob can be interpreted as an array of elements of the given width.
   *
   * @return The number of elements contained in the blob.
   * @throws InvalidBufferLayoutException
   *           If the blob length is no multiple of the element width.
   */
  protected static int validatedElementCount(byte[] blob, int bytesPerElement) throws InvalidBufferLayoutException {
    if (blob.length % bytesPerElement != 0)
      throw new InvalidBufferLayoutException(
          "Byte length " + blob.length + " is not a multiple of the element width " + bytesPerElement + ".");
    return blob.length / bytesPerElement;
  }

  /**
   * @return Page capacity of a buffer that adopts a blob with the given number of elements.
   */
  protected static int pageCapacityForBlob(int numberOfElements) {
    return (numberOfElements > 0) ? numberOfElements : DEFAULT_PAGE_CAPACITY;
  }
}
