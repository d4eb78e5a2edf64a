/*
 * Copyright ConsenSys AG.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License is distributed on
 * an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package org.hyperledger.numeric.datatypes;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Reads and writes bit fields at an absolute bit offset of a {@link WordStorage}.
 *
 * <p>A field is split into word-aligned chunks: one per word it touches. Fields are assembled
 * least significant bit first. The cursor advances past every field it reads or writes.
 */
public final class BitCursor {
  private final WordStorage storage;
  private long position;

  /**
   * Instantiates a cursor.
   *
   * @param storage storage to address.
   * @param position absolute bit offset of the first field.
   */
  public BitCursor(final WordStorage storage, final long position) {
    checkArgument(position >= 0, "Negative bit position: %s", position);
    this.storage = checkNotNull(storage, "storage");
    this.position = position;
  }

  public long position() {
    return position;
  }

  /**
   * Reads a field and advances past it.
   *
   * @param bitCount field width, between 0 and 64.
   * @return the field value.
   */
  public long read(final int bitCount) {
    checkField(bitCount);
    int wordBits = storage.width().bits();
    long result = 0;
    int done = 0;
    while (done < bitCount) {
      int wordIndex = (int) (position / wordBits);
      int offset = (int) (position % wordBits);
      int step = Math.min(bitCount - done, wordBits - offset);
      long chunk = storage.get(wordIndex) >>> offset;
      if (step < 64) chunk &= (1L << step) - 1;
      result |= chunk << done;
      done += step;
      position += step;
    }
    return result;
  }

  /**
   * Overwrites a field and advances past it. Bits outside the field are left untouched.
   *
   * @param bitCount field width, between 0 and 64.
   * @param value field value; bits above {@code bitCount} are ignored.
   */
  public void write(final int bitCount, final long value) {
    checkField(bitCount);
    int wordBits = storage.width().bits();
    int done = 0;
    while (done < bitCount) {
      int wordIndex = (int) (position / wordBits);
      int offset = (int) (position % wordBits);
      int step = Math.min(bitCount - done, wordBits - offset);
      long fieldMask = step == 64 ? -1L : (1L << step) - 1;
      long chunk = (value >>> done) & fieldMask;
      long word = storage.get(wordIndex);
      word &= ~(fieldMask << offset);
      word |= chunk << offset;
      storage.set(wordIndex, word);
      done += step;
      position += step;
    }
  }

  private void checkField(final int bitCount) {
    checkArgument(bitCount >= 0 && bitCount <= 64, "Invalid field width: %s", bitCount);
    if (position + bitCount > storage.bitCapacity()) {
      throw new IndexOutOfBoundsException(
          "Field ["
              + position
              + ", "
              + (position + bitCount)
              + ") exceeds storage of "
              + storage.bitCapacity()
              + " bits");
    }
  }
}
