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

import java.util.OptionalLong;

/**
 * Codec for factorial-base digits packed back to back into a {@link DigitStorage}.
 *
 * <p>Digit {@code i} ranges over {@code [0, i]} and has positional weight {@code i!}. It occupies
 * exactly {@code bitsNeeded(i)} bits, starting at bit {@code totalBitsUpTo(i)}. Digit 0 is always 0
 * and occupies no bits.
 */
public final class FactorAccess {

  /** Largest addressable digit index. Negative Java longs are treated as above it. */
  public static final long MAX_INDEX = Long.MAX_VALUE;

  private FactorAccess() {}

  // region Layout
  // --------------------------------------------------------------------------

  /**
   * Number of significant bits of a value.
   *
   * @param value unsigned value.
   * @return the bit count, 0 for 0 and 64 for negative longs.
   */
  public static int bitsNeeded(final long value) {
    return 64 - Long.numberOfLeadingZeros(value);
  }

  /**
   * Floor of the base-2 logarithm.
   *
   * @param value unsigned value.
   * @return {@code floor(log2(value))}, or 0 for 0.
   */
  public static int log2Floor(final long value) {
    return (value == 0) ? 0 : bitsNeeded(value) - 1;
  }

  /**
   * Bit offset of a digit: the summed widths of digits {@code 0..index-1}.
   *
   * <p>With {@code N = index - 1} and {@code M = floor(log2(N))} the sum of the bit lengths of
   * {@code 1..N} is {@code N + M*N - (2^(M+1) - M - 2)}.
   *
   * @param index digit index.
   * @return the absolute bit offset of the digit.
   * @throws IndexOutOfBoundsException if the index is above {@link #MAX_INDEX} or its offset does
   *     not fit a long.
   */
  public static long totalBitsUpTo(final long index) {
    checkIndex(index);
    if (index == 0 || index == 1) return 0;
    long n = index - 1;
    int m = log2Floor(n);
    long prefix;
    try {
      prefix = Math.addExact(n, Math.multiplyExact(m, n));
    } catch (ArithmeticException e) {
      IndexOutOfBoundsException error =
          new IndexOutOfBoundsException("Bit offset of digit " + index + " overflows");
      error.initCause(e);
      throw error;
    }
    // m <= 61 here, larger values overflowed above
    return prefix - ((1L << (m + 1)) - m - 2);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Digit access
  // --------------------------------------------------------------------------

  /**
   * Reads a digit.
   *
   * @param storage packed digits.
   * @param index digit index.
   * @return the digit, or empty if its bits lie past the end of the storage.
   */
  public static OptionalLong extract(final WordStorage storage, final long index) {
    long position = totalBitsUpTo(index);
    int width = bitsNeeded(index);
    if (width == 0) return OptionalLong.of(0);
    long capacity = storage.bitCapacity();
    if (position >= capacity || position + width > capacity) return OptionalLong.empty();
    return OptionalLong.of(new BitCursor(storage, position).read(width));
  }

  /**
   * Writes a digit, growing the storage by whole words as needed.
   *
   * @param storage packed digits.
   * @param index digit index.
   * @param value digit value, at most {@code index}.
   * @throws IllegalArgumentException if {@code value} exceeds the radix of the position.
   */
  public static void put(final DigitStorage storage, final long index, final long value) {
    long position = totalBitsUpTo(index);
    checkArgument(
        value >= 0 && value <= index,
        "Digit %s exceeds the radix of position %s in the factorial number system",
        value,
        index);
    int width = bitsNeeded(index);
    if (width == 0) return;
    long wordsNeeded = storage.width().wordsFor(position + width);
    if (wordsNeeded > Integer.MAX_VALUE) {
      throw new IndexOutOfBoundsException("Digit " + index + " lies beyond addressable storage");
    }
    if (wordsNeeded > storage.size()) storage.resize((int) wordsNeeded);
    if (storage.highestDigitIndex() < index) storage.highestDigitIndex(index);
    new BitCursor(storage, position).write(width, value);
  }

  /**
   * Restores the canonical form: the cached index names the highest nonzero digit and no word
   * past it is kept. A zero value ends up with no words and a cleared sign.
   *
   * @param storage packed digits.
   */
  public static void trim(final DigitStorage storage) {
    long highest = storage.highestDigitIndex();
    while (highest > 0 && extract(storage, highest).orElse(0) == 0) highest--;
    storage.highestDigitIndex(highest);
    if (highest == 0) {
      storage.clear();
      storage.setNegative(false);
      return;
    }
    long words = storage.width().wordsFor(totalBitsUpTo(highest + 1));
    if (storage.size() > words) storage.resize((int) words);
  }

  // --------------------------------------------------------------------------
  // endregion

  private static void checkIndex(final long index) {
    if (index < 0) {
      throw new IndexOutOfBoundsException(
          "Digit index " + Long.toUnsignedString(index) + " exceeds " + MAX_INDEX);
    }
  }
}
