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

import java.util.Arrays;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Variable-length sequence of unsigned words plus a packed sign and 63-bit auxiliary value.
 *
 * <p>This is the mutable working container behind the integer engines. An engine value owns its
 * storage exclusively and only hands out copies.
 */
public class WordStorage {
  // region Internals
  // --------------------------------------------------------------------------
  // Words are little-endian: index 0 is the least significant word.
  // Every word is kept masked to the configured width.
  // Slots past size are always zero, so growing never exposes stale bits.
  // The sign lives in the MSB of state, the remaining 63 bits are left to subclasses.

  private static final long SIGN_MASK = 1L << 63;
  private static final long AUX_MASK = ~SIGN_MASK;
  private static final long[] NO_WORDS = new long[0];

  private final WordWidth width;
  private long[] words;
  private int size;
  private long state;

  // --------------------------------------------------------------------------
  // endregion

  // region Constructors
  // --------------------------------------------------------------------------

  /**
   * Instantiates an empty storage.
   *
   * @param width width of the words.
   */
  public WordStorage(final WordWidth width) {
    this.width = checkNotNull(width, "width");
    this.words = NO_WORDS;
  }

  /**
   * Copy constructor.
   *
   * @param other storage to copy, words and state included.
   */
  protected WordStorage(final WordStorage other) {
    this.width = other.width;
    this.words = Arrays.copyOf(other.words, other.size);
    this.size = other.size;
    this.state = other.state;
  }

  /**
   * Instantiates a storage holding the given words.
   *
   * @param width width of the words.
   * @param words words in little-endian order, masked to {@code width}.
   * @return a new storage, not trimmed.
   */
  public static WordStorage of(final WordWidth width, final long... words) {
    WordStorage storage = new WordStorage(width);
    storage.resize(words.length);
    for (int i = 0; i < words.length; i++) {
      storage.set(i, words[i]);
    }
    return storage;
  }

  /**
   * Deep copy of this storage.
   *
   * @return an independent copy.
   */
  public WordStorage copy() {
    return new WordStorage(this);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Word access
  // --------------------------------------------------------------------------

  public WordWidth width() {
    return width;
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /**
   * Number of bits the current words can hold.
   *
   * @return {@code size * width} bits.
   */
  public long bitCapacity() {
    return (long) size * width.bits();
  }

  /**
   * Reads a word.
   *
   * @param index word index, little-endian.
   * @return the word.
   */
  public long get(final int index) {
    Objects.checkIndex(index, size);
    return words[index];
  }

  /**
   * Reads a word, treating words past the end as zero.
   *
   * @param index word index, little-endian.
   * @return the word, or 0 if {@code index >= size()}.
   */
  public long getOrZero(final int index) {
    return index < size ? words[index] : 0L;
  }

  /**
   * Overwrites a word. Bits above the word width are dropped.
   *
   * @param index word index, little-endian.
   * @param value new word value.
   */
  public void set(final int index, final long value) {
    Objects.checkIndex(index, size);
    words[index] = value & width.mask();
  }

  /**
   * Appends a most significant word.
   *
   * @param value word value, masked to the width.
   */
  public void push(final long value) {
    ensureCapacity(size + 1);
    words[size++] = value & width.mask();
  }

  /**
   * Grows with zero words or truncates the most significant words.
   *
   * @param newSize new number of words.
   */
  public void resize(final int newSize) {
    checkArgument(newSize >= 0, "Negative storage size: %s", newSize);
    if (newSize > size) {
      ensureCapacity(newSize);
    } else {
      Arrays.fill(words, newSize, size, 0L);
    }
    size = newSize;
  }

  /** Drops all words. The packed state is kept. */
  public void clear() {
    resize(0);
  }

  /**
   * Copy of the words.
   *
   * @return words in little-endian order.
   */
  public long[] toArray() {
    return Arrays.copyOf(words, size);
  }

  private void ensureCapacity(final int capacity) {
    if (capacity > words.length) {
      words = Arrays.copyOf(words, Math.max(capacity, words.length * 2));
    }
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Packed state
  // --------------------------------------------------------------------------

  public boolean isNegative() {
    return (state & SIGN_MASK) != 0;
  }

  public void setNegative(final boolean negative) {
    if (negative) state |= SIGN_MASK;
    else state &= AUX_MASK;
  }

  /**
   * The 63-bit value packed next to the sign.
   *
   * @return the auxiliary value.
   */
  protected long auxiliary() {
    return state & AUX_MASK;
  }

  /**
   * Replaces the 63-bit value packed next to the sign. The sign is untouched.
   *
   * @param value non-negative value.
   */
  protected void auxiliary(final long value) {
    checkArgument(value >= 0, "Auxiliary value does not fit 63 bits: %s", value);
    state = (state & SIGN_MASK) | value;
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Bit level
  // --------------------------------------------------------------------------

  /**
   * Is every word 0 ? An empty storage is zero.
   *
   * @return true if no bit is set.
   */
  public boolean isZero() {
    for (int i = 0; i < size; i++) {
      if (words[i] != 0) return false;
    }
    return true;
  }

  /**
   * Position of the highest set bit plus one.
   *
   * @return the occupied bit length, 0 for zero.
   */
  public long bitLength() {
    int i = size - 1;
    while ((i >= 0) && (words[i] == 0)) i--;
    if (i < 0) return 0;
    return (long) i * width.bits() + (64 - Long.numberOfLeadingZeros(words[i]));
  }

  /**
   * Reads a single bit.
   *
   * @param bit absolute bit position.
   * @return true if the bit is set, false for bits past the end.
   */
  public boolean testBit(final long bit) {
    long wordIndex = bit / width.bits();
    if (wordIndex >= size) return false;
    return ((words[(int) wordIndex] >>> (bit % width.bits())) & 1L) != 0;
  }

  /**
   * Sets a single bit, growing the storage if needed.
   *
   * @param bit absolute bit position.
   */
  public void setBit(final long bit) {
    int wordIndex = Math.toIntExact(bit / width.bits());
    if (wordIndex >= size) resize(wordIndex + 1);
    words[wordIndex] |= 1L << (bit % width.bits());
  }

  /**
   * The low 64 bits of the magnitude.
   *
   * @return the least significant 64 bits, unsigned.
   */
  public long low64Bits() {
    long result = 0;
    int bits = width.bits();
    for (int i = 0; i < size && (long) i * bits < 64; i++) {
      result |= words[i] << (i * bits);
    }
    return result;
  }

  /**
   * Shifts the magnitude to the left into a new storage. The sign is not carried over.
   *
   * @param shift number of bits to shift, non-negative.
   * @return the shifted magnitude, trimmed.
   */
  public WordStorage shiftLeft(final long shift) {
    checkArgument(shift >= 0, "Negative shift: %s", shift);
    int bits = width.bits();
    int limbShift = Math.toIntExact(shift / bits);
    int bitShift = (int) (shift % bits);
    WordStorage result = new WordStorage(width);
    if (isZero()) {
      result.trimTrailingZeros();
      return result;
    }
    result.resize(size + limbShift + 1);
    if (bitShift == 0) {
      System.arraycopy(words, 0, result.words, limbShift, size);
    } else {
      int j = limbShift;
      long carry = 0;
      for (int i = 0; i < size; ++i, ++j) {
        result.words[j] = ((words[i] << bitShift) | carry) & width.mask();
        carry = words[i] >>> (bits - bitShift);
      }
      result.words[j] = carry; // last carry
    }
    result.trimTrailingZeros();
    return result;
  }

  /**
   * Drops most significant zero words. If nothing is left, a single zero word is kept and the sign
   * is cleared.
   */
  public void trimTrailingZeros() {
    int newSize = size;
    while (newSize > 0 && words[newSize - 1] == 0) newSize--;
    size = newSize;
    if (size == 0) {
      push(0);
      setNegative(false);
    }
  }

  // --------------------------------------------------------------------------
  // endregion

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (obj == null || obj.getClass() != getClass()) return false;
    WordStorage other = (WordStorage) obj;
    return width == other.width
        && state == other.state
        && Arrays.equals(words, 0, size, other.words, 0, other.size);
  }

  @Override
  public int hashCode() {
    int h = 31 * width.hashCode() + Long.hashCode(state);
    for (int i = 0; i < size; i++) {
      h = 31 * h + Long.hashCode(words[i]);
    }
    return h;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("width", width)
        .add("negative", isNegative())
        .add("auxiliary", auxiliary())
        .add("words", Arrays.toString(toArray()))
        .toString();
  }
}
