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
package org.hyperledger.numeric.arithmetic;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.math.BigInteger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.tuweni.bytes.Bytes;
import org.hyperledger.numeric.datatypes.BitCursor;
import org.hyperledger.numeric.datatypes.DecimalStrings;
import org.hyperledger.numeric.datatypes.WordOps;
import org.hyperledger.numeric.datatypes.WordStorage;
import org.hyperledger.numeric.datatypes.WordWidth;

/**
 * Arbitrary-precision signed integer in base {@code 2^w}.
 *
 * <p>The magnitude is kept as little-endian words of a configurable width next to a sign flag.
 * Values of different widths belong to different families and cannot be mixed.
 */
public final class BinaryInteger implements IntegralNumber<BinaryInteger> {
  private static final Logger LOG = LogManager.getLogger(BinaryInteger.class);

  // region Internals
  // --------------------------------------------------------------------------
  // The storage is always canonical: no most significant zero word, at least one word,
  // and zero is never negative.

  // Decimal rendering of wide values uses base 10^9 chunks.
  private static final int CHUNK_BASE = 1_000_000_000;
  private static final int CHUNK_DIGITS = 9;

  private final WordStorage storage;

  @VisibleForTesting
  long[] words() {
    return storage.toArray();
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Constructors
  // --------------------------------------------------------------------------

  private BinaryInteger(final WordStorage storage) {
    // Takes ownership: storage must be canonical and not shared.
    this.storage = storage;
  }

  /**
   * Parses decimal text with the default word width.
   *
   * @param value text matching {@code -?(0|[1-9][0-9]*)}.
   * @return the parsed value.
   * @throws NumberFormatException if the text is not a decimal integer.
   */
  public static BinaryInteger of(final String value) {
    return of(value, WordWidth.DEFAULT);
  }

  /**
   * Parses decimal text.
   *
   * @param value text matching {@code -?(0|[1-9][0-9]*)}.
   * @param width word width of the new value.
   * @return the parsed value.
   * @throws NumberFormatException if the text is not a decimal integer.
   */
  public static BinaryInteger of(final String value, final WordWidth width) {
    DecimalStrings.checkValid(value);
    boolean negative = value.charAt(0) == '-';
    String magnitude = negative ? value.substring(1) : value;
    WordStorage storage = new WordStorage(width);
    // Each halving yields the next bit, least significant first.
    for (long bit = 0; !DecimalStrings.ZERO.equals(magnitude); bit++) {
      DecimalStrings.WordDivision division = DecimalStrings.divideByWord(magnitude, 2);
      if (division.remainder() != 0) storage.setBit(bit);
      magnitude = division.quotient();
    }
    return canonical(storage, negative);
  }

  /**
   * Instantiates a new BinaryInteger from a long with the default word width.
   *
   * @param value long value to convert.
   * @return The BinaryInteger equivalent of value.
   */
  public static BinaryInteger valueOf(final long value) {
    return valueOf(value, WordWidth.DEFAULT);
  }

  /**
   * Instantiates a new BinaryInteger from a long.
   *
   * @param value long value to convert.
   * @param width word width of the new value.
   * @return The BinaryInteger equivalent of value.
   */
  public static BinaryInteger valueOf(final long value, final WordWidth width) {
    // -Long.MIN_VALUE wraps to itself, which is 2^63 read as unsigned
    return valueOfUnsigned(value < 0 ? -value : value, width).withSign(value < 0);
  }

  /**
   * Instantiates a new BinaryInteger from an unsigned long with the default word width.
   *
   * @param value bits of an unsigned long.
   * @return The BinaryInteger equivalent of value.
   */
  public static BinaryInteger valueOfUnsigned(final long value) {
    return valueOfUnsigned(value, WordWidth.DEFAULT);
  }

  /**
   * Instantiates a new BinaryInteger from an unsigned long.
   *
   * @param value bits of an unsigned long.
   * @param width word width of the new value.
   * @return The BinaryInteger equivalent of value.
   */
  public static BinaryInteger valueOfUnsigned(final long value, final WordWidth width) {
    WordStorage storage = new WordStorage(width);
    long remaining = value;
    while (remaining != 0) {
      storage.push(remaining & width.mask());
      remaining = width.bits() == 64 ? 0 : remaining >>> width.bits();
    }
    return canonical(storage, false);
  }

  /**
   * Instantiates a new BinaryInteger from a big-endian magnitude.
   *
   * @param magnitude raw bytes in BigEndian order.
   * @param negative sign of the value; ignored for a zero magnitude.
   * @param width word width of the new value.
   * @return The BinaryInteger represented by the bytes and sign.
   */
  public static BinaryInteger fromBytes(
      final Bytes magnitude, final boolean negative, final WordWidth width) {
    checkNotNull(magnitude, "magnitude");
    Bytes trimmed = magnitude.trimLeadingZeros();
    int nBytes = trimmed.size();
    WordStorage storage = new WordStorage(width);
    storage.resize(Math.toIntExact(width.wordsFor(8L * nBytes)));
    BitCursor cursor = new BitCursor(storage, 0);
    for (int i = nBytes - 1; i >= 0; i--) {
      cursor.write(8, trimmed.get(i) & 0xFF);
    }
    return canonical(storage, negative);
  }

  private static BinaryInteger canonical(final WordStorage storage, final boolean negative) {
    storage.setNegative(negative);
    storage.trimTrailingZeros();
    return new BinaryInteger(storage);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Conversions
  // --------------------------------------------------------------------------

  public WordWidth width() {
    return storage.width();
  }

  /**
   * Convert the magnitude to big-endian bytes.
   *
   * @return minimal big-endian bytes of {@code |this|}, empty for zero.
   */
  public Bytes toBytes() {
    int nBytes = (int) ((storage.bitLength() + 7) / 8);
    byte[] out = new byte[nBytes];
    BitCursor cursor = new BitCursor(storage, 0);
    for (int i = nBytes - 1; i >= 0; i--) {
      out[i] = (byte) cursor.read(8);
    }
    return Bytes.wrap(out);
  }

  @Override
  public BigInteger toBigInteger() {
    return new BigInteger(isNegative() ? -1 : 1, toBytes().toArrayUnsafe());
  }

  @Override
  public long longValueExact() {
    long bits = storage.bitLength();
    if (bits > 64) throw overflow(bits, "long");
    long magnitude = storage.low64Bits();
    if (!isNegative()) {
      if (magnitude < 0) throw overflow(bits, "long");
      return magnitude;
    }
    if (magnitude == Long.MIN_VALUE) return Long.MIN_VALUE;
    if (magnitude < 0) throw overflow(bits, "long");
    return -magnitude;
  }

  @Override
  public long unsignedLongValueExact() {
    if (isNegative()) {
      throw new ArithmeticException("Negative value has no unsigned long representation");
    }
    long bits = storage.bitLength();
    if (bits > 64) throw overflow(bits, "unsigned long");
    return storage.low64Bits();
  }

  private static ArithmeticException overflow(final long bits, final String type) {
    return new ArithmeticException(
        "Integer overflow: a " + bits + "-bit magnitude does not fit a " + type);
  }

  @Override
  public String toString() {
    long bits = storage.bitLength();
    if (bits <= 64) {
      String digits = Long.toUnsignedString(storage.low64Bits());
      return isNegative() ? "-" + digits : digits;
    }
    LOG.trace("Rendering a {}-bit magnitude through decimal chunks", bits);
    // Double-and-add from the most significant bit, 2^29 < 10^9 bounds the chunk count.
    int[] chunks = new int[(int) (bits / 29) + 2];
    int used = 1;
    for (long i = bits - 1; i >= 0; i--) {
      long carry = storage.testBit(i) ? 1 : 0;
      for (int j = 0; j < used; j++) {
        long v = chunks[j] * 2L + carry;
        chunks[j] = (int) (v % CHUNK_BASE);
        carry = v / CHUNK_BASE;
      }
      if (carry != 0) chunks[used++] = (int) carry;
    }
    StringBuilder sb = new StringBuilder(used * CHUNK_DIGITS + 1);
    if (isNegative()) sb.append('-');
    sb.append(chunks[used - 1]);
    for (int j = used - 2; j >= 0; j--) {
      sb.append(Strings.padStart(Integer.toString(chunks[j]), CHUNK_DIGITS, '0'));
    }
    return sb.toString();
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Comparisons
  // --------------------------------------------------------------------------

  @Override
  public boolean isZero() {
    return storage.isZero();
  }

  @Override
  public boolean isNegative() {
    return storage.isNegative();
  }

  /**
   * Compares two BinaryInteger of the same width.
   *
   * @param other right BinaryInteger
   * @return 0 if this == other, negative if this &lt; other and positive if this &gt; other.
   */
  @Override
  public int compareTo(final BinaryInteger other) {
    checkFamily(other);
    if (isNegative() != other.isNegative()) return isNegative() ? -1 : 1;
    boolean thisZero = isZero();
    boolean otherZero = other.isZero();
    if (thisZero && otherZero) return 0;
    if (thisZero) return -1;
    if (otherZero) return 1;
    int cmp = compareMagnitudes(storage, other.storage);
    return isNegative() ? -cmp : cmp;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof BinaryInteger)) return false;
    BinaryInteger other = (BinaryInteger) obj;
    return storage.equals(other.storage);
  }

  @Override
  public int hashCode() {
    return storage.hashCode();
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Arithmetic Operations
  // --------------------------------------------------------------------------

  @Override
  public BinaryInteger withSign(final boolean negative) {
    if (negative == isNegative()) return this;
    WordStorage copy = storage.copy();
    copy.setNegative(negative && !copy.isZero());
    return new BinaryInteger(copy);
  }

  @Override
  public BinaryInteger self() {
    return this;
  }

  @Override
  public BinaryInteger create(final long value) {
    return valueOf(value, width());
  }

  @Override
  public BinaryInteger add(final BinaryInteger other) {
    checkFamily(other);
    return new BinaryInteger(addMagnitudes(storage, other.storage));
  }

  @Override
  public BinaryInteger subtract(final BinaryInteger other) {
    checkFamily(other);
    return new BinaryInteger(subtractMagnitudes(storage, other.storage));
  }

  /**
   * Shift-and-add multiplication: one shifted copy of {@code |this|} per set bit of {@code other}.
   *
   * @param other the multiplier.
   * @return {@code this * other}.
   */
  @Override
  public BinaryInteger multiply(final BinaryInteger other) {
    checkFamily(other);
    if (isZero() || other.isZero()) return create(0);
    WordStorage product = WordStorage.of(width(), 0);
    long bits = other.storage.bitLength();
    for (long bit = 0; bit < bits; bit++) {
      if (other.storage.testBit(bit)) {
        product = addMagnitudes(product, storage.shiftLeft(bit));
      }
    }
    return canonical(product, isNegative() != other.isNegative());
  }

  /**
   * Restoring binary long division.
   *
   * @param other the divisor.
   * @return {@code this / other}, truncated toward zero.
   */
  @Override
  public BinaryInteger divide(final BinaryInteger other) {
    checkFamily(other);
    if (other.isZero()) throw new ArithmeticException("Division by zero");
    if (isZero()) return create(0);
    WordStorage quotient = new WordStorage(width());
    WordStorage remainder = WordStorage.of(width(), 0);
    for (long i = storage.bitLength() - 1; i >= 0; i--) {
      remainder = remainder.shiftLeft(1);
      if (storage.testBit(i)) remainder.set(0, remainder.get(0) | 1L);
      if (compareMagnitudes(remainder, other.storage) >= 0) {
        remainder = subtractMagnitudes(remainder, other.storage);
        quotient.setBit(i);
      }
    }
    return canonical(quotient, isNegative() != other.isNegative());
  }

  @Override
  public BinaryInteger modulo(final BinaryInteger other) {
    checkFamily(other);
    if (other.isZero()) throw new ArithmeticException("Division by zero");
    if (isZero()) return create(0);
    BinaryInteger remainder = minus(divide(other).times(other));
    return remainder.withSign(isNegative());
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Support (private) Algorithms
  // --------------------------------------------------------------------------

  private void checkFamily(final BinaryInteger other) {
    checkArgument(
        width() == other.width(), "Word width mismatch: %s and %s", width(), other.width());
  }

  private static int compareMagnitudes(final WordStorage a, final WordStorage b) {
    int cmp;
    for (int i = Math.max(a.size(), b.size()) - 1; i >= 0; i--) {
      cmp = Long.compareUnsigned(a.getOrZero(i), b.getOrZero(i));
      if (cmp != 0) return cmp < 0 ? -1 : 1;
    }
    return 0;
  }

  private static WordStorage addMagnitudes(final WordStorage a, final WordStorage b) {
    WordWidth width = a.width();
    int len = Math.max(a.size(), b.size());
    long[] sum = new long[len + 1];
    int carry = 0;
    for (int i = 0; i < len; i++) {
      carry = WordOps.sum(sum, i, a.getOrZero(i), b.getOrZero(i), carry, width);
    }
    sum[len] = carry;
    WordStorage result = WordStorage.of(width, sum);
    result.trimTrailingZeros();
    return result;
  }

  private static WordStorage subtractMagnitudes(final WordStorage a, final WordStorage b) {
    WordWidth width = a.width();
    int len = Math.max(a.size(), b.size());
    long[] diff = new long[len];
    int borrow = 0;
    for (int i = 0; i < len; i++) {
      borrow = WordOps.subtract(diff, i, a.getOrZero(i), b.getOrZero(i), borrow, width);
    }
    checkArgument(borrow == 0, "Subtrahend magnitude exceeds minuend magnitude");
    WordStorage result = WordStorage.of(width, diff);
    result.trimTrailingZeros();
    return result;
  }

  // --------------------------------------------------------------------------
  // endregion
}
