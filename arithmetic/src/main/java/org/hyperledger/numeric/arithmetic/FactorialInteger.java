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

import java.util.OptionalLong;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hyperledger.numeric.datatypes.DecimalStrings;
import org.hyperledger.numeric.datatypes.DigitStorage;
import org.hyperledger.numeric.datatypes.FactorAccess;
import org.hyperledger.numeric.datatypes.WordWidth;

/**
 * Arbitrary-precision signed integer in the factorial number system.
 *
 * <p>Digit {@code i} lies in {@code [0, i]} and weighs {@code i!}. Digits are bit-packed, each
 * taking exactly {@code bitsNeeded(i)} bits. Addition and subtraction run digit by digit in mixed
 * radix; multiplication, division and remainder go through decimal text.
 */
public final class FactorialInteger implements IntegralNumber<FactorialInteger> {
  private static final Logger LOG = LogManager.getLogger(FactorialInteger.class);

  private final DigitStorage storage;

  @VisibleForTesting
  long[] words() {
    return storage.toArray();
  }

  // region Constructors
  // --------------------------------------------------------------------------

  private FactorialInteger(final DigitStorage storage) {
    this.storage = storage;
  }

  /**
   * Parses decimal text with the default word width.
   *
   * @param value text matching {@code -?(0|[1-9][0-9]*)}.
   * @return the parsed value.
   * @throws NumberFormatException if the text is not a decimal integer.
   */
  public static FactorialInteger of(final String value) {
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
  public static FactorialInteger of(final String value, final WordWidth width) {
    DecimalStrings.checkValid(value);
    boolean negative = value.charAt(0) == '-';
    return parseMagnitude(negative ? value.substring(1) : value, negative, width);
  }

  public static FactorialInteger valueOf(final long value) {
    return valueOf(value, WordWidth.DEFAULT);
  }

  /**
   * Instantiates a new FactorialInteger from a long.
   *
   * @param value long value to convert.
   * @param width word width of the new value.
   * @return The FactorialInteger equivalent of value.
   */
  public static FactorialInteger valueOf(final long value, final WordWidth width) {
    return valueOfUnsigned(value < 0 ? -value : value, width).withSign(value < 0);
  }

  public static FactorialInteger valueOfUnsigned(final long value) {
    return valueOfUnsigned(value, WordWidth.DEFAULT);
  }

  /**
   * Instantiates a new FactorialInteger from an unsigned long.
   *
   * @param value bits of an unsigned long.
   * @param width word width of the new value.
   * @return The FactorialInteger equivalent of value.
   */
  public static FactorialInteger valueOfUnsigned(final long value, final WordWidth width) {
    DigitStorage storage = new DigitStorage(width);
    long remaining = value;
    for (long radix = 1; remaining != 0; radix++) {
      FactorAccess.put(storage, radix - 1, Long.remainderUnsigned(remaining, radix));
      remaining = Long.divideUnsigned(remaining, radix);
    }
    return canonical(storage, false);
  }

  private static FactorialInteger parseMagnitude(
      final String magnitude, final boolean negative, final WordWidth width) {
    DigitStorage storage = new DigitStorage(width);
    String remaining = magnitude;
    // digit i is the remainder of the division by i + 1
    for (long index = 0; !DecimalStrings.ZERO.equals(remaining); index++) {
      DecimalStrings.WordDivision division = DecimalStrings.divideByWord(remaining, index + 1);
      FactorAccess.put(storage, index, division.remainder());
      remaining = division.quotient();
    }
    return canonical(storage, negative);
  }

  private static FactorialInteger canonical(final DigitStorage storage, final boolean negative) {
    storage.setNegative(negative);
    FactorAccess.trim(storage);
    return new FactorialInteger(storage);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Digits and Conversions
  // --------------------------------------------------------------------------

  public WordWidth width() {
    return storage.width();
  }

  /**
   * Digit at a position.
   *
   * @param index digit index.
   * @return the digit, 0 past the highest stored one.
   * @throws IndexOutOfBoundsException if the index is above {@link FactorAccess#MAX_INDEX}.
   */
  public long digit(final long index) {
    return digitAt(storage, index);
  }

  /**
   * Index of the highest nonzero digit.
   *
   * @return the index, 0 for zero.
   */
  public long highestDigitIndex() {
    return storage.highestDigitIndex();
  }

  @Override
  public long longValueExact() {
    long result = 0;
    long factorial = 1;
    boolean factorialOverflow = false;
    long highest = storage.highestDigitIndex();
    for (long index = 1; index <= highest; index++) {
      if (!factorialOverflow) {
        if (factorial > Long.MAX_VALUE / index) factorialOverflow = true;
        else factorial *= index;
      }
      long digit = digitAt(storage, index);
      if (digit == 0) continue;
      if (factorialOverflow) {
        throw new ArithmeticException("Integer overflow: digit " + index + " outweighs a long");
      }
      long term = Math.multiplyExact(digit, factorial);
      result = isNegative() ? Math.subtractExact(result, term) : Math.addExact(result, term);
    }
    return result;
  }

  @Override
  public long unsignedLongValueExact() {
    if (isNegative()) {
      throw new ArithmeticException("Negative value has no unsigned long representation");
    }
    long result = 0;
    long factorial = 1;
    boolean factorialOverflow = false;
    long highest = storage.highestDigitIndex();
    for (long index = 1; index <= highest; index++) {
      if (!factorialOverflow) {
        if (Long.compareUnsigned(factorial, Long.divideUnsigned(-1L, index)) > 0) {
          factorialOverflow = true;
        } else {
          factorial *= index;
        }
      }
      long digit = digitAt(storage, index);
      if (digit == 0) continue;
      if (factorialOverflow
          || Long.compareUnsigned(factorial, Long.divideUnsigned(-1L, digit)) > 0) {
        throw unsignedOverflow(index);
      }
      long sum = result + digit * factorial;
      if (Long.compareUnsigned(sum, result) < 0) throw unsignedOverflow(index);
      result = sum;
    }
    return result;
  }

  private static ArithmeticException unsignedOverflow(final long index) {
    return new ArithmeticException(
        "Integer overflow: digit " + index + " outweighs an unsigned long");
  }

  @Override
  public String toString() {
    String magnitude = magnitudeString();
    return isNegative() ? "-" + magnitude : magnitude;
  }

  // Horner accumulation of digit * index! in decimal text.
  private String magnitudeString() {
    if (isZero()) return DecimalStrings.ZERO;
    String sum = DecimalStrings.ZERO;
    String factorial = "1";
    long highest = storage.highestDigitIndex();
    for (long index = 0; index <= highest; index++) {
      OptionalLong digit = FactorAccess.extract(storage, index);
      if (digit.isEmpty()) break;
      if (digit.getAsLong() != 0) {
        sum = DecimalStrings.add(sum, DecimalStrings.multiplyByWord(factorial, digit.getAsLong()));
      }
      factorial = DecimalStrings.multiplyByWord(factorial, index + 1);
    }
    return sum;
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Comparisons
  // --------------------------------------------------------------------------

  @Override
  public boolean isZero() {
    return storage.highestDigitIndex() == 0;
  }

  @Override
  public boolean isNegative() {
    return storage.isNegative();
  }

  /**
   * Compares two FactorialInteger of the same width, most significant digit first.
   *
   * @param other right FactorialInteger
   * @return 0 if this == other, negative if this &lt; other and positive if this &gt; other.
   */
  @Override
  public int compareTo(final FactorialInteger other) {
    checkFamily(other);
    if (isNegative() != other.isNegative()) return isNegative() ? -1 : 1;
    boolean thisZero = isZero();
    boolean otherZero = other.isZero();
    if (thisZero && otherZero) return 0;
    if (thisZero) return -1;
    if (otherZero) return 1;
    long top = Math.max(storage.highestDigitIndex(), other.storage.highestDigitIndex());
    for (long index = top; index > 0; index--) {
      long a = digitAt(storage, index);
      long b = digitAt(other.storage, index);
      if (a != b) {
        int cmp = a < b ? -1 : 1;
        return isNegative() ? -cmp : cmp;
      }
    }
    return 0;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof FactorialInteger)) return false;
    FactorialInteger other = (FactorialInteger) obj;
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
  public FactorialInteger withSign(final boolean negative) {
    if (negative == isNegative()) return this;
    DigitStorage copy = storage.copy();
    copy.setNegative(negative && !isZero());
    return new FactorialInteger(copy);
  }

  @Override
  public FactorialInteger self() {
    return this;
  }

  @Override
  public FactorialInteger create(final long value) {
    return valueOf(value, width());
  }

  @Override
  public FactorialInteger add(final FactorialInteger other) {
    checkFamily(other);
    DigitStorage result = new DigitStorage(width());
    long top = Math.max(storage.highestDigitIndex(), other.storage.highestDigitIndex());
    long carry = 0;
    for (long index = 0; index <= top || carry != 0; index++) {
      long sum = digitAt(storage, index) + digitAt(other.storage, index) + carry;
      carry = 0;
      if (sum > index) {
        sum -= index + 1;
        carry = 1;
      }
      FactorAccess.put(result, index, sum);
    }
    return canonical(result, false);
  }

  @Override
  public FactorialInteger subtract(final FactorialInteger other) {
    checkFamily(other);
    DigitStorage result = new DigitStorage(width());
    long top = Math.max(storage.highestDigitIndex(), other.storage.highestDigitIndex());
    long borrow = 0;
    for (long index = 0; index <= top; index++) {
      long diff = digitAt(storage, index) - digitAt(other.storage, index) - borrow;
      borrow = 0;
      if (diff < 0) {
        diff += index + 1;
        borrow = 1;
      }
      FactorAccess.put(result, index, diff);
    }
    checkArgument(borrow == 0, "Subtrahend magnitude exceeds minuend magnitude");
    return canonical(result, false);
  }

  @Override
  public FactorialInteger multiply(final FactorialInteger other) {
    checkFamily(other);
    if (isZero() || other.isZero()) return create(0);
    LOG.trace(
        "Multiplying factorial values with {} and {} digits in decimal",
        highestDigitIndex(),
        other.highestDigitIndex());
    String product = DecimalStrings.multiply(magnitudeString(), other.magnitudeString());
    return parseMagnitude(product, isNegative() != other.isNegative(), width());
  }

  @Override
  public FactorialInteger divide(final FactorialInteger other) {
    checkFamily(other);
    if (other.isZero()) throw new ArithmeticException("Division by zero");
    if (isZero()) return create(0);
    LOG.trace(
        "Dividing factorial values with {} and {} digits in decimal",
        highestDigitIndex(),
        other.highestDigitIndex());
    DecimalStrings.Division division =
        DecimalStrings.divide(magnitudeString(), other.magnitudeString());
    return parseMagnitude(division.quotient(), isNegative() != other.isNegative(), width());
  }

  /**
   * Remainder of truncating division, carrying the sign of the dividend.
   *
   * @param other the divisor.
   * @return {@code this - (this / other) * other}.
   */
  @Override
  public FactorialInteger modulo(final FactorialInteger other) {
    checkFamily(other);
    if (other.isZero()) throw new ArithmeticException("Division by zero");
    if (isZero()) return create(0);
    LOG.trace(
        "Reducing factorial values with {} and {} digits in decimal",
        highestDigitIndex(),
        other.highestDigitIndex());
    DecimalStrings.Division division =
        DecimalStrings.divide(magnitudeString(), other.magnitudeString());
    return parseMagnitude(division.remainder(), isNegative(), width());
  }

  // --------------------------------------------------------------------------
  // endregion

  private void checkFamily(final FactorialInteger other) {
    checkArgument(
        width() == other.width(), "Word width mismatch: %s and %s", width(), other.width());
  }

  private static long digitAt(final DigitStorage storage, final long index) {
    if (index > storage.highestDigitIndex()) return 0;
    return FactorAccess.extract(storage, index).orElse(0);
  }
}
