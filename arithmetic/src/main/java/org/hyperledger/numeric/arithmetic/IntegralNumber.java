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

import java.math.BigInteger;

/**
 * Arbitrary-precision signed integer built on a small primitive contract.
 *
 * <p>Engines implement the primitives: {@link #compareTo}, the magnitude operations {@link #add}
 * and {@link #subtract}, the signed operations {@link #multiply}, {@link #divide} and {@link
 * #modulo}, and sign access. Every signed operator ({@link #plus}, {@link #minus}, {@link #abs},
 * {@link #pow}, {@link #sqrt}, ...) is derived here once for all engines.
 *
 * <p>Values are immutable: every operation returns a new value and leaves its operands untouched.
 *
 * @param <T> the engine type.
 */
public interface IntegralNumber<T extends IntegralNumber<T>> extends Comparable<T> {

  // region Primitives
  // --------------------------------------------------------------------------

  /**
   * Sum of the magnitudes. The sign of the result is left to the caller.
   *
   * @param other the other operand.
   * @return {@code |this| + |other|}, non-negative.
   */
  T add(T other);

  /**
   * Difference of the magnitudes. The sign of the result is left to the caller.
   *
   * @param other the other operand, with {@code |other| <= |this|}.
   * @return {@code |this| - |other|}, non-negative.
   * @throws IllegalArgumentException if {@code |other| > |this|}.
   */
  T subtract(T other);

  /**
   * Signed product.
   *
   * @param other the multiplier.
   * @return {@code this * other}.
   */
  T multiply(T other);

  /**
   * Signed quotient, truncated toward zero.
   *
   * @param other the divisor.
   * @return {@code this / other}.
   * @throws ArithmeticException if {@code other} is zero.
   */
  T divide(T other);

  /**
   * Signed remainder of the truncating division; it takes the sign of {@code this}.
   *
   * @param other the divisor.
   * @return {@code this % other}.
   * @throws ArithmeticException if {@code other} is zero.
   */
  T modulo(T other);

  boolean isNegative();

  boolean isZero();

  /**
   * Same magnitude with the given sign. Zero stays non-negative.
   *
   * @param negative requested sign.
   * @return the re-signed value.
   */
  T withSign(boolean negative);

  /**
   * Creates a value of the same engine and word width.
   *
   * @param value native value.
   * @return the converted value.
   */
  T create(long value);

  /**
   * This value, typed as its engine.
   *
   * @return {@code this}.
   */
  T self();

  /**
   * Exact conversion to a long.
   *
   * @return the value as a long.
   * @throws ArithmeticException if the value does not fit a long.
   */
  long longValueExact();

  /**
   * Exact conversion to an unsigned long.
   *
   * @return the value as the bits of an unsigned long.
   * @throws ArithmeticException if the value is negative or does not fit 64 bits.
   */
  long unsignedLongValueExact();

  // --------------------------------------------------------------------------
  // endregion

  // region Derived operators
  // --------------------------------------------------------------------------

  /**
   * Signed sum ({@code +}).
   *
   * @param other the addend.
   * @return {@code this + other}.
   */
  default T plus(final T other) {
    if (isNegative() == other.isNegative()) {
      return add(other).withSign(isNegative());
    }
    int cmp = abs().compareTo(other.abs());
    if (cmp == 0) return create(0);
    T larger = cmp > 0 ? self() : other;
    T smaller = cmp > 0 ? other : self();
    return larger.subtract(smaller).withSign(larger.isNegative());
  }

  /**
   * Signed difference ({@code -}).
   *
   * @param other the subtrahend.
   * @return {@code this - other}.
   */
  default T minus(final T other) {
    return plus(other.negate());
  }

  /**
   * Signed product ({@code *}).
   *
   * @param other the multiplier.
   * @return {@code this * other}.
   */
  default T times(final T other) {
    return multiply(other);
  }

  /**
   * Truncating quotient ({@code /}).
   *
   * @param other the divisor.
   * @return {@code this / other}.
   */
  default T div(final T other) {
    return divide(other);
  }

  /**
   * Remainder ({@code %}), signed like {@code this}.
   *
   * @param other the divisor.
   * @return {@code this % other}.
   */
  default T rem(final T other) {
    return modulo(other);
  }

  /**
   * {@code this + 1}.
   *
   * @return the successor.
   */
  default T increment() {
    return plus(create(1));
  }

  /**
   * {@code this - 1}.
   *
   * @return the predecessor.
   */
  default T decrement() {
    return minus(create(1));
  }

  /**
   * Unary minus.
   *
   * @return {@code -this}.
   */
  default T negate() {
    return withSign(!isNegative());
  }

  default T abs() {
    return isNegative() ? negate() : self();
  }

  default int signum() {
    if (isZero()) return 0;
    return isNegative() ? -1 : 1;
  }

  /**
   * Exponentiation by squaring.
   *
   * @param exponent non-negative exponent.
   * @return {@code this^exponent}; {@code 1} when the exponent is 0.
   */
  default T pow(final int exponent) {
    checkArgument(exponent >= 0, "Negative exponent: %s", exponent);
    T result = create(1);
    T base = self();
    int exp = exponent;
    while (exp > 0) {
      if ((exp & 1) == 1) result = result.times(base);
      exp >>>= 1;
      if (exp > 0) base = base.times(base);
    }
    return result;
  }

  /**
   * Integer square root, found by binary search over {@code [1, this]}.
   *
   * @return the largest {@code m} with {@code m * m <= this}.
   * @throws ArithmeticException if the value is negative.
   */
  default T sqrt() {
    if (isNegative()) throw new ArithmeticException("Square root of negative value");
    if (isZero()) return self();
    T one = create(1);
    T two = create(2);
    T low = one;
    T high = self();
    while (low.compareTo(high) <= 0) {
      T mid = low.plus(high).div(two);
      int cmp = mid.times(mid).compareTo(self());
      if (cmp == 0) return mid;
      if (cmp < 0) low = mid.plus(one);
      else high = mid.minus(one);
    }
    return high;
  }

  default boolean isLessThan(final T other) {
    return compareTo(other) < 0;
  }

  default boolean isLessOrEqualTo(final T other) {
    return compareTo(other) <= 0;
  }

  default boolean isGreaterThan(final T other) {
    return compareTo(other) > 0;
  }

  default boolean isGreaterOrEqualTo(final T other) {
    return compareTo(other) >= 0;
  }

  default boolean isEqualTo(final T other) {
    return compareTo(other) == 0;
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Conversions
  // --------------------------------------------------------------------------

  /**
   * Exact conversion to an int.
   *
   * @return the value as an int.
   * @throws ArithmeticException if the value does not fit an int.
   */
  default int intValueExact() {
    return Math.toIntExact(longValueExact());
  }

  /**
   * Convert to BigInteger.
   *
   * @return BigInteger representing the integer.
   */
  default BigInteger toBigInteger() {
    return new BigInteger(toString());
  }

  // --------------------------------------------------------------------------
  // endregion
}
