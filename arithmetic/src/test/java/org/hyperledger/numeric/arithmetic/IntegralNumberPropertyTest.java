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

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigInteger;
import java.util.function.Function;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import org.hyperledger.numeric.datatypes.WordWidth;

/** Property-based tests checking both engines against BigInteger */
public class IntegralNumberPropertyTest {

  private static final BigInteger BOUND = BigInteger.TEN.pow(40);

  // region Test Data Providers

  @Provide
  Arbitrary<BigInteger> signed() {
    return Arbitraries.bigIntegers().between(BOUND.negate(), BOUND);
  }

  @Provide
  Arbitrary<Long> longs() {
    return Arbitraries.longs();
  }

  @Provide
  Arbitrary<WordWidth> widths() {
    return Arbitraries.of(WordWidth.class);
  }

  // endregion

  // region Binary engine

  @Property(tries = 300)
  void property_binary_matchesBigInteger(
      @ForAll("signed") final BigInteger a,
      @ForAll("signed") final BigInteger b,
      @ForAll("widths") final WordWidth width) {
    checkAgainstBigInteger(s -> BinaryInteger.of(s, width), a, b);
  }

  @Property
  void property_binary_longRoundTrip(
      @ForAll("longs") final long value, @ForAll("widths") final WordWidth width) {
    BinaryInteger number = BinaryInteger.valueOf(value, width);
    assertThat(number.longValueExact()).isEqualTo(value);
    assertThat(number.toString()).isEqualTo(Long.toString(value));
    assertThat(BinaryInteger.valueOfUnsigned(value, width).toString())
        .isEqualTo(Long.toUnsignedString(value));
  }

  @Property(tries = 300)
  void property_binary_bytesRoundTrip(
      @ForAll("signed") final BigInteger a, @ForAll("widths") final WordWidth width) {
    BinaryInteger number = BinaryInteger.of(a.toString(), width);
    assertThat(number.toBigInteger()).isEqualTo(a);
    assertThat(BinaryInteger.fromBytes(number.toBytes(), a.signum() < 0, width)).isEqualTo(number);
  }

  // endregion

  // region Factorial engine

  @Property(tries = 100)
  void property_factorial_matchesBigInteger(
      @ForAll("signed") final BigInteger a,
      @ForAll("signed") final BigInteger b,
      @ForAll("widths") final WordWidth width) {
    checkAgainstBigInteger(s -> FactorialInteger.of(s, width), a, b);
  }

  @Property
  void property_factorial_longRoundTrip(@ForAll("longs") final long value) {
    FactorialInteger number = FactorialInteger.valueOf(value);
    assertThat(number.longValueExact()).isEqualTo(value);
    assertThat(number).isEqualTo(FactorialInteger.of(Long.toString(value)));
  }

  // endregion

  private static <T extends IntegralNumber<T>> void checkAgainstBigInteger(
      final Function<String, T> parser, final BigInteger a, final BigInteger b) {
    // Arrange
    T x = parser.apply(a.toString());
    T y = parser.apply(b.toString());

    // Act & Assert
    assertThat(x.toString()).isEqualTo(a.toString());
    assertThat(x.plus(y).toString()).isEqualTo(a.add(b).toString());
    assertThat(x.minus(y).toString()).isEqualTo(a.subtract(b).toString());
    assertThat(x.times(y).toString()).isEqualTo(a.multiply(b).toString());
    assertThat(Integer.signum(x.compareTo(y))).isEqualTo(a.compareTo(b));
    assertThat(x.plus(x.negate()).toString()).isEqualTo("0");
    assertThat(x.times(x.create(1))).isEqualTo(x);
    if (a.signum() != 0) {
      assertThat(x.div(x).toString()).isEqualTo("1");
      assertThat(x.rem(x).isZero()).isTrue();
    }
    if (b.signum() != 0) {
      // BigInteger divide and remainder also truncate toward zero
      assertThat(x.div(y).toString()).isEqualTo(a.divide(b).toString());
      assertThat(x.rem(y).toString()).isEqualTo(a.remainder(b).toString());
    }
  }
}
