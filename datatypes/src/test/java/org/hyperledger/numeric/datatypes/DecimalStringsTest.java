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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.hyperledger.numeric.datatypes.DecimalStrings.TrimMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class DecimalStringsTest {

  @ParameterizedTest
  @ValueSource(strings = {"0", "-0", "7", "-7", "1234567890123456789012345678901234567890"})
  void acceptsCanonicalDecimals(final String text) {
    assertThat(DecimalStrings.isValid(text)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "-", "+1", "007", "-01", "1a", " 1", "1.5", "--1"})
  void rejectsMalformedDecimals(final String text) {
    assertThat(DecimalStrings.isValid(text)).isFalse();
    assertThatThrownBy(() -> DecimalStrings.checkValid(text))
        .isInstanceOf(NumberFormatException.class);
  }

  @Test
  void trimsEitherSide() {
    assertThat(DecimalStrings.trimZeros("000120", TrimMode.LEADING)).isEqualTo("120");
    assertThat(DecimalStrings.trimZeros("000120", TrimMode.TRAILING)).isEqualTo("00012");
    assertThat(DecimalStrings.trimZeros("0000", TrimMode.LEADING)).isEqualTo("0");
    assertThat(DecimalStrings.trimZeros("", TrimMode.TRAILING)).isEqualTo("0");
  }

  @Test
  void comparesByLengthThenDigits() {
    assertThat(DecimalStrings.greaterOrEqual("100", "99")).isTrue();
    assertThat(DecimalStrings.greaterOrEqual("99", "100")).isFalse();
    assertThat(DecimalStrings.greaterOrEqual("42", "42")).isTrue();
    assertThat(DecimalStrings.greaterOrEqual("41", "42")).isFalse();
  }

  @Test
  void addPropagatesCarry() {
    assertThat(DecimalStrings.add("999", "1")).isEqualTo("1000");
    assertThat(DecimalStrings.add("0", "0")).isEqualTo("0");
    assertThat(DecimalStrings.add("5", "123")).isEqualTo("128");
  }

  @Test
  void subtractPropagatesBorrow() {
    assertThat(DecimalStrings.subtract("1000", "1")).isEqualTo("999");
    assertThat(DecimalStrings.subtract("42", "42")).isEqualTo("0");
    assertThatThrownBy(() -> DecimalStrings.subtract("1", "2"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void multiplies() {
    assertThat(DecimalStrings.multiply("123", "456")).isEqualTo("56088");
    assertThat(DecimalStrings.multiply("0", "456")).isEqualTo("0");
    assertThat(DecimalStrings.multiplyByWord("99", 99)).isEqualTo("9801");
    assertThat(DecimalStrings.multiplyByWord("12345", 0)).isEqualTo("0");
    assertThatThrownBy(() -> DecimalStrings.multiplyByWord("1", Long.MAX_VALUE))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void dividesByWord() {
    DecimalStrings.WordDivision division = DecimalStrings.divideByWord("123", 10);
    assertThat(division.quotient()).isEqualTo("12");
    assertThat(division.remainder()).isEqualTo(3);

    division = DecimalStrings.divideByWord("7", 9);
    assertThat(division.quotient()).isEqualTo("0");
    assertThat(division.remainder()).isEqualTo(7);

    assertThatThrownBy(() -> DecimalStrings.divideByWord("7", 0))
        .isInstanceOf(ArithmeticException.class)
        .hasMessage("Division by zero");
  }

  @Test
  void dividesByFullRangeWord() {
    DecimalStrings.WordDivision division =
        DecimalStrings.divideByWord("92233720368547758075", Long.MAX_VALUE);
    assertThat(division.quotient()).isEqualTo("10");
    assertThat(division.remainder()).isEqualTo(5);

    division = DecimalStrings.divideByWord("1000000000000000000000000000000", Long.MAX_VALUE - 1);
    assertThat(division.quotient()).isEqualTo("108420217248");
    assertThat(division.remainder()).isEqualTo(5076944487145698112L);

    assertThatThrownBy(() -> DecimalStrings.divideByWord("7", -3))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void longDivision() {
    DecimalStrings.Division division = DecimalStrings.divide("65550", "3");
    assertThat(division.quotient()).isEqualTo("21850");
    assertThat(division.remainder()).isEqualTo("0");

    division = DecimalStrings.divide("21850", "4");
    assertThat(division.quotient()).isEqualTo("5462");
    assertThat(division.remainder()).isEqualTo("2");

    division = DecimalStrings.divide("12", "345");
    assertThat(division.quotient()).isEqualTo("0");
    assertThat(division.remainder()).isEqualTo("12");

    division = DecimalStrings.divide("1000000000000000000000", "1000000000007");
    assertThat(division.quotient()).isEqualTo("999999999");
    assertThat(division.remainder()).isEqualTo("993000000007");
  }

  @Test
  void longDivisionByZeroThrows() {
    assertThatThrownBy(() -> DecimalStrings.divide("1", "0"))
        .isInstanceOf(ArithmeticException.class)
        .hasMessage("Division by zero");
  }
}
