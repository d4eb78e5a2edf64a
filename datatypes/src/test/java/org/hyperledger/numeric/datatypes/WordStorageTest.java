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

import org.junit.jupiter.api.Test;

public class WordStorageTest {

  @Test
  void wordsAreMaskedToWidth() {
    WordStorage storage = WordStorage.of(WordWidth.BYTE, 0x1FF);
    assertThat(storage.get(0)).isEqualTo(0xFF);
    storage.push(0x1234);
    assertThat(storage.get(1)).isEqualTo(0x34);
  }

  @Test
  void resizeZeroFillsRegrownWords() {
    WordStorage storage = WordStorage.of(WordWidth.INT, 1, 2, 3);
    storage.resize(1);
    storage.resize(3);
    assertThat(storage.toArray()).containsExactly(1, 0, 0);
  }

  @Test
  void getOutsideSizeThrows() {
    WordStorage storage = WordStorage.of(WordWidth.INT, 1);
    assertThatThrownBy(() -> storage.get(1)).isInstanceOf(IndexOutOfBoundsException.class);
    assertThat(storage.getOrZero(7)).isEqualTo(0);
  }

  @Test
  void trimDropsMostSignificantZeroWords() {
    WordStorage storage = WordStorage.of(WordWidth.INT, 5, 0, 0);
    storage.setNegative(true);
    storage.trimTrailingZeros();
    assertThat(storage.toArray()).containsExactly(5);
    assertThat(storage.isNegative()).isTrue();
  }

  @Test
  void trimOfZeroKeepsOneWordAndClearsSign() {
    WordStorage storage = WordStorage.of(WordWidth.INT, 0, 0);
    storage.setNegative(true);
    storage.trimTrailingZeros();
    assertThat(storage.toArray()).containsExactly(0);
    assertThat(storage.isNegative()).isFalse();
  }

  @Test
  void bitLengthSpansWords() {
    assertThat(WordStorage.of(WordWidth.BYTE, 0, 1).bitLength()).isEqualTo(9);
    assertThat(WordStorage.of(WordWidth.LONG, -1L).bitLength()).isEqualTo(64);
    assertThat(WordStorage.of(WordWidth.SHORT, 0, 0).bitLength()).isEqualTo(0);
  }

  @Test
  void setBitGrowsStorage() {
    WordStorage storage = new WordStorage(WordWidth.BYTE);
    storage.setBit(17);
    assertThat(storage.size()).isEqualTo(3);
    assertThat(storage.get(2)).isEqualTo(2);
    assertThat(storage.testBit(17)).isTrue();
    assertThat(storage.testBit(16)).isFalse();
    assertThat(storage.testBit(1000)).isFalse();
  }

  @Test
  void low64BitsGathersNarrowWords() {
    WordStorage storage = WordStorage.of(WordWidth.BYTE, 1, 2, 3, 4, 5, 6, 7, 8, 9);
    assertThat(storage.low64Bits()).isEqualTo(0x0807060504030201L);
  }

  @Test
  void shiftLeftCarriesAcrossWords() {
    WordStorage storage = WordStorage.of(WordWidth.BYTE, 0x81);
    storage.setNegative(true);

    assertThat(storage.shiftLeft(1).toArray()).containsExactly(0x02, 0x01);
    assertThat(storage.shiftLeft(8).toArray()).containsExactly(0x00, 0x81);
    assertThat(storage.shiftLeft(9).toArray()).containsExactly(0x00, 0x02, 0x01);
    assertThat(storage.shiftLeft(1).isNegative()).isFalse();
  }

  @Test
  void shiftLeftOfLongWords() {
    WordStorage storage = WordStorage.of(WordWidth.LONG, Long.MIN_VALUE);
    assertThat(storage.shiftLeft(1).toArray()).containsExactly(0L, 1L);
    assertThat(storage.shiftLeft(0).toArray()).containsExactly(Long.MIN_VALUE);
  }

  @Test
  void copyIsIndependent() {
    WordStorage storage = WordStorage.of(WordWidth.INT, 7);
    WordStorage copy = storage.copy();
    copy.set(0, 8);
    copy.setNegative(true);
    assertThat(storage.get(0)).isEqualTo(7);
    assertThat(storage.isNegative()).isFalse();
    assertThat(copy).isNotEqualTo(storage);
  }

  @Test
  void equalityIncludesWidthAndSign() {
    assertThat(WordStorage.of(WordWidth.INT, 1)).isEqualTo(WordStorage.of(WordWidth.INT, 1));
    assertThat(WordStorage.of(WordWidth.INT, 1)).isNotEqualTo(WordStorage.of(WordWidth.LONG, 1));
    assertThat(WordStorage.of(WordWidth.INT, 1).hashCode())
        .isEqualTo(WordStorage.of(WordWidth.INT, 1).hashCode());
  }

  @Test
  void digitStorageKeepsSignAndHighestIndexApart() {
    DigitStorage storage = new DigitStorage(WordWidth.INT);
    storage.setNegative(true);
    storage.highestDigitIndex(Long.MAX_VALUE);
    assertThat(storage.isNegative()).isTrue();
    assertThat(storage.highestDigitIndex()).isEqualTo(Long.MAX_VALUE);

    storage.setNegative(false);
    assertThat(storage.highestDigitIndex()).isEqualTo(Long.MAX_VALUE);
    assertThatThrownBy(() -> storage.highestDigitIndex(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void widthLookup() {
    assertThat(WordWidth.ofBits(16)).isEqualTo(WordWidth.SHORT);
    assertThat(WordWidth.BYTE.wordsFor(17)).isEqualTo(3);
    assertThat(WordWidth.LONG.mask()).isEqualTo(-1L);
    assertThatThrownBy(() -> WordWidth.ofBits(12)).isInstanceOf(IllegalArgumentException.class);
  }
}
