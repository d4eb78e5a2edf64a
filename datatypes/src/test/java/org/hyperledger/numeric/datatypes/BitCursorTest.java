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

public class BitCursorTest {

  @Test
  void writeLeavesNeighbouringBitsUntouched() {
    WordStorage storage = WordStorage.of(WordWidth.BYTE, 0xFF, 0xFF);
    new BitCursor(storage, 2).write(12, 0);
    assertThat(storage.toArray()).containsExactly(0x03, 0xC0);
  }

  @Test
  void fieldSpanningThreeNarrowWords() {
    WordStorage storage = WordStorage.of(WordWidth.BYTE, 0, 0, 0, 0);
    BitCursor writer = new BitCursor(storage, 4);
    writer.write(20, 0xABCDE);
    assertThat(writer.position()).isEqualTo(24);
    assertThat(storage.toArray()).containsExactly(0xE0, 0xCD, 0xAB, 0x00);

    assertThat(new BitCursor(storage, 4).read(20)).isEqualTo(0xABCDE);
  }

  @Test
  void fullLongFieldAcrossTwoLongWords() {
    WordStorage storage = WordStorage.of(WordWidth.LONG, 0, 0);
    new BitCursor(storage, 32).write(64, 0x0123456789ABCDEFL);
    assertThat(storage.toArray()).containsExactly(0x89ABCDEF00000000L, 0x01234567L);
    assertThat(new BitCursor(storage, 32).read(64)).isEqualTo(0x0123456789ABCDEFL);
  }

  @Test
  void readAdvancesThroughConsecutiveFields() {
    WordStorage storage = WordStorage.of(WordWidth.SHORT, 0);
    BitCursor writer = new BitCursor(storage, 0);
    writer.write(1, 1);
    writer.write(2, 2);
    writer.write(3, 5);

    BitCursor reader = new BitCursor(storage, 0);
    assertThat(reader.read(1)).isEqualTo(1);
    assertThat(reader.read(2)).isEqualTo(2);
    assertThat(reader.read(3)).isEqualTo(5);
    assertThat(reader.position()).isEqualTo(6);
  }

  @Test
  void writeIgnoresBitsAboveField() {
    WordStorage storage = WordStorage.of(WordWidth.INT, 0);
    new BitCursor(storage, 0).write(4, 0xFF);
    assertThat(storage.get(0)).isEqualTo(0xF);
  }

  @Test
  void zeroWidthFieldIsANoOp() {
    WordStorage storage = new WordStorage(WordWidth.INT);
    assertThat(new BitCursor(storage, 0).read(0)).isEqualTo(0);
  }

  @Test
  void fieldPastCapacityThrows() {
    WordStorage storage = WordStorage.of(WordWidth.BYTE, 0);
    assertThatThrownBy(() -> new BitCursor(storage, 4).read(5))
        .isInstanceOf(IndexOutOfBoundsException.class);
    assertThatThrownBy(() -> new BitCursor(storage, 0).write(65, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new BitCursor(storage, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
