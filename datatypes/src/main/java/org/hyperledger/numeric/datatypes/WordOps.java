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

/**
 * Overflow-aware single word arithmetic.
 *
 * <p>These are the only routines that reason about word overflow: engines propagate carries and
 * borrows through them instead of relying on wider intermediate types. Operands must already be
 * masked to the word width.
 */
public final class WordOps {

  private WordOps() {}

  /**
   * Adds two words and an incoming carry, wrapping on overflow.
   *
   * @param result array receiving the wrapped sum.
   * @param index slot of {@code result} to write.
   * @param a left word.
   * @param b right word.
   * @param carry incoming carry, 0 or 1.
   * @param width width of the words.
   * @return the outgoing carry, 0 or 1.
   */
  public static int sum(
      final long[] result,
      final int index,
      final long a,
      final long b,
      final int carry,
      final WordWidth width) {
    long s = (a + b + carry) & width.mask();
    result[index] = s;
    // s == a only happens with a carry when b + carry wrapped to zero
    return (Long.compareUnsigned(s, a) < 0 || (carry != 0 && s == a)) ? 1 : 0;
  }

  /**
   * Subtracts a word and an incoming borrow, wrapping on underflow.
   *
   * @param result array receiving the wrapped difference.
   * @param index slot of {@code result} to write.
   * @param a minuend word.
   * @param b subtrahend word.
   * @param borrow incoming borrow, 0 or 1.
   * @param width width of the words.
   * @return the outgoing borrow, 0 or 1.
   */
  public static int subtract(
      final long[] result,
      final int index,
      final long a,
      final long b,
      final int borrow,
      final WordWidth width) {
    result[index] = (a - b - borrow) & width.mask();
    return (Long.compareUnsigned(a, b) < 0 || (borrow != 0 && a == b)) ? 1 : 0;
  }
}
