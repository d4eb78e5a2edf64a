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
 * Width of the unsigned machine words backing a {@link WordStorage}.
 *
 * <p>Words are always held in a {@code long}; narrower widths only use the low {@link #bits()} bits.
 */
public enum WordWidth {
  /** 8-bit words. */
  BYTE(8),
  /** 16-bit words. */
  SHORT(16),
  /** 32-bit words. */
  INT(32),
  /** 64-bit words. */
  LONG(64);

  /** Width used by engine factories that are not given one. */
  public static final WordWidth DEFAULT = INT;

  private final int bits;
  private final long mask;

  WordWidth(final int bits) {
    this.bits = bits;
    this.mask = bits == 64 ? -1L : (1L << bits) - 1;
  }

  /**
   * Number of bits per word.
   *
   * @return the word width in bits.
   */
  public int bits() {
    return bits;
  }

  /**
   * Mask selecting the low {@link #bits()} bits of a long.
   *
   * @return the word mask.
   */
  public long mask() {
    return mask;
  }

  /**
   * Number of words needed to hold the given number of bits.
   *
   * @param bitCount number of bits, non-negative.
   * @return the word count, rounded up.
   */
  public long wordsFor(final long bitCount) {
    return (bitCount + bits - 1) / bits;
  }

  /**
   * Looks up a width by its bit count.
   *
   * @param bits one of 8, 16, 32 or 64.
   * @return the matching width.
   */
  public static WordWidth ofBits(final int bits) {
    for (WordWidth width : values()) {
      if (width.bits == bits) return width;
    }
    throw new IllegalArgumentException("Unsupported word width: " + bits);
  }
}
