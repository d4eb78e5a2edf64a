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

/**
 * Base-10 arithmetic on decimal digit strings.
 *
 * <p>Used to parse and render decimal text and as the arithmetic fallback of the factorial engine.
 * Every operand is an unsigned magnitude without leading zeros; signs are handled by callers.
 */
public final class DecimalStrings {

  /** The decimal string of zero. */
  public static final String ZERO = "0";

  /** Largest factor accepted by {@link #multiplyByWord}. */
  public static final long MAX_WORD_OPERAND = (Long.MAX_VALUE - 9) / 10;

  private static final char ZERO_CHAR = '0';
  private static final char MINUS = '-';

  /** Side from which {@link #trimZeros} removes zeros. */
  public enum TrimMode {
    LEADING,
    TRAILING
  }

  /** Quotient and remainder of a division by a single word. */
  public static final class WordDivision {
    private final String quotient;
    private final long remainder;

    WordDivision(final String quotient, final long remainder) {
      this.quotient = quotient;
      this.remainder = remainder;
    }

    public String quotient() {
      return quotient;
    }

    public long remainder() {
      return remainder;
    }
  }

  /** Quotient and remainder of a division by a decimal string. */
  public static final class Division {
    private final String quotient;
    private final String remainder;

    Division(final String quotient, final String remainder) {
      this.quotient = quotient;
      this.remainder = remainder;
    }

    public String quotient() {
      return quotient;
    }

    public String remainder() {
      return remainder;
    }
  }

  private DecimalStrings() {}

  // region Validation
  // --------------------------------------------------------------------------

  /**
   * Checks the {@code -?(0|[1-9][0-9]*)} format.
   *
   * @param str candidate text.
   * @return true if {@code str} is a canonical signed decimal integer, {@code "-0"} included.
   */
  public static boolean isValid(final CharSequence str) {
    if (str == null || str.length() == 0) return false;
    int start = 0;
    if (str.charAt(0) == MINUS) {
      if (str.length() == 1) return false;
      start = 1;
    }
    if (str.length() > start + 1 && str.charAt(start) == ZERO_CHAR) return false;
    for (int i = start; i < str.length(); i++) {
      char c = str.charAt(i);
      if (c < '0' || c > '9') return false;
    }
    return true;
  }

  /**
   * Rejects text that fails {@link #isValid}.
   *
   * @param str candidate text.
   * @throws NumberFormatException if the text is not a canonical decimal integer.
   */
  public static void checkValid(final CharSequence str) {
    if (!isValid(str)) {
      throw new NumberFormatException("Invalid decimal integer: \"" + str + "\"");
    }
  }

  /**
   * Compares two magnitudes.
   *
   * @param a left magnitude.
   * @param b right magnitude.
   * @return true if {@code a >= b}.
   */
  public static boolean greaterOrEqual(final String a, final String b) {
    if (a.length() != b.length()) return a.length() > b.length();
    return a.compareTo(b) >= 0;
  }

  /**
   * Removes zeros from one side. An all-zero or empty input yields {@code "0"}.
   *
   * @param str digit string.
   * @param mode side to trim.
   * @return the trimmed string, never empty.
   */
  public static String trimZeros(final CharSequence str, final TrimMode mode) {
    int begin = 0;
    int end = str.length();
    if (mode == TrimMode.LEADING) {
      while (begin < end && str.charAt(begin) == ZERO_CHAR) begin++;
    } else {
      while (end > begin && str.charAt(end - 1) == ZERO_CHAR) end--;
    }
    if (begin == end) return ZERO;
    return str.subSequence(begin, end).toString();
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Arithmetic
  // --------------------------------------------------------------------------

  /**
   * Sum of two magnitudes.
   *
   * @param a left magnitude.
   * @param b right magnitude.
   * @return {@code a + b}.
   */
  public static String add(final String a, final String b) {
    String longer = a.length() >= b.length() ? a : b;
    String shorter = a.length() >= b.length() ? b : a;
    StringBuilder sb = new StringBuilder(longer.length() + 1);
    int carry = 0;
    int i = longer.length() - 1;
    int j = shorter.length() - 1;
    while (i >= 0 || carry != 0) {
      int digitA = (i >= 0) ? longer.charAt(i) - ZERO_CHAR : 0;
      int digitB = (j >= 0) ? shorter.charAt(j) - ZERO_CHAR : 0;
      int sum = digitA + digitB + carry;
      sb.append((char) (sum % 10 + ZERO_CHAR));
      carry = sum / 10;
      --i;
      --j;
    }
    return trimZeros(sb.reverse(), TrimMode.LEADING);
  }

  /**
   * Difference of two magnitudes.
   *
   * @param a minuend.
   * @param b subtrahend, not larger than {@code a}.
   * @return {@code a - b}.
   * @throws IllegalArgumentException if {@code a < b}; negative results are not representable.
   */
  public static String subtract(final String a, final String b) {
    if (ZERO.equals(b)) return a;
    if (a.equals(b)) return ZERO;
    checkArgument(greaterOrEqual(a, b), "Subtrahend %s is larger than minuend %s", b, a);
    StringBuilder sb = new StringBuilder(a.length());
    int borrow = 0;
    int j = b.length() - 1;
    for (int i = a.length() - 1; i >= 0; i--, j--) {
      int diff = (a.charAt(i) - ZERO_CHAR) - ((j >= 0) ? b.charAt(j) - ZERO_CHAR : 0) - borrow;
      if (diff < 0) {
        diff += 10;
        borrow = 1;
      } else {
        borrow = 0;
      }
      sb.append((char) (diff + ZERO_CHAR));
    }
    return trimZeros(sb.reverse(), TrimMode.LEADING);
  }

  /**
   * Schoolbook product of two magnitudes.
   *
   * @param a left magnitude.
   * @param b right magnitude.
   * @return {@code a * b}.
   */
  public static String multiply(final String a, final String b) {
    if (ZERO.equals(a) || ZERO.equals(b)) return ZERO;
    int[] digits = new int[a.length() + b.length()];
    for (int i = a.length() - 1; i >= 0; i--) {
      int digitA = a.charAt(i) - ZERO_CHAR;
      for (int j = b.length() - 1; j >= 0; j--) {
        int sum = digitA * (b.charAt(j) - ZERO_CHAR) + digits[i + j + 1];
        digits[i + j + 1] = sum % 10;
        digits[i + j] += sum / 10;
      }
    }
    StringBuilder sb = new StringBuilder(digits.length);
    for (int digit : digits) {
      sb.append((char) (digit + ZERO_CHAR));
    }
    return trimZeros(sb, TrimMode.LEADING);
  }

  /**
   * Product of a magnitude and a single word.
   *
   * @param a magnitude.
   * @param factor word factor, at most {@link #MAX_WORD_OPERAND}.
   * @return {@code a * factor}.
   */
  public static String multiplyByWord(final String a, final long factor) {
    checkArgument(
        factor >= 0 && factor <= MAX_WORD_OPERAND, "Factor out of word range: %s", factor);
    if (factor == 0 || ZERO.equals(a)) return ZERO;
    if (factor == 1) return a;
    StringBuilder sb = new StringBuilder(a.length() + 19);
    long carry = 0;
    for (int i = a.length() - 1; i >= 0; i--) {
      long product = (a.charAt(i) - ZERO_CHAR) * factor + carry;
      sb.append((char) (product % 10 + ZERO_CHAR));
      carry = product / 10;
    }
    while (carry > 0) {
      sb.append((char) (carry % 10 + ZERO_CHAR));
      carry /= 10;
    }
    return sb.reverse().toString();
  }

  /**
   * Short division by a single word.
   *
   * @param a dividend magnitude.
   * @param divisor positive word divisor.
   * @return the quotient string and the word remainder.
   * @throws ArithmeticException if {@code divisor} is 0.
   */
  public static WordDivision divideByWord(final String a, final long divisor) {
    if (divisor == 0) throw new ArithmeticException("Division by zero");
    checkArgument(divisor > 0, "Negative divisor: %s", divisor);
    if (a.isEmpty() || ZERO.equals(a)) return new WordDivision(ZERO, 0);
    StringBuilder quotient = new StringBuilder(a.length());
    long remainder = 0;
    for (int i = 0; i < a.length(); i++) {
      int digit = a.charAt(i) - ZERO_CHAR;
      if (remainder <= MAX_WORD_OPERAND) {
        long accumulated = remainder * 10 + digit;
        quotient.append((char) (accumulated / divisor + ZERO_CHAR));
        remainder = accumulated % divisor;
      } else {
        remainder = wideDigitStep(quotient, remainder, digit, divisor);
      }
    }
    return new WordDivision(trimZeros(quotient, TrimMode.LEADING), remainder);
  }

  // remainder * 10 + digit overflows a long here: fold it in one remainder at a time.
  // Both partial sums stay below the divisor, and the quotient digit is at most 9.
  private static long wideDigitStep(
      final StringBuilder quotient, final long remainder, final int digit, final long divisor) {
    long partial = digit;
    int q = 0;
    for (int k = 0; k < 10; k++) {
      long room = divisor - remainder;
      if (partial >= room) {
        partial -= room;
        q++;
      } else {
        partial += remainder;
      }
    }
    quotient.append((char) (q + ZERO_CHAR));
    return partial;
  }

  /**
   * Long division of two magnitudes.
   *
   * @param a dividend magnitude.
   * @param b divisor magnitude.
   * @return the quotient and remainder strings.
   * @throws ArithmeticException if {@code b} is {@code "0"}.
   */
  public static Division divide(final String a, final String b) {
    if (ZERO.equals(b)) throw new ArithmeticException("Division by zero");
    if (ZERO.equals(a)) return new Division(ZERO, ZERO);
    if (!greaterOrEqual(a, b)) return new Division(ZERO, a);
    StringBuilder quotient = new StringBuilder(a.length());
    String remainder = ZERO;
    for (int i = 0; i < a.length(); i++) {
      remainder = ZERO.equals(remainder) ? String.valueOf(a.charAt(i)) : remainder + a.charAt(i);
      int count = 0;
      while (greaterOrEqual(remainder, b)) {
        remainder = subtract(remainder, b);
        ++count;
      }
      quotient.append((char) (count + ZERO_CHAR));
    }
    return new Division(trimZeros(quotient, TrimMode.LEADING), remainder);
  }

  // --------------------------------------------------------------------------
  // endregion
}
