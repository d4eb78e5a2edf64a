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
 * Word storage of a factorial-base number.
 *
 * <p>The auxiliary field caches the highest digit index written through {@link FactorAccess}, so
 * that digit scans do not need to walk the packed bits to find where the number ends.
 */
public final class DigitStorage extends WordStorage {

  public DigitStorage(final WordWidth width) {
    super(width);
  }

  private DigitStorage(final DigitStorage other) {
    super(other);
  }

  @Override
  public DigitStorage copy() {
    return new DigitStorage(this);
  }

  /**
   * Highest digit index cached for this storage.
   *
   * @return the cached index, 0 when no digit has been written.
   */
  public long highestDigitIndex() {
    return auxiliary();
  }

  /**
   * Replaces the cached highest digit index.
   *
   * @param index new cached index.
   */
  public void highestDigitIndex(final long index) {
    auxiliary(index);
  }
}
