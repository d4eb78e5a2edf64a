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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@State(Scope.Thread)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@OutputTimeUnit(value = TimeUnit.NANOSECONDS)
@BenchmarkMode(Mode.AverageTime)
public abstract class AbstractArithmeticBenchmark<T extends IntegralNumber<T>> {

  protected static final int SAMPLE_SIZE = 1_000;

  protected List<T> aPool;
  protected List<T> bPool;
  protected int index;

  // Operand sizes in decimal digits
  public enum Case {
    DIGITS_10_10(10, 10),
    DIGITS_50_50(50, 50),
    DIGITS_50_10(50, 10),
    DIGITS_200_200(200, 200),
    DIGITS_200_50(200, 50),
    DIGITS_RAND(-1, -1); // Random sizes up to 200 digits

    final int aDigits;
    final int bDigits;

    Case(final int aDigits, final int bDigits) {
      this.aDigits = aDigits;
      this.bDigits = bDigits;
    }
  }

  @Param({
    "DIGITS_10_10",
    "DIGITS_50_50",
    "DIGITS_50_10",
    "DIGITS_200_200",
    "DIGITS_200_50",
    "DIGITS_RAND"
  })
  private String caseName;

  protected abstract T parse(String value);

  @Setup(Level.Trial)
  public void setUp() {
    Case scenario = Case.valueOf(caseName);
    aPool = new ArrayList<>(SAMPLE_SIZE);
    bPool = new ArrayList<>(SAMPLE_SIZE);

    final ThreadLocalRandom random = ThreadLocalRandom.current();
    for (int i = 0; i < SAMPLE_SIZE; i++) {
      int aDigits = scenario.aDigits < 0 ? random.nextInt(1, 201) : scenario.aDigits;
      int bDigits = scenario.bDigits < 0 ? random.nextInt(1, 201) : scenario.bDigits;
      aPool.add(parse(randomDecimal(random, aDigits)));
      bPool.add(parse(randomDecimal(random, bDigits)));
    }
    index = 0;
  }

  private static String randomDecimal(final ThreadLocalRandom random, final int digits) {
    StringBuilder sb = new StringBuilder(digits + 1);
    if (random.nextBoolean()) sb.append('-');
    sb.append((char) ('1' + random.nextInt(9)));
    for (int i = 1; i < digits; i++) {
      sb.append((char) ('0' + random.nextInt(10)));
    }
    return sb.toString();
  }

  @Benchmark
  public void plus(final Blackhole blackhole) {
    blackhole.consume(aPool.get(index).plus(bPool.get(index)));
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void minus(final Blackhole blackhole) {
    blackhole.consume(aPool.get(index).minus(bPool.get(index)));
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void times(final Blackhole blackhole) {
    blackhole.consume(aPool.get(index).times(bPool.get(index)));
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void div(final Blackhole blackhole) {
    blackhole.consume(aPool.get(index).div(bPool.get(index)));
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void rem(final Blackhole blackhole) {
    blackhole.consume(aPool.get(index).rem(bPool.get(index)));
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void compare(final Blackhole blackhole) {
    blackhole.consume(aPool.get(index).compareTo(bPool.get(index)));
    index = (index + 1) % SAMPLE_SIZE;
  }

  @Benchmark
  public void stringify(final Blackhole blackhole) {
    blackhole.consume(aPool.get(index).toString());
    index = (index + 1) % SAMPLE_SIZE;
  }
}
