/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.axiom.util;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link Rational}. */
class RationalTest {
  @Test void testNormalize() {
    assertThat(Rational.of(6, 4), hasToString("3/2"));
    assertThat(Rational.of(4, -2), hasToString("-2"));
    assertThat(Rational.of(-3, -6), hasToString("1/2"));
    assertThat(Rational.of(0, 5), is(Rational.ZERO));
    assertThat(Rational.of(4, -2).isInteger(), is(true));
  }

  @Test void testArithmetic() {
    final Rational half = Rational.of(1, 2);
    final Rational third = Rational.of(1, 3);
    assertThat(half.add(third), is(Rational.of(5, 6)));
    assertThat(half.subtract(third), is(Rational.of(1, 6)));
    assertThat(half.multiply(third), is(Rational.of(1, 6)));
    assertThat(half.divide(third), is(Rational.of(3, 2)));
    assertThat(half.pow(3), is(Rational.of(1, 8)));
    assertThat(half.pow(-2), is(Rational.of(4)));
    assertThat(half.negate().abs(), is(half));
  }

  @Test void testFloorCeil() {
    assertThat(Rational.of(7, 2).floor(), is(Rational.of(3)));
    assertThat(Rational.of(7, 2).ceil(), is(Rational.of(4)));
    assertThat(Rational.of(-7, 2).floor(), is(Rational.of(-4)));
    assertThat(Rational.of(-7, 2).ceil(), is(Rational.of(-3)));
    assertThat(Rational.of(5).floor(), is(Rational.of(5)));
  }

  @Test void testCompare() {
    assertThat(Rational.of(1, 3).compareTo(Rational.of(1, 2)) < 0, is(true));
    assertThat(Rational.of(-1, 2).signum(), is(-1));
    assertThat(Rational.of(2, 4), is(Rational.of(1, 2)));
    assertThat(Rational.of(2, 4).hashCode(),
        is(Rational.of(1, 2).hashCode()));
  }

  @Test void testDivideByZero() {
    assertThrows(IllegalArgumentException.class, () -> Rational.of(1, 0));
    assertThrows(IllegalArgumentException.class,
        () -> Rational.ONE.divide(Rational.ZERO));
  }
}

// End RationalTest.java
