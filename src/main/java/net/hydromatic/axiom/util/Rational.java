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

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Exact rational number.
 *
 * <p>The denominator is always positive and the fraction is always in lowest
 * terms, so two rationals are equal if and only if their numerators and
 * denominators are equal.
 */
public final class Rational implements Comparable<Rational> {
  public static final Rational ZERO = new Rational(BigInteger.ZERO);
  public static final Rational ONE = new Rational(BigInteger.ONE);
  public static final Rational MINUS_ONE = ONE.negate();

  public final BigInteger numerator;
  public final BigInteger denominator;

  private Rational(BigInteger numerator) {
    this(numerator, BigInteger.ONE);
  }

  private Rational(BigInteger numerator, BigInteger denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  /** Creates an integer. */
  public static Rational of(long value) {
    return of(BigInteger.valueOf(value));
  }

  /** Creates an integer. */
  public static Rational of(BigInteger value) {
    return new Rational(value);
  }

  /** Creates a fraction, reducing it to lowest terms. */
  public static Rational of(long numerator, long denominator) {
    return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  /** Creates a fraction, reducing it to lowest terms. */
  public static Rational of(BigInteger numerator, BigInteger denominator) {
    checkArgument(denominator.signum() != 0, "zero denominator");
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    final BigInteger gcd = numerator.gcd(denominator);
    if (gcd.signum() != 0 && !gcd.equals(BigInteger.ONE)) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    return new Rational(numerator, denominator);
  }

  @Override public int hashCode() {
    return Objects.hash(numerator, denominator);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Rational
        && numerator.equals(((Rational) o).numerator)
        && denominator.equals(((Rational) o).denominator);
  }

  @Override public int compareTo(Rational o) {
    return numerator.multiply(o.denominator)
        .compareTo(o.numerator.multiply(denominator));
  }

  @Override public String toString() {
    return isInteger()
        ? numerator.toString()
        : numerator + "/" + denominator;
  }

  public boolean isInteger() {
    return denominator.equals(BigInteger.ONE);
  }

  public int signum() {
    return numerator.signum();
  }

  public Rational negate() {
    return new Rational(numerator.negate(), denominator);
  }

  public Rational abs() {
    return signum() < 0 ? negate() : this;
  }

  public Rational add(Rational o) {
    if (isInteger() && o.isInteger()) {
      return new Rational(numerator.add(o.numerator));
    }
    return of(numerator.multiply(o.denominator)
            .add(o.numerator.multiply(denominator)),
        denominator.multiply(o.denominator));
  }

  public Rational subtract(Rational o) {
    return add(o.negate());
  }

  public Rational multiply(Rational o) {
    return of(numerator.multiply(o.numerator),
        denominator.multiply(o.denominator));
  }

  /** Divides; throws if {@code o} is zero. */
  public Rational divide(Rational o) {
    return of(numerator.multiply(o.denominator),
        denominator.multiply(o.numerator));
  }

  /** Raises to an integer power; throws if this is zero and {@code n} is
   * negative. */
  public Rational pow(int n) {
    if (n < 0) {
      return ONE.divide(pow(-n));
    }
    return new Rational(numerator.pow(n), denominator.pow(n));
  }

  /** Returns the largest integer not greater than this. */
  public Rational floor() {
    if (isInteger()) {
      return this;
    }
    final BigInteger[] qr = numerator.divideAndRemainder(denominator);
    return new Rational(
        numerator.signum() < 0 ? qr[0].subtract(BigInteger.ONE) : qr[0]);
  }

  /** Returns the smallest integer not less than this. */
  public Rational ceil() {
    return negate().floor().negate();
  }

  /** Returns the value as an {@code int}; throws if it is not an integer
   * or does not fit. */
  public int intValueExact() {
    checkArgument(isInteger(), "not an integer: %s", this);
    return numerator.intValueExact();
  }
}

// End Rational.java
