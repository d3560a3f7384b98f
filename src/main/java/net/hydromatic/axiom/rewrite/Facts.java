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
package net.hydromatic.axiom.rewrite;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.axiom.ast.ExprBuilder.ex;

import com.google.common.collect.ImmutableSet;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Limit;
import net.hydromatic.axiom.ast.Op;
import net.hydromatic.axiom.type.Sign;
import net.hydromatic.axiom.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Facts derived from the assumptions on symbols. */
public abstract class Facts {
  /** How deeply to follow the domains of symbols whose bounds contain other
   * symbols. */
  private static final int MAX_DEPTH = 6;

  private Facts() {}

  /** Returns what is known about the sign of a numeric expression, or null
   * if nothing is known. */
  public static @Nullable Sign sign(Expr.Exp e) {
    return sign(e, 0);
  }

  private static @Nullable Sign sign(Expr.Exp e, int depth) {
    if (depth > MAX_DEPTH || !e.dtype().isNumeric()) {
      return null;
    }
    switch (e.op) {
    case NUMBER:
      final int signum = requireNonNull(e.numberValue()).signum();
      return signum > 0 ? Sign.POSITIVE
          : signum < 0 ? Sign.NEGATIVE
          : Sign.ZERO;
    case INFINITY:
      return Sign.POSITIVE;
    case NEGATIVE_INFINITY:
      return Sign.NEGATIVE;
    case SYMBOL:
      return symbolSign((Expr.Symbol) e, depth);
    case INDEXED:
      return e.args().get(0) instanceof Expr.Symbol
          ? symbolSign((Expr.Symbol) e.args().get(0), depth)
          : null;
    case ADD:
      Sign sum = Sign.ZERO;
      for (Expr.Exp arg : e.args()) {
        sum = Sign.add(sum, sign(arg, depth));
      }
      return sum != null ? sum : boundSign(e, depth);
    case MUL:
      Sign product = Sign.POSITIVE;
      for (Expr.Exp arg : e.args()) {
        product = Sign.multiply(product, sign(arg, depth));
      }
      return product;
    case POW:
      return powerSign(sign(e.args().get(0), depth),
          e.args().get(1).numberValue());
    case MIN:
    case MAX:
      return extremumSign(e, depth);
    case KRONECKER_DELTA:
      return Sign.NONNEGATIVE;
    case PIECEWISE:
      Sign s = null;
      for (int i = 0; i < e.args().size(); i += 2) {
        final Expr.Exp value = e.args().get(i);
        if (value.op == Op.UNDEFINED) {
          continue;
        }
        final Sign s2 = sign(value, depth);
        if (s2 == null) {
          return null;
        }
        s = s == null ? s2 : union(s, s2);
        if (s == null) {
          return null;
        }
      }
      return s;
    case BINDER:
      return binderSign((Expr.Binder) e, depth);
    default:
      return null;
    }
  }

  private static @Nullable Sign symbolSign(Expr.Symbol symbol, int depth) {
    if (symbol.assumptions.sign != null) {
      return symbol.assumptions.sign;
    }
    return domainSign(symbol.domain(), depth);
  }

  /** Returns the sign of every element of a set. */
  private static @Nullable Sign domainSign(Expr.Exp domain, int depth) {
    switch (domain.op) {
    case INTERVAL:
      final Expr.Interval interval = (Expr.Interval) domain;
      final Sign lower = sign(interval.lower, depth + 1);
      if (lower != null && lower.isNonNegative()) {
        return lower == Sign.POSITIVE || interval.leftOpen
            ? Sign.POSITIVE : Sign.NONNEGATIVE;
      }
      final Sign upper = sign(interval.upper, depth + 1);
      if (upper != null && upper.isNonPositive()) {
        return upper == Sign.NEGATIVE || interval.rightOpen
            ? Sign.NEGATIVE : Sign.NONPOSITIVE;
      }
      return null;
    case FINITE_SET:
      Sign s = null;
      for (Expr.Exp element : domain.args()) {
        final Sign s2 = sign(element, depth + 1);
        if (s2 == null) {
          return null;
        }
        s = s == null ? s2 : union(s, s2);
        if (s == null) {
          return null;
        }
      }
      return s;
    default:
      return null;
    }
  }

  /** Bounds a sum that is affine in a single symbol by evaluating it at the
   * ends of that symbol's domain. */
  private static @Nullable Sign boundSign(Expr.Exp e, int depth) {
    final ImmutableSet<Expr.Symbol> symbols = FreeFinder.freeSymbols(e);
    if (symbols.size() != 1) {
      return null;
    }
    final Expr.Symbol x = symbols.iterator().next();
    if (x.domain().op != Op.INTERVAL) {
      return null;
    }
    final Polynomials.Affine affine = Polynomials.affine(e, x);
    if (affine == null) {
      return null;
    }
    final Rational slope = affine.slope.numberValue();
    if (slope == null) {
      return null;
    }
    final Expr.Interval domain = (Expr.Interval) x.domain();
    final Expr.Exp atLower =
        ex.add(ex.mul(affine.slope, domain.lower), affine.intercept);
    final Expr.Exp atUpper =
        ex.add(ex.mul(affine.slope, domain.upper), affine.intercept);
    final Expr.Exp least = slope.signum() > 0 ? atLower : atUpper;
    final Expr.Exp greatest = slope.signum() > 0 ? atUpper : atLower;
    final boolean leastOpen =
        slope.signum() > 0 ? domain.leftOpen : domain.rightOpen;
    final boolean greatestOpen =
        slope.signum() > 0 ? domain.rightOpen : domain.leftOpen;
    final Sign low = sign(least, depth + 1);
    if (low != null && low.isNonNegative()) {
      return low == Sign.POSITIVE || leastOpen
          ? Sign.POSITIVE : Sign.NONNEGATIVE;
    }
    final Sign high = sign(greatest, depth + 1);
    if (high != null && high.isNonPositive()) {
      return high == Sign.NEGATIVE || greatestOpen
          ? Sign.NEGATIVE : Sign.NONPOSITIVE;
    }
    return null;
  }

  private static @Nullable Sign powerSign(@Nullable Sign base,
      @Nullable Rational exponent) {
    if (exponent == null || !exponent.isInteger()) {
      return base == Sign.POSITIVE ? Sign.POSITIVE : null;
    }
    if (base == Sign.ZERO) {
      return exponent.signum() > 0 ? Sign.ZERO : null;
    }
    final boolean even = exponent.intValueExact() % 2 == 0;
    if (even) {
      return base == Sign.POSITIVE || base == Sign.NEGATIVE
          ? Sign.POSITIVE
          : exponent.signum() > 0 ? Sign.NONNEGATIVE : Sign.POSITIVE;
    }
    if (exponent.signum() < 0 && base != null) {
      // the base is non-zero, so the result has the base's strict sign
      return base.isNonNegative() ? Sign.POSITIVE : Sign.NEGATIVE;
    }
    return base;
  }

  private static @Nullable Sign extremumSign(Expr.Exp e, int depth) {
    final boolean isMin = e.op == Op.MIN;
    boolean allNonNegative = true;
    boolean allNonPositive = true;
    for (Expr.Exp arg : e.args()) {
      final Sign s = sign(arg, depth);
      if (s == null) {
        allNonNegative = allNonPositive = false;
        continue;
      }
      if (isMin && s == Sign.NEGATIVE || !isMin && s == Sign.POSITIVE) {
        return s;
      }
      allNonNegative &= s.isNonNegative();
      allNonPositive &= s.isNonPositive();
    }
    return allNonNegative ? Sign.NONNEGATIVE
        : allNonPositive ? Sign.NONPOSITIVE
        : null;
  }

  private static @Nullable Sign binderSign(Expr.Binder binder, int depth) {
    for (Limit limit : binder.limits) {
      if (!limit.isOriented()) {
        return null;
      }
    }
    final Sign s = sign(binder.function, depth);
    if (s == null) {
      return null;
    }
    switch (binder.variant) {
    case SUM:
    case INTEGRAL:
      return s.isNonNegative() ? Sign.NONNEGATIVE
          : s.isNonPositive() ? Sign.NONPOSITIVE
          : null;
    case PRODUCT:
      return s == Sign.POSITIVE ? Sign.POSITIVE
          : s.isNonNegative() ? Sign.NONNEGATIVE
          : null;
    default:
      return null;
    }
  }

  /** Returns the least sign that includes both signs, or null. */
  private static @Nullable Sign union(Sign a, Sign b) {
    if (a == b) {
      return a;
    }
    if (a.isNonNegative() && b.isNonNegative()) {
      return Sign.NONNEGATIVE;
    }
    if (a.isNonPositive() && b.isNonPositive()) {
      return Sign.NONPOSITIVE;
    }
    return null;
  }
}

// End Facts.java
