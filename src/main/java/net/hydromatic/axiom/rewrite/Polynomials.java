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

import static net.hydromatic.axiom.ast.ExprBuilder.ex;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Op;
import net.hydromatic.axiom.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Polynomial structure of expressions.
 *
 * <p>Every method reports an expression of an unexpected shape by returning
 * null, never by throwing. */
public abstract class Polynomials {
  private Polynomials() {}

  /** Returns the coefficients of an expression as a polynomial in
   * {@code x}, lowest power first, or null if it is not a polynomial in
   * {@code x}. The coefficients do not contain {@code x}. The zero
   * polynomial has an empty list. */
  public static @Nullable List<Expr.Exp> coefficients(Expr.Exp e,
      Expr.Symbol x) {
    final List<Expr.Exp> list = coeffs(e, x);
    if (list == null) {
      return null;
    }
    while (!list.isEmpty() && list.get(list.size() - 1).equals(ex.zero())) {
      list.remove(list.size() - 1);
    }
    return list;
  }

  private static @Nullable List<Expr.Exp> coeffs(Expr.Exp e, Expr.Symbol x) {
    if (!FreeFinder.occursFree(e, x)) {
      return new ArrayList<>(ImmutableList.of(e));
    }
    switch (e.op) {
    case SYMBOL:
      return new ArrayList<>(ImmutableList.of(ex.zero(), ex.one()));
    case ADD:
      List<Expr.Exp> sum = new ArrayList<>();
      for (Expr.Exp arg : e.args()) {
        final List<Expr.Exp> c = coeffs(arg, x);
        if (c == null) {
          return null;
        }
        sum = plus(sum, c);
      }
      return sum;
    case MUL:
      List<Expr.Exp> product = new ArrayList<>(ImmutableList.of(ex.one()));
      for (Expr.Exp arg : e.args()) {
        final List<Expr.Exp> c = coeffs(arg, x);
        if (c == null) {
          return null;
        }
        product = times(product, c);
      }
      return product;
    case POW:
      final Rational n = e.args().get(1).numberValue();
      if (n == null || !n.isInteger() || n.signum() < 0
          || n.compareTo(Rational.of(64)) > 0) {
        return null;
      }
      final List<Expr.Exp> base = coeffs(e.args().get(0), x);
      if (base == null) {
        return null;
      }
      List<Expr.Exp> power = new ArrayList<>(ImmutableList.of(ex.one()));
      for (int i = 0; i < n.intValueExact(); i++) {
        power = times(power, base);
      }
      return power;
    default:
      return null;
    }
  }

  private static List<Expr.Exp> plus(List<Expr.Exp> a, List<Expr.Exp> b) {
    final List<Expr.Exp> list = new ArrayList<>();
    for (int i = 0; i < Math.max(a.size(), b.size()); i++) {
      list.add(
          ex.add(i < a.size() ? a.get(i) : ex.zero(),
              i < b.size() ? b.get(i) : ex.zero()));
    }
    return list;
  }

  private static List<Expr.Exp> times(List<Expr.Exp> a, List<Expr.Exp> b) {
    final List<Expr.Exp> list = new ArrayList<>();
    for (int i = 0; i < a.size() + b.size() - 1; i++) {
      list.add(ex.zero());
    }
    for (int i = 0; i < a.size(); i++) {
      for (int j = 0; j < b.size(); j++) {
        list.set(i + j, ex.add(list.get(i + j), ex.mul(a.get(i), b.get(j))));
      }
    }
    return list;
  }

  /** Returns the degree of an expression as a polynomial in {@code x};
   * -1 if it is zero or not a polynomial. */
  public static int degree(Expr.Exp e, Expr.Symbol x) {
    final List<Expr.Exp> list = coefficients(e, x);
    return list == null ? -1 : list.size() - 1;
  }

  /** Returns the slope and intercept if an expression has the form
   * {@code slope * x + intercept} with non-zero slope, otherwise null. */
  public static @Nullable Affine affine(Expr.Exp e, Expr.Symbol x) {
    final List<Expr.Exp> list = coefficients(e, x);
    if (list == null || list.size() != 2) {
      return null;
    }
    return new Affine(list.get(1), list.get(0));
  }

  /** Splits a sum, product, conjunction or disjunction (according to
   * {@code op}) into the part that does not depend on any of the given
   * symbols and the part that does. Returns null unless both parts are
   * non-trivial. */
  public static @Nullable Split split(Expr.Exp e, Op op,
      Collection<? extends Expr.Symbol> symbols) {
    if (e.op != op) {
      return null;
    }
    final List<Expr.Exp> independent = new ArrayList<>();
    final List<Expr.Exp> dependent = new ArrayList<>();
    for (Expr.Exp arg : e.args()) {
      (FreeFinder.isIndependent(arg, symbols) ? independent : dependent)
          .add(arg);
    }
    if (independent.isEmpty() || dependent.isEmpty()) {
      return null;
    }
    return new Split(ex.call(op, independent), ex.call(op, dependent));
  }

  /** Expression of the form {@code slope * x + intercept}. */
  public static class Affine {
    public final Expr.Exp slope;
    public final Expr.Exp intercept;

    Affine(Expr.Exp slope, Expr.Exp intercept) {
      this.slope = slope;
      this.intercept = intercept;
    }

    /** Returns the value of {@code x} at which the expression is zero. */
    public Expr.Exp root() {
      return ex.div(ex.neg(intercept), slope);
    }
  }

  /** Sum or product separated into a part that is independent of some
   * symbols and a part that is not. */
  public static class Split {
    public final Expr.Exp independent;
    public final Expr.Exp dependent;

    Split(Expr.Exp independent, Expr.Exp dependent) {
      this.independent = independent;
      this.dependent = dependent;
    }
  }
}

// End Polynomials.java
