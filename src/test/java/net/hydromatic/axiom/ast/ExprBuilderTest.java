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
package net.hydromatic.axiom.ast;

import static net.hydromatic.axiom.Matchers.hasOp;
import static net.hydromatic.axiom.Matchers.isExp;
import static net.hydromatic.axiom.ast.ExprBuilder.ex;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.axiom.type.Assumptions;
import net.hydromatic.axiom.type.DType;
import net.hydromatic.axiom.type.Sign;
import net.hydromatic.axiom.util.Rational;
import org.junit.jupiter.api.Test;

/** Tests {@link ExprBuilder}. */
class ExprBuilderTest {
  private final Expr.Symbol x = ex.real("x");
  private final Expr.Symbol y = ex.real("y");
  private final Expr.Symbol i = ex.integer("i");
  private final Expr.Symbol a = ex.integer("a");
  private final Expr.Symbol n =
      ex.symbol("n", Assumptions.INTEGER.withSign(Sign.NONNEGATIVE));

  private static Expr.Exp f(Expr.Exp... args) {
    return ex.apply("f", DType.REAL, args);
  }

  @Test void testInterning() {
    assertThat(ex.add(x, y), sameInstance(ex.add(y, x)));
    assertThat(ex.real("x"), sameInstance(x));
    assertThat(ex.dummy(x).equals(x), is(false));
    assertThat(ex.dummy(x).toString(), startsWith("_x"));
  }

  @Test void testAdd() {
    assertThat(ex.add(ex.number(1), ex.number(2)), is(ex.number(3)));
    assertThat(ex.add(x, x, ex.number(2)), isExp("2 + 2*x"));
    assertThat(ex.add(x, ex.neg(x)), is(ex.zero()));
    assertThat(ex.add(y, x), isExp("x + y"));
    assertThat(ex.add(x, ex.infinity()), is(ex.infinity()));
    assertThat(ex.add(ex.infinity(), ex.negativeInfinity()),
        is(ex.undefined()));
  }

  @Test void testMul() {
    assertThat(ex.mul(x, x), is(ex.pow(x, ex.number(2))));
    assertThat(ex.mul(x, x), isExp("x^2"));
    assertThat(ex.mul(ex.number(2), ex.number(3)), is(ex.number(6)));
    assertThat(ex.mul(x, ex.zero()), is(ex.zero()));
    assertThat(ex.mul(ex.number(2), ex.add(x, ex.one())),
        is(ex.add(ex.mul(ex.number(2), x), ex.number(2))));
    assertThat(ex.pow(ex.pow(x, ex.number(2)), ex.number(3)),
        is(ex.pow(x, ex.number(6))));
    assertThat(ex.div(ex.number(3), ex.number(2)),
        is(ex.number(Rational.of(3, 2))));
    assertThat(ex.pow(ex.zero(), ex.minusOne()), is(ex.undefined()));
  }

  @Test void testIntervals() {
    assertThat(ex.interval(ex.number(5), ex.number(1), true),
        is(ex.emptySet()));
    assertThat(ex.interval(ex.number(2), ex.number(2), true),
        is(ex.finiteSet(ex.number(2))));
    assertThat(ex.interval(ex.number(2), ex.number(2), true), isExp("{2}"));
    assertThat(ex.interval(ex.zero(), ex.number(5), true),
        isExp("Range[0, 5]"));
    assertThat(ex.interval(ex.zero(), ex.one(), true, false, false),
        isExp("Interval(0, 1]"));
    assertThat(
        ex.interval(ex.number(Rational.of(1, 2)),
            ex.number(Rational.of(7, 2)), false, false, true),
        isExp("Range[1, 3]"));
    assertThat(ex.finiteSet(ex.number(2), ex.one(), ex.number(2)),
        isExp("{1, 2}"));
  }

  @Test void testRelations() {
    assertThat(ex.eq(x, x), is(ex.trueLiteral()));
    assertThat(ex.lt(x, x), is(ex.falseLiteral()));
    assertThat(ex.ge(n, ex.zero()), is(ex.trueLiteral()));
    assertThat(ex.lt(n, ex.zero()), is(ex.falseLiteral()));
    assertThat(ex.lt(ex.one(), ex.number(2)), is(ex.trueLiteral()));
    assertThat(ex.ne(ex.number(Rational.of(1, 2)), i), is(ex.trueLiteral()));
    assertThat(ex.lt(x, y), hasOp(Op.LT));
  }

  @Test void testNot() {
    final Expr.Exp p = ex.lt(x, ex.one());
    final Expr.Exp q = ex.gt(y, ex.number(2));
    assertThat(ex.not(p), is(ex.ge(x, ex.one())));
    assertThat(ex.not(ex.and(p, q)),
        is(ex.or(ex.ge(x, ex.one()), ex.le(y, ex.number(2)))));
    assertThat(ex.not(ex.not(p)), is(p));
    final Expr.Exp forAll = ex.bind(Variant.FOR_ALL, ex.lt(x, y), Limit.of(x));
    assertThat(ex.not(forAll),
        is(ex.bind(Variant.EXISTS, ex.ge(x, y), Limit.of(x))));
  }

  @Test void testJunction() {
    final Expr.Exp p = ex.lt(x, ex.one());
    final Expr.Exp q = ex.gt(y, ex.number(2));
    assertThat(ex.and(p, ex.not(p)), is(ex.falseLiteral()));
    assertThat(ex.or(p, ex.not(p)), is(ex.trueLiteral()));
    assertThat(ex.and(p, ex.trueLiteral()), is(p));
    assertThat(ex.and(p, p), is(p));
    assertThat(ex.or(p, ex.trueLiteral()), is(ex.trueLiteral()));
    assertThat(ex.and(p, q), is(ex.and(q, p)));
    assertThat(ex.and(), is(ex.trueLiteral()));
    assertThat(ex.or(), is(ex.falseLiteral()));
  }

  @Test void testPiecewise() {
    assertThat(ex.piecewise(x, ex.falseLiteral(), y, ex.trueLiteral()),
        is(y));
    assertThat(ex.piecewise(x, ex.lt(x, ex.zero())),
        isExp("Piecewise((x, x < 0), (undefined, true))"));
    assertThat(
        ex.piecewise(x, ex.lt(x, ex.zero()), x, ex.trueLiteral()), is(x));
  }

  @Test void testKroneckerDelta() {
    assertThat(ex.kroneckerDelta(ex.number(3), ex.number(3)), is(ex.one()));
    assertThat(ex.kroneckerDelta(ex.number(3), ex.number(4)), is(ex.zero()));
    assertThat(ex.kroneckerDelta(i, ex.number(3)),
        is(ex.kroneckerDelta(ex.number(3), i)));
  }

  @Test void testBinderToString() {
    assertThat(ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), n)),
        hasToString("Sum[i:0:n](f(i))"));
  }

  @Test void testBindCollapses() {
    // no limits
    assertThat(ex.bind(Variant.SUM, f(i)), is(f(i)));
    // function is the identity
    assertThat(ex.bind(Variant.SUM, ex.zero(), Limit.of(i, ex.zero(), n)),
        is(ex.zero()));
    // empty set
    assertThat(ex.bind(Variant.SUM, f(i), Limit.of(i, ex.emptySet())),
        is(ex.zero()));
    assertThat(
        ex.bind(Variant.FOR_ALL, ex.lt(i, a), Limit.of(i, ex.emptySet())),
        is(ex.trueLiteral()));
    // equal bounds
    assertThat(ex.bind(Variant.SUM, f(i), Limit.of(i, a, a)), is(f(a)));
    assertThat(ex.bind(Variant.INTEGRAL, f(x), Limit.of(x, y, y)),
        is(ex.zero()));
    assertThat(ex.bind(Variant.ARG_MAX, f(x), Limit.of(x, y, y)), is(y));
    // empty integer range
    assertThat(
        ex.bind(Variant.SUM, f(i), Limit.of(i, ex.number(3), ex.number(2))),
        is(ex.zero()));
    assertThat(
        ex.bind(Variant.PRODUCT, f(i),
            Limit.of(i, ex.number(3), ex.number(2))),
        is(ex.one()));
  }

  @Test void testBindReversedRangeIsEmpty() {
    final Limit reversed = Limit.of(i, ex.number(5), ex.one());
    final Expr.Exp p = ex.apply("p", DType.BOOLEAN, i);
    assertThat(ex.bind(Variant.FOR_ALL, p, reversed), is(ex.trueLiteral()));
    assertThat(ex.bind(Variant.EXISTS, p, reversed), is(ex.falseLiteral()));
    assertThat(ex.bind(Variant.MINIMIZE, f(i), reversed), is(ex.infinity()));
    assertThat(ex.bind(Variant.MAXIMIZE, f(i), reversed),
        is(ex.negativeInfinity()));
    assertThat(ex.bind(Variant.ARG_MIN, f(i), reversed), is(ex.undefined()));
    assertThat(ex.bind(Variant.ARG_MAX, f(i), reversed), is(ex.undefined()));
    assertThat(ex.bind(Variant.UNION, ex.finiteSet(i), reversed),
        is(ex.emptySet()));
    assertThat(ex.bind(Variant.INTERSECTION, ex.finiteSet(i), reversed),
        is(ex.universalSet()));
    // symbolic bounds, and a real variable
    assertThat(
        ex.bind(Variant.EXISTS, p, Limit.of(i, ex.add(n, ex.number(2)), n)),
        is(ex.falseLiteral()));
    assertThat(
        ex.bind(Variant.MINIMIZE, f(x), Limit.of(x, ex.one(), ex.zero())),
        is(ex.infinity()));
    // sums, products and integrals keep their orientation
    assertThat(ex.bind(Variant.PRODUCT, f(i), reversed), hasOp(Op.BINDER));
    assertThat(
        ex.bind(Variant.INTEGRAL, f(x), Limit.of(x, ex.one(), ex.zero())),
        hasOp(Op.BINDER));
  }

  @Test void testBindKeeps() {
    assertThat(ex.bind(Variant.MAPPING, f(i), Limit.of(i, a, a)),
        hasOp(Op.BINDER));
    assertThat(
        ex.bind(Variant.SUM, f(i), Limit.of(i, ex.number(5), ex.one())),
        hasOp(Op.BINDER));
    assertThat(ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), n)),
        hasOp(Op.BINDER));
  }

  @Test void testBindRejects() {
    final Expr.Symbol j = ex.integer("j");
    assertThrows(IllegalArgumentException.class, () ->
        ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), n),
            Limit.of(i, ex.zero(), a)));
    assertThrows(IllegalArgumentException.class, () ->
        ex.bind(Variant.SUM, f(i, j), Limit.of(i, ex.zero(), j),
            Limit.of(j, ex.zero(), n)));
    assertThrows(IllegalArgumentException.class, () ->
        ex.bind(Variant.FOR_ALL, f(i), Limit.of(i, ex.zero(), n)));
  }
}

// End ExprBuilderTest.java
