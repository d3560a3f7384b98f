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

import static net.hydromatic.axiom.Matchers.hasOp;
import static net.hydromatic.axiom.ast.ExprBuilder.ex;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Limit;
import net.hydromatic.axiom.ast.Op;
import net.hydromatic.axiom.ast.Variant;
import net.hydromatic.axiom.type.Assumptions;
import net.hydromatic.axiom.type.DType;
import net.hydromatic.axiom.type.Sign;
import org.junit.jupiter.api.Test;

/** Tests {@link Simplifier}. */
class SimplifierTest {
  private final Expr.Symbol i = ex.integer("i");
  private final Expr.Symbol j = ex.integer("j");
  private final Expr.Symbol a = ex.integer("a");
  private final Expr.Symbol x = ex.real("x");
  private final Expr.Symbol c = ex.real("c");
  private final Expr.Symbol n =
      ex.symbol("n", Assumptions.INTEGER.withSign(Sign.NONNEGATIVE));
  private final Expr.Symbol m =
      ex.symbol("m", Assumptions.INTEGER.withSign(Sign.NONNEGATIVE));

  private static Expr.Exp f(Expr.Exp... args) {
    return ex.apply("f", DType.REAL, args);
  }

  private static Expr.Exp p(Expr.Exp... args) {
    return ex.apply("p", DType.BOOLEAN, args);
  }

  private static Expr.Exp simplify(Expr.Exp e) {
    return Simplifier.simplify(e);
  }

  @Test void testUnroll() {
    final Expr.Exp e =
        ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), ex.number(2)));
    assertThat(simplify(e),
        is(ex.add(f(ex.zero()), f(ex.one()), f(ex.number(2)))));
  }

  @Test void testUnrollProductOverSet() {
    final Expr.Exp e =
        ex.bind(Variant.PRODUCT, f(i),
            Limit.of(i, ex.finiteSet(ex.one(), ex.number(3))));
    assertThat(simplify(e), is(ex.mul(f(ex.one()), f(ex.number(3)))));
  }

  @Test void testConstantSum() {
    final Expr.Exp e = ex.bind(Variant.SUM, c, Limit.of(i, ex.one(), n));
    assertThat(simplify(e), is(ex.mul(c, n)));
  }

  @Test void testConstantMinimum() {
    // the domain is not empty, so the limit can be dropped
    final Expr.Exp e =
        ex.bind(Variant.MINIMIZE, c, Limit.of(i, ex.zero(), n));
    assertThat(simplify(e), is(c));
  }

  @Test void testReversedSum() {
    final Expr.Exp e =
        ex.bind(Variant.SUM, f(i), Limit.of(i, ex.number(5), ex.one()));
    assertThat(simplify(e),
        is(ex.neg(ex.add(f(ex.number(2)), f(ex.number(3)), f(ex.number(4))))));
  }

  @Test void testReversedSumOnePass() {
    final Session session = Session.create().with(Prop.SIMPLIFY_PASS_COUNT, 1);
    final Expr.Exp e =
        ex.bind(Variant.SUM, f(i), Limit.of(i, ex.number(5), ex.one()));
    assertThat(Simplifier.simplify(session, e),
        is(
            ex.neg(
                ex.bind(Variant.SUM, f(i),
                    Limit.of(i, ex.number(2), ex.number(4))))));
  }

  @Test void testSingleton() {
    final Expr.Exp e =
        ex.bind(Variant.SUM, f(i), Limit.of(i, ex.finiteSet(ex.number(3))));
    assertThat(simplify(e), is(f(ex.number(3))));
    final Expr.Exp e2 =
        ex.bind(Variant.FOR_ALL, p(i), Limit.of(i, ex.finiteSet(ex.number(5))));
    assertThat(simplify(e2), is(p(ex.number(5))));
  }

  @Test void testIntegralOverPoints() {
    // a finite set has measure zero, however many points it has
    final Expr.Exp e =
        ex.bind(Variant.INTEGRAL, f(x), Limit.of(x, ex.finiteSet(ex.number(5))));
    assertThat(simplify(e), is(ex.zero()));
    final Expr.Exp e2 =
        ex.bind(Variant.INTEGRAL, f(x),
            Limit.of(x, ex.finiteSet(ex.number(5), ex.number(7))));
    assertThat(simplify(e2), is(ex.zero()));
  }

  @Test void testFactor() {
    final Expr.Exp e =
        ex.bind(Variant.SUM, ex.mul(c, f(i)), Limit.of(i, ex.zero(), n));
    assertThat(simplify(e),
        is(ex.mul(c, ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), n)))));
  }

  @Test void testShift() {
    final Expr.Exp e =
        ex.bind(Variant.SUM, ex.add(c, f(i)), Limit.of(i, ex.zero(), n));
    assertThat(simplify(e),
        is(
            ex.add(ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), n)),
                ex.mul(c, ex.add(n, ex.one())))));
  }

  @Test void testFactorQuantifier() {
    // "Exists i. q and p(i)" always becomes "q and Exists i. p(i)"
    final Expr.Exp q = ex.lt(c, x);
    final Expr.Exp e =
        ex.bind(Variant.EXISTS, ex.and(q, p(i)), Limit.of(i, ex.zero(), n));
    assertThat(simplify(e),
        is(ex.and(q, ex.bind(Variant.EXISTS, p(i), Limit.of(i, ex.zero(), n)))));
  }

  @Test void testPiecewiseSplit() {
    final Expr.Exp e =
        ex.bind(Variant.SUM,
            ex.piecewise(f(i), ex.lt(i, ex.number(5)),
                ex.zero(), ex.trueLiteral()),
            Limit.of(i, ex.zero(), ex.number(10)));
    assertThat(simplify(e),
        is(
            ex.add(f(ex.zero()), f(ex.one()), f(ex.number(2)),
                f(ex.number(3)), f(ex.number(4)))));
  }

  @Test void testPiecewiseIndependent() {
    final Expr.Exp condition = ex.lt(c, x);
    final Expr.Exp e =
        ex.bind(Variant.SUM,
            ex.piecewise(f(i), condition, ex.zero(), ex.trueLiteral()),
            Limit.of(i, ex.zero(), n));
    assertThat(simplify(e),
        is(
            ex.piecewise(
                ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), n)),
                condition, ex.zero(), ex.trueLiteral())));
  }

  @Test void testNarrowDelta() {
    final Expr.Exp e =
        ex.bind(Variant.SUM,
            ex.mul(ex.kroneckerDelta(i, ex.number(3)), f(i)),
            Limit.of(i, ex.zero(), ex.infinity()));
    assertThat(simplify(e), is(f(ex.number(3))));

    // the same, with narrowing switched off
    final Session session =
        Session.create().with(Prop.NARROW_DOMAINS, false);
    assertThat(Simplifier.simplify(session, e), is(e));
  }

  @Test void testDenest() {
    final Expr.Exp inner =
        ex.bind(Variant.SUM, f(i, j), Limit.of(j, ex.zero(), m));
    final Expr.Exp e = ex.bind(Variant.SUM, inner, Limit.of(i, ex.zero(), n));
    assertThat(simplify(e),
        is(
            ex.bind(Variant.SUM, f(i, j), Limit.of(i, ex.zero(), n),
                Limit.of(j, ex.zero(), m))));
  }

  @Test void testExtremum() {
    final Expr.Exp f = ex.add(ex.mul(ex.number(3), x), c);
    final Limit limit = Limit.of(x, ex.zero(), ex.one());
    assertThat(simplify(ex.bind(Variant.MINIMIZE, f, limit)), is(c));
    assertThat(simplify(ex.bind(Variant.MAXIMIZE, f, limit)),
        is(ex.add(ex.number(3), c)));
    assertThat(simplify(ex.bind(Variant.ARG_MAX, ex.neg(x), limit)),
        is(ex.zero()));
    assertThat(simplify(ex.bind(Variant.ARG_MIN, ex.neg(x), limit)),
        is(ex.one()));
  }

  @Test void testOnePointExists() {
    final Limit limit = Limit.of(i, ex.zero(), n);
    final Expr.Exp e =
        ex.bind(Variant.EXISTS, ex.and(ex.eq(i, a), p(i)), limit);
    final Expr.Exp expected =
        simplify(ex.and(ex.contains(a, limit.domain()), p(a)));
    assertThat(simplify(e), is(expected));
  }

  @Test void testOnePointForAll() {
    final Limit limit = Limit.of(i, ex.zero(), n);
    final Expr.Exp e =
        ex.bind(Variant.FOR_ALL, ex.or(ex.ne(i, a), p(i)), limit);
    final Expr.Exp expected =
        simplify(ex.or(ex.notContains(a, limit.domain()), p(a)));
    assertThat(simplify(e), is(expected));
  }

  @Test void testMergeQuantifiers() {
    final Limit limit = Limit.of(i, ex.zero(), n);
    final Expr.Exp e =
        ex.and(ex.bind(Variant.FOR_ALL, p(i), limit),
            ex.bind(Variant.FOR_ALL, ex.lt(f(i), c), limit));
    assertThat(simplify(e),
        is(ex.bind(Variant.FOR_ALL, ex.and(p(i), ex.lt(f(i), c)), limit)));
  }

  @Test void testTracer() {
    final List<String> rules = new ArrayList<>();
    final List<Expr.Exp> passes = new ArrayList<>();
    final Session session =
        Session.create()
            .withTracer(
                Tracers.withOnPass(
                    Tracers.withOnRule(Tracers.empty(),
                        (rule, e) -> rules.add(rule)),
                    passes::add));
    final Expr.Exp e =
        ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), ex.number(2)));
    final Expr.Exp r = Simplifier.simplify(session, e);
    assertThat(rules, hasItem("unroll"));
    assertThat(passes.get(passes.size() - 1), is(r));
  }

  @Test void testIdempotent() {
    final List<Expr.Exp> list = new ArrayList<>();
    list.add(
        ex.bind(Variant.SUM, ex.add(c, ex.mul(c, f(i))),
            Limit.of(i, ex.zero(), n)));
    list.add(
        ex.bind(Variant.EXISTS, ex.and(ex.eq(i, a), p(i)),
            Limit.of(i, ex.zero(), n)));
    list.add(
        ex.bind(Variant.SUM, f(i), Limit.of(i, ex.number(5), ex.one())));
    for (Expr.Exp e : list) {
      final Expr.Exp r = simplify(e);
      assertThat(simplify(r), is(r));
    }
  }

  @Test void testDepthLimit() {
    Expr.Exp e = x;
    for (int k = 0; k < 20; k++) {
      e = f(e);
    }
    final Expr.Exp deep = e;
    final Session session = Session.create().with(Prop.MAX_DEPTH, 10);
    assertThrows(RewriteException.class, () ->
        Simplifier.simplify(session, deep));
    assertThat(Simplifier.simplify(deep), is(deep));
  }

  @Test void testLeavesIrreducible() {
    final Expr.Exp e =
        ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), n));
    assertThat(simplify(e), is(e));
  }
}

// End SimplifierTest.java
