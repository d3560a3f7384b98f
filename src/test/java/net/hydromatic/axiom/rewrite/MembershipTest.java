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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Limit;
import net.hydromatic.axiom.ast.Variant;
import net.hydromatic.axiom.type.Assumptions;
import net.hydromatic.axiom.type.DType;
import net.hydromatic.axiom.type.Sign;
import org.junit.jupiter.api.Test;

/** Tests {@link Membership}. */
class MembershipTest {
  private final Expr.Symbol i = ex.integer("i");
  private final Expr.Symbol x = ex.real("x");
  private final Expr.Symbol n =
      ex.symbol("n", Assumptions.INTEGER.withSign(Sign.NONNEGATIVE));
  private final Expr.Symbol setA = ex.symbol("A", Assumptions.SET);
  private final Expr.Symbol setB = ex.symbol("B", Assumptions.SET);

  private static Expr.Exp f(Expr.Exp... args) {
    return ex.apply("f", DType.REAL, args);
  }

  @Test void testDecided() {
    final Expr.Exp range = ex.interval(ex.zero(), ex.number(5), true);
    assertThat(Membership.contains(ex.number(2), range),
        is(ex.trueLiteral()));
    assertThat(Membership.contains(ex.number(7), range),
        is(ex.falseLiteral()));
  }

  @Test void testSingleton() {
    assertThat(Membership.contains(x, ex.finiteSet(ex.number(3))),
        is(ex.eq(x, ex.number(3))));
    assertThat(
        Membership.simplify(ex.notContains(x, ex.finiteSet(ex.number(3)))),
        is(ex.ne(x, ex.number(3))));
  }

  @Test void testUnionComprehension() {
    final Limit limit = Limit.of(i, ex.zero(), n);
    final Expr.Exp union =
        ex.bind(Variant.UNION, ex.finiteSet(f(i)), limit);
    assertThat(Membership.contains(x, union),
        is(ex.bind(Variant.EXISTS, ex.eq(x, f(i)), limit)));
  }

  @Test void testSubsetOfFinite() {
    final Expr.Exp a = ex.finiteSet(ex.one(), ex.number(2));
    assertThat(Membership.subset(a, setA),
        is(
            ex.and(ex.contains(ex.one(), setA),
                ex.contains(ex.number(2), setA))));
  }

  @Test void testDefinition() {
    final Expr.Exp subset = ex.subset(setA, setB);
    final Expr.Symbol e = ex.real("x");
    assertThat(Membership.definition(subset),
        is(ex.bind(Variant.FOR_ALL, ex.contains(e, setB), Limit.of(e, setA))));
  }

  @Test void testAsKroneckerDelta() {
    final Expr.Exp set = ex.finiteSet(ex.one(), ex.number(2));
    final Expr.Exp sum =
        ex.add(ex.kroneckerDelta(i, ex.one()),
            ex.kroneckerDelta(i, ex.number(2)));
    assertThat(Membership.asKroneckerDelta(ex.contains(i, set)), is(sum));
    assertThat(Membership.asKroneckerDelta(ex.notContains(i, set)),
        is(ex.sub(ex.one(), sum)));
    assertThat(Membership.asKroneckerDelta(ex.lt(i, n)), nullValue());
  }
}

// End MembershipTest.java
