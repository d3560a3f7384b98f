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

import static net.hydromatic.axiom.ast.ExprBuilder.ex;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.axiom.type.Assumptions;
import net.hydromatic.axiom.type.DType;
import net.hydromatic.axiom.type.Sign;
import org.junit.jupiter.api.Test;

/** Tests {@link Limit}. */
class LimitTest {
  private final Expr.Symbol i = ex.integer("i");
  private final Expr.Symbol n =
      ex.symbol("n", Assumptions.INTEGER.withSign(Sign.NONNEGATIVE));

  @Test void testWhere() {
    final Limit limit =
        Limit.where(i,
            ex.and(ex.ge(i, ex.zero()), ex.lt(i, ex.number(10))));
    assertThat(limit.isInterval(), is(true));
    assertThat(limit, hasToString("i:0:9"));
    assertThat(limit.extent(), is(ex.number(10)));
  }

  @Test void testRealInterval() {
    final Expr.Symbol x = ex.real("x");
    final Limit bounds = Limit.of(x, ex.zero(), ex.one());
    final Limit set =
        Limit.of(x, ex.interval(ex.zero(), ex.one(), false));
    assertThat(set, is(bounds));
    assertThat(set.hashCode(), is(bounds.hashCode()));
    assertThat(set, hasToString("x:0:1"));
    final Expr.Exp f = ex.apply("f", DType.REAL, x);
    assertThat(ex.bind(Variant.INTEGRAL, f, set),
        is(ex.bind(Variant.INTEGRAL, f, bounds)));
    // a half-open interval keeps the set form
    final Limit halfOpen =
        Limit.of(x, ex.interval(ex.zero(), ex.one(), false, true, false));
    assertThat(halfOpen.isSet(), is(true));
    assertThat(Limit.of(x, ex.negativeInfinity(), ex.infinity())
        .isUnconstrained(), is(true));
  }

  @Test void testOriented() {
    assertThat(Limit.of(i, ex.number(5), ex.one()).isOriented(), is(false));
    // the empty range [3, 2] is allowed
    assertThat(Limit.of(i, ex.number(3), ex.number(2)).isOriented(),
        is(true));
    assertThat(Limit.of(i, ex.zero(), n).isOriented(), is(true));
    assertThat(Limit.of(i).isOriented(), is(true));
  }

  @Test void testOutsideDomain() {
    assertThrows(IllegalArgumentException.class, () ->
        Limit.of(n, ex.minusOne(), ex.number(3)));
  }

  @Test void testExtent() {
    assertThat(Limit.of(i, ex.zero(), n).extent(), is(ex.add(n, ex.one())));
    assertThat(Limit.of(i, ex.zero(), ex.infinity()).extent(),
        is(ex.infinity()));
    assertThat(
        Limit.of(i, ex.finiteSet(ex.one(), ex.number(2))).extent(),
        is(ex.number(2)));
  }

  @Test void testUnconstrained() {
    assertThat(Limit.of(i, ex.universalSet()).isUnconstrained(), is(true));
    assertThat(Limit.of(i, i.domain()).isUnconstrained(), is(true));
    assertThat(Limit.of(i).domain(), is(i.domain()));
    assertThat(Limit.of(i), hasToString("i"));
  }

  @Test void testSet() {
    final Limit limit = Limit.of(i, ex.finiteSet(ex.one(), ex.number(2)));
    assertThat(limit.isSet(), is(true));
    assertThat(limit, hasToString("i:{1, 2}"));
    // an integer interval becomes an interval limit
    final Limit limit2 =
        Limit.of(i, ex.interval(ex.one(), ex.number(4), true));
    assertThat(limit2.isInterval(), is(true));
    assertThat(limit2, hasToString("i:1:4"));
  }
}

// End LimitTest.java
