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
import net.hydromatic.axiom.type.DType;
import org.junit.jupiter.api.Test;

/** Tests {@link Domains}. */
class DomainsTest {
  private final Expr.Symbol i = ex.integer("i");
  private final Expr.Symbol x = ex.real("x");

  @Test void testInterval() {
    final Expr.Exp condition =
        ex.and(ex.ge(i, ex.zero()), ex.lt(i, ex.number(10)));
    assertThat(Domains.domainConditioned(i, condition),
        is(ex.interval(ex.zero(), ex.number(9), true)));
  }

  @Test void testReal() {
    // 2x + 1 > 0 is x > -1/2
    final Expr.Exp condition =
        ex.gt(ex.add(ex.mul(ex.number(2), x), ex.one()), ex.zero());
    assertThat(Domains.domainConditioned(x, condition),
        is(
            ex.interval(ex.div(ex.minusOne(), ex.number(2)), ex.infinity(),
                true, true, false)));
  }

  @Test void testEquation() {
    assertThat(Domains.domainConditioned(i, ex.eq(i, ex.number(3))),
        is(ex.finiteSet(ex.number(3))));
    assertThat(Domains.domainConditioned(i, ex.trueLiteral()),
        is(i.domain()));
    assertThat(Domains.domainConditioned(i, ex.falseLiteral()),
        is(ex.emptySet()));
  }

  @Test void testUnsolvable() {
    final Expr.Exp p = ex.apply("p", DType.BOOLEAN, i);
    assertThat(Domains.domainConditioned(i, p), nullValue());
    assertThat(
        Domains.domainConditioned(i, ex.lt(ex.mul(i, i), ex.number(4))),
        nullValue());
  }

  @Test void testNonIdentity() {
    final Expr.Exp f = ex.apply("f", DType.REAL, i);
    final Expr.Exp delta = ex.kroneckerDelta(i, ex.number(3));
    assertThat(Domains.nonIdentity(ex.mul(delta, f), i, ex.zero()),
        is(ex.finiteSet(ex.number(3))));
    assertThat(Domains.nonIdentity(f, i, ex.zero()), nullValue());
    final Expr.Exp piecewise =
        ex.piecewise(f, ex.lt(i, ex.number(5)), ex.zero(), ex.trueLiteral());
    assertThat(Domains.nonIdentity(piecewise, i, ex.zero()),
        is(ex.interval(ex.negativeInfinity(), ex.number(4), true)));
  }
}

// End DomainsTest.java
