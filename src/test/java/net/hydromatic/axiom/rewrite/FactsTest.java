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
import net.hydromatic.axiom.type.Assumptions;
import net.hydromatic.axiom.type.Sign;
import org.junit.jupiter.api.Test;

/** Tests {@link Facts}. */
class FactsTest {
  private final Expr.Symbol i = ex.integer("i");
  private final Expr.Symbol n =
      ex.symbol("n", Assumptions.INTEGER.withSign(Sign.NONNEGATIVE));
  private final Expr.Symbol k =
      ex.symbol("k", Assumptions.INTEGER.withSign(Sign.POSITIVE));

  @Test void testConstants() {
    assertThat(Facts.sign(ex.number(3)), is(Sign.POSITIVE));
    assertThat(Facts.sign(ex.minusOne()), is(Sign.NEGATIVE));
    assertThat(Facts.sign(ex.zero()), is(Sign.ZERO));
    assertThat(Facts.sign(ex.infinity()), is(Sign.POSITIVE));
  }

  @Test void testSymbols() {
    assertThat(Facts.sign(n), is(Sign.NONNEGATIVE));
    assertThat(Facts.sign(i), nullValue());
    assertThat(Facts.sign(ex.add(n, ex.one())), is(Sign.POSITIVE));
    assertThat(Facts.sign(ex.neg(n)), is(Sign.NONPOSITIVE));
    assertThat(Facts.sign(ex.mul(n, k)), is(Sign.NONNEGATIVE));
    assertThat(Facts.sign(ex.kroneckerDelta(i, n)), is(Sign.NONNEGATIVE));
  }

  /** A positive integer is at least one, so {@code k - 1} is not
   * negative. */
  @Test void testBound() {
    assertThat(Facts.sign(ex.sub(k, ex.one())), is(Sign.NONNEGATIVE));
    assertThat(Facts.sign(ex.sub(ex.zero(), k)), is(Sign.NEGATIVE));
  }
}

// End FactsTest.java
