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

import com.google.common.collect.ImmutableList;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.type.Assumptions;
import net.hydromatic.axiom.type.Sign;
import org.junit.jupiter.api.Test;

/** Tests {@link Sets}. */
class SetsTest {
  private final Expr.Symbol a = ex.integer("a");
  private final Expr.Symbol n =
      ex.symbol("n", Assumptions.INTEGER.withSign(Sign.NONNEGATIVE));

  private static Expr.Exp range(long lower, long upper) {
    return ex.interval(ex.number(lower), ex.number(upper), true);
  }

  @Test void testContains() {
    assertThat(Sets.contains(range(0, 5), ex.number(3)), is(true));
    assertThat(Sets.contains(range(0, 5), ex.number(7)), is(false));
    assertThat(Sets.contains(range(0, 5), a), nullValue());
    assertThat(Sets.contains(ex.emptySet(), a), is(false));
    assertThat(Sets.contains(ex.universalSet(), a), is(true));
    assertThat(Sets.contains(ex.finiteSet(ex.one(), ex.number(2)), a),
        nullValue());
    assertThat(Sets.contains(ex.finiteSet(ex.one(), ex.number(2)),
        ex.number(3)), is(false));
    // a symbol belongs to its own domain
    assertThat(Sets.contains(n.domain(), n), is(true));
  }

  @Test void testSubset() {
    assertThat(Sets.isSubset(range(1, 3), range(0, 5)), is(true));
    assertThat(Sets.isSubset(range(1, 7), range(0, 5)), is(false));
    assertThat(Sets.isSubset(ex.emptySet(), range(0, 5)), is(true));
    assertThat(
        Sets.isSubset(ex.finiteSet(ex.one(), ex.number(2)), range(0, 5)),
        is(true));
  }

  @Test void testSize() {
    assertThat(Sets.size(range(0, 5)), is(ex.number(6)));
    assertThat(Sets.size(ex.interval(ex.zero(), n, true)),
        is(ex.add(n, ex.one())));
    assertThat(Sets.size(ex.finiteSet(ex.one(), ex.number(2))),
        is(ex.number(2)));
    assertThat(Sets.size(ex.finiteSet(ex.one(), a)), nullValue());
    assertThat(Sets.size(ex.interval(ex.zero(), ex.one(), false)),
        is(ex.infinity()));
  }

  @Test void testIsEmpty() {
    assertThat(Sets.isEmpty(ex.emptySet()), is(true));
    assertThat(Sets.isEmpty(ex.interval(ex.zero(), n, true)), is(false));
    assertThat(Sets.isEmpty(ex.interval(ex.zero(), a, true)), nullValue());
  }

  @Test void testElements() {
    assertThat(Sets.elements(range(0, 2), 10),
        is(ImmutableList.of(ex.zero(), ex.one(), ex.number(2))));
    assertThat(Sets.elements(range(0, 100), 10), nullValue());
    assertThat(Sets.elements(ex.interval(ex.zero(), n, true), 10),
        nullValue());
  }

  @Test void testSingleton() {
    assertThat(Sets.singleton(ex.finiteSet(a)), is(a));
    assertThat(Sets.singleton(range(0, 5)), nullValue());
  }
}

// End SetsTest.java
