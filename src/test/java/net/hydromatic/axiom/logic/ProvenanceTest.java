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
package net.hydromatic.axiom.logic;

import static net.hydromatic.axiom.ast.ExprBuilder.ex;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.type.DType;
import org.junit.jupiter.api.Test;

/** Tests {@link Provenance} and {@link Derivation}. */
class ProvenanceTest {
  @Test void testDirection() {
    assertThat(Provenance.EQUIVALENT.isForward(), is(true));
    assertThat(Provenance.EQUIVALENT.isBackward(), is(true));
    assertThat(Provenance.GIVEN.isBackward(), is(false));
    assertThat(Provenance.SUBSTITUTED_FROM.isForward(), is(true));
    assertThat(Provenance.IMPLIED_BY.isForward(), is(false));
  }

  @Test void testCombine() {
    assertThat(Provenance.EQUIVALENT.combine(Provenance.IMPLIED_BY),
        is(Provenance.IMPLIED_BY));
    assertThat(Provenance.GIVEN.combine(Provenance.EQUIVALENT),
        is(Provenance.GIVEN));
    assertThat(Provenance.SUBSTITUTED_FROM.combine(Provenance.SUBSTITUTED_FROM),
        is(Provenance.SUBSTITUTED_FROM));
    assertThat(Provenance.SUBSTITUTED_FROM.combine(Provenance.GIVEN),
        is(Provenance.GIVEN));
    assertThat(Provenance.IMPLIED_BY.combine(Provenance.IMPLIED_BY),
        is(Provenance.IMPLIED_BY));
    assertThrows(IllegalArgumentException.class, () ->
        Provenance.GIVEN.combine(Provenance.IMPLIED_BY));
    assertThrows(IllegalArgumentException.class, () ->
        Provenance.IMPLIED_BY.combine(Provenance.SUBSTITUTED_FROM));
  }

  @Test void testThen() {
    final Expr.Exp p = ex.apply("p", DType.BOOLEAN);
    final Expr.Exp q = ex.apply("q", DType.BOOLEAN);
    final Expr.Exp r = ex.apply("r", DType.BOOLEAN);
    final Derivation d1 = Derivation.of(q, Provenance.EQUIVALENT, p);
    final Derivation d2 = Derivation.of(r, Provenance.GIVEN, q);
    final Derivation d = d1.then(d2);
    assertThat(d.result, is(r));
    assertThat(d.provenance, is(Provenance.GIVEN));
    assertThat(d.premises, is(ImmutableList.of(p)));
    assertThat(d, is(Derivation.of(r, Provenance.GIVEN, p)));
  }
}

// End ProvenanceTest.java
