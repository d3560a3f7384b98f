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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Limit;
import net.hydromatic.axiom.ast.Op;
import net.hydromatic.axiom.ast.Variant;
import net.hydromatic.axiom.type.DType;
import org.junit.jupiter.api.Test;

/** Tests {@link Binders}. */
class BindersTest {
  private final Expr.Symbol i = ex.integer("i");
  private final Expr.Symbol j = ex.integer("j");
  private final Expr.Symbol a = ex.integer("a");

  private static Expr.Exp f(Expr.Exp... args) {
    return ex.apply("f", DType.REAL, args);
  }

  @Test void testInstantiate() {
    final Expr.Binder b =
        (Expr.Binder) ex.bind(Variant.SUM, f(i, j),
            Limit.of(i, ex.zero(), ex.number(5)),
            Limit.of(j, ex.zero(), i));
    assertThat(Binders.instantiate(b, 0, ex.number(2)),
        is(
            ex.bind(Variant.SUM, f(ex.number(2), j),
                Limit.of(j, ex.zero(), ex.number(2)))));
    assertThat(Binders.instantiate(b, 1, a),
        is(
            ex.bind(Variant.SUM, f(i, a),
                Limit.of(i, ex.zero(), ex.number(5)))));
  }

  @Test void testIndex() {
    final Expr.Exp e =
        ex.bind(Variant.MAPPING, f(i), Limit.of(i, ex.zero(), ex.number(5)));
    assertThat(Binders.index(e, ex.number(2)), is(f(ex.number(2))));
    assertThrows(IllegalArgumentException.class, () ->
        Binders.index(e, ex.number(7)));
    assertThat(Binders.index(e, a), hasOp(Op.BINDER));
  }

  @Test void testRenameBound() {
    final Expr.Binder b =
        (Expr.Binder) ex.bind(Variant.SUM, f(i),
            Limit.of(i, ex.zero(), ex.number(5)));
    assertThat(Binders.renameBound(b, i, j),
        is(ex.bind(Variant.SUM, f(j), Limit.of(j, ex.zero(), ex.number(5)))));
    assertThrows(IllegalArgumentException.class, () ->
        Binders.renameBound(b, j, a));
  }

  @Test void testDepth() {
    assertThat(Binders.depth(a), is(1));
    assertThat(Binders.depth(f(a)), is(2));
    assertThat(Binders.depth(f(f(a))), is(3));
  }
}

// End BindersTest.java
