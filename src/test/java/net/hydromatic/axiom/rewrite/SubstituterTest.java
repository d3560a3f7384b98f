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
import static org.hamcrest.CoreMatchers.not;
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

/** Tests {@link Substituter}. */
class SubstituterTest {
  private final Expr.Symbol i = ex.integer("i");
  private final Expr.Symbol j = ex.integer("j");
  private final Expr.Symbol a = ex.integer("a");
  private final Expr.Symbol x = ex.real("x");
  private final Expr.Symbol y = ex.real("y");
  private final Expr.Symbol n =
      ex.symbol("n", Assumptions.INTEGER.withSign(Sign.NONNEGATIVE));

  private static Expr.Exp f(Expr.Exp... args) {
    return ex.apply("f", DType.REAL, args);
  }

  @Test void testFree() {
    final Expr.Exp e = ex.add(f(x), y);
    assertThat(Substituter.substitute(e, x, ex.number(2)),
        is(ex.add(f(ex.number(2)), y)));
    // a sub-expression can be replaced, too
    assertThat(Substituter.substitute(e, f(x), x), is(ex.add(x, y)));
  }

  @Test void testBoundNotReplaced() {
    final Expr.Exp e = ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), n));
    final Expr.Exp e2 = ex.add(e, f(i));
    assertThat(Substituter.substitute(e2, i, a),
        is(ex.add(e, f(a))));
  }

  @Test void testCaptureAvoiding() {
    // substituting "x := i" inside "Sum[i](f(i, x))" must not capture "i"
    final Expr.Exp e =
        ex.bind(Variant.SUM, f(i, x), Limit.of(i, ex.zero(), n));
    final Expr.Exp r = Substituter.substitute(ex.mul(e, y), x, i);
    assertThat(FreeFinder.occursFree(r, i), is(true));
    assertThat(FreeFinder.occursFree(r, x), is(false));
    final Expr.Exp binder = r.args().get(1).op == Op.BINDER
        ? r.args().get(1) : r.args().get(0);
    assertThat(binder, hasOp(Op.BINDER));
    final Expr.Symbol v = ((Expr.Binder) binder).limits.get(0).variable;
    assertThat(v, not(is(i)));
    assertThat(((Expr.Binder) binder).function, is(f(v, i)));
  }

  @Test void testRename() {
    final Expr.Exp e = ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), n));
    assertThat(Substituter.substitute(e, i, j),
        is(ex.bind(Variant.SUM, f(j), Limit.of(j, ex.zero(), n))));
    // renaming to a variable that occurs free does nothing
    final Expr.Exp e2 =
        ex.bind(Variant.SUM, f(i, j), Limit.of(i, ex.zero(), n));
    assertThat(Substituter.substitute(e2, i, j), is(e2));
    // types must match
    assertThrows(IllegalArgumentException.class, () ->
        Substituter.substitute(e, i, x));
  }

  @Test void testShift() {
    final Expr.Exp e =
        ex.bind(Variant.SUM, ex.mul(i, i), Limit.of(i, ex.zero(), n));
    assertThat(Substituter.substitute(e, i, ex.add(i, ex.one())),
        is(
            ex.bind(Variant.SUM, ex.pow(ex.sub(i, ex.one()), ex.number(2)),
                Limit.of(i, ex.one(), ex.add(n, ex.one())))));
  }

  @Test void testReflect() {
    final Expr.Exp e =
        ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), ex.number(3)));
    assertThat(Substituter.substitute(e, i, ex.neg(i)),
        is(
            ex.bind(Variant.SUM, f(ex.neg(i)),
                Limit.of(i, ex.number(-3), ex.zero()))));
  }

  @Test void testIntegralScale() {
    final Expr.Exp e =
        ex.bind(Variant.INTEGRAL, f(x), Limit.of(x, ex.zero(), ex.one()));
    final Expr.Exp two = ex.number(2);
    assertThat(Substituter.substitute(e, x, ex.mul(two, x)),
        is(
            ex.bind(Variant.INTEGRAL,
                ex.mul(f(ex.div(x, two)), ex.div(ex.one(), two)),
                Limit.of(x, ex.zero(), two))));
  }

  @Test void testNotAffine() {
    final Expr.Exp e = ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), n));
    assertThat(Substituter.substitute(e, i, ex.mul(i, i)), is(e));
    // an integer variable may only be shifted or reflected
    assertThat(Substituter.substitute(e, i, ex.mul(ex.number(2), i)), is(e));
  }

  @Test void testEliminate() {
    final Expr.Exp e =
        ex.bind(Variant.FOR_ALL, ex.lt(x, y), Limit.of(x));
    assertThat(Substituter.substitute(e, x, ex.number(3)),
        is(ex.lt(ex.number(3), y)));
    // a constrained limit is not eliminated
    final Expr.Exp e2 =
        ex.bind(Variant.FOR_ALL, ex.lt(x, y),
            Limit.of(x, ex.zero(), ex.one()));
    assertThat(Substituter.substitute(e2, x, ex.number(3)), is(e2));
  }

  @Test void testAlphaRoundTrip() {
    final Expr.Exp e =
        ex.bind(Variant.SUM, f(i, a), Limit.of(i, ex.zero(), n));
    final Expr.Symbol k = ex.integer("k");
    final Expr.Exp e2 = Substituter.substitute(e, i, k);
    assertThat(e2, not(is(e)));
    assertThat(Substituter.substitute(e2, k, i), is(e));
  }

  @Test void testDepthLimit() {
    final Session session = Session.create().with(Prop.MAX_DEPTH, 2);
    final Expr.Exp e = ex.bind(Variant.SUM, f(i), Limit.of(i, ex.zero(), n));
    assertThrows(RewriteException.class, () ->
        Substituter.substitute(session, ex.add(e, x), x, y));
  }

  @Test void testTracer() {
    final List<Expr.Exp> results = new ArrayList<>();
    final Session session =
        Session.create()
            .withTracer(Tracers.withOnSubstitute(Tracers.empty(), results::add));
    session.substitute(f(x), x, y);
    session.substitute(f(x), y, x);
    assertThat(results.size(), is(1));
    assertThat(results.get(0), is(f(y)));
  }
}

// End SubstituterTest.java
