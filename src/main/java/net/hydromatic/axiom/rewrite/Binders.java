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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.axiom.ast.ExprBuilder.ex;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Limit;

/** Operations on binders. */
public abstract class Binders {
  private Binders() {}

  /** Returns the term of a binder for a particular value of the variable of
   * limit {@code i}: substitutes the value and removes the limit. If no
   * limits remain, the result is the substituted function. */
  public static Expr.Exp instantiate(Expr.Binder binder, int i,
      Expr.Exp value) {
    checkArgument(i >= 0 && i < binder.limits.size(), "no limit %s in %s",
        i, binder);
    return Substituter.instantiate(binder, i, value);
  }

  /** Specializes an expression at a value of the variable of its first
   * limit. A value inside the domain instantiates the binder; a value
   * provably outside it is an error; otherwise returns a binder whose first
   * limit ranges over {@code {value}} intersected with the domain. */
  public static Expr.Exp index(Expr.Exp e, Expr.Exp value) {
    if (!(e instanceof Expr.Binder)) {
      return ex.indexed(e, value);
    }
    final Expr.Binder binder = (Expr.Binder) e;
    final Limit limit = binder.limits.get(0);
    final Expr.Exp domain = limit.domain();
    final Boolean contains = Sets.contains(domain, value);
    checkArgument(!Boolean.FALSE.equals(contains),
        "index %s is outside the domain %s of %s", value, domain,
        limit.variable);
    if (Boolean.TRUE.equals(contains)) {
      return instantiate(binder, 0, value);
    }
    final List<Limit> limits = new ArrayList<>(binder.limits);
    limits.set(0,
        Limit.of(limit.variable,
            ex.intersection(ex.finiteSet(value), domain)));
    return ex.bind(binder.variant, binder.function, limits);
  }

  /** Renames the variable of a limit. The new variable must not occur free
   * in the binder. If the limit is unconstrained and the new variable has a
   * different domain, the limit keeps the domain of the old variable. */
  public static Expr.Binder renameBound(Expr.Binder binder, Expr.Symbol from,
      Expr.Symbol to) {
    final int i = binder.indexOf(from);
    checkArgument(i >= 0, "%s is not bound in %s", from, binder);
    final Map<Expr.Symbol, Expr.Symbol> map = ImmutableMap.of(from, to);
    final List<Limit> limits = new ArrayList<>();
    for (int j = 0; j < binder.limits.size(); j++) {
      final Limit limit = binder.limits.get(j);
      if (j < i) {
        limits.add(limit);
      } else if (j == i) {
        limits.add(
            limit.isUnconstrained() && !to.domain().equals(from.domain())
                ? Limit.of(to, from.domain())
                : limit.copy(to, limit.lower, limit.upper, limit.set));
      } else {
        limits.add(Replacer.replace(limit, map));
      }
    }
    final Expr.Exp e =
        ex.bind(binder.variant, Replacer.replace(binder.function, map),
            limits);
    if (!(e instanceof Expr.Binder)) {
      throw new AssertionError("renaming " + from + " to " + to
          + " collapsed " + binder);
    }
    return (Expr.Binder) e;
  }

  /** Returns the depth of an expression; a leaf has depth 1. */
  public static int depth(Expr.Exp e) {
    int max = 0;
    final Deque<Expr.Exp> stack = new ArrayDeque<>();
    final Deque<Integer> depths = new ArrayDeque<>();
    stack.push(e);
    depths.push(1);
    while (!stack.isEmpty()) {
      final Expr.Exp e2 = stack.pop();
      final int d = depths.pop();
      max = Math.max(max, d);
      for (Expr.Exp arg : e2.args()) {
        stack.push(arg);
        depths.push(d + 1);
      }
    }
    return max;
  }
}

// End Binders.java
