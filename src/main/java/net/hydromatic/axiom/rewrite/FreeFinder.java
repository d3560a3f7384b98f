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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Limit;

/** Finds free variables in an expression.
 *
 * <p>Uses an explicit stack rather than recursion, so that it can handle
 * arbitrarily deep expressions. */
public class FreeFinder {
  private FreeFinder() {}

  /** Finds the free symbols in an expression. */
  public static ImmutableSet<Expr.Symbol> freeSymbols(Expr.Exp exp) {
    final ImmutableSet.Builder<Expr.Symbol> set = ImmutableSet.builder();
    find(exp, set::add);
    return set.build();
  }

  /** Returns whether a symbol occurs free in an expression. */
  public static boolean occursFree(Expr.Exp exp, Expr.Symbol symbol) {
    if (!exp.has(symbol)) {
      return false;
    }
    return freeSymbols(exp).contains(symbol);
  }

  /** Returns whether none of the given symbols occurs free in an
   * expression. */
  public static boolean isIndependent(Expr.Exp exp,
      Collection<? extends Expr.Symbol> symbols) {
    for (Expr.Symbol symbol : symbols) {
      if (occursFree(exp, symbol)) {
        return false;
      }
    }
    return true;
  }

  private static void find(Expr.Exp exp, Consumer<Expr.Symbol> consumer) {
    final Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(exp, ImmutableSet.of()));
    while (!stack.isEmpty()) {
      final Frame frame = stack.pop();
      final Expr.Exp e = frame.exp;
      switch (e.op) {
      case SYMBOL:
        if (!frame.bound.contains(e)) {
          consumer.accept((Expr.Symbol) e);
        }
        break;
      case CONDITION_SET:
        final Expr.ConditionSet conditionSet = (Expr.ConditionSet) e;
        stack.push(new Frame(conditionSet.base, frame.bound));
        stack.push(
            new Frame(conditionSet.condition,
                plus(frame.bound, conditionSet.variable)));
        break;
      case BINDER:
        final Expr.Binder binder = (Expr.Binder) e;
        ImmutableSet<Expr.Symbol> bound = frame.bound;
        for (Limit limit : binder.limits) {
          for (Expr.Exp x : limit.expressions()) {
            stack.push(new Frame(x, bound));
          }
          bound = plus(bound, limit.variable);
        }
        stack.push(new Frame(binder.function, bound));
        break;
      default:
        final List<Expr.Exp> args = e.args();
        for (Expr.Exp arg : args) {
          stack.push(new Frame(arg, frame.bound));
        }
      }
    }
  }

  private static ImmutableSet<Expr.Symbol> plus(Set<Expr.Symbol> set,
      Expr.Symbol symbol) {
    return ImmutableSet.<Expr.Symbol>builder().addAll(set).add(symbol)
        .build();
  }

  /** Expression to visit, and the symbols bound at that point. */
  private static class Frame {
    final Expr.Exp exp;
    final ImmutableSet<Expr.Symbol> bound;

    Frame(Expr.Exp exp, ImmutableSet<Expr.Symbol> bound) {
      this.exp = exp;
      this.bound = bound;
    }
  }
}

// End FreeFinder.java
