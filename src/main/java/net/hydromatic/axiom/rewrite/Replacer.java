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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Limit;
import net.hydromatic.axiom.ast.Shuttle;

/** Replaces free occurrences of symbols with expressions.
 *
 * <p>Respects scope: a binder that rebinds a symbol hides it from the
 * replacement. Does not avoid capture, so the free symbols of the
 * replacements must not be bound anywhere in the expression; use
 * {@link Substituter} if they might be. */
public class Replacer extends Shuttle {
  protected final Map<Expr.Symbol, ? extends Expr.Exp> substitution;

  private Replacer(Map<Expr.Symbol, ? extends Expr.Exp> substitution) {
    this.substitution = requireNonNull(substitution);
  }

  /** Replaces symbols according to a map. */
  public static Expr.Exp replace(Expr.Exp exp,
      Map<Expr.Symbol, ? extends Expr.Exp> substitution) {
    if (substitution.isEmpty()) {
      return exp;
    }
    return exp.accept(new Replacer(substitution));
  }

  /** Replaces a symbol. */
  public static Expr.Exp replace(Expr.Exp exp, Expr.Symbol symbol,
      Expr.Exp replacement) {
    return replace(exp, ImmutableMap.of(symbol, replacement));
  }

  /** Replaces symbols in the bounds of a limit. */
  static Limit replace(Limit limit,
      Map<Expr.Symbol, ? extends Expr.Exp> substitution) {
    if (substitution.isEmpty()) {
      return limit;
    }
    final Replacer replacer = new Replacer(substitution);
    return limit.copy(limit.variable,
        limit.lower == null ? null : limit.lower.accept(replacer),
        limit.upper == null ? null : limit.upper.accept(replacer),
        limit.set == null ? null : limit.set.accept(replacer));
  }

  @Override protected Expr.Exp visit(Expr.Symbol symbol) {
    final Expr.Exp exp = substitution.get(symbol);
    return exp != null ? exp : symbol;
  }

  @Override protected Expr.Exp visit(Expr.ConditionSet conditionSet) {
    if (!substitution.containsKey(conditionSet.variable)) {
      return conditionSet.copy(conditionSet.variable,
          conditionSet.condition.accept(this),
          conditionSet.base.accept(this));
    }
    final Map<Expr.Symbol, Expr.Exp> inner = new HashMap<>(substitution);
    inner.remove(conditionSet.variable);
    return conditionSet.copy(conditionSet.variable,
        replace(conditionSet.condition, inner),
        conditionSet.base.accept(this));
  }

  @Override protected Expr.Exp visit(Expr.Binder binder) {
    final Map<Expr.Symbol, Expr.Exp> scope = new HashMap<>(substitution);
    final List<Limit> limits = new ArrayList<>();
    for (Limit limit : binder.limits) {
      limits.add(replace(limit, scope));
      scope.remove(limit.variable);
    }
    return binder.copy(replace(binder.function, scope), limits);
  }
}

// End Replacer.java
