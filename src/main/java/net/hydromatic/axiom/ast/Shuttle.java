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

import java.util.ArrayList;
import java.util.List;

/** Visits and transforms expression trees.
 *
 * <p>The default implementation of each method rebuilds a node from its
 * transformed children, returning the original node if no child changed. */
public class Shuttle {
  protected List<Expr.Exp> visitList(List<Expr.Exp> nodes) {
    final List<Expr.Exp> list = new ArrayList<>();
    for (Expr.Exp node : nodes) {
      list.add(node.accept(this));
    }
    return list;
  }

  protected Limit visit(Limit limit) {
    final Expr.Exp variable = limit.variable.accept(this);
    if (!(variable instanceof Expr.Symbol)) {
      return limit;
    }
    return limit.copy((Expr.Symbol) variable,
        limit.lower == null ? null : limit.lower.accept(this),
        limit.upper == null ? null : limit.upper.accept(this),
        limit.set == null ? null : limit.set.accept(this));
  }

  protected Expr.Exp visit(Expr.Symbol symbol) {
    return symbol; // leaf
  }

  protected Expr.Exp visit(Expr.Number number) {
    return number; // leaf
  }

  protected Expr.Exp visit(Expr.Atom atom) {
    return atom; // leaf
  }

  protected Expr.Exp visit(Expr.Call call) {
    return call.copy(visitList(call.args));
  }

  protected Expr.Exp visit(Expr.Apply apply) {
    return apply.copy(visitList(apply.args));
  }

  protected Expr.Exp visit(Expr.Interval interval) {
    return interval.copy(interval.lower.accept(this),
        interval.upper.accept(this));
  }

  protected Expr.Exp visit(Expr.ConditionSet conditionSet) {
    final Expr.Exp variable = conditionSet.variable.accept(this);
    return conditionSet.copy(
        variable instanceof Expr.Symbol
            ? (Expr.Symbol) variable
            : conditionSet.variable,
        conditionSet.condition.accept(this),
        conditionSet.base.accept(this));
  }

  protected Expr.Exp visit(Expr.Binder binder) {
    final List<Limit> limits = new ArrayList<>();
    for (Limit limit : binder.limits) {
      limits.add(visit(limit));
    }
    return binder.copy(binder.function.accept(this), limits);
  }
}

// End Shuttle.java
