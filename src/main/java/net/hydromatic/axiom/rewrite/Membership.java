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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Limit;
import net.hydromatic.axiom.ast.Op;
import net.hydromatic.axiom.ast.Variant;
import net.hydromatic.axiom.type.Assumptions;
import net.hydromatic.axiom.type.DType;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rewrites membership predicates: {@code x ∈ S}, {@code x ∉ S} and
 * {@code A ⊆ B}. */
public abstract class Membership {
  private Membership() {}

  /** Simplifies a membership predicate, or returns any other expression
   * unchanged. */
  public static Expr.Exp simplify(Expr.Exp e) {
    switch (e.op) {
    case CONTAINS:
      return contains(e.args().get(0), e.args().get(1));
    case NOT_CONTAINS:
      return ex.not(contains(e.args().get(0), e.args().get(1)));
    case SUBSET:
      return subset(e.args().get(0), e.args().get(1));
    default:
      return e;
    }
  }

  /** Rewrites {@code x ∈ set}. Decides it if possible; otherwise splits a
   * union into a disjunction, an intersection into a conjunction, and a
   * complement into a membership and a non-membership; turns membership in
   * a union comprehension into Exists and in an intersection comprehension
   * into ForAll; unfolds a set that has a definition; and turns membership
   * of a singleton into an equation. */
  public static Expr.Exp contains(Expr.Exp x, Expr.Exp set) {
    final Boolean decided = Sets.contains(set, x);
    if (decided != null) {
      return ex.bool(decided);
    }
    switch (set.op) {
    case FINITE_SET:
      final Expr.Exp element = Sets.singleton(set);
      return element != null ? ex.eq(x, element) : ex.contains(x, set);
    case UNION:
    case INTERSECTION:
      final List<Expr.Exp> list = new ArrayList<>();
      for (Expr.Exp arg : set.args()) {
        list.add(contains(x, arg));
      }
      return set.op == Op.UNION ? ex.or(list) : ex.and(list);
    case COMPLEMENT:
      return ex.and(contains(x, set.args().get(0)),
          ex.not(contains(x, set.args().get(1))));
    case CONDITION_SET:
      final Expr.ConditionSet conditionSet = (Expr.ConditionSet) set;
      return ex.and(contains(x, conditionSet.base),
          Substituter.substitute(conditionSet.condition,
              conditionSet.variable, x));
    case SYMBOL:
      final Expr.Exp definition = ((Expr.Symbol) set).definition();
      return definition != null
          ? contains(x, definition)
          : ex.contains(x, set);
    case BINDER:
      final Expr.Binder binder = (Expr.Binder) set;
      if (binder.variant == Variant.UNION
          || binder.variant == Variant.INTERSECTION) {
        final Expr.Binder b = apart(binder, FreeFinder.freeSymbols(x));
        return ex.bind(
            binder.variant == Variant.UNION ? Variant.EXISTS
                : Variant.FOR_ALL,
            contains(x, b.function), b.limits);
      }
      return ex.contains(x, set);
    default:
      return ex.contains(x, set);
    }
  }

  /** Rewrites {@code a ⊆ b}. Decides it if possible; otherwise turns it into
   * a conjunction of memberships if {@code a} is finite, a conjunction of
   * subsets if {@code a} is a union or {@code b} an intersection, and a
   * ForAll if {@code a} is a union comprehension or {@code b} an
   * intersection comprehension. */
  public static Expr.Exp subset(Expr.Exp a, Expr.Exp b) {
    final Boolean decided = Sets.isSubset(a, b);
    if (decided != null) {
      return ex.bool(decided);
    }
    final List<Expr.Exp> list = new ArrayList<>();
    if (a.op == Op.FINITE_SET) {
      for (Expr.Exp e : a.args()) {
        list.add(contains(e, b));
      }
      return ex.and(list);
    }
    if (a.op == Op.UNION) {
      for (Expr.Exp arg : a.args()) {
        list.add(subset(arg, b));
      }
      return ex.and(list);
    }
    if (b.op == Op.INTERSECTION) {
      for (Expr.Exp arg : b.args()) {
        list.add(subset(a, arg));
      }
      return ex.and(list);
    }
    if (isComprehension(a, Variant.UNION)) {
      final Expr.Binder binder =
          apart((Expr.Binder) a, FreeFinder.freeSymbols(b));
      return ex.bind(Variant.FOR_ALL, subset(binder.function, b),
          binder.limits);
    }
    if (isComprehension(b, Variant.INTERSECTION)) {
      final Expr.Binder binder =
          apart((Expr.Binder) b, FreeFinder.freeSymbols(a));
      return ex.bind(Variant.FOR_ALL, subset(a, binder.function),
          binder.limits);
    }
    return ex.subset(a, b);
  }

  /** Returns the definition of {@code a ⊆ b}: {@code ForAll[e:a](e ∈ b)}. */
  public static Expr.Exp definition(Expr.Exp subset) {
    checkArgument(subset.op == Op.SUBSET, "not a subset predicate: %s",
        subset);
    final Expr.Exp a = subset.args().get(0);
    final Expr.Exp b = subset.args().get(1);
    final Expr.Symbol e =
        ex.symbol(NameGenerator.avoiding(a, b).get(elementType(a)),
            Assumptions.of(elementType(a)));
    return ex.bind(Variant.FOR_ALL, ex.contains(e, b), Limit.of(e, a));
  }

  /** Converts membership in a finite set whose elements are distinct into an
   * arithmetic indicator: a sum of Kronecker deltas, or one minus that sum
   * for non-membership. Returns null if not possible. */
  public static Expr.@Nullable Exp asKroneckerDelta(Expr.Exp e) {
    if (e.op != Op.CONTAINS && e.op != Op.NOT_CONTAINS) {
      return null;
    }
    final Expr.Exp x = e.args().get(0);
    final Expr.Exp set = e.args().get(1);
    if (set.op != Op.FINITE_SET || Sets.size(set) == null) {
      return null;
    }
    final List<Expr.Exp> terms = new ArrayList<>();
    for (Expr.Exp element : set.args()) {
      terms.add(ex.kroneckerDelta(x, element));
    }
    final Expr.Exp sum = ex.add(terms);
    return e.op == Op.CONTAINS ? sum : ex.sub(ex.one(), sum);
  }

  /** Returns the element type of a set. */
  static DType elementType(Expr.Exp set) {
    switch (set.op) {
    case INTERVAL:
      return ((Expr.Interval) set).elementType();
    case FINITE_SET:
      DType t = set.args().get(0).dtype();
      for (Expr.Exp arg : set.args()) {
        t = t.join(arg.dtype());
      }
      return t;
    case CONDITION_SET:
      return ((Expr.ConditionSet) set).variable.dtype();
    case UNION:
    case INTERSECTION:
    case COMPLEMENT:
      return elementType(set.args().get(0));
    default:
      return DType.REAL;
    }
  }

  private static boolean isComprehension(Expr.Exp e, Variant variant) {
    return e instanceof Expr.Binder && ((Expr.Binder) e).variant == variant;
  }

  /** Renames the variables of a binder that are in a given set. */
  private static Expr.Binder apart(Expr.Binder binder,
      Set<Expr.Symbol> symbols) {
    Expr.Binder b = binder;
    for (Expr.Symbol v : binder.variables()) {
      if (symbols.contains(v)) {
        b = Binders.renameBound(b, v, ex.dummy(v));
      }
    }
    return b;
  }
}

// End Membership.java
