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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Op;
import net.hydromatic.axiom.type.DType;
import net.hydromatic.axiom.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Derives the set of values of a variable from conditions on it. */
public abstract class Domains {
  private Domains() {}

  /** Returns the set of values in the domain of {@code x} that satisfy a
   * condition, or null if the condition is not of a form that can be solved
   * for {@code x}.
   *
   * <p>Solves relations that are affine in {@code x}, membership of
   * {@code x} in a set, and conjunctions, disjunctions and negations of
   * these. */
  public static Expr.@Nullable Exp domainConditioned(Expr.Symbol x,
      Expr.Exp condition) {
    final Expr.Exp set = solve(x, condition);
    return set == null ? null : ex.intersection(set, x.domain());
  }

  private static Expr.@Nullable Exp solve(Expr.Symbol x, Expr.Exp condition) {
    if (condition.isTrue()) {
      return x.domain();
    }
    if (condition.isFalse()) {
      return ex.emptySet();
    }
    if (!FreeFinder.occursFree(condition, x)) {
      return null;
    }
    switch (condition.op) {
    case AND:
    case OR:
      final List<Expr.Exp> sets = new ArrayList<>();
      for (Expr.Exp arg : condition.args()) {
        final Expr.Exp set = solve(x, arg);
        if (set == null) {
          return null;
        }
        sets.add(set);
      }
      return condition.op == Op.AND
          ? ex.intersection(sets)
          : ex.union(sets);
    case NOT:
      final Expr.Exp set = solve(x, condition.args().get(0));
      return set == null ? null : ex.complement(x.domain(), set);
    case CONTAINS:
    case NOT_CONTAINS:
      final Expr.Exp element = condition.args().get(0);
      final Expr.Exp s = condition.args().get(1);
      if (!element.equals(x) || FreeFinder.occursFree(s, x)) {
        return null;
      }
      return condition.op == Op.CONTAINS
          ? ex.intersection(s, x.domain())
          : ex.complement(x.domain(), s);
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      return solveRelation(x, condition.op, condition.args().get(0),
          condition.args().get(1));
    default:
      return null;
    }
  }

  /** Solves {@code a op b} for {@code x}, where {@code a - b} is affine in
   * {@code x} with a numeric slope. */
  private static Expr.@Nullable Exp solveRelation(Expr.Symbol x, Op op,
      Expr.Exp a, Expr.Exp b) {
    if (!a.dtype().isNumeric()) {
      return null;
    }
    final Polynomials.Affine affine = Polynomials.affine(ex.sub(a, b), x);
    if (affine == null) {
      return null;
    }
    final Rational slope = affine.slope.numberValue();
    if (slope == null) {
      return null;
    }
    if (slope.signum() < 0) {
      op = op.reverse();
    }
    final Expr.Exp root = affine.root();
    final boolean integer = x.dtype() == DType.INTEGER;
    final Expr.Exp negativeInfinity = ex.negativeInfinity();
    final Expr.Exp infinity = ex.infinity();
    switch (op) {
    case EQ:
      return ex.finiteSet(root);
    case NE:
      return ex.complement(x.domain(), ex.finiteSet(root));
    case LT:
      return ex.interval(negativeInfinity, root, true, true, integer);
    case LE:
      return ex.interval(negativeInfinity, root, true, false, integer);
    case GT:
      return ex.interval(root, infinity, true, true, integer);
    case GE:
      return ex.interval(root, infinity, false, true, integer);
    default:
      throw new AssertionError(op);
    }
  }

  /** Returns a set that contains every value of {@code x} at which
   * {@code f} may differ from {@code identity}, or null if none can be
   * derived. Points outside the set are points where {@code f} is
   * certainly equal to {@code identity}. */
  public static Expr.@Nullable Exp nonIdentity(Expr.Exp f, Expr.Symbol x,
      Expr.Exp identity) {
    if (!FreeFinder.occursFree(f, x)) {
      return null;
    }
    switch (f.op) {
    case PIECEWISE:
      final List<Expr.Exp> args = f.args();
      final List<Expr.Exp> conditions = new ArrayList<>();
      final List<Expr.Exp> previous = new ArrayList<>();
      for (int i = 0; i < args.size(); i += 2) {
        final Expr.Exp value = args.get(i);
        final Expr.Exp condition = args.get(i + 1);
        if (!value.equals(identity)) {
          final List<Expr.Exp> terms = new ArrayList<>(previous);
          terms.add(condition);
          conditions.add(ex.and(terms));
        }
        previous.add(ex.not(condition));
      }
      return domainConditioned(x, ex.or(conditions));
    case KRONECKER_DELTA:
      return identity.equals(ex.zero())
          ? domainConditioned(x, ex.eq(f.args().get(0), f.args().get(1)))
          : null;
    case MUL:
      return identity.equals(ex.zero())
          ? intersectKnown(f.args(), arg -> nonIdentity(arg, x, identity))
          : null;
    case AND:
      // Exists: true only where every conjunct is true
      return identity.isFalse()
          ? intersectKnown(f.args(), arg -> solveOrNull(x, arg))
          : solveOrNull(x, ex.not(f));
    case OR:
      // ForAll: false only where every disjunct is false
      return identity.isTrue()
          ? intersectKnown(f.args(), arg -> solveOrNull(x, ex.not(arg)))
          : solveOrNull(x, f);
    default:
      if (f.isBoolean()) {
        return identity.isTrue() ? solveOrNull(x, ex.not(f))
            : identity.isFalse() ? solveOrNull(x, f)
            : null;
      }
      return null;
    }
  }

  private static Expr.@Nullable Exp solveOrNull(Expr.Symbol x,
      Expr.Exp condition) {
    return FreeFinder.occursFree(condition, x)
        ? domainConditioned(x, condition)
        : null;
  }

  /** Intersects the sets that a function returns for each argument,
   * ignoring arguments for which it returns null. Returns null if it
   * returns null for every argument. */
  private static Expr.@Nullable Exp intersectKnown(List<Expr.Exp> args,
      Function<Expr.Exp, Expr.@Nullable Exp> f) {
    final List<Expr.Exp> sets = new ArrayList<>();
    for (Expr.Exp arg : args) {
      final Expr.Exp set = f.apply(arg);
      if (set != null) {
        sets.add(set);
      }
    }
    return sets.isEmpty() ? null : ex.intersection(sets);
  }
}

// End Domains.java
