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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.axiom.ast.ExprBuilder.ex;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Limit;
import net.hydromatic.axiom.ast.Op;
import net.hydromatic.axiom.ast.Shuttle;
import net.hydromatic.axiom.ast.Variant;
import net.hydromatic.axiom.type.DType;
import net.hydromatic.axiom.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Capture-avoiding substitution.
 *
 * <p>Replaces every free occurrence of an expression {@code old} with
 * {@code replacement}. Before descending into a binder whose variable occurs
 * free in {@code replacement}, or which rebinds {@code old}, renames that
 * variable to a dummy; afterwards renames it back if the original name is
 * still available.
 *
 * <p>Substituting for the variable that the outermost binder binds has a
 * different meaning: a change of variable. See
 * {@link #substitute(Session, Expr.Exp, Expr.Exp, Expr.Exp)}.
 */
public class Substituter extends Shuttle {
  private final Expr.Exp old;
  private final Expr.Exp replacement;
  private final ImmutableSet<Expr.Symbol> oldSymbols;
  private final ImmutableSet<Expr.Symbol> replacementSymbols;

  private Substituter(Expr.Exp old, Expr.Exp replacement) {
    this.old = requireNonNull(old);
    this.replacement = requireNonNull(replacement);
    this.oldSymbols = FreeFinder.freeSymbols(old);
    this.replacementSymbols = FreeFinder.freeSymbols(replacement);
  }

  /** Substitutes using a default session. */
  public static Expr.Exp substitute(Expr.Exp e, Expr.Exp old,
      Expr.Exp replacement) {
    return substitute(Session.create(), e, old, replacement);
  }

  /** Substitutes {@code replacement} for {@code old} in {@code e}.
   *
   * <p>If {@code e} is a binder and {@code old} is one of its variables:
   *
   * <ul>
   * <li>if {@code replacement} is a symbol not free in {@code e}, renames the
   * variable, keeping its domain;
   * <li>if {@code replacement} is {@code a * old + k} for a number
   * {@code a} (which must be 1 or -1 if the variable is an integer), changes
   * the variable, transforming the function and the domain;
   * <li>if {@code replacement} does not contain {@code old} and the limit is
   * unconstrained, removes the limit and substitutes into the function;
   * <li>otherwise returns {@code e} unchanged.
   * </ul>
   *
   * @throws RewriteException if {@code e} is nested deeper than
   *   {@link Prop#MAX_DEPTH}
   */
  public static Expr.Exp substitute(Session session, Expr.Exp e,
      Expr.Exp old, Expr.Exp replacement) {
    final int maxDepth = Prop.MAX_DEPTH.intValue(session.map);
    if (Binders.depth(e) > maxDepth) {
      throw new RewriteException("expression is nested deeper than "
          + maxDepth, e);
    }
    final Expr.Exp result;
    if (e instanceof Expr.Binder && ((Expr.Binder) e).indexOf(old) >= 0) {
      final Expr.Binder binder = (Expr.Binder) e;
      result = new Substituter(old, replacement)
          .changeVariable(binder, binder.indexOf(old));
    } else {
      result = e.accept(new Substituter(old, replacement));
    }
    if (!result.equals(e)) {
      session.tracer.onSubstitute(e, old, replacement, result);
    }
    return result;
  }

  /** Substitutes a value for the variable of limit {@code i} and removes
   * that limit. The value is in the scope of the earlier limits, so it may
   * reference their variables. */
  static Expr.Exp instantiate(Expr.Binder binder, int i, Expr.Exp value) {
    final Limit limit = binder.limits.get(i);
    final Substituter substituter = new Substituter(limit.variable, value);
    final Map<Expr.Symbol, Expr.Symbol> renames = new LinkedHashMap<>();
    final Expr.Binder b = substituter.renameApart(binder, i, true, renames);
    final List<Limit> limits = new ArrayList<>();
    for (int j = 0; j < b.limits.size(); j++) {
      if (j < i) {
        limits.add(b.limits.get(j));
      } else if (j > i) {
        limits.add(substituter.visit(b.limits.get(j)));
      }
    }
    final Expr.Exp result =
        ex.bind(b.variant, b.function.accept(substituter), limits);
    return renameBack(result, renames);
  }

  @Override protected Expr.Exp visit(Expr.Symbol symbol) {
    return symbol.equals(old) ? replacement : symbol;
  }

  @Override protected Expr.Exp visit(Expr.Call call) {
    return call.equals(old) ? replacement : super.visit(call);
  }

  @Override protected Expr.Exp visit(Expr.Apply apply) {
    return apply.equals(old) ? replacement : super.visit(apply);
  }

  @Override protected Expr.Exp visit(Expr.ConditionSet conditionSet) {
    final Expr.Symbol variable = conditionSet.variable;
    final Expr.Exp base = conditionSet.base.accept(this);
    if (oldSymbols.contains(variable)) {
      return conditionSet.copy(variable, conditionSet.condition, base);
    }
    if (replacementSymbols.contains(variable)) {
      final Expr.Symbol dummy = ex.dummy(variable);
      final Expr.Exp condition =
          Replacer.replace(conditionSet.condition, variable, dummy)
              .accept(this);
      return ex.conditionSet(dummy, condition, base);
    }
    return conditionSet.copy(variable, conditionSet.condition.accept(this),
        base);
  }

  @Override protected Expr.Exp visit(Expr.Binder binder) {
    if (binder.equals(old)) {
      return replacement;
    }
    if (!binder.has(old)) {
      return binder;
    }
    final Map<Expr.Symbol, Expr.Symbol> renames = new LinkedHashMap<>();
    final Expr.Binder b = renameApart(binder, -1, false, renames);
    return renameBack(super.visit(b), renames);
  }

  /** Renames to dummies the variables of a binder that would capture a
   * symbol of the replacement, or that rebind a symbol of {@code old}.
   * Skips limit {@code skip}, and if {@code laterOnly}, the limits before
   * it. Records the renames. */
  private Expr.Binder renameApart(Expr.Binder binder, int skip,
      boolean laterOnly, Map<Expr.Symbol, Expr.Symbol> renames) {
    Expr.Binder b = binder;
    for (int j = laterOnly ? skip + 1 : 0; j < binder.limits.size(); j++) {
      final Expr.Symbol v = binder.limits.get(j).variable;
      if (j != skip
          && (replacementSymbols.contains(v) || oldSymbols.contains(v))) {
        final Expr.Symbol dummy = ex.dummy(v);
        b = Binders.renameBound(b, v, dummy);
        renames.put(v, dummy);
      }
    }
    return b;
  }

  /** Renames dummies back to their original names, if the result is still a
   * binder over them and the original names do not occur. */
  private static Expr.Exp renameBack(Expr.Exp e,
      Map<Expr.Symbol, Expr.Symbol> renames) {
    for (Map.Entry<Expr.Symbol, Expr.Symbol> entry : renames.entrySet()) {
      if (e instanceof Expr.Binder
          && ((Expr.Binder) e).indexOf(entry.getValue()) >= 0
          && !e.has(entry.getKey())) {
        e = Binders.renameBound((Expr.Binder) e, entry.getValue(),
            entry.getKey());
      }
    }
    return e;
  }

  /** Substitutes {@link #replacement} for the variable of limit {@code i}
   * of a binder. */
  private Expr.Exp changeVariable(Expr.Binder binder, int i) {
    final Limit limit = binder.limits.get(i);
    final Expr.Symbol x = limit.variable;
    if (replacement.equals(x)) {
      return binder;
    }
    checkArgument(replacement.shape().equals(x.shape()),
        "cannot substitute %s, of shape %s, for %s, of shape %s",
        replacement, replacement.shape(), x, x.shape());
    if (replacement instanceof Expr.Symbol) {
      final Expr.Symbol y = (Expr.Symbol) replacement;
      checkArgument(y.dtype() == x.dtype(),
          "cannot rename %s, of type %s, to %s, of type %s", x, x.dtype(),
          y, y.dtype());
      if (FreeFinder.occursFree(binder, y) || binder.indexOf(y) >= 0) {
        return binder;
      }
      return Binders.renameBound(binder, x, y);
    }
    if (!FreeFinder.occursFree(replacement, x)) {
      if (!limit.isUnconstrained()) {
        return binder;
      }
      checkArgument(x.dtype().contains(replacement.dtype()),
          "cannot substitute %s, of type %s, for %s, of type %s",
          replacement, replacement.dtype(), x, x.dtype());
      return instantiate(binder, i, replacement);
    }
    if (!binder.variant.allowsReindex()) {
      return binder;
    }
    final Polynomials.Affine affine = Polynomials.affine(replacement, x);
    if (affine == null) {
      return binder;
    }
    final Rational slope = affine.slope.numberValue();
    if (slope == null
        || x.dtype() == DType.INTEGER && !slope.abs().equals(Rational.ONE)) {
      return binder;
    }
    final Map<Expr.Symbol, Expr.Symbol> renames = new LinkedHashMap<>();
    final Expr.Binder b = renameApart(binder, i, false, renames);
    final Limit newLimit = image(b.limits.get(i), affine, slope);
    if (newLimit == null) {
      return binder;
    }
    // x_old = (x_new - k) / a
    final Substituter inverse =
        new Substituter(x, ex.div(ex.sub(x, affine.intercept), affine.slope));
    final List<Limit> limits = new ArrayList<>();
    for (int j = 0; j < b.limits.size(); j++) {
      limits.add(j < i ? b.limits.get(j)
          : j == i ? newLimit
          : inverse.visit(b.limits.get(j)));
    }
    Expr.Exp function = b.function.accept(inverse);
    if (b.variant == Variant.INTEGRAL) {
      function = ex.mul(function, ex.number(Rational.ONE.divide(slope.abs())));
    }
    return renameBack(ex.bind(b.variant, function, limits), renames);
  }

  /** Returns the limit over the image of a limit's domain under
   * {@code x -> slope * x + intercept}, or null if it cannot be
   * expressed. */
  private static @Nullable Limit image(Limit limit,
      Polynomials.Affine affine, Rational slope) {
    final Expr.Symbol x = limit.variable;
    final boolean reverse = slope.signum() < 0;
    if (limit.lower != null && limit.upper != null) {
      final Expr.Exp lower = map(affine, limit.lower);
      final Expr.Exp upper = map(affine, limit.upper);
      final Expr.Exp newLower = reverse ? upper : lower;
      final Expr.Exp newUpper = reverse ? lower : upper;
      if (outside(x, newLower) || outside(x, newUpper)) {
        return null;
      }
      return Limit.of(x, newLower, newUpper);
    }
    final Expr.Exp domain = limit.domain();
    switch (domain.op) {
    case UNIVERSAL_SET:
      return limit;
    case INTERVAL:
      final Expr.Interval interval = (Expr.Interval) domain;
      if (interval.lower.op == Op.NEGATIVE_INFINITY
          && interval.upper.op == Op.INFINITY) {
        return limit;
      }
      final Expr.Exp lower = map(affine, interval.lower);
      final Expr.Exp upper = map(affine, interval.upper);
      final Expr.Exp set = reverse
          ? ex.interval(upper, lower, interval.rightOpen, interval.leftOpen,
              interval.integer)
          : ex.interval(lower, upper, interval.leftOpen, interval.rightOpen,
              interval.integer);
      return imageLimit(x, set);
    case FINITE_SET:
      final List<Expr.Exp> elements = new ArrayList<>();
      for (Expr.Exp e : domain.args()) {
        elements.add(map(affine, e));
      }
      return imageLimit(x, ex.finiteSet(elements));
    default:
      return null;
    }
  }

  private static @Nullable Limit imageLimit(Expr.Symbol x, Expr.Exp set) {
    if (!Boolean.TRUE.equals(Sets.isSubset(set, x.domain()))) {
      return null;
    }
    return Limit.of(x, set);
  }

  private static Expr.Exp map(Polynomials.Affine affine, Expr.Exp e) {
    return ex.add(ex.mul(affine.slope, e), affine.intercept);
  }

  private static boolean outside(Expr.Symbol x, Expr.Exp bound) {
    return bound.op != Op.INFINITY
        && bound.op != Op.NEGATIVE_INFINITY
        && Boolean.FALSE.equals(Sets.contains(x.domain(), bound));
  }
}

// End Substituter.java
