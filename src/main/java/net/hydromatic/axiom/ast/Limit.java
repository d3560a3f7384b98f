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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.axiom.ast.ExprBuilder.ex;

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import net.hydromatic.axiom.rewrite.Domains;
import net.hydromatic.axiom.rewrite.Facts;
import net.hydromatic.axiom.rewrite.Sets;
import net.hydromatic.axiom.type.DType;
import net.hydromatic.axiom.type.Sign;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Variable and the domain over which a binder ranges it.
 *
 * <p>A limit has one of three forms: unconstrained {@code (x)}, which ranges
 * over the variable's own domain; interval {@code (x, lower, upper)}, with
 * both bounds inclusive; explicit set {@code (x, set)}. The factory methods
 * normalize, so that equal domains give equal limits: an integer interval,
 * or a closed interval of a non-integer variable, becomes the interval form,
 * and a set equal to the variable's own domain becomes the unconstrained
 * form.
 */
public final class Limit {
  public final Expr.Symbol variable;
  public final Expr.@Nullable Exp lower;
  public final Expr.@Nullable Exp upper;
  public final Expr.@Nullable Exp set;

  private Limit(Expr.Symbol variable, Expr.@Nullable Exp lower,
      Expr.@Nullable Exp upper, Expr.@Nullable Exp set) {
    this.variable = requireNonNull(variable);
    this.lower = lower;
    this.upper = upper;
    this.set = set;
  }

  /** Creates an unconstrained limit. */
  public static Limit of(Expr.Symbol variable) {
    return new Limit(variable, null, null, null);
  }

  /** Creates a limit over an interval, both bounds inclusive. */
  public static Limit of(Expr.Symbol variable, Expr.Exp lower,
      Expr.Exp upper) {
    checkArgument(lower.dtype().isNumeric() && upper.dtype().isNumeric(),
        "bounds of %s must be numeric: %s, %s", variable, lower, upper);
    checkArgument(lower.shape().isEmpty() && upper.shape().isEmpty(),
        "bounds of %s must be scalar", variable);
    final Sign sign = Facts.sign(ex.sub(upper, lower));
    if (sign != null && sign.isNonNegative()) {
      checkArgument(
          !outside(variable, lower) && !outside(variable, upper),
          "bounds [%s, %s] lie outside the domain of %s", lower, upper,
          variable);
    }
    if (ex.interval(lower, upper, false, false,
            variable.dtype() == DType.INTEGER)
        .equals(variable.domain())) {
      return of(variable);
    }
    return new Limit(variable, lower, upper, null);
  }

  /** Returns whether a finite bound is provably outside the domain of a
   * variable. */
  private static boolean outside(Expr.Symbol variable, Expr.Exp bound) {
    return bound.op != Op.INFINITY
        && bound.op != Op.NEGATIVE_INFINITY
        && Boolean.FALSE.equals(Sets.contains(variable.domain(), bound));
  }

  /** Creates a limit over a set. */
  public static Limit of(Expr.Symbol variable, Expr.Exp set) {
    checkArgument(set.isSet(), "domain of %s must be a set: %s", variable,
        set);
    if (set.op == Op.FINITE_SET) {
      for (Expr.Exp e : set.args()) {
        checkArgument(variable.dtype().contains(e.dtype()),
            "element %s of domain does not have the type %s of %s", e,
            variable.dtype(), variable);
      }
    }
    if (set.op == Op.UNIVERSAL_SET || set.equals(variable.domain())) {
      return of(variable);
    }
    if (set.op == Op.INTERVAL && variable.dtype() == DType.INTEGER) {
      Expr.Exp s = set;
      if (!((Expr.Interval) s).integer) {
        s = ex.intersection(s, variable.domain());
      }
      if (s.op == Op.INTERVAL && ((Expr.Interval) s).integer) {
        final Expr.Interval interval = (Expr.Interval) s;
        return of(variable, interval.lower, interval.upper);
      }
      return new Limit(variable, null, null, s);
    }
    if (set.op == Op.INTERVAL) {
      final Expr.Interval interval = (Expr.Interval) set;
      if (!interval.integer && !interval.leftOpen && !interval.rightOpen
          && !outside(variable, interval.lower)
          && !outside(variable, interval.upper)) {
        return of(variable, interval.lower, interval.upper);
      }
    }
    return new Limit(variable, null, null, set);
  }

  /** Creates a limit over the values of a variable that satisfy a
   * condition. */
  public static Limit where(Expr.Symbol variable, Expr.Exp condition) {
    checkArgument(condition.isBoolean(), "not a condition: %s", condition);
    Expr.Exp set = Domains.domainConditioned(variable, condition);
    if (set == null) {
      set = ex.conditionSet(variable, condition, variable.domain());
    }
    return of(variable, set);
  }

  public boolean isUnconstrained() {
    return lower == null && set == null;
  }

  public boolean isInterval() {
    return lower != null;
  }

  public boolean isSet() {
    return set != null;
  }

  /** Returns whether the bounds of an interval limit are provably in
   * order, allowing the empty integer range whose upper bound is one less
   * than its lower bound. Always true for the other forms. */
  public boolean isOriented() {
    if (lower == null || upper == null) {
      return true;
    }
    final Expr.Exp diff = variable.dtype() == DType.INTEGER
        ? ex.add(ex.sub(upper, lower), ex.one())
        : ex.sub(upper, lower);
    final Sign sign = Facts.sign(diff);
    return sign != null && sign.isNonNegative();
  }

  /** Returns the bounds or set, whichever this limit has. */
  public ImmutableList<Expr.Exp> expressions() {
    if (lower != null && upper != null) {
      return ImmutableList.of(lower, upper);
    }
    if (set != null) {
      return ImmutableList.of(set);
    }
    return ImmutableList.of();
  }

  /** Returns the domain as a set. */
  public Expr.Exp domain() {
    if (set != null) {
      return set;
    }
    if (lower != null && upper != null) {
      return ex.interval(lower, upper, false, false,
          variable.dtype() == DType.INTEGER);
    }
    return variable.domain();
  }

  /** Returns the number of values in the domain, or infinity, or
   * undefined if unknown. For an interval this is {@code upper - lower + 1},
   * which is negative for a reversed interval. */
  public Expr.Exp extent() {
    if (lower != null && upper != null) {
      if (lower.op == Op.NEGATIVE_INFINITY || upper.op == Op.INFINITY) {
        return ex.infinity();
      }
      return ex.add(ex.sub(upper, lower), ex.one());
    }
    final Expr.@Nullable Exp size = Sets.size(domain());
    return size != null ? size : ex.undefined();
  }

  /** Returns a limit with different variable and bounds, or this limit if
   * nothing changed. */
  public Limit copy(Expr.Symbol variable, Expr.@Nullable Exp lower,
      Expr.@Nullable Exp upper, Expr.@Nullable Exp set) {
    if (variable == this.variable
        && lower == this.lower
        && upper == this.upper
        && set == this.set) {
      return this;
    }
    if (set != null) {
      return of(variable, set);
    }
    if (lower != null && upper != null) {
      return of(variable, lower, upper);
    }
    return of(variable);
  }

  void unparse(ExprWriter w) {
    w.append(variable, 0, 0);
    if (lower != null && upper != null) {
      w.append(":").append(lower, 0, 0).append(":").append(upper, 0, 0);
    } else if (set != null) {
      w.append(":").append(set, 0, 0);
    }
  }

  @Override public int hashCode() {
    return Objects.hash(variable, lower, upper, set);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Limit
        && variable.equals(((Limit) o).variable)
        && Objects.equals(lower, ((Limit) o).lower)
        && Objects.equals(upper, ((Limit) o).upper)
        && Objects.equals(set, ((Limit) o).set);
  }

  @Override public String toString() {
    final ExprWriter w = new ExprWriter();
    unparse(w);
    return w.toString();
  }
}

// End Limit.java
