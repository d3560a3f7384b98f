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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Op;
import net.hydromatic.axiom.type.DType;
import net.hydromatic.axiom.type.Sign;
import net.hydromatic.axiom.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Decides questions about sets.
 *
 * <p>Each method returns null if it cannot decide. */
public abstract class Sets {
  private Sets() {}

  /** Returns whether a set contains an element. */
  public static @Nullable Boolean contains(Expr.Exp set, Expr.Exp e) {
    if (e instanceof Expr.Symbol && ((Expr.Symbol) e).domain().equals(set)) {
      return true;
    }
    switch (set.op) {
    case EMPTY_SET:
      return false;
    case UNIVERSAL_SET:
      return true;
    case FINITE_SET:
      boolean allDistinct = true;
      for (Expr.Exp element : set.args()) {
        if (element.equals(e)) {
          return true;
        }
        if (!ex.eq(element, e).isFalse()) {
          allDistinct = false;
        }
      }
      return allDistinct ? Boolean.FALSE : null;
    case INTERVAL:
      return intervalContains((Expr.Interval) set, e);
    case UNION:
      boolean allFalse = true;
      for (Expr.Exp arg : set.args()) {
        final Boolean b = contains(arg, e);
        if (Boolean.TRUE.equals(b)) {
          return true;
        }
        if (b == null) {
          allFalse = false;
        }
      }
      return allFalse ? Boolean.FALSE : null;
    case INTERSECTION:
      boolean allTrue = true;
      for (Expr.Exp arg : set.args()) {
        final Boolean b = contains(arg, e);
        if (Boolean.FALSE.equals(b)) {
          return false;
        }
        if (b == null) {
          allTrue = false;
        }
      }
      return allTrue ? Boolean.TRUE : null;
    case COMPLEMENT:
      final Boolean inA = contains(set.args().get(0), e);
      final Boolean inB = contains(set.args().get(1), e);
      if (Boolean.FALSE.equals(inA) || Boolean.TRUE.equals(inB)) {
        return false;
      }
      if (Boolean.TRUE.equals(inA) && Boolean.FALSE.equals(inB)) {
        return true;
      }
      return null;
    case CONDITION_SET:
      final Expr.ConditionSet conditionSet = (Expr.ConditionSet) set;
      final Boolean inBase = contains(conditionSet.base, e);
      if (Boolean.FALSE.equals(inBase)) {
        return false;
      }
      final Expr.Exp condition =
          Substituter.substitute(conditionSet.condition,
              conditionSet.variable, e);
      if (condition.isFalse()) {
        return false;
      }
      if (condition.isTrue() && Boolean.TRUE.equals(inBase)) {
        return true;
      }
      return null;
    default:
      return null;
    }
  }

  private static @Nullable Boolean intervalContains(Expr.Interval interval,
      Expr.Exp e) {
    if (!e.dtype().isNumeric()
        || e.op == Op.INFINITY
        || e.op == Op.NEGATIVE_INFINITY) {
      return e.op == Op.UNDEFINED ? null : Boolean.FALSE;
    }
    final Rational value = e.numberValue();
    if (interval.integer && value != null && !value.isInteger()) {
      return false;
    }
    final Expr.Exp low = interval.leftOpen
        ? ex.gt(e, interval.lower)
        : ex.ge(e, interval.lower);
    final Expr.Exp high = interval.rightOpen
        ? ex.lt(e, interval.upper)
        : ex.le(e, interval.upper);
    if (low.isFalse() || high.isFalse()) {
      return false;
    }
    if (low.isTrue() && high.isTrue()) {
      return !interval.integer || e.dtype() == DType.INTEGER
          ? Boolean.TRUE : null;
    }
    return null;
  }

  /** Returns whether every element of {@code a} is an element of
   * {@code b}. */
  public static @Nullable Boolean isSubset(Expr.Exp a, Expr.Exp b) {
    if (a.equals(b) || a.op == Op.EMPTY_SET || b.op == Op.UNIVERSAL_SET) {
      return true;
    }
    if (b.op == Op.EMPTY_SET) {
      return isEmpty(a);
    }
    switch (a.op) {
    case FINITE_SET:
      return all(a.args(), e -> contains(b, e));
    case UNION:
      return all(a.args(), e -> isSubset(e, b));
    case INTERSECTION:
      for (Expr.Exp arg : a.args()) {
        if (Boolean.TRUE.equals(isSubset(arg, b))) {
          return true;
        }
      }
      break;
    case COMPLEMENT:
      if (Boolean.TRUE.equals(isSubset(a.args().get(0), b))) {
        return true;
      }
      break;
    case CONDITION_SET:
      if (Boolean.TRUE.equals(
          isSubset(((Expr.ConditionSet) a).base, b))) {
        return true;
      }
      break;
    default:
      break;
    }
    switch (b.op) {
    case INTERSECTION:
      return all(b.args(), e -> isSubset(a, e));
    case UNION:
      for (Expr.Exp arg : b.args()) {
        if (Boolean.TRUE.equals(isSubset(a, arg))) {
          return true;
        }
      }
      break;
    case COMPLEMENT:
      if (Boolean.TRUE.equals(isSubset(a, b.args().get(0)))
          && Boolean.TRUE.equals(
              isEmpty(ex.intersection(a, b.args().get(1))))) {
        return true;
      }
      break;
    default:
      break;
    }
    if (a.op == Op.INTERVAL && b.op == Op.INTERVAL) {
      return intervalSubset((Expr.Interval) a, (Expr.Interval) b);
    }
    if (a.op == Op.INTERVAL && b.op == Op.FINITE_SET
        && Boolean.FALSE.equals(isFinite(a))) {
      return false;
    }
    return null;
  }

  private static @Nullable Boolean intervalSubset(Expr.Interval a,
      Expr.Interval b) {
    if (!a.integer && b.integer) {
      return Boolean.FALSE.equals(isEmpty(a)) ? Boolean.FALSE : null;
    }
    final Boolean low = endWithin(a.lower, a.leftOpen && !a.integer,
        b.lower, b.leftOpen, 1);
    final Boolean high = endWithin(a.upper, a.rightOpen && !a.integer,
        b.upper, b.rightOpen, -1);
    if (Boolean.TRUE.equals(low) && Boolean.TRUE.equals(high)) {
      return true;
    }
    if ((Boolean.FALSE.equals(low) || Boolean.FALSE.equals(high))
        && Boolean.FALSE.equals(isEmpty(a))) {
      return false;
    }
    return null;
  }

  /** Returns whether an end of one interval lies within the corresponding
   * end of another. {@code direction} is 1 for lower ends, -1 for upper
   * ends. */
  private static @Nullable Boolean endWithin(Expr.Exp aEnd, boolean aOpen,
      Expr.Exp bEnd, boolean bOpen, int direction) {
    final Op bInfinite = direction > 0 ? Op.NEGATIVE_INFINITY : Op.INFINITY;
    if (bEnd.op == bInfinite) {
      return true;
    }
    if (aEnd.op == bInfinite) {
      return false;
    }
    Sign sign = Facts.sign(ex.sub(aEnd, bEnd));
    if (sign == null) {
      return null;
    }
    if (direction < 0) {
      sign = sign.negate();
    }
    if (sign == Sign.POSITIVE) {
      return true;
    }
    if (sign == Sign.ZERO) {
      return aOpen || !bOpen;
    }
    if (sign == Sign.NEGATIVE) {
      return false;
    }
    return sign == Sign.NONNEGATIVE && (aOpen || !bOpen) ? Boolean.TRUE
        : null;
  }

  /** Returns whether a set has no elements. */
  public static @Nullable Boolean isEmpty(Expr.Exp set) {
    switch (set.op) {
    case EMPTY_SET:
      return true;
    case UNIVERSAL_SET:
    case FINITE_SET:
      return false;
    case INTERVAL:
      final Expr.Interval interval = (Expr.Interval) set;
      final Sign sign = Facts.sign(ex.sub(interval.upper, interval.lower));
      if (sign == null) {
        return null;
      }
      if (sign == Sign.NEGATIVE) {
        return true;
      }
      if (sign == Sign.POSITIVE) {
        return interval.integer && (interval.leftOpen || interval.rightOpen)
            ? null : Boolean.FALSE;
      }
      if (sign == Sign.ZERO) {
        return interval.leftOpen || interval.rightOpen;
      }
      return sign == Sign.NONNEGATIVE
          && !interval.leftOpen && !interval.rightOpen ? Boolean.FALSE : null;
    case UNION:
      return all(set.args(), Sets::isEmpty);
    case COMPLEMENT:
      return Boolean.TRUE.equals(
          isSubset(set.args().get(0), set.args().get(1))) ? Boolean.TRUE
          : null;
    case INTERSECTION:
      for (Expr.Exp arg : set.args()) {
        if (Boolean.TRUE.equals(isEmpty(arg))) {
          return true;
        }
      }
      return null;
    case CONDITION_SET:
      return Boolean.TRUE.equals(isEmpty(((Expr.ConditionSet) set).base))
          ? Boolean.TRUE : null;
    default:
      return null;
    }
  }

  /** Returns the number of elements of a set, or null if unknown. The size
   * of an infinite set is {@code oo}. */
  public static Expr.@Nullable Exp size(Expr.Exp set) {
    switch (set.op) {
    case EMPTY_SET:
      return ex.zero();
    case UNIVERSAL_SET:
      return ex.infinity();
    case FINITE_SET:
      final List<Expr.Exp> args = set.args();
      for (int i = 0; i < args.size(); i++) {
        for (int j = i + 1; j < args.size(); j++) {
          if (!ex.eq(args.get(i), args.get(j)).isFalse()) {
            return null;
          }
        }
      }
      return ex.number(args.size());
    case INTERVAL:
      final Expr.Interval interval = (Expr.Interval) set;
      if (!interval.isBounded()) {
        return ex.infinity();
      }
      if (interval.integer) {
        final Expr.Exp n =
            ex.add(ex.sub(interval.upper, interval.lower), ex.one());
        final Sign sign = Facts.sign(n);
        return sign != null && sign.isNonNegative() ? n : null;
      }
      return Boolean.FALSE.equals(isEmpty(set)) ? ex.infinity() : null;
    default:
      return null;
    }
  }

  /** Returns whether a set is finite. */
  public static @Nullable Boolean isFinite(Expr.Exp set) {
    switch (set.op) {
    case EMPTY_SET:
    case FINITE_SET:
      return true;
    case UNIVERSAL_SET:
      return false;
    case INTERVAL:
      final Expr.Interval interval = (Expr.Interval) set;
      if (interval.integer) {
        return interval.isBounded();
      }
      return Boolean.FALSE.equals(isEmpty(set)) ? Boolean.FALSE : null;
    case UNION:
      return all(set.args(), Sets::isFinite);
    case INTERSECTION:
      // Finite if any argument is; otherwise undecidable in general.
      for (Expr.Exp arg : set.args()) {
        if (Boolean.TRUE.equals(isFinite(arg))) {
          return true;
        }
      }
      return null;
    case COMPLEMENT:
    case CONDITION_SET:
      return Boolean.TRUE.equals(isFinite(set.args().get(
          set.op == Op.COMPLEMENT ? 0 : 2))) ? Boolean.TRUE : null;
    default:
      return null;
    }
  }

  /** Returns the elements of a set that has at most {@code max} elements,
   * or null if the elements cannot be listed. The list may contain
   * symbolic elements that are equal. */
  public static @Nullable List<Expr.Exp> elements(Expr.Exp set, int max) {
    switch (set.op) {
    case EMPTY_SET:
      return ImmutableList.of();
    case FINITE_SET:
      return set.args().size() <= max ? set.args() : null;
    case INTERVAL:
      final Expr.Interval interval = (Expr.Interval) set;
      final Rational lower = interval.lower.numberValue();
      final Rational upper = interval.upper.numberValue();
      if (!interval.integer || lower == null || upper == null) {
        return null;
      }
      final Rational count = upper.subtract(lower).add(Rational.ONE);
      if (count.compareTo(Rational.of(max)) > 0) {
        return null;
      }
      final ImmutableList.Builder<Expr.Exp> b = ImmutableList.builder();
      for (Rational r = lower; r.compareTo(upper) <= 0;
           r = r.add(Rational.ONE)) {
        b.add(ex.number(r));
      }
      return b.build();
    default:
      return null;
    }
  }

  /** Applies a test to each element; returns true if all are true, false
   * if any is false, otherwise null. */
  private static @Nullable Boolean all(List<Expr.Exp> list,
      Function<Expr.Exp, @Nullable Boolean> test) {
    boolean allTrue = true;
    for (Expr.Exp e : list) {
      final Boolean b = test.apply(e);
      if (Boolean.FALSE.equals(b)) {
        return false;
      }
      if (b == null) {
        allTrue = false;
      }
    }
    return allTrue ? Boolean.TRUE : null;
  }

  /** Returns the element of a one-element set, or null. */
  public static Expr.@Nullable Exp singleton(Expr.Exp set) {
    if (set.op == Op.FINITE_SET && set.args().size() == 1) {
      return set.args().get(0);
    }
    return null;
  }
}

// End Sets.java
