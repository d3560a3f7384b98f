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

import static net.hydromatic.axiom.ast.ExprBuilder.ex;
import static net.hydromatic.axiom.util.Static.allMatch;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.axiom.rewrite.Binders;
import net.hydromatic.axiom.rewrite.Facts;
import net.hydromatic.axiom.rewrite.Sets;
import net.hydromatic.axiom.type.DType;
import net.hydromatic.axiom.type.Sign;
import net.hydromatic.axiom.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Kind of bound-variable expression.
 *
 * <p>Each variant supplies a reduction operator, the value over an empty
 * domain, and a procedure that unrolls the binder over a finite domain.
 * Everything else about binders is shared.
 */
public enum Variant {
  SUM("Sum") {
    @Override public Expr.Exp reduce(List<Expr.Exp> terms) {
      return ex.add(terms);
    }

    @Override public Expr.Exp identity() {
      return ex.zero();
    }
  },

  PRODUCT("Product") {
    @Override public Expr.Exp reduce(List<Expr.Exp> terms) {
      return ex.mul(terms);
    }

    @Override public Expr.Exp identity() {
      return ex.one();
    }
  },

  /** Integral. Its limits are real intervals, and a finite set has measure
   * zero. */
  INTEGRAL("Integral") {
    @Override public Expr.Exp reduce(List<Expr.Exp> terms) {
      return ex.add(terms);
    }

    @Override public Expr.Exp identity() {
      return ex.zero();
    }

    @Override public Expr.@Nullable Exp finiteUnroll(Expr.Binder binder,
        int i, List<Expr.Exp> elements) {
      return ex.zero();
    }
  },

  MINIMIZE("Minimize") {
    @Override public Expr.Exp reduce(List<Expr.Exp> terms) {
      return ex.min(terms);
    }

    @Override public Expr.Exp identity() {
      return ex.infinity();
    }
  },

  MAXIMIZE("Maximize") {
    @Override public Expr.Exp reduce(List<Expr.Exp> terms) {
      return ex.max(terms);
    }

    @Override public Expr.Exp identity() {
      return ex.negativeInfinity();
    }
  },

  /** Value of the variable at which the function is least. Undefined over an
   * empty domain. */
  ARG_MIN("ArgMin") {
    @Override public Expr.Exp identity() {
      return ex.undefined();
    }

    @Override public Expr.@Nullable Exp finiteUnroll(Expr.Binder binder,
        int i, List<Expr.Exp> elements) {
      return argExtreme(binder, elements, -1);
    }
  },

  ARG_MAX("ArgMax") {
    @Override public Expr.Exp identity() {
      return ex.undefined();
    }

    @Override public Expr.@Nullable Exp finiteUnroll(Expr.Binder binder,
        int i, List<Expr.Exp> elements) {
      return argExtreme(binder, elements, 1);
    }
  },

  /** Array comprehension. Unrolls only along its outermost limit, into an
   * array literal. */
  MAPPING("Mapping") {
    @Override public Expr.@Nullable Exp identity() {
      return null;
    }

    @Override public Expr.@Nullable Exp finiteUnroll(Expr.Binder binder,
        int i, List<Expr.Exp> elements) {
      if (i != 0 || elements.isEmpty()) {
        return null;
      }
      final List<Expr.Exp> terms = new ArrayList<>();
      for (Expr.Exp element : elements) {
        terms.add(Binders.instantiate(binder, 0, element));
      }
      return ex.array(terms);
    }
  },

  UNION("Union") {
    @Override public Expr.Exp reduce(List<Expr.Exp> terms) {
      return ex.union(terms);
    }

    @Override public Expr.Exp identity() {
      return ex.emptySet();
    }
  },

  INTERSECTION("Intersection") {
    @Override public Expr.Exp reduce(List<Expr.Exp> terms) {
      return ex.intersection(terms);
    }

    @Override public Expr.Exp identity() {
      return ex.universalSet();
    }
  },

  FOR_ALL("ForAll") {
    @Override public Expr.Exp reduce(List<Expr.Exp> terms) {
      return ex.and(terms);
    }

    @Override public Expr.Exp identity() {
      return ex.trueLiteral();
    }
  },

  EXISTS("Exists") {
    @Override public Expr.Exp reduce(List<Expr.Exp> terms) {
      return ex.or(terms);
    }

    @Override public Expr.Exp identity() {
      return ex.falseLiteral();
    }
  };

  public final String displayName;

  Variant(String displayName) {
    this.displayName = displayName;
  }

  /** Applies the reduction operator to a list of terms. */
  public Expr.Exp reduce(List<Expr.Exp> terms) {
    throw new AssertionError(this + " has no reduction operator");
  }

  /** Returns the value of this binder over an empty domain, or null if it
   * has none. */
  public abstract Expr.@Nullable Exp identity();

  /** Whether this variant combines its terms with a reduction operator. */
  public boolean isReduction() {
    return this != ARG_MIN && this != ARG_MAX && this != MAPPING;
  }

  /** Whether the reduction operator ignores repeated terms. */
  public boolean isIdempotent() {
    switch (this) {
    case MINIMIZE:
    case MAXIMIZE:
    case UNION:
    case INTERSECTION:
    case FOR_ALL:
    case EXISTS:
      return true;
    default:
      return false;
    }
  }

  /** Whether reversed bounds denote an oriented value (Karr's convention
   * for sums and products, negation for integrals) rather than an empty
   * domain. */
  public boolean isKarr() {
    return this == SUM || this == PRODUCT || this == INTEGRAL;
  }

  public boolean isQuantifier() {
    return this == FOR_ALL || this == EXISTS;
  }

  /** Whether a change of variable preserves the value. Not true of the
   * variants whose value depends on the position of the variable. */
  public boolean allowsReindex() {
    return this != ARG_MIN && this != ARG_MAX && this != MAPPING;
  }

  /** Whether a binder whose function is a binder of the same variant can be
   * merged into one. */
  public boolean isDenestable() {
    return this != ARG_MIN && this != ARG_MAX;
  }

  /** Returns the variant that gives the negated value when applied to the
   * negated function, or null. */
  public @Nullable Variant reversed() {
    switch (this) {
    case MINIMIZE:
      return MAXIMIZE;
    case MAXIMIZE:
      return MINIMIZE;
    case ARG_MIN:
      return ARG_MAX;
    case ARG_MAX:
      return ARG_MIN;
    default:
      return null;
    }
  }

  /** Returns the element type of a binder of this variant. */
  DType dtype(Expr.Binder binder) {
    switch (this) {
    case FOR_ALL:
    case EXISTS:
      return DType.BOOLEAN;
    case UNION:
    case INTERSECTION:
      return DType.SET;
    case ARG_MIN:
    case ARG_MAX:
      return binder.limits.get(0).variable.dtype();
    case INTEGRAL:
      return binder.function.dtype().join(DType.REAL);
    default:
      return binder.function.dtype();
    }
  }

  /** Expands a binder whose limit {@code i} ranges over an explicit list of
   * values. Returns null if this variant cannot be unrolled there. */
  public Expr.@Nullable Exp finiteUnroll(Expr.Binder binder, int i,
      List<Expr.Exp> elements) {
    Expr.Exp acc = null;
    final List<Expr.Exp> seen = new ArrayList<>();
    for (Expr.Exp element : elements) {
      final Expr.Exp term = Binders.instantiate(binder, i, element);
      if (acc == null) {
        acc = term;
      } else {
        final Expr.Exp combined = reduce(ImmutableList.of(acc, term));
        if (isIdempotent()
            || allMatch(seen, e -> ex.eq(e, element).isFalse())) {
          acc = combined;
        } else {
          // The element may equal an earlier one; count it only once.
          acc = ex.piecewise(
              ImmutableList.of(acc, ex.contains(element, ex.finiteSet(seen)),
                  combined, ex.trueLiteral()));
        }
      }
      seen.add(element);
    }
    return acc != null ? acc : identity();
  }

  /** Removes a limit whose variable the function does not use. {@code rest}
   * is the binder without that limit. Returns null if the value would
   * change in a way this variant cannot express. */
  public Expr.@Nullable Exp dropLimit(Expr.Exp rest, Limit limit) {
    switch (this) {
    case SUM:
    case PRODUCT:
      final Expr.Exp extent = limit.extent();
      if (extent.op == Op.INFINITY || extent.op == Op.UNDEFINED) {
        return null;
      }
      return this == SUM ? ex.mul(rest, extent) : ex.pow(rest, extent);
    case INTEGRAL:
      if (limit.lower == null
          || limit.upper == null
          || !isFinite(limit.lower)
          || !isFinite(limit.upper)) {
        return null;
      }
      return ex.mul(rest, ex.sub(limit.upper, limit.lower));
    case MINIMIZE:
    case MAXIMIZE:
    case UNION:
    case INTERSECTION:
    case FOR_ALL:
    case EXISTS:
      return Boolean.FALSE.equals(Sets.isEmpty(limit.domain())) ? rest : null;
    default:
      return null;
    }
  }

  /** Moves a factor that does not depend on any bound variable outside a
   * binder whose function is {@code factor * dependent}. Returns null if this
   * variant does not allow it. */
  public Expr.@Nullable Exp factorOut(Expr.Exp factor, Expr.Exp dependent,
      List<Limit> limits) {
    final Variant reversed = reversed();
    switch (this) {
    case SUM:
    case INTEGRAL:
      return ex.mul(factor, ex.bind(this, dependent, limits));
    case PRODUCT:
      if (limits.size() != 1) {
        return null;
      }
      final Expr.Exp extent = limits.get(0).extent();
      if (extent.op == Op.INFINITY || extent.op == Op.UNDEFINED) {
        return null;
      }
      return ex.mul(ex.pow(factor, extent), ex.bind(this, dependent, limits));
    case MINIMIZE:
    case MAXIMIZE:
    case ARG_MIN:
    case ARG_MAX:
      final Sign sign = Facts.sign(factor);
      final Variant variant;
      if (sign == Sign.POSITIVE) {
        variant = this;
      } else if (sign == Sign.NEGATIVE && reversed != null) {
        variant = reversed;
      } else {
        return null;
      }
      final Expr.Exp b = ex.bind(variant, dependent, limits);
      return this == ARG_MIN || this == ARG_MAX ? b : ex.mul(factor, b);
    default:
      return null;
    }
  }

  /** Moves a term that does not depend on any bound variable outside a
   * binder whose function is {@code term + dependent}. Returns null if this
   * variant does not allow it. */
  public Expr.@Nullable Exp shiftOut(Expr.Exp term, Expr.Exp dependent,
      List<Limit> limits) {
    switch (this) {
    case SUM:
    case INTEGRAL:
      return ex.add(ex.bind(this, dependent, limits),
          ex.bind(this, term, limits));
    case MINIMIZE:
    case MAXIMIZE:
      return ex.add(ex.bind(this, dependent, limits), term);
    case ARG_MIN:
    case ARG_MAX:
      return ex.bind(this, dependent, limits);
    default:
      return null;
    }
  }

  private static boolean isFinite(Expr.Exp e) {
    return e.op != Op.INFINITY && e.op != Op.NEGATIVE_INFINITY;
  }

  /** Unrolls ArgMin ({@code direction} -1) or ArgMax (1) over a list of
   * values. Only possible if every term is a number. */
  private static Expr.@Nullable Exp argExtreme(Expr.Binder binder,
      List<Expr.Exp> elements, int direction) {
    if (binder.limits.size() != 1) {
      return null;
    }
    if (elements.isEmpty()) {
      return ex.undefined();
    }
    if (elements.size() == 1) {
      return elements.get(0);
    }
    Expr.Exp best = null;
    Rational bestValue = null;
    for (Expr.Exp element : elements) {
      final Rational value =
          Binders.instantiate(binder, 0, element).numberValue();
      if (value == null) {
        return null;
      }
      if (bestValue == null || value.compareTo(bestValue) * direction > 0) {
        best = element;
        bestValue = value;
      }
    }
    return best;
  }
}

// End Variant.java
