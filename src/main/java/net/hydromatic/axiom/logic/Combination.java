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
package net.hydromatic.axiom.logic;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.axiom.ast.ExprBuilder.ex;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Limit;
import net.hydromatic.axiom.ast.Op;
import net.hydromatic.axiom.ast.Variant;
import net.hydromatic.axiom.rewrite.Sets;

/**
 * Two statements brought under a common quantifier prefix.
 *
 * <p>The prefix is the chain of quantifiers that was peeled from the first
 * statement (and, when they nest, from the second), outermost first. The
 * bound variables have been renamed so that no free symbol of either body
 * is captured.
 */
public final class Combination {
  public final ImmutableList<Frame> prefix;
  public final Expr.Exp left;
  public final Expr.Exp right;

  Combination(List<Frame> prefix, Expr.Exp left, Expr.Exp right) {
    this.prefix = ImmutableList.copyOf(prefix);
    this.left = requireNonNull(left);
    this.right = requireNonNull(right);
  }

  /** Joins the bodies with {@link Op#AND} or {@link Op#OR} and wraps the
   * result in the prefix. */
  public Expr.Exp build(Op junction) {
    Expr.Exp e = ex.call(junction, ImmutableList.of(left, right));
    for (Frame frame : prefix.reverse()) {
      e = ex.bind(frame.variant, e, frame.limits);
    }
    return e;
  }

  /** Returns how {@link #build} relates to the two original statements
   * joined by {@code junction}.
   *
   * <p>An existential distributes over a conjunction with a statement it
   * does not bind, and a universal over a disjunction. The other two
   * combinations are equivalences only if the domain has an element: a
   * universal over an empty domain is true, so pulling a conjunct inside
   * loses it, and dually for an existential. */
  public Provenance provenance(Op junction) {
    Provenance provenance = Provenance.EQUIVALENT;
    for (Frame frame : prefix) {
      final boolean distributes =
          (frame.variant == Variant.EXISTS) == (junction == Op.AND);
      if (!distributes && !frame.isNonEmpty()) {
        provenance = provenance.combine(
            junction == Op.AND ? Provenance.GIVEN : Provenance.IMPLIED_BY);
      }
    }
    return provenance;
  }

  /** One quantifier in a prefix. */
  public static class Frame {
    public final Variant variant;
    public final ImmutableList<Limit> limits;

    Frame(Variant variant, List<Limit> limits) {
      this.variant = requireNonNull(variant);
      this.limits = ImmutableList.copyOf(limits);
    }

    /** Returns whether every limit provably has an element. */
    boolean isNonEmpty() {
      for (Limit limit : limits) {
        if (!Boolean.FALSE.equals(Sets.isEmpty(limit.domain()))) {
          return false;
        }
      }
      return true;
    }

    @Override public String toString() {
      return variant.displayName + limits;
    }
  }
}

// End Combination.java
