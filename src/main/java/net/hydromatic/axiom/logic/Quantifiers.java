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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.axiom.ast.ExprBuilder.ex;
import static net.hydromatic.axiom.util.Static.concat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Limit;
import net.hydromatic.axiom.ast.Op;
import net.hydromatic.axiom.ast.Variant;
import net.hydromatic.axiom.rewrite.Binders;
import net.hydromatic.axiom.rewrite.FreeFinder;
import net.hydromatic.axiom.rewrite.NameGenerator;
import net.hydromatic.axiom.rewrite.Session;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Combines quantified statements.
 *
 * <p>Every operation returns a {@link Derivation} whose result has been
 * simplified, and reports it to the session's tracer. The provenance says
 * which way the implication between the arguments and the result runs; no
 * operation claims an equivalence that holds in only one direction.
 */
public abstract class Quantifiers {
  private Quantifiers() {}

  /** Returns whether an expression is a {@code ForAll} or {@code Exists}. */
  public static boolean isQuantifier(Expr.Exp e) {
    return e instanceof Expr.Binder && ((Expr.Binder) e).variant.isQuantifier();
  }

  /** Conjoins two statements. */
  public static Derivation and(Session session, Expr.Exp a, Expr.Exp b) {
    return derive(session, junction(Op.AND, a, b), a, b);
  }

  /** Disjoins two statements. */
  public static Derivation or(Session session, Expr.Exp a, Expr.Exp b) {
    return derive(session, junction(Op.OR, a, b), a, b);
  }

  /** Substitutes a value for a variable bound by a quantifier.
   *
   * <p>For {@code ForAll} the result is {@code value ∉ D ∨ P(value)}, which
   * the statement implies; for {@code Exists} it is
   * {@code value ∈ D ∧ P(value)}, which implies the statement. If the body
   * is a conjunction (respectively disjunction) the guard is distributed
   * over its terms. Quantifiers over earlier limits stay in place. */
  public static Derivation instantiate(Session session, Expr.Exp e,
      Expr.Symbol variable, Expr.Exp value) {
    checkArgument(isQuantifier(e), "not a quantifier: %s", e);
    final Expr.Binder binder = (Expr.Binder) e;
    final int i = binder.indexOf(variable);
    checkArgument(i >= 0, "%s is not bound in %s", variable, e);
    checkArgument(FreeFinder.isIndependent(value, binder.variables()),
        "value %s refers to variables bound in %s", value, e);
    final Expr.Exp domain = binder.limits.get(i).domain();
    final Expr.Exp inner =
        ex.bind(binder.variant, binder.function,
            binder.limits.subList(i, binder.limits.size()));
    if (!(inner instanceof Expr.Binder)) {
      throw new AssertionError("limits of " + e + " collapsed");
    }
    final Expr.Exp instance =
        Binders.instantiate((Expr.Binder) inner, 0, value);
    final boolean forAll = binder.variant == Variant.FOR_ALL;
    final Expr.Exp guard =
        forAll ? ex.notContains(value, domain) : ex.contains(value, domain);
    final Op guardJunction = forAll ? Op.OR : Op.AND;
    final Op distributed = forAll ? Op.AND : Op.OR;
    final Expr.Exp guarded;
    if (instance.op == distributed) {
      final List<Expr.Exp> terms = new ArrayList<>();
      for (Expr.Exp term : instance.args()) {
        terms.add(ex.call(guardJunction, ImmutableList.of(guard, term)));
      }
      guarded = ex.call(distributed, terms);
    } else {
      guarded = ex.call(guardJunction, ImmutableList.of(guard, instance));
    }
    final Expr.Exp result =
        ex.bind(binder.variant, guarded, binder.limits.subList(0, i));
    return derive(session,
        Derivation.of(result,
            forAll ? Provenance.SUBSTITUTED_FROM : Provenance.IMPLIED_BY,
            e),
        e);
  }

  /** Exchanges a quantifier with the quantifier that is its body.
   *
   * <p>Swapping quantifiers of the same kind is an equivalence.
   * {@code Exists[x](ForAll[y](P))} implies {@code ForAll[y](Exists[x](P))},
   * so that swap is {@link Provenance#GIVEN}; the converse does not hold, so
   * swapping {@code ForAll[y](Exists[x](P))} is
   * {@link Provenance#IMPLIED_BY}. */
  public static Derivation swap(Session session, Expr.Exp e) {
    checkArgument(isQuantifier(e), "not a quantifier: %s", e);
    final Expr.Binder outer = (Expr.Binder) e;
    checkArgument(isQuantifier(outer.function),
        "body of %s is not a quantifier", e);
    Expr.Binder inner = (Expr.Binder) outer.function;
    for (Limit limit : inner.limits) {
      for (Expr.Exp exp : limit.expressions()) {
        checkArgument(FreeFinder.isIndependent(exp, outer.variables()),
            "cannot swap; domain of %s depends on %s", limit.variable,
            outer.variables());
      }
    }
    // The inner variables move outward; they must not capture free symbols
    // of the outer limits.
    final Set<Expr.Symbol> outerFree = new HashSet<>();
    for (Limit limit : outer.limits) {
      for (Expr.Exp exp : limit.expressions()) {
        outerFree.addAll(FreeFinder.freeSymbols(exp));
      }
    }
    final NameGenerator names = NameGenerator.avoiding(e);
    for (Expr.Symbol v : inner.variables()) {
      if (outerFree.contains(v)) {
        inner = Binders.renameBound(inner, v, names.fresh(v));
      }
    }
    final Expr.Exp result =
        ex.bind(inner.variant,
            ex.bind(outer.variant, inner.function, outer.limits),
            inner.limits);
    final Provenance provenance;
    if (outer.variant == inner.variant) {
      provenance = Provenance.EQUIVALENT;
    } else if (outer.variant == Variant.EXISTS) {
      provenance = Provenance.GIVEN;
    } else {
      provenance = Provenance.IMPLIED_BY;
    }
    return derive(session, Derivation.of(result, provenance, e), e);
  }

  /** Peels the quantifiers of {@code a} into a prefix, renaming bound
   * variables that would capture free symbols of {@code b}. */
  public static Combination combineClauses(Expr.Exp a, Expr.Exp b) {
    return combineClauses(a, b, ImmutableSet.of());
  }

  private static Combination combineClauses(Expr.Exp a, Expr.Exp b,
      Set<Expr.Symbol> avoid) {
    final Set<Expr.Symbol> free =
        ImmutableSet.<Expr.Symbol>builder()
            .addAll(FreeFinder.freeSymbols(b))
            .addAll(avoid)
            .build();
    final NameGenerator names = NameGenerator.avoiding(a, b);
    final List<Combination.Frame> prefix = new ArrayList<>();
    Expr.Exp e = a;
    while (isQuantifier(e)) {
      Expr.Binder binder = (Expr.Binder) e;
      for (Expr.Symbol v : binder.variables()) {
        if (free.contains(v)) {
          binder = Binders.renameBound(binder, v, names.fresh(v));
        }
      }
      prefix.add(new Combination.Frame(binder.variant, binder.limits));
      e = binder.function;
    }
    return new Combination(prefix, e, b);
  }

  private static Derivation derive(Session session, Derivation derivation,
      Expr.Exp... premises) {
    final Derivation d =
        Derivation.of(session.simplify(derivation.result),
            derivation.provenance, premises);
    session.tracer.onDerivation(d);
    return d;
  }

  /** Joins two statements with {@link Op#AND} or {@link Op#OR}. */
  private static Derivation junction(Op op, Expr.Exp a, Expr.Exp b) {
    checkArgument(a.isBoolean(), "not a statement: %s", a);
    checkArgument(b.isBoolean(), "not a statement: %s", b);
    // The quantifier that distributes over the junction when both sides
    // are quantified the same way, and the one that absorbs a side it does
    // not bind.
    final Variant distributive = op == Op.AND ? Variant.FOR_ALL : Variant.EXISTS;
    final Variant absorbing = op == Op.AND ? Variant.EXISTS : Variant.FOR_ALL;
    final Expr.Binder qa = isQuantifier(a) ? (Expr.Binder) a : null;
    final Expr.Binder qb = isQuantifier(b) ? (Expr.Binder) b : null;

    if (qa != null && qb != null
        && qa.variant == distributive && qb.variant == distributive) {
      if (qa.limits.equals(qb.limits)) {
        return Derivation.of(
            ex.bind(distributive,
                ex.call(op, ImmutableList.of(qa.function, qb.function)),
                qa.limits),
            Provenance.EQUIVALENT, a, b);
      }
      final Derivation d = mergeShared(op, qa, qb);
      if (d != null) {
        return d;
      }
    }

    if (op == Op.AND && qa != null && qb != null
        && qa.variant != qb.variant) {
      final Expr.Binder forAll = qa.variant == Variant.FOR_ALL ? qa : qb;
      final Expr.Binder exists = qa.variant == Variant.EXISTS ? qa : qb;
      final Derivation d = guardShared(forAll, exists, a, b);
      if (d != null) {
        return d;
      }
    }

    // Pull the other statement inside a quantifier, preferring one that
    // absorbs it.
    final Combination c;
    if (qa != null && (qa.variant == absorbing || qb == null
        || qb.variant != absorbing)) {
      c = nest(combineClauses(a, b), absorbing);
    } else if (qb != null) {
      c = nest(combineClauses(b, a), absorbing);
    } else {
      return Derivation.of(ex.call(op, ImmutableList.of(a, b)),
          Provenance.EQUIVALENT, a, b);
    }
    return Derivation.of(c.build(op), c.provenance(op), a, b);
  }

  /** If the second statement of a combination is a quantifier of the
   * absorbing kind, moves its quantifiers into the prefix too. */
  private static Combination nest(Combination c, Variant absorbing) {
    if (!isQuantifier(c.right)
        || ((Expr.Binder) c.right).variant != absorbing
        || c.prefix.isEmpty()
        || c.prefix.get(c.prefix.size() - 1).variant != absorbing) {
      return c;
    }
    final Combination c2 =
        combineClauses(c.right, c.left, FreeFinder.freeSymbols(c.left));
    return new Combination(concat(c.prefix, c2.prefix), c.left, c2.left);
  }

  /** Merges two quantifiers of the distributive kind over the same single
   * variable but different domains. */
  private static @Nullable Derivation mergeShared(Op op, Expr.Binder qa,
      Expr.Binder qb) {
    if (qa.limits.size() != 1 || qb.limits.size() != 1) {
      return null;
    }
    final Limit la = qa.limits.get(0);
    final Limit lb = qb.limits.get(0);
    final Expr.Symbol x = la.variable;
    if (!x.equals(lb.variable)) {
      return null;
    }
    final Expr.Exp union = ex.union(la.domain(), lb.domain());
    if (qa.function.equals(qb.function)) {
      // "ForAll x in A. P and ForAll x in B. P" is "ForAll x in A ∪ B. P";
      // likewise "or" of two Exists.
      return Derivation.of(
          ex.bind(qa.variant, qa.function, Limit.of(x, union)),
          Provenance.EQUIVALENT, qa, qb);
    }
    if (op == Op.AND) {
      return Derivation.of(
          ex.bind(Variant.FOR_ALL, ex.and(qa.function, qb.function),
              Limit.of(x, ex.intersection(la.domain(), lb.domain()))),
          Provenance.GIVEN, qa, qb);
    }
    return Derivation.of(
        ex.bind(Variant.EXISTS,
            ex.or(ex.and(ex.contains(x, la.domain()), qa.function),
                ex.and(ex.contains(x, lb.domain()), qb.function)),
            Limit.of(x, union)),
        Provenance.EQUIVALENT, qa, qb);
  }

  /** Conjoins {@code ForAll[x∈A](P)} and {@code Exists[x∈B](Q)} over the
   * same single variable as {@code Exists[x∈B](Q ∧ (x ∉ A ∨ P))}. */
  private static @Nullable Derivation guardShared(Expr.Binder forAll,
      Expr.Binder exists, Expr.Exp a, Expr.Exp b) {
    if (forAll.limits.size() != 1 || exists.limits.size() != 1) {
      return null;
    }
    final Limit la = forAll.limits.get(0);
    final Limit lb = exists.limits.get(0);
    if (!la.variable.equals(lb.variable)) {
      return null;
    }
    final Expr.Exp guarded =
        ex.or(ex.notContains(la.variable, la.domain()), forAll.function);
    return Derivation.of(
        ex.bind(Variant.EXISTS, ex.and(exists.function, guarded),
            exists.limits),
        Provenance.GIVEN, a, b);
  }
}

// End Quantifiers.java
