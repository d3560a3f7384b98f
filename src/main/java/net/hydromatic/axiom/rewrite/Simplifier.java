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
import static net.hydromatic.axiom.util.Static.allMatch;
import static net.hydromatic.axiom.util.Static.concat;
import static net.hydromatic.axiom.util.Static.remove;
import static net.hydromatic.axiom.util.Static.set;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Limit;
import net.hydromatic.axiom.ast.Op;
import net.hydromatic.axiom.ast.Shuttle;
import net.hydromatic.axiom.ast.Variant;
import net.hydromatic.axiom.type.DType;
import net.hydromatic.axiom.type.Sign;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Simplifies expressions.
 *
 * <p>Each pass walks the tree bottom-up. Operator nodes are already in
 * canonical form (the builder normalizes them) apart from membership tests,
 * which the simplifier rewrites with {@link Membership#simplify}. At each
 * binder, the simplifier first simplifies the function under the knowledge
 * that each bound variable lies in its limit's domain, then tries the binder
 * rules in order; the first rule that applies wins.
 *
 * <p>Passes repeat until the expression stops changing, or until
 * {@link Prop#SIMPLIFY_PASS_COUNT} passes have run.
 */
public class Simplifier extends Shuttle {
  private final Session session;
  private final int maxUnroll;
  private final boolean narrowDomains;

  private Simplifier(Session session) {
    this.session = session;
    this.maxUnroll = Prop.MAX_UNROLL.intValue(session.map);
    this.narrowDomains = Prop.NARROW_DOMAINS.booleanValue(session.map);
  }

  /** Simplifies an expression using default properties. */
  public static Expr.Exp simplify(Expr.Exp e) {
    return simplify(Session.create(), e);
  }

  /** Simplifies an expression.
   *
   * @throws RewriteException if {@code e} is nested deeper than
   *   {@link Prop#MAX_DEPTH}
   */
  public static Expr.Exp simplify(Session session, Expr.Exp e) {
    final int maxDepth = Prop.MAX_DEPTH.intValue(session.map);
    if (Binders.depth(e) > maxDepth) {
      throw new RewriteException("expression is nested deeper than "
          + maxDepth, e);
    }
    final int passCount =
        Math.max(Prop.SIMPLIFY_PASS_COUNT.intValue(session.map), 1);
    final Simplifier simplifier = new Simplifier(session);
    Expr.Exp current = e;
    for (int i = 0; i < passCount; i++) {
      final Expr.Exp next = current.accept(simplifier);
      session.tracer.onPass(i, next);
      if (next.equals(current)) {
        break;
      }
      current = next;
    }
    return current;
  }

  /** Reports that a rule has fired, and returns its result. */
  private Expr.Exp fire(String rule, Expr.Exp before, Expr.Exp after) {
    if (!after.equals(before)) {
      session.tracer.onRule(rule, before, after);
    }
    return after;
  }

  @Override protected Expr.Exp visit(Expr.Call call) {
    final Expr.Exp e = super.visit(call);
    switch (e.op) {
    case CONTAINS:
    case NOT_CONTAINS:
    case SUBSET:
      return fire("membership", e, Membership.simplify(e));
    case AND:
    case OR:
      return fire("mergeQuantifiers", e, mergeQuantifiers(e));
    default:
      return e;
    }
  }

  /** Merges the quantifiers of a conjunction (or disjunction) that
   * distribute over it and have the same limits: "ForAll[x:D](p) ∧
   * ForAll[x:D](q)" becomes "ForAll[x:D](p ∧ q)", and dually for Exists
   * and "∨". */
  private static Expr.Exp mergeQuantifiers(Expr.Exp e) {
    final Variant distributive =
        e.op == Op.AND ? Variant.FOR_ALL : Variant.EXISTS;
    final Map<List<Limit>, List<Expr.Exp>> groups = new LinkedHashMap<>();
    final List<Expr.Exp> others = new ArrayList<>();
    for (Expr.Exp arg : e.args()) {
      if (arg instanceof Expr.Binder
          && ((Expr.Binder) arg).variant == distributive) {
        final Expr.Binder binder = (Expr.Binder) arg;
        groups.computeIfAbsent(binder.limits, k -> new ArrayList<>())
            .add(binder.function);
      } else {
        others.add(arg);
      }
    }
    if (allMatch(groups.values(), list -> list.size() < 2)) {
      return e;
    }
    groups.forEach((limits, functions) ->
        others.add(
            ex.bind(distributive, ex.call(e.op, functions), limits)));
    return ex.call(e.op, others);
  }

  @Override protected Expr.Exp visit(Expr.Binder binder) {
    final List<Limit> limits = new ArrayList<>();
    for (Limit limit : binder.limits) {
      limits.add(visit(limit));
    }
    final Expr.Exp function = simplifyFunction(binder.function, limits);
    final Expr.Exp e = binder.copy(function, limits);
    if (!(e instanceof Expr.Binder)) {
      return fire("collapse", binder, e);
    }
    final Expr.Binder b = (Expr.Binder) e;
    Expr.Exp r;
    if ((r = deadLimit(b)) != null) {
      return fire("deadLimit", b, r);
    }
    if ((r = singleton(b)) != null) {
      return fire("singleton", b, r);
    }
    if ((r = reverse(b)) != null) {
      return fire("reverse", b, r);
    }
    if ((r = unroll(b)) != null) {
      return fire("unroll", b, r);
    }
    if ((r = factor(b)) != null) {
      return fire("factor", b, r);
    }
    if ((r = piecewise(b)) != null) {
      return fire("piecewise", b, r);
    }
    if ((r = narrow(b)) != null) {
      return fire("narrow", b, r);
    }
    if ((r = denest(b)) != null) {
      return fire("denest", b, r);
    }
    if ((r = extremum(b)) != null) {
      return fire("extremum", b, r);
    }
    if ((r = onePoint(b)) != null) {
      return fire("onePoint", b, r);
    }
    return b;
  }

  /** Simplifies the function of a binder, replacing each constrained bound
   * variable with a dummy whose domain is the limit's domain, so that
   * relations on the variable can be decided. */
  private Expr.Exp simplifyFunction(Expr.Exp function, List<Limit> limits) {
    final Map<Expr.Symbol, Expr.Symbol> dummies = new LinkedHashMap<>();
    for (Limit limit : limits) {
      final Expr.Symbol v = limit.variable;
      if (limit.isUnconstrained()
          || !limit.isOriented()
          || isRebound(function, v)) {
        continue;
      }
      final Expr.Exp domain = limit.domain();
      if (domain.op == Op.EMPTY_SET || domain.equals(v.domain())) {
        continue;
      }
      dummies.put(v,
          ex.dummy(v.name, v.assumptions.withDomain(domain)));
    }
    if (dummies.isEmpty()) {
      return function.accept(this);
    }
    final Expr.Exp e = Replacer.replace(function, dummies).accept(this);
    final Map<Expr.Symbol, Expr.Symbol> back = new LinkedHashMap<>();
    dummies.forEach((v, d) -> back.put(d, v));
    return Replacer.replace(e, back);
  }

  /** Returns whether a binder or condition set within an expression binds a
   * given symbol. */
  private static boolean isRebound(Expr.Exp e, Expr.Symbol symbol) {
    final Deque<Expr.Exp> stack = new ArrayDeque<>();
    stack.push(e);
    while (!stack.isEmpty()) {
      final Expr.Exp exp = stack.pop();
      if (exp instanceof Expr.Binder
          && ((Expr.Binder) exp).indexOf(symbol) >= 0) {
        return true;
      }
      if (exp instanceof Expr.ConditionSet
          && ((Expr.ConditionSet) exp).variable.equals(symbol)) {
        return true;
      }
      exp.args().forEach(stack::push);
    }
    return false;
  }

  /** Returns whether the variable of limit {@code i} occurs in the bounds
   * of a later limit. */
  private static boolean referencedLater(Expr.Binder b, int i) {
    final Expr.Symbol v = b.limits.get(i).variable;
    for (int j = i + 1; j < b.limits.size(); j++) {
      for (Expr.Exp e : b.limits.get(j).expressions()) {
        if (FreeFinder.occursFree(e, v)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Removes a limit whose variable the function does not use. */
  private static Expr.@Nullable Exp deadLimit(Expr.Binder b) {
    if (!b.variant.isReduction()) {
      return null;
    }
    for (int i = b.limits.size() - 1; i >= 0; i--) {
      final Limit limit = b.limits.get(i);
      if (FreeFinder.occursFree(b.function, limit.variable)
          || referencedLater(b, i)) {
        continue;
      }
      final Expr.Exp rest =
          ex.bind(b.variant, b.function, remove(b.limits, i));
      final Expr.Exp r = b.variant.dropLimit(rest, limit);
      if (r != null) {
        return r;
      }
    }
    return null;
  }

  /** Instantiates a limit whose domain has exactly one element. */
  private static Expr.@Nullable Exp singleton(Expr.Binder b) {
    if (b.variant == Variant.MAPPING) {
      return null;
    }
    for (int i = 0; i < b.limits.size(); i++) {
      final Expr.Exp e = Sets.singleton(b.limits.get(i).domain());
      if (e == null) {
        continue;
      }
      switch (b.variant) {
      case INTEGRAL:
        // a point has measure zero
        return ex.zero();
      case ARG_MIN:
      case ARG_MAX:
        if (b.limits.size() == 1) {
          return e;
        }
        continue;
      default:
        return Binders.instantiate(b, i, e);
      }
    }
    return null;
  }

  /** Rewrites a sum or product over a reversed range (upper bound more than
   * one below the lower bound) as the reciprocal over the gap, and an
   * integral with reversed bounds as the negated integral. */
  private static Expr.@Nullable Exp reverse(Expr.Binder b) {
    for (int i = 0; i < b.limits.size(); i++) {
      final Limit limit = b.limits.get(i);
      if (!limit.isInterval()) {
        continue;
      }
      final Expr.Exp lower = limit.lower;
      final Expr.Exp upper = limit.upper;
      switch (b.variant) {
      case SUM:
      case PRODUCT:
        if (limit.variable.dtype() != DType.INTEGER
            || Facts.sign(ex.add(ex.sub(upper, lower), ex.one()))
                != Sign.NEGATIVE) {
          continue;
        }
        final Expr.Exp lo = ex.add(upper, ex.one());
        final Expr.Exp hi = ex.sub(lower, ex.one());
        if (!withinDomain(limit.variable, lo, hi)) {
          continue;
        }
        final Expr.Exp inner =
            ex.bind(b.variant, b.function,
                set(b.limits, i, Limit.of(limit.variable, lo, hi)));
        return b.variant == Variant.SUM
            ? ex.neg(inner)
            : ex.pow(inner, ex.minusOne());
      case INTEGRAL:
        if (Facts.sign(ex.sub(upper, lower)) != Sign.NEGATIVE) {
          continue;
        }
        return ex.neg(
            ex.bind(b.variant, b.function,
                set(b.limits, i, Limit.of(limit.variable, upper, lower))));
      default:
        return null;
      }
    }
    return null;
  }

  private static boolean withinDomain(Expr.Symbol v, Expr.Exp... values) {
    for (Expr.Exp value : values) {
      if (Sets.contains(v.domain(), value) != Boolean.TRUE) {
        return false;
      }
    }
    return true;
  }

  /** Expands a limit whose domain is a small enumerable set. */
  private Expr.@Nullable Exp unroll(Expr.Binder b) {
    final int n = b.variant == Variant.MAPPING ? 1 : b.limits.size();
    for (int i = 0; i < n; i++) {
      final Limit limit = b.limits.get(i);
      if (!limit.isOriented()) {
        continue;
      }
      final List<Expr.Exp> elements =
          Sets.elements(limit.domain(), maxUnroll);
      if (elements == null) {
        continue;
      }
      final Expr.Exp r = b.variant.finiteUnroll(b, i, elements);
      if (r != null) {
        return r;
      }
    }
    return null;
  }

  /** Moves the part of the function that does not depend on the bound
   * variables outside the binder. */
  private static Expr.@Nullable Exp factor(Expr.Binder b) {
    final List<Expr.Symbol> variables = b.variables();
    final Polynomials.Split split;
    switch (b.function.op) {
    case MUL:
      split = Polynomials.split(b.function, Op.MUL, variables);
      return split == null
          ? null
          : b.variant.factorOut(split.independent, split.dependent, b.limits);
    case ADD:
      split = Polynomials.split(b.function, Op.ADD, variables);
      return split == null
          ? null
          : b.variant.shiftOut(split.independent, split.dependent, b.limits);
    case AND:
    case OR:
      if (!b.variant.isQuantifier()) {
        return null;
      }
      split = Polynomials.split(b.function, b.function.op, variables);
      if (split == null) {
        return null;
      }
      // "Exists x. P and Q(x)" and "ForAll x. P or Q(x)" factor always;
      // the other two only if the domain has an element.
      final boolean absorbing =
          (b.variant == Variant.EXISTS) == (b.function.op == Op.AND);
      if (!absorbing && !nonEmpty(b.limits)) {
        return null;
      }
      return ex.call(b.function.op,
          List.of(split.independent,
              ex.bind(b.variant, split.dependent, b.limits)));
    default:
      return null;
    }
  }

  private static boolean nonEmpty(List<Limit> limits) {
    for (Limit limit : limits) {
      if (Sets.isEmpty(limit.domain()) != Boolean.FALSE) {
        return false;
      }
    }
    return true;
  }

  /** Pushes a binder into the branches of a piecewise function whose
   * conditions do not depend on the bound variables; or, if the conditions
   * depend on just one bound variable, splits that variable's domain into
   * one piece per branch. */
  private static Expr.@Nullable Exp piecewise(Expr.Binder b) {
    if (b.function.op != Op.PIECEWISE) {
      return null;
    }
    final List<Expr.Exp> args = b.function.args();
    final List<Expr.Symbol> variables = b.variables();
    boolean independent = true;
    for (int k = 1; k < args.size(); k += 2) {
      if (!FreeFinder.isIndependent(args.get(k), variables)) {
        independent = false;
        break;
      }
    }
    if (independent) {
      final List<Expr.Exp> list = new ArrayList<>();
      for (int k = 0; k < args.size(); k += 2) {
        list.add(ex.bind(b.variant, args.get(k), b.limits));
        list.add(args.get(k + 1));
      }
      return ex.piecewise(list);
    }
    return splitDomain(b, args);
  }

  private static Expr.@Nullable Exp splitDomain(Expr.Binder b,
      List<Expr.Exp> args) {
    switch (b.variant) {
    case SUM:
    case PRODUCT:
    case MINIMIZE:
    case MAXIMIZE:
    case UNION:
    case INTERSECTION:
    case FOR_ALL:
    case EXISTS:
      break;
    default:
      return null;
    }
    // Find the one bound variable that the conditions use.
    int index = -1;
    for (int k = 1; k < args.size(); k += 2) {
      for (Expr.Symbol symbol : FreeFinder.freeSymbols(args.get(k))) {
        final int i = b.indexOf(symbol);
        if (i < 0 || i == index) {
          continue;
        }
        if (index >= 0) {
          return null;
        }
        index = i;
      }
    }
    final Limit limit = b.limits.get(index);
    if (referencedLater(b, index) || !limit.isOriented()) {
      return null;
    }
    final Expr.Symbol v = limit.variable;
    final List<Expr.Exp> terms = new ArrayList<>();
    final List<Expr.Exp> previous = new ArrayList<>();
    for (int k = 0; k < args.size(); k += 2) {
      final Expr.Exp condition = args.get(k + 1);
      final List<Expr.Exp> conjuncts = new ArrayList<>();
      previous.forEach(c -> conjuncts.add(ex.not(c)));
      conjuncts.add(condition);
      previous.add(condition);
      final Expr.Exp region = Domains.domainConditioned(v, ex.and(conjuncts));
      if (region == null) {
        return null;
      }
      final Expr.Exp piece = ex.intersection(region, limit.domain());
      switch (piece.op) {
      case EMPTY_SET:
        continue;
      case INTERVAL:
      case FINITE_SET:
        break;
      default:
        return null;
      }
      // Each piece must decide its own condition, or we would split again
      // on the next pass.
      final Expr.Symbol d = ex.dummy(v.name, v.assumptions.withDomain(piece));
      if (Replacer.replace(condition, v, d).op != Op.TRUE) {
        return null;
      }
      terms.add(
          ex.bind(b.variant, args.get(k),
              set(b.limits, index, Limit.of(v, piece))));
    }
    return b.variant.reduce(terms);
  }

  /** Shrinks the domain of a limit to the region where the function may
   * differ from the identity of the reduction. */
  private Expr.@Nullable Exp narrow(Expr.Binder b) {
    if (!narrowDomains) {
      return null;
    }
    switch (b.variant) {
    case INTEGRAL:
    case ARG_MIN:
    case ARG_MAX:
    case MAPPING:
      return null;
    default:
      break;
    }
    final Expr.Exp identity = b.variant.identity();
    if (identity == null) {
      return null;
    }
    for (int i = 0; i < b.limits.size(); i++) {
      final Limit limit = b.limits.get(i);
      if (!limit.isOriented() || referencedLater(b, i)) {
        continue;
      }
      final Expr.Exp region =
          Domains.nonIdentity(b.function, limit.variable, identity);
      if (region == null) {
        continue;
      }
      final Expr.Exp domain = limit.domain();
      final Expr.Exp narrowed = ex.intersection(region, domain);
      if (narrowed.equals(domain)
          || narrowed.op == Op.INTERSECTION
          || Sets.isSubset(domain, narrowed) == Boolean.TRUE) {
        continue;
      }
      return ex.bind(b.variant, b.function,
          set(b.limits, i, Limit.of(limit.variable, narrowed)));
    }
    return null;
  }

  /** Merges a binder whose function is a binder of the same variant. */
  private static Expr.@Nullable Exp denest(Expr.Binder b) {
    if (!(b.function instanceof Expr.Binder)) {
      return null;
    }
    Expr.Binder inner = (Expr.Binder) b.function;
    if (inner.variant != b.variant || !b.variant.isDenestable()) {
      return null;
    }
    final NameGenerator nameGenerator = NameGenerator.avoiding(b);
    for (Expr.Symbol v : inner.variables()) {
      if (b.indexOf(v) >= 0) {
        inner = Binders.renameBound(inner, v, nameGenerator.fresh(v));
      }
    }
    return ex.bind(b.variant, inner.function,
        concat(b.limits, inner.limits));
  }

  /** Evaluates the minimum or maximum of an affine function over an
   * interval at the appropriate end point. */
  private static Expr.@Nullable Exp extremum(Expr.Binder b) {
    switch (b.variant) {
    case MINIMIZE:
    case MAXIMIZE:
    case ARG_MIN:
    case ARG_MAX:
      break;
    default:
      return null;
    }
    if (b.limits.size() != 1) {
      return null;
    }
    final Limit limit = b.limits.get(0);
    if (!limit.isInterval() || !limit.isOriented()) {
      return null;
    }
    final Polynomials.Affine affine =
        Polynomials.affine(b.function, limit.variable);
    if (affine == null || !(affine.slope instanceof Expr.Number)) {
      return null;
    }
    final int signum = ((Expr.Number) affine.slope).value.signum();
    if (signum == 0) {
      return null;
    }
    final boolean increasing = signum > 0;
    final boolean minimum =
        b.variant == Variant.MINIMIZE || b.variant == Variant.ARG_MIN;
    final Expr.Exp point = increasing == minimum ? limit.lower : limit.upper;
    switch (b.variant) {
    case ARG_MIN:
    case ARG_MAX:
      return point;
    default:
      return Binders.instantiate(b, 0, point);
    }
  }

  /** Eliminates an existentially quantified variable that the function
   * equates to a value, or a universally quantified variable that the
   * function requires to differ from a value. */
  private static Expr.@Nullable Exp onePoint(Expr.Binder b) {
    final Op junction;
    final Op literal;
    switch (b.variant) {
    case EXISTS:
      junction = Op.AND;
      literal = Op.EQ;
      break;
    case FOR_ALL:
      junction = Op.OR;
      literal = Op.NE;
      break;
    default:
      return null;
    }
    final List<Expr.Exp> literals =
        b.function.op == junction ? b.function.args() : List.of(b.function);
    final List<Expr.Symbol> variables = b.variables();
    for (int i = 0; i < b.limits.size(); i++) {
      final Limit limit = b.limits.get(i);
      final Expr.Symbol v = limit.variable;
      final Expr.Exp domain = limit.domain();
      if (referencedLater(b, i)
          || !FreeFinder.isIndependent(domain, variables)) {
        continue;
      }
      for (Expr.Exp e : literals) {
        if (e.op != literal) {
          continue;
        }
        final Expr.Exp a0 = e.args().get(0);
        final Expr.Exp a1 = e.args().get(1);
        final Expr.Exp value =
            a0.equals(v) ? a1 : a1.equals(v) ? a0 : null;
        if (value == null || !FreeFinder.isIndependent(value, variables)) {
          continue;
        }
        final Expr.Exp instance = Binders.instantiate(b, i, value);
        return b.variant == Variant.EXISTS
            ? ex.and(ex.contains(value, domain), instance)
            : ex.or(ex.notContains(value, domain), instance);
      }
    }
    return null;
  }
}

// End Simplifier.java
