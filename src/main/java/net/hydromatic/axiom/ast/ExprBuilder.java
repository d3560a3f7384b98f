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
import static net.hydromatic.axiom.util.Static.anyMatch;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.axiom.rewrite.Binders;
import net.hydromatic.axiom.rewrite.Facts;
import net.hydromatic.axiom.rewrite.FreeFinder;
import net.hydromatic.axiom.rewrite.Sets;
import net.hydromatic.axiom.rewrite.Substituter;
import net.hydromatic.axiom.type.Assumptions;
import net.hydromatic.axiom.type.DType;
import net.hydromatic.axiom.type.Sign;
import net.hydromatic.axiom.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds expressions.
 *
 * <p>Every method returns an expression in canonical form, and interns it, so
 * that structurally equal expressions are usually the same object. The
 * interning table holds its entries weakly and is safe to use from several
 * threads.
 */
public enum ExprBuilder {
  /** The singleton instance of the expression builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ex;

  private final Interner<Expr.Exp> interner = Interners.newWeakInterner();
  private final AtomicInteger dummyCount = new AtomicInteger();

  private final Expr.Number zero = intern(new Expr.Number(Rational.ZERO));
  private final Expr.Number one = intern(new Expr.Number(Rational.ONE));
  private final Expr.Number minusOne =
      intern(new Expr.Number(Rational.MINUS_ONE));
  private final Expr.Atom trueLiteral = intern(new Expr.Atom(Op.TRUE));
  private final Expr.Atom falseLiteral = intern(new Expr.Atom(Op.FALSE));
  private final Expr.Atom infinity = intern(new Expr.Atom(Op.INFINITY));
  private final Expr.Atom negativeInfinity =
      intern(new Expr.Atom(Op.NEGATIVE_INFINITY));
  private final Expr.Atom undefined = intern(new Expr.Atom(Op.UNDEFINED));
  private final Expr.Atom emptySet = intern(new Expr.Atom(Op.EMPTY_SET));
  private final Expr.Atom universalSet =
      intern(new Expr.Atom(Op.UNIVERSAL_SET));

  @SuppressWarnings("unchecked")
  private <E extends Expr.Exp> E intern(E e) {
    return (E) interner.intern(e);
  }

  // atoms

  /** Creates a symbol. */
  public Expr.Symbol symbol(String name, Assumptions assumptions) {
    return intern(new Expr.Symbol(name, assumptions, -1));
  }

  /** Creates an integer symbol. */
  public Expr.Symbol integer(String name) {
    return symbol(name, Assumptions.INTEGER);
  }

  /** Creates a real symbol. */
  public Expr.Symbol real(String name) {
    return symbol(name, Assumptions.REAL);
  }

  /** Creates a dummy with the same name and assumptions as a symbol. It is
   * not equal to any other symbol. */
  public Expr.Symbol dummy(Expr.Symbol symbol) {
    return dummy(symbol.name, symbol.assumptions);
  }

  /** Creates a dummy. It is not equal to any other symbol. */
  public Expr.Symbol dummy(String name, Assumptions assumptions) {
    return intern(
        new Expr.Symbol(name, assumptions, dummyCount.getAndIncrement()));
  }

  public Expr.Exp number(long value) {
    return number(Rational.of(value));
  }

  public Expr.Exp number(Rational value) {
    if (value.signum() == 0) {
      return zero;
    }
    return intern(new Expr.Number(value));
  }

  public Expr.Exp zero() {
    return zero;
  }

  public Expr.Exp one() {
    return one;
  }

  public Expr.Exp minusOne() {
    return minusOne;
  }

  public Expr.Exp trueLiteral() {
    return trueLiteral;
  }

  public Expr.Exp falseLiteral() {
    return falseLiteral;
  }

  public Expr.Exp bool(boolean b) {
    return b ? trueLiteral : falseLiteral;
  }

  public Expr.Exp infinity() {
    return infinity;
  }

  public Expr.Exp negativeInfinity() {
    return negativeInfinity;
  }

  /** Returns the value of an expression that has no value, such as the
   * ArgMin over an empty domain. */
  public Expr.Exp undefined() {
    return undefined;
  }

  public Expr.Exp emptySet() {
    return emptySet;
  }

  public Expr.Exp universalSet() {
    return universalSet;
  }

  /** Creates a call to any operator that {@link Expr.Call} represents. */
  public Expr.Exp call(Op op, List<Expr.Exp> args) {
    switch (op) {
    case ADD:
      return add(args);
    case MUL:
      return mul(args);
    case POW:
      return pow(args.get(0), args.get(1));
    case MIN:
      return min(args);
    case MAX:
      return max(args);
    case KRONECKER_DELTA:
      return kroneckerDelta(args.get(0), args.get(1));
    case INDEXED:
      return indexed(args.get(0), args.subList(1, args.size()));
    case ARRAY:
      return array(args);
    case PIECEWISE:
      return piecewise(args);
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      return relation(op, args.get(0), args.get(1));
    case NOT:
      return not(args.get(0));
    case AND:
      return and(args);
    case OR:
      return or(args);
    case CONTAINS:
      return contains(args.get(0), args.get(1));
    case NOT_CONTAINS:
      return notContains(args.get(0), args.get(1));
    case SUBSET:
      return subset(args.get(0), args.get(1));
    case FINITE_SET:
      return finiteSet(args);
    case UNION:
      return union(args);
    case INTERSECTION:
      return intersection(args);
    case COMPLEMENT:
      return complement(args.get(0), args.get(1));
    default:
      throw new AssertionError("not a call: " + op);
    }
  }

  private static void flatten(Op op, List<? extends Expr.Exp> args,
      List<Expr.Exp> flat) {
    for (Expr.Exp arg : args) {
      if (arg.op == op) {
        flatten(op, arg.args(), flat);
      } else {
        flat.add(arg);
      }
    }
  }

  // arithmetic

  public Expr.Exp add(Expr.Exp... args) {
    return add(Arrays.asList(args));
  }

  /** Creates a sum. Folds constants, combines like terms, and sorts the
   * terms. */
  public Expr.Exp add(List<? extends Expr.Exp> args) {
    final List<Expr.Exp> flat = new ArrayList<>();
    flatten(Op.ADD, args, flat);
    Rational constant = Rational.ZERO;
    boolean positiveInfinity = false;
    boolean negativeInfinity = false;
    final Map<Expr.Exp, Rational> terms = new LinkedHashMap<>();
    for (Expr.Exp arg : flat) {
      checkArgument(arg.dtype().isNumeric(), "not numeric: %s", arg);
      switch (arg.op) {
      case NUMBER:
        constant = constant.add(requireNonNull(arg.numberValue()));
        break;
      case INFINITY:
        positiveInfinity = true;
        break;
      case NEGATIVE_INFINITY:
        negativeInfinity = true;
        break;
      case UNDEFINED:
        return undefined;
      default:
        if (arg.op == Op.MUL && arg.args().get(0).op == Op.NUMBER) {
          terms.merge(rest(arg), requireNonNull(arg.args().get(0).numberValue()),
              Rational::add);
        } else {
          terms.merge(arg, Rational.ONE, Rational::add);
        }
      }
    }
    if (positiveInfinity && negativeInfinity) {
      return undefined;
    }
    if (positiveInfinity) {
      return infinity;
    }
    if (negativeInfinity) {
      return this.negativeInfinity;
    }
    final List<Expr.Exp> list = new ArrayList<>();
    terms.forEach((term, coefficient) -> {
      if (coefficient.equals(Rational.ONE)) {
        list.add(term);
      } else if (coefficient.signum() != 0) {
        list.add(scaled(coefficient, term));
      }
    });
    list.sort(Expr.ORDERING);
    if (constant.signum() != 0) {
      list.add(0, number(constant));
    }
    switch (list.size()) {
    case 0:
      return zero;
    case 1:
      return list.get(0);
    default:
      return intern(new Expr.Call(Op.ADD, ImmutableList.copyOf(list)));
    }
  }

  /** Returns a product without its leading numeric coefficient. */
  private Expr.Exp rest(Expr.Exp product) {
    final List<Expr.Exp> args = product.args();
    return args.size() == 2
        ? args.get(1)
        : intern(new Expr.Call(Op.MUL,
            ImmutableList.copyOf(args.subList(1, args.size()))));
  }

  /** Multiplies a term that has no numeric coefficient by a number. */
  private Expr.Exp scaled(Rational coefficient, Expr.Exp term) {
    final ImmutableList.Builder<Expr.Exp> b = ImmutableList.builder();
    b.add(number(coefficient));
    if (term.op == Op.MUL) {
      b.addAll(term.args());
    } else {
      b.add(term);
    }
    return intern(new Expr.Call(Op.MUL, b.build()));
  }

  public Expr.Exp mul(Expr.Exp... args) {
    return mul(Arrays.asList(args));
  }

  /** Creates a product. Folds constants, merges powers of the same base, and
   * distributes a numeric coefficient over a single sum. */
  public Expr.Exp mul(List<? extends Expr.Exp> args) {
    final List<Expr.Exp> flat = new ArrayList<>();
    flatten(Op.MUL, args, flat);
    Rational coefficient = Rational.ONE;
    boolean infinite = false;
    final Map<Expr.Exp, Rational> powers = new LinkedHashMap<>();
    for (Expr.Exp arg : flat) {
      checkArgument(arg.dtype().isNumeric(), "not numeric: %s", arg);
      switch (arg.op) {
      case NUMBER:
        coefficient = coefficient.multiply(requireNonNull(arg.numberValue()));
        break;
      case INFINITY:
        infinite = true;
        break;
      case NEGATIVE_INFINITY:
        infinite = true;
        coefficient = coefficient.negate();
        break;
      case UNDEFINED:
        return undefined;
      case POW:
        final Rational n = arg.args().get(1).numberValue();
        if (n != null) {
          powers.merge(arg.args().get(0), n, Rational::add);
          break;
        }
        // fall through
      default:
        powers.merge(arg, Rational.ONE, Rational::add);
      }
    }
    if (infinite) {
      if (coefficient.signum() == 0) {
        return undefined;
      }
      if (powers.isEmpty()) {
        return coefficient.signum() > 0 ? infinity : negativeInfinity;
      }
      powers.put(infinity, Rational.ONE);
      coefficient = Rational.of(coefficient.signum());
    }
    if (coefficient.signum() == 0) {
      return zero;
    }
    final List<Expr.Exp> factors = new ArrayList<>();
    powers.forEach((base, n) -> {
      if (n.equals(Rational.ONE)) {
        factors.add(base);
      } else if (n.signum() != 0) {
        factors.add(pow(base, number(n)));
      }
    });
    factors.sort(Expr.ORDERING);
    if (factors.isEmpty()) {
      return number(coefficient);
    }
    if (factors.size() == 1) {
      final Expr.Exp factor = factors.get(0);
      if (coefficient.equals(Rational.ONE)) {
        return factor;
      }
      if (factor.op == Op.ADD) {
        final List<Expr.Exp> terms = new ArrayList<>();
        for (Expr.Exp term : factor.args()) {
          terms.add(mul(number(coefficient), term));
        }
        return add(terms);
      }
    }
    if (!coefficient.equals(Rational.ONE)) {
      factors.add(0, number(coefficient));
    }
    return intern(new Expr.Call(Op.MUL, ImmutableList.copyOf(factors)));
  }

  public Expr.Exp neg(Expr.Exp e) {
    return mul(minusOne, e);
  }

  public Expr.Exp sub(Expr.Exp a, Expr.Exp b) {
    return add(a, neg(b));
  }

  public Expr.Exp div(Expr.Exp a, Expr.Exp b) {
    return mul(a, pow(b, minusOne));
  }

  /** Creates a power. Folds integer powers of numbers and of products, and
   * powers of powers. */
  public Expr.Exp pow(Expr.Exp base, Expr.Exp exponent) {
    checkArgument(base.dtype().isNumeric() && exponent.dtype().isNumeric(),
        "not numeric: %s ^ %s", base, exponent);
    final Rational n = exponent.numberValue();
    if (n == null) {
      if (base.equals(one)) {
        return one;
      }
      return intern(
          new Expr.Call(Op.POW, ImmutableList.of(base, exponent)));
    }
    if (n.signum() == 0) {
      return one;
    }
    if (n.equals(Rational.ONE)) {
      return base;
    }
    switch (base.op) {
    case NUMBER:
      if (n.isInteger()) {
        final Rational value = requireNonNull(base.numberValue());
        if (value.signum() == 0) {
          return n.signum() < 0 ? undefined : zero;
        }
        return number(value.pow(n.intValueExact()));
      }
      break;
    case INFINITY:
      return n.signum() > 0 ? infinity : zero;
    case UNDEFINED:
      return undefined;
    case POW:
      final Rational m = base.args().get(1).numberValue();
      if (m != null && n.isInteger()) {
        return pow(base.args().get(0), number(m.multiply(n)));
      }
      break;
    case MUL:
      if (n.isInteger()) {
        final List<Expr.Exp> factors = new ArrayList<>();
        for (Expr.Exp factor : base.args()) {
          factors.add(pow(factor, exponent));
        }
        return mul(factors);
      }
      break;
    default:
      break;
    }
    return intern(new Expr.Call(Op.POW, ImmutableList.of(base, exponent)));
  }

  public Expr.Exp min(Expr.Exp... args) {
    return min(Arrays.asList(args));
  }

  public Expr.Exp min(List<? extends Expr.Exp> args) {
    return extremum(Op.MIN, args);
  }

  public Expr.Exp max(Expr.Exp... args) {
    return max(Arrays.asList(args));
  }

  public Expr.Exp max(List<? extends Expr.Exp> args) {
    return extremum(Op.MAX, args);
  }

  /** Creates a minimum or maximum, dropping arguments that are provably not
   * the extreme. */
  private Expr.Exp extremum(Op op, List<? extends Expr.Exp> args) {
    final boolean isMin = op == Op.MIN;
    final List<Expr.Exp> flat = new ArrayList<>();
    flatten(op, args, flat);
    final List<Expr.Exp> kept = new ArrayList<>();
    for (Expr.Exp arg : flat) {
      checkArgument(arg.dtype().isNumeric(), "not numeric: %s", arg);
      if (arg.op == Op.UNDEFINED) {
        return undefined;
      }
      if (arg.op == (isMin ? Op.INFINITY : Op.NEGATIVE_INFINITY)) {
        continue;
      }
      if (arg.op == (isMin ? Op.NEGATIVE_INFINITY : Op.INFINITY)) {
        return arg;
      }
      boolean dominated = false;
      for (Iterator<Expr.Exp> iterator = kept.iterator();
           iterator.hasNext();) {
        Sign sign = Facts.sign(sub(arg, iterator.next()));
        if (sign == null) {
          continue;
        }
        if (!isMin) {
          sign = sign.negate();
        }
        if (sign.isNonNegative()) {
          dominated = true;
          break;
        }
        if (sign.isNonPositive()) {
          iterator.remove();
        }
      }
      if (!dominated) {
        kept.add(arg);
      }
    }
    switch (kept.size()) {
    case 0:
      return isMin ? infinity : negativeInfinity;
    case 1:
      return kept.get(0);
    default:
      kept.sort(Expr.ORDERING);
      return intern(new Expr.Call(op, ImmutableList.copyOf(kept)));
    }
  }

  /** Creates a Kronecker delta, which is 1 if its arguments are equal and 0
   * otherwise. */
  public Expr.Exp kroneckerDelta(Expr.Exp a, Expr.Exp b) {
    final Expr.Exp eq = eq(a, b);
    if (eq.isTrue()) {
      return one;
    }
    if (eq.isFalse()) {
      return zero;
    }
    final List<Expr.Exp> args = new ArrayList<>(Arrays.asList(a, b));
    args.sort(Expr.ORDERING);
    return intern(
        new Expr.Call(Op.KRONECKER_DELTA, ImmutableList.copyOf(args)));
  }

  /** Applies an uninterpreted function. */
  public Expr.Exp apply(String name, DType type, List<? extends Expr.Exp> args) {
    return intern(new Expr.Apply(name, type, ImmutableList.copyOf(args)));
  }

  public Expr.Exp apply(String name, DType type, Expr.Exp... args) {
    return apply(name, type, Arrays.asList(args));
  }

  /** Creates an array literal. */
  public Expr.Exp array(List<? extends Expr.Exp> elements) {
    for (Expr.Exp element : elements) {
      checkArgument(element.shape().equals(elements.get(0).shape()),
          "elements of an array must have the same shape");
    }
    return intern(
        new Expr.Call(Op.ARRAY, ImmutableList.copyOf(elements)));
  }

  /** Indexes an array-valued expression. Selects the element of an array
   * literal, and specializes a binder. */
  public Expr.Exp indexed(Expr.Exp base, List<? extends Expr.Exp> indices) {
    if (indices.isEmpty()) {
      return base;
    }
    final Expr.Exp index = indices.get(0);
    final List<? extends Expr.Exp> rest = indices.subList(1, indices.size());
    if (base.op == Op.ARRAY && index.op == Op.NUMBER) {
      final Rational n = requireNonNull(index.numberValue());
      checkArgument(n.isInteger()
              && n.signum() >= 0
              && n.compareTo(Rational.of(base.args().size())) < 0,
          "index %s out of range for %s", index, base);
      return indexed(base.args().get(n.intValueExact()), rest);
    }
    if (base instanceof Expr.Binder) {
      return indexed(Binders.index(base, index), rest);
    }
    checkArgument(base.shape().size() >= indices.size(),
        "too many indices for %s", base);
    return intern(
        new Expr.Call(Op.INDEXED,
            ImmutableList.<Expr.Exp>builder().add(base).addAll(indices)
                .build()));
  }

  public Expr.Exp indexed(Expr.Exp base, Expr.Exp... indices) {
    return indexed(base, Arrays.asList(indices));
  }

  /** Creates a case split from arguments {@code [e0, c0, e1, c1, ...]}.
   * Drops false branches, stops at the first true condition, and supplies
   * {@link #undefined()} if no condition is true. */
  public Expr.Exp piecewise(List<? extends Expr.Exp> args) {
    checkArgument(args.size() % 2 == 0, "odd number of arguments");
    final List<Expr.Exp> out = new ArrayList<>();
    for (int i = 0; i < args.size(); i += 2) {
      final Expr.Exp e = args.get(i);
      Expr.Exp c = args.get(i + 1);
      checkArgument(c.isBoolean(), "not a condition: %s", c);
      if (c.isFalse()) {
        continue;
      }
      final int n = out.size();
      if (n > 0 && out.get(n - 2).equals(e)) {
        c = or(out.get(n - 1), c);
        out.set(n - 1, c);
      } else {
        out.add(e);
        out.add(c);
      }
      if (c.isTrue()) {
        break;
      }
    }
    if (out.isEmpty() || !out.get(out.size() - 1).isTrue()) {
      out.add(undefined);
      out.add(trueLiteral);
    }
    if (out.size() == 2) {
      return out.get(0);
    }
    return intern(new Expr.Call(Op.PIECEWISE, ImmutableList.copyOf(out)));
  }

  public Expr.Exp piecewise(Expr.Exp... args) {
    return piecewise(Arrays.asList(args));
  }

  // relations

  public Expr.Exp eq(Expr.Exp a, Expr.Exp b) {
    return relation(Op.EQ, a, b);
  }

  public Expr.Exp ne(Expr.Exp a, Expr.Exp b) {
    return relation(Op.NE, a, b);
  }

  public Expr.Exp lt(Expr.Exp a, Expr.Exp b) {
    return relation(Op.LT, a, b);
  }

  public Expr.Exp le(Expr.Exp a, Expr.Exp b) {
    return relation(Op.LE, a, b);
  }

  public Expr.Exp gt(Expr.Exp a, Expr.Exp b) {
    return relation(Op.GT, a, b);
  }

  public Expr.Exp ge(Expr.Exp a, Expr.Exp b) {
    return relation(Op.GE, a, b);
  }

  /** Creates a comparison, evaluating it if the sign of {@code a - b} is
   * known. */
  public Expr.Exp relation(Op op, Expr.Exp a, Expr.Exp b) {
    checkArgument(op.isRelation(), "not a relation: %s", op);
    if (a.equals(b)) {
      return bool(op == Op.EQ || op == Op.LE || op == Op.GE);
    }
    if (!a.dtype().isNumeric() || !b.dtype().isNumeric()) {
      checkArgument(op == Op.EQ || op == Op.NE,
          "cannot order %s and %s", a, b);
      if (a instanceof Expr.Atom && b instanceof Expr.Atom) {
        return bool(op == Op.NE);
      }
      return intern(new Expr.Call(op, ImmutableList.of(a, b)));
    }
    if ((op == Op.EQ || op == Op.NE)
        && (isFraction(a) && b.dtype() == DType.INTEGER
            || isFraction(b) && a.dtype() == DType.INTEGER)) {
      return bool(op == Op.NE);
    }
    final Sign sign = Facts.sign(sub(a, b));
    if (sign != null) {
      final Boolean value = decide(op, sign);
      if (value != null) {
        return bool(value);
      }
    }
    return intern(new Expr.Call(op, ImmutableList.of(a, b)));
  }

  private static boolean isFraction(Expr.Exp e) {
    return e.op == Op.NUMBER && !requireNonNull(e.numberValue()).isInteger();
  }

  /** Decides a relation given the sign of the difference of its operands;
   * returns null if the sign is not precise enough. */
  private static @Nullable Boolean decide(Op op, Sign sign) {
    switch (op) {
    case EQ:
    case NE:
      if (sign == Sign.ZERO) {
        return op == Op.EQ;
      }
      if (sign == Sign.POSITIVE || sign == Sign.NEGATIVE) {
        return op == Op.NE;
      }
      return null;
    case LT:
      return sign == Sign.NEGATIVE ? Boolean.TRUE
          : sign.isNonNegative() ? Boolean.FALSE : null;
    case LE:
      return sign.isNonPositive() ? Boolean.TRUE
          : sign == Sign.POSITIVE ? Boolean.FALSE : null;
    case GT:
      return sign == Sign.POSITIVE ? Boolean.TRUE
          : sign.isNonPositive() ? Boolean.FALSE : null;
    case GE:
      return sign.isNonNegative() ? Boolean.TRUE
          : sign == Sign.NEGATIVE ? Boolean.FALSE : null;
    default:
      throw new AssertionError(op);
    }
  }

  // logic

  /** Creates a negation. Flips relations and memberships, applies De
   * Morgan's laws, and turns a negated ForAll into an Exists of the
   * negation, and vice versa. */
  public Expr.Exp not(Expr.Exp e) {
    checkArgument(e.isBoolean(), "not a condition: %s", e);
    switch (e.op) {
    case TRUE:
      return falseLiteral;
    case FALSE:
      return trueLiteral;
    case NOT:
      return e.args().get(0);
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      if (e.args().get(0).dtype().isNumeric() || e.op == Op.EQ
          || e.op == Op.NE) {
        return relation(e.op.negate(), e.args().get(0), e.args().get(1));
      }
      break;
    case CONTAINS:
      return notContains(e.args().get(0), e.args().get(1));
    case NOT_CONTAINS:
      return contains(e.args().get(0), e.args().get(1));
    case AND:
      return or(negateAll(e.args()));
    case OR:
      return and(negateAll(e.args()));
    case BINDER:
      final Expr.Binder binder = (Expr.Binder) e;
      if (binder.variant.isQuantifier()) {
        return bind(
            binder.variant == Variant.FOR_ALL
                ? Variant.EXISTS
                : Variant.FOR_ALL,
            not(binder.function), binder.limits);
      }
      break;
    default:
      break;
    }
    return intern(new Expr.Call(Op.NOT, ImmutableList.of(e)));
  }

  private List<Expr.Exp> negateAll(List<Expr.Exp> args) {
    final List<Expr.Exp> list = new ArrayList<>();
    args.forEach(arg -> list.add(not(arg)));
    return list;
  }

  public Expr.Exp and(Expr.Exp... args) {
    return and(Arrays.asList(args));
  }

  public Expr.Exp and(List<? extends Expr.Exp> args) {
    return junction(Op.AND, args);
  }

  public Expr.Exp or(Expr.Exp... args) {
    return or(Arrays.asList(args));
  }

  public Expr.Exp or(List<? extends Expr.Exp> args) {
    return junction(Op.OR, args);
  }

  /** Creates a conjunction or disjunction. Flattens, removes the unit and
   * duplicates, and detects an argument together with its negation. */
  private Expr.Exp junction(Op op, List<? extends Expr.Exp> args) {
    final Expr.Exp unit = op == Op.AND ? trueLiteral : falseLiteral;
    final Expr.Exp zero = op == Op.AND ? falseLiteral : trueLiteral;
    final List<Expr.Exp> flat = new ArrayList<>();
    flatten(op, args, flat);
    final Set<Expr.Exp> set = new LinkedHashSet<>();
    for (Expr.Exp arg : flat) {
      checkArgument(arg.isBoolean(), "not a condition: %s", arg);
      if (arg.equals(zero)) {
        return zero;
      }
      if (!arg.equals(unit)) {
        set.add(arg);
      }
    }
    for (Expr.Exp arg : set) {
      if (isLiteral(arg) && set.contains(not(arg))) {
        return zero;
      }
    }
    final List<Expr.Exp> list = new ArrayList<>(set);
    switch (list.size()) {
    case 0:
      return unit;
    case 1:
      return list.get(0);
    default:
      list.sort(Expr.ORDERING);
      return intern(new Expr.Call(op, ImmutableList.copyOf(list)));
    }
  }

  /** Whether a condition is atomic or a negated atom. */
  private static boolean isLiteral(Expr.Exp e) {
    return e.op == Op.NOT
        || e.op.isRelation()
        || e.op == Op.CONTAINS
        || e.op == Op.NOT_CONTAINS;
  }

  // membership

  /** Creates a membership test, evaluating it if possible. */
  public Expr.Exp contains(Expr.Exp element, Expr.Exp set) {
    checkArgument(set.isSet(), "not a set: %s", set);
    final Boolean b = Sets.contains(set, element);
    if (b != null) {
      return bool(b);
    }
    return intern(new Expr.Call(Op.CONTAINS, ImmutableList.of(element, set)));
  }

  public Expr.Exp notContains(Expr.Exp element, Expr.Exp set) {
    checkArgument(set.isSet(), "not a set: %s", set);
    final Boolean b = Sets.contains(set, element);
    if (b != null) {
      return bool(!b);
    }
    return intern(
        new Expr.Call(Op.NOT_CONTAINS, ImmutableList.of(element, set)));
  }

  public Expr.Exp subset(Expr.Exp a, Expr.Exp b) {
    checkArgument(a.isSet() && b.isSet(), "not sets: %s, %s", a, b);
    final Boolean value = Sets.isSubset(a, b);
    if (value != null) {
      return bool(value);
    }
    return intern(new Expr.Call(Op.SUBSET, ImmutableList.of(a, b)));
  }

  // sets

  public Expr.Exp finiteSet(Expr.Exp... elements) {
    return finiteSet(Arrays.asList(elements));
  }

  /** Creates a set from a list of elements. Removes duplicates. */
  public Expr.Exp finiteSet(List<? extends Expr.Exp> elements) {
    final List<Expr.Exp> list =
        new ArrayList<>(new LinkedHashSet<Expr.Exp>(elements));
    if (list.isEmpty()) {
      return emptySet;
    }
    list.sort(Expr.ORDERING);
    return intern(new Expr.Call(Op.FINITE_SET, ImmutableList.copyOf(list)));
  }

  /** Creates a closed interval. */
  public Expr.Exp interval(Expr.Exp lower, Expr.Exp upper, boolean integer) {
    return interval(lower, upper, false, false, integer);
  }

  /** Creates an interval. An integer interval is made closed, a reversed
   * interval is empty, and a single-point interval is a singleton. */
  public Expr.Exp interval(Expr.Exp lower, Expr.Exp upper, boolean leftOpen,
      boolean rightOpen, boolean integer) {
    checkArgument(lower.dtype().isNumeric() && upper.dtype().isNumeric(),
        "bounds must be numeric: %s, %s", lower, upper);
    if (lower.op == Op.INFINITY || upper.op == Op.NEGATIVE_INFINITY) {
      return emptySet;
    }
    if (lower.op == Op.NEGATIVE_INFINITY) {
      leftOpen = true;
    }
    if (upper.op == Op.INFINITY) {
      rightOpen = true;
    }
    if (integer) {
      final Rational lo = lower.numberValue();
      if (lo != null) {
        lower = number(leftOpen ? lo.floor().add(Rational.ONE) : lo.ceil());
        leftOpen = false;
      } else if (leftOpen && lower.op != Op.NEGATIVE_INFINITY
          && lower.dtype() == DType.INTEGER) {
        lower = add(lower, one);
        leftOpen = false;
      }
      final Rational hi = upper.numberValue();
      if (hi != null) {
        upper = number(rightOpen ? hi.ceil().subtract(Rational.ONE)
            : hi.floor());
        rightOpen = false;
      } else if (rightOpen && upper.op != Op.INFINITY
          && upper.dtype() == DType.INTEGER) {
        upper = sub(upper, one);
        rightOpen = false;
      }
    }
    final Sign sign = Facts.sign(sub(upper, lower));
    if (sign == Sign.NEGATIVE) {
      return emptySet;
    }
    if (sign == Sign.ZERO) {
      return leftOpen || rightOpen ? emptySet : finiteSet(lower);
    }
    return intern(
        new Expr.Interval(lower, upper, leftOpen, rightOpen, integer));
  }

  public Expr.Exp union(Expr.Exp... args) {
    return union(Arrays.asList(args));
  }

  /** Creates a union. Merges finite sets and overlapping intervals, and
   * drops arguments contained in other arguments. */
  public Expr.Exp union(List<? extends Expr.Exp> args) {
    final List<Expr.Exp> flat = new ArrayList<>();
    flatten(Op.UNION, args, flat);
    final List<Expr.Exp> sets = new ArrayList<>();
    final Set<Expr.Exp> elements = new LinkedHashSet<>();
    for (Expr.Exp arg : flat) {
      checkArgument(arg.isSet(), "not a set: %s", arg);
      switch (arg.op) {
      case EMPTY_SET:
        break;
      case UNIVERSAL_SET:
        return universalSet;
      case FINITE_SET:
        elements.addAll(arg.args());
        break;
      default:
        if (!sets.contains(arg)) {
          sets.add(arg);
        }
      }
    }
    mergePairs(sets, this::unionOfIntervals);
    elements.removeIf(e ->
        anyMatch(sets, s -> Boolean.TRUE.equals(Sets.contains(s, e))));
    removeIf(sets, (a, b) -> Boolean.TRUE.equals(Sets.isSubset(a, b)));
    if (!elements.isEmpty()) {
      sets.add(finiteSet(new ArrayList<>(elements)));
    }
    switch (sets.size()) {
    case 0:
      return emptySet;
    case 1:
      return sets.get(0);
    default:
      sets.sort(Expr.ORDERING);
      return intern(new Expr.Call(Op.UNION, ImmutableList.copyOf(sets)));
    }
  }

  public Expr.Exp intersection(Expr.Exp... args) {
    return intersection(Arrays.asList(args));
  }

  /** Creates an intersection. Filters finite sets, intersects intervals,
   * and drops arguments that contain other arguments. */
  public Expr.Exp intersection(List<? extends Expr.Exp> args) {
    final List<Expr.Exp> flat = new ArrayList<>();
    flatten(Op.INTERSECTION, args, flat);
    final List<Expr.Exp> sets = new ArrayList<>();
    for (Expr.Exp arg : flat) {
      checkArgument(arg.isSet(), "not a set: %s", arg);
      if (arg.op == Op.EMPTY_SET) {
        return emptySet;
      }
      if (arg.op != Op.UNIVERSAL_SET && !sets.contains(arg)) {
        sets.add(arg);
      }
    }
    for (int i = 0; i < sets.size(); i++) {
      final Expr.Exp s = sets.get(i);
      if (s.op == Op.COMPLEMENT) {
        final List<Expr.Exp> others = new ArrayList<>(sets);
        others.set(i, s.args().get(0));
        return complement(intersection(others), s.args().get(1));
      }
    }
    for (int i = 0; i < sets.size(); i++) {
      final Expr.Exp s = sets.get(i);
      if (s.op == Op.FINITE_SET) {
        final List<Expr.Exp> kept = new ArrayList<>();
        boolean decided = true;
        for (Expr.Exp e : s.args()) {
          Boolean in = Boolean.TRUE;
          for (Expr.Exp other : sets) {
            if (other != s) {
              final Boolean b = Sets.contains(other, e);
              if (Boolean.FALSE.equals(b)) {
                in = Boolean.FALSE;
                break;
              }
              if (b == null) {
                in = null;
              }
            }
          }
          if (in == null) {
            decided = false;
          }
          if (!Boolean.FALSE.equals(in)) {
            kept.add(e);
          }
        }
        final Expr.Exp filtered = finiteSet(kept);
        if (decided || filtered.op == Op.EMPTY_SET) {
          return filtered;
        }
        sets.set(i, filtered);
      }
    }
    mergePairs(sets, this::intersectionOfIntervals);
    removeIf(sets, (a, b) -> Boolean.TRUE.equals(Sets.isSubset(b, a)));
    switch (sets.size()) {
    case 0:
      return universalSet;
    case 1:
      return sets.get(0);
    default:
      sets.sort(Expr.ORDERING);
      return intern(
          new Expr.Call(Op.INTERSECTION, ImmutableList.copyOf(sets)));
    }
  }

  /** Creates the set of elements of {@code a} that are not in {@code b}. */
  public Expr.Exp complement(Expr.Exp a, Expr.Exp b) {
    checkArgument(a.isSet() && b.isSet(), "not sets: %s, %s", a, b);
    if (b.op == Op.EMPTY_SET) {
      return a;
    }
    if (a.op == Op.EMPTY_SET
        || b.op == Op.UNIVERSAL_SET
        || a.equals(b)
        || Boolean.TRUE.equals(Sets.isSubset(a, b))) {
      return emptySet;
    }
    if (a.op == Op.FINITE_SET) {
      final List<Expr.Exp> kept = new ArrayList<>();
      boolean decided = true;
      for (Expr.Exp e : a.args()) {
        final Boolean in = Sets.contains(b, e);
        if (in == null) {
          decided = false;
        }
        if (!Boolean.TRUE.equals(in)) {
          kept.add(e);
        }
      }
      final Expr.Exp rest = finiteSet(kept);
      if (decided || rest.op == Op.EMPTY_SET) {
        return rest;
      }
      a = rest;
    }
    if (a.op == Op.INTERVAL && b.op == Op.FINITE_SET) {
      Expr.Interval interval = (Expr.Interval) a;
      final List<Expr.Exp> elements = new ArrayList<>(b.args());
      for (boolean changed = true; changed && interval.integer;) {
        changed = false;
        for (Iterator<Expr.Exp> iterator = elements.iterator();
             iterator.hasNext();) {
          final Expr.Exp e = iterator.next();
          Expr.Exp s = interval;
          if (e.equals(interval.lower)) {
            s = interval(add(interval.lower, one), interval.upper, true);
          } else if (e.equals(interval.upper)) {
            s = interval(interval.lower, sub(interval.upper, one), true);
          } else if (Boolean.FALSE.equals(Sets.contains(interval, e))) {
            iterator.remove();
            changed = true;
            continue;
          }
          if (s != interval) {
            iterator.remove();
            changed = true;
            if (s.op != Op.INTERVAL) {
              return complement(s, finiteSet(elements));
            }
            interval = (Expr.Interval) s;
          }
        }
      }
      a = interval;
      b = finiteSet(elements);
      if (b.op == Op.EMPTY_SET) {
        return a;
      }
    }
    if (Boolean.TRUE.equals(Sets.isEmpty(intersection(a, b)))) {
      return a;
    }
    return intern(new Expr.Call(Op.COMPLEMENT, ImmutableList.of(a, b)));
  }

  /** Creates the set of elements of {@code base} for which {@code condition}
   * holds when substituted for {@code variable}. */
  public Expr.Exp conditionSet(Expr.Symbol variable, Expr.Exp condition,
      Expr.Exp base) {
    checkArgument(condition.isBoolean(), "not a condition: %s", condition);
    if (condition.isTrue()) {
      return base;
    }
    if (condition.isFalse()) {
      return emptySet;
    }
    if (!FreeFinder.occursFree(condition, variable)) {
      return intern(new Expr.Call(Op.PIECEWISE,
          ImmutableList.of(base, condition, emptySet, trueLiteral)));
    }
    if (base.op == Op.FINITE_SET) {
      final List<Expr.Exp> kept = new ArrayList<>();
      for (Expr.Exp e : base.args()) {
        final Expr.Exp c = Substituter.substitute(condition, variable, e);
        if (c.isFalse()) {
          continue;
        }
        if (!c.isTrue()) {
          return intern(new Expr.ConditionSet(variable, condition, base));
        }
        kept.add(e);
      }
      return finiteSet(kept);
    }
    return intern(new Expr.ConditionSet(variable, condition, base));
  }

  /** Calls {@code merger} on each pair of elements; when it returns a
   * non-null value, replaces the pair with that value and starts again. */
  private static void mergePairs(List<Expr.Exp> sets, Merger merger) {
    restart:
    for (;;) {
      for (int i = 0; i < sets.size(); i++) {
        for (int j = i + 1; j < sets.size(); j++) {
          final Expr.Exp merged = merger.merge(sets.get(i), sets.get(j));
          if (merged != null) {
            sets.remove(j);
            sets.set(i, merged);
            continue restart;
          }
        }
      }
      return;
    }
  }

  /** Removes each element {@code a} for which there is another element
   * {@code b} such that {@code redundant.test(a, b)}. */
  private static void removeIf(List<Expr.Exp> sets, Redundancy redundant) {
    final Set<Integer> removed = new HashSet<>();
    for (int i = 0; i < sets.size(); i++) {
      for (int j = 0; j < sets.size(); j++) {
        if (i != j && !removed.contains(j)
            && redundant.test(sets.get(i), sets.get(j))) {
          removed.add(i);
          break;
        }
      }
    }
    for (int i = sets.size() - 1; i >= 0; i--) {
      if (removed.contains(i)) {
        sets.remove(i);
      }
    }
  }

  private Expr.@Nullable Exp unionOfIntervals(Expr.Exp a, Expr.Exp b) {
    if (a.op != Op.INTERVAL || b.op != Op.INTERVAL) {
      return null;
    }
    final Expr.Interval x = (Expr.Interval) a;
    final Expr.Interval y = (Expr.Interval) b;
    if (x.integer != y.integer) {
      return null;
    }
    final Expr.Exp gap = x.integer ? one : zero;
    final Sign s0 = Facts.sign(sub(y.lower, add(x.upper, gap)));
    final Sign s1 = Facts.sign(sub(x.lower, add(y.upper, gap)));
    final boolean overlap = x.integer
        ? s0 != null && s0.isNonPositive() && s1 != null && s1.isNonPositive()
        : s0 == Sign.NEGATIVE && s1 == Sign.NEGATIVE;
    if (!overlap) {
      return null;
    }
    final Sign lowerSign = Facts.sign(sub(x.lower, y.lower));
    final Sign upperSign = Facts.sign(sub(x.upper, y.upper));
    if (lowerSign == null || upperSign == null) {
      return null;
    }
    final Expr.Interval low = lowerSign.isNonPositive() ? x : y;
    final Expr.Interval high = upperSign.isNonNegative() ? x : y;
    return interval(low.lower, high.upper,
        lowerSign == Sign.ZERO ? x.leftOpen && y.leftOpen : low.leftOpen,
        upperSign == Sign.ZERO ? x.rightOpen && y.rightOpen : high.rightOpen,
        x.integer);
  }

  private Expr.@Nullable Exp intersectionOfIntervals(Expr.Exp a,
      Expr.Exp b) {
    if (a.op != Op.INTERVAL || b.op != Op.INTERVAL) {
      return null;
    }
    Expr.Interval x = (Expr.Interval) a;
    Expr.Interval y = (Expr.Interval) b;
    if (x.integer != y.integer) {
      final Expr.Interval real = x.integer ? y : x;
      final Expr.Exp converted = interval(real.lower, real.upper,
          real.leftOpen, real.rightOpen, true);
      if (converted.op != Op.INTERVAL) {
        return intersection(x.integer ? x : y, converted);
      }
      x = x.integer ? x : (Expr.Interval) converted;
      y = y.integer ? y : (Expr.Interval) converted;
    }
    final Sign lowerSign = Facts.sign(sub(x.lower, y.lower));
    final Sign upperSign = Facts.sign(sub(x.upper, y.upper));
    if (lowerSign == null || upperSign == null) {
      return null;
    }
    final Expr.Interval low = lowerSign.isNonNegative() ? x : y;
    final Expr.Interval high = upperSign.isNonPositive() ? x : y;
    return interval(low.lower, high.upper,
        lowerSign == Sign.ZERO ? x.leftOpen || y.leftOpen : low.leftOpen,
        upperSign == Sign.ZERO ? x.rightOpen || y.rightOpen : high.rightOpen,
        x.integer);
  }

  /** Combines two sets into one, or returns null. */
  private interface Merger {
    Expr.@Nullable Exp merge(Expr.Exp a, Expr.Exp b);
  }

  /** Decides whether a set is redundant given another set. */
  private interface Redundancy {
    boolean test(Expr.Exp a, Expr.Exp b);
  }

  // binders

  public Expr.Exp bind(Variant variant, Expr.Exp function, Limit... limits) {
    return bind(variant, function, Arrays.asList(limits));
  }

  /** Creates a bound-variable expression.
   *
   * <p>Collapses degenerate forms: no limits, a function equal to the
   * identity of the reduction, an interval limit whose bounds are equal, an
   * empty integer range, and an empty set. */
  public Expr.Exp bind(Variant variant, Expr.Exp function,
      List<Limit> limits) {
    final Set<Expr.Symbol> variables = new HashSet<>();
    for (int i = 0; i < limits.size(); i++) {
      final Limit limit = limits.get(i);
      checkArgument(variables.add(limit.variable),
          "variable %s is bound more than once", limit.variable);
      for (int j = i; j < limits.size(); j++) {
        for (Expr.Exp e : limit.expressions()) {
          checkArgument(!FreeFinder.occursFree(e, limits.get(j).variable),
              "domain of %s references %s, which is not bound by an earlier "
                  + "limit", limit.variable, limits.get(j).variable);
        }
      }
    }
    if (variant.isQuantifier()) {
      checkArgument(function.isBoolean(), "not a condition: %s", function);
    } else if (variant == Variant.UNION || variant == Variant.INTERSECTION) {
      checkArgument(function.isSet(), "not a set: %s", function);
    }
    if (limits.isEmpty()) {
      return function;
    }
    if (variant.isReduction() && function.equals(variant.identity())) {
      return function;
    }
    final Expr.Binder binder =
        intern(new Expr.Binder(variant, function,
            ImmutableList.copyOf(limits)));
    for (int i = limits.size() - 1; i >= 0; i--) {
      final Expr.Exp collapsed = collapse(binder, i);
      if (collapsed != null) {
        return collapsed;
      }
    }
    return binder;
  }

  /** Collapses limit {@code i} of a binder if it is degenerate, otherwise
   * returns null. */
  private Expr.@Nullable Exp collapse(Expr.Binder binder, int i) {
    final Variant variant = binder.variant;
    if (variant == Variant.MAPPING) {
      return null;
    }
    final Limit limit = binder.limits.get(i);
    if (limit.set != null && limit.set.op == Op.EMPTY_SET) {
      return variant.identity();
    }
    if (limit.lower == null || limit.upper == null) {
      return null;
    }
    final Sign sign = Facts.sign(sub(limit.upper, limit.lower));
    if (sign == Sign.ZERO) {
      switch (variant) {
      case INTEGRAL:
        return variant.identity();
      case ARG_MIN:
      case ARG_MAX:
        return binder.limits.size() == 1 ? limit.lower : null;
      default:
        return Binders.instantiate(binder, i, limit.lower);
      }
    }
    if (limit.variable.dtype() == DType.INTEGER
        && variant != Variant.INTEGRAL
        && Facts.sign(add(sub(limit.upper, limit.lower), one)) == Sign.ZERO) {
      return variant.identity();
    }
    // Reversed bounds are meaningful for sums, products and integrals; for
    // any other variant the range is empty.
    if (!variant.isKarr() && sign == Sign.NEGATIVE) {
      return variant.identity();
    }
    return null;
  }
}

// End ExprBuilder.java
