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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.axiom.ast.ExprBuilder.ex;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import net.hydromatic.axiom.type.Assumptions;
import net.hydromatic.axiom.type.DType;
import net.hydromatic.axiom.util.Rational;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expression tree.
 *
 * <p>Nodes are immutable. Create them using {@link ExprBuilder}, which puts
 * each node into canonical form and interns it, so that equal expressions are
 * usually the same object.
 */
public class Expr {
  private Expr() {}

  /** Canonical order of arguments of commutative operators: numbers first,
   * then by operator, then by string. */
  public static final Ordering<Exp> ORDERING =
      Ordering.from(
          Comparator.<Exp>comparingInt(e -> e.op == Op.NUMBER ? 0 : 1)
              .thenComparing(e -> e.op)
              .thenComparing(Exp::toString));

  /** Base class of all expressions. */
  public abstract static class Exp {
    public final Op op;
    private int hash;
    private @Nullable String string;

    Exp(Op op) {
      this.op = requireNonNull(op);
    }

    /** Returns the child expressions, in a fixed order. */
    public abstract List<Exp> args();

    /** Returns the attributes, other than {@link #op} and {@link #args()},
     * that take part in equality. */
    Object key() {
      return op;
    }

    /** Returns the element type. */
    public abstract DType dtype();

    /** Returns the shape; empty for a scalar. */
    public ImmutableList<Exp> shape() {
      return ImmutableList.of();
    }

    /** Accepts a shuttle, returning a possibly transformed expression. */
    public abstract Exp accept(Shuttle shuttle);

    /** Accepts a visitor. */
    public abstract void accept(Visitor visitor);

    abstract ExprWriter unparse(ExprWriter w, int left, int right);

    @Override public final String toString() {
      String s = string;
      if (s == null) {
        s = string = unparse(new ExprWriter(), 0, 0).toString();
      }
      return s;
    }

    @Override public final int hashCode() {
      int h = hash;
      if (h == 0) {
        h = Objects.hash(op, key(), args());
        hash = h == 0 ? 1 : h;
      }
      return hash;
    }

    @Override public final boolean equals(Object o) {
      if (o == this) {
        return true;
      }
      if (!(o instanceof Exp)) {
        return false;
      }
      final Exp e = (Exp) o;
      return op == e.op
          && hashCode() == e.hashCode()
          && key().equals(e.key())
          && args().equals(e.args());
    }

    public boolean isTrue() {
      return op == Op.TRUE;
    }

    public boolean isFalse() {
      return op == Op.FALSE;
    }

    public boolean isBoolean() {
      return dtype() == DType.BOOLEAN;
    }

    public boolean isSet() {
      return dtype() == DType.SET;
    }

    /** Whether this is a finite or infinite numeric constant. */
    public boolean isConstant() {
      return op == Op.NUMBER
          || op == Op.INFINITY
          || op == Op.NEGATIVE_INFINITY;
    }

    /** Returns the value if this is a number, otherwise null. */
    public @Nullable Rational numberValue() {
      return null;
    }

    /** Whether this is a negative number, negative infinity, or a product
     * whose numeric coefficient is negative. */
    public boolean isNegative() {
      switch (op) {
      case NUMBER:
        return requireNonNull(numberValue()).signum() < 0;
      case NEGATIVE_INFINITY:
        return true;
      case MUL:
        return args().get(0).op == Op.NUMBER && args().get(0).isNegative();
      default:
        return false;
      }
    }

    /** Whether {@code sub} occurs anywhere in this expression, free or
     * bound. */
    public boolean has(Exp sub) {
      final Deque<Exp> stack = new ArrayDeque<>();
      stack.push(this);
      while (!stack.isEmpty()) {
        final Exp e = stack.pop();
        if (e.equals(sub)) {
          return true;
        }
        e.args().forEach(stack::push);
      }
      return false;
    }
  }

  /** Variable. A dummy variable has a non-negative {@link #dummyIndex}, and
   * is never equal to a variable created independently. */
  public static class Symbol extends Exp {
    public final String name;
    public final Assumptions assumptions;
    public final int dummyIndex;
    private final Exp domain;

    Symbol(String name, Assumptions assumptions, int dummyIndex) {
      super(Op.SYMBOL);
      this.name = requireNonNull(name);
      this.assumptions = requireNonNull(assumptions);
      this.dummyIndex = dummyIndex;
      this.domain = assumptions.domain();
    }

    @Override public List<Exp> args() {
      return ImmutableList.of();
    }

    @Override Object key() {
      return Arrays.asList(name, assumptions, dummyIndex);
    }

    @Override public DType dtype() {
      return assumptions.dtype;
    }

    @Override public ImmutableList<Exp> shape() {
      return assumptions.shape;
    }

    public boolean isDummy() {
      return dummyIndex >= 0;
    }

    /** Returns the domain, derived from the assumptions. */
    public Exp domain() {
      return domain;
    }

    public @Nullable Exp definition() {
      return assumptions.definition;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return isDummy()
          ? w.append("_").append(name).append(Integer.toString(dummyIndex))
          : w.append(name);
    }
  }

  /** Exact rational number. */
  public static class Number extends Exp {
    public final Rational value;

    Number(Rational value) {
      super(Op.NUMBER);
      this.value = requireNonNull(value);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of();
    }

    @Override Object key() {
      return value;
    }

    @Override public DType dtype() {
      return value.isInteger() ? DType.INTEGER : DType.RATIONAL;
    }

    @Override public Rational numberValue() {
      return value;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      final boolean compound = value.signum() < 0 || !value.isInteger();
      if (compound && (left > Op.MUL.left || right > Op.MUL.left)) {
        return w.append("(").append(value.toString()).append(")");
      }
      return w.append(value.toString());
    }
  }

  /** Constant with no attributes other than its operator: infinity, truth
   * values, the empty and universal sets, undefined. */
  public static class Atom extends Exp {
    Atom(Op op) {
      super(op);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of();
    }

    @Override public DType dtype() {
      switch (op) {
      case TRUE:
      case FALSE:
        return DType.BOOLEAN;
      case EMPTY_SET:
      case UNIVERSAL_SET:
        return DType.SET;
      case INFINITY:
      case NEGATIVE_INFINITY:
        return DType.REAL;
      default:
        return DType.COMPLEX;
      }
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      switch (op) {
      case TRUE:
        return w.append("true");
      case FALSE:
        return w.append("false");
      case EMPTY_SET:
        return w.append("∅");
      case UNIVERSAL_SET:
        return w.append("𝕌");
      case INFINITY:
        return w.append("oo");
      case NEGATIVE_INFINITY:
        return w.append("-oo");
      case UNDEFINED:
        return w.append("undefined");
      default:
        throw new AssertionError(op);
      }
    }
  }

  /** Application of a built-in operator to a list of arguments.
   *
   * <p>A {@link Op#PIECEWISE} call has arguments
   * {@code [e0, c0, e1, c1, ...]}; its last condition is always true. */
  public static class Call extends Exp {
    public final ImmutableList<Exp> args;

    Call(Op op, ImmutableList<Exp> args) {
      super(op);
      this.args = requireNonNull(args);
    }

    @Override public List<Exp> args() {
      return args;
    }

    public Exp arg(int i) {
      return args.get(i);
    }

    @Override public DType dtype() {
      switch (op) {
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case NOT:
      case AND:
      case OR:
      case CONTAINS:
      case NOT_CONTAINS:
      case SUBSET:
        return DType.BOOLEAN;
      case FINITE_SET:
      case UNION:
      case INTERSECTION:
      case COMPLEMENT:
        return DType.SET;
      case KRONECKER_DELTA:
        return DType.INTEGER;
      case INDEXED:
        return args.get(0).dtype();
      case POW:
        final Rational n = args.get(1).numberValue();
        if (n != null && n.isInteger() && n.signum() >= 0) {
          return args.get(0).dtype();
        }
        return args.get(0).dtype().join(
            n != null && n.isInteger() ? DType.RATIONAL : DType.REAL);
      case PIECEWISE:
        DType t = null;
        for (int i = 0; i < args.size(); i += 2) {
          if (args.get(i).op != Op.UNDEFINED) {
            t = t == null ? args.get(i).dtype() : t.join(args.get(i).dtype());
          }
        }
        return t == null ? DType.COMPLEX : t;
      default:
        DType t2 = args.get(0).dtype();
        for (Exp arg : args) {
          t2 = t2.join(arg.dtype());
        }
        return t2;
      }
    }

    @Override public ImmutableList<Exp> shape() {
      switch (op) {
      case ARRAY:
        return ImmutableList.<Exp>builder()
            .add(ex.number(args.size()))
            .addAll(args.isEmpty()
                ? ImmutableList.of()
                : args.get(0).shape())
            .build();
      case INDEXED:
        final ImmutableList<Exp> baseShape = args.get(0).shape();
        final int n = Math.min(args.size() - 1, baseShape.size());
        return baseShape.subList(n, baseShape.size());
      case ADD:
      case MUL:
        for (Exp arg : args) {
          if (!arg.shape().isEmpty()) {
            return arg.shape();
          }
        }
        return ImmutableList.of();
      case PIECEWISE:
        return args.get(0).shape();
      default:
        return ImmutableList.of();
      }
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Returns a call with the same operator and different arguments. */
    public Exp copy(List<Exp> args) {
      return args.equals(this.args) ? this : ex.call(op, args);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      switch (op) {
      case ADD:
        return w.sum(left, args, right);
      case MUL:
        if (args.get(0).equals(ex.minusOne())) {
          if (left > op.left || op.right < right) {
            return w.append("(").append(this, 0, 0).append(")");
          }
          w.append("-");
          final List<Exp> rest = args.subList(1, args.size());
          return rest.size() == 1
              ? rest.get(0).unparse(w, op.right, right)
              : w.infix(op.right, rest, op, right);
        }
        return w.infix(left, args, op, right);
      case POW:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case AND:
      case OR:
      case CONTAINS:
      case NOT_CONTAINS:
      case SUBSET:
      case UNION:
      case INTERSECTION:
      case COMPLEMENT:
        return w.infix(left, args, op, right);
      case NOT:
        return w.prefix(left, op, args.get(0), right);
      case MIN:
        return w.call("Min", args);
      case MAX:
        return w.call("Max", args);
      case KRONECKER_DELTA:
        return w.call("KroneckerDelta", args);
      case INDEXED:
        w.append(args.get(0), op.left, op.right).append("[");
        return w.appendAll(args.subList(1, args.size()), ", ").append("]");
      case ARRAY:
        return w.append("[").appendAll(args, ", ").append("]");
      case FINITE_SET:
        return w.append("{").appendAll(args, ", ").append("}");
      case PIECEWISE:
        w.append("Piecewise(");
        for (int i = 0; i < args.size(); i += 2) {
          if (i > 0) {
            w.append(", ");
          }
          w.append("(").append(args.get(i), 0, 0).append(", ")
              .append(args.get(i + 1), 0, 0).append(")");
        }
        return w.append(")");
      default:
        throw new AssertionError(op);
      }
    }
  }

  /** Application of an uninterpreted function, such as {@code f(x)}. */
  public static class Apply extends Exp {
    public final String name;
    public final DType type;
    public final ImmutableList<Exp> args;

    Apply(String name, DType type, ImmutableList<Exp> args) {
      super(Op.APPLY);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.args = requireNonNull(args);
    }

    @Override public List<Exp> args() {
      return args;
    }

    @Override Object key() {
      return Arrays.asList(name, type);
    }

    @Override public DType dtype() {
      return type;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Exp copy(List<Exp> args) {
      return args.equals(this.args) ? this : ex.apply(name, type, args);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.call(name, args);
    }
  }

  /** Interval of real numbers, or (if {@link #integer}) of integers.
   *
   * <p>An integer interval always has closed finite ends. An infinite end is
   * always open. */
  public static class Interval extends Exp {
    public final Exp lower;
    public final Exp upper;
    public final boolean leftOpen;
    public final boolean rightOpen;
    public final boolean integer;

    Interval(Exp lower, Exp upper, boolean leftOpen, boolean rightOpen,
        boolean integer) {
      super(Op.INTERVAL);
      this.lower = requireNonNull(lower);
      this.upper = requireNonNull(upper);
      this.leftOpen = leftOpen;
      this.rightOpen = rightOpen;
      this.integer = integer;
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(lower, upper);
    }

    @Override Object key() {
      return Arrays.asList(leftOpen, rightOpen, integer);
    }

    @Override public DType dtype() {
      return DType.SET;
    }

    /** Type of the elements. */
    public DType elementType() {
      return integer ? DType.INTEGER : DType.REAL;
    }

    public boolean isBounded() {
      return lower.op != Op.NEGATIVE_INFINITY && upper.op != Op.INFINITY;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Exp copy(Exp lower, Exp upper) {
      return lower == this.lower && upper == this.upper
          ? this
          : ex.interval(lower, upper, leftOpen, rightOpen, integer);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      if (integer) {
        w.append("Range[");
      } else {
        w.append(leftOpen ? "Interval(" : "Interval[");
      }
      w.append(lower, 0, 0).append(", ").append(upper, 0, 0);
      return w.append(!integer && rightOpen ? ")" : "]");
    }
  }

  /** Set of the elements of {@link #base} that satisfy {@link #condition}.
   * Binds {@link #variable} within {@link #condition}. */
  public static class ConditionSet extends Exp {
    public final Symbol variable;
    public final Exp condition;
    public final Exp base;

    ConditionSet(Symbol variable, Exp condition, Exp base) {
      super(Op.CONDITION_SET);
      this.variable = requireNonNull(variable);
      this.condition = requireNonNull(condition);
      this.base = requireNonNull(base);
    }

    @Override public List<Exp> args() {
      return ImmutableList.of(variable, condition, base);
    }

    @Override public DType dtype() {
      return DType.SET;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Exp copy(Symbol variable, Exp condition, Exp base) {
      return variable == this.variable
          && condition == this.condition
          && base == this.base
          ? this
          : ex.conditionSet(variable, condition, base);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.call("ConditionSet", args());
    }
  }

  /** Bound-variable expression: a function bound over one or more limits.
   *
   * <p>Limits are ordered outermost first. The bounds of a limit may only
   * reference the variables of earlier limits. */
  public static class Binder extends Exp {
    public final Variant variant;
    public final Exp function;
    public final ImmutableList<Limit> limits;

    Binder(Variant variant, Exp function, ImmutableList<Limit> limits) {
      super(Op.BINDER);
      this.variant = requireNonNull(variant);
      this.function = requireNonNull(function);
      this.limits = requireNonNull(limits);
    }

    @Override public List<Exp> args() {
      final ImmutableList.Builder<Exp> b = ImmutableList.builder();
      b.add(function);
      for (Limit limit : limits) {
        b.add(limit.variable);
        b.addAll(limit.expressions());
      }
      return b.build();
    }

    @Override Object key() {
      return Arrays.asList(variant, limits);
    }

    @Override public DType dtype() {
      return variant.dtype(this);
    }

    @Override public ImmutableList<Exp> shape() {
      switch (variant) {
      case MAPPING:
        final ImmutableList.Builder<Exp> b = ImmutableList.builder();
        limits.forEach(limit -> b.add(limit.extent()));
        return b.addAll(function.shape()).build();
      case ARG_MIN:
      case ARG_MAX:
        return limits.get(0).variable.shape();
      default:
        return function.shape();
      }
    }

    /** Returns the variables bound by the limits, outermost first. */
    public ImmutableList<Symbol> variables() {
      final ImmutableList.Builder<Symbol> b = ImmutableList.builder();
      limits.forEach(limit -> b.add(limit.variable));
      return b.build();
    }

    /** Returns the ordinal of the limit that binds a variable, or -1. */
    public int indexOf(Exp variable) {
      for (int i = 0; i < limits.size(); i++) {
        if (limits.get(i).variable.equals(variable)) {
          return i;
        }
      }
      return -1;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Exp copy(Exp function, List<Limit> limits) {
      return function == this.function && limits.equals(this.limits)
          ? this
          : ex.bind(variant, function, limits);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      w.append(variant.displayName).append("[");
      for (int i = 0; i < limits.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        limits.get(i).unparse(w);
      }
      return w.append("](").append(function, 0, 0).append(")");
    }
  }
}

// End Expr.java
