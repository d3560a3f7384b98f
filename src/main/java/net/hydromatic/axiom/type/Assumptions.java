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
package net.hydromatic.axiom.type;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.axiom.ast.ExprBuilder.ex;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.axiom.ast.Expr;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Explicit assumptions about a symbol.
 *
 * <p>Only explicit assumptions take part in the identity of a symbol. Facts
 * derived from them, such as the default domain, do not. An explicit domain
 * that equals the derived default is dropped when the assumptions are created,
 * so that it cannot distinguish two otherwise equal symbols.
 */
public final class Assumptions {
  public static final Assumptions INTEGER = of(DType.INTEGER);
  public static final Assumptions REAL = of(DType.REAL);
  public static final Assumptions BOOLEAN = of(DType.BOOLEAN);
  public static final Assumptions SET = of(DType.SET);

  public final DType dtype;
  /** Dimensions; empty for a scalar. Each may be symbolic. */
  public final ImmutableList<Expr.Exp> shape;
  public final @Nullable Sign sign;
  /** Explicit domain, or null to use the domain derived from the type and
   * sign. */
  public final Expr.@Nullable Exp domain;
  /** Expression that the symbol is defined to equal, or null. */
  public final Expr.@Nullable Exp definition;

  private Assumptions(DType dtype, ImmutableList<Expr.Exp> shape,
      @Nullable Sign sign, Expr.@Nullable Exp domain,
      Expr.@Nullable Exp definition) {
    this.dtype = requireNonNull(dtype, "dtype");
    this.shape = requireNonNull(shape, "shape");
    this.sign = sign;
    this.domain = domain;
    this.definition = definition;
    checkArgument(sign == null || dtype.isNumeric(),
        "sign requires a numeric type: %s", dtype);
    checkArgument(domain == null || domain.dtype() == DType.SET,
        "domain must be a set: %s", domain);
  }

  /** Creates scalar assumptions of a given type. */
  public static Assumptions of(DType dtype) {
    return new Assumptions(dtype, ImmutableList.of(), null, null, null);
  }

  public Assumptions withSign(@Nullable Sign sign) {
    return new Assumptions(dtype, shape, sign, domain, definition);
  }

  public Assumptions withShape(List<? extends Expr.Exp> shape) {
    return new Assumptions(dtype, ImmutableList.copyOf(shape), sign, domain,
        definition);
  }

  public Assumptions withDomain(Expr.@Nullable Exp domain) {
    if (domain != null && domain.equals(defaultDomain())) {
      domain = null;
    }
    return new Assumptions(dtype, shape, sign, domain, definition);
  }

  public Assumptions withDefinition(Expr.@Nullable Exp definition) {
    return new Assumptions(dtype, shape, sign, domain, definition);
  }

  public Assumptions withDType(DType dtype) {
    return new Assumptions(dtype, shape, dtype.isNumeric() ? sign : null,
        domain, definition);
  }

  /** Returns the domain: the explicit one, or else the one derived from the
   * type and sign. */
  public Expr.Exp domain() {
    return domain != null ? domain : defaultDomain();
  }

  /** Returns the domain implied by the type and the sign. */
  public Expr.Exp defaultDomain() {
    if (!dtype.isNumeric() || dtype == DType.COMPLEX) {
      return ex.universalSet();
    }
    final boolean integer = dtype == DType.INTEGER;
    final Expr.Exp zero = ex.zero();
    if (sign == null) {
      return ex.interval(ex.negativeInfinity(), ex.infinity(), true, true,
          integer);
    }
    switch (sign) {
    case POSITIVE:
      return ex.interval(zero, ex.infinity(), true, true, integer);
    case NONNEGATIVE:
      return ex.interval(zero, ex.infinity(), false, true, integer);
    case NEGATIVE:
      return ex.interval(ex.negativeInfinity(), zero, true, true, integer);
    case NONPOSITIVE:
      return ex.interval(ex.negativeInfinity(), zero, true, false, integer);
    case ZERO:
      return ex.finiteSet(ImmutableList.of(zero));
    default:
      throw new AssertionError(sign);
    }
  }

  @Override public int hashCode() {
    return Objects.hash(dtype, shape, sign, domain, definition);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Assumptions
        && dtype == ((Assumptions) o).dtype
        && shape.equals(((Assumptions) o).shape)
        && sign == ((Assumptions) o).sign
        && Objects.equals(domain, ((Assumptions) o).domain)
        && Objects.equals(definition, ((Assumptions) o).definition);
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder("{").append(dtype);
    if (!shape.isEmpty()) {
      b.append(", shape=").append(shape);
    }
    if (sign != null) {
      b.append(", ").append(sign);
    }
    if (domain != null) {
      b.append(", domain=").append(domain);
    }
    if (definition != null) {
      b.append(", definition=").append(definition);
    }
    return b.append("}").toString();
  }
}

// End Assumptions.java
