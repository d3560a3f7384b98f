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

/** Sub-types of {@link Expr.Exp}. */
public enum Op {
  // atoms
  SYMBOL(true),
  NUMBER(true),
  INFINITY(true),
  NEGATIVE_INFINITY(true),
  UNDEFINED(true),
  TRUE(true),
  FALSE(true),
  EMPTY_SET(true),
  UNIVERSAL_SET(true),

  // arithmetic
  ADD(" + ", 6),
  MUL("*", 7),
  POW("^", 8, false),
  MIN(true),
  MAX(true),
  KRONECKER_DELTA(true),
  APPLY(true),
  INDEXED(true),
  ARRAY(true),
  PIECEWISE(true),

  // relations
  EQ(" = ", 4),
  NE(" ≠ ", 4),
  LT(" < ", 4),
  LE(" ≤ ", 4),
  GT(" > ", 4),
  GE(" ≥ ", 4),

  // logic
  NOT("¬", 3),
  AND(" ∧ ", 2),
  OR(" ∨ ", 1),

  // membership
  CONTAINS(" ∈ ", 4),
  NOT_CONTAINS(" ∉ ", 4),
  SUBSET(" ⊆ ", 4),

  // sets
  INTERVAL(true),
  FINITE_SET(true),
  UNION(" ∪ ", 5),
  INTERSECTION(" ∩ ", 6),
  COMPLEMENT(" \\ ", 5),
  CONDITION_SET(true),

  /** Bound-variable expression; see {@link Expr.Binder}. */
  BINDER(true);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Whether this is a binary numeric comparison. */
  public boolean isRelation() {
    switch (this) {
    case EQ:
    case NE:
    case LT:
    case LE:
    case GT:
    case GE:
      return true;
    default:
      return false;
    }
  }

  /** Returns the relation that holds when this relation does not. */
  public Op negate() {
    switch (this) {
    case EQ:
      return NE;
    case NE:
      return EQ;
    case LT:
      return GE;
    case LE:
      return GT;
    case GT:
      return LE;
    case GE:
      return LT;
    case CONTAINS:
      return NOT_CONTAINS;
    case NOT_CONTAINS:
      return CONTAINS;
    default:
      throw new AssertionError("cannot negate " + this);
    }
  }

  /** Returns the relation that holds when the operands are swapped. */
  public Op reverse() {
    switch (this) {
    case LT:
      return GT;
    case LE:
      return GE;
    case GT:
      return LT;
    case GE:
      return LE;
    case EQ:
    case NE:
      return this;
    default:
      throw new AssertionError("cannot reverse " + this);
    }
  }
}

// End Op.java
