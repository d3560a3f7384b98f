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

import org.checkerframework.checker.nullness.qual.Nullable;

/** What is known about the sign of a numeric value. */
public enum Sign {
  POSITIVE,
  NEGATIVE,
  ZERO,
  NONNEGATIVE,
  NONPOSITIVE;

  public boolean isNonNegative() {
    return this == POSITIVE || this == ZERO || this == NONNEGATIVE;
  }

  public boolean isNonPositive() {
    return this == NEGATIVE || this == ZERO || this == NONPOSITIVE;
  }

  /** Returns the sign of the negation of a value with this sign. */
  public Sign negate() {
    switch (this) {
    case POSITIVE:
      return NEGATIVE;
    case NEGATIVE:
      return POSITIVE;
    case NONNEGATIVE:
      return NONPOSITIVE;
    case NONPOSITIVE:
      return NONNEGATIVE;
    default:
      return ZERO;
    }
  }

  /** Returns the sign of a product, or null if unknown. */
  public static @Nullable Sign multiply(@Nullable Sign a, @Nullable Sign b) {
    if (a == ZERO || b == ZERO) {
      return ZERO;
    }
    if (a == null || b == null) {
      return null;
    }
    final boolean strict = (a == POSITIVE || a == NEGATIVE)
        && (b == POSITIVE || b == NEGATIVE);
    final boolean negative = a.isNonPositive() != b.isNonPositive();
    if (strict) {
      return negative ? NEGATIVE : POSITIVE;
    }
    return negative ? NONPOSITIVE : NONNEGATIVE;
  }

  /** Returns the sign of a sum, or null if unknown. */
  public static @Nullable Sign add(@Nullable Sign a, @Nullable Sign b) {
    if (a == null || b == null) {
      return null;
    }
    if (a == ZERO) {
      return b;
    }
    if (b == ZERO) {
      return a;
    }
    if (a.isNonNegative() && b.isNonNegative()) {
      return a == POSITIVE || b == POSITIVE ? POSITIVE : NONNEGATIVE;
    }
    if (a.isNonPositive() && b.isNonPositive()) {
      return a == NEGATIVE || b == NEGATIVE ? NEGATIVE : NONPOSITIVE;
    }
    return null;
  }
}

// End Sign.java
