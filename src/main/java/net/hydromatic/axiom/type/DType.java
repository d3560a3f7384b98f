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

/**
 * Element type of an expression, independent of its shape.
 *
 * <p>The numeric types form a chain: every {@link #INTEGER} is a
 * {@link #RATIONAL}, every rational is {@link #REAL}, every real is
 * {@link #COMPLEX}.
 */
public enum DType {
  BOOLEAN,
  INTEGER,
  RATIONAL,
  REAL,
  COMPLEX,
  SET;

  public boolean isNumeric() {
    return this == INTEGER
        || this == RATIONAL
        || this == REAL
        || this == COMPLEX;
  }

  /** Returns whether every value of {@code other} is a value of this type. */
  public boolean contains(DType other) {
    if (this == other) {
      return true;
    }
    return isNumeric()
        && other.isNumeric()
        && other.ordinal() <= ordinal();
  }

  /** Returns the least type that contains both types. If the types are not
   * comparable, returns this type. */
  public DType join(DType other) {
    if (this == other) {
      return this;
    }
    if (isNumeric() && other.isNumeric()) {
      return ordinal() >= other.ordinal() ? this : other;
    }
    return this;
  }
}

// End DType.java
