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

/** How a derived statement relates to the statements it was derived
 * from. */
public enum Provenance {
  /** The result holds if and only if the premises hold. */
  EQUIVALENT,
  /** The premises imply the result. */
  GIVEN,
  /** The result is an instance of a universal premise; a particular kind
   * of {@link #GIVEN}. */
  SUBSTITUTED_FROM,
  /** The result implies the premises. */
  IMPLIED_BY;

  /** Returns whether the premises imply the result. */
  public boolean isForward() {
    return this != IMPLIED_BY;
  }

  /** Returns whether the result implies the premises. */
  public boolean isBackward() {
    return this == EQUIVALENT || this == IMPLIED_BY;
  }

  /** Returns the provenance of two steps performed one after the other: the
   * weaker of the two.
   *
   * @throws IllegalArgumentException if one step is forward and the other
   * backward, so that the chain implies nothing
   */
  public Provenance combine(Provenance next) {
    if (this == EQUIVALENT) {
      return next;
    }
    if (next == EQUIVALENT || next == this) {
      return this;
    }
    if (isForward() && next.isForward()) {
      return GIVEN;
    }
    throw new IllegalArgumentException("cannot chain " + this + " and "
        + next);
  }
}

// End Provenance.java
