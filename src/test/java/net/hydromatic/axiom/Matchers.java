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
package net.hydromatic.axiom;

import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Op;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in Axiom tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an expression by its string representation. */
  public static Matcher<Expr.Exp> isExp(String expected) {
    return new CustomTypeSafeMatcher<Expr.Exp>("expression " + expected) {
      @Override protected boolean matchesSafely(Expr.Exp e) {
        return e.toString().equals(expected);
      }
    };
  }

  /** Matches an expression whose operator is a given operator. */
  public static Matcher<Expr.Exp> hasOp(Op op) {
    return new CustomTypeSafeMatcher<Expr.Exp>("expression with op " + op) {
      @Override protected boolean matchesSafely(Expr.Exp e) {
        return e.op == op;
      }
    };
  }
}

// End Matchers.java
