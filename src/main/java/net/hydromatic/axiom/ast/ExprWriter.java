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

import java.util.List;

/**
 * Converts expressions to strings, adding parentheses only where operator
 * precedence requires them.
 */
public class ExprWriter {
  private final StringBuilder b = new StringBuilder();

  @Override public String toString() {
    return b.toString();
  }

  /** Appends a string. */
  public ExprWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an expression, given the precedence of the operators to its
   * left and right. */
  public ExprWriter append(Expr.Exp e, int left, int right) {
    return e.unparse(this, left, right);
  }

  /** Appends a list of expressions, each with no surrounding precedence. */
  public ExprWriter appendAll(List<? extends Expr.Exp> list, String sep) {
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        b.append(sep);
      }
      list.get(i).unparse(this, 0, 0);
    }
    return this;
  }

  /** Appends a function-call, such as "Min(a, b)". */
  public ExprWriter call(String name, List<? extends Expr.Exp> args) {
    b.append(name).append('(');
    appendAll(args, ", ");
    b.append(')');
    return this;
  }

  /** Appends a prefix operator applied to an argument. */
  public ExprWriter prefix(int left, Op op, Expr.Exp a, int right) {
    if (left > op.left || op.right < right) {
      b.append('(');
      prefix(0, op, a, 0);
      b.append(')');
      return this;
    }
    b.append(op.padded);
    return a.unparse(this, op.right, right);
  }

  /** Appends an infix operator applied to two or more arguments. */
  public ExprWriter infix(int left, List<? extends Expr.Exp> args, Op op,
      int right) {
    if (left > op.left || op.right < right) {
      b.append('(');
      infix(0, args, op, 0);
      b.append(')');
      return this;
    }
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        b.append(op.padded);
      }
      args.get(i).unparse(this,
          i == 0 ? left : op.right,
          i == args.size() - 1 ? right : op.left);
    }
    return this;
  }

  /** Appends a sum, writing "a - b" rather than "a + -b". */
  ExprWriter sum(int left, List<? extends Expr.Exp> args, int right) {
    final Op op = Op.ADD;
    if (left > op.left || op.right < right) {
      b.append('(');
      sum(0, args, 0);
      b.append(')');
      return this;
    }
    for (int i = 0; i < args.size(); i++) {
      final Expr.Exp arg = args.get(i);
      final int argLeft = i == 0 ? left : op.right;
      final int argRight = i == args.size() - 1 ? right : op.left;
      if (i > 0 && arg.isNegative()) {
        b.append(" - ");
        ExprBuilder.ex.neg(arg).unparse(this, argLeft, argRight);
      } else {
        if (i > 0) {
          b.append(op.padded);
        }
        arg.unparse(this, argLeft, argRight);
      }
    }
    return this;
  }
}

// End ExprWriter.java
