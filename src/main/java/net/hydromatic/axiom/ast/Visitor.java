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

/** Visits expression trees. */
public class Visitor {

  /** For use as a method reference. */
  protected void accept(Expr.Exp e) {
    e.accept(this);
  }

  protected void visit(Limit limit) {
    limit.variable.accept(this);
    limit.expressions().forEach(this::accept);
  }

  protected void visit(Expr.Symbol symbol) {}

  protected void visit(Expr.Number number) {}

  protected void visit(Expr.Atom atom) {}

  protected void visit(Expr.Call call) {
    call.args.forEach(this::accept);
  }

  protected void visit(Expr.Apply apply) {
    apply.args.forEach(this::accept);
  }

  protected void visit(Expr.Interval interval) {
    interval.lower.accept(this);
    interval.upper.accept(this);
  }

  protected void visit(Expr.ConditionSet conditionSet) {
    conditionSet.variable.accept(this);
    conditionSet.condition.accept(this);
    conditionSet.base.accept(this);
  }

  protected void visit(Expr.Binder binder) {
    binder.limits.forEach(this::visit);
    binder.function.accept(this);
  }
}

// End Visitor.java
