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
package net.hydromatic.axiom.rewrite;

import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.logic.Derivation;

/** Called on various events during rewriting. */
public interface Tracer {
  /** Called when a simplification rule transforms an expression. */
  void onRule(String rule, Expr.Exp before, Expr.Exp after);

  /** Called at the end of each simplification pass. */
  void onPass(int pass, Expr.Exp e);

  /** Called when a substitution changes an expression. */
  void onSubstitute(Expr.Exp before, Expr.Exp old, Expr.Exp replacement,
      Expr.Exp after);

  /** Called when the quantifier combinator derives a statement. */
  void onDerivation(Derivation derivation);
}

// End Tracer.java
