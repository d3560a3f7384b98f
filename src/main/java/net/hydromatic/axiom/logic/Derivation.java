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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.axiom.ast.Expr;

/** A statement derived from premises, with the provenance that says which
 * way the implication runs. */
public final class Derivation {
  public final Expr.Exp result;
  public final Provenance provenance;
  public final ImmutableList<Expr.Exp> premises;

  private Derivation(Expr.Exp result, Provenance provenance,
      ImmutableList<Expr.Exp> premises) {
    this.result = requireNonNull(result);
    this.provenance = requireNonNull(provenance);
    this.premises = requireNonNull(premises);
  }

  public static Derivation of(Expr.Exp result, Provenance provenance,
      List<? extends Expr.Exp> premises) {
    return new Derivation(result, provenance, ImmutableList.copyOf(premises));
  }

  public static Derivation of(Expr.Exp result, Provenance provenance,
      Expr.Exp... premises) {
    return of(result, provenance, ImmutableList.copyOf(premises));
  }

  /** Chains a derivation whose premise is this derivation's result. The
   * chain's premises are this derivation's premises. */
  public Derivation then(Derivation next) {
    return new Derivation(next.result, provenance.combine(next.provenance),
        premises);
  }

  @Override public int hashCode() {
    return Objects.hash(result, provenance, premises);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Derivation
        && result.equals(((Derivation) o).result)
        && provenance == ((Derivation) o).provenance
        && premises.equals(((Derivation) o).premises);
  }

  @Override public String toString() {
    return result + " [" + provenance + " " + premises + "]";
  }
}

// End Derivation.java
