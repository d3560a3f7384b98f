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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.logic.Derivation;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that passes the name of each rule that fires, and the
   * expression it produced, to a consumer, then calls the underlying
   * tracer. */
  public static Tracer withOnRule(Tracer tracer,
      BiConsumer<String, Expr.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRule(String rule, Expr.Exp before,
          Expr.Exp after) {
        consumer.accept(rule, after);
        super.onRule(rule, before, after);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of each
   * simplification pass, then calls the underlying tracer. */
  public static Tracer withOnPass(Tracer tracer,
      Consumer<Expr.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onPass(int pass, Expr.Exp e) {
        consumer.accept(e);
        super.onPass(pass, e);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of each
   * substitution, then calls the underlying tracer. */
  public static Tracer withOnSubstitute(Tracer tracer,
      Consumer<Expr.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSubstitute(Expr.Exp before, Expr.Exp old,
          Expr.Exp replacement, Expr.Exp after) {
        consumer.accept(after);
        super.onSubstitute(before, old, replacement, after);
      }
    };
  }

  public static Tracer withOnDerivation(Tracer tracer,
      Consumer<Derivation> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDerivation(Derivation derivation) {
        consumer.accept(derivation);
        super.onDerivation(derivation);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onRule(String rule, Expr.Exp before,
        Expr.Exp after) {
    }

    @Override public void onPass(int pass, Expr.Exp e) {
    }

    @Override public void onSubstitute(Expr.Exp before, Expr.Exp old,
        Expr.Exp replacement, Expr.Exp after) {
    }

    @Override public void onDerivation(Derivation derivation) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onRule(String rule, Expr.Exp before,
        Expr.Exp after) {
      tracer.onRule(rule, before, after);
    }

    @Override public void onPass(int pass, Expr.Exp e) {
      tracer.onPass(pass, e);
    }

    @Override public void onSubstitute(Expr.Exp before, Expr.Exp old,
        Expr.Exp replacement, Expr.Exp after) {
      tracer.onSubstitute(before, old, replacement, after);
    }

    @Override public void onDerivation(Derivation derivation) {
      tracer.onDerivation(derivation);
    }
  }
}

// End Tracers.java
