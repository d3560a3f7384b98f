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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.axiom.rewrite.Tracer;
import net.hydromatic.axiom.rewrite.Tracers;

/** Ordered record of derivations.
 *
 * <p>The log belongs to the caller; nothing in the library keeps a
 * reference to one. To record the steps of the quantifier combinator, put
 * {@link #tracer(Tracer)} into the session. */
public class ProofLog {
  private final List<Derivation> derivations = new ArrayList<>();

  /** Appends a derivation, and returns it. */
  public Derivation add(Derivation derivation) {
    derivations.add(derivation);
    return derivation;
  }

  public ImmutableList<Derivation> derivations() {
    return ImmutableList.copyOf(derivations);
  }

  public int size() {
    return derivations.size();
  }

  /** Returns a tracer that behaves like the given tracer but also appends
   * each derivation to this log. */
  public Tracer tracer(Tracer tracer) {
    return Tracers.withOnDerivation(tracer, this::add);
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < derivations.size(); i++) {
      final Derivation d = derivations.get(i);
      b.append('(').append(i + 1).append(") ")
          .append(d.result).append(" [").append(d.provenance).append("]\n");
    }
    return b.toString();
  }
}

// End ProofLog.java
