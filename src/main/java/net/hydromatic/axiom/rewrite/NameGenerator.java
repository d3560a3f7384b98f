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

import static net.hydromatic.axiom.ast.ExprBuilder.ex;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.axiom.ast.Expr;
import net.hydromatic.axiom.ast.Visitor;
import net.hydromatic.axiom.type.DType;

/**
 * Generates readable names for new variables.
 *
 * <p>Tries the conventional names for the type of the variable ("i", "j",
 * "k", ... for integers, "x", "y", "z", ... otherwise), skipping names that
 * are in use, and then appends an ordinal to the first name.
 */
public class NameGenerator {
  private static final ImmutableList<String> INTEGER_NAMES =
      ImmutableList.of("i", "j", "k", "l", "m", "n");
  private static final ImmutableList<String> REAL_NAMES =
      ImmutableList.of("x", "y", "z", "t", "u", "v", "w");
  private static final ImmutableList<String> SET_NAMES =
      ImmutableList.of("A", "B", "C", "D", "E");

  private final Set<String> used = new HashSet<>();
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();

  /** Creates a generator that avoids every name used by a symbol in the
   * given expressions, free or bound. */
  public static NameGenerator avoiding(Expr.Exp... exps) {
    final NameGenerator generator = new NameGenerator();
    final Visitor visitor = new Visitor() {
      @Override protected void visit(Expr.Symbol symbol) {
        generator.used.add(symbol.name);
      }
    };
    for (Expr.Exp exp : exps) {
      exp.accept(visitor);
    }
    return generator;
  }

  /** Returns an unused name for a variable of a given type, and marks it
   * used. */
  public String get(DType type) {
    final ImmutableList<String> names = type == DType.INTEGER ? INTEGER_NAMES
        : type == DType.SET ? SET_NAMES
        : REAL_NAMES;
    for (String name : names) {
      if (used.add(name)) {
        return name;
      }
    }
    for (;;) {
      final String name = names.get(0) + (inc(names.get(0)) + 1);
      if (used.add(name)) {
        return name;
      }
    }
  }

  /** Returns a new symbol with the same assumptions as a given symbol and an
   * unused name. */
  public Expr.Symbol fresh(Expr.Symbol symbol) {
    return ex.symbol(get(symbol.dtype()), symbol.assumptions);
  }

  /** Returns the number of times that "name" has been used for a variable. */
  public int inc(String name) {
    return nameCounts.computeIfAbsent(name, n -> new AtomicInteger(0))
        .getAndIncrement();
  }
}

// End NameGenerator.java
