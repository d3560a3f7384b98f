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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.axiom.ast.Expr;

/** Settings and callbacks shared by a sequence of rewrites.
 *
 * <p>A session holds no expressions; the record of derived statements
 * belongs to the caller (see {@link net.hydromatic.axiom.logic.ProofLog}). */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;

  /** Receives events. */
  public final Tracer tracer;

  /** Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied. It may be immutable if the session is for a narrow,
   * internal use.
   *
   * @param map Map that contains property values
   * @param tracer Tracer */
  public Session(Map<Prop, Object> map, Tracer tracer) {
    this.map = requireNonNull(map, "map");
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Creates a session with default properties and no tracing. */
  public static Session create() {
    return new Session(ImmutableMap.of(), Tracers.empty());
  }

  /** Returns a session with the same properties and a different tracer. */
  public Session withTracer(Tracer tracer) {
    return new Session(map, tracer);
  }

  /** Returns a session with the same tracer and one property changed. */
  public Session with(Prop prop, Object value) {
    final Map<Prop, Object> map2 = new LinkedHashMap<>(map);
    prop.set(map2, value);
    return new Session(map2, tracer);
  }

  /** Returns a session with the same tracer and properties set from
   * name-value pairs, such as the contents of a properties file. Names may
   * be camel-case ({@code maxUnroll}) or upper-case
   * ({@code MAX_UNROLL}); string values are converted to the property's
   * type.
   *
   * @throws IllegalArgumentException if a name is not a property, or a value
   *   cannot be converted */
  public Session withProperties(Map<String, ?> properties) {
    final Map<Prop, Object> map2 = new LinkedHashMap<>(map);
    properties.forEach((name, value) ->
        Prop.lookup(name).setLenient(map2, value));
    return new Session(map2, tracer);
  }

  /** Simplifies an expression. */
  public Expr.Exp simplify(Expr.Exp e) {
    return Simplifier.simplify(this, e);
  }

  /** Substitutes {@code replacement} for {@code old} in an expression. */
  public Expr.Exp substitute(Expr.Exp e, Expr.Exp old, Expr.Exp replacement) {
    return Substituter.substitute(this, e, old, replacement);
  }
}

// End Session.java
