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
package net.hydromatic.prover;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.prover.ast.Clause;
import net.hydromatic.prover.ast.KnowledgeBase;
import net.hydromatic.prover.ast.Literal;
import net.hydromatic.prover.parse.LiteralParser;
import net.hydromatic.prover.resolve.Inference;
import net.hydromatic.prover.resolve.Prop;
import net.hydromatic.prover.resolve.Resolver;
import net.hydromatic.prover.resolve.Saturation;
import net.hydromatic.prover.resolve.Tracer;
import net.hydromatic.prover.resolve.Tracers;
import net.hydromatic.prover.util.RobinsonUnifier;
import net.hydromatic.prover.util.Unifier;
import net.hydromatic.prover.util.Unifiers;

/**
 * Entry point to the prover.
 *
 * <p>A Prover is immutable. It holds values of properties (see {@link Prop})
 * and a tracer; methods {@link #withProp} and {@link #withTracer} return a
 * modified copy.
 *
 * <p>For example,
 *
 * <pre>{@code
 * Inference inference =
 *     Prover.create()
 *         .withProp(Prop.MAX_ITERATIONS, 10)
 *         .infer(
 *             ImmutableList.of(ImmutableList.of("A"),
 *                 ImmutableList.of("¬A", "C")),
 *             ImmutableList.of("C"));
 * assert inference.entailed();
 * }</pre>
 */
public class Prover {
  private final ImmutableMap<Prop, Object> map;
  private final Tracer tracer;

  private Prover(ImmutableMap<Prop, Object> map, Tracer tracer) {
    this.map = requireNonNull(map);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a Prover with default property values. */
  public static Prover create() {
    return new Prover(ImmutableMap.of(), Tracers.nullTracer());
  }

  /**
   * Creates a Prover whose properties are set from strings. Keys may be
   * either the camel-case name ({@code "maxIterations"}) or the upper-case
   * name ({@code "MAX_ITERATIONS"}) of a {@link Prop}.
   *
   * @throws IllegalArgumentException if a property is unknown or its value
   *   is invalid
   */
  public static Prover create(Map<String, String> properties) {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    properties.forEach((name, value) ->
        Prop.lookup(name).setLenient(map, value));
    return new Prover(ImmutableMap.copyOf(map), Tracers.nullTracer());
  }

  /** Returns a copy of this Prover with a property set to a value. */
  public Prover withProp(Prop prop, Object value) {
    final Map<Prop, Object> map2 = new LinkedHashMap<>(map);
    prop.set(map2, value);
    return new Prover(ImmutableMap.copyOf(map2), tracer);
  }

  /** Returns a copy of this Prover with a given tracer. */
  public Prover withTracer(Tracer tracer) {
    return new Prover(map, tracer);
  }

  /** Returns the value of a property. */
  public Object get(Prop prop) {
    return prop.get(map);
  }

  /** Creates a unifier configured by this Prover's properties. */
  public Unifier unifier() {
    return new RobinsonUnifier(Prop.OCCURS_CHECK.booleanValue(map));
  }

  /** Creates a resolver configured by this Prover's properties. */
  public Resolver resolver() {
    return new Resolver(unifier(), Prop.DISCARD_TAUTOLOGIES.booleanValue(map),
        tracer);
  }

  /**
   * Unifies two literals, given as text. Returns a {@link
   * Unifier.Substitution} on success and a {@link Unifier.Failure}
   * otherwise.
   *
   * @throws net.hydromatic.prover.parse.ParseException if either text is
   *   not a valid literal
   */
  public Unifier.Result unify(String left, String right) {
    return unify(left, right, Unifier.Substitution.EMPTY);
  }

  /**
   * Unifies two literals, given as text, extending an existing
   * substitution.
   */
  public Unifier.Result unify(String left, String right,
      Unifier.Substitution substitution) {
    final Literal literal0 = LiteralParser.parseLiteral(left);
    final Literal literal1 = LiteralParser.parseLiteral(right);
    return Unifiers.unify(unifier(), literal0, literal1, substitution);
  }

  /** Returns every resolvent of two clauses, given as text. */
  public Set<Clause> resolve(Iterable<String> left, Iterable<String> right) {
    return resolver().resolve(LiteralParser.parseClause(left),
        LiteralParser.parseClause(right));
  }

  /**
   * Returns whether a knowledge base entails a query.
   *
   * <p>The knowledge base is a collection of clauses, each a collection of
   * literals in text form such as {@code "¬King(x)"}; the query is a single
   * clause.
   *
   * @throws net.hydromatic.prover.parse.ParseException if a literal is
   *   invalid; this happens before inference starts
   */
  public Inference infer(Iterable<? extends Iterable<String>> kb,
      Iterable<String> query) {
    return infer(LiteralParser.parseKnowledgeBase(kb),
        LiteralParser.parseClause(query));
  }

  /** Returns whether a knowledge base entails a query clause. */
  public Inference infer(KnowledgeBase kb, Clause query) {
    return new Saturation(map, tracer).run(kb, query);
  }
}

// End Prover.java
