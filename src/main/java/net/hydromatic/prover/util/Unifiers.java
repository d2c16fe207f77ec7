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
package net.hydromatic.prover.util;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.prover.ast.Clause;
import net.hydromatic.prover.ast.Literal;
import net.hydromatic.prover.ast.Term;
import net.hydromatic.prover.ast.Term.Variable;
import net.hydromatic.prover.util.Unifier.Failure;
import net.hydromatic.prover.util.Unifier.FailureKind;
import net.hydromatic.prover.util.Unifier.Result;
import net.hydromatic.prover.util.Unifier.Substitution;

/**
 * Utilities for unification.
 *
 * @see Unifier
 */
public abstract class Unifiers {
  private Unifiers() {}

  /** Unifies two literals, extending an existing substitution. */
  public static Result unify(Unifier unifier, Literal left, Literal right,
      Substitution substitution) {
    return unify(unifier, left, right, substitution, Tracers.nullTracer());
  }

  /**
   * Unifies two literals. They must have the same polarity; if they do not,
   * returns a {@link FailureKind#CLASH} failure.
   */
  public static Result unify(Unifier unifier, Literal left, Literal right,
      Substitution substitution, Unifier.Tracer tracer) {
    if (left.positive != right.positive) {
      return Failure.of(FailureKind.CLASH,
          "literals have opposite polarity: " + left + ", " + right);
    }
    return unifier.unify(left.term, right.term, substitution, tracer);
  }

  /**
   * Finds a substitution that makes two literals complementary, starting with
   * no bindings.
   */
  public static Result complement(Unifier unifier, Literal left,
      Literal right) {
    return complement(unifier, left, right, Substitution.EMPTY,
        Tracers.nullTracer());
  }

  /**
   * Finds a substitution that makes two literals complementary; that is,
   * makes them have the same term. They must have opposite polarity; if they
   * do not, returns a {@link FailureKind#CLASH} failure.
   *
   * <p>If one literal is already the exact complement of the other (for
   * example {@code A} and {@code ¬A}) the result is the unchanged
   * substitution, without calling the unifier. That is a special case of
   * unification, kept here so that the unifier itself never has to consider
   * polarity.
   *
   * <p>A literal that is a bare variable, such as {@code p}, is a
   * proposition, and matches nothing but its exact complement.
   */
  public static Result complement(Unifier unifier, Literal left,
      Literal right, Substitution substitution, Unifier.Tracer tracer) {
    if (left.positive == right.positive) {
      return Failure.of(FailureKind.CLASH,
          "literals have the same polarity: " + left + ", " + right);
    }
    if (left.isComplementOf(right)) {
      return substitution;
    }
    if (left.isProposition() || right.isProposition()) {
      return Failure.of(FailureKind.CLASH,
          "proposition matches only its complement: " + left + ", " + right);
    }
    return unifier.unify(left.term, right.term, substitution, tracer);
  }

  /**
   * Renames the variables of {@code clause} that also occur in {@code other},
   * so that the two clauses have no variables in common.
   */
  public static Clause renameApart(Clause clause, Clause other) {
    final Set<Variable> variables = clause.variables();
    final Set<Variable> otherVariables = other.variables();
    if (variables.isEmpty() || otherVariables.isEmpty()) {
      return clause;
    }
    final NameGenerator nameGenerator = new NameGenerator();
    final Map<Variable, Term> map = new HashMap<>();
    variables.forEach(v -> nameGenerator.reserve(v.name));
    otherVariables.forEach(v -> nameGenerator.reserve(v.name));
    for (Variable variable : variables) {
      if (otherVariables.contains(variable)) {
        map.put(variable, Term.variable(nameGenerator.fresh(variable.name)));
      }
    }
    return clause.rename(map);
  }
}

// End Unifiers.java
