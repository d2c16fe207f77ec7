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

import static java.util.Objects.requireNonNull;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.prover.ast.Op;
import net.hydromatic.prover.ast.Term;
import net.hydromatic.prover.ast.Term.Compound;
import net.hydromatic.prover.ast.Term.Variable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Robinson's unification algorithm.
 *
 * <p>Arguments of compound terms are unified left to right, threading the
 * bindings made so far through each step; the first pair that fails aborts
 * the whole unification.
 *
 * <p>Following a variable's binding that leads, through other bindings,
 * back to the same variable fails with {@link FailureKind#OCCURS}. That can
 * only happen if the occurs check is off and the given substitution is
 * cyclic.
 */
public class RobinsonUnifier extends Unifier {
  private final boolean occurs;

  /** Creates a unifier that performs the occurs check. */
  public RobinsonUnifier() {
    this(true);
  }

  /** Creates a unifier, specifying whether to perform the occurs check. */
  public RobinsonUnifier(boolean occurs) {
    this.occurs = occurs;
  }

  @Override
  public boolean occurs() {
    return occurs;
  }

  @Override
  public Result unify(Term left, Term right, Substitution substitution,
      Tracer tracer) {
    if (occurs && !substitution.isAcyclic()) {
      return failure(FailureKind.OCCURS,
          "substitution is cyclic: " + substitution);
    }
    final Map<Variable, Term> map = new HashMap<>(substitution.resultMap);
    final Failure failure =
        unify(left, right, map, new HashSet<>(), tracer);
    if (failure != null) {
      return failure;
    }
    if (map.size() == substitution.size()) {
      // No new bindings
      return substitution;
    }
    return Substitution.of(map);
  }

  /** Unifies two terms, adding bindings to {@code map}; null on success. */
  private @Nullable Failure unify(Term left, Term right,
      Map<Variable, Term> map, Set<Variable> chased, Tracer tracer) {
    if (resolve(left, map).equals(resolve(right, map))) {
      tracer.onDelete(left, right);
      return null;
    }
    if (left.op == Op.VARIABLE) {
      return unifyVariable((Variable) left, right, map, chased, tracer);
    }
    if (right.op == Op.VARIABLE) {
      return unifyVariable((Variable) right, left, map, chased, tracer);
    }
    if (left.op == Op.COMPOUND && right.op == Op.COMPOUND) {
      return unifyCompound((Compound) left, (Compound) right, map, chased,
          tracer);
    }
    tracer.onConflict(left, right);
    return failure(FailureKind.CLASH,
        "cannot unify " + left + " with " + right);
  }

  private @Nullable Failure unifyCompound(Compound left, Compound right,
      Map<Variable, Term> map, Set<Variable> chased, Tracer tracer) {
    if (!left.name.equals(right.name)) {
      tracer.onConflict(left, right);
      return failure(FailureKind.CLASH,
          "compound terms have different names: " + left + ", " + right);
    }
    if (left.arity() != right.arity()) {
      tracer.onConflict(left, right);
      return new ArityMismatch(left, right);
    }
    for (int i = 0; i < left.arity(); i++) {
      final Failure failure =
          unify(left.args.get(i), right.args.get(i), map, chased, tracer);
      if (failure != null) {
        return failure;
      }
    }
    return null;
  }

  private @Nullable Failure unifyVariable(Variable variable, Term term,
      Map<Variable, Term> map, Set<Variable> chased, Tracer tracer) {
    final Term bound = map.get(variable);
    if (bound != null) {
      return chase(variable, bound, term, map, chased, tracer);
    }
    if (term.op == Op.VARIABLE) {
      final Term termBound = map.get((Variable) term);
      if (termBound != null) {
        return chase((Variable) term, variable, termBound, map, chased,
            tracer);
      }
    }
    if (variable.equals(term)) {
      return null;
    }
    if (occurs && resolve(term, map).contains(variable)) {
      tracer.onCycle(variable, term);
      return failure(FailureKind.OCCURS,
          "variable " + variable + " occurs in " + term);
    }
    tracer.onVariable(variable, term);
    map.put(variable, term);
    return null;
  }

  /**
   * Unifies two terms, one of which is the binding of {@code variable},
   * unless that binding is already being followed.
   */
  private @Nullable Failure chase(Variable variable, Term left, Term right,
      Map<Variable, Term> map, Set<Variable> chased, Tracer tracer) {
    if (!chased.add(variable)) {
      tracer.onCycle(variable, requireNonNull(map.get(variable)));
      return failure(FailureKind.OCCURS,
          "binding of " + variable + " leads back to itself");
    }
    final Failure failure = unify(left, right, map, chased, tracer);
    chased.remove(variable);
    return failure;
  }

  /**
   * Applies the bindings made so far to a term.
   *
   * <p>If this unifier performs the occurs check, the bindings are acyclic,
   * and are followed until no bound variable remains. Otherwise, to be sure
   * of terminating, makes a single pass.
   */
  private Term resolve(Term term, Map<Variable, Term> map) {
    if (map.isEmpty()) {
      return term;
    }
    if (!occurs) {
      return term.apply(map);
    }
    Term previous;
    Term current = term;
    do {
      previous = current;
      current = current.apply(map);
    } while (!current.equals(previous));
    return current;
  }
}

// End RobinsonUnifier.java
