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

import com.google.common.collect.ImmutableSortedMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.prover.ast.Term;
import net.hydromatic.prover.ast.Term.Compound;
import net.hydromatic.prover.ast.Term.Variable;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Given a pair of terms, finds a substitution that makes them equal. */
public abstract class Unifier {
  /** Whether this unifier checks for cycles in substitutions. */
  public boolean occurs() {
    return false;
  }

  /** Unifies two terms, starting with no bindings. */
  public Result unify(Term left, Term right) {
    return unify(left, right, Substitution.EMPTY, Tracers.nullTracer());
  }

  /** Unifies two terms, extending an existing substitution. */
  public Result unify(Term left, Term right, Substitution substitution) {
    return unify(left, right, substitution, Tracers.nullTracer());
  }

  /**
   * Unifies two terms, extending an existing substitution and reporting
   * each step to a tracer.
   *
   * <p>Returns a {@link Substitution} on success (which is empty if the
   * terms are already equal) and a {@link Failure} otherwise.
   */
  public abstract Result unify(Term left, Term right,
      Substitution substitution, Tracer tracer);

  protected Failure failure(FailureKind kind, String reason) {
    return Failure.of(kind, reason);
  }

  /**
   * Result of attempting unification. A success is {@link Substitution}; a
   * failure is {@link Failure}.
   */
  public interface Result {
    /** Whether unification succeeded. */
    default boolean succeeded() {
      return this instanceof Substitution;
    }
  }

  /** Result indicating that unification was not possible. */
  public interface Failure extends Result {
    FailureKind kind();

    String reason();

    /** Creates a failure. */
    static Failure of(FailureKind kind, String reason) {
      return new SimpleFailure(kind, reason);
    }
  }

  /** Reasons why unification can fail. */
  public enum FailureKind {
    /**
     * Two terms have different names or kinds, or a variable is already bound
     * to a different value.
     */
    CLASH,
    /** Compound terms have the same name but different numbers of arguments. */
    ARITY_MISMATCH,
    /** Binding a variable would make it depend on itself. */
    OCCURS
  }

  /** Failure with a kind and a reason. */
  private static class SimpleFailure implements Failure {
    private final FailureKind kind;
    private final String reason;

    SimpleFailure(FailureKind kind, String reason) {
      this.kind = requireNonNull(kind);
      this.reason = requireNonNull(reason);
    }

    @Override
    public FailureKind kind() {
      return kind;
    }

    @Override
    public String reason() {
      return reason;
    }

    @Override
    public String toString() {
      return kind + ": " + reason;
    }
  }

  /**
   * Failure that occurs when two compound terms have the same name but a
   * different number of arguments.
   */
  public static final class ArityMismatch implements Failure {
    public final Compound left;
    public final Compound right;

    public ArityMismatch(Compound left, Compound right) {
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public FailureKind kind() {
      return FailureKind.ARITY_MISMATCH;
    }

    @Override
    public String reason() {
      return "arity mismatch: " + left.name + " has " + left.arity()
          + " and " + right.arity() + " arguments: " + left + ", " + right;
    }

    @Override
    public String toString() {
      return kind() + ": " + reason();
    }
  }

  /**
   * Map from variables to terms; the result of a successful unification.
   *
   * <p>A substitution is immutable. Its entries are sorted by variable name.
   * It is acyclic (and {@link #apply(Term)} follows bindings transitively)
   * unless it was created by a unifier that does not perform the occurs
   * check.
   */
  public static final class Substitution implements Result {
    /** Substitution with no bindings. */
    public static final Substitution EMPTY =
        new Substitution(ImmutableSortedMap.of());

    /**
     * The result of the unification algorithm proper. Values are as they were
     * bound, and may reference other variables that are keys.
     */
    public final ImmutableSortedMap<Variable, Term> resultMap;

    private final boolean acyclic;

    private Substitution(ImmutableSortedMap<Variable, Term> resultMap) {
      this.resultMap = requireNonNull(resultMap);
      this.acyclic = !hasCycles(resultMap);
    }

    /** Creates a substitution from a map. */
    public static Substitution of(Map<Variable, Term> map) {
      return map.isEmpty()
          ? EMPTY
          : new Substitution(ImmutableSortedMap.copyOf(map));
    }

    /** Creates a substitution with one (variable, term) entry. */
    public static Substitution of(Variable variable, Term term) {
      return new Substitution(ImmutableSortedMap.of(variable, term));
    }

    public boolean isEmpty() {
      return resultMap.isEmpty();
    }

    public int size() {
      return resultMap.size();
    }

    /** Returns the term bound to a variable, or null. */
    public @Nullable Term get(Variable variable) {
      return resultMap.get(variable);
    }

    /** Whether no variable depends, directly or transitively, on itself. */
    public boolean isAcyclic() {
      return acyclic;
    }

    /** Returns a substitution with an additional binding. */
    public Substitution plus(Variable variable, Term term) {
      final Map<Variable, Term> map = new HashMap<>(resultMap);
      map.put(variable, term);
      return of(map);
    }

    /**
     * Applies this substitution to a term.
     *
     * <p>A variable that is a key is replaced by its term, and a compound
     * term is rebuilt with each argument replaced. If this substitution is
     * acyclic, replacement continues until no bound variable remains, so
     * that applying the result again changes nothing. If it is cyclic, a
     * single pass is made.
     */
    public Term apply(Term term) {
      if (resultMap.isEmpty()) {
        return term;
      }
      if (!acyclic) {
        return term.apply(resultMap);
      }
      Term previous;
      Term current = term;
      do {
        previous = current;
        current = current.apply(resultMap);
      } while (!current.equals(previous));
      return current;
    }

    /**
     * Returns the composition of this substitution with {@code inner}.
     * Applying the result is equivalent to applying {@code inner} and then
     * applying this.
     */
    public Substitution compose(Substitution inner) {
      if (inner.isEmpty()) {
        return this;
      }
      final Map<Variable, Term> composed = new HashMap<>(resultMap);
      inner.resultMap.forEach((key, value) -> composed.put(key, apply(value)));
      composed.entrySet().removeIf(e -> e.getKey().equals(e.getValue()));
      return of(composed);
    }

    /** Returns a substitution in which every value is fully resolved. */
    public Substitution resolve() {
      if (!acyclic) {
        return this;
      }
      final Map<Variable, Term> map = new HashMap<>();
      resultMap.forEach((key, value) -> map.put(key, apply(value)));
      return of(map);
    }

    @Override
    public int hashCode() {
      return resultMap.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
          || obj instanceof Substitution
              && resultMap.equals(((Substitution) obj).resultMap);
    }

    @Override
    public String toString() {
      return accept(new StringBuilder()).toString();
    }

    public StringBuilder accept(StringBuilder buf) {
      buf.append("[");
      int i = 0;
      for (Map.Entry<Variable, Term> entry : resultMap.entrySet()) {
        buf.append(i++ > 0 ? ", " : "")
            .append(entry.getValue())
            .append("/")
            .append(entry.getKey());
      }
      return buf.append("]");
    }

    private static boolean hasCycles(Map<Variable, Term> map) {
      final Set<Variable> done = new HashSet<>();
      for (Variable variable : map.keySet()) {
        if (reaches(variable, map, new LinkedHashSet<>(), done)) {
          return true;
        }
      }
      return false;
    }

    /**
     * Returns whether expanding {@code variable} leads back to a variable in
     * {@code active}.
     */
    private static boolean reaches(Variable variable, Map<Variable, Term> map,
        Set<Variable> active, Set<Variable> done) {
      if (done.contains(variable)) {
        return false;
      }
      final Term term = map.get(variable);
      if (term == null) {
        return false;
      }
      if (!active.add(variable)) {
        return true;
      }
      final Set<Variable> variables = new LinkedHashSet<>();
      term.collectVariables(variables);
      for (Variable v : variables) {
        if (reaches(v, map, active, done)) {
          return true;
        }
      }
      active.remove(variable);
      done.add(variable);
      return false;
    }
  }

  /** Called on various events during unification. */
  public interface Tracer {
    /** Called when two terms are already equal. */
    void onDelete(Term left, Term right);

    /** Called when two terms cannot be unified. */
    void onConflict(Term left, Term right);

    /** Called when binding a variable would create a cycle. */
    void onCycle(Variable variable, Term term);

    /** Called when a variable is bound to a term. */
    void onVariable(Variable variable, Term term);
  }
}

// End Unifier.java
