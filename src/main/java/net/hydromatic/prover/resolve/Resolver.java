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
package net.hydromatic.prover.resolve;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.Set;
import net.hydromatic.prover.ast.Clause;
import net.hydromatic.prover.ast.Literal;
import net.hydromatic.prover.util.RobinsonUnifier;
import net.hydromatic.prover.util.Unifier;
import net.hydromatic.prover.util.Unifiers;

/**
 * Derives resolvents from pairs of clauses.
 *
 * <p>Given clauses A and B, for each literal L of A and each literal M of B
 * that can be made complementary by a substitution s, the resolvent is
 * s((A - {L}) ∪ (B - {M})).
 */
public class Resolver {
  private final Unifier unifier;
  private final boolean discardTautologies;
  private final Tracer tracer;

  /** Creates a Resolver. */
  public Resolver(Unifier unifier, boolean discardTautologies,
      Tracer tracer) {
    this.unifier = requireNonNull(unifier);
    this.discardTautologies = discardTautologies;
    this.tracer = requireNonNull(tracer);
  }

  /**
   * Creates a Resolver that performs the occurs check, discards tautologies
   * and traces nothing.
   */
  public static Resolver create() {
    return new Resolver(new RobinsonUnifier(), true, Tracers.nullTracer());
  }

  /**
   * Returns every resolvent of two clauses.
   *
   * <p>Variables of {@code right} that also occur in {@code left} are renamed
   * before matching, and each resolvent is standardized, so the result
   * contains no two clauses that differ only in the names of variables.
   * Returns an empty set if the clauses have no complementary literals.
   */
  public Set<Clause> resolve(Clause left, Clause right) {
    final Clause right2 = Unifiers.renameApart(right, left);
    final Set<Clause> resolvents = new LinkedHashSet<>();
    for (Literal l : left) {
      for (Literal m : right2) {
        if (l.positive == m.positive) {
          continue;
        }
        final Unifier.Result result = Unifiers.complement(unifier, l, m);
        if (result instanceof Unifier.Failure) {
          tracer.onFailure(l, m, (Unifier.Failure) result);
          continue;
        }
        final Unifier.Substitution substitution =
            (Unifier.Substitution) result;
        final Clause resolvent =
            left.minus(l)
                .union(right2.minus(m))
                .apply(substitution)
                .standardize();
        if (discardTautologies && resolvent.isTautology()) {
          continue;
        }
        if (resolvents.add(resolvent)) {
          tracer.onResolvent(left, right, resolvent);
        }
      }
    }
    return ImmutableSet.copyOf(resolvents);
  }
}

// End Resolver.java
