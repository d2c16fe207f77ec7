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

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import net.hydromatic.prover.ast.Clause;
import net.hydromatic.prover.ast.KnowledgeBase;
import net.hydromatic.prover.ast.Literal;
import net.hydromatic.prover.util.RobinsonUnifier;
import net.hydromatic.prover.util.Unifier;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Proves a query by resolution refutation.
 *
 * <p>Negates the query, adds it to the clauses of the knowledge base, and
 * repeatedly resolves pairs of clauses until it derives the empty clause
 * ({@link State#PROVED}), can derive no new clause ({@link
 * State#NOT_ENTAILED}), or reaches one of the bounds set by {@link Prop}
 * ({@link State#INCONCLUSIVE}). An integer bound of zero means no limit.
 *
 * <p>Each call to {@link #run} has its own working set; a Saturation may be
 * used for several queries, but not concurrently.
 */
public class Saturation {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Saturation.class);

  private final int maxIterations;
  private final int maxClauses;
  private final int maxTermDepth;
  private final int timeoutMillis;
  private final Unifier unifier;
  private final boolean discardTautologies;
  private final Tracer tracer;

  /** Creates a Saturation with given properties and tracer. */
  public Saturation(Map<Prop, Object> map, Tracer tracer) {
    this.maxIterations = Prop.MAX_ITERATIONS.intValue(map);
    this.maxClauses = Prop.MAX_CLAUSES.intValue(map);
    this.maxTermDepth = Prop.MAX_TERM_DEPTH.intValue(map);
    this.timeoutMillis = Prop.TIMEOUT_MILLIS.intValue(map);
    this.unifier = new RobinsonUnifier(Prop.OCCURS_CHECK.booleanValue(map));
    this.discardTautologies = Prop.DISCARD_TAUTOLOGIES.booleanValue(map);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a Saturation with default properties. */
  public static Saturation create() {
    return new Saturation(ImmutableMap.of(), Tracers.nullTracer());
  }

  /** Returns whether a knowledge base entails a query clause. */
  public Inference run(KnowledgeBase kb, Clause query) {
    LOGGER.debug("Refuting {} using {} clauses", query, kb.size());
    final Run run = new Run();
    final Inference inference = run.run(kb, query);
    LOGGER.debug("{} {}", query, inference);
    tracer.onOutcome(inference);
    return inference;
  }

  /** Work space for one call to {@link #run}. */
  private class Run implements Tracer {
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final Resolver resolver =
        new Resolver(unifier, discardTautologies, this);
    final Set<Clause> clauses = new LinkedHashSet<>();
    State state = State.RUNNING;
    int iteration = 0;
    int failureCount = 0;
    boolean discarded = false;

    Inference run(KnowledgeBase kb, Clause query) {
      for (Clause clause : kb) {
        clauses.add(clause.standardize());
      }
      if (!query.isEmpty()) {
        clauses.add(query.negateEach().standardize());
      }
      if (clauses.contains(Clause.EMPTY)) {
        return finish(State.PROVED, null);
      }

      // Clauses that have been resolved against each other; and clauses
      // added by the previous round, that have not.
      final List<Clause> old = new ArrayList<>();
      List<Clause> fresh = new ArrayList<>(clauses);
      while (state == State.RUNNING) {
        if (maxIterations > 0 && iteration >= maxIterations) {
          return finish(State.INCONCLUSIVE,
              "reached maximum of " + maxIterations + " iterations");
        }
        ++iteration;
        tracer.onIteration(iteration, clauses.size());
        final Set<Clause> candidates = new LinkedHashSet<>();
        for (int i = 0; i < fresh.size(); i++) {
          if (timedOut()) {
            return finish(State.INCONCLUSIVE,
                "timed out after " + timeoutMillis + " milliseconds");
          }
          final Clause left = fresh.get(i);
          for (Clause right : old) {
            if (resolve(left, right, candidates)) {
              return finish(State.PROVED, null);
            }
          }
          for (int j = i + 1; j < fresh.size(); j++) {
            if (resolve(left, fresh.get(j), candidates)) {
              return finish(State.PROVED, null);
            }
          }
        }

        final List<Clause> added = new ArrayList<>();
        for (Clause candidate : candidates) {
          if (maxTermDepth > 0 && candidate.depth() > maxTermDepth) {
            discarded = true;
          } else if (clauses.add(candidate)) {
            added.add(candidate);
          }
        }
        if (added.isEmpty()) {
          return discarded
              ? finish(State.INCONCLUSIVE, "discarded resolvents deeper than "
                  + maxTermDepth)
              : finish(State.NOT_ENTAILED, null);
        }
        if (maxClauses > 0 && clauses.size() > maxClauses) {
          return finish(State.INCONCLUSIVE,
              "exceeded maximum of " + maxClauses + " clauses");
        }
        old.addAll(fresh);
        fresh = added;
      }
      throw new AssertionError(state);
    }

    /**
     * Resolves a pair of clauses, adding resolvents to a set. Returns whether
     * the empty clause was derived.
     */
    private boolean resolve(Clause left, Clause right,
        Set<Clause> candidates) {
      final Set<Clause> resolvents = resolver.resolve(left, right);
      if (resolvents.contains(Clause.EMPTY)) {
        return true;
      }
      candidates.addAll(resolvents);
      return false;
    }

    private boolean timedOut() {
      return timeoutMillis > 0
          && stopwatch.elapsed(TimeUnit.MILLISECONDS) > timeoutMillis;
    }

    private Inference finish(State state, @Nullable String reason) {
      this.state = state;
      if (state == State.INCONCLUSIVE) {
        LOGGER.info("Gave up after {} iterations and {} clauses: {}",
            iteration, clauses.size(), reason);
      }
      return new Inference(state, iteration, clauses.size(), failureCount,
          reason);
    }

    @Override public void onIteration(int iteration, int clauseCount) {
      tracer.onIteration(iteration, clauseCount);
    }

    @Override public void onResolvent(Clause left, Clause right,
        Clause resolvent) {
      tracer.onResolvent(left, right, resolvent);
    }

    @Override public void onFailure(Literal left, Literal right,
        Unifier.Failure failure) {
      ++failureCount;
      tracer.onFailure(left, right, failure);
    }

    @Override public void onOutcome(Inference inference) {
      tracer.onOutcome(inference);
    }
  }
}

// End Saturation.java
