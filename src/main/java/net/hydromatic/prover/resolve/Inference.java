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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Result of an attempt to prove a query by resolution. */
public final class Inference {
  public final State state;
  /** Number of rounds of resolution performed. */
  public final int iterations;
  /** Number of clauses in the working set when saturation stopped. */
  public final int clauseCount;
  /** Number of pairs of opposite literals that did not unify. */
  public final int failureCount;
  /** Which bound was reached, if the state is {@link State#INCONCLUSIVE}. */
  public final @Nullable String reason;

  Inference(State state, int iterations, int clauseCount, int failureCount,
      @Nullable String reason) {
    this.state = requireNonNull(state);
    this.iterations = iterations;
    this.clauseCount = clauseCount;
    this.failureCount = failureCount;
    this.reason = reason;
    checkArgument(state.isTerminal(), "not terminal: %s", state);
    checkArgument((reason != null) == (state == State.INCONCLUSIVE),
        "reason must be given if and only if inconclusive");
  }

  /** Returns whether the query was proved. */
  public boolean entailed() {
    return state == State.PROVED;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(state)
        .append(" after ")
        .append(iterations)
        .append(iterations == 1 ? " iteration" : " iterations")
        .append(" (")
        .append(clauseCount)
        .append(" clauses)");
    if (reason != null) {
      buf.append(": ").append(reason);
    }
    return buf.toString();
  }
}

// End Inference.java
