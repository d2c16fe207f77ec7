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

/**
 * State of a {@link Saturation}.
 *
 * <p>Saturation starts in {@link #RUNNING} and stops in one of the other,
 * terminal, states.
 */
public enum State {
  /** Still resolving pairs of clauses. */
  RUNNING,

  /** The empty clause was derived; the query is entailed. */
  PROVED,

  /** No new clause can be derived; the query is not entailed. */
  NOT_ENTAILED,

  /**
   * A bound on iterations, clauses, term depth or time was reached before
   * either a proof or a fixpoint.
   */
  INCONCLUSIVE;

  /** Whether this is a state in which saturation stops. */
  public boolean isTerminal() {
    return this != RUNNING;
  }
}

// End State.java
