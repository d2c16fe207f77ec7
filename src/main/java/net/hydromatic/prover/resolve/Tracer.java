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

import net.hydromatic.prover.ast.Clause;
import net.hydromatic.prover.ast.Literal;
import net.hydromatic.prover.util.Unifier;

/** Called on various events during resolution. */
public interface Tracer {
  /** Called at the start of each round, with the size of the working set. */
  void onIteration(int iteration, int clauseCount);

  /** Called when two clauses yield a resolvent. */
  void onResolvent(Clause left, Clause right, Clause resolvent);

  /**
   * Called when two literals of opposite polarity cannot be made
   * complementary. The pair yields no resolvent; resolution continues.
   */
  void onFailure(Literal left, Literal right, Unifier.Failure failure);

  /** Called when saturation stops. */
  void onOutcome(Inference inference);
}

// End Tracer.java
