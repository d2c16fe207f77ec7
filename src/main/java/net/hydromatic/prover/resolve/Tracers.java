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

import java.io.PrintWriter;
import net.hydromatic.prover.ast.Clause;
import net.hydromatic.prover.ast.Literal;
import net.hydromatic.prover.util.Unifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Implementations of {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer nullTracer() {
    return NullTracer.INSTANCE;
  }

  /** Returns a tracer that writes each event to a writer. */
  public static Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /** Returns a tracer that logs each event at TRACE level. */
  public static Tracer loggingTracer() {
    return loggingTracer(LoggerFactory.getLogger(Saturation.class));
  }

  /** Returns a tracer that logs each event at TRACE level to a logger. */
  public static Tracer loggingTracer(Logger logger) {
    return new LoggingTracer(logger);
  }

  /** Tracer that does nothing. */
  private enum NullTracer implements Tracer {
    INSTANCE;

    @Override public void onIteration(int iteration, int clauseCount) {}

    @Override public void onResolvent(Clause left, Clause right,
        Clause resolvent) {}

    @Override public void onFailure(Literal left, Literal right,
        Unifier.Failure failure) {}

    @Override public void onOutcome(Inference inference) {}
  }

  /** Tracer that writes to a {@link PrintWriter}. */
  private static class PrintTracer implements Tracer {
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    @Override public void onIteration(int iteration, int clauseCount) {
      w.println("iteration " + iteration + " clauses " + clauseCount);
      w.flush();
    }

    @Override public void onResolvent(Clause left, Clause right,
        Clause resolvent) {
      w.println("resolve " + left + " " + right + " -> " + resolvent);
      w.flush();
    }

    @Override public void onFailure(Literal left, Literal right,
        Unifier.Failure failure) {
      w.println("fail " + left + " " + right + " " + failure.kind());
      w.flush();
    }

    @Override public void onOutcome(Inference inference) {
      w.println("outcome " + inference);
      w.flush();
    }
  }

  /** Tracer that writes to an SLF4J {@link Logger}. */
  private static class LoggingTracer implements Tracer {
    private final Logger logger;

    LoggingTracer(Logger logger) {
      this.logger = requireNonNull(logger);
    }

    @Override public void onIteration(int iteration, int clauseCount) {
      logger.trace("Iteration {}, {} clauses", iteration, clauseCount);
    }

    @Override public void onResolvent(Clause left, Clause right,
        Clause resolvent) {
      logger.trace("Resolved {} and {} to {}", left, right, resolvent);
    }

    @Override public void onFailure(Literal left, Literal right,
        Unifier.Failure failure) {
      logger.trace("Could not resolve {} with {}: {}", left, right,
          failure.reason());
    }

    @Override public void onOutcome(Inference inference) {
      logger.trace("Outcome {}", inference);
    }
  }
}

// End Tracers.java
