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

import java.io.OutputStream;
import java.io.PrintWriter;
import net.hydromatic.prover.ast.Term;
import net.hydromatic.prover.ast.Term.Variable;

/** Implementations of {@link Unifier.Tracer}. */
public class Tracers {

  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Unifier.Tracer nullTracer() {
    return NullTracer.INSTANCE;
  }

  /** Returns a tracer that writes debugging messages to a writer. */
  public static Unifier.Tracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /** Returns a tracer that writes debugging messages to a stream. */
  public static Unifier.Tracer printTracer(OutputStream stream) {
    return printTracer(new PrintWriter(stream));
  }

  /** Implementation of {@link Unifier.Tracer} that does nothing. */
  private enum NullTracer implements Unifier.Tracer {
    INSTANCE;

    public void onDelete(Term left, Term right) {}

    public void onConflict(Term left, Term right) {}

    public void onCycle(Variable variable, Term term) {}

    public void onVariable(Variable variable, Term term) {}
  }

  /**
   * Implementation of {@link Unifier.Tracer} that writes to a given {@link
   * PrintWriter}.
   */
  private static class PrintTracer implements Unifier.Tracer {
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void print(String event, Term left, Term right) {
      w.println(event + " " + left + " " + right);
      w.flush();
    }

    public void onDelete(Term left, Term right) {
      print("delete", left, right);
    }

    public void onConflict(Term left, Term right) {
      print("conflict", left, right);
    }

    public void onCycle(Variable variable, Term term) {
      print("cycle", variable, term);
    }

    public void onVariable(Variable variable, Term term) {
      print("variable", variable, term);
    }
  }
}

// End Tracers.java
