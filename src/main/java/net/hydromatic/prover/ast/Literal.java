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
package net.hydromatic.prover.ast;

import static java.util.Objects.requireNonNull;

import java.util.Map;
import java.util.Set;
import net.hydromatic.prover.util.Unifier;

/**
 * A term with a polarity.
 *
 * <p>A negative literal prints with a leading {@link #NOT} symbol, for
 * example {@code ¬King(x)}. Two literals are equal if and only if their
 * canonical texts are equal.
 *
 * <p>A literal whose term is a bare variable, such as {@code p}, is a
 * proposition. It matches only its exact complement; substitutions and
 * renaming leave it alone, and its variable is not counted among the
 * variables of the literal.
 */
public final class Literal {
  /** Symbol that marks a negative literal. */
  public static final char NOT = '¬';

  public final Term term;
  public final boolean positive;

  private Literal(Term term, boolean positive) {
    this.term = requireNonNull(term);
    this.positive = positive;
  }

  /** Creates a positive literal. */
  public static Literal of(Term term) {
    return new Literal(term, true);
  }

  /** Creates a literal with a given polarity. */
  public static Literal of(Term term, boolean positive) {
    return new Literal(term, positive);
  }

  /** Returns this literal with its polarity toggled. */
  public Literal negate() {
    return new Literal(term, !positive);
  }

  /**
   * Returns whether this literal is the exact complement of another; that
   * is, it has the same term and the opposite polarity.
   */
  public boolean isComplementOf(Literal literal) {
    return positive != literal.positive && term.equals(literal.term);
  }

  /** Returns whether this literal's term is a bare variable. */
  public boolean isProposition() {
    return term.op == Op.VARIABLE;
  }

  /** Applies a substitution to this literal. */
  public Literal apply(Unifier.Substitution substitution) {
    if (isProposition()) {
      return this;
    }
    final Term term2 = substitution.apply(term);
    return term2 == term ? this : new Literal(term2, positive);
  }

  /** Replaces variables in a single pass, for example to rename them. */
  public Literal rename(Map<Term.Variable, Term> map) {
    if (isProposition()) {
      return this;
    }
    final Term term2 = term.apply(map);
    return term2 == term ? this : new Literal(term2, positive);
  }

  /** Adds the variables in this literal to a set. */
  public void collectVariables(Set<Term.Variable> variables) {
    if (!isProposition()) {
      term.collectVariables(variables);
    }
  }

  @Override
  public int hashCode() {
    return term.hashCode() * 2 + (positive ? 1 : 0);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Literal
            && positive == ((Literal) obj).positive
            && term.equals(((Literal) obj).term);
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  public StringBuilder unparse(StringBuilder buf) {
    if (!positive) {
      buf.append(NOT);
    }
    return term.unparse(buf);
  }
}

// End Literal.java
