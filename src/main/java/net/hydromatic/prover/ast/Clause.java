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

import com.google.common.collect.Collections2;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.Ordering;
import com.google.common.math.LongMath;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.prover.util.Unifier;

/**
 * A set of literals, read as their disjunction.
 *
 * <p>Clauses are immutable. The empty clause is a contradiction.
 */
public final class Clause implements Iterable<Literal> {
  /** The empty clause. */
  public static final Clause EMPTY = new Clause(ImmutableSet.of());

  /** Prefix of the names that {@link #standardize()} gives variables. */
  public static final String VARIABLE_PREFIX = "v";

  /** Largest number of literal orders that {@link #standardize()} tries. */
  public static final int MAX_ORDERINGS = 720;

  /**
   * Orders literals by their text with variables blanked out, then by their
   * full text.
   */
  private static final Ordering<Literal> SKELETON_ORDERING =
      Ordering.<String>natural()
          .onResultOf(Clause::skeleton)
          .compound(Ordering.usingToString());

  public final ImmutableSet<Literal> literals;

  private Clause(ImmutableSet<Literal> literals) {
    this.literals = requireNonNull(literals);
  }

  /** Creates a clause. */
  public static Clause of(Literal... literals) {
    return of(ImmutableList.copyOf(literals));
  }

  /** Creates a clause. */
  public static Clause of(Iterable<Literal> literals) {
    final ImmutableSet<Literal> set = ImmutableSet.copyOf(literals);
    return set.isEmpty() ? EMPTY : new Clause(set);
  }

  public boolean isEmpty() {
    return literals.isEmpty();
  }

  public int size() {
    return literals.size();
  }

  public boolean contains(Literal literal) {
    return literals.contains(literal);
  }

  @Override
  public Iterator<Literal> iterator() {
    return literals.iterator();
  }

  /** Returns a clause with every literal of this one except {@code literal}. */
  public Clause minus(Literal literal) {
    if (!literals.contains(literal)) {
      return this;
    }
    final ImmutableSet.Builder<Literal> builder = ImmutableSet.builder();
    for (Literal l : literals) {
      if (!l.equals(literal)) {
        builder.add(l);
      }
    }
    return of(builder.build());
  }

  /** Returns the union of this clause and another. */
  public Clause union(Clause clause) {
    if (clause.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return clause;
    }
    return of(
        ImmutableSet.<Literal>builder()
            .addAll(literals)
            .addAll(clause.literals)
            .build());
  }

  /**
   * Returns the clause formed by negating each literal of this clause.
   *
   * <p>This is how a query clause is negated before it is added to the set
   * of clauses to be refuted.
   */
  public Clause negateEach() {
    final ImmutableSet.Builder<Literal> builder = ImmutableSet.builder();
    for (Literal literal : literals) {
      builder.add(literal.negate());
    }
    return of(builder.build());
  }

  /** Returns whether this clause contains a literal and its complement. */
  public boolean isTautology() {
    for (Literal literal : literals) {
      if (!literal.positive && literals.contains(literal.negate())) {
        return true;
      }
    }
    return false;
  }

  /** Applies a substitution to each literal of this clause. */
  public Clause apply(Unifier.Substitution substitution) {
    if (substitution.isEmpty() || isEmpty()) {
      return this;
    }
    final ImmutableSet.Builder<Literal> builder = ImmutableSet.builder();
    for (Literal literal : literals) {
      builder.add(literal.apply(substitution));
    }
    return of(builder.build());
  }

  /**
   * Replaces variables in this clause in a single pass, for example to rename
   * them.
   */
  public Clause rename(Map<Term.Variable, Term> map) {
    if (map.isEmpty() || isEmpty()) {
      return this;
    }
    final ImmutableSet.Builder<Literal> builder = ImmutableSet.builder();
    for (Literal literal : literals) {
      builder.add(literal.rename(map));
    }
    return of(builder.build());
  }

  /** Returns the variables in this clause, in order of occurrence. */
  public Set<Term.Variable> variables() {
    final Set<Term.Variable> variables = new LinkedHashSet<>();
    for (Literal literal : literals) {
      literal.collectVariables(variables);
    }
    return variables;
  }

  /** Returns the depth of the deepest term in this clause. */
  public int depth() {
    int depth = 0;
    for (Literal literal : literals) {
      depth = Math.max(depth, literal.term.depth());
    }
    return depth;
  }

  /**
   * Renames the variables of this clause to {@code v0}, {@code v1}, and so
   * on.
   *
   * <p>Variables are numbered in order of first occurrence after sorting the
   * literals by their text with variables blanked out. Literals with the
   * same blanked-out text may be taken in any order; each order is tried,
   * and the renaming whose text is least wins. Thus two clauses that differ
   * only in the names of their variables standardize to the same clause.
   * If there are more than {@link #MAX_ORDERINGS} orders, only the first
   * is tried.
   */
  public Clause standardize() {
    if (variables().isEmpty()) {
      return this;
    }
    final List<List<List<Literal>>> groupOrders = new ArrayList<>();
    long orderCount = 1;
    for (List<Literal> group : skeletonGroups()) {
      orderCount =
          LongMath.saturatedMultiply(orderCount,
              LongMath.factorial(group.size()));
      if (orderCount > MAX_ORDERINGS) {
        return renumber(SKELETON_ORDERING.sortedCopy(literals));
      }
      groupOrders.add(ImmutableList.copyOf(Collections2.permutations(group)));
    }
    Clause best = null;
    String bestText = null;
    for (List<List<Literal>> groups : Lists.cartesianProduct(groupOrders)) {
      final Clause clause = renumber(Iterables.concat(groups));
      final String text = clause.toString();
      if (bestText == null || text.compareTo(bestText) < 0) {
        best = clause;
        bestText = text;
      }
    }
    return requireNonNull(best);
  }

  /**
   * Returns the literals of this clause sorted by their text with variables
   * blanked out, in groups that have the same blanked-out text.
   */
  private List<List<Literal>> skeletonGroups() {
    final ListMultimap<String, Literal> groups =
        MultimapBuilder.treeKeys().arrayListValues().build();
    for (Literal literal : SKELETON_ORDERING.sortedCopy(literals)) {
      groups.put(skeleton(literal), literal);
    }
    final List<List<Literal>> list = new ArrayList<>();
    for (String key : groups.keySet()) {
      list.add(groups.get(key));
    }
    return list;
  }

  /**
   * Renames variables to {@code v0}, {@code v1}, ... in order of first
   * occurrence in a list of this clause's literals, and sorts the result.
   */
  private Clause renumber(Iterable<Literal> ordered) {
    final Set<Term.Variable> variables = new LinkedHashSet<>();
    for (Literal literal : ordered) {
      literal.collectVariables(variables);
    }
    final Map<Term.Variable, Term> map = new HashMap<>();
    int i = 0;
    for (Term.Variable variable : variables) {
      map.put(variable, Term.variable(VARIABLE_PREFIX + i++));
    }
    final List<Literal> renamed = new ArrayList<>();
    for (Literal literal : ordered) {
      renamed.add(literal.rename(map));
    }
    return of(SKELETON_ORDERING.sortedCopy(renamed));
  }

  /** Returns the text of a literal with each variable replaced by "_".
   * A proposition keeps its name. */
  private static String skeleton(Literal literal) {
    if (literal.isProposition()) {
      return literal.toString();
    }
    final StringBuilder buf = new StringBuilder();
    if (!literal.positive) {
      buf.append(Literal.NOT);
    }
    literal.term.accept(new SkeletonWriter(buf));
    return buf.toString();
  }

  @Override
  public int hashCode() {
    return literals.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Clause
            && literals.equals(((Clause) obj).literals);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("{");
    int i = 0;
    for (Literal literal : literals) {
      if (i++ > 0) {
        buf.append(", ");
      }
      literal.unparse(buf);
    }
    return buf.append('}').toString();
  }

  /** Writes a term, blanking out its variables. */
  private static class SkeletonWriter implements Term.TermVisitor<Void> {
    private final StringBuilder buf;

    SkeletonWriter(StringBuilder buf) {
      this.buf = buf;
    }

    @Override
    public Void visit(Term.Variable variable) {
      buf.append('_');
      return null;
    }

    @Override
    public Void visit(Term.Constant constant) {
      constant.unparse(buf);
      return null;
    }

    @Override
    public Void visit(Term.Compound compound) {
      buf.append(compound.name).append('(');
      for (int i = 0; i < compound.args.size(); i++) {
        if (i > 0) {
          buf.append(',');
        }
        compound.args.get(i).accept(this);
      }
      buf.append(')');
      return null;
    }
  }
}

// End Clause.java
