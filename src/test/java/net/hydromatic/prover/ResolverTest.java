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
package net.hydromatic.prover;

import static net.hydromatic.prover.parse.LiteralParser.parseClause;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Set;
import net.hydromatic.prover.ast.Clause;
import net.hydromatic.prover.resolve.Resolver;
import net.hydromatic.prover.resolve.Tracers;
import net.hydromatic.prover.util.RobinsonUnifier;
import net.hydromatic.prover.util.Unifiers;
import org.junit.jupiter.api.Test;

/** Tests {@link Resolver} and the clause operations it relies on. */
public class ResolverTest {
  private final Resolver resolver = Resolver.create();

  private static Set<Clause> clauses(Clause... clauses) {
    return ImmutableSet.copyOf(clauses);
  }

  @Test void testGround() {
    final Set<Clause> resolvents =
        resolver.resolve(parseClause("A"), parseClause("¬A", "C"));
    assertThat(resolvents, is(clauses(parseClause("C"))));

    // Resolution is symmetric
    assertThat(resolver.resolve(parseClause("¬A", "C"), parseClause("A")),
        is(resolvents));
  }

  @Test void testEmptyClause() {
    assertThat(resolver.resolve(parseClause("P(John)"),
            parseClause("¬P(John)")),
        is(clauses(Clause.EMPTY)));
    assertThat(resolver.resolve(parseClause("P(x)"), parseClause("¬P(John)")),
        is(clauses(Clause.EMPTY)));
  }

  @Test void testNoComplement() {
    assertThat(resolver.resolve(parseClause("A"), parseClause("B")), empty());
    assertThat(resolver.resolve(parseClause("A"), parseClause("A", "B")),
        empty());
    assertThat(
        resolver.resolve(parseClause("P(John)"), parseClause("¬P(Mary)")),
        empty());
  }

  @Test void testUnifying() {
    final Set<Clause> resolvents =
        resolver.resolve(parseClause("King(John)"),
            parseClause("¬King(x)", "¬Greedy(x)", "Evil(x)"));
    assertThat(resolvents,
        is(clauses(parseClause("¬Greedy(John)", "Evil(John)"))));
  }

  /** Variables of the second clause are renamed so that they do not clash
   * with variables of the first. */
  @Test void testRenameApart() {
    final Clause left = parseClause("P(x)");
    final Clause right = parseClause("¬P(f(x))", "Q(x)");
    assertThat(Unifiers.renameApart(right, left),
        hasToString("{¬P(f(x1)), Q(x1)}"));
    assertThat(Unifiers.renameApart(right, parseClause("P(y)")),
        is(right));

    // Without renaming, unifying x with f(x) would fail the occurs check
    assertThat(resolver.resolve(left, right),
        is(clauses(parseClause("Q(v0)"))));
  }

  /** Resolvents are standardized, so clauses that differ only in the names
   * of their variables are equal. */
  @Test void testStandardize() {
    final Clause c1 = parseClause("Q(y, x)", "¬P(x)");
    final Clause c2 = parseClause("¬P(b)", "Q(a, b)");
    assertThat(c1.equals(c2), is(false));
    assertThat(c1.standardize(), is(c2.standardize()));
    assertThat(c1.standardize(), hasToString("{Q(v0,v1), ¬P(v1)}"));
    assertThat(parseClause("A").standardize(), is(parseClause("A")));

    final Set<Clause> resolvents =
        resolver.resolve(parseClause("P(A)", "P(B)"),
            parseClause("¬P(x)", "R(x, y)"));
    assertThat(resolvents,
        is(clauses(parseClause("P(B)", "R(A, v0)"),
            parseClause("P(A)", "R(B, v0)"))));
  }

  /** Clauses that differ only in the names of their variables standardize
   * to the same clause, even if literals have the same shape. */
  @Test void testStandardizeVariants() {
    final Clause c1 = parseClause("Q(a)", "Q(b)", "R(a)");
    final Clause c2 = parseClause("Q(a)", "Q(b)", "R(b)");
    assertThat(c1.standardize(), is(c2.standardize()));
    assertThat(c1.standardize(), hasToString("{Q(v0), Q(v1), R(v0)}"));

    final Clause c3 = parseClause("P(x, y)", "P(y, z)", "P(z, x)");
    final Clause c4 = parseClause("P(b, c)", "P(a, b)", "P(c, a)");
    assertThat(c3.standardize(), is(c4.standardize()));

    // Not variants
    assertThat(c1.standardize().equals(parseClause("Q(a)", "Q(a)", "R(a)")
        .standardize()), is(false));
  }

  /** A literal that is a bare variable is a proposition. It matches only
   * its exact complement, and is never renamed. */
  @Test void testProposition() {
    assertThat(resolver.resolve(parseClause("a"), parseClause("¬b")),
        empty());
    assertThat(resolver.resolve(parseClause("p"), parseClause("¬Rains")),
        empty());
    assertThat(resolver.resolve(parseClause("p"), parseClause("¬p", "q")),
        is(clauses(parseClause("q"))));
    assertThat(
        resolver.resolve(parseClause("p", "P(x)"), parseClause("¬p", "Q(x)")),
        is(clauses(parseClause("P(v0)", "Q(v1)"))));

    assertThat(parseClause("a").standardize(), is(parseClause("a")));
    assertThat(parseClause("a", "P(a)").standardize(),
        hasToString("{P(v0), a}"));
    assertThat(parseClause("a").variables().isEmpty(), is(true));
  }

  @Test void testTautology() {
    final Clause left = parseClause("P(x)", "Q(x)");
    final Clause right = parseClause("¬P(A)", "¬Q(A)");
    // Each pair yields a tautology, such as {Q(A), ¬Q(A)}
    assertThat(resolver.resolve(left, right), empty());

    final Resolver resolver2 =
        new Resolver(new RobinsonUnifier(), false, Tracers.nullTracer());
    assertThat(resolver2.resolve(left, right),
        is(clauses(parseClause("Q(A)", "¬Q(A)"),
            parseClause("P(A)", "¬P(A)"))));
  }

  @Test void testTrace() {
    final StringWriter sw = new StringWriter();
    final Resolver resolver2 =
        new Resolver(new RobinsonUnifier(), true,
            Tracers.printTracer(new PrintWriter(sw)));
    resolver2.resolve(parseClause("P(A)", "Q(B)"),
        parseClause("¬P(A)", "¬Q(C)"));
    final String nl = System.lineSeparator();
    assertThat(sw.toString(),
        is("resolve {P(A), Q(B)} {¬P(A), ¬Q(C)} -> {Q(B), ¬Q(C)}" + nl
            + "fail P(A) ¬Q(C) CLASH" + nl
            + "fail Q(B) ¬P(A) CLASH" + nl
            + "fail Q(B) ¬Q(C) CLASH" + nl));
  }

  /** Resolves clauses given as text, through {@link Prover}. */
  @Test void testProverResolve() {
    final Set<Clause> resolvents =
        Prover.create().resolve(ImmutableList.of("A"),
            ImmutableList.of("¬A", "C"));
    assertThat(resolvents, hasToString("[{C}]"));
  }
}

// End ResolverTest.java
