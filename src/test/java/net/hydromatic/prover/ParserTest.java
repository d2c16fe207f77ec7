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

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.prover.ast.Clause;
import net.hydromatic.prover.ast.KnowledgeBase;
import net.hydromatic.prover.ast.Literal;
import net.hydromatic.prover.ast.Op;
import net.hydromatic.prover.ast.Term;
import net.hydromatic.prover.parse.LiteralParser;
import net.hydromatic.prover.parse.ParseException;
import org.junit.jupiter.api.Test;

/** Tests {@link LiteralParser}. */
public class ParserTest {
  /** Parses text that is expected to be invalid, and checks the error. */
  private static void assertParseError(String text, String message,
      int column) {
    final ParseException e =
        assertThrows(ParseException.class,
            () -> LiteralParser.parseLiteral(text));
    assertThat(e.getMessage(), is(message));
    assertThat(e.column(), is(column));
    assertThat(e.text(), is(text));
  }

  @Test void testVariablesAndConstants() {
    assertThat(LiteralParser.parseTerm("x").op, is(Op.VARIABLE));
    assertThat(LiteralParser.parseTerm("z").op, is(Op.VARIABLE));
    assertThat(LiteralParser.parseTerm("xy").op, is(Op.CONSTANT));
    assertThat(LiteralParser.parseTerm("X").op, is(Op.CONSTANT));
    assertThat(LiteralParser.parseTerm("John").op, is(Op.CONSTANT));
    assertThat(LiteralParser.parseTerm("f(x)").op, is(Op.COMPOUND));
    assertThat(LiteralParser.isVariableName("a"), is(true));
    assertThat(LiteralParser.isVariableName("A"), is(false));
    assertThat(LiteralParser.isVariableName("ab"), is(false));
  }

  @Test void testCompound() {
    final Term term = LiteralParser.parseTerm(" Loves ( father(x) , x ) ");
    assertThat(term, instanceOf(Term.Compound.class));
    final Term.Compound compound = (Term.Compound) term;
    assertThat(compound.name, is("Loves"));
    assertThat(compound.arity(), is(2));
    assertThat(compound.args.get(1), is((Term) Term.variable("x")));
    assertThat(term, hasToString("Loves(father(x),x)"));
    assertThat(term.depth(), is(3));
    assertThat(term.isGround(), is(false));
    assertThat(term,
        is((Term) Term.compound("Loves",
            Term.compound("father", Term.variable("x")),
            Term.variable("x"))));
  }

  @Test void testNegation() {
    final Literal literal = LiteralParser.parseLiteral("¬ King(x)");
    assertThat(literal.positive, is(false));
    assertThat(literal, hasToString("¬King(x)"));
    assertThat(LiteralParser.parseLiteral("~King(x)"), is(literal));
    assertThat(LiteralParser.parseLiteral("!King(x)"), is(literal));
    assertThat(LiteralParser.parseLiteral("King(x)").positive, is(true));
    assertThat(literal.isComplementOf(literal.negate()), is(true));
    assertThat(literal.isComplementOf(literal), is(false));
  }

  @Test void testClause() {
    final Clause clause =
        LiteralParser.parseClause("¬King(x)", "¬Greedy(x)", "Evil(x)",
            "Evil(x)");
    assertThat(clause.size(), is(3));
    assertThat(clause, hasToString("{¬King(x), ¬Greedy(x), Evil(x)}"));
    assertThat(clause.isTautology(), is(false));
    assertThat(LiteralParser.parseClause("P(x)", "¬P(x)").isTautology(),
        is(true));
    assertThat(LiteralParser.parseClause(ImmutableList.of()),
        is(Clause.EMPTY));
  }

  @Test void testKnowledgeBase() {
    final KnowledgeBase kb =
        LiteralParser.parseKnowledgeBase(
            ImmutableList.of(ImmutableList.of("A"),
                ImmutableList.of("¬A", "C"),
                ImmutableList.of("A")));
    assertThat(kb.size(), is(2));
    assertThat(kb.contains(LiteralParser.parseClause("C", "¬A")), is(true));
    assertThat(kb, hasToString("[{A}, {¬A, C}]"));
  }

  @Test void testErrors() {
    assertParseError("", "expected name, got end of text", 0);
    assertParseError("¬", "expected name, got end of text", 1);
    assertParseError("P(", "expected name, got end of text", 2);
    assertParseError("P()", "empty argument list", 2);
    assertParseError("P(x", "unbalanced parentheses: missing ')'", 0);
    assertParseError("P(x))", "unbalanced parentheses: unexpected ')'", 4);
    assertParseError("P(x,)", "empty argument", 4);
    assertParseError("P(x y)", "expected ',' or ')'", 4);
    assertParseError("P x", "unexpected text after term", 2);
    assertParseError("(x)", "expected name, got '('", 0);
  }

  /** Negation is allowed before a literal, not before a term. */
  @Test void testNegatedTerm() {
    final ParseException e =
        assertThrows(ParseException.class,
            () -> LiteralParser.parseTerm("P(¬x)"));
    assertThat(e.getMessage(), is("expected name, got '¬'"));
    assertThat(e.column(), is(2));
  }

  @Test void testDescribe() {
    final ParseException e =
        assertThrows(ParseException.class,
            () -> LiteralParser.parseLiteral("P()"));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is("P()\n  ^ Error: empty argument list"));
  }
}

// End ParserTest.java
