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
package net.hydromatic.prover.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import net.hydromatic.prover.ast.Clause;
import net.hydromatic.prover.ast.KnowledgeBase;
import net.hydromatic.prover.ast.Literal;
import net.hydromatic.prover.ast.Term;

/**
 * Parses the text of literals, such as {@code ¬Loves(father(x), x)}.
 *
 * <p>The grammar is as follows. Whitespace between tokens is ignored.
 *
 * <pre>{@code
 * literal ::= [ '¬' | '~' | '!' ] term
 * term    ::= name [ '(' term { ',' term } ')' ]
 * }</pre>
 *
 * <p>A name without arguments that is a single lower-case letter is a
 * variable; any other name without arguments is a constant.
 */
public class LiteralParser {
  /** Characters that mark a literal as negative. */
  private static final CharMatcher NEGATION = CharMatcher.anyOf("¬~!");

  /** Characters that end a name. */
  private static final CharMatcher DELIMITER =
      CharMatcher.anyOf("(),").or(NEGATION).or(CharMatcher.whitespace());

  private final String text;
  private int pos;

  private LiteralParser(String text) {
    this.text = requireNonNull(text);
  }

  /** Parses a literal. */
  public static Literal parseLiteral(String text) {
    final LiteralParser parser = new LiteralParser(text);
    parser.skipWhitespace();
    final boolean positive = !parser.negation();
    final Term term = parser.term();
    parser.end();
    return Literal.of(term, positive);
  }

  /** Parses a term. Unlike a literal, a term may not be negated. */
  public static Term parseTerm(String text) {
    final LiteralParser parser = new LiteralParser(text);
    parser.skipWhitespace();
    final Term term = parser.term();
    parser.end();
    return term;
  }

  /** Parses a clause, given the text of each of its literals. */
  public static Clause parseClause(Iterable<String> literals) {
    final ImmutableList.Builder<Literal> list = ImmutableList.builder();
    for (String literal : literals) {
      list.add(parseLiteral(literal));
    }
    return Clause.of(list.build());
  }

  /** Parses a clause, given the text of each of its literals. */
  public static Clause parseClause(String... literals) {
    return parseClause(ImmutableList.copyOf(literals));
  }

  /** Parses a knowledge base, given the text of each literal of each clause. */
  public static KnowledgeBase parseKnowledgeBase(
      Iterable<? extends Iterable<String>> clauses) {
    final ImmutableList.Builder<Clause> list = ImmutableList.builder();
    for (Iterable<String> clause : clauses) {
      list.add(parseClause(clause));
    }
    return KnowledgeBase.of(list.build());
  }

  /**
   * Returns whether an atomic token denotes a variable. By convention, a
   * variable is a single lower-case letter.
   */
  public static boolean isVariableName(String name) {
    return name.length() == 1
        && name.charAt(0) >= 'a'
        && name.charAt(0) <= 'z';
  }

  private boolean negation() {
    if (pos < text.length() && NEGATION.matches(text.charAt(pos))) {
      ++pos;
      skipWhitespace();
      return true;
    }
    return false;
  }

  private Term term() {
    final int start = pos;
    final String name = name();
    skipWhitespace();
    if (pos >= text.length() || text.charAt(pos) != '(') {
      return isVariableName(name)
          ? Term.variable(name)
          : Term.constant(name);
    }
    ++pos;
    skipWhitespace();
    if (pos < text.length() && text.charAt(pos) == ')') {
      throw error("empty argument list", pos);
    }
    final ImmutableList.Builder<Term> args = ImmutableList.builder();
    for (;;) {
      args.add(term());
      skipWhitespace();
      if (pos >= text.length()) {
        throw error("unbalanced parentheses: missing ')'", start);
      }
      final char c = text.charAt(pos++);
      if (c == ')') {
        return Term.compound(name, args.build());
      }
      if (c != ',') {
        throw error("expected ',' or ')'", pos - 1);
      }
      skipWhitespace();
    }
  }

  private String name() {
    final int start = pos;
    while (pos < text.length() && !DELIMITER.matches(text.charAt(pos))) {
      ++pos;
    }
    if (pos == start) {
      if (pos >= text.length()) {
        throw error("expected name, got end of text", pos);
      }
      final char c = text.charAt(pos);
      throw error(c == ',' || c == ')'
          ? "empty argument"
          : "expected name, got '" + c + "'", pos);
    }
    return text.substring(start, pos);
  }

  private void end() {
    skipWhitespace();
    if (pos < text.length()) {
      throw error(text.charAt(pos) == ')'
          ? "unbalanced parentheses: unexpected ')'"
          : "unexpected text after term", pos);
    }
  }

  private void skipWhitespace() {
    while (pos < text.length()
        && CharMatcher.whitespace().matches(text.charAt(pos))) {
      ++pos;
    }
  }

  private ParseException error(String message, int column) {
    return new ParseException(message, text, column);
  }
}

// End LiteralParser.java
