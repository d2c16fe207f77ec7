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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Term: a {@link Variable}, a {@link Constant}, or a {@link Compound}.
 *
 * <p>Terms are immutable, and two terms are equal if they have the same
 * structure. The kind of a term is held in its {@link #op}; it is decided
 * once, by the parser or by the factory method that creates the term, and
 * is never re-derived from the term's text.
 */
public abstract class Term {
  public final Op op;

  Term(Op op) {
    this.op = requireNonNull(op);
  }

  /** Creates a variable. */
  public static Variable variable(String name) {
    return new Variable(name);
  }

  /** Creates a constant. */
  public static Constant constant(String name) {
    return new Constant(name);
  }

  /** Creates a compound term. */
  public static Compound compound(String name, Term... args) {
    return new Compound(name, ImmutableList.copyOf(args));
  }

  /** Creates a compound term. */
  public static Compound compound(String name, Iterable<? extends Term> args) {
    return new Compound(name, ImmutableList.copyOf(args));
  }

  /**
   * Returns the canonical text of this term, for example
   * {@code Loves(father(x),x)}.
   *
   * <p>Arguments are separated by a comma without spaces, so that two terms
   * with the same canonical text are equal.
   */
  @Override
  public final String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /** Appends the canonical text of this term to a builder. */
  public abstract StringBuilder unparse(StringBuilder buf);

  /**
   * Replaces each variable that is a key in {@code map} by its value. Makes
   * a single pass; the values are not themselves rewritten.
   */
  public abstract Term apply(Map<Variable, Term> map);

  /** Returns whether this term references a given variable. */
  public abstract boolean contains(Variable variable);

  /** Adds the variables in this term, in order of occurrence, to a set. */
  public abstract void collectVariables(Set<Variable> variables);

  /**
   * Returns the nesting depth of this term. A variable or constant has depth
   * 1; {@code f(g(a))} has depth 3.
   */
  public abstract int depth();

  /** Returns whether this term contains no variables. */
  public boolean isGround() {
    return true;
  }

  /** Accepts a visitor. */
  public abstract <R> R accept(TermVisitor<R> visitor);

  /**
   * Visitor for terms.
   *
   * @param <R> return type
   * @see Term#accept(TermVisitor)
   */
  public interface TermVisitor<R> {
    R visit(Variable variable);

    R visit(Constant constant);

    R visit(Compound compound);
  }

  /** A variable. Its value is found by unification. */
  public static final class Variable extends Term
      implements Comparable<Variable> {
    public final String name;

    Variable(String name) {
      super(Op.VARIABLE);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty variable name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Variable
              && name.equals(((Variable) obj).name);
    }

    @Override
    public int compareTo(Variable o) {
      return name.compareTo(o.name);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public Term apply(Map<Variable, Term> map) {
      return map.getOrDefault(this, this);
    }

    @Override
    public boolean contains(Variable variable) {
      return equals(variable);
    }

    @Override
    public void collectVariables(Set<Variable> variables) {
      variables.add(this);
    }

    @Override
    public int depth() {
      return 1;
    }

    @Override
    public boolean isGround() {
      return false;
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** A constant, such as {@code John} or {@code A}. */
  public static final class Constant extends Term {
    public final String name;

    Constant(String name) {
      super(Op.CONSTANT);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty constant name");
    }

    @Override
    public int hashCode() {
      return name.hashCode() * 31 + 1;
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Constant
              && name.equals(((Constant) obj).name);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      return buf.append(name);
    }

    @Override
    public Term apply(Map<Variable, Term> map) {
      return this;
    }

    @Override
    public boolean contains(Variable variable) {
      return false;
    }

    @Override
    public void collectVariables(Set<Variable> variables) {
    }

    @Override
    public int depth() {
      return 1;
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * A name applied to a list of arguments.
   *
   * <p>Used both for predicates, such as {@code Parent(x,y)}, and for
   * functions, such as {@code father(x)}.
   */
  public static final class Compound extends Term {
    public final String name;
    public final ImmutableList<Term> args;

    Compound(String name, ImmutableList<Term> args) {
      super(Op.COMPOUND);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
      checkArgument(!name.isEmpty(), "empty name");
      checkArgument(!args.isEmpty(), "compound %s has no arguments", name);
    }

    /** Returns the number of arguments. */
    public int arity() {
      return args.size();
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Compound
              && name.equals(((Compound) obj).name)
              && args.equals(((Compound) obj).args);
    }

    @Override
    public StringBuilder unparse(StringBuilder buf) {
      buf.append(name).append('(');
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          buf.append(',');
        }
        args.get(i).unparse(buf);
      }
      return buf.append(')');
    }

    @Override
    public Term apply(Map<Variable, Term> map) {
      if (map.isEmpty() || isGround()) {
        return this;
      }
      final List<Term> newArgs = new ArrayList<>(args.size());
      for (Term arg : args) {
        newArgs.add(arg.apply(map));
      }
      if (newArgs.equals(args)) {
        return this;
      }
      return new Compound(name, ImmutableList.copyOf(newArgs));
    }

    @Override
    public boolean contains(Variable variable) {
      for (Term arg : args) {
        if (arg.contains(variable)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public void collectVariables(Set<Variable> variables) {
      for (Term arg : args) {
        arg.collectVariables(variables);
      }
    }

    @Override
    public int depth() {
      int depth = 0;
      for (Term arg : args) {
        depth = Math.max(depth, arg.depth());
      }
      return depth + 1;
    }

    @Override
    public boolean isGround() {
      for (Term arg : args) {
        if (!arg.isGround()) {
          return false;
        }
      }
      return true;
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }
}

// End Term.java
