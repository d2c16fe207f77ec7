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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Iterator;

/** A set of clauses that are assumed to be true. */
public final class KnowledgeBase implements Iterable<Clause> {
  public final ImmutableSet<Clause> clauses;

  private KnowledgeBase(ImmutableSet<Clause> clauses) {
    this.clauses = requireNonNull(clauses);
  }

  /** Creates a knowledge base. */
  public static KnowledgeBase of(Clause... clauses) {
    return of(ImmutableList.copyOf(clauses));
  }

  /** Creates a knowledge base. */
  public static KnowledgeBase of(Iterable<Clause> clauses) {
    return new KnowledgeBase(ImmutableSet.copyOf(clauses));
  }

  public int size() {
    return clauses.size();
  }

  public boolean contains(Clause clause) {
    return clauses.contains(clause);
  }

  @Override
  public Iterator<Clause> iterator() {
    return clauses.iterator();
  }

  @Override
  public int hashCode() {
    return clauses.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof KnowledgeBase
            && clauses.equals(((KnowledgeBase) obj).clauses);
  }

  @Override
  public String toString() {
    return clauses.toString();
  }
}

// End KnowledgeBase.java
