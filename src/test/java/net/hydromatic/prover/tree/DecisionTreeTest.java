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
package net.hydromatic.prover.tree;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests {@link DecisionTree}. */
public class DecisionTreeTest {
  /** Whether to play outside, given the outlook and the wind. */
  private static final List<List<String>> WEATHER =
      ImmutableList.of(
          ImmutableList.of("Sunny", "Weak", "No"),
          ImmutableList.of("Sunny", "Strong", "No"),
          ImmutableList.of("Rain", "Weak", "Yes"),
          ImmutableList.of("Rain", "Strong", "No"),
          ImmutableList.of("Overcast", "Weak", "Yes"),
          ImmutableList.of("Overcast", "Strong", "Yes"));

  @Test void testEntropy() {
    assertThat(DecisionTree.entropy(WEATHER, 2), closeTo(1.0, 1e-9));
    assertThat(DecisionTree.entropy(WEATHER.subList(0, 2), 2), is(0.0));
    assertThat(DecisionTree.informationGain(WEATHER, 0, 2),
        closeTo(2.0 / 3.0, 1e-9));
    assertThat(DecisionTree.informationGain(WEATHER, 1, 2),
        closeTo(0.0817, 1e-4));
  }

  @Test void testBuild() {
    final DecisionTree.Node root =
        DecisionTree.build(WEATHER, ImmutableList.of(0, 1), 2);
    assertThat(root, instanceOf(DecisionTree.Split.class));
    final DecisionTree.Split split = (DecisionTree.Split) root;
    assertThat(split.feature, is(0));
    assertThat(split, hasToString("Node(feature=0, children=3)"));
    assertThat(split.children.keySet().toString(),
        is("[Sunny, Rain, Overcast]"));
    assertThat(split.children.get("Sunny"), hasToString("Leaf(decision=No)"));
    assertThat(split.children.get("Overcast"),
        hasToString("Leaf(decision=Yes)"));

    final DecisionTree.Node rain = split.children.get("Rain");
    assertThat(rain.isLeaf(), is(false));
    final DecisionTree.Split rainSplit = (DecisionTree.Split) rain;
    assertThat(rainSplit.feature, is(1));
    assertThat(rainSplit.children.get("Weak"),
        hasToString("Leaf(decision=Yes)"));
    assertThat(rainSplit.children.get("Strong"),
        hasToString("Leaf(decision=No)"));
  }

  /** A negative target index counts from the end of the row. */
  @Test void testNegativeTarget() {
    final DecisionTree.Node root =
        DecisionTree.build(WEATHER, ImmutableList.of(0, 1), -1);
    assertThat(root, hasToString("Node(feature=0, children=3)"));
  }

  @Test void testNoRows() {
    assertThat(DecisionTree.build(ImmutableList.of(), ImmutableList.of(0), 1),
        nullValue());
  }

  @Test void testLeaves() {
    // All labels agree
    final DecisionTree.Node node =
        DecisionTree.build(WEATHER.subList(0, 2), ImmutableList.of(0, 1), 2);
    assertThat(node.isLeaf(), is(true));
    assertThat(((DecisionTree.Leaf) node).decision, is((Object) "No"));

    // No features; the majority label wins, and the first-seen label wins
    // a tie
    assertThat(DecisionTree.build(WEATHER, ImmutableList.of(), 2),
        hasToString("Leaf(decision=No)"));
    assertThat(
        DecisionTree.build(WEATHER.subList(2, 6), ImmutableList.of(), 2),
        hasToString("Leaf(decision=Yes)"));

    // No feature has any gain
    final List<List<String>> rows =
        ImmutableList.of(ImmutableList.of("a", "Yes"),
            ImmutableList.of("a", "No"),
            ImmutableList.of("a", "No"));
    assertThat(DecisionTree.build(rows, ImmutableList.of(0), 1),
        hasToString("Leaf(decision=No)"));
  }

  @Test void testInvalid() {
    assertThrows(IllegalArgumentException.class, () ->
        DecisionTree.build(WEATHER, ImmutableList.of(0), 3));
    assertThrows(IllegalArgumentException.class, () ->
        DecisionTree.build(
            ImmutableList.of(ImmutableList.of("a", "b"),
                ImmutableList.of("a")),
            ImmutableList.of(0), 1));
  }
}

// End DecisionTreeTest.java
