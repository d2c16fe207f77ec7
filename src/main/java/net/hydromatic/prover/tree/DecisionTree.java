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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds a decision tree from rows of data, using the ID3 algorithm.
 *
 * <p>At each node, chooses the feature with the greatest information gain
 * (the reduction in entropy of the target field), splits the rows by the
 * values of that feature, and recurses on the remaining features.
 */
public abstract class DecisionTree {
  private static final double LOG2 = Math.log(2);

  private DecisionTree() {}

  /**
   * Builds a decision tree.
   *
   * @param rows Rows; each is a list of field values, of equal length
   * @param featureIndices Indexes of the fields that may be used to split
   * @param targetIndex Index of the field that holds the class label; if
   *   negative, counts from the end, so -1 is the last field
   * @return Root of the tree, or null if there are no rows
   */
  public static @Nullable Node build(List<? extends List<?>> rows,
      List<Integer> featureIndices, int targetIndex) {
    if (rows.isEmpty()) {
      return null;
    }
    final int width = rows.get(0).size();
    for (List<?> row : rows) {
      checkArgument(row.size() == width, "rows have different lengths");
    }
    final int target = targetIndex < 0 ? width + targetIndex : targetIndex;
    checkArgument(target >= 0 && target < width,
        "target index out of range: %s", targetIndex);
    return buildNode(ImmutableList.copyOf(rows), featureIndices, target);
  }

  private static Node buildNode(List<? extends List<?>> rows,
      List<Integer> features, int target) {
    final Multiset<Object> labels = labels(rows, target);
    if (labels.elementSet().size() == 1) {
      return new Leaf(labels.iterator().next());
    }
    if (features.isEmpty()) {
      return new Leaf(majority(labels));
    }

    int best = -1;
    double bestGain = Double.NEGATIVE_INFINITY;
    for (int feature : features) {
      final double gain = informationGain(rows, feature, target);
      if (gain > bestGain) {
        bestGain = gain;
        best = feature;
      }
    }
    if (bestGain <= 0) {
      return new Leaf(majority(labels));
    }

    final List<Integer> remaining = new ArrayList<>(features);
    remaining.remove(Integer.valueOf(best));
    final ImmutableMap.Builder<Object, Node> children = ImmutableMap.builder();
    split(rows, best).forEach((value, subset) ->
        children.put(value, buildNode(subset, remaining, target)));
    return new Split(best, children.build());
  }

  /** Returns the entropy, in bits, of the target field of some rows. */
  static double entropy(List<? extends List<?>> rows, int target) {
    final Multiset<Object> labels = labels(rows, target);
    double entropy = 0;
    for (Multiset.Entry<Object> entry : labels.entrySet()) {
      final double p = (double) entry.getCount() / rows.size();
      entropy -= p * Math.log(p) / LOG2;
    }
    return entropy;
  }

  /** Returns the reduction in entropy from splitting rows on a feature. */
  static double informationGain(List<? extends List<?>> rows, int feature,
      int target) {
    double weighted = 0;
    for (List<List<?>> subset : split(rows, feature).values()) {
      weighted += (double) subset.size() / rows.size()
          * entropy(subset, target);
    }
    return entropy(rows, target) - weighted;
  }

  /** Groups rows by the value of a field, in order of first occurrence. */
  private static Map<Object, List<List<?>>> split(
      List<? extends List<?>> rows, int feature) {
    final Map<Object, List<List<?>>> subsets = new LinkedHashMap<>();
    for (List<?> row : rows) {
      final Object value = requireNonNull(row.get(feature), "value");
      subsets.computeIfAbsent(value, v -> new ArrayList<>()).add(row);
    }
    return subsets;
  }

  private static Multiset<Object> labels(List<? extends List<?>> rows,
      int target) {
    final Multiset<Object> labels = LinkedHashMultiset.create();
    for (List<?> row : rows) {
      labels.add(requireNonNull(row.get(target), "label"));
    }
    return labels;
  }

  /** Returns the most common label; if there is a tie, the first seen. */
  private static Object majority(Multiset<Object> labels) {
    Object best = null;
    int bestCount = 0;
    for (Multiset.Entry<Object> entry : labels.entrySet()) {
      if (entry.getCount() > bestCount) {
        best = entry.getElement();
        bestCount = entry.getCount();
      }
    }
    return requireNonNull(best);
  }

  /** Node in a decision tree. */
  public abstract static class Node {
    /** Returns whether this node is a leaf. */
    public abstract boolean isLeaf();
  }

  /** Leaf node; holds the class label to predict. */
  public static final class Leaf extends Node {
    public final Object decision;

    Leaf(Object decision) {
      this.decision = requireNonNull(decision);
    }

    @Override public boolean isLeaf() {
      return true;
    }

    @Override public String toString() {
      return "Leaf(decision=" + decision + ")";
    }
  }

  /** Interior node; chooses a child by the value of a feature. */
  public static final class Split extends Node {
    public final int feature;
    public final ImmutableMap<Object, Node> children;

    Split(int feature, ImmutableMap<Object, Node> children) {
      this.feature = feature;
      this.children = requireNonNull(children);
    }

    @Override public boolean isLeaf() {
      return false;
    }

    @Override public String toString() {
      return "Node(feature=" + feature + ", children=" + children.size() + ")";
    }
  }
}

// End DecisionTree.java
