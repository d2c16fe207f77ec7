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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates unique names.
 *
 * <p>Keeps track of every name it has seen or generated, so that a fresh
 * name never coincides with a name that is already in use.
 */
public class NameGenerator {
  private final Set<String> used = new HashSet<>();
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();

  /** Records that a name is in use. */
  public void reserve(String name) {
    used.add(name);
  }

  /**
   * Generates a name that starts with {@code prefix} and is not in use; for
   * example, "x" might yield "x1", then "x2".
   */
  public String fresh(String prefix) {
    final AtomicInteger count =
        nameCounts.computeIfAbsent(prefix, n -> new AtomicInteger(1));
    for (;;) {
      final String name = prefix + count.getAndIncrement();
      if (used.add(name)) {
        return name;
      }
    }
  }
}

// End NameGenerator.java
