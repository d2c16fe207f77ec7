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
package net.hydromatic.prover.resolve;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Ints;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls inference.
 *
 * @see net.hydromatic.prover.Prover#withProp(Prop, Object)
 */
public enum Prop {
  /**
   * Integer property "maxIterations" is the number of rounds of resolution
   * after which saturation gives up and reports an inconclusive result.
   * Zero means no limit. Default is 50.
   */
  MAX_ITERATIONS("maxIterations", Integer.class, true, 50),

  /**
   * Integer property "maxClauses" is the number of clauses in the working set
   * above which saturation gives up and reports an inconclusive result.
   * Zero means no limit. Default is 5,000.
   */
  MAX_CLAUSES("maxClauses", Integer.class, true, 5_000),

  /**
   * Integer property "maxTermDepth" is the depth of the deepest term allowed
   * in a resolvent. Deeper resolvents are discarded, and if a fixpoint is
   * later reached, the result is inconclusive rather than "not entailed".
   * Zero means no limit. Default is 8.
   */
  MAX_TERM_DEPTH("maxTermDepth", Integer.class, true, 8),

  /**
   * Integer property "timeoutMillis" is the wall-clock time, in milliseconds,
   * after which saturation gives up and reports an inconclusive result. Zero,
   * the default, means no limit.
   */
  TIMEOUT_MILLIS("timeoutMillis", Integer.class, true, 0),

  /**
   * Boolean property "occursCheck" controls whether unification refuses to
   * bind a variable to a term that contains it. Default is true.
   */
  OCCURS_CHECK("occursCheck", Boolean.class, true, true),

  /**
   * Boolean property "discardTautologies" controls whether a resolvent that
   * contains a literal and its complement is discarded. Default is true.
   */
  DISCARD_TAUTOLOGIES("discardTautologies", Boolean.class, true, true);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    Object o = map.get(this);
    return this.<Integer>typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return (T) (o == null ? defaultValue : o);
  }

  /**
   * Sets the value of a property, converting a string to the property's type
   * if necessary.
   */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = ((String) value).trim();
      if (type == Integer.class) {
        final Integer i = Ints.tryParse(s);
        if (i == null) {
          throw new IllegalArgumentException("value for property "
              + camelName + " must be an integer: " + value);
        }
        set(map, i);
        return;
      }
      if (type == Boolean.class) {
        switch (s.toLowerCase(Locale.ROOT)) {
        case "true":
          set(map, true);
          return;
        case "false":
          set(map, false);
          return;
        default:
          throw new IllegalArgumentException("value for property "
              + camelName + " must be 'true' or 'false': " + value);
        }
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property " + camelName
            + " is required");
      }
      map.remove(this);
      return;
    }
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException("value for property " + camelName
          + " must have type " + type.getSimpleName());
    }
    if (value instanceof Integer && (Integer) value < 0) {
      throw new IllegalArgumentException("value for property " + camelName
          + " must not be negative: " + value);
    }
    map.put(this, value);
  }
}

// End Prop.java
