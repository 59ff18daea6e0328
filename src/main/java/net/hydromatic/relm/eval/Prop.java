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
package net.hydromatic.relm.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * @see Session#map
 */
public enum Prop {
  /**
   * Integer property "canonicalCheckLimit" is the maximum number of
   * permutations of atoms to try when deciding whether an instance is
   * isomorphic to one already found. If an instance needs more, only the
   * blocking clause excludes repeats. Default is 40,320 (8!).
   */
  CANONICAL_CHECK_LIMIT("canonicalCheckLimit", Integer.class, true, 40_320),

  /**
   * String property "command" is the label of the command to execute. If not
   * set (the default), every command is executed.
   */
  COMMAND("command", String.class, false, null),

  /**
   * Integer property "defaultScope" is the number of atoms of each top-level
   * signature when a command gives no scope. Default is 3.
   */
  DEFAULT_SCOPE("defaultScope", Integer.class, true, 3),

  /**
   * Boolean property "exactScopes" controls whether the scope of each
   * signature is an exact number of atoms. If false, a scope is an upper
   * bound, unless the command says "exactly". Default is true.
   */
  EXACT_SCOPES("exactScopes", Boolean.class, true, true),

  /**
   * String property "output" controls how instances are printed. Default is
   * "text".
   */
  OUTPUT("output", Output.class, true, Output.TEXT),

  /** Long property "randomSeed" seeds the solver's branching. Default 0. */
  RANDOM_SEED("randomSeed", Long.class, true, 0L),

  /**
   * Integer property "solutionLimit" is the maximum number of instances to
   * find for each command. Default is 1.
   */
  SOLUTION_LIMIT("solutionLimit", Integer.class, true, 1),

  /**
   * Integer property "solverThreads" is the number of solvers that race on
   * each problem. Default is 1; if greater than 1, a portfolio of solvers
   * with different seeds is used.
   */
  SOLVER_THREADS("solverThreads", Integer.class, true, 1),

  /**
   * Integer property "symmetryBreaking" is the maximum number of variables
   * in each lex-leader constraint. 0 disables symmetry breaking. Default is
   * 20.
   */
  SYMMETRY_BREAKING("symmetryBreaking", Integer.class, true, 20),

  /**
   * Long property "timeoutMillis" is the time allowed for each search, in
   * milliseconds. 0, the default, means no limit.
   */
  TIMEOUT_MILLIS("timeoutMillis", Long.class, true, 0L);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

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

  Prop(String camelName, Class<?> type, boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(validValue(type, defaultValue));
    }
  }

  private static boolean validValue(Class<?> type, Object value) {
    if (type == Boolean.class
        || type == Integer.class
        || type == Long.class
        || type == String.class
        || type.isEnum()) {
      return type.isInstance(value);
    }
    return false;
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
  public @Nullable Object get(Map<Prop, Object> map) {
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
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  /** Returns the value of a long property. */
  public long longValue(Map<Prop, Object> map) {
    checkType(Long.class);
    return this.<Long>typeValue(map.get(this));
  }

  /** Returns the value of a string property, or null. */
  public @Nullable String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    final Object o = map.get(this);
    return o == null && defaultValue == null ? null : typeValue(o);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /**
   * Sets the value of a property, allowing strings for enum, boolean and
   * numeric types.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = (String) value;
      if (type.isEnum()) {
        Optional<Enum> optional =
            Enums.getIfPresent((Class<Enum>) type, s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(Enum::name)
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new IllegalArgumentException("value for property "
              + camelName + " must be one of: " + values);
        }
        set(map, optional.get());
        return;
      }
      try {
        if (type == Integer.class) {
          set(map, Integer.valueOf(s));
          return;
        }
        if (type == Long.class) {
          set(map, Long.valueOf(s));
          return;
        }
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must be a number: '" + s + "'", e);
      }
      if (type == Boolean.class) {
        if (!s.equalsIgnoreCase("true") && !s.equalsIgnoreCase("false")) {
          throw new IllegalArgumentException("value for property "
              + camelName + " must be true or false: '" + s + "'");
        }
        set(map, Boolean.valueOf(s));
        return;
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
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }

  /** Allowed values for {@link #OUTPUT} property. */
  public enum Output {
    /** One line per relation, tuples in index order. The default. */
    TEXT,
    /** One line per instance. */
    COMPACT
  }
}

// End Prop.java
