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
package net.hydromatic.relm.compile;

import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Environment that binds variable names to values; types while resolving,
 * boolean matrices while translating.
 *
 * <p>Every environment is immutable; when you call {@link #bind}, a new
 * environment is created that inherits from the previous environment. The new
 * environment may obscure bindings in the old environment, but neither the new
 * nor the old will ever change.
 *
 * @param <V> Value type
 */
public abstract class Environment<V> {
  /** Returns an environment with no bindings. */
  @SuppressWarnings("unchecked")
  public static <V> Environment<V> empty() {
    return (Environment<V>) EmptyEnvironment.INSTANCE;
  }

  /** Returns the value of {@code name} if bound, null if not. */
  public abstract @Nullable V getOpt(String name);

  /** Returns the value of {@code name}; throws if not bound. */
  public V get(String name) {
    final V v = getOpt(name);
    if (v == null) {
      throw new IllegalArgumentException("not found: " + name);
    }
    return v;
  }

  /** Creates an environment that extends this one with a binding. */
  public Environment<V> bind(String name, V value) {
    return new SubEnvironment<>(this, name, value);
  }

  /** Returns the visible bindings, most recent first. */
  public Map<String, V> asMap() {
    final Map<String, V> map = new LinkedHashMap<>();
    for (Environment<V> e = this; e instanceof SubEnvironment; ) {
      final SubEnvironment<V> sub = (SubEnvironment<V>) e;
      map.putIfAbsent(sub.name, sub.value);
      e = sub.parent;
    }
    return map;
  }

  /** Environment that has no bindings. */
  private static class EmptyEnvironment<V> extends Environment<V> {
    static final EmptyEnvironment<Object> INSTANCE = new EmptyEnvironment<>();

    @Override public @Nullable V getOpt(String name) {
      return null;
    }
  }

  /** Environment that binds one name and inherits the rest. */
  private static class SubEnvironment<V> extends Environment<V> {
    private final Environment<V> parent;
    private final String name;
    private final V value;

    SubEnvironment(Environment<V> parent, String name, V value) {
      this.parent = requireNonNull(parent);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override public @Nullable V getOpt(String name) {
      for (Environment<V> e = this; e instanceof SubEnvironment; ) {
        final SubEnvironment<V> sub = (SubEnvironment<V>) e;
        if (sub.name.equals(name)) {
          return sub.value;
        }
        e = sub.parent;
      }
      return null;
    }
  }
}

// End Environment.java
