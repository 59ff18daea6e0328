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
package net.hydromatic.relm.sat;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Unary ("thermometer") encoding of a non-negative integer.
 *
 * <p>{@link #atLeast atLeast(k)} is the condition that the value is at least
 * {@code k}. A counter built with a limit below the number of its inputs
 * saturates: it can answer {@code atLeast(k)} only for {@code k} up to the
 * limit.
 */
public class Counter {
  private final Sat sat;
  private final ImmutableList<Sat.Term> terms;
  private final boolean exact;

  private Counter(Sat sat, ImmutableList<Sat.Term> terms, boolean exact) {
    this.sat = requireNonNull(sat);
    this.terms = requireNonNull(terms);
    this.exact = exact;
  }

  /** Creates a counter of how many of a list of conditions are true. */
  public static Counter of(Sat sat, Iterable<Sat.Term> inputs, int limit) {
    checkArgument(limit >= 0, "negative limit %s", limit);
    List<Sat.Term> c = new ArrayList<>();
    boolean exact = true;
    for (Sat.Term x : inputs) {
      if (c.size() >= limit) {
        exact = false;
      }
      final int m = Math.min(c.size() + 1, limit);
      final List<Sat.Term> next = new ArrayList<>(m);
      for (int k = 0; k < m; k++) {
        final Sat.Term previous = k < c.size() ? c.get(k) : Sat.FALSE;
        final Sat.Term below = k == 0 ? Sat.TRUE : c.get(k - 1);
        next.add(sat.or(previous, sat.and(below, x)));
      }
      c = next;
    }
    return new Counter(sat, ImmutableList.copyOf(c), exact);
  }

  /** Creates a counter with a constant value. */
  public static Counter constant(Sat sat, int value) {
    checkArgument(value >= 0, "negative value %s", value);
    final ImmutableList.Builder<Sat.Term> b = ImmutableList.builder();
    for (int i = 0; i < value; i++) {
      b.add(Sat.TRUE);
    }
    return new Counter(sat, b.build(), true);
  }

  /** Whether this counter holds its value rather than saturating. */
  public boolean isExact() {
    return exact;
  }

  /** Returns the largest value this counter can distinguish. */
  public int max() {
    return terms.size();
  }

  /** Returns the condition that the value is at least {@code k}. */
  public Sat.Term atLeast(int k) {
    if (k <= 0) {
      return Sat.TRUE;
    }
    if (k <= terms.size()) {
      return terms.get(k - 1);
    }
    if (exact) {
      return Sat.FALSE;
    }
    throw new IllegalArgumentException(
        "counter saturates at " + terms.size() + "; cannot compare with "
            + k);
  }

  /** Returns the condition that this value equals another. */
  public Sat.Term eq(Counter that) {
    final List<Sat.Term> conjuncts = new ArrayList<>();
    final int max = Math.max(max(), that.max());
    for (int k = 1; k <= max; k++) {
      conjuncts.add(sat.iff(atLeast(k), that.atLeast(k)));
    }
    return sat.and(conjuncts);
  }

  /** Returns the condition that this value is at most another. */
  public Sat.Term le(Counter that) {
    final List<Sat.Term> conjuncts = new ArrayList<>();
    for (int k = 1; k <= max(); k++) {
      conjuncts.add(sat.implies(atLeast(k), that.atLeast(k)));
    }
    return sat.and(conjuncts);
  }

  /** Returns the condition that this value is less than another. */
  public Sat.Term lt(Counter that) {
    final List<Sat.Term> disjuncts = new ArrayList<>();
    for (int k = 1; k <= that.max(); k++) {
      disjuncts.add(sat.and(sat.not(atLeast(k)), that.atLeast(k)));
    }
    return sat.or(disjuncts);
  }
}

// End Counter.java
