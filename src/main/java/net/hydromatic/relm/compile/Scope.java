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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import net.hydromatic.relm.instance.Universe;
import net.hydromatic.relm.type.Command;
import net.hydromatic.relm.type.Sig;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sizes of signatures for one command, and the universe of atoms allocated
 * for them.
 *
 * <p>A signature with a scope has at most (or, if exact, exactly) that many
 * atoms. Each exact signature, and each top-level signature, has a pool of
 * atoms tagged with it or its descendants.
 */
public class Scope {
  public final Command command;
  public final Universe universe;
  private final ImmutableMap<Sig, Integer> counts;
  private final ImmutableSet<Sig> exact;

  Scope(Command command, Universe universe, Map<Sig, Integer> counts,
      Iterable<Sig> exact) {
    this.command = requireNonNull(command);
    this.universe = requireNonNull(universe);
    this.counts = ImmutableMap.copyOf(counts);
    this.exact = ImmutableSet.copyOf(exact);
  }

  /** Returns the scope of a signature, or null if it has none. */
  public @Nullable Integer count(Sig sig) {
    return counts.get(sig);
  }

  /** Whether a signature has exactly as many atoms as its scope. */
  public boolean isExact(Sig sig) {
    return exact.contains(sig);
  }

  /** Returns the signatures that have a scope. */
  public ImmutableSet<Sig> sigs() {
    return counts.keySet();
  }

  @Override public String toString() {
    final StringBuilder b = new StringBuilder();
    counts.forEach((sig, count) -> {
      if (b.length() > 0) {
        b.append(", ");
      }
      b.append(exact.contains(sig) ? "exactly " : "")
          .append(count)
          .append(' ')
          .append(sig.name);
    });
    return b.toString();
  }
}

// End Scope.java
