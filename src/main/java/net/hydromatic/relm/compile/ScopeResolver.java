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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.ast.Pos;
import net.hydromatic.relm.instance.Universe;
import net.hydromatic.relm.type.Command;
import net.hydromatic.relm.type.Model;
import net.hydromatic.relm.type.Sig;

/**
 * Computes the {@link Scope} of a command.
 *
 * <p>Top-level signatures take the command's explicit scope, else its overall
 * scope, else the default scope; "one" signatures have exactly one atom and
 * "lone" signatures at most one. Atoms are allocated hierarchy by hierarchy,
 * in declaration order: the pools of exact sub-signatures first, then the
 * remaining atoms of the signature itself.
 */
public class ScopeResolver {
  private static final long UNBOUNDED = Long.MAX_VALUE / 4;

  private final Model model;
  private final Command command;
  private final int defaultScope;
  private final boolean exactScopes;
  private final Map<Sig, Integer> counts = new LinkedHashMap<>();
  private final Set<Sig> exact = new LinkedHashSet<>();
  private final Map<Sig, Pos> positions = new HashMap<>();
  private final Universe.Builder universe = Universe.builder();

  private ScopeResolver(Model model, Command command, int defaultScope,
      boolean exactScopes) {
    this.model = model;
    this.command = command;
    this.defaultScope = defaultScope;
    this.exactScopes = exactScopes;
  }

  /**
   * Computes the scope of a command.
   *
   * @param model Resolved module
   * @param command Command
   * @param defaultScope Scope of top-level signatures that the command does
   *     not give a scope
   * @param exactScopes Whether a signature given a scope without "exactly"
   *     has exactly that many atoms, rather than at most that many
   * @throws ScopeException if the scopes are contradictory
   */
  public static Scope resolve(Model model, Command command, int defaultScope,
      boolean exactScopes) {
    return new ScopeResolver(model, command, defaultScope, exactScopes)
        .resolve();
  }

  private Scope resolve() {
    for (Command.SigScope scope : command.scopes) {
      addExplicit(scope);
    }
    for (Sig sig : model.sigs) {
      if (!counts.containsKey(sig) && !sig.isSubset()) {
        if (sig.mult == Ast.Mult.ONE) {
          counts.put(sig, 1);
          exact.add(sig);
        } else if (sig.mult == Ast.Mult.LONE) {
          counts.put(sig, 1);
        }
      }
    }
    final List<Sig> topLevelSigs = model.topLevelSigs();
    for (Sig sig : topLevelSigs) {
      if (!counts.containsKey(sig)) {
        final int n =
            command.overall != null ? command.overall : defaultScope;
        // An implicit scope grows to hold what sub-signatures require.
        counts.put(sig, Math.max(n, (int) minimum(sig)));
        if (exactScopes) {
          exact.add(sig);
        }
      }
    }
    for (Sig sig : topLevelSigs) {
      allocate(sig, counts.get(sig));
    }
    return new Scope(command, universe.build(), counts, exact);
  }

  private void addExplicit(Command.SigScope scope) {
    final Sig sig = scope.sig;
    if (sig.isSubset()) {
      throw new ScopeException(
          "cannot give a scope to subset signature '" + sig.name + "' in "
              + command,
          scope.pos);
    }
    if (scope.count < 0) {
      throw new ScopeException(
          "scope of '" + sig.name + "' is negative in " + command, scope.pos);
    }
    if (sig.mult == Ast.Mult.ONE && scope.count != 1
        || sig.mult == Ast.Mult.LONE && scope.count > 1
        || sig.mult == Ast.Mult.SOME && scope.count < 1) {
      throw new ScopeException(
          "signature '" + sig.name + "' is declared '"
              + sig.mult.keyword() + "' but has scope " + scope.count
              + " in " + command,
          scope.pos);
    }
    counts.put(sig, scope.count);
    positions.put(sig, scope.pos);
    if (scope.exactly || exactScopes || sig.mult == Ast.Mult.ONE) {
      exact.add(sig);
    }
  }

  /** Returns the fewest atoms that a signature can have. */
  private long minimum(Sig sig) {
    if (exact.contains(sig)) {
      return counts.get(sig);
    }
    long sum = 0;
    for (Sig child : model.children(sig)) {
      sum += minimum(child);
    }
    return sig.mult == Ast.Mult.SOME ? Math.max(1, sum) : sum;
  }

  /** Returns the most atoms that a signature can have. */
  private long capacity(Sig sig) {
    long c = sig.isAbstract ? childCapacity(sig) : UNBOUNDED;
    final Integer count = counts.get(sig);
    if (count != null) {
      c = Math.min(c, count);
    }
    return c;
  }

  private long childCapacity(Sig sig) {
    long sum = 0;
    for (Sig child : model.children(sig)) {
      sum = Math.min(UNBOUNDED, sum + capacity(child));
    }
    return sum;
  }

  /** Allocates the pool of a top-level or exact signature. */
  private void allocate(Sig sig, int count) {
    final Pos pos = positions.getOrDefault(sig, command.pos);
    long required = 0;
    for (Sig child : model.children(sig)) {
      required += minimum(child);
    }
    if (required > count) {
      throw new ScopeException(
          "scope of '" + sig.name + "' is " + count
              + " but its sub-signatures require at least " + required
              + " atoms in " + command,
          pos);
    }
    if (sig.isAbstract && exact.contains(sig)) {
      final long capacity = childCapacity(sig);
      if (count > capacity) {
        throw new ScopeException(
            model.children(sig).isEmpty()
                ? "abstract signature '" + sig.name
                    + "' has no sub-signatures to hold its " + count
                    + " atoms in " + command
                : "abstract signature '" + sig.name + "' has scope " + count
                    + " but its sub-signatures can hold at most " + capacity
                    + " atoms in " + command,
            pos);
      }
    }
    final List<Sig> pools = new ArrayList<>();
    for (Sig child : model.children(sig)) {
      collectPools(child, pools);
    }
    int used = 0;
    for (Sig pool : pools) {
      final int n = counts.get(pool);
      allocate(pool, n);
      used += n;
    }
    universe.add(sig, count - used);
  }

  /**
   * Finds the exact signatures in a subtree that are not within another exact
   * signature.
   */
  private void collectPools(Sig sig, List<Sig> pools) {
    if (exact.contains(sig)) {
      pools.add(sig);
      return;
    }
    for (Sig child : model.children(sig)) {
      collectPools(child, pools);
    }
  }
}

// End ScopeResolver.java
