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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import net.hydromatic.relm.instance.Atom;
import net.hydromatic.relm.instance.Universe;
import net.hydromatic.relm.sat.BooleanMatrix;
import net.hydromatic.relm.sat.Sat;
import net.hydromatic.relm.type.Relation;

/**
 * Generates a predicate that excludes some instances that are isomorphic to
 * others.
 *
 * <p>Atoms with the same tag are interchangeable. Swapping two adjacent atoms
 * of a class is a permutation {@code π} of the universe; it maps each
 * primary variable (relation {@code r}, tuple {@code t}) to the variable for
 * ({@code r}, {@code π(t)}). For each such permutation, we require that the
 * vector {@code V} of primary variables is lexicographically no greater than
 * {@code π(V)}. The lexicographically least member of each isomorphism class
 * satisfies every such constraint, so no class is lost.
 *
 * <p>Only the first {@code limit} pairs of variables that {@code π} moves are
 * compared, which keeps the predicate small and is still sound.
 */
public class SymmetryBreaker {
  private final Sat sat;
  private final Universe universe;
  private final Map<Relation, BooleanMatrix> relations;
  private final int limit;

  private SymmetryBreaker(Sat sat, Universe universe,
      Map<Relation, BooleanMatrix> relations, int limit) {
    this.sat = requireNonNull(sat);
    this.universe = requireNonNull(universe);
    this.relations = requireNonNull(relations);
    this.limit = limit;
  }

  /**
   * Returns a symmetry-breaking predicate.
   *
   * @param sat Circuit builder
   * @param universe Universe, whose atom tags define the classes
   * @param relations Matrix of each relation, in declaration order
   * @param limit Maximum number of variables per comparison; 0 disables
   */
  public static Sat.Term breakSymmetries(Sat sat, Universe universe,
      Map<Relation, BooleanMatrix> relations, int limit) {
    if (limit <= 0) {
      return Sat.TRUE;
    }
    return new SymmetryBreaker(sat, universe, relations, limit).predicate();
  }

  private Sat.Term predicate() {
    final List<Sat.Term> conjuncts = new ArrayList<>();
    for (Collection<Atom> atomClass : universe.classes()) {
      final List<Atom> atoms = new ArrayList<>(atomClass);
      for (int i = 0; i + 1 < atoms.size(); i++) {
        conjuncts.add(lexLeader(atoms.get(i).index, atoms.get(i + 1).index));
      }
    }
    return sat.and(conjuncts);
  }

  /** Returns {@code V ≤lex π(V)} for the permutation that swaps two atoms. */
  private Sat.Term lexLeader(int a, int b) {
    final List<Sat.Term> left = new ArrayList<>();
    final List<Sat.Term> right = new ArrayList<>();
    outer:
    for (Map.Entry<Relation, BooleanMatrix> entry : relations.entrySet()) {
      final BooleanMatrix matrix = entry.getValue();
      final int arity = entry.getKey().arity();
      for (Map.Entry<Integer, Sat.Term> cell : matrix.cells().entrySet()) {
        if (!(cell.getValue() instanceof Sat.Variable)) {
          continue;
        }
        final int image = swap(cell.getKey(), arity, a, b);
        final Sat.Term permuted = matrix.get(image);
        if (permuted == cell.getValue()) {
          continue;
        }
        left.add(cell.getValue());
        right.add(permuted);
        if (left.size() >= limit) {
          break outer;
        }
      }
    }
    return lessOrEqual(left, right);
  }

  /** Swaps atoms {@code a} and {@code b} in a tuple. */
  private int swap(int index, int arity, int a, int b) {
    final int[] columns = universe.decode(index, arity);
    for (int i = 0; i < columns.length; i++) {
      if (columns[i] == a) {
        columns[i] = b;
      } else if (columns[i] == b) {
        columns[i] = a;
      }
    }
    return universe.encode(columns);
  }

  /**
   * Returns the condition that one vector of terms is lexicographically no
   * greater than another, with false less than true.
   */
  Sat.Term lessOrEqual(List<Sat.Term> left, List<Sat.Term> right) {
    final List<Sat.Term> conjuncts = new ArrayList<>();
    Sat.Term equalSoFar = Sat.TRUE;
    for (int i = 0; i < left.size(); i++) {
      final Sat.Term x = left.get(i);
      final Sat.Term y = right.get(i);
      conjuncts.add(sat.implies(equalSoFar, sat.implies(x, y)));
      equalSoFar = sat.and(equalSoFar, sat.iff(x, y));
    }
    return sat.and(conjuncts);
  }
}

// End SymmetryBreaker.java
