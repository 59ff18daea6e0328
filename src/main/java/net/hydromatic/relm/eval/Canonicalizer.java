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

import com.google.common.collect.Collections2;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.math.LongMath;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import net.hydromatic.relm.instance.Atom;
import net.hydromatic.relm.instance.Instance;
import net.hydromatic.relm.instance.TupleSet;
import net.hydromatic.relm.instance.Universe;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes canonical forms of instances, so that two instances are
 * isomorphic (equal after permuting interchangeable atoms) if and only if
 * their canonical forms are equal.
 *
 * <p>The canonical form is the least, in lexicographic order, of the encoded
 * forms of the instance under every permutation that maps each atom to an
 * atom with the same tag.
 */
class Canonicalizer {
  private static final Ordering<Iterable<List<Integer>>> ORDERING =
      Ordering.<Integer>natural().lexicographical()
          .<List<Integer>>lexicographical();

  private final Universe universe;
  /** Each permutation maps atom index to atom index. */
  private final @Nullable List<int[]> permutations;

  Canonicalizer(Universe universe, int limit) {
    this.universe = universe;
    this.permutations = permutations(universe, limit);
  }

  private static @Nullable List<int[]> permutations(Universe universe,
      int limit) {
    final List<List<List<Atom>>> classPermutations = new ArrayList<>();
    long count = 1;
    for (Collection<Atom> atoms : universe.classes()) {
      count = LongMath.saturatedMultiply(count,
          LongMath.factorial(atoms.size()));
      if (count > limit) {
        return null;
      }
      classPermutations.add(
          ImmutableList.copyOf(Collections2.orderedPermutations(atoms)));
    }
    final List<int[]> list = new ArrayList<>();
    for (List<List<Atom>> images : Lists.cartesianProduct(classPermutations)) {
      final int[] permutation = new int[universe.size()];
      int i = 0;
      for (Collection<Atom> atoms : universe.classes()) {
        final List<Atom> image = images.get(i++);
        int j = 0;
        for (Atom atom : atoms) {
          permutation[atom.index] = image.get(j++).index;
        }
      }
      list.add(permutation);
    }
    return list;
  }

  /**
   * Returns the canonical form of an instance, or null if there are too
   * many permutations.
   */
  @Nullable List<List<Integer>> canonicalForm(Instance instance) {
    if (permutations == null) {
      return null;
    }
    @Nullable List<List<Integer>> best = null;
    for (int[] permutation : permutations) {
      final List<List<Integer>> form = apply(instance, permutation);
      if (best == null || ORDERING.compare(form, best) < 0) {
        best = form;
      }
    }
    return best;
  }

  /** Encodes an instance after permuting its atoms. */
  private List<List<Integer>> apply(Instance instance, int[] permutation) {
    final ImmutableList.Builder<List<Integer>> b = ImmutableList.builder();
    for (TupleSet tupleSet : instance.values.values()) {
      final List<Integer> indexes = new ArrayList<>();
      for (int index : tupleSet.indexes) {
        final int[] columns = universe.decode(index, tupleSet.arity);
        for (int i = 0; i < columns.length; i++) {
          columns[i] = permutation[columns[i]];
        }
        indexes.add(universe.encode(columns));
      }
      b.add(Ordering.<Integer>natural().immutableSortedCopy(indexes));
    }
    return b.build();
  }
}

// End Canonicalizer.java
