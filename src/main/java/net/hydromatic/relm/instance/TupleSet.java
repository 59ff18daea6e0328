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
package net.hydromatic.relm.instance;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/** Immutable set of tuples of the same arity over a universe. */
public class TupleSet {
  public final Universe universe;
  public final int arity;
  /** Encoded tuples, in ascending order; see {@link Universe#encode}. */
  public final ImmutableSortedSet<Integer> indexes;

  private TupleSet(
      Universe universe, int arity, ImmutableSortedSet<Integer> indexes) {
    this.universe = requireNonNull(universe);
    this.arity = arity;
    this.indexes = requireNonNull(indexes);
  }

  /** Creates a tuple set from encoded tuples. */
  public static TupleSet of(
      Universe universe, int arity, Iterable<Integer> indexes) {
    final int capacity = universe.capacity(arity);
    final ImmutableSortedSet<Integer> set =
        ImmutableSortedSet.copyOf(indexes);
    checkArgument(set.isEmpty() || set.first() >= 0 && set.last() < capacity);
    return new TupleSet(universe, arity, set);
  }

  /** Creates an empty tuple set. */
  public static TupleSet empty(Universe universe, int arity) {
    return new TupleSet(universe, arity, ImmutableSortedSet.of());
  }

  /** Creates a unary tuple set from a collection of atoms. */
  public static TupleSet ofAtoms(Universe universe, Collection<Atom> atoms) {
    final ImmutableSortedSet.Builder<Integer> b =
        ImmutableSortedSet.naturalOrder();
    for (Atom atom : atoms) {
      b.add(atom.index);
    }
    return new TupleSet(universe, 1, b.build());
  }

  /** Creates the set of all tuples of a given arity. */
  public static TupleSet all(Universe universe, int arity) {
    final ImmutableSortedSet.Builder<Integer> b =
        ImmutableSortedSet.naturalOrder();
    final int capacity = universe.capacity(arity);
    for (int i = 0; i < capacity; i++) {
      b.add(i);
    }
    return new TupleSet(universe, arity, b.build());
  }

  public int size() {
    return indexes.size();
  }

  public boolean isEmpty() {
    return indexes.isEmpty();
  }

  public boolean contains(int index) {
    return indexes.contains(index);
  }

  /** Whether this set contains a tuple of atoms. */
  public boolean contains(Atom... atoms) {
    checkArgument(atoms.length == arity);
    final int[] columns = new int[arity];
    for (int i = 0; i < arity; i++) {
      columns[i] = atoms[i].index;
    }
    return indexes.contains(universe.encode(columns));
  }

  /** Whether every tuple of this set is in another. */
  public boolean isSubsetOf(TupleSet that) {
    checkArgument(arity == that.arity);
    return that.indexes.containsAll(indexes);
  }

  public TupleSet union(TupleSet that) {
    checkArgument(arity == that.arity);
    return new TupleSet(
        universe,
        arity,
        ImmutableSortedSet.<Integer>naturalOrder()
            .addAll(indexes)
            .addAll(that.indexes)
            .build());
  }

  public TupleSet intersect(TupleSet that) {
    checkArgument(arity == that.arity);
    final ImmutableSortedSet.Builder<Integer> b =
        ImmutableSortedSet.naturalOrder();
    for (int index : indexes) {
      if (that.indexes.contains(index)) {
        b.add(index);
      }
    }
    return new TupleSet(universe, arity, b.build());
  }

  /** Returns the cross product of this set and another. */
  public TupleSet product(TupleSet that) {
    final int shift = universe.capacity(that.arity);
    universe.capacity(arity + that.arity);
    final ImmutableSortedSet.Builder<Integer> b =
        ImmutableSortedSet.naturalOrder();
    for (int i : indexes) {
      for (int j : that.indexes) {
        b.add(i * shift + j);
      }
    }
    return new TupleSet(universe, arity + that.arity, b.build());
  }

  /**
   * Returns the relational join of this set and another: tuples formed from
   * a tuple of each whose last and first atoms match, without that atom.
   */
  public TupleSet join(TupleSet that) {
    checkArgument(arity + that.arity > 2);
    final int n = universe.size();
    final int shift = universe.capacity(that.arity - 1);
    final ImmutableSortedSet.Builder<Integer> b =
        ImmutableSortedSet.naturalOrder();
    for (int i : indexes) {
      final int prefix = i / n;
      final int middle = i % n;
      // tuples of "that" starting with "middle" are a contiguous range
      for (int j : that.indexes.subSet(middle * shift, (middle + 1) * shift)) {
        b.add(prefix * shift + j % shift);
      }
    }
    return new TupleSet(universe, arity + that.arity - 2, b.build());
  }

  /** Returns the transpose of a binary tuple set. */
  public TupleSet transpose() {
    checkArgument(arity == 2);
    final int n = universe.size();
    final ImmutableSortedSet.Builder<Integer> b =
        ImmutableSortedSet.naturalOrder();
    for (int i : indexes) {
      b.add((i % n) * n + i / n);
    }
    return new TupleSet(universe, arity, b.build());
  }

  /** Returns the transitive closure of a binary tuple set. */
  public TupleSet closure() {
    checkArgument(arity == 2);
    TupleSet c = this;
    for (;;) {
      final TupleSet next = c.union(c.join(c));
      if (next.equals(c)) {
        return c;
      }
      c = next;
    }
  }

  /** Returns the tuples as lists of atoms, in index order. */
  public List<List<Atom>> tuples() {
    final ImmutableList.Builder<List<Atom>> b = ImmutableList.builder();
    for (int index : indexes) {
      b.add(tuple(index));
    }
    return b.build();
  }

  /** Decodes one tuple. */
  public List<Atom> tuple(int index) {
    final ImmutableList.Builder<Atom> b = ImmutableList.builder();
    for (int column : universe.decode(index, arity)) {
      b.add(universe.atom(column));
    }
    return b.build();
  }

  @Override
  public int hashCode() {
    return Objects.hash(arity, indexes);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TupleSet
            && universe == ((TupleSet) o).universe
            && arity == ((TupleSet) o).arity
            && indexes.equals(((TupleSet) o).indexes);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    for (int index : indexes) {
      if (b.length() > 1) {
        b.append(", ");
      }
      final List<Atom> tuple = tuple(index);
      if (arity == 1) {
        b.append(tuple.get(0));
      } else {
        b.append('(');
        for (int i = 0; i < tuple.size(); i++) {
          if (i > 0) {
            b.append(", ");
          }
          b.append(tuple.get(i));
        }
        b.append(')');
      }
    }
    return b.append('}').toString();
  }
}

// End TupleSet.java
