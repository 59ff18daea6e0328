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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;
import net.hydromatic.relm.instance.TupleSet;
import net.hydromatic.relm.instance.Universe;

/**
 * Relation whose tuples are present under boolean conditions.
 *
 * <p>A matrix of arity {@code k} over a universe of {@code n} atoms maps each
 * tuple index (see {@code Universe.encode}) to a {@link Sat.Term} that is
 * true in exactly the instances where the tuple is in the relation. Cells
 * that are {@link Sat#FALSE} are not stored.
 *
 * <p>Matrices are immutable; operations return new matrices.
 */
public class BooleanMatrix {
  public final Sat sat;
  public final int n;
  public final int arity;
  private final NavigableMap<Integer, Sat.Term> cells;

  private BooleanMatrix(
      Sat sat, int n, int arity, NavigableMap<Integer, Sat.Term> cells) {
    this.sat = requireNonNull(sat);
    this.n = n;
    this.arity = arity;
    this.cells = cells;
  }

  /** Creates a matrix from cells, dropping those that are false. */
  public static BooleanMatrix of(
      Sat sat, int n, int arity, Map<Integer, Sat.Term> cells) {
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    cells.forEach((index, term) -> {
      if (term != Sat.FALSE) {
        map.put(index, term);
      }
    });
    return new BooleanMatrix(sat, n, arity, map);
  }

  /** Creates an empty matrix. */
  public static BooleanMatrix empty(Sat sat, int n, int arity) {
    return new BooleanMatrix(sat, n, arity, new TreeMap<>());
  }

  /** Creates a matrix whose cells are true for the tuples of a set. */
  public static BooleanMatrix constant(Sat sat, TupleSet tupleSet) {
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    for (int index : tupleSet.indexes) {
      map.put(index, Sat.TRUE);
    }
    return new BooleanMatrix(
        sat, tupleSet.universe.size(), tupleSet.arity, map);
  }

  /** Creates a unary matrix containing exactly one atom. */
  public static BooleanMatrix atom(Sat sat, int n, int atom) {
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    map.put(atom, Sat.TRUE);
    return new BooleanMatrix(sat, n, 1, map);
  }

  /** Creates the unary matrix of all atoms. */
  public static BooleanMatrix univ(Sat sat, int n) {
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    for (int i = 0; i < n; i++) {
      map.put(i, Sat.TRUE);
    }
    return new BooleanMatrix(sat, n, 1, map);
  }

  /** Creates the binary identity matrix. */
  public static BooleanMatrix iden(Sat sat, int n) {
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    for (int i = 0; i < n; i++) {
      map.put(i * n + i, Sat.TRUE);
    }
    return new BooleanMatrix(sat, n, 2, map);
  }

  /** Returns the condition for a tuple to be present. */
  public Sat.Term get(int index) {
    final Sat.Term term = cells.get(index);
    return term == null ? Sat.FALSE : term;
  }

  /** Returns the cells that are not false, in tuple order. */
  public SortedMap<Integer, Sat.Term> cells() {
    return Collections.unmodifiableSortedMap(cells);
  }

  /** Whether every cell is a constant. */
  public boolean isConstant() {
    for (Sat.Term term : cells.values()) {
      if (term != Sat.TRUE) {
        return false;
      }
    }
    return true;
  }

  private int capacity(int arity) {
    return Universe.capacity(n, arity);
  }

  private BooleanMatrix create(int arity, TreeMap<Integer, Sat.Term> map) {
    map.values().removeIf(t -> t == Sat.FALSE);
    return new BooleanMatrix(sat, n, arity, map);
  }

  public BooleanMatrix union(BooleanMatrix that) {
    checkArgument(arity == that.arity);
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>(cells);
    that.cells.forEach((index, term) ->
        map.merge(index, term, (a, b) -> sat.or(a, b)));
    return create(arity, map);
  }

  public BooleanMatrix intersect(BooleanMatrix that) {
    checkArgument(arity == that.arity);
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    cells.forEach((index, term) -> {
      final Sat.Term t = that.cells.get(index);
      if (t != null) {
        map.put(index, sat.and(term, t));
      }
    });
    return create(arity, map);
  }

  public BooleanMatrix difference(BooleanMatrix that) {
    checkArgument(arity == that.arity);
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    cells.forEach((index, term) ->
        map.put(index, sat.and(term, sat.not(that.get(index)))));
    return create(arity, map);
  }

  /**
   * Returns "{@code this ++ that}": the tuples of {@code that}, and the tuples
   * of this whose first atom is not the first atom of a tuple of
   * {@code that}.
   */
  public BooleanMatrix override(BooleanMatrix that) {
    checkArgument(arity == that.arity);
    final int rowSize = capacity(arity - 1);
    final BooleanMatrix thatDomain = that.firstColumn();
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    cells.forEach((index, term) ->
        map.put(index,
            sat.and(term, sat.not(thatDomain.get(index / rowSize)))));
    that.cells.forEach((index, term) ->
        map.merge(index, term, (a, b) -> sat.or(a, b)));
    return create(arity, map);
  }

  /** Returns the cross product "{@code this -> that}". */
  public BooleanMatrix product(BooleanMatrix that) {
    final int shift = capacity(that.arity);
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    cells.forEach((i, a) ->
        that.cells.forEach((j, b) -> map.put(i * shift + j, sat.and(a, b))));
    return create(arity + that.arity, map);
  }

  /** Returns the relational join "{@code this.that}". */
  public BooleanMatrix join(BooleanMatrix that) {
    checkArgument(arity + that.arity > 2);
    final int rowSize = capacity(that.arity - 1);
    final TreeMap<Integer, List<Sat.Term>> terms = new TreeMap<>();
    cells.forEach((i, a) -> {
      final int prefix = i / n;
      final int middle = i % n;
      that.cells
          .subMap(middle * rowSize, (middle + 1) * rowSize)
          .forEach((j, b) ->
              terms
                  .computeIfAbsent(prefix * rowSize + j % rowSize,
                      k -> new ArrayList<>())
                  .add(sat.and(a, b)));
    });
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    terms.forEach((index, list) -> map.put(index, sat.or(list)));
    return create(arity + that.arity - 2, map);
  }

  /** Returns the transpose "{@code ~this}" of a binary matrix. */
  public BooleanMatrix transpose() {
    checkArgument(arity == 2);
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    cells.forEach((index, term) ->
        map.put((index % n) * n + index / n, term));
    return create(2, map);
  }

  /**
   * Returns the transitive closure "{@code ^this}" of a binary matrix.
   *
   * <p>Squares at most ⌈log<sub>2</sub> n⌉ times, since after {@code k}
   * squarings the matrix contains all paths of length up to
   * 2<sup>k</sup>; stops early if a squaring adds nothing.
   */
  public BooleanMatrix closure() {
    checkArgument(arity == 2);
    BooleanMatrix c = this;
    for (int reach = 1; reach < n; reach *= 2) {
      final BooleanMatrix next = c.union(c.join(c));
      if (next.cells.equals(c.cells)) {
        break;
      }
      c = next;
    }
    return c;
  }

  /** Returns the domain restriction "{@code set <: this}". */
  public BooleanMatrix restrictDomain(BooleanMatrix set) {
    checkArgument(set.arity == 1);
    final int rowSize = capacity(arity - 1);
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    cells.forEach((index, term) ->
        map.put(index, sat.and(term, set.get(index / rowSize))));
    return create(arity, map);
  }

  /** Returns the range restriction "{@code this :> set}". */
  public BooleanMatrix restrictRange(BooleanMatrix set) {
    checkArgument(set.arity == 1);
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    cells.forEach((index, term) ->
        map.put(index, sat.and(term, set.get(index % n))));
    return create(arity, map);
  }

  /** Returns the unary matrix of atoms that start a tuple. */
  public BooleanMatrix firstColumn() {
    final int rowSize = capacity(arity - 1);
    final TreeMap<Integer, List<Sat.Term>> terms = new TreeMap<>();
    cells.forEach((index, term) ->
        terms.computeIfAbsent(index / rowSize, k -> new ArrayList<>())
            .add(term));
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    terms.forEach((index, list) -> map.put(index, sat.or(list)));
    return create(1, map);
  }

  /** Returns "{@code if condition then this else that}", cell by cell. */
  public BooleanMatrix choice(Sat.Term condition, BooleanMatrix that) {
    checkArgument(arity == that.arity);
    final TreeMap<Integer, Sat.Term> map = new TreeMap<>();
    cells.forEach((index, term) ->
        map.put(index, sat.ite(condition, term, that.get(index))));
    that.cells.forEach((index, term) ->
        map.computeIfAbsent(index,
            k -> sat.ite(condition, Sat.FALSE, term)));
    return create(arity, map);
  }

  // formulas

  /** Returns the condition that this contains at least one tuple. */
  public Sat.Term some() {
    return sat.or(cells.values());
  }

  /** Returns the condition that this contains no tuples. */
  public Sat.Term no() {
    return sat.not(some());
  }

  /**
   * Returns the condition that this contains at most one tuple.
   *
   * <p>Uses a chain of prefix disjunctions, so the circuit is linear in the
   * number of cells.
   */
  public Sat.Term lone() {
    final List<Sat.Term> conjuncts = new ArrayList<>();
    Sat.Term seen = Sat.FALSE;
    for (Sat.Term term : cells.values()) {
      conjuncts.add(sat.not(sat.and(seen, term)));
      seen = sat.or(seen, term);
    }
    return sat.and(conjuncts);
  }

  /** Returns the condition that this contains exactly one tuple. */
  public Sat.Term one() {
    return sat.and(some(), lone());
  }

  /** Returns the condition that every tuple of this is in another. */
  public Sat.Term in(BooleanMatrix that) {
    checkArgument(arity == that.arity);
    final List<Sat.Term> conjuncts = new ArrayList<>();
    cells.forEach((index, term) ->
        conjuncts.add(sat.implies(term, that.get(index))));
    return sat.and(conjuncts);
  }

  /** Returns the condition that this and another have the same tuples. */
  public Sat.Term eq(BooleanMatrix that) {
    return sat.and(in(that), that.in(this));
  }

  /**
   * Returns a counter of the tuples of this matrix, able to distinguish
   * counts up to {@code limit}.
   */
  public Counter count(int limit) {
    return Counter.of(sat, cells.values(), limit);
  }

  @Override
  public String toString() {
    return cells.toString();
  }
}

// End BooleanMatrix.java
