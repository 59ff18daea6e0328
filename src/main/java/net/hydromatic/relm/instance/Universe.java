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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.Multimap;
import com.google.common.math.LongMath;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import net.hydromatic.relm.type.Sig;

/**
 * Finite, ordered set of atoms.
 *
 * <p>A tuple of arity {@code k} is encoded as the integer
 * {@code a[0] * n^(k-1) + ... + a[k-1]}, where {@code n} is the size of the
 * universe; this is the order in which tuples and their variables are
 * listed.
 */
public class Universe {
  public final ImmutableList<Atom> atoms;

  private Universe(ImmutableList<Atom> atoms) {
    this.atoms = atoms;
  }

  /** Returns a builder. */
  public static Builder builder() {
    return new Builder();
  }

  public int size() {
    return atoms.size();
  }

  public Atom atom(int i) {
    return atoms.get(i);
  }

  /** Looks up an atom by name, or throws. */
  public Atom atom(String name) {
    for (Atom atom : atoms) {
      if (atom.name.equals(name)) {
        return atom;
      }
    }
    throw new IllegalArgumentException("no atom " + name);
  }

  /**
   * Returns the classes of interchangeable atoms: for each tag, the atoms
   * with that tag, in universe order.
   */
  public Collection<Collection<Atom>> classes() {
    final Multimap<Sig, Atom> map = LinkedHashMultimap.create();
    for (Atom atom : atoms) {
      map.put(atom.tag, atom);
    }
    return map.asMap().values();
  }

  /** Returns the number of tuples of a given arity, n<sup>arity</sup>. */
  public int capacity(int arity) {
    return capacity(atoms.size(), arity);
  }

  /** Returns whether tuples of a given arity can be encoded as an
   * {@code int}. */
  public boolean fits(int arity) {
    return LongMath.saturatedPow(atoms.size(), arity) <= Integer.MAX_VALUE;
  }

  /**
   * Returns the number of tuples of a given arity over {@code size} atoms.
   *
   * @throws IllegalArgumentException if the number does not fit in an
   * {@code int}
   */
  public static int capacity(int size, int arity) {
    final long c = LongMath.saturatedPow(size, arity);
    checkArgument(c <= Integer.MAX_VALUE,
        "universe of %s atoms too large for arity %s", size, arity);
    return (int) c;
  }

  /** Encodes a tuple of atom indexes. */
  public int encode(int... columns) {
    int index = 0;
    for (int column : columns) {
      index = index * atoms.size() + column;
    }
    return index;
  }

  /** Decodes a tuple index into atom indexes. */
  public int[] decode(int index, int arity) {
    final int[] columns = new int[arity];
    for (int i = arity - 1; i >= 0; i--) {
      columns[i] = index % atoms.size();
      index /= atoms.size();
    }
    return columns;
  }

  @Override
  public String toString() {
    return atoms.toString();
  }

  /** Builder for a {@link Universe}; assigns names and indexes to atoms. */
  public static class Builder {
    private final List<Atom> atoms = new ArrayList<>();

    /** Adds {@code count} atoms tagged with a signature. */
    public List<Atom> add(Sig tag, int count) {
      int existing = 0;
      for (Atom atom : atoms) {
        if (atom.tag == tag) {
          ++existing;
        }
      }
      final List<Atom> added = new ArrayList<>();
      for (int i = 0; i < count; i++) {
        final Atom atom =
            new Atom(tag.name + "$" + (existing + i), atoms.size(), tag);
        atoms.add(atom);
        added.add(atom);
      }
      return added;
    }

    public Universe build() {
      return new Universe(ImmutableList.copyOf(atoms));
    }
  }
}

// End Universe.java
