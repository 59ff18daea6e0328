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
package net.hydromatic.relm.type;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Signature: a named set of atoms.
 *
 * <p>A signature either extends at most one parent, or is a subset
 * ("{@code in}") of one or more supersets. Children of the same parent are
 * disjoint, and top-level signatures are disjoint from each other.
 */
public class Sig extends Relation {
  /** Pseudo-signature of all atoms; the column type of "univ" and "iden". */
  public static final Sig UNIV =
      new Sig("univ", Pos.ZERO, -1, false, null, null, ImmutableList.of());

  public final boolean isAbstract;
  public final Ast.@Nullable Mult mult;
  public final @Nullable Sig parent;
  public final ImmutableList<Sig> supersets;

  public Sig(
      String name,
      Pos pos,
      int ordinal,
      boolean isAbstract,
      Ast.@Nullable Mult mult,
      @Nullable Sig parent,
      ImmutableList<Sig> supersets) {
    super(name, pos, ordinal);
    this.isAbstract = isAbstract;
    this.mult = mult;
    this.parent = parent;
    this.supersets = requireNonNull(supersets);
  }

  @Override
  public int arity() {
    return 1;
  }

  /** Whether this is a subset signature, declared with "{@code in}". */
  public boolean isSubset() {
    return !supersets.isEmpty();
  }

  /** Whether this signature has neither a parent nor supersets. */
  public boolean isTopLevel() {
    return this != UNIV && parent == null && supersets.isEmpty();
  }

  /** Whether this signature is {@code sig} or one of its ancestors. */
  public boolean isSameOrAncestorOf(Sig sig) {
    for (Sig s = sig; s != null; s = s.parent) {
      if (s == this) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns whether this signature and another may share atoms in some
   * instance. Signatures in different hierarchies, or in different branches
   * of the same hierarchy, cannot.
   */
  public boolean overlaps(Sig sig) {
    if (this == UNIV || sig == UNIV) {
      return true;
    }
    if (isSubset()) {
      for (Sig superset : supersets) {
        if (superset.overlaps(sig)) {
          return true;
        }
      }
      return false;
    }
    if (sig.isSubset()) {
      return sig.overlaps(this);
    }
    return isSameOrAncestorOf(sig) || sig.isSameOrAncestorOf(this);
  }

  /**
   * Returns the more specific of two overlapping signatures, or this
   * signature if neither contains the other.
   */
  public Sig meet(Sig sig) {
    if (this == UNIV) {
      return sig;
    }
    if (sig == UNIV || sig.isSameOrAncestorOf(this)) {
      return this;
    }
    if (isSameOrAncestorOf(sig)) {
      return sig;
    }
    return this;
  }
}

// End Sig.java
