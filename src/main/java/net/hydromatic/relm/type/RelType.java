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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;

/**
 * Type of a resolved expression.
 *
 * <p>A relation type is a set of products of signatures, all of the same
 * arity; for example the type of "{@code Man + Woman}" is
 * "{@code {Man, Woman}}", and the type of "{@code spouse}" is
 * "{@code {Person->Person}}". Formulas and integer expressions have kinds
 * {@link Kind#FORMULA} and {@link Kind#INT} and no products.
 */
public class RelType {
  public static final RelType FORMULA =
      new RelType(Kind.FORMULA, 0, ImmutableSet.of());
  public static final RelType INT = new RelType(Kind.INT, 0, ImmutableSet.of());

  public final Kind kind;
  public final int arity;
  public final ImmutableSet<ImmutableList<Sig>> products;

  private RelType(
      Kind kind, int arity, ImmutableSet<ImmutableList<Sig>> products) {
    this.kind = requireNonNull(kind);
    this.arity = arity;
    this.products = requireNonNull(products);
  }

  /** Creates a relation type from a set of products of the same arity. */
  public static RelType of(int arity, Iterable<ImmutableList<Sig>> products) {
    final ImmutableSet<ImmutableList<Sig>> set = ImmutableSet.copyOf(products);
    for (List<Sig> product : set) {
      checkArgument(product.size() == arity);
    }
    return new RelType(Kind.RELATION, arity, set);
  }

  /** Creates the unary type of a signature. */
  public static RelType of(Sig sig) {
    return of(1, ImmutableList.of(ImmutableList.of(sig)));
  }

  /** Creates a relation type of given arity whose columns are "univ". */
  public static RelType univ(int arity) {
    final ImmutableList.Builder<Sig> b = ImmutableList.builder();
    for (int i = 0; i < arity; i++) {
      b.add(Sig.UNIV);
    }
    return of(arity, ImmutableList.of(b.build()));
  }

  /** Creates the type of "none", which has no products. */
  public static RelType empty(int arity) {
    return of(arity, ImmutableList.of());
  }

  public boolean isRelation() {
    return kind == Kind.RELATION;
  }

  public boolean isFormula() {
    return kind == Kind.FORMULA;
  }

  /** Returns the type of "{@code this + that}"; arities must match. */
  public RelType union(RelType that) {
    checkArgument(arity == that.arity);
    final ImmutableSet.Builder<ImmutableList<Sig>> b = ImmutableSet.builder();
    b.addAll(products).addAll(that.products);
    return of(arity, b.build());
  }

  /**
   * Returns the type of "{@code this & that}": the pairs of products whose
   * columns overlap, each column narrowed to the more specific signature.
   */
  public RelType intersect(RelType that) {
    checkArgument(arity == that.arity);
    final ImmutableSet.Builder<ImmutableList<Sig>> b = ImmutableSet.builder();
    for (List<Sig> p : products) {
      for (List<Sig> q : that.products) {
        if (overlaps(p, q)) {
          final ImmutableList.Builder<Sig> b2 = ImmutableList.builder();
          for (int i = 0; i < arity; i++) {
            b2.add(p.get(i).meet(q.get(i)));
          }
          b.add(b2.build());
        }
      }
    }
    return of(arity, b.build());
  }

  /** Whether some product of this type overlaps some product of another. */
  public boolean overlaps(RelType that) {
    for (List<Sig> p : products) {
      for (List<Sig> q : that.products) {
        if (overlaps(p, q)) {
          return true;
        }
      }
    }
    return false;
  }

  private static boolean overlaps(List<Sig> p, List<Sig> q) {
    for (int i = 0; i < p.size(); i++) {
      if (!p.get(i).overlaps(q.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns the type of "{@code this -> that}". */
  public RelType product(RelType that) {
    final ImmutableSet.Builder<ImmutableList<Sig>> b = ImmutableSet.builder();
    for (List<Sig> p : products) {
      for (List<Sig> q : that.products) {
        b.add(ImmutableList.<Sig>builder().addAll(p).addAll(q).build());
      }
    }
    return of(arity + that.arity, b.build());
  }

  /**
   * Returns the type of "{@code this.that}". Products whose adjacent columns
   * cannot overlap contribute nothing; if no pair of products contributes,
   * the result has no products.
   */
  public RelType join(RelType that) {
    checkArgument(arity + that.arity > 2);
    final ImmutableSet.Builder<ImmutableList<Sig>> b = ImmutableSet.builder();
    for (List<Sig> p : products) {
      for (List<Sig> q : that.products) {
        if (p.get(p.size() - 1).overlaps(q.get(0))) {
          b.add(
              ImmutableList.<Sig>builder()
                  .addAll(p.subList(0, p.size() - 1))
                  .addAll(q.subList(1, q.size()))
                  .build());
        }
      }
    }
    return of(arity + that.arity - 2, b.build());
  }

  /** Returns the type of "{@code ~this}". */
  public RelType transpose() {
    checkArgument(arity == 2);
    final ImmutableSet.Builder<ImmutableList<Sig>> b = ImmutableSet.builder();
    for (ImmutableList<Sig> p : products) {
      b.add(p.reverse());
    }
    return of(arity, b.build());
  }

  /** Whether this type has no products; such an expression is always empty. */
  public boolean isEmpty() {
    return products.isEmpty();
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, arity, products);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof RelType
            && kind == ((RelType) o).kind
            && arity == ((RelType) o).arity
            && products.equals(((RelType) o).products);
  }

  @Override
  public String toString() {
    switch (kind) {
      case FORMULA:
        return "formula";
      case INT:
        return "int";
      default:
        final StringBuilder b = new StringBuilder("{");
        for (List<Sig> product : products) {
          if (b.length() > 1) {
            b.append(", ");
          }
          for (int i = 0; i < product.size(); i++) {
            if (i > 0) {
              b.append("->");
            }
            b.append(product.get(i).name);
          }
        }
        return b.append("}").toString();
    }
  }

  /** Kind of value an expression yields. */
  public enum Kind {
    RELATION,
    FORMULA,
    INT
  }
}

// End RelType.java
