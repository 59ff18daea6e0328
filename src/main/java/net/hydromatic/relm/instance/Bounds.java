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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.relm.type.Relation;

/**
 * Lower and upper bound of every relation.
 *
 * <p>In every instance, each relation contains all tuples of its lower bound
 * and no tuple outside its upper bound.
 */
public class Bounds {
  public final Universe universe;
  private final ImmutableMap<Relation, TupleSet> lowers;
  private final ImmutableMap<Relation, TupleSet> uppers;

  public Bounds(
      Universe universe,
      Map<Relation, TupleSet> lowers,
      Map<Relation, TupleSet> uppers) {
    this.universe = requireNonNull(universe);
    this.lowers = ImmutableMap.copyOf(lowers);
    this.uppers = ImmutableMap.copyOf(uppers);
    checkArgument(this.lowers.keySet().equals(this.uppers.keySet()));
    for (Map.Entry<Relation, TupleSet> e : this.lowers.entrySet()) {
      checkArgument(
          e.getValue().isSubsetOf(this.uppers.get(e.getKey())),
          "lower bound of %s is not within its upper bound", e.getKey());
    }
  }

  public Iterable<Relation> relations() {
    return uppers.keySet();
  }

  public TupleSet lower(Relation relation) {
    return requireNonNull(lowers.get(relation), relation.name);
  }

  public TupleSet upper(Relation relation) {
    return requireNonNull(uppers.get(relation), relation.name);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (Relation relation : uppers.keySet()) {
      b.append(relation.name)
          .append(": [")
          .append(lower(relation))
          .append(", ")
          .append(upper(relation))
          .append("]\n");
    }
    return b.toString();
  }
}

// End Bounds.java
