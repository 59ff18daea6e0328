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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.relm.type.Relation;

/** Assignment of a tuple set to every relation; a model of a module. */
public class Instance {
  public final Universe universe;
  public final ImmutableMap<Relation, TupleSet> values;

  public Instance(Universe universe, Map<Relation, TupleSet> values) {
    this.universe = requireNonNull(universe);
    this.values = ImmutableMap.copyOf(values);
  }

  /** Returns the value of a relation. */
  public TupleSet get(Relation relation) {
    return requireNonNull(values.get(relation), relation.name);
  }

  /** Returns the value of the first relation with a given name. */
  public TupleSet get(String name) {
    for (Map.Entry<Relation, TupleSet> e : values.entrySet()) {
      if (e.getKey().name.equals(name)) {
        return e.getValue();
      }
    }
    throw new IllegalArgumentException("no relation " + name);
  }

  /**
   * Writes this instance, one relation per line; or, if {@code compact}, all
   * on one line, separated by semicolons.
   */
  public StringBuilder describeTo(StringBuilder b, boolean compact) {
    int i = 0;
    for (Map.Entry<Relation, TupleSet> e : values.entrySet()) {
      if (i++ > 0) {
        b.append(compact ? "; " : "\n");
      }
      b.append(e.getKey().name).append(" = ").append(e.getValue());
    }
    return b;
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Instance && values.equals(((Instance) o).values);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder(), false).toString();
  }
}

// End Instance.java
