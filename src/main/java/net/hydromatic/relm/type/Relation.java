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

import net.hydromatic.relm.ast.Pos;

/**
 * Relation whose value an instance assigns: a signature (arity 1) or a field
 * (arity 2 or more).
 *
 * <p>Relations are compared by identity; each is created once, when a module
 * is resolved. The ordinal is the position in declaration order, and is the
 * order in which the bound compiler allocates variables.
 */
public abstract class Relation {
  public final String name;
  public final Pos pos;
  public final int ordinal;

  protected Relation(String name, Pos pos, int ordinal) {
    this.name = requireNonNull(name);
    this.pos = requireNonNull(pos);
    this.ordinal = ordinal;
  }

  /** Returns the number of columns. */
  public abstract int arity();

  @Override
  public String toString() {
    return name;
  }
}

// End Relation.java
