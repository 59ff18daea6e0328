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

import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.ast.Pos;

/**
 * Field of a signature.
 *
 * <p>A field "{@code f: m E}" declared in signature {@code S} is a relation
 * of arity {@code 1 + arity(E)} whose tuples all start with an atom of
 * {@code S}. The declared type {@link #exp} is resolved, and may refer to
 * the variable "{@code this}" and to earlier fields.
 */
public class Field extends Relation {
  public final Sig owner;
  public final boolean disj;
  public final Ast.Mult mult;
  public final Ast.Exp exp;
  public final RelType type;

  public Field(
      String name,
      Pos pos,
      int ordinal,
      Sig owner,
      boolean disj,
      Ast.Mult mult,
      Ast.Exp exp,
      RelType type) {
    super(name, pos, ordinal);
    this.owner = requireNonNull(owner);
    this.disj = disj;
    this.mult = requireNonNull(mult);
    this.exp = requireNonNull(exp);
    this.type = requireNonNull(type);
  }

  @Override
  public int arity() {
    return type.arity;
  }
}

// End Field.java
