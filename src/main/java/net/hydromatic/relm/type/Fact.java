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
 * Named, resolved formula that every instance must satisfy: a fact, an
 * assertion, or an implicit constraint derived from a declaration.
 */
public class Fact {
  public final String name;
  public final Pos pos;
  public final Ast.Exp formula;

  public Fact(String name, Pos pos, Ast.Exp formula) {
    this.name = requireNonNull(name);
    this.pos = requireNonNull(pos);
    this.formula = requireNonNull(formula);
  }

  @Override
  public String toString() {
    return name + ": " + formula;
  }
}

// End Fact.java
