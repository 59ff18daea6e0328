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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Predicate or function.
 *
 * <p>The signature (parameters and return type) is resolved before any body,
 * so that bodies may call functions declared later; the body is assigned once
 * it has been resolved.
 */
public class Function {
  public final String name;
  public final Pos pos;
  public final boolean isPredicate;
  /** Resolved parameter declarations. */
  public final ImmutableList<Ast.VarDecl> params;
  /** Type of the result; {@link RelType#FORMULA} for a predicate. */
  public final RelType returnType;

  private Ast.@Nullable Exp body;

  public Function(
      String name,
      Pos pos,
      boolean isPredicate,
      ImmutableList<Ast.VarDecl> params,
      RelType returnType) {
    this.name = requireNonNull(name);
    this.pos = requireNonNull(pos);
    this.isPredicate = isPredicate;
    this.params = requireNonNull(params);
    this.returnType = requireNonNull(returnType);
  }

  /** Returns the names of the parameters, in order. */
  public ImmutableList<String> paramNames() {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    for (Ast.VarDecl decl : params) {
      for (Ast.Id id : decl.names) {
        b.add(id.name);
      }
    }
    return b.build();
  }

  /** Returns the resolved body. */
  public Ast.Exp body() {
    checkState(body != null, "body of %s is not resolved", name);
    return body;
  }

  /** Sets the resolved body; may be called only once. */
  public void setBody(Ast.Exp body) {
    checkState(this.body == null, "body of %s is already set", name);
    this.body = requireNonNull(body);
  }

  @Override
  public String toString() {
    return (isPredicate ? "pred " : "fun ") + name;
  }
}

// End Function.java
