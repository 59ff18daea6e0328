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
 * Resolved "run" or "check" command.
 *
 * <p>{@link #formula} is what an instance must satisfy in addition to the
 * facts: for "run", the body of the predicate (its parameters existentially
 * quantified); for "check", the negation of the assertion, so that an
 * instance is a counterexample.
 */
public class Command {
  public final String label;
  public final Pos pos;
  public final boolean isCheck;
  public final Ast.Exp formula;
  public final @Nullable Integer overall;
  public final ImmutableList<SigScope> scopes;
  public final @Nullable Integer expect;

  public Command(
      String label,
      Pos pos,
      boolean isCheck,
      Ast.Exp formula,
      @Nullable Integer overall,
      ImmutableList<SigScope> scopes,
      @Nullable Integer expect) {
    this.label = requireNonNull(label);
    this.pos = requireNonNull(pos);
    this.isCheck = isCheck;
    this.formula = requireNonNull(formula);
    this.overall = overall;
    this.scopes = requireNonNull(scopes);
    this.expect = expect;
  }

  /** Returns the explicit scope of a signature, or null. */
  public @Nullable SigScope scope(Sig sig) {
    for (SigScope scope : scopes) {
      if (scope.sig == sig) {
        return scope;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    final StringBuilder b =
        new StringBuilder(isCheck ? "check " : "run ").append(label);
    if (overall != null || !scopes.isEmpty()) {
      b.append(" for ");
      if (overall != null) {
        b.append(overall);
        if (!scopes.isEmpty()) {
          b.append(" but ");
        }
      }
      for (int i = 0; i < scopes.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        b.append(scopes.get(i));
      }
    }
    return b.toString();
  }

  /** Scope given to one signature by a command, e.g. "exactly 2 Man". */
  public static class SigScope {
    public final Sig sig;
    public final int count;
    public final boolean exactly;
    public final Pos pos;

    public SigScope(Sig sig, int count, boolean exactly, Pos pos) {
      this.sig = requireNonNull(sig);
      this.count = count;
      this.exactly = exactly;
      this.pos = requireNonNull(pos);
    }

    @Override
    public String toString() {
      return (exactly ? "exactly " : "") + count + " " + sig.name;
    }
  }
}

// End Command.java
