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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import net.hydromatic.relm.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Resolved module: signatures, fields, facts, functions and commands. */
public class Model {
  public final ImmutableList<Sig> sigs;
  public final ImmutableList<Field> fields;
  public final ImmutableList<Fact> facts;
  /** Appended facts, keyed by signature, with "{@code this}" free. */
  public final ImmutableMap<Sig, Ast.Exp> appendedFacts;
  public final ImmutableMap<String, Function> functions;
  public final ImmutableMap<String, Fact> assertions;
  public final ImmutableList<Command> commands;

  private final ImmutableListMultimap<Sig, Sig> children;
  private final ImmutableListMultimap<Sig, Field> fieldsBySig;

  public Model(
      List<Sig> sigs,
      List<Field> fields,
      List<Fact> facts,
      ImmutableMap<Sig, Ast.Exp> appendedFacts,
      ImmutableMap<String, Function> functions,
      ImmutableMap<String, Fact> assertions,
      List<Command> commands) {
    this.sigs = byOrdinal(sigs);
    this.fields = byOrdinal(fields);
    this.facts = ImmutableList.copyOf(facts);
    this.appendedFacts = requireNonNull(appendedFacts);
    this.functions = requireNonNull(functions);
    this.assertions = requireNonNull(assertions);
    this.commands = ImmutableList.copyOf(commands);

    final ImmutableListMultimap.Builder<Sig, Sig> childBuilder =
        ImmutableListMultimap.builder();
    for (Sig sig : this.sigs) {
      if (sig.parent != null) {
        childBuilder.put(sig.parent, sig);
      }
    }
    this.children = childBuilder.build();
    final ImmutableListMultimap.Builder<Sig, Field> fieldBuilder =
        ImmutableListMultimap.builder();
    for (Field field : this.fields) {
      fieldBuilder.put(field.owner, field);
    }
    this.fieldsBySig = fieldBuilder.build();
  }

  private static <R extends Relation> ImmutableList<R> byOrdinal(
      List<R> relations) {
    return ImmutableList.sortedCopyOf(
        Comparator.<R>comparingInt(r -> r.ordinal), relations);
  }

  /** Returns the signatures that extend a given signature. */
  public ImmutableList<Sig> children(Sig sig) {
    return children.get(sig);
  }

  /** Returns the fields declared in a given signature. */
  public ImmutableList<Field> fields(Sig sig) {
    return fieldsBySig.get(sig);
  }

  /** Returns the top-level signatures, in declaration order. */
  public List<Sig> topLevelSigs() {
    final List<Sig> list = new ArrayList<>();
    for (Sig sig : sigs) {
      if (sig.isTopLevel()) {
        list.add(sig);
      }
    }
    return list;
  }

  /** Returns all signatures and fields, in declaration order. */
  public ImmutableList<Relation> relations() {
    final List<Relation> list = new ArrayList<>();
    list.addAll(sigs);
    list.addAll(fields);
    return byOrdinal(list);
  }

  /** Looks up a signature by name. */
  public @Nullable Sig sig(String name) {
    for (Sig sig : sigs) {
      if (sig.name.equals(name)) {
        return sig;
      }
    }
    return null;
  }

  /** Looks up a field by name; if there are several, returns the first. */
  public @Nullable Field field(String name) {
    for (Field field : fields) {
      if (field.name.equals(name)) {
        return field;
      }
    }
    return null;
  }

  /** Looks up a command by label. */
  public @Nullable Command command(String label) {
    for (Command command : commands) {
      if (command.label.equals(label)) {
        return command;
      }
    }
    return null;
  }
}

// End Model.java
