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
package net.hydromatic.relm.compile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.ast.Pos;
import net.hydromatic.relm.eval.Prop;
import net.hydromatic.relm.eval.Session;
import net.hydromatic.relm.instance.Bounds;
import net.hydromatic.relm.parse.Parsers;
import net.hydromatic.relm.sat.BooleanMatrix;
import net.hydromatic.relm.sat.Sat;
import net.hydromatic.relm.type.Command;
import net.hydromatic.relm.type.Fact;
import net.hydromatic.relm.type.Model;
import net.hydromatic.relm.type.Relation;

/** Helpers for compilation. */
public abstract class Compiles {
  private Compiles() {}

  /** Parses and resolves the text of a module. */
  public static Model resolve(String text, String file, Tracer tracer) {
    final Ast.Module module = Parsers.parse(text, file);
    final Model model = Resolver.resolve(module);
    tracer.onModel(model);
    return model;
  }

  /**
   * Translates a command to a boolean problem.
   *
   * <p>Computes the scope and bounds, then translates the model's facts, the
   * implicit constraints of its declarations and the command's formula, and
   * adds a symmetry-breaking predicate. Properties
   * {@link Prop#DEFAULT_SCOPE}, {@link Prop#EXACT_SCOPES} and
   * {@link Prop#SYMMETRY_BREAKING} of the session apply.
   */
  public static Problem translate(Session session, Model model,
      Command command, Tracer tracer) {
    final Scope scope =
        ScopeResolver.resolve(model, command,
            Prop.DEFAULT_SCOPE.intValue(session.map),
            Prop.EXACT_SCOPES.booleanValue(session.map));
    tracer.onScope(scope);

    final Bounds bounds = BoundCompiler.bounds(model, scope);
    tracer.onBounds(bounds);

    final Sat sat = new Sat();
    final ImmutableMap<Relation, BooleanMatrix> relations =
        BoundCompiler.primaryMatrices(sat, model, bounds);
    final Translator translator =
        new Translator(sat, model, bounds.universe, relations);

    final List<Fact> facts = new ArrayList<>(model.facts);
    facts.addAll(BoundCompiler.implicitFacts(model, scope, bounds));
    facts.add(new Fact(command.label, command.pos, command.formula));
    final ImmutableMap.Builder<Fact, Sat.Term> constraints =
        ImmutableMap.builder();
    for (Fact fact : facts) {
      constraints.put(fact,
          translator.formula(fact.formula, Environment.empty()));
    }

    final Sat.Term symmetry =
        SymmetryBreaker.breakSymmetries(sat, bounds.universe, relations,
            Prop.SYMMETRY_BREAKING.intValue(session.map));
    final Problem problem =
        new Problem(model, command, scope, bounds, sat, relations,
            constraints.build(), symmetry);
    tracer.onTranslation(problem);
    return problem;
  }

  /**
   * Returns the commands to execute: all of the model's commands, or, if
   * property {@link Prop#COMMAND} is set, the one with that label.
   */
  public static List<Command> commands(Session session, Model model) {
    final String label = Prop.COMMAND.stringValue(session.map);
    if (label == null) {
      return model.commands;
    }
    final Command command = model.command(label);
    if (command == null) {
      throw new ScopeException("no command '" + label + "'",
          Pos.ZERO);
    }
    return ImmutableList.of(command);
  }
}

// End Compiles.java
