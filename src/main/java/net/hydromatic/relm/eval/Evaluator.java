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
package net.hydromatic.relm.eval;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.compile.Environment;
import net.hydromatic.relm.compile.Translator;
import net.hydromatic.relm.instance.Instance;
import net.hydromatic.relm.instance.TupleSet;
import net.hydromatic.relm.sat.BooleanMatrix;
import net.hydromatic.relm.sat.Sat;
import net.hydromatic.relm.type.Fact;
import net.hydromatic.relm.type.Model;
import net.hydromatic.relm.type.Relation;

/**
 * Evaluates resolved formulas and expressions in an instance.
 *
 * <p>Runs the translator with each relation fixed to its value in the
 * instance, so every circuit folds to a constant.
 */
public class Evaluator {
  private final Instance instance;
  private final Translator translator;

  public Evaluator(Model model, Instance instance) {
    this.instance = requireNonNull(instance);
    final Sat sat = new Sat();
    final Map<Relation, BooleanMatrix> matrices = new LinkedHashMap<>();
    instance.values.forEach((relation, tupleSet) ->
        matrices.put(relation, BooleanMatrix.constant(sat, tupleSet)));
    this.translator = new Translator(sat, model, instance.universe, matrices);
  }

  /** Returns whether a formula is true in the instance. */
  public boolean holds(Ast.Exp formula) {
    final Sat.Term term = translator.formula(formula, Environment.empty());
    checkState(term.isConstant(), "not constant: %s", term);
    return term == Sat.TRUE;
  }

  /** Returns the value of a relational expression in the instance. */
  public TupleSet evaluate(Ast.Exp exp) {
    final BooleanMatrix matrix = translator.matrix(exp, Environment.empty());
    checkState(matrix.isConstant(), "not constant: %s", matrix);
    return TupleSet.of(instance.universe, matrix.arity,
        matrix.cells().keySet());
  }

  /** Returns the facts that are false in the instance. */
  public List<Fact> violated(Iterable<Fact> facts) {
    final ImmutableList.Builder<Fact> b = ImmutableList.builder();
    for (Fact fact : facts) {
      if (!holds(fact.formula)) {
        b.add(fact);
      }
    }
    return b.build();
  }
}

// End Evaluator.java
