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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.relm.instance.Bounds;
import net.hydromatic.relm.instance.Instance;
import net.hydromatic.relm.instance.TupleSet;
import net.hydromatic.relm.sat.BooleanMatrix;
import net.hydromatic.relm.sat.Sat;
import net.hydromatic.relm.type.Command;
import net.hydromatic.relm.type.Fact;
import net.hydromatic.relm.type.Model;
import net.hydromatic.relm.type.Relation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Boolean encoding of a command: the circuit whose satisfying assignments
 * are the instances of the command's formula, the model's facts and the
 * implicit constraints of its declarations, within bounds.
 */
public class Problem {
  public final Model model;
  public final Command command;
  public final Scope scope;
  public final Bounds bounds;
  public final Sat sat;
  /** Matrix of each relation; cells are {@link Sat#TRUE} or variables. */
  public final ImmutableMap<Relation, BooleanMatrix> relations;
  /** Translation of each constraint, in the order they were translated. */
  public final ImmutableMap<Fact, Sat.Term> constraints;
  /** Conjunction of all constraints. */
  public final Sat.Term formula;
  /** Symmetry-breaking predicate; may be {@link Sat#TRUE}. */
  public final Sat.Term symmetry;
  /** A constraint that is false under the bounds, or null if there is none. */
  public final @Nullable Fact trivialFact;

  Problem(Model model, Command command, Scope scope, Bounds bounds, Sat sat,
      ImmutableMap<Relation, BooleanMatrix> relations,
      ImmutableMap<Fact, Sat.Term> constraints, Sat.Term symmetry) {
    this.model = requireNonNull(model);
    this.command = requireNonNull(command);
    this.scope = requireNonNull(scope);
    this.bounds = requireNonNull(bounds);
    this.sat = requireNonNull(sat);
    this.relations = requireNonNull(relations);
    this.constraints = requireNonNull(constraints);
    this.formula = sat.and(constraints.values());
    this.symmetry = requireNonNull(symmetry);
    Fact trivialFact = null;
    for (Map.Entry<Fact, Sat.Term> entry : constraints.entrySet()) {
      if (entry.getValue() == Sat.FALSE) {
        trivialFact = entry.getKey();
        break;
      }
    }
    this.trivialFact = trivialFact;
  }

  /**
   * Returns the variables of the relations' matrices, in relation order and
   * then tuple order.
   */
  public ImmutableList<Sat.Variable> primaryVariables() {
    final ImmutableList.Builder<Sat.Variable> b = ImmutableList.builder();
    relations.values().forEach(matrix ->
        matrix.cells().values().forEach(term -> {
          if (term instanceof Sat.Variable) {
            b.add((Sat.Variable) term);
          }
        }));
    return b.build();
  }

  /**
   * Creates an instance from an assignment of values to variables.
   *
   * @param values Value of each variable, indexed by {@link Sat.Variable#id}
   */
  public Instance instance(boolean[] values) {
    final Map<Relation, TupleSet> map = new LinkedHashMap<>();
    relations.forEach((relation, matrix) -> {
      final ImmutableList.Builder<Integer> indexes = ImmutableList.builder();
      matrix.cells().forEach((index, term) -> {
        if (term.evaluate(values)) {
          indexes.add(index);
        }
      });
      map.put(relation,
          TupleSet.of(bounds.universe, relation.arity(), indexes.build()));
    });
    return new Instance(bounds.universe, map);
  }

  @Override
  public String toString() {
    return "Problem{command=" + command.label
        + ", atoms=" + bounds.universe.size()
        + ", variables=" + sat.variableCount()
        + ", primaryVariables=" + primaryVariables().size()
        + "}";
  }
}

// End Problem.java
