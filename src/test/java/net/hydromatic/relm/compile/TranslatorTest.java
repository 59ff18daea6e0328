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

import static net.hydromatic.relm.Als.text;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.relm.eval.Prop;
import net.hydromatic.relm.eval.Session;
import net.hydromatic.relm.instance.Bounds;
import net.hydromatic.relm.instance.Instance;
import net.hydromatic.relm.sat.Sat;
import net.hydromatic.relm.type.Fact;
import net.hydromatic.relm.type.Model;
import org.junit.jupiter.api.Test;

/** Tests {@link Translator}, via {@link Compiles#translate}. */
public class TranslatorTest {
  private static Problem translate(String text, String label,
      boolean exactScopes) {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.EXACT_SCOPES.set(map, exactScopes);
    final Session session = new Session(map);
    final Model model = session.resolve(text, "test.als");
    return Compiles.translate(session, model,
        Objects.requireNonNull(model.command(label)), Tracers.empty());
  }

  /** Returns the translation of the command's own formula. */
  private static Sat.Term commandTerm(Problem problem) {
    return Iterables.getLast(problem.constraints.values());
  }

  @Test void testFamily() {
    final List<Model> models = new ArrayList<>();
    final List<Scope> scopes = new ArrayList<>();
    final List<Bounds> boundsList = new ArrayList<>();
    final List<Problem> problems = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnTranslation(
            Tracers.withOnBounds(
                Tracers.withOnScope(
                    Tracers.withOnModel(Tracers.empty(), models::add),
                    scopes::add),
                boundsList::add),
            problems::add);
    final Session session = Session.create().withTracer(tracer);
    final Model model = session.resolve(text("family.als"), "family.als");
    final Problem problem =
        Compiles.translate(session, model,
            Objects.requireNonNull(model.command("Show")), tracer);
    assertThat(models, is(List.of(model)));
    assertThat(scopes.size(), is(1));
    assertThat(boundsList.size(), is(1));
    assertThat(problems.size(), is(1));
    assertThat(problems.get(0), is(problem));

    // Man and Woman have 2 floating atoms each, and spouse and parents 16
    // tuples each; the other signatures are fixed
    assertThat(problem.primaryVariables().size(), is(36));
    assertThat(problem.trivialFact, nullValue());
    // 4 facts, 10 implicit facts, and the command
    assertThat(problem.constraints.size(), is(15));
    assertThat(Iterables.getLast(problem.constraints.keySet()).name,
        is("Show"));
    assertThat(commandTerm(problem), is(Sat.TRUE));
  }

  /** A formula that is false under the bounds is detected before solving. */
  @Test void testTriviallyFalse() {
    final Problem problem =
        translate("sig A {} run {some A and no A} for 2", "run$1", true);
    final Fact fact = problem.trivialFact;
    assertThat(fact, notNullValue());
    assertThat(fact.name, is("run$1"));
    assertThat(problem.formula, is(Sat.FALSE));

    final Problem problem2 =
        translate("sig A {} fact F {no A} run {} for 2", "run$1", true);
    assertThat(problem2.trivialFact == null ? null : problem2.trivialFact.name,
        is("F"));
  }

  /** Cardinality comparisons of fixed relations fold to constants. */
  @Test void testConstantCardinality() {
    assertThat(
        commandTerm(translate("sig A {} run {#A = 2} for 2", "run$1", true)),
        is(Sat.TRUE));
    assertThat(
        commandTerm(translate("sig A {} run {#A > 2} for 2", "run$1", true)),
        is(Sat.FALSE));
    assertThat(
        commandTerm(translate("sig A {} run {#A > 2} for 2", "run$1", false))
            .isConstant(),
        is(true));
    assertThat(
        commandTerm(translate("sig A {} run {#A > 1} for 2", "run$1", false))
            .isConstant(),
        is(false));
  }

  /** Quantifiers over fixed atoms unroll into one term per atom. */
  @Test void testQuantifier() {
    final Problem problem =
        translate("sig A {r: set A} run {all a: A | a in a.r} for 2",
            "run$1", true);
    final Sat.Term term = commandTerm(problem);
    final List<Sat.Variable> variables = problem.primaryVariables();
    assertThat(variables.size(), is(4));
    final boolean[] env = new boolean[problem.sat.variableCount()];
    assertThat(term.evaluate(env), is(false));
    // r(A$0, A$0)
    env[variables.get(0).id] = true;
    assertThat(term.evaluate(env), is(false));
    // r(A$1, A$1)
    env[variables.get(3).id] = true;
    assertThat(term.evaluate(env), is(true));
    // r(A$0, A$1) does not matter
    env[variables.get(1).id] = true;
    assertThat(term.evaluate(env), is(true));
  }

  /** The instance read from an assignment holds the true cells. */
  @Test void testInstance() {
    final Problem problem =
        translate("sig A {r: set A} run {} for exactly 2 A", "run$1", true);
    final boolean[] values = new boolean[problem.sat.variableCount()];
    final List<Sat.Variable> variables = problem.primaryVariables();
    // r(A$0, A$1)
    values[variables.get(1).id] = true;
    final Instance instance = problem.instance(values);
    assertThat(instance.get("A").toString(), is("{A$0, A$1}"));
    assertThat(instance.get("r").toString(), is("{(A$0, A$1)}"));
    assertThat(instance.toString(), is("A = {A$0, A$1}\nr = {(A$0, A$1)}"));
  }
}

// End TranslatorTest.java
