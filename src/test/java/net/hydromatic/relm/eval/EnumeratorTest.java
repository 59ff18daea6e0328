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

import static net.hydromatic.relm.Als.als;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.relm.Als;
import net.hydromatic.relm.compile.Tracer;
import net.hydromatic.relm.compile.Tracers;
import net.hydromatic.relm.instance.Instance;
import net.hydromatic.relm.sat.SatSolver;
import net.hydromatic.relm.type.Model;
import org.junit.jupiter.api.Test;

/** Tests {@link Enumerator} and the solutions it returns. */
public class EnumeratorTest {
  /** Three interchangeable atoms; 8 assignments, 4 up to isomorphism. */
  private static final String SUBSETS = "sig A {} run {} for 3";

  /** Twelve pigeons, eleven holes; hard to refute without symmetry. */
  private static final String PIGEONHOLE = "sig Pigeon {hole: one Hole}\n"
      + "sig Hole {}\n"
      + "fact {all disj p, q: Pigeon | p.hole != q.hole}\n"
      + "run {} for exactly 12 Pigeon, exactly 11 Hole\n";

  private static Als subsets() {
    return als(SUBSETS)
        .withProp(Prop.EXACT_SCOPES, false)
        .withProp(Prop.SOLUTION_LIMIT, 100);
  }

  private static int satisfiable(List<Solution> solutions) {
    int n = 0;
    for (Solution solution : solutions) {
      if (solution.isSatisfiable()) {
        ++n;
      }
    }
    return n;
  }

  @Test void testEnumerate() {
    subsets().assertSolutions("run$1", solutions -> {
      assertThat(solutions, hasSize(5));
      assertThat(satisfiable(solutions), is(4));
      final Solution last = solutions.get(4);
      assertThat(last.outcome, is(Solution.Outcome.UNSATISFIABLE));
      assertThat(last.ordinal, is(4));
      assertThat(last.toString(), is("No more instances"));

      // one instance of each size
      final Set<Integer> sizes = new HashSet<>();
      for (int i = 0; i < 4; i++) {
        assertThat(solutions.get(i).ordinal, is(i));
        sizes.add(solutions.get(i).instance().get("A").size());
      }
      assertThat(sizes, is(Set.of(0, 1, 2, 3)));
    });
  }

  /** Without symmetry breaking, canonical forms still remove duplicates. */
  @Test void testCanonicalize() {
    final List<SatSolver.Result> results = new ArrayList<>();
    final List<Instance> instances = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnInstance(
            Tracers.withOnSolve(Tracers.empty(), results::add),
            instances::add);
    subsets()
        .withProp(Prop.SYMMETRY_BREAKING, 0)
        .withTracer(tracer)
        .assertSolutions("run$1", solutions ->
            assertThat(satisfiable(solutions), is(4)));
    // every assignment is found, but only 4 are returned
    assertThat(results, hasSize(9));
    assertThat(instances, hasSize(4));
  }

  @Test void testNoDeduplication() {
    subsets()
        .withProp(Prop.SYMMETRY_BREAKING, 0)
        .withProp(Prop.CANONICAL_CHECK_LIMIT, 0)
        .assertSolutions("run$1", solutions ->
            assertThat(satisfiable(solutions), is(8)));
  }

  @Test void testSolutionLimit() {
    subsets()
        .withProp(Prop.SOLUTION_LIMIT, 2)
        .assertSolutions("run$1", solutions -> {
          assertThat(solutions, hasSize(2));
          assertThat(satisfiable(solutions), is(2));
        });
    subsets()
        .withProp(Prop.SOLUTION_LIMIT, 0)
        .assertSolutions("run$1", solutions ->
            assertThat(solutions, empty()));
  }

  /** The same seed gives the same sequence of instances. */
  @Test void testDeterministic() {
    final Als als =
        als("sig A {r: set A} run {some r} for 3")
            .withProp(Prop.SOLUTION_LIMIT, 5);
    final List<String> first = descriptions(als.solve("run$1"));
    assertThat(descriptions(als.solve("run$1")), is(first));
    assertThat(first, hasSize(5));
  }

  private static List<String> descriptions(List<Solution> solutions) {
    final List<String> list = new ArrayList<>();
    for (Solution solution : solutions) {
      list.add(solution.toString());
    }
    return list;
  }

  @Test void testDescribe() {
    als("sig A {} assert X {some A} check X for 3")
        .withProp(Prop.EXACT_SCOPES, false)
        .withProp(Prop.SOLUTION_LIMIT, 5)
        .assertSolutions("X", solutions -> {
          assertThat(solutions, hasSize(2));
          assertThat(solutions.get(0).toString(),
              is("Counterexample 1: A = {}"));
          assertThat(solutions.get(0).describeTo(new StringBuilder(), false)
                  .toString(),
              is("Counterexample 1:\nA = {}"));
          assertThat(solutions.get(1).toString(),
              is("No more counterexamples"));
        });
    als("sig A {} run {some A} for exactly 1 A")
        .assertSolutions("run$1", solutions ->
            assertThat(solutions.get(0).toString(),
                is("Instance 1: A = {A$0}")));
    als("sig A {} run {some none} for 2")
        .withProp(Prop.EXACT_SCOPES, false)
        .assertSolutions("run$1", solutions ->
            assertThat(solutions.get(0).toString(),
                is("No instance found (run$1 is false within the scope)")));
  }

  @Test void testTrivial() {
    als("sig A {} fact F {no A} run {} for 2")
        .assertSolutions("run$1", solutions -> {
          assertThat(solutions, hasSize(1));
          final Solution solution = solutions.get(0);
          assertThat(solution.outcome,
              is(Solution.Outcome.TRIVIALLY_UNSATISFIABLE));
          assertThat(solution.trivialFact.name, is("F"));
          assertThat(solution.toString(),
              is("No instance found (F is false within the scope)"));
        });
  }

  /** A search that runs out of time is not reported as unsatisfiable. */
  @Test void testTimeout() {
    als(PIGEONHOLE)
        .withProp(Prop.SYMMETRY_BREAKING, 0)
        .withProp(Prop.TIMEOUT_MILLIS, 50L)
        .assertSolutions("run$1", solutions -> {
          final Solution solution = solutions.get(0);
          assertThat(solution.outcome, is(Solution.Outcome.TIMEOUT));
          assertThat(solution.isSatisfiable(), is(false));
          assertThat(solution.instance == null, is(true));
          assertThat(solution.toString(), startsWith("Timeout after "));
        });
  }

  @Test void testExpect() {
    final List<String> warnings = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnWarnings(Tracers.empty(), warnings::addAll);
    final String text = "sig A {}\n"
        + "run {some A} for 2 expect 0\n"
        + "run {some A} for 2 expect 1\n"
        + "run {no A} for 2 expect 1\n"
        + "assert X {some A} check X for 2 expect 1\n";
    final Als als = als(text).withTracer(tracer);
    final Model model = als.model();
    for (String label : List.of("run$1", "run$2", "run$3", "X")) {
      als.solve(label);
    }
    assertThat(model.commands, hasSize(4));
    assertThat(warnings,
        is(List.of("command run$1 expected no instance, but found one",
            "command run$3 expected an instance, but found none",
            "command X expected a counterexample, but found none")));
  }
}

// End EnumeratorTest.java
