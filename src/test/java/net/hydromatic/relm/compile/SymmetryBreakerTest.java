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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.relm.eval.Prop;
import net.hydromatic.relm.eval.Session;
import net.hydromatic.relm.sat.Sat;
import net.hydromatic.relm.type.Model;
import org.junit.jupiter.api.Test;

/** Tests {@link SymmetryBreaker}. */
public class SymmetryBreakerTest {
  /** Translates the first command of a module. */
  private static Problem problem(String text, boolean exactScopes,
      int symmetryBreaking) {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.EXACT_SCOPES.set(map, exactScopes);
    Prop.SYMMETRY_BREAKING.set(map, symmetryBreaking);
    final Session session = new Session(map);
    final Model model = session.resolve(text, "test.als");
    return Compiles.translate(session, model, model.commands.get(0),
        Tracers.empty());
  }

  /**
   * Counts the assignments to the primary variables that satisfy both the
   * problem's formula and its symmetry-breaking predicate.
   */
  private static int count(Problem problem) {
    final List<Sat.Variable> variables = problem.primaryVariables();
    final boolean[] env = new boolean[problem.sat.variableCount()];
    int count = 0;
    for (int bits = 0; bits < 1 << variables.size(); bits++) {
      for (int i = 0; i < variables.size(); i++) {
        env[variables.get(i).id] = (bits & (1 << i)) != 0;
      }
      if (problem.formula.evaluate(env)
          && problem.symmetry.evaluate(env)) {
        ++count;
      }
    }
    return count;
  }

  /** For a set of 3 interchangeable atoms, keeps one subset per size. */
  @Test void testUnary() {
    final String text = "sig A {} run {} for 3";
    final Problem problem = problem(text, false, 20);
    assertThat(problem.primaryVariables().size(), is(3));
    assertThat(count(problem), is(4));
    assertThat(count(problem(text, false, 0)), is(8));
  }

  /**
   * For a relation over 2 interchangeable atoms, keeps one of each of the 10
   * isomorphism classes of the 16 relations.
   */
  @Test void testBinary() {
    final String text = "sig A {r: set A} run {} for exactly 2 A";
    final Problem problem = problem(text, true, 20);
    assertThat(problem.primaryVariables().size(), is(4));
    assertThat(count(problem), is(10));
    assertThat(count(problem(text, true, 0)), is(16));
  }

  /** Comparing fewer variables removes fewer instances. */
  @Test void testLimit() {
    final String text = "sig A {r: set A} run {} for exactly 2 A";
    // only "r(0, 0) =< r(1, 1)"
    assertThat(count(problem(text, true, 1)), is(12));
  }

  /** Atoms of different signatures are not interchangeable. */
  @Test void testDistinctTags() {
    final Problem problem =
        problem("sig A {} sig B {} run {} for 1", false, 20);
    assertThat(problem.symmetry, is(Sat.TRUE));
    assertThat(count(problem), is(4));
  }
}

// End SymmetryBreakerTest.java
