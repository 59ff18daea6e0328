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
package net.hydromatic.relm.sat;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.relm.sat.Sat.Term;
import net.hydromatic.relm.sat.Sat.Variable;
import org.junit.jupiter.api.Test;

/** Tests satisfiability of boolean circuits. */
public class SatTest {
  /** Tests a formula with three clauses. It has exactly one solution. */
  @Test void testBuild() {
    final Sat sat = new Sat();
    final Variable x = sat.variable("x");
    final Variable y = sat.variable("y");

    // (x ∨ y) ∧ (¬x ∨ ¬y) ∧ (¬x ∨ y)
    final Term clause0 = sat.or(x, y);
    final Term clause1 = sat.or(sat.not(x), sat.not(y));
    final Term clause2 = sat.or(sat.not(x), y);
    final Term formula = sat.and(clause0, clause1, clause2);

    final Map<Variable, Boolean> solution = sat.solve(formula);
    assertThat(solution, notNullValue());
    assertThat(solution, is(ImmutableMap.of(x, false, y, true)));
  }

  /** Tests true ("and" with zero arguments). */
  @Test void testTrue() {
    final Sat sat = new Sat();
    final Term trueTerm = sat.and();
    assertThat(trueTerm, hasToString("true"));
    assertThat(trueTerm, sameInstance(Sat.TRUE));

    final Map<Variable, Boolean> solve = sat.solve(trueTerm);
    assertThat("satisfiable", solve, notNullValue());
    assertThat(solve.isEmpty(), is(true));
  }

  /** Tests false ("or" with zero arguments). */
  @Test void testFalse() {
    final Sat sat = new Sat();
    final Term falseTerm = sat.or();
    assertThat(falseTerm, hasToString("false"));

    final Map<Variable, Boolean> solve = sat.solve(falseTerm);
    assertThat("not satisfiable", solve, nullValue());
  }

  /**
   * Tests that the factory methods fold constants and complements, and
   * share structurally equal terms.
   */
  @Test void testSimplify() {
    final Sat sat = new Sat();
    final Variable x = sat.variable("x");
    final Variable y = sat.variable("y");
    assertThat(sat.and(x, Sat.TRUE), sameInstance(x));
    assertThat(sat.and(x, Sat.FALSE), sameInstance(Sat.FALSE));
    assertThat(sat.or(x, Sat.TRUE), sameInstance(Sat.TRUE));
    assertThat(sat.and(x, sat.not(x)), sameInstance(Sat.FALSE));
    assertThat(sat.or(x, sat.not(x)), sameInstance(Sat.TRUE));
    assertThat(sat.not(sat.not(x)), sameInstance(x));
    assertThat(sat.and(x, y), sameInstance(sat.and(y, x)));
    assertThat(sat.or(x, x), sameInstance(x));
    assertThat(sat.iff(x, x), sameInstance(Sat.TRUE));
    assertThat(sat.ite(Sat.TRUE, x, y), sameInstance(x));
    assertThat(sat.ite(Sat.FALSE, x, y), sameInstance(y));
    assertThat(sat.variable("x"), sameInstance(x));
  }

  /** Tests printing of nested terms. */
  @Test void testToString() {
    final Sat sat = new Sat();
    final Variable x = sat.variable("x");
    final Variable y = sat.variable("y");
    final Variable z = sat.variable("z");
    assertThat(sat.and(x, sat.or(y, z)), hasToString("x ∧ (y ∨ z)"));
    assertThat(sat.or(x, sat.and(y, z)), hasToString("x ∨ y ∧ z"));
    assertThat(sat.not(x), hasToString("¬x"));
  }

  /** Tests the counter of how many terms are true. */
  @Test void testCounter() {
    final Sat sat = new Sat();
    final List<Term> inputs = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      inputs.add(sat.variable("v" + i));
    }
    final Counter counter = Counter.of(sat, inputs, 10);
    assertThat(counter.max(), is(4));

    // "exactly 2 of 4" has 6 solutions
    final Term exactlyTwo = counter.eq(Counter.constant(sat, 2));
    assertThat(countSolutions(sat, exactlyTwo, 4), is(6));

    // "at most 1 of 4" has 5 solutions
    final Term atMostOne = counter.le(Counter.constant(sat, 1));
    assertThat(countSolutions(sat, atMostOne, 4), is(5));

    // "more than 3 of 4" has 1 solution
    final Term all = Counter.constant(sat, 3).lt(counter);
    assertThat(countSolutions(sat, all, 4), is(1));
  }

  /**
   * Tests that a counter with a limit saturates, but still compares
   * correctly with constants below the limit.
   */
  @Test void testCounterLimit() {
    final Sat sat = new Sat();
    final List<Term> inputs = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      inputs.add(sat.variable("v" + i));
    }
    final Counter counter = Counter.of(sat, inputs, 3);
    assertThat(counter.max(), is(3));
    // "fewer than 3 of 5": 1 + 5 + 10 = 16 solutions
    final Term fewerThanThree = counter.lt(Counter.constant(sat, 3));
    assertThat(countSolutions(sat, fewerThanThree, 5), is(16));
  }

  /** Counts the assignments to variables 0 .. n-1 that satisfy a term. */
  static int countSolutions(Sat sat, Term term, int n) {
    int count = 0;
    final boolean[] env = new boolean[sat.variableCount()];
    for (int bits = 0; bits < 1 << n; bits++) {
      for (int i = 0; i < n; i++) {
        env[i] = (bits & (1 << i)) != 0;
      }
      if (term.evaluate(env)) {
        ++count;
      }
    }
    return count;
  }

  /** Tests that the terms of a conjunction are sorted by creation order. */
  @Test void testFlatten() {
    final Sat sat = new Sat();
    final Variable x = sat.variable("x");
    final Variable y = sat.variable("y");
    final Variable z = sat.variable("z");
    final Term and = sat.and(z, sat.and(y, x));
    assertThat(and, hasToString("x ∧ y ∧ z"));
    assertThat(((Sat.And) and).terms, is(ImmutableList.of(x, y, z)));
  }
}

// End SatTest.java
