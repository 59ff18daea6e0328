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
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/** Tests {@link CdclSolver}. */
public class CdclSolverTest {
  /**
   * Adds clauses saying that each of {@code pigeons} pigeons occupies one of
   * {@code holes} holes, at most one pigeon per hole. Returns the clauses.
   */
  static List<int[]> pigeonhole(SatSolver solver, int pigeons, int holes) {
    final int[][] p = new int[pigeons][holes];
    for (int i = 0; i < pigeons; i++) {
      for (int j = 0; j < holes; j++) {
        p[i][j] = solver.newVariable();
      }
    }
    final List<int[]> clauses = new ArrayList<>();
    for (int i = 0; i < pigeons; i++) {
      clauses.add(p[i].clone());
    }
    for (int j = 0; j < holes; j++) {
      for (int i = 0; i < pigeons; i++) {
        for (int k = i + 1; k < pigeons; k++) {
          clauses.add(new int[] {-p[i][j], -p[k][j]});
        }
      }
    }
    clauses.forEach(solver::addClause);
    return clauses;
  }

  /** Returns whether the solver's model satisfies every clause. */
  static boolean satisfies(SatSolver solver, List<int[]> clauses) {
    for (int[] clause : clauses) {
      boolean satisfied = false;
      for (int literal : clause) {
        if (solver.value(Math.abs(literal)) == literal > 0) {
          satisfied = true;
          break;
        }
      }
      if (!satisfied) {
        return false;
      }
    }
    return true;
  }

  /** Counts models by adding a blocking clause after each one. */
  static int countModels(SatSolver solver) {
    int count = 0;
    while (solver.solve(Cancellation.none()) == SatSolver.Result.SATISFIABLE) {
      ++count;
      final int[] blocking = new int[solver.variableCount()];
      for (int v = 1; v <= blocking.length; v++) {
        blocking[v - 1] = solver.value(v) ? -v : v;
      }
      solver.addClause(blocking);
    }
    return count;
  }

  @Test void testSimple() {
    try (CdclSolver solver = new CdclSolver()) {
      final int x = solver.newVariable();
      final int y = solver.newVariable();
      solver.addClause(x, y);
      solver.addClause(-x, -y);
      solver.addClause(-x, y);
      assertThat(solver.solve(Cancellation.none()),
          is(SatSolver.Result.SATISFIABLE));
      assertThat(solver.value(x), is(false));
      assertThat(solver.value(y), is(true));
    }
  }

  /** Five pigeons do not fit into four holes. */
  @Test void testPigeonhole() {
    try (CdclSolver solver = new CdclSolver()) {
      pigeonhole(solver, 5, 4);
      assertThat(solver.solve(Cancellation.none()),
          is(SatSolver.Result.UNSATISFIABLE));
      assertThat(solver.conflictCount() > 0, is(true));
      assertThat(solver.decisionCount() > 0, is(true));
    }
  }

  /** Four pigeons fit into four holes, in 4! ways. */
  @Test void testPigeonholeSatisfiable() {
    try (CdclSolver solver = new CdclSolver()) {
      final List<int[]> clauses = pigeonhole(solver, 4, 4);
      assertThat(solver.solve(Cancellation.none()),
          is(SatSolver.Result.SATISFIABLE));
      assertThat(satisfies(solver, clauses), is(true));
    }
    try (CdclSolver solver = new CdclSolver()) {
      // "exactly one hole per pigeon" is implied when pigeons = holes
      pigeonhole(solver, 4, 4);
      assertThat(countModels(solver), is(24));
    }
  }

  /** "x1 or x2 or x3" has 7 models. */
  @Test void testEnumerate() {
    try (CdclSolver solver = new CdclSolver()) {
      final int x1 = solver.newVariable();
      final int x2 = solver.newVariable();
      final int x3 = solver.newVariable();
      solver.addClause(x1, x2, x3);
      assertThat(countModels(solver), is(7));
      // once unsatisfiable, always unsatisfiable
      assertThat(solver.solve(Cancellation.none()),
          is(SatSolver.Result.UNSATISFIABLE));
    }
  }

  /** Clauses added between solves are respected. */
  @Test void testIncremental() {
    try (CdclSolver solver = new CdclSolver()) {
      final int x = solver.newVariable();
      final int y = solver.newVariable();
      solver.addClause(x, y);
      assertThat(solver.solve(Cancellation.none()),
          is(SatSolver.Result.SATISFIABLE));
      solver.addClause(-x);
      assertThat(solver.solve(Cancellation.none()),
          is(SatSolver.Result.SATISFIABLE));
      assertThat(solver.value(x), is(false));
      assertThat(solver.value(y), is(true));
      solver.addClause(-y);
      assertThat(solver.solve(Cancellation.none()),
          is(SatSolver.Result.UNSATISFIABLE));
    }
  }

  @Test void testEmptyClause() {
    try (CdclSolver solver = new CdclSolver()) {
      solver.newVariable();
      assertThat(solver.addClause(), is(false));
      assertThat(solver.solve(Cancellation.none()),
          is(SatSolver.Result.UNSATISFIABLE));
    }
  }

  /** A cancelled search returns UNKNOWN, never UNSATISFIABLE. */
  @Test void testCancelled() {
    try (CdclSolver solver = new CdclSolver()) {
      final int x = solver.newVariable();
      final int y = solver.newVariable();
      solver.addClause(x, y);
      final Cancellation cancellation = Cancellation.none();
      cancellation.cancel();
      assertThat(solver.solve(cancellation), is(SatSolver.Result.UNKNOWN));
      // the solver is still usable
      assertThat(solver.solve(Cancellation.none()),
          is(SatSolver.Result.SATISFIABLE));
    }
  }

  /**
   * Solves random 3-SAT instances with several seeds. A model, if found, must
   * satisfy every clause.
   */
  @Test void testRandom() {
    final Random random = new Random(1234);
    for (long seed = 0; seed < 5; seed++) {
      try (CdclSolver solver = new CdclSolver(seed)) {
        final int n = 50;
        for (int v = 0; v < n; v++) {
          solver.newVariable();
        }
        final List<int[]> clauses = new ArrayList<>();
        for (int c = 0; c < 150; c++) {
          final int[] clause = new int[3];
          for (int i = 0; i < 3; i++) {
            final int v = random.nextInt(n) + 1;
            clause[i] = random.nextBoolean() ? v : -v;
          }
          clauses.add(clause);
          solver.addClause(clause);
        }
        final SatSolver.Result result = solver.solve(Cancellation.none());
        if (result == SatSolver.Result.SATISFIABLE) {
          assertThat(satisfies(solver, clauses), is(true));
        } else {
          assertThat(result, is(SatSolver.Result.UNSATISFIABLE));
        }
      }
    }
  }
}

// End CdclSolverTest.java
