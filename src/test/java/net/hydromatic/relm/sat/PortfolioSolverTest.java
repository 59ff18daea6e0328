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

import static net.hydromatic.relm.sat.CdclSolverTest.countModels;
import static net.hydromatic.relm.sat.CdclSolverTest.pigeonhole;
import static net.hydromatic.relm.sat.CdclSolverTest.satisfies;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests {@link PortfolioSolver}. */
public class PortfolioSolverTest {
  @Test void testUnsatisfiable() {
    try (PortfolioSolver solver = new PortfolioSolver(3, 0L)) {
      pigeonhole(solver, 5, 4);
      assertThat(solver.solve(Cancellation.none()),
          is(SatSolver.Result.UNSATISFIABLE));
    }
  }

  @Test void testSatisfiable() {
    try (PortfolioSolver solver = new PortfolioSolver(4, 7L)) {
      final List<int[]> clauses = pigeonhole(solver, 5, 5);
      assertThat(solver.solve(Cancellation.none()),
          is(SatSolver.Result.SATISFIABLE));
      assertThat(satisfies(solver, clauses), is(true));
    }
  }

  /**
   * Enumerates models through a portfolio; the count does not depend on which
   * worker wins each round.
   */
  @Test void testEnumerate() {
    try (PortfolioSolver solver = new PortfolioSolver(2, 0L)) {
      pigeonhole(solver, 3, 3);
      assertThat(countModels(solver), is(6));
    }
  }

  @Test void testCancelled() {
    try (PortfolioSolver solver = new PortfolioSolver(2, 0L)) {
      final int x = solver.newVariable();
      final int y = solver.newVariable();
      solver.addClause(x, y);
      final Cancellation cancellation = Cancellation.none();
      cancellation.cancel();
      assertThat(solver.solve(cancellation), is(SatSolver.Result.UNKNOWN));
      assertThrows(IllegalStateException.class, () -> solver.value(x));
    }
  }

  @Test void testThreads() {
    assertThrows(IllegalArgumentException.class,
        () -> new PortfolioSolver(0, 0L));
  }
}

// End PortfolioSolverTest.java
