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
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import net.hydromatic.relm.compile.Problem;
import net.hydromatic.relm.compile.Tracer;
import net.hydromatic.relm.instance.Instance;
import net.hydromatic.relm.sat.Cancellation;
import net.hydromatic.relm.sat.CdclSolver;
import net.hydromatic.relm.sat.Cnf;
import net.hydromatic.relm.sat.PortfolioSolver;
import net.hydromatic.relm.sat.Sat;
import net.hydromatic.relm.sat.SatSolver;
import net.hydromatic.relm.type.Fact;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds the instances of a problem, one at a time.
 *
 * <p>Owns the solver. After each instance, adds a clause that excludes the
 * same assignment to the primary variables, and solves again. Skips
 * instances that are isomorphic to one already returned.
 *
 * <p>Each call to {@link #next} returns either an instance or, at the end, a
 * solution whose outcome says why there are no more: the problem is
 * unsatisfiable, or the search timed out. {@link #next} is synchronized, so
 * adding a blocking clause and solving again happen atomically.
 */
public class Enumerator implements AutoCloseable {
  private final Problem problem;
  private final Tracer tracer;
  private final SatSolver solver;
  private final Canonicalizer canonicalizer;
  private final List<Sat.Variable> variables;
  private final int[] literals;
  private final int solutionLimit;
  private final long timeoutMillis;
  private final Set<List<List<Integer>>> canonicalForms = new HashSet<>();
  private int count;
  private boolean done;

  Enumerator(Session session, Problem problem, Tracer tracer) {
    this.problem = requireNonNull(problem);
    this.tracer = requireNonNull(tracer);
    this.solutionLimit = Prop.SOLUTION_LIMIT.intValue(session.map);
    this.timeoutMillis = Prop.TIMEOUT_MILLIS.longValue(session.map);
    final int threads = Prop.SOLVER_THREADS.intValue(session.map);
    final long seed = Prop.RANDOM_SEED.longValue(session.map);
    this.solver =
        threads > 1
            ? new PortfolioSolver(threads, seed)
            : new CdclSolver(seed);
    this.canonicalizer =
        new Canonicalizer(problem.bounds.universe,
            Prop.CANONICAL_CHECK_LIMIT.intValue(session.map));

    final Cnf cnf = new Cnf(solver);
    this.variables = problem.primaryVariables();
    this.literals = new int[variables.size()];
    for (int i = 0; i < literals.length; i++) {
      literals[i] = cnf.literal(variables.get(i));
    }
    cnf.assertTrue(problem.formula);
    cnf.assertTrue(problem.symmetry);
    this.done = solutionLimit <= 0;
  }

  /** Returns whether {@link #next} may be called. */
  public synchronized boolean hasNext() {
    return !done;
  }

  /** Returns the next instance, or the reason that there are no more. */
  public synchronized Solution next() {
    if (done) {
      throw new NoSuchElementException();
    }
    final Fact trivialFact = problem.trivialFact;
    if (trivialFact != null) {
      done = true;
      return Solution.triviallyUnsatisfiable(problem.command, trivialFact);
    }
    for (;;) {
      final Cancellation cancellation =
          timeoutMillis > 0
              ? Cancellation.withTimeout(timeoutMillis)
              : Cancellation.none();
      final long start = System.nanoTime();
      final SatSolver.Result result = solver.solve(cancellation);
      final long elapsedMillis =
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
      tracer.onSolve(result, elapsedMillis);
      switch (result) {
        case UNKNOWN:
          done = true;
          return Solution.timeout(problem.command, count, elapsedMillis);
        case UNSATISFIABLE:
          done = true;
          return Solution.unsatisfiable(problem.command, count,
              elapsedMillis);
        default:
          break;
      }

      final Instance instance = extract();
      if (!isNew(instance)) {
        continue;
      }
      checkConstraints(instance);
      tracer.onInstance(instance);
      final Solution solution =
          Solution.satisfiable(problem.command, instance, count++,
              elapsedMillis);
      if (count >= solutionLimit) {
        done = true;
      }
      return solution;
    }
  }

  /**
   * Reads the instance from the solver's model, and adds a clause so that
   * the solver will not find the same assignment again.
   */
  private Instance extract() {
    final boolean[] values = new boolean[problem.sat.variableCount()];
    final int[] clause = new int[literals.length];
    for (int i = 0; i < literals.length; i++) {
      final boolean value = solver.value(literals[i]);
      values[variables.get(i).id] = value;
      clause[i] = value ? -literals[i] : literals[i];
    }
    solver.addClause(clause);
    return problem.instance(values);
  }

  /** Checks that an instance satisfies every constraint of the problem. */
  private void checkConstraints(Instance instance) {
    final List<Fact> violated =
        new Evaluator(problem.model, instance)
            .violated(problem.constraints.keySet());
    checkState(violated.isEmpty(), "instance violates %s: %s", violated,
        instance);
  }

  /** Returns whether an instance is not isomorphic to one already found. */
  private boolean isNew(Instance instance) {
    final @Nullable List<List<Integer>> form =
        canonicalizer.canonicalForm(instance);
    return form == null || canonicalForms.add(form);
  }

  /** Returns all remaining solutions, up to and including the last. */
  public synchronized List<Solution> remaining() {
    final ImmutableList.Builder<Solution> b = ImmutableList.builder();
    while (hasNext()) {
      b.add(next());
    }
    return b.build();
  }

  @Override
  public void close() {
    solver.close();
  }
}

// End Enumerator.java
