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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Solver that races several {@link CdclSolver} instances, with different
 * seeds, on the same clauses.
 *
 * <p>To its caller it is a single solver: {@link #solve} blocks until the
 * first worker returns a definitive answer (satisfiable or unsatisfiable),
 * cancels the others, and waits for all of them to stop. If every worker
 * is cancelled, the result is {@link Result#UNKNOWN}. If a worker fails,
 * {@link #solve} throws {@link SolverException}.
 *
 * <p>Workers run on a private pool of daemon threads, which {@link #close}
 * shuts down.
 */
public class PortfolioSolver implements SatSolver {
  private final ImmutableList<CdclSolver> workers;
  private final ExecutorService executor;
  private @Nullable CdclSolver winner;

  /**
   * Creates a portfolio of {@code threads} workers; the first uses
   * {@code seed}, and the others successive seeds.
   */
  public PortfolioSolver(int threads, long seed) {
    checkArgument(threads > 0, "threads must be positive");
    final ImmutableList.Builder<CdclSolver> b = ImmutableList.builder();
    for (int i = 0; i < threads; i++) {
      b.add(new CdclSolver(seed + i));
    }
    this.workers = b.build();
    this.executor =
        Executors.newFixedThreadPool(
            threads,
            new ThreadFactoryBuilder()
                .setNameFormat("relm-solver-%d")
                .setDaemon(true)
                .build());
  }

  @Override public int newVariable() {
    int v = 0;
    for (CdclSolver worker : workers) {
      v = worker.newVariable();
    }
    return v;
  }

  @Override public int variableCount() {
    return workers.get(0).variableCount();
  }

  @Override public boolean addClause(int... literals) {
    winner = null;
    boolean ok = true;
    for (CdclSolver worker : workers) {
      ok &= worker.addClause(literals);
    }
    return ok;
  }

  @Override public Result solve(Cancellation cancellation) {
    winner = null;
    final Cancellation shared = cancellation.child();
    final CompletionService<Outcome> service =
        new ExecutorCompletionService<>(executor);
    for (CdclSolver worker : workers) {
      final Callable<Outcome> task =
          () -> new Outcome(worker, worker.solve(shared));
      service.submit(task);
    }
    Result result = Result.UNKNOWN;
    SolverException failure = null;
    try {
      for (int i = 0; i < workers.size(); i++) {
        final Future<Outcome> future = service.take();
        try {
          final Outcome outcome = future.get();
          if (outcome.result != Result.UNKNOWN && winner == null) {
            winner = outcome.worker;
            result = outcome.result;
            shared.cancel();
          }
        } catch (ExecutionException e) {
          shared.cancel();
          if (failure == null) {
            failure = new SolverException("solver worker failed", e.getCause());
          }
        }
      }
    } catch (InterruptedException e) {
      shared.cancel();
      Thread.currentThread().interrupt();
      throw new SolverException("interrupted while solving", e);
    }
    if (failure != null) {
      winner = null;
      throw failure;
    }
    return result;
  }

  @Override public boolean value(int variable) {
    checkState(winner != null, "no model");
    return winner.value(variable);
  }

  @Override public void close() {
    executor.shutdownNow();
  }

  /** Result of one worker. */
  private static class Outcome {
    final CdclSolver worker;
    final Result result;

    Outcome(CdclSolver worker, Result result) {
      this.worker = worker;
      this.result = result;
    }
  }
}

// End PortfolioSolver.java
