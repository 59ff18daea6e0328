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

/**
 * Backend that decides satisfiability of a set of clauses.
 *
 * <p>Variables are numbered from 1; a literal is a variable number, negated
 * for the negative literal. Clauses may be added between calls to
 * {@link #solve}; a solver must keep everything it has learned.
 *
 * <p>A solver is not thread-safe; callers must not add clauses or solve
 * concurrently.
 */
public interface SatSolver extends AutoCloseable {
  /** Allocates a variable and returns its number. */
  int newVariable();

  /** Returns the number of variables allocated. */
  int variableCount();

  /**
   * Adds a clause.
   *
   * <p>Returns false if the clauses are now trivially unsatisfiable (for
   * example, the clause is empty), in which case every subsequent solve
   * returns {@link Result#UNSATISFIABLE}.
   */
  boolean addClause(int... literals);

  /**
   * Searches for an assignment satisfying all clauses.
   *
   * <p>Returns {@link Result#UNKNOWN} if the cancellation is triggered (by
   * another thread, or because its deadline has passed) before the search
   * completes.
   */
  Result solve(Cancellation cancellation);

  /**
   * Returns the value of a variable in the model found by the last call to
   * {@link #solve}, which must have returned {@link Result#SATISFIABLE}.
   */
  boolean value(int variable);

  @Override
  void close();

  /** Result of a call to {@link #solve}. */
  enum Result {
    SATISFIABLE,
    UNSATISFIABLE,
    UNKNOWN
  }
}

// End SatSolver.java
