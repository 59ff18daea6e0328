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

import java.util.HashMap;
import java.util.Map;

/**
 * Converts a {@link Sat} circuit to clauses in a {@link SatSolver}, using the
 * Tseitin encoding.
 *
 * <p>Each circuit variable and each conjunction or disjunction gets one
 * solver variable; a negation is the negated literal of its argument. Gates
 * are encoded in both directions, because a gate shared by several parents
 * may occur with either polarity. Conversion is incremental: terms already
 * converted keep their literals, so formulas can be added between solves.
 */
public class Cnf {
  private final SatSolver solver;
  private final Map<Sat.Term, Integer> literals = new HashMap<>();
  private int trueLiteral = 0;

  public Cnf(SatSolver solver) {
    this.solver = solver;
  }

  /** Adds clauses that require a term to be true. */
  public void assertTrue(Sat.Term term) {
    if (term == Sat.TRUE) {
      return;
    }
    if (term instanceof Sat.And) {
      for (Sat.Term t : ((Sat.And) term).terms) {
        assertTrue(t);
      }
    } else if (term instanceof Sat.Or) {
      // empty for FALSE, which makes the solver unsatisfiable
      final Sat.Or or = (Sat.Or) term;
      final int[] clause = new int[or.terms.size()];
      for (int i = 0; i < clause.length; i++) {
        clause[i] = literal(or.terms.get(i));
      }
      addClause(clause);
    } else {
      addClause(literal(term));
    }
  }

  /** Returns the literal of a term, adding variables and clauses if new. */
  public int literal(Sat.Term term) {
    if (term instanceof Sat.Not) {
      return -literal(((Sat.Not) term).term);
    }
    if (term.isConstant()) {
      if (trueLiteral == 0) {
        trueLiteral = solver.newVariable();
        addClause(trueLiteral);
      }
      return term == Sat.TRUE ? trueLiteral : -trueLiteral;
    }
    final Integer existing = literals.get(term);
    if (existing != null) {
      return existing;
    }
    if (term instanceof Sat.Variable) {
      final int v = solver.newVariable();
      literals.put(term, v);
      return v;
    }
    final Sat.Node node = (Sat.Node) term;
    final int[] args = new int[node.terms.size()];
    for (int i = 0; i < args.length; i++) {
      args[i] = literal(node.terms.get(i));
    }
    final int g = solver.newVariable();
    literals.put(term, g);
    final int[] big = new int[args.length + 1];
    if (node instanceof Sat.And) {
      // g => a_i; (a_1 and ... and a_n) => g
      big[0] = g;
      for (int i = 0; i < args.length; i++) {
        addClause(-g, args[i]);
        big[i + 1] = -args[i];
      }
    } else {
      // a_i => g; g => (a_1 or ... or a_n)
      big[0] = -g;
      for (int i = 0; i < args.length; i++) {
        addClause(g, -args[i]);
        big[i + 1] = args[i];
      }
    }
    addClause(big);
    return g;
  }

  private void addClause(int... clause) {
    solver.addClause(clause);
  }
}

// End Cnf.java
