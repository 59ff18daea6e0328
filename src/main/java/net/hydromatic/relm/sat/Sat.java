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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Boolean circuit.
 *
 * <p>Terms are variables, negations, conjunctions and disjunctions, and the
 * constants {@link #TRUE} and {@link #FALSE}. The factory methods fold
 * constants, flatten nested conjunctions and disjunctions, remove duplicates
 * and detect complementary arguments, and return the same object for
 * structurally equal terms, so that a circuit is a DAG.
 */
public class Sat {
  /** The constant "true", an empty conjunction. */
  public static final Term TRUE = new And(-2, ImmutableList.of());

  /** The constant "false", an empty disjunction. */
  public static final Term FALSE = new Or(-1, ImmutableList.of());

  private final List<Variable> variables = new ArrayList<>();
  private final Map<String, Variable> variablesByName = new HashMap<>();
  private final Map<Term, Term> notCache = new HashMap<>();
  private final Map<List<Term>, Term> andCache = new HashMap<>();
  private final Map<List<Term>, Term> orCache = new HashMap<>();
  private int nextOrdinal = 0;

  /**
   * Finds an assignment of variables such that a term evaluates to true, or
   * null if there is no solution.
   *
   * <p>Tries every assignment, so is only suitable for circuits with a few
   * variables; {@link Cnf} and a {@link SatSolver} solve larger ones.
   */
  public @Nullable Map<Variable, Boolean> solve(Term term) {
    final List<List<Assignment>> allAssignments = new ArrayList<>();
    for (Variable variable : variables) {
      allAssignments.add(
          ImmutableList.of(
              new Assignment(variable, false), new Assignment(variable, true)));
    }

    final boolean[] env = new boolean[variables.size()];
    for (List<Assignment> assignments :
        Lists.cartesianProduct(allAssignments)) {
      assignments.forEach(a -> env[a.variable.id] = a.value);
      if (term.evaluate(env)) {
        final ImmutableMap.Builder<Variable, Boolean> builder =
            ImmutableMap.builder();
        assignments.forEach(a -> builder.put(a.variable, a.value));
        return builder.build();
      }
    }
    return null;
  }

  /** Returns the variable with a given name, creating it if necessary. */
  public Variable variable(String name) {
    Variable variable = variablesByName.get(name);
    if (variable != null) {
      return variable;
    }
    variable = new Variable(nextOrdinal++, variables.size(), name);
    variables.add(variable);
    variablesByName.put(name, variable);
    return variable;
  }

  /** Returns the variable with a given id. */
  public Variable variable(int id) {
    return variables.get(id);
  }

  /** Returns the number of variables created so far. */
  public int variableCount() {
    return variables.size();
  }

  public Term constant(boolean b) {
    return b ? TRUE : FALSE;
  }

  public Term not(Term term) {
    if (term == TRUE) {
      return FALSE;
    }
    if (term == FALSE) {
      return TRUE;
    }
    if (term instanceof Not) {
      return ((Not) term).term;
    }
    return notCache.computeIfAbsent(term, t -> new Not(nextOrdinal++, t));
  }

  public Term and(Term... terms) {
    return and(ImmutableList.copyOf(terms));
  }

  public Term and(Iterable<? extends Term> terms) {
    final List<Term> args = flatten(Op.AND, terms);
    if (args == null) {
      return FALSE;
    }
    switch (args.size()) {
      case 0:
        return TRUE;
      case 1:
        return args.get(0);
      default:
        return andCache.computeIfAbsent(
            args, list -> new And(nextOrdinal++, ImmutableList.copyOf(list)));
    }
  }

  public Term or(Term... terms) {
    return or(ImmutableList.copyOf(terms));
  }

  public Term or(Iterable<? extends Term> terms) {
    final List<Term> args = flatten(Op.OR, terms);
    if (args == null) {
      return TRUE;
    }
    switch (args.size()) {
      case 0:
        return FALSE;
      case 1:
        return args.get(0);
      default:
        return orCache.computeIfAbsent(
            args, list -> new Or(nextOrdinal++, ImmutableList.copyOf(list)));
    }
  }

  /** Returns "a implies b". */
  public Term implies(Term a, Term b) {
    return or(not(a), b);
  }

  /** Returns "a iff b". */
  public Term iff(Term a, Term b) {
    if (a == b) {
      return TRUE;
    }
    return and(implies(a, b), implies(b, a));
  }

  /** Returns "if c then a else b". */
  public Term ite(Term c, Term a, Term b) {
    if (c == TRUE || a == b) {
      return a;
    }
    if (c == FALSE) {
      return b;
    }
    return or(and(c, a), and(not(c), b));
  }

  /**
   * Flattens the arguments of a conjunction or disjunction, sorted by
   * ordinal and without duplicates. Returns null if the result is the
   * absorbing constant (false for "and", true for "or").
   */
  private static @Nullable List<Term> flatten(
      Op op, Iterable<? extends Term> terms) {
    final Term unit = op == Op.AND ? TRUE : FALSE;
    final Term zero = op == Op.AND ? FALSE : TRUE;
    final TreeMap<Integer, Term> map = new TreeMap<>();
    for (Term term : terms) {
      if (term == zero) {
        return null;
      }
      if (term == unit) {
        continue;
      }
      if (term.op == op) {
        for (Term t : ((Node) term).terms) {
          map.put(t.ordinal, t);
        }
      } else {
        map.put(term.ordinal, term);
      }
    }
    for (Term term : map.values()) {
      if (term instanceof Not && map.containsKey(((Not) term).term.ordinal)) {
        return null;
      }
    }
    return new ArrayList<>(map.values());
  }

  /** Base class for all terms (variables, and, or, not). */
  public abstract static class Term {
    final Op op;
    /** Creation order; unique within a {@link Sat}, negative for constants. */
    final int ordinal;

    Term(Op op, int ordinal) {
      this.op = requireNonNull(op, "op");
      this.ordinal = ordinal;
    }

    @Override
    public String toString() {
      return unparse(new StringBuilder(), 0, 0).toString();
    }

    protected abstract StringBuilder unparse(
        StringBuilder buf, int left, int right);

    public abstract boolean evaluate(boolean[] env);

    /** Whether this term is the constant {@link #TRUE} or {@link #FALSE}. */
    public boolean isConstant() {
      return this == TRUE || this == FALSE;
    }
  }

  /** Variable. Its value can be true or false. */
  public static class Variable extends Term {
    public final int id;
    public final String name;

    Variable(int ordinal, int id, String name) {
      super(Op.VARIABLE, ordinal);
      this.id = id;
      this.name = requireNonNull(name, "name");
    }

    @Override
    protected StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(name);
    }

    @Override
    public boolean evaluate(boolean[] env) {
      return env[id];
    }
  }

  /** Term that has a variable number of arguments ("and" or "or"). */
  public abstract static class Node extends Term {
    public final ImmutableList<Term> terms;

    Node(Op op, int ordinal, ImmutableList<Term> terms) {
      super(op, ordinal);
      this.terms = requireNonNull(terms);
    }

    @Override
    protected StringBuilder unparse(StringBuilder buf, int left, int right) {
      switch (terms.size()) {
        case 0:
          // empty "and" prints as "true";
          // empty "or" prints as "false"
          return buf.append(op.emptyName);
        case 1:
          // singleton "and" and "or" print as the sole term
          return terms.get(0).unparse(buf, left, right);
      }
      if (left > op.left || right > op.right) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      for (int i = 0; i < terms.size(); i++) {
        final Term term = terms.get(i);
        if (i > 0) {
          buf.append(op.str);
        }
        term.unparse(
            buf,
            i == 0 ? left : op.right,
            i == terms.size() - 1 ? right : op.left);
      }
      return buf;
    }
  }

  /** "And" term. */
  public static class And extends Node {
    And(int ordinal, ImmutableList<Term> terms) {
      super(Op.AND, ordinal, terms);
    }

    @Override
    public boolean evaluate(boolean[] env) {
      for (Term term : terms) {
        if (!term.evaluate(env)) {
          return false;
        }
      }
      return true;
    }
  }

  /** "Or" term. */
  public static class Or extends Node {
    Or(int ordinal, ImmutableList<Term> terms) {
      super(Op.OR, ordinal, terms);
    }

    @Override
    public boolean evaluate(boolean[] env) {
      for (Term term : terms) {
        if (term.evaluate(env)) {
          return true;
        }
      }
      return false;
    }
  }

  /** "Not" term. */
  public static class Not extends Term {
    public final Term term;

    Not(int ordinal, Term term) {
      super(Op.NOT, ordinal);
      this.term = requireNonNull(term, "term");
    }

    @Override
    protected StringBuilder unparse(StringBuilder buf, int left, int right) {
      return term.unparse(buf.append(op.str), op.right, right);
    }

    @Override
    public boolean evaluate(boolean[] env) {
      return !term.evaluate(env);
    }
  }

  /**
   * Operator (or type of term), with its left and right precedence and print
   * name.
   */
  enum Op {
    AND(3, 4, " ∧ ", "true"),
    OR(1, 2, " ∨ ", "false"),
    NOT(5, 5, "¬", ""),
    VARIABLE(0, 0, "", "");

    final int left;
    final int right;
    final String str;
    final String emptyName;

    Op(int left, int right, String str, String emptyName) {
      this.left = left;
      this.right = right;
      this.str = str;
      this.emptyName = emptyName;
    }
  }

  /** Assignment of a variable to a value. */
  private static class Assignment {
    final Variable variable;
    final boolean value;

    Assignment(Variable variable, boolean value) {
      this.variable = requireNonNull(variable, "variable");
      this.value = value;
    }
  }
}

// End Sat.java
