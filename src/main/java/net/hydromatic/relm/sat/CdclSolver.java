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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Conflict-driven clause-learning SAT solver.
 *
 * <p>Propagates with two watched literals per clause, learns the first
 * unique implication point of each conflict, branches on the unassigned
 * variable of highest activity (kept in a heap, with decaying bumps), reuses
 * the last value of each variable (phase saving), restarts after a Luby
 * sequence of conflict counts, and periodically discards the less active
 * half of the learned clauses.
 *
 * <p>The solver is incremental: clauses may be added between calls to
 * {@link #solve}, and learned clauses are kept.
 *
 * <p>Internally, literal {@code v} has code {@code 2v} and literal {@code -v}
 * has code {@code 2v + 1}.
 */
public class CdclSolver implements SatSolver {
  private static final int RESTART_BASE = 100;
  private static final double VAR_DECAY = 0.95;
  private static final double CLAUSE_DECAY = 0.999;
  private static final double RANDOM_FREQUENCY = 0.02;

  private final @Nullable Random random;

  private int varCount = 0;
  /** Per variable: 0 unassigned, 1 true, -1 false. */
  private byte[] assigns = new byte[16];
  private int[] levels = new int[16];
  private @Nullable Clause[] reasons = new Clause[16];
  private double[] activity = new double[16];
  private boolean[] phases = new boolean[16];
  private boolean[] seen = new boolean[16];
  private boolean @Nullable [] model;

  private int[] trail = new int[16];
  private int trailSize = 0;
  private int[] trailLimits = new int[16];
  private int decisionLevel = 0;
  private int propagateHead = 0;

  /** Per literal code: the clauses watching that literal. */
  private final List<List<Clause>> watches = new ArrayList<>();
  private final List<Clause> clauses = new ArrayList<>();
  private final List<Clause> learnts = new ArrayList<>();
  private final VarHeap heap = new VarHeap();

  private double varIncrement = 1d;
  private double clauseIncrement = 1d;
  private double maxLearnts = 0d;
  private boolean ok = true;
  private long conflicts = 0;
  private long decisions = 0;

  /** Creates a solver that makes no random decisions. */
  public CdclSolver() {
    this(0L);
  }

  /**
   * Creates a solver. If the seed is not zero, the solver perturbs initial
   * activities and makes occasional random decisions, so that solvers with
   * different seeds explore the search space differently.
   */
  public CdclSolver(long seed) {
    this.random = seed == 0L ? null : new Random(seed);
    watches.add(new ArrayList<>());
    watches.add(new ArrayList<>());
  }

  /** Returns the number of conflicts so far, over all solves. */
  public long conflictCount() {
    return conflicts;
  }

  /** Returns the number of decisions so far, over all solves. */
  public long decisionCount() {
    return decisions;
  }

  @Override public int newVariable() {
    final int v = ++varCount;
    if (v >= assigns.length) {
      final int n = assigns.length * 2;
      assigns = Arrays.copyOf(assigns, n);
      levels = Arrays.copyOf(levels, n);
      reasons = Arrays.copyOf(reasons, n);
      activity = Arrays.copyOf(activity, n);
      phases = Arrays.copyOf(phases, n);
      seen = Arrays.copyOf(seen, n);
      trail = Arrays.copyOf(trail, n);
      trailLimits = Arrays.copyOf(trailLimits, n);
    }
    if (random != null) {
      activity[v] = random.nextDouble() * 1e-5;
    }
    watches.add(new ArrayList<>());
    watches.add(new ArrayList<>());
    heap.insert(v);
    return v;
  }

  @Override public int variableCount() {
    return varCount;
  }

  @Override public boolean addClause(int... literals) {
    checkState(decisionLevel == 0);
    if (!ok) {
      return false;
    }
    final int[] codes = new int[literals.length];
    for (int i = 0; i < literals.length; i++) {
      final int lit = literals[i];
      checkArgument(lit != 0 && Math.abs(lit) <= varCount,
          "invalid literal %s", lit);
      codes[i] = lit > 0 ? 2 * lit : -2 * lit + 1;
    }
    Arrays.sort(codes);
    int n = 0;
    int previous = -1;
    for (int code : codes) {
      final int value = litValue(code);
      if (value == 1 || code == (previous ^ 1)) {
        // satisfied at level 0, or a tautology
        return true;
      }
      if (value == 0 && code != previous) {
        codes[n++] = code;
        previous = code;
      }
    }
    switch (n) {
      case 0:
        ok = false;
        return false;
      case 1:
        enqueue(codes[0], null);
        if (propagate() != null) {
          ok = false;
        }
        return ok;
      default:
        final Clause clause = new Clause(Arrays.copyOf(codes, n), false);
        attach(clause);
        clauses.add(clause);
        return true;
    }
  }

  @Override public Result solve(Cancellation cancellation) {
    model = null;
    if (!ok) {
      return Result.UNSATISFIABLE;
    }
    if (maxLearnts < clauses.size() / 3d) {
      maxLearnts = Math.max(clauses.size() / 3d, 100d);
    }
    for (int restart = 0; ; restart++) {
      final Result result =
          search(luby(restart) * RESTART_BASE, cancellation);
      if (result != null) {
        cancelUntil(0);
        return result;
      }
      maxLearnts *= 1.1d;
    }
  }

  @Override public boolean value(int variable) {
    checkState(model != null, "no model");
    checkArgument(variable > 0 && variable < model.length);
    return model[variable];
  }

  @Override public void close() {
  }

  /**
   * Searches until a result is found, a number of conflicts have occurred
   * (returns null, to restart), or the search is cancelled.
   */
  private @Nullable Result search(
      int conflictLimit, Cancellation cancellation) {
    int conflictCount = 0;
    for (;;) {
      final Clause conflict = propagate();
      if (conflict != null) {
        ++conflicts;
        ++conflictCount;
        if (decisionLevel == 0) {
          ok = false;
          return Result.UNSATISFIABLE;
        }
        learn(conflict);
        varIncrement /= VAR_DECAY;
        clauseIncrement /= CLAUSE_DECAY;
        continue;
      }
      if (conflictCount >= conflictLimit) {
        cancelUntil(0);
        return null;
      }
      if (learnts.size() - trailSize >= maxLearnts) {
        reduceLearnts();
      }
      if (cancellation.isCancelled()) {
        return Result.UNKNOWN;
      }
      final int next = pickBranchLiteral();
      if (next < 0) {
        final boolean[] m = new boolean[varCount + 1];
        for (int v = 1; v <= varCount; v++) {
          m[v] = assigns[v] > 0;
        }
        model = m;
        return Result.SATISFIABLE;
      }
      ++decisions;
      trailLimits[decisionLevel++] = trailSize;
      enqueue(next, null);
    }
  }

  /** Returns the value of a literal code: 1 true, -1 false, 0 unassigned. */
  private int litValue(int code) {
    final int a = assigns[code >> 1];
    return (code & 1) == 0 ? a : -a;
  }

  private void enqueue(int code, @Nullable Clause reason) {
    final int v = code >> 1;
    assigns[v] = (byte) ((code & 1) == 0 ? 1 : -1);
    levels[v] = decisionLevel;
    reasons[v] = reason;
    trail[trailSize++] = code;
  }

  private void attach(Clause clause) {
    watches.get(clause.literals[0]).add(clause);
    watches.get(clause.literals[1]).add(clause);
  }

  /**
   * Propagates all enqueued assignments; returns a conflicting clause, or
   * null.
   */
  private @Nullable Clause propagate() {
    while (propagateHead < trailSize) {
      final int falseCode = trail[propagateHead++] ^ 1;
      final List<Clause> list = watches.get(falseCode);
      int i = 0;
      int j = 0;
      final int size = list.size();
      while (i < size) {
        final Clause clause = list.get(i++);
        if (clause.deleted) {
          continue;
        }
        final int[] lits = clause.literals;
        if (lits[0] == falseCode) {
          lits[0] = lits[1];
          lits[1] = falseCode;
        }
        if (litValue(lits[0]) == 1) {
          list.set(j++, clause);
          continue;
        }
        boolean moved = false;
        for (int k = 2; k < lits.length; k++) {
          if (litValue(lits[k]) != -1) {
            lits[1] = lits[k];
            lits[k] = falseCode;
            watches.get(lits[1]).add(clause);
            moved = true;
            break;
          }
        }
        if (moved) {
          continue;
        }
        list.set(j++, clause);
        if (litValue(lits[0]) == -1) {
          while (i < size) {
            list.set(j++, list.get(i++));
          }
          list.subList(j, size).clear();
          propagateHead = trailSize;
          return clause;
        }
        enqueue(lits[0], clause);
      }
      list.subList(j, size).clear();
    }
    return null;
  }

  /**
   * Analyzes a conflict, backtracks, and adds the learned clause, whose
   * first literal is then implied.
   */
  private void learn(Clause conflict) {
    final List<Integer> learnt = new ArrayList<>();
    learnt.add(-1);
    int pathCount = 0;
    int code = -1;
    int index = trailSize - 1;
    Clause clause = conflict;
    do {
      if (clause.learnt) {
        bumpClause(clause);
      }
      final int[] lits = clause.literals;
      for (int k = code == -1 ? 0 : 1; k < lits.length; k++) {
        final int q = lits[k];
        final int v = q >> 1;
        if (!seen[v] && levels[v] > 0) {
          bumpVariable(v);
          seen[v] = true;
          if (levels[v] >= decisionLevel) {
            ++pathCount;
          } else {
            learnt.add(q);
          }
        }
      }
      while (!seen[trail[index] >> 1]) {
        --index;
      }
      code = trail[index--];
      clause = reasons[code >> 1];
      seen[code >> 1] = false;
      --pathCount;
    } while (pathCount > 0);
    learnt.set(0, code ^ 1);

    int backtrackLevel = 0;
    int maxIndex = 1;
    for (int k = 1; k < learnt.size(); k++) {
      final int v = learnt.get(k) >> 1;
      seen[v] = false;
      if (levels[v] > backtrackLevel) {
        backtrackLevel = levels[v];
        maxIndex = k;
      }
    }
    cancelUntil(backtrackLevel);
    if (learnt.size() == 1) {
      enqueue(learnt.get(0), null);
      return;
    }
    final int[] lits = new int[learnt.size()];
    for (int k = 0; k < lits.length; k++) {
      lits[k] = learnt.get(k);
    }
    // watch the literal assigned at the backtrack level
    final int t = lits[1];
    lits[1] = lits[maxIndex];
    lits[maxIndex] = t;
    final Clause learned = new Clause(lits, true);
    attach(learned);
    learnts.add(learned);
    bumpClause(learned);
    enqueue(lits[0], learned);
  }

  private void cancelUntil(int level) {
    if (decisionLevel <= level) {
      return;
    }
    for (int i = trailSize - 1; i >= trailLimits[level]; i--) {
      final int v = trail[i] >> 1;
      phases[v] = assigns[v] > 0;
      assigns[v] = 0;
      reasons[v] = null;
      if (!heap.contains(v)) {
        heap.insert(v);
      }
    }
    trailSize = trailLimits[level];
    propagateHead = trailSize;
    decisionLevel = level;
  }

  /** Returns the code of the next decision, or -1 if all are assigned. */
  private int pickBranchLiteral() {
    if (random != null
        && random.nextDouble() < RANDOM_FREQUENCY
        && !heap.isEmpty()) {
      final int v = heap.get(random.nextInt(heap.size()));
      if (assigns[v] == 0) {
        return 2 * v + (phases[v] ? 0 : 1);
      }
    }
    while (!heap.isEmpty()) {
      final int v = heap.removeMax();
      if (assigns[v] == 0) {
        return 2 * v + (phases[v] ? 0 : 1);
      }
    }
    return -1;
  }

  private void bumpVariable(int v) {
    activity[v] += varIncrement;
    if (activity[v] > 1e100) {
      for (int i = 1; i <= varCount; i++) {
        activity[i] *= 1e-100;
      }
      varIncrement *= 1e-100;
    }
    if (heap.contains(v)) {
      heap.increased(v);
    }
  }

  private void bumpClause(Clause clause) {
    clause.activity += clauseIncrement;
    if (clause.activity > 1e20) {
      for (Clause c : learnts) {
        c.activity *= 1e-20;
      }
      clauseIncrement *= 1e-20;
    }
  }

  /**
   * Removes the less active half of the learned clauses, except binary
   * clauses and clauses that are the reason for a current assignment.
   * Removed clauses are unhooked from watch lists lazily, by
   * {@link #propagate}.
   */
  private void reduceLearnts() {
    learnts.sort(Comparator.comparingDouble(c -> c.activity));
    final int half = learnts.size() / 2;
    final List<Clause> kept = new ArrayList<>();
    for (int i = 0; i < learnts.size(); i++) {
      final Clause c = learnts.get(i);
      if (i < half && c.literals.length > 2 && !isLocked(c)) {
        c.deleted = true;
      } else {
        kept.add(c);
      }
    }
    learnts.clear();
    learnts.addAll(kept);
  }

  private boolean isLocked(Clause clause) {
    final int code = clause.literals[0];
    return reasons[code >> 1] == clause && litValue(code) == 1;
  }

  /**
   * Returns the {@code i}th element (from 0) of the Luby sequence
   * 1, 1, 2, 1, 1, 2, 4, 1, 1, 2, 1, 1, 2, 4, 8, ....
   */
  static int luby(int i) {
    int size = 1;
    int sequence = 0;
    while (size < i + 1) {
      ++sequence;
      size = 2 * size + 1;
    }
    int x = i;
    while (size - 1 != x) {
      size = (size - 1) >> 1;
      --sequence;
      x = x % size;
    }
    return 1 << sequence;
  }

  /** Clause; original or learned. */
  private static class Clause {
    final int[] literals;
    final boolean learnt;
    double activity;
    boolean deleted;

    Clause(int[] literals, boolean learnt) {
      this.literals = literals;
      this.learnt = learnt;
    }
  }

  /** Binary max-heap of variables, ordered by activity. */
  private class VarHeap {
    private int[] heap = new int[16];
    private int[] positions = new int[16];
    private int size = 0;

    boolean isEmpty() {
      return size == 0;
    }

    int size() {
      return size;
    }

    int get(int i) {
      return heap[i];
    }

    boolean contains(int v) {
      return v < positions.length && positions[v] > 0;
    }

    void insert(int v) {
      if (v >= positions.length) {
        positions =
            Arrays.copyOf(positions, Math.max(v + 1, positions.length * 2));
      }
      if (size == heap.length) {
        heap = Arrays.copyOf(heap, size * 2);
      }
      heap[size] = v;
      positions[v] = size + 1;
      ++size;
      up(size - 1);
    }

    /** Restores order after the activity of {@code v} has increased. */
    void increased(int v) {
      up(positions[v] - 1);
    }

    int removeMax() {
      final int v = heap[0];
      positions[v] = 0;
      --size;
      if (size > 0) {
        heap[0] = heap[size];
        positions[heap[0]] = 1;
        down(0);
      }
      return v;
    }

    private void up(int i) {
      final int v = heap[i];
      while (i > 0) {
        final int parent = (i - 1) >> 1;
        if (activity[heap[parent]] >= activity[v]) {
          break;
        }
        heap[i] = heap[parent];
        positions[heap[i]] = i + 1;
        i = parent;
      }
      heap[i] = v;
      positions[v] = i + 1;
    }

    private void down(int i) {
      final int v = heap[i];
      for (;;) {
        int child = 2 * i + 1;
        if (child >= size) {
          break;
        }
        if (child + 1 < size
            && activity[heap[child + 1]] > activity[heap[child]]) {
          ++child;
        }
        if (activity[heap[child]] <= activity[v]) {
          break;
        }
        heap[i] = heap[child];
        positions[heap[i]] = i + 1;
        i = child;
      }
      heap[i] = v;
      positions[v] = i + 1;
    }
  }
}

// End CdclSolver.java
