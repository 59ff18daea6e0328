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

import static java.util.Objects.requireNonNull;

import net.hydromatic.relm.instance.Instance;
import net.hydromatic.relm.type.Command;
import net.hydromatic.relm.type.Fact;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of one step of solving a command: an instance, or the reason there
 * are no more.
 */
public class Solution {
  public final Command command;
  public final Outcome outcome;
  /** The instance; not null if and only if the outcome is satisfiable. */
  public final @Nullable Instance instance;
  /**
   * Constraint that is false under the bounds, if the outcome is {@link
   * Outcome#TRIVIALLY_UNSATISFIABLE}.
   */
  public final @Nullable Fact trivialFact;
  /** Number of instances returned before this one. */
  public final int ordinal;
  public final long elapsedMillis;

  private Solution(Command command, Outcome outcome,
      @Nullable Instance instance, @Nullable Fact trivialFact, int ordinal,
      long elapsedMillis) {
    this.command = requireNonNull(command);
    this.outcome = requireNonNull(outcome);
    this.instance = instance;
    this.trivialFact = trivialFact;
    this.ordinal = ordinal;
    this.elapsedMillis = elapsedMillis;
  }

  static Solution satisfiable(Command command, Instance instance,
      int ordinal, long elapsedMillis) {
    return new Solution(command, Outcome.SATISFIABLE,
        requireNonNull(instance), null, ordinal, elapsedMillis);
  }

  static Solution unsatisfiable(Command command, int ordinal,
      long elapsedMillis) {
    return new Solution(command, Outcome.UNSATISFIABLE, null, null, ordinal,
        elapsedMillis);
  }

  static Solution triviallyUnsatisfiable(Command command, Fact fact) {
    return new Solution(command, Outcome.TRIVIALLY_UNSATISFIABLE, null,
        requireNonNull(fact), 0, 0L);
  }

  static Solution timeout(Command command, int ordinal, long elapsedMillis) {
    return new Solution(command, Outcome.TIMEOUT, null, null, ordinal,
        elapsedMillis);
  }

  public boolean isSatisfiable() {
    return outcome == Outcome.SATISFIABLE;
  }

  /** Returns the instance; throws if there is none. */
  public Instance instance() {
    if (instance == null) {
      throw new IllegalStateException("no instance: " + outcome);
    }
    return instance;
  }

  /** Writes a description of this solution, as the command line shows it. */
  public StringBuilder describeTo(StringBuilder b, boolean compact) {
    switch (outcome) {
      case SATISFIABLE:
        b.append(command.isCheck ? "Counterexample" : "Instance")
            .append(' ')
            .append(ordinal + 1)
            .append(compact ? ": " : ":\n");
        return instance().describeTo(b, compact);
      case TRIVIALLY_UNSATISFIABLE:
        noneFound(b);
        return b.append(" (")
            .append(requireNonNull(trivialFact).name)
            .append(" is false within the scope)");
      case TIMEOUT:
        return b.append("Timeout after ").append(elapsedMillis)
            .append(" ms");
      default:
        return noneFound(b);
    }
  }

  private StringBuilder noneFound(StringBuilder b) {
    if (ordinal > 0) {
      return b.append("No more ")
          .append(command.isCheck ? "counterexamples" : "instances");
    }
    return b.append(command.isCheck
        ? "No counterexample found"
        : "No instance found");
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder(), true).toString();
  }

  /** Outcome of solving. */
  public enum Outcome {
    /** An instance was found. */
    SATISFIABLE,
    /** The solver proved that there are no (more) instances. */
    UNSATISFIABLE,
    /** A constraint is false under the bounds, so no search was needed. */
    TRIVIALLY_UNSATISFIABLE,
    /** The search timed out. Not a proof of anything. */
    TIMEOUT
  }
}

// End Solution.java
