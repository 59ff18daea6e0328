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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.relm.compile.Compiles;
import net.hydromatic.relm.compile.Problem;
import net.hydromatic.relm.compile.Tracer;
import net.hydromatic.relm.compile.Tracers;
import net.hydromatic.relm.type.Command;
import net.hydromatic.relm.type.Model;
import net.hydromatic.relm.util.RelmException;

/**
 * Session environment.
 *
 * <p>Holds property values, and the tracer that receives the intermediate
 * results of each stage of compilation and solving.
 */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;
  /** Receives intermediate results; by default, ignores them. */
  private Tracer tracer = Tracers.empty();

  /**
   * Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied. It should probably be a {@link LinkedHashMap} to provide
   * deterministic iteration order.
   *
   * @param map Map that contains property values
   */
  public Session(Map<Prop, Object> map) {
    this.map = requireNonNull(map);
  }

  /** Creates a Session with default property values. */
  public static Session create() {
    return new Session(new LinkedHashMap<>());
  }

  /** Sets the tracer, and returns this session. */
  public Session withTracer(Tracer tracer) {
    this.tracer = requireNonNull(tracer, "tracer");
    return this;
  }

  /** Parses and resolves a module. */
  public Model resolve(String text, String file) {
    return Compiles.resolve(text, file, tracer);
  }

  /** Returns the commands to execute, per property {@link Prop#COMMAND}. */
  public List<Command> commands(Model model) {
    return Compiles.commands(this, model);
  }

  /**
   * Translates a command and creates an enumerator for its instances. The
   * caller must close the enumerator.
   */
  public Enumerator enumerate(Model model, Command command) {
    final Problem problem = Compiles.translate(this, model, command, tracer);
    return new Enumerator(this, problem, tracer);
  }

  /**
   * Executes a command, returning up to {@link Prop#SOLUTION_LIMIT}
   * instances, followed by a solution that explains why there are no more,
   * if the search ended before the limit.
   *
   * <p>If the command has an "expect" clause that the result contradicts,
   * sends a warning to the tracer.
   */
  public List<Solution> execute(Model model, Command command) {
    final List<Solution> solutions;
    try (Enumerator enumerator = enumerate(model, command)) {
      solutions = enumerator.remaining();
    }
    checkExpect(command, solutions);
    return solutions;
  }

  private void checkExpect(Command command, List<Solution> solutions) {
    if (command.expect == null || solutions.isEmpty()) {
      return;
    }
    final Solution first = solutions.get(0);
    final List<String> warnings = new ArrayList<>();
    switch (first.outcome) {
      case SATISFIABLE:
        if (command.expect == 0) {
          warnings.add("command " + command.label + " expected "
              + (command.isCheck ? "no counterexample" : "no instance")
              + ", but found one");
        }
        break;
      case UNSATISFIABLE:
      case TRIVIALLY_UNSATISFIABLE:
        if (command.expect != 0) {
          warnings.add("command " + command.label + " expected "
              + (command.isCheck ? "a counterexample" : "an instance")
              + ", but found none");
        }
        break;
      default:
        break;
    }
    if (!warnings.isEmpty()) {
      tracer.onWarnings(ImmutableList.copyOf(warnings));
    }
  }

  /** Writes a description of an error to a buffer. */
  public void handle(RelmException e, StringBuilder buf) {
    e.describeTo(buf);
  }
}

// End Session.java
