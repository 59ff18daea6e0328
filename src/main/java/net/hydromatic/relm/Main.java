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
package net.hydromatic.relm;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.relm.compile.Tracers;
import net.hydromatic.relm.eval.Prop;
import net.hydromatic.relm.eval.Session;
import net.hydromatic.relm.eval.Solution;
import net.hydromatic.relm.sat.SolverException;
import net.hydromatic.relm.type.Command;
import net.hydromatic.relm.type.Model;
import net.hydromatic.relm.util.RelmException;

/**
 * Command-line model finder.
 *
 * <p>Usage: {@code relm [--prop=value ...] file.als ...}. Executes each
 * command of each file, or only the command named by {@code --command}, and
 * prints the instances found.
 */
public class Main {
  /** An instance (or counterexample) was found. */
  public static final int EXIT_FOUND = 0;
  /** The input has a syntax, type or scope error. */
  public static final int EXIT_ERROR = 1;
  /** No instance exists within the scope. */
  public static final int EXIT_UNSATISFIABLE = 2;
  /** The search timed out. */
  public static final int EXIT_TIMEOUT = 3;
  /** Internal error. */
  public static final int EXIT_INTERNAL = 4;

  private final List<String> argList;
  private final PrintWriter out;
  final Session session;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args), System.out,
            new LinkedHashMap<>());
    System.exit(main.run());
  }

  /** Creates a Main. */
  public Main(List<String> args, PrintStream out, Map<Prop, Object> propMap) {
    this(args, new OutputStreamWriter(out, StandardCharsets.UTF_8), propMap);
  }

  /** Creates a Main. */
  public Main(List<String> argList, Writer out, Map<Prop, Object> propMap) {
    this.argList = ImmutableList.copyOf(argList);
    this.out = out instanceof PrintWriter
        ? (PrintWriter) out
        : new PrintWriter(out);
    this.session = new Session(propMap);
    this.session.withTracer(
        Tracers.withOnWarnings(Tracers.empty(), warnings ->
            warnings.forEach(w -> this.out.println("Warning: " + w))));
  }

  /** Runs the files, and returns the exit code. */
  public int run() {
    try {
      final List<File> files;
      try {
        files = parseArgs();
      } catch (IllegalArgumentException e) {
        out.println("Error: " + e.getMessage());
        return EXIT_ERROR;
      }
      if (files.isEmpty()) {
        out.println("Usage: relm [--prop=value ...] file.als ...");
        return EXIT_ERROR;
      }
      int exitCode = EXIT_FOUND;
      for (File file : files) {
        final int fileExitCode = run(file);
        if (fileExitCode == EXIT_ERROR) {
          return fileExitCode;
        }
        exitCode = Math.max(exitCode, fileExitCode);
      }
      return exitCode;
    } catch (SolverException e) {
      out.println(e.describeTo(new StringBuilder()));
      return EXIT_INTERNAL;
    } catch (RuntimeException e) {
      if (e instanceof RelmException) {
        final StringBuilder buf = new StringBuilder();
        session.handle((RelmException) e, buf);
        out.println(buf);
        return EXIT_ERROR;
      }
      out.println("Internal error: " + e);
      e.printStackTrace(out);
      return EXIT_INTERNAL;
    } finally {
      out.flush();
    }
  }

  /** Applies "--prop=value" arguments to the session; returns the files. */
  private List<File> parseArgs() {
    final List<File> files = new ArrayList<>();
    for (String arg : argList) {
      if (arg.startsWith("--")) {
        final int eq = arg.indexOf('=');
        if (eq < 0) {
          throw new IllegalArgumentException("expected --prop=value, got '"
              + arg + "'");
        }
        Prop.lookup(arg.substring(2, eq))
            .setLenient(session.map, arg.substring(eq + 1));
      } else {
        files.add(new File(arg));
      }
    }
    return files;
  }

  /** Executes the commands of one file, and returns the exit code. */
  private int run(File file) {
    final String text;
    try {
      text = Files.asCharSource(file, StandardCharsets.UTF_8).read();
    } catch (IOException e) {
      out.println("Error: cannot read " + file + ": " + e.getMessage());
      return EXIT_ERROR;
    }
    final Model model = session.resolve(text, file.getPath());
    final boolean compact =
        Prop.OUTPUT.enumValue(session.map, Prop.Output.class)
            == Prop.Output.COMPACT;
    int exitCode = EXIT_FOUND;
    for (Command command : session.commands(model)) {
      out.println("Executing \"" + command + "\"");
      final List<Solution> solutions = session.execute(model, command);
      for (Solution solution : solutions) {
        out.println(solution.describeTo(new StringBuilder(), compact));
      }
      exitCode = Math.max(exitCode, exitCode(solutions));
    }
    return exitCode;
  }

  private static int exitCode(List<Solution> solutions) {
    if (solutions.isEmpty()) {
      return EXIT_FOUND;
    }
    switch (solutions.get(0).outcome) {
      case SATISFIABLE:
        return EXIT_FOUND;
      case TIMEOUT:
        return EXIT_TIMEOUT;
      default:
        return EXIT_UNSATISFIABLE;
    }
  }
}

// End Main.java
