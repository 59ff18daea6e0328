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
package net.hydromatic.relm.compile;

import static net.hydromatic.relm.Als.als;
import static net.hydromatic.relm.Als.assertError;
import static net.hydromatic.relm.Als.resource;
import static net.hydromatic.relm.Als.throwsA;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Objects;
import net.hydromatic.relm.instance.Universe;
import net.hydromatic.relm.type.Command;
import net.hydromatic.relm.type.Model;
import net.hydromatic.relm.type.Sig;
import org.junit.jupiter.api.Test;

/** Tests {@link ScopeResolver}. */
public class ScopeResolverTest {
  /** Computes the scope of the first command of a module. */
  private static Scope scope(String text, boolean exactScopes) {
    final Model model = als(text).model();
    return ScopeResolver.resolve(model, model.commands.get(0), 3,
        exactScopes);
  }

  private static Scope scope(String text) {
    return scope(text, true);
  }

  private static Sig sig(Scope scope, String name) {
    for (Sig sig : scope.sigs()) {
      if (sig.name.equals(name)) {
        return sig;
      }
    }
    throw new AssertionError("no scope for " + name);
  }

  private static void assertScopeError(String text, boolean exactScopes,
      String message) {
    assertError(() -> scope(text, exactScopes),
        throwsA(ScopeException.class, message));
  }

  @Test void testFamily() {
    final Model model = resource("family.als").model();
    final Command command = Objects.requireNonNull(model.command("Show"));
    final Scope scope = ScopeResolver.resolve(model, command, 3, true);
    final Universe universe = scope.universe;
    assertThat(universe.toString(), is("[Adam$0, Eve$0, Person$0, Person$1]"));
    assertThat(scope.count(sig(scope, "Person")), is(4));
    assertThat(scope.isExact(sig(scope, "Person")), is(true));
    assertThat(scope.count(sig(scope, "Adam")), is(1));
    assertThat(scope.isExact(sig(scope, "Adam")), is(true));
    // Man and Woman have no scope of their own
    assertThat(scope.sigs().size(), is(3));
    assertThat(universe.classes().size(), is(3));
  }

  @Test void testOverallScope() {
    final Scope scope = scope("sig A {} sig B {} run {} for 2 but 4 B");
    assertThat(scope.universe.toString(),
        is("[A$0, A$1, B$0, B$1, B$2, B$3]"));
    assertThat(scope.toString(), is("exactly 4 B, exactly 2 A"));
  }

  @Test void testDefaultScope() {
    final Scope scope = scope("sig A {} run {}", false);
    assertThat(scope.count(sig(scope, "A")), is(3));
    assertThat(scope.isExact(sig(scope, "A")), is(false));
    assertThat(scope.toString(), is("3 A"));
  }

  @Test void testExactly() {
    final Scope scope = scope("sig A {} sig B {} run {} for exactly 2 A, 1 B",
        false);
    assertThat(scope.toString(), is("exactly 2 A, 1 B"));
  }

  /** An implicit scope grows to hold what its sub-signatures require. */
  @Test void testImplicitScopeGrows() {
    final Scope scope =
        scope("abstract sig P {}\n"
            + "one sig X, Y, Z extends P {}\n"
            + "run {} for 2");
    assertThat(scope.count(sig(scope, "P")), is(3));
    assertThat(scope.universe.toString(), is("[X$0, Y$0, Z$0]"));
  }

  @Test void testLoneAndOne() {
    final Scope scope = scope("lone sig A {} one sig B {} run {}");
    assertThat(scope.count(sig(scope, "A")), is(1));
    assertThat(scope.isExact(sig(scope, "A")), is(false));
    assertThat(scope.count(sig(scope, "B")), is(1));
    assertThat(scope.isExact(sig(scope, "B")), is(true));
  }

  @Test void testAbstractWithFloatingAtoms() {
    final Scope scope =
        scope("abstract sig A {}\n"
            + "one sig B, C extends A {}\n"
            + "run {} for 3 A", false);
    assertThat(scope.universe.toString(), is("[B$0, C$0, A$0]"));
  }

  @Test void testErrors() {
    final String family = "abstract sig Person {}\n"
        + "sig Man, Woman extends Person {}\n"
        + "one sig Adam extends Man {}\n"
        + "one sig Eve extends Woman {}\n";
    assertScopeError(family + "run {} for 1 Person", true,
        "scope of 'Person' is 1 but its sub-signatures require at least 2 "
            + "atoms in run run$1 for 1 Person");
    assertScopeError("one sig A {} run {} for 2 A", true,
        "signature 'A' is declared 'one' but has scope 2");
    assertScopeError("lone sig A {} run {} for 2 A", true,
        "signature 'A' is declared 'lone' but has scope 2");
    assertScopeError("some sig A {} run {} for 0 A", true,
        "signature 'A' is declared 'some' but has scope 0");
    assertScopeError("sig A {} sig B in A {} run {} for 2 B", true,
        "cannot give a scope to subset signature 'B'");
    assertScopeError("abstract sig A {} run {} for 2 A", true,
        "abstract signature 'A' has no sub-signatures to hold its 2 atoms");
    assertScopeError("abstract sig A {}\n"
            + "one sig B, C extends A {}\n"
            + "run {} for 3 A", true,
        "abstract signature 'A' has scope 3 but its sub-signatures can hold "
            + "at most 2 atoms");
  }
}

// End ScopeResolverTest.java
