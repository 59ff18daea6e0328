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

import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.relm.instance.Bounds;
import net.hydromatic.relm.type.Command;
import net.hydromatic.relm.type.Fact;
import net.hydromatic.relm.type.Model;
import org.junit.jupiter.api.Test;

/** Tests {@link BoundCompiler}. */
public class BoundCompilerTest {
  private static Model family() {
    return resource("family.als").model();
  }

  private static Scope scope(Model model, String label,
      boolean exactScopes) {
    final Command command = Objects.requireNonNull(model.command(label));
    return ScopeResolver.resolve(model, command, 3, exactScopes);
  }

  private static List<String> names(List<Fact> facts) {
    final List<String> names = new ArrayList<>();
    for (Fact fact : facts) {
      names.add(fact.name);
    }
    return names;
  }

  @Test void testFamilyBounds() {
    final Model model = family();
    final Bounds bounds =
        BoundCompiler.bounds(model, scope(model, "Show", true));
    assertThat(bounds.lower(model.sig("Person")).toString(),
        is("{Adam$0, Eve$0, Person$0, Person$1}"));
    assertThat(bounds.upper(model.sig("Person")).toString(),
        is("{Adam$0, Eve$0, Person$0, Person$1}"));
    // Person atoms may float into Man or Woman
    assertThat(bounds.lower(model.sig("Man")).toString(), is("{Adam$0}"));
    assertThat(bounds.upper(model.sig("Man")).toString(),
        is("{Adam$0, Person$0, Person$1}"));
    assertThat(bounds.upper(model.sig("Woman")).toString(),
        is("{Eve$0, Person$0, Person$1}"));
    assertThat(bounds.lower(model.sig("Adam")).toString(), is("{Adam$0}"));
    assertThat(bounds.upper(model.sig("Adam")).toString(), is("{Adam$0}"));
    assertThat(bounds.lower(model.field("spouse")).size(), is(0));
    assertThat(bounds.upper(model.field("spouse")).size(), is(16));
    assertThat(bounds.upper(model.field("parents")).size(), is(16));
  }

  /** Without exact scopes, a signature's atoms are only an upper bound. */
  @Test void testInexactBounds() {
    final Model model = als("sig A {r: set B} sig B {} run {} for 2").model();
    final Bounds bounds =
        BoundCompiler.bounds(model, scope(model, "run$1", false));
    assertThat(bounds.lower(model.sig("A")).size(), is(0));
    assertThat(bounds.upper(model.sig("A")).toString(), is("{A$0, A$1}"));
    assertThat(bounds.upper(model.field("r")).toString(),
        is("{(A$0, B$0), (A$0, B$1), (A$1, B$0), (A$1, B$1)}"));
  }

  @Test void testSubsetBounds() {
    final Model model =
        als("sig A {} sig B {} sig C in A + B {} run {} for 1").model();
    final Bounds bounds =
        BoundCompiler.bounds(model, scope(model, "run$1", true));
    assertThat(bounds.lower(model.sig("C")).size(), is(0));
    assertThat(bounds.upper(model.sig("C")).toString(), is("{A$0, B$0}"));
  }

  /** A field whose tuples cannot be numbered is a scope error. */
  @Test void testUniverseTooLargeForArity() {
    final Model model =
        als("sig A {f: A -> A -> A -> A} run {} for 80").model();
    final Scope scope = scope(model, "run$1", true);
    assertThat(scope.universe.size(), is(80));
    assertError(() -> BoundCompiler.bounds(model, scope),
        throwsA(ScopeException.class,
            "universe of 80 atoms is too large for field 'f' of arity 5"));
  }

  @Test void testFamilyImplicitFacts() {
    final Model model = family();
    final Scope scope = scope(model, "Show", true);
    final Bounds bounds = BoundCompiler.bounds(model, scope);
    final List<String> names =
        names(BoundCompiler.implicitFacts(model, scope, bounds));
    assertThat(names,
        hasItems("disjoint Man, Woman", "abstract Person", "Man in Person",
            "Adam in Man", "spouse domain", "spouse type", "parents type"));
    // Person is exact, so needs no scope constraint
    assertThat(names.contains("scope of Person"), is(false));
  }

  @Test void testImplicitFacts() {
    final Model model =
        als("sig A {disj f: lone A} {some f}\n"
            + "lone sig B {}\n"
            + "sig C in A {}\n"
            + "run {} for 3").model();
    final Scope scope = scope(model, "run$1", false);
    final Bounds bounds = BoundCompiler.bounds(model, scope);
    final List<String> names =
        names(BoundCompiler.implicitFacts(model, scope, bounds));
    assertThat(names,
        hasItems("lone B", "C in A", "f domain", "f type", "f disjoint",
            "A appended fact"));
  }
}

// End BoundCompilerTest.java
